package battetl.transform.transformer;

import battetl.transform.model.DataTable;

/**
 * Hook that returns the table unchanged.
 *
 * Used when no hook class is configured or the configured class cannot be loaded.
 */
public class NoOpTableTransformer implements TableTransformer {

    @Override
    public DataTable transform(DataTable table) {
        return table;
    }

    @Override
    public boolean requiresTransformation() {
        return false;
    }
}
