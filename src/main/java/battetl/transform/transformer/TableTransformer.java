package battetl.transform.transformer;

import battetl.transform.model.DataTable;

/**
 * Post-transform hook for customer-specific fixups.
 *
 * Implementations are loaded by class name from
 * {@code battetl.transform.test-data-hook-class} or
 * {@code battetl.transform.cycle-stats-hook-class} and run once, after all
 * built-in normalization of the table, on every transform call.
 *
 * Example configuration:
 * battetl.transform.test-data-hook-class=com.example.cells.DropFormationCycles
 *
 * Implementations need a public no-argument constructor.
 */
public interface TableTransformer {

    /**
     * Transform a normalized table.
     *
     * @param table the table produced by the built-in pipeline
     * @return the table to keep, which may be the same instance
     */
    DataTable transform(DataTable table);

    /**
     * Whether {@link #transform(DataTable)} changes anything. When false the
     * hook is skipped.
     */
    default boolean requiresTransformation() {
        return true;
    }

    /**
     * Called once after the class is loaded.
     */
    default void initialize() {
    }

    /**
     * Called when the hook is evicted from the factory cache.
     */
    default void cleanup() {
    }
}
