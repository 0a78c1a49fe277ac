package battetl.transform.model;

import lombok.Value;

/**
 * Result of column signature matching. Both fields are null when no known
 * signature matched.
 */
@Value
public class FormatDetection {

    public static final FormatDetection NONE = new FormatDetection(null, null);

    CyclerMake make;
    DataKind kind;

    public boolean isDetected() {
        return make != null && kind != null;
    }

    public boolean is(CyclerMake make, DataKind kind) {
        return this.make == make && this.kind == kind;
    }
}
