package battetl.transform.model;

/**
 * What a cycler file contains: time series readings or per-cycle summaries.
 */
public enum DataKind {
    TEST_DATA("test_data"),
    CYCLE_STATS("cycle_stats");

    private final String value;

    DataKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
