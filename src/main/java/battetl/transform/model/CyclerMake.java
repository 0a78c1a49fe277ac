package battetl.transform.model;

/**
 * Battery cycler manufacturers whose output files are understood natively.
 */
public enum CyclerMake {
    ARBIN("arbin"),
    MACCOR("maccor");

    private final String value;

    CyclerMake(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
