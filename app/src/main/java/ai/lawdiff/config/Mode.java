package ai.lawdiff.config;

/**
 * What a run of the command line does.
 */
public enum Mode {
    /** Compare two statute versions article by article. */
    COMPARE(2),
    /** Parse a single statute into its chapter / section / article structure. */
    PARSE(1);

    private final int requiredInputs;

    Mode(int requiredInputs) {
        this.requiredInputs = requiredInputs;
    }

    public int requiredInputs() {
        return requiredInputs;
    }

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return COMPARE;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }
}
