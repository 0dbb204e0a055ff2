package ai.lawdiff.text;

import java.util.Objects;

/**
 * A recognized chapter, section or article header split into its numeral token and the text that follows it.
 */
public record HeaderMatch(LineType type, String numeral, String remainder) {

    public HeaderMatch {
        Objects.requireNonNull(type, "type");
        if (!type.isHeader()) {
            throw new IllegalArgumentException("Not a header type: " + type);
        }
        numeral = Objects.requireNonNull(numeral, "numeral");
        remainder = Objects.requireNonNull(remainder, "remainder");
    }
}
