package ai.lawdiff.align;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * How an alignment entry was produced.
 */
public enum MatchType {
    MANUAL,
    AUTO,
    NONE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
