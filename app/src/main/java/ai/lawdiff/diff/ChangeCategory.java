package ai.lawdiff.diff;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of an article after comparing two statute versions.
 */
public enum ChangeCategory {
    IDENTICAL("identical"),
    MODIFIED("modified"),
    ADDED("new"),
    DELETED("deleted");

    private final String label;

    ChangeCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
