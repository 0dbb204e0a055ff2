package ai.lawdiff.align;

import java.util.Objects;

/**
 * A contiguous piece of text that is shared by, removed from, or added to the newer article version.
 */
public record DiffSpan(DiffSpanType type, String text) {

    public DiffSpan {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }
}
