package ai.lawdiff.align;

/**
 * Kind of a character-level diff span.
 */
public enum DiffSpanType {
    EQUAL,
    DELETED,
    INSERTED
}
