package ai.lawdiff.align;

/**
 * A run of {@code size} equal code points starting at {@code a[aStart]} and {@code b[bStart]}.
 */
public record MatchingBlock(int aStart, int bStart, int size) {
}
