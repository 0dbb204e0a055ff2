package ai.lawdiff.align;

import java.util.Objects;

/**
 * Pairing of an old article with a new article, or with {@link #UNMATCHED} when the old article was removed.
 */
public record AlignmentEntry(int oldNumber, int newNumber, double similarity, MatchType matchType) {

    public static final int UNMATCHED = -1;

    public AlignmentEntry {
        Objects.requireNonNull(matchType, "matchType");
        if (similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("similarity must be within [0, 1]: " + similarity);
        }
        if ((matchType == MatchType.NONE) != (newNumber == UNMATCHED)) {
            throw new IllegalArgumentException("Only unmatched entries may carry new number " + UNMATCHED);
        }
    }

    static AlignmentEntry unmatched(int oldNumber) {
        return new AlignmentEntry(oldNumber, UNMATCHED, 0.0, MatchType.NONE);
    }

    public boolean isMatched() {
        return matchType != MatchType.NONE;
    }
}
