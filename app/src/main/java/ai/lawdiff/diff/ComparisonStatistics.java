package ai.lawdiff.diff;

/**
 * Per-category counts of a comparison.
 */
public record ComparisonStatistics(int totalArticlesV1,
                                   int totalArticlesV2,
                                   int identicalCount,
                                   int modifiedCount,
                                   int newCount,
                                   int deletedCount,
                                   int manualMatchesCount,
                                   int autoMatchesCount) {
}
