package ai.lawdiff.align;

/**
 * Counts describing one alignment run.
 */
public record AlignmentStatistics(int totalOld, int totalNew, int manualCount, int autoCount, int deletedCount,
                                  int addedCount) {
}
