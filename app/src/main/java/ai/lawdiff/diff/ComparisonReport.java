package ai.lawdiff.diff;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Classified comparison of two statute versions, the structure report renderers consume.
 */
public record ComparisonReport(List<MatchedArticle> identical,
                               List<MatchedArticle> modified,
                               List<UnmatchedArticle> added,
                               List<UnmatchedArticle> deleted,
                               SortedMap<Integer, Integer> mapping,
                               List<String> warnings,
                               ComparisonStatistics statistics) {

    public ComparisonReport {
        identical = List.copyOf(Objects.requireNonNull(identical, "identical"));
        modified = List.copyOf(Objects.requireNonNull(modified, "modified"));
        added = List.copyOf(Objects.requireNonNull(added, "added"));
        deleted = List.copyOf(Objects.requireNonNull(deleted, "deleted"));
        mapping = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(mapping, "mapping")));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        Objects.requireNonNull(statistics, "statistics");
    }
}
