package ai.lawdiff.align;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of aligning two statute versions. Manual entries come first in the order they were supplied, followed by
 * automatic and unmatched entries in ascending old article order.
 */
public record AlignmentResult(List<AlignmentEntry> entries, List<Integer> addedNumbers, List<String> warnings,
                              AlignmentStatistics statistics) {

    public AlignmentResult {
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
        addedNumbers = List.copyOf(Objects.requireNonNull(addedNumbers, "addedNumbers"));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        Objects.requireNonNull(statistics, "statistics");
    }

    public List<AlignmentEntry> matchedEntries() {
        return entries.stream().filter(AlignmentEntry::isMatched).collect(Collectors.toList());
    }

    public List<AlignmentEntry> deletedEntries() {
        return entries.stream().filter(entry -> !entry.isMatched()).collect(Collectors.toList());
    }
}
