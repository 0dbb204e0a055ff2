package ai.lawdiff.diff;

import ai.lawdiff.align.DiffSpan;
import ai.lawdiff.align.MatchType;
import java.util.List;
import java.util.Objects;

/**
 * An old article paired with a new article. {@code diff} is empty for identical pairs.
 */
public record MatchedArticle(ChangeCategory category,
                             int oldNumber,
                             int newNumber,
                             String oldContent,
                             String newContent,
                             double similarity,
                             MatchType matchType,
                             ArticleLocation oldLocation,
                             ArticleLocation newLocation,
                             List<DiffSpan> diff) {

    public MatchedArticle {
        Objects.requireNonNull(category, "category");
        if (category != ChangeCategory.IDENTICAL && category != ChangeCategory.MODIFIED) {
            throw new IllegalArgumentException("Matched articles are identical or modified, not " + category);
        }
        Objects.requireNonNull(oldContent, "oldContent");
        Objects.requireNonNull(newContent, "newContent");
        Objects.requireNonNull(matchType, "matchType");
        Objects.requireNonNull(oldLocation, "oldLocation");
        Objects.requireNonNull(newLocation, "newLocation");
        diff = diff == null ? List.of() : List.copyOf(diff);
    }
}
