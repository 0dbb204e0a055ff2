package ai.lawdiff.diff;

import java.util.Objects;

/**
 * An article present in only one version: added to the new version or deleted from the old one.
 */
public record UnmatchedArticle(ChangeCategory category, int articleNumber, String content, ArticleLocation location) {

    public UnmatchedArticle {
        Objects.requireNonNull(category, "category");
        if (category != ChangeCategory.ADDED && category != ChangeCategory.DELETED) {
            throw new IllegalArgumentException("Unmatched articles are added or deleted, not " + category);
        }
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(location, "location");
    }
}
