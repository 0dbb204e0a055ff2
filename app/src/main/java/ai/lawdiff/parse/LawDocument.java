package ai.lawdiff.parse;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable hierarchical model of one statute version. All maps iterate in ascending number order.
 */
public final class LawDocument {

    private final String sourceName;
    private final SortedMap<Integer, Chapter> chapters;
    private final SortedMap<Integer, Section> sections;
    private final SortedMap<Integer, Article> articles;
    private final List<Integer> duplicateArticleNumbers;
    private final DocumentMetadata metadata;

    public LawDocument(String sourceName,
                       Map<Integer, Chapter> chapters,
                       Map<Integer, Section> sections,
                       Map<Integer, Article> articles,
                       List<Integer> duplicateArticleNumbers,
                       int totalContentLength) {
        this.sourceName = sourceName;
        this.chapters = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(chapters, "chapters")));
        this.sections = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(sections, "sections")));
        this.articles = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(articles, "articles")));
        this.duplicateArticleNumbers = duplicateArticleNumbers == null ? List.of() : List.copyOf(duplicateArticleNumbers);
        this.metadata = new DocumentMetadata(this.chapters.size(), this.sections.size(), this.articles.size(),
                totalContentLength);
    }

    public static LawDocument ofArticles(Map<Integer, Article> articles) {
        return new LawDocument(null, Map.of(), Map.of(), articles, List.of(), 0);
    }

    public Optional<String> sourceName() {
        return Optional.ofNullable(sourceName);
    }

    public SortedMap<Integer, Chapter> chapters() {
        return chapters;
    }

    public SortedMap<Integer, Section> sections() {
        return sections;
    }

    public SortedMap<Integer, Article> articles() {
        return articles;
    }

    public Optional<Article> article(int number) {
        return Optional.ofNullable(articles.get(number));
    }

    /**
     * Article numbers that occurred more than once in the source; the last occurrence is the one kept.
     */
    public List<Integer> duplicateArticleNumbers() {
        return duplicateArticleNumbers;
    }

    public DocumentMetadata metadata() {
        return metadata;
    }
}
