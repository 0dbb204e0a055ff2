package ai.lawdiff.diff;

import ai.lawdiff.align.AlignmentEntry;
import ai.lawdiff.align.AlignmentResult;
import ai.lawdiff.align.MatchType;
import ai.lawdiff.align.TextSimilarity;
import ai.lawdiff.parse.Article;
import ai.lawdiff.parse.LawDocument;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an {@link AlignmentResult} into identical / modified / added / deleted article lists with resolved chapter and
 * section information and character-level diffs for modified pairs.
 */
public class ComparisonAnalyzer {

    /** Matched pairs at or above this similarity are reported as identical. */
    public static final double IDENTICAL_THRESHOLD = 0.98;

    private static final Logger LOGGER = LoggerFactory.getLogger(ComparisonAnalyzer.class);

    private final TextSimilarity similarity;

    public ComparisonAnalyzer() {
        this(new TextSimilarity());
    }

    public ComparisonAnalyzer(TextSimilarity similarity) {
        this.similarity = Objects.requireNonNull(similarity, "similarity");
    }

    public ComparisonReport analyze(LawDocument oldDocument, LawDocument newDocument, AlignmentResult alignment) {
        Objects.requireNonNull(oldDocument, "oldDocument");
        Objects.requireNonNull(newDocument, "newDocument");
        Objects.requireNonNull(alignment, "alignment");

        List<MatchedArticle> identical = new ArrayList<>();
        List<MatchedArticle> modified = new ArrayList<>();
        List<UnmatchedArticle> added = new ArrayList<>();
        List<UnmatchedArticle> deleted = new ArrayList<>();
        TreeMap<Integer, Integer> mapping = new TreeMap<>();
        int manualCount = 0;
        int autoCount = 0;

        for (AlignmentEntry entry : alignment.entries()) {
            Article oldArticle = requireArticle(oldDocument, entry.oldNumber(), "old");
            if (!entry.isMatched()) {
                deleted.add(new UnmatchedArticle(ChangeCategory.DELETED, oldArticle.number(), oldArticle.content(),
                        ArticleLocation.of(oldDocument, oldArticle)));
                continue;
            }
            if (entry.matchType() == MatchType.MANUAL) {
                manualCount++;
            } else {
                autoCount++;
            }
            Article newArticle = requireArticle(newDocument, entry.newNumber(), "new");
            mapping.put(entry.oldNumber(), entry.newNumber());
            boolean same = entry.similarity() >= IDENTICAL_THRESHOLD;
            MatchedArticle matched = new MatchedArticle(
                    same ? ChangeCategory.IDENTICAL : ChangeCategory.MODIFIED,
                    entry.oldNumber(),
                    entry.newNumber(),
                    oldArticle.content(),
                    newArticle.content(),
                    entry.similarity(),
                    entry.matchType(),
                    ArticleLocation.of(oldDocument, oldArticle),
                    ArticleLocation.of(newDocument, newArticle),
                    same ? List.of() : similarity.diff(oldArticle.content(), newArticle.content()));
            if (same) {
                identical.add(matched);
            } else {
                modified.add(matched);
            }
        }

        for (Integer number : alignment.addedNumbers()) {
            Article newArticle = requireArticle(newDocument, number, "new");
            added.add(new UnmatchedArticle(ChangeCategory.ADDED, number, newArticle.content(),
                    ArticleLocation.of(newDocument, newArticle)));
        }

        identical.sort(Comparator.comparingInt(MatchedArticle::oldNumber));
        modified.sort(Comparator.comparingInt(MatchedArticle::oldNumber));
        added.sort(Comparator.comparingInt(UnmatchedArticle::articleNumber));
        deleted.sort(Comparator.comparingInt(UnmatchedArticle::articleNumber));

        ComparisonStatistics statistics = new ComparisonStatistics(
                oldDocument.articles().size(),
                newDocument.articles().size(),
                identical.size(),
                modified.size(),
                added.size(),
                deleted.size(),
                manualCount,
                autoCount);
        LOGGER.info("Comparison finished: {} identical, {} modified, {} new, {} deleted ({} manual, {} automatic matches)",
                statistics.identicalCount(), statistics.modifiedCount(), statistics.newCount(),
                statistics.deletedCount(), manualCount, autoCount);
        return new ComparisonReport(identical, modified, added, deleted, mapping, alignment.warnings(), statistics);
    }

    private static Article requireArticle(LawDocument document, int number, String side) {
        return document.article(number)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Alignment references " + side + " article " + number + " missing from its document"));
    }
}
