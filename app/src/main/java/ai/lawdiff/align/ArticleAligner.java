package ai.lawdiff.align;

import ai.lawdiff.parse.Article;
import ai.lawdiff.parse.LawDocument;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns the articles of two statute versions.
 *
 * <p>Manual matches are applied first and always win. Remaining old articles are then visited in ascending order and
 * greedily paired with the most similar unclaimed new article (lowest new number on ties) when the similarity is above
 * zero and reaches the threshold. New articles left unclaimed are reported as added.
 */
public class ArticleAligner {

    public static final double DEFAULT_THRESHOLD = 0.8;

    private static final Logger LOGGER = LoggerFactory.getLogger(ArticleAligner.class);

    private final TextSimilarity similarity;

    public ArticleAligner() {
        this(new TextSimilarity());
    }

    public ArticleAligner(TextSimilarity similarity) {
        this.similarity = Objects.requireNonNull(similarity, "similarity");
    }

    public AlignmentResult align(LawDocument oldDocument, LawDocument newDocument, List<ManualMatch> manualMatches) {
        return align(oldDocument, newDocument, manualMatches, DEFAULT_THRESHOLD);
    }

    public AlignmentResult align(LawDocument oldDocument, LawDocument newDocument, List<ManualMatch> manualMatches,
                                 double threshold) {
        Objects.requireNonNull(oldDocument, "oldDocument");
        Objects.requireNonNull(newDocument, "newDocument");
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0, 1]: " + threshold);
        }
        List<ManualMatch> manual = manualMatches == null ? List.of() : manualMatches;
        Map<Integer, Article> oldArticles = oldDocument.articles();
        Map<Integer, Article> newArticles = newDocument.articles();

        List<AlignmentEntry> entries = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<Integer> consumedOld = new HashSet<>();
        Set<Integer> consumedNew = new HashSet<>();

        int manualCount = 0;
        for (ManualMatch match : manual) {
            Article oldArticle = oldArticles.get(match.oldNumber());
            Article newArticle = newArticles.get(match.newNumber());
            String problem = null;
            if (oldArticle == null || newArticle == null) {
                problem = "Manual match references a missing article: old " + match.oldNumber()
                        + " / new " + match.newNumber();
            } else if (consumedOld.contains(match.oldNumber()) || consumedNew.contains(match.newNumber())) {
                problem = "Manual match reuses an already matched article: old " + match.oldNumber()
                        + " / new " + match.newNumber();
            }
            if (problem != null) {
                LOGGER.warn(problem);
                warnings.add(problem);
                continue;
            }
            double score = similarity.ratio(oldArticle.content(), newArticle.content());
            entries.add(new AlignmentEntry(match.oldNumber(), match.newNumber(), score, MatchType.MANUAL));
            consumedOld.add(match.oldNumber());
            consumedNew.add(match.newNumber());
            manualCount++;
            LOGGER.debug("Manual match: article {} -> {} (similarity {})", match.oldNumber(), match.newNumber(),
                    String.format("%.3f", score));
        }

        LOGGER.debug("Automatic matching of {} old against {} new articles",
                oldArticles.size() - consumedOld.size(), newArticles.size() - consumedNew.size());
        int autoCount = 0;
        int deletedCount = 0;
        for (Article oldArticle : oldArticles.values()) {
            if (consumedOld.contains(oldArticle.number())) {
                continue;
            }
            // a candidate sharing no text with the old article is never picked
            int bestNumber = AlignmentEntry.UNMATCHED;
            double bestScore = 0.0;
            for (Article candidate : newArticles.values()) {
                if (consumedNew.contains(candidate.number())) {
                    continue;
                }
                double score = similarity.ratio(oldArticle.content(), candidate.content());
                if (score > bestScore) {
                    bestScore = score;
                    bestNumber = candidate.number();
                }
            }
            if (bestNumber != AlignmentEntry.UNMATCHED && bestScore >= threshold) {
                entries.add(new AlignmentEntry(oldArticle.number(), bestNumber, bestScore, MatchType.AUTO));
                consumedOld.add(oldArticle.number());
                consumedNew.add(bestNumber);
                autoCount++;
            } else {
                entries.add(AlignmentEntry.unmatched(oldArticle.number()));
                deletedCount++;
            }
        }

        List<Integer> added = new ArrayList<>();
        for (Integer number : newArticles.keySet()) {
            if (!consumedNew.contains(number)) {
                added.add(number);
            }
        }

        AlignmentStatistics statistics = new AlignmentStatistics(oldArticles.size(), newArticles.size(),
                manualCount, autoCount, deletedCount, added.size());
        LOGGER.info("Aligned articles: {} manual, {} automatic, {} deleted, {} added",
                manualCount, autoCount, deletedCount, added.size());
        return new AlignmentResult(entries, added, warnings, statistics);
    }
}
