package ai.lawdiff.diff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import ai.lawdiff.align.AlignmentResult;
import ai.lawdiff.align.ArticleAligner;
import ai.lawdiff.align.DiffSpan;
import ai.lawdiff.align.DiffSpanType;
import ai.lawdiff.align.ManualMatch;
import ai.lawdiff.align.MatchType;
import ai.lawdiff.parse.Article;
import ai.lawdiff.parse.DocumentParser;
import ai.lawdiff.parse.LawDocument;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ComparisonAnalyzerTest {

    private final ArticleAligner aligner = new ArticleAligner();
    private final ComparisonAnalyzer analyzer = new ComparisonAnalyzer();

    @Test
    void classifiesSmokingAndFineScenarioAtDefaultThreshold() {
        LawDocument oldDocument = document(1, "禁止吸烟。", 2, "罚款一百元。");
        LawDocument newDocument = document(1, "禁止吸烟和饮酒。", 3, "罚款二百元。");

        ComparisonReport report = analyze(oldDocument, newDocument, ArticleAligner.DEFAULT_THRESHOLD);

        // 禁止吸烟。 vs 禁止吸烟和饮酒。 scores 10/13, just below the default threshold
        assertThat(report.identical()).isEmpty();
        assertThat(report.modified())
                .extracting(MatchedArticle::oldNumber, MatchedArticle::newNumber, MatchedArticle::matchType)
                .containsExactly(tuple(2, 3, MatchType.AUTO));
        assertThat(report.modified().get(0).similarity()).isCloseTo(10.0 / 12.0, within(1e-9));
        assertThat(report.deleted()).extracting(UnmatchedArticle::articleNumber).containsExactly(1);
        assertThat(report.added()).extracting(UnmatchedArticle::articleNumber).containsExactly(1);
        assertThat(report.mapping()).containsExactly(Map.entry(2, 3));
    }

    @Test
    void bothPairsAreModifiedAtLowerThreshold() {
        LawDocument oldDocument = document(1, "禁止吸烟。", 2, "罚款一百元。");
        LawDocument newDocument = document(1, "禁止吸烟和饮酒。", 3, "罚款二百元。");

        ComparisonReport report = analyze(oldDocument, newDocument, 0.75);

        assertThat(report.modified())
                .extracting(MatchedArticle::oldNumber, MatchedArticle::newNumber, MatchedArticle::category)
                .containsExactly(tuple(1, 1, ChangeCategory.MODIFIED), tuple(2, 3, ChangeCategory.MODIFIED));
        assertThat(report.modified().get(0).similarity()).isLessThan(ComparisonAnalyzer.IDENTICAL_THRESHOLD);
        assertThat(report.modified().get(0).diff())
                .filteredOn(span -> span.type() == DiffSpanType.INSERTED)
                .extracting(DiffSpan::text)
                .containsExactly("和饮酒");
        assertThat(report.added()).isEmpty();
        assertThat(report.deleted()).isEmpty();
        assertThat(report.statistics())
                .extracting(ComparisonStatistics::totalArticlesV1, ComparisonStatistics::totalArticlesV2,
                        ComparisonStatistics::modifiedCount, ComparisonStatistics::autoMatchesCount)
                .containsExactly(2, 2, 2, 2);
    }

    @Test
    void identicalPairsCarryNoDiff() {
        LawDocument oldDocument = document(1, "本法自公布之日起施行。");
        LawDocument newDocument = document(2, "本法自公布之日起施行。");

        ComparisonReport report = analyze(oldDocument, newDocument, ArticleAligner.DEFAULT_THRESHOLD);

        assertThat(report.identical())
                .extracting(MatchedArticle::oldNumber, MatchedArticle::newNumber, MatchedArticle::category)
                .containsExactly(tuple(1, 2, ChangeCategory.IDENTICAL));
        assertThat(report.identical().get(0).diff()).isEmpty();
        assertThat(report.statistics().identicalCount()).isEqualTo(1);
    }

    @Test
    void countsManualMatchesAndPassesWarningsThrough() {
        LawDocument oldDocument = document(5, "本法自公布之日起施行。");
        LawDocument newDocument = document(9, "国务院负责组织实施。");

        AlignmentResult alignment = aligner.align(oldDocument, newDocument,
                List.of(new ManualMatch(5, 9), new ManualMatch(6, 9)));
        ComparisonReport report = analyzer.analyze(oldDocument, newDocument, alignment);

        assertThat(report.modified()).extracting(MatchedArticle::matchType).containsExactly(MatchType.MANUAL);
        assertThat(report.statistics().manualMatchesCount()).isEqualTo(1);
        assertThat(report.warnings()).hasSize(1);
    }

    @Test
    void resolvesChapterAndSectionTitles() {
        DocumentParser parser = new DocumentParser();
        LawDocument oldDocument = parser.parse(String.join("\n",
                "第一章 总则",
                "第一节 一般规定",
                "第一条 为了规范管理，制定本法。"));
        LawDocument newDocument = parser.parse(String.join("\n",
                "第一章 总则",
                "第一条 为了规范管理，制定本法。",
                "第二章 附则",
                "第二条 本法自公布之日起施行。"));

        ComparisonReport report = analyze(oldDocument, newDocument, ArticleAligner.DEFAULT_THRESHOLD);

        MatchedArticle matched = report.identical().get(0);
        assertThat(matched.oldLocation()).isEqualTo(new ArticleLocation(1, "总则", 1, "一般规定"));
        assertThat(matched.oldLocation().describe()).isEqualTo("第1章《总则》 - 第1节《一般规定》");
        assertThat(matched.newLocation().describe()).isEqualTo("第1章《总则》");
        assertThat(report.added().get(0).location())
                .extracting(ArticleLocation::chapterNumber, ArticleLocation::chapterTitle)
                .containsExactly(2, "附则");
    }

    private ComparisonReport analyze(LawDocument oldDocument, LawDocument newDocument, double threshold) {
        AlignmentResult alignment = aligner.align(oldDocument, newDocument, List.of(), threshold);
        return analyzer.analyze(oldDocument, newDocument, alignment);
    }

    private static LawDocument document(Object... numberAndContent) {
        Map<Integer, Article> articles = new LinkedHashMap<>();
        for (int i = 0; i < numberAndContent.length; i += 2) {
            int number = (Integer) numberAndContent[i];
            String content = (String) numberAndContent[i + 1];
            articles.put(number, new Article(number, content, "第" + number + "条" + content, null, null, 1));
        }
        return LawDocument.ofArticles(articles);
    }
}
