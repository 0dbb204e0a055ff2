package ai.lawdiff.align;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class TextSimilarityTest {

    private final TextSimilarity similarity = new TextSimilarity();

    @Test
    void ratioCountsMatchedCharactersOfBothTexts() {
        assertThat(similarity.ratio("禁止吸烟。", "禁止吸烟和饮酒。")).isCloseTo(10.0 / 13.0, within(1e-9));
        assertThat(similarity.ratio("罚款一百元。", "罚款二百元。")).isCloseTo(10.0 / 12.0, within(1e-9));
        assertThat(similarity.ratio("abcde", "abcdX")).isEqualTo(0.8);
    }

    @Test
    void identicalTextsHaveRatioOne() {
        assertThat(similarity.ratio("本法自公布之日起施行。", "本法自公布之日起施行。")).isEqualTo(1.0);
    }

    @Test
    void emptyTextHasRatioZero() {
        assertThat(similarity.ratio("", "内容")).isZero();
        assertThat(similarity.ratio("内容", "")).isZero();
        assertThat(similarity.ratio("", "")).isZero();
        assertThat(similarity.ratio(null, "内容")).isZero();
    }

    @Test
    void ratioDoesNotDependOnArgumentOrder() {
        assertThat(similarity.ratio("tide", "diet")).isEqualTo(0.5);
        assertThat(similarity.ratio("diet", "tide")).isEqualTo(0.5);
        assertThat(similarity.ratio("罚款一百元。", "一百元罚款。"))
                .isEqualTo(similarity.ratio("一百元罚款。", "罚款一百元。"));
        assertThat(similarity.ratio("禁止吸烟和饮酒。", "禁止吸烟。"))
                .isEqualTo(similarity.ratio("禁止吸烟。", "禁止吸烟和饮酒。"));
    }

    @Test
    void unrelatedTextsHaveRatioZero() {
        assertThat(similarity.ratio("甲乙丙", "丁戊己")).isZero();
    }

    @Test
    void diffEmitsDeletionBeforeInsertion() {
        assertThat(similarity.diff("罚款一百元。", "罚款二百元。"))
                .extracting(DiffSpan::type, DiffSpan::text)
                .containsExactly(
                        tuple(DiffSpanType.EQUAL, "罚款"),
                        tuple(DiffSpanType.DELETED, "一"),
                        tuple(DiffSpanType.INSERTED, "二"),
                        tuple(DiffSpanType.EQUAL, "百元。"));
    }

    @Test
    void diffOfAppendedTextIsInsertion() {
        assertThat(similarity.diff("禁止吸烟。", "禁止吸烟和饮酒。"))
                .extracting(DiffSpan::type, DiffSpan::text)
                .containsExactly(
                        tuple(DiffSpanType.EQUAL, "禁止吸烟"),
                        tuple(DiffSpanType.INSERTED, "和饮酒"),
                        tuple(DiffSpanType.EQUAL, "。"));
    }

    @Test
    void diffAgainstEmptyTextIsSingleSpan() {
        assertThat(similarity.diff("", "新增"))
                .extracting(DiffSpan::type, DiffSpan::text)
                .containsExactly(tuple(DiffSpanType.INSERTED, "新增"));
        assertThat(similarity.diff("删除", null))
                .extracting(DiffSpan::type, DiffSpan::text)
                .containsExactly(tuple(DiffSpanType.DELETED, "删除"));
    }
}
