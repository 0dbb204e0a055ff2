package ai.lawdiff.text;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void mergesLineWithoutTerminalPunctuation() {
        List<String> repaired = normalizer.repairLineBreaks(List.of("机动车驾驶人应当", "遵守交通信号。"));

        assertThat(repaired).containsExactly("机动车驾驶人应当遵守交通信号。");
    }

    @Test
    void keepsStructuralLinesApart() {
        List<String> repaired = normalizer.repairLineBreaks(List.of(
                "中华人民共和国道路交通安全法",
                "第一章 总则",
                "第一条 有下列情形之一的",
                "（一）饮酒后驾驶",
                "(二)超速行驶"));

        assertThat(repaired).containsExactly(
                "中华人民共和国道路交通安全法",
                "第一章 总则",
                "第一条 有下列情形之一的",
                "（一）饮酒后驾驶",
                "(二)超速行驶");
    }

    @Test
    void blankLineEndsLogicalLine() {
        assertThat(normalizer.repairLineBreaks("甲方应当\n\n乙方可以")).isEqualTo("甲方应当\n乙方可以");
    }

    @Test
    void cleanLinesDropsBlankLinesAndTrims() {
        assertThat(normalizer.cleanLines("  第一条 内容。 \r\n\n\t\n第二条 其他。"))
                .containsExactly("第一条 内容。", "第二条 其他。");
        assertThat(normalizer.cleanLines(null)).isEmpty();
    }

    @Test
    void normalizesAsciiPunctuationAndRemovesWhitespace() {
        assertThat(normalizer.normalizePunctuation("处以 罚款, 见(附件); 完毕."))
                .isEqualTo("处以罚款，见（附件）；完毕。");
    }

    @Test
    void keepsPeriodNextToDigits() {
        assertThat(normalizer.normalizePunctuation("比例为1.5倍")).isEqualTo("比例为1.5倍");
        assertThat(normalizer.normalizePunctuation("2. 申请人")).isEqualTo("2.申请人");
    }

    @Test
    void punctuationNormalizationIsIdempotent() {
        List<String> samples = List.of(
                "处以 罚款, 见(附件); 完毕.",
                "\"引用\" 和 'single' <书名>",
                "比例为1.5倍. 其余!",
                "已经是全角：（一）。");

        for (String sample : samples) {
            String once = normalizer.normalizePunctuation(sample);
            assertThat(normalizer.normalizePunctuation(once)).isEqualTo(once);
        }
    }

    @Test
    void cleanArticleContentKeepsEnumeratedItemsOnTheirOwnLines() {
        String content = normalizer.cleanArticleContent("有下列情形之一的:\n(一) 吸烟;\n(二) 饮酒.");

        assertThat(content).isEqualTo("有下列情形之一的：\n（一）吸烟；\n（二）饮酒。");
    }

    @Test
    void segmentArticleBodyJoinsWrappedSentences() {
        List<String> segments = normalizer.segmentArticleBody(List.of("本法所称车辆", "是指机动车和非机动车。", "（一）机动车"));

        assertThat(segments).containsExactly("本法所称车辆是指机动车和非机动车。", "（一）机动车");
    }

    @Test
    void cleanArticleContentOfEmptyBodyIsEmpty() {
        assertThat(normalizer.cleanArticleContent("")).isEmpty();
        assertThat(normalizer.cleanArticleContent(null)).isEmpty();
    }
}
