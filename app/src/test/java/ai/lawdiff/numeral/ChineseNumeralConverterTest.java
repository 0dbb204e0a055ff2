package ai.lawdiff.numeral;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ChineseNumeralConverterTest {

    @Test
    void convertsLeadingTenWithoutDigit() {
        assertThat(ChineseNumeralConverter.convert("十")).isEqualTo(10);
        assertThat(ChineseNumeralConverter.convert("十一")).isEqualTo(11);
        assertThat(ChineseNumeralConverter.convert("二十")).isEqualTo(20);
    }

    @Test
    void treatsZeroAsPlaceholder() {
        assertThat(ChineseNumeralConverter.convert("一百零五")).isEqualTo(105);
        assertThat(ChineseNumeralConverter.convert("一千零一")).isEqualTo(1001);
        assertThat(ChineseNumeralConverter.convert("二〇")).isEqualTo(2);
    }

    @Test
    void convertsUpToFourDigits() {
        assertThat(ChineseNumeralConverter.convert("九千九百九十九")).isEqualTo(9999);
        assertThat(ChineseNumeralConverter.convert("两百三十")).isEqualTo(230);
        assertThat(ChineseNumeralConverter.convert("一百一十二")).isEqualTo(112);
    }

    @Test
    void appliesTenThousandAsPlainMultiplier() {
        assertThat(ChineseNumeralConverter.convert("一万")).isEqualTo(10000);
    }

    @Test
    void yieldsZeroForMissingOrUnknownInput() {
        assertThat(ChineseNumeralConverter.convert(null)).isZero();
        assertThat(ChineseNumeralConverter.convert("")).isZero();
        assertThat(ChineseNumeralConverter.convert("abc")).isZero();
    }
}
