package ai.lawdiff.numeral;

import java.util.Map;

/**
 * Converts Chinese numeral tokens such as {@code 一百零五} into integers.
 *
 * <p>The ten-thousand unit {@code 万} is applied as a plain multiplier instead of opening a new
 * magnitude group, so values of 20,000 and above are not converted according to standard
 * grammar. Article and chapter numbers never get there.
 */
public final class ChineseNumeralConverter {

    private static final Map<Character, Integer> DIGITS = Map.ofEntries(
            Map.entry('零', 0),
            Map.entry('〇', 0),
            Map.entry('一', 1),
            Map.entry('二', 2),
            Map.entry('两', 2),
            Map.entry('三', 3),
            Map.entry('四', 4),
            Map.entry('五', 5),
            Map.entry('六', 6),
            Map.entry('七', 7),
            Map.entry('八', 8),
            Map.entry('九', 9));

    private static final Map<Character, Integer> UNITS = Map.of(
            '十', 10,
            '百', 100,
            '千', 1000,
            '万', 10000);

    /** Character class matching every numeral character the converter understands. */
    public static final String NUMERAL_CHARACTERS = "零〇一二两三四五六七八九十百千万";

    private ChineseNumeralConverter() {
    }

    /**
     * Converts the given token. Unknown characters are skipped; {@code null}, empty or fully
     * unrecognized input yields {@code 0}.
     */
    public static int convert(String token) {
        if (token == null || token.isEmpty()) {
            return 0;
        }
        int total = 0;
        int pending = 0;
        for (int i = 0; i < token.length(); i++) {
            char ch = token.charAt(i);
            Integer digit = DIGITS.get(ch);
            if (digit != null) {
                // zero is only a placeholder
                if (digit != 0) {
                    pending = digit;
                }
                continue;
            }
            Integer unit = UNITS.get(ch);
            if (unit != null) {
                int multiplier = pending == 0 ? 1 : pending;
                total += multiplier * unit;
                pending = 0;
            }
        }
        return total + pending;
    }
}
