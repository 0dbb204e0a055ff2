package ai.lawdiff.text;

import ai.lawdiff.numeral.ChineseNumeralConverter;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex based classifier for Chinese statute text ({@code 第一章}, {@code 第二节}, {@code 第三条}, {@code （一）}).
 */
public class DefaultLineClassifier implements LineClassifier {

    private static final String NUMERAL = "[" + ChineseNumeralConverter.NUMERAL_CHARACTERS + "]+";
    private static final String SEPARATOR = "[\\s　]*";

    private static final Pattern CHAPTER = Pattern.compile("^第(" + NUMERAL + ")章" + SEPARATOR + "(.+)$");
    private static final Pattern SECTION = Pattern.compile("^第(" + NUMERAL + ")节" + SEPARATOR + "(.+)$");
    private static final Pattern ARTICLE = Pattern.compile("^第(" + NUMERAL + ")条" + SEPARATOR + "(.+)$");
    private static final Pattern HEADER_LOOKALIKE = Pattern.compile("^第" + NUMERAL + "[章节]");
    private static final Pattern ENUMERATOR = Pattern.compile("^[(（](?:" + NUMERAL + "|\\d+)[)）]");

    @Override
    public LineType classify(String line) {
        if (line == null || line.isBlank()) {
            return LineType.BLANK;
        }
        String trimmed = line.strip();
        Optional<HeaderMatch> header = matchHeader(trimmed);
        if (header.isPresent()) {
            return header.get().type();
        }
        if (HEADER_LOOKALIKE.matcher(trimmed).find()) {
            return LineType.HEADER_LOOKALIKE;
        }
        if (startsWithEnumerator(trimmed)) {
            return LineType.ENUMERATED_ITEM;
        }
        return LineType.CONTENT;
    }

    @Override
    public Optional<HeaderMatch> matchHeader(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.strip();
        return match(CHAPTER, LineType.CHAPTER_HEADER, trimmed)
                .or(() -> match(SECTION, LineType.SECTION_HEADER, trimmed))
                .or(() -> match(ARTICLE, LineType.ARTICLE_HEADER, trimmed));
    }

    /**
     * Whether the line opens with a parenthesised enumerator such as {@code （一）} or {@code (2)}.
     */
    public static boolean startsWithEnumerator(String line) {
        return line != null && ENUMERATOR.matcher(line.strip()).find();
    }

    private static Optional<HeaderMatch> match(Pattern pattern, LineType type, String line) {
        Matcher matcher = pattern.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String remainder = matcher.group(2).strip();
        if (remainder.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new HeaderMatch(type, matcher.group(1), remainder));
    }
}
