package ai.lawdiff.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Repairs spurious line breaks left behind by copy-pasting statutes out of PDF or web pages and normalizes
 * punctuation to full-width forms.
 */
public class TextNormalizer {

    private static final String TERMINAL_PUNCTUATION = "。．.；;：:！!？?";
    private static final String STRUCTURAL_PREFIXES = "第条章节";

    private static final Map<Character, Character> FULL_WIDTH = Map.ofEntries(
            Map.entry(',', '，'),
            Map.entry('.', '。'),
            Map.entry(';', '；'),
            Map.entry(':', '：'),
            Map.entry('?', '？'),
            Map.entry('!', '！'),
            Map.entry('(', '（'),
            Map.entry(')', '）'),
            Map.entry('[', '［'),
            Map.entry(']', '］'),
            Map.entry('{', '｛'),
            Map.entry('}', '｝'),
            Map.entry('<', '《'),
            Map.entry('>', '》'),
            Map.entry('«', '《'),
            Map.entry('»', '》'),
            Map.entry('"', '＂'),
            Map.entry('\'', '＇'));

    /**
     * Splits text into trimmed lines and drops blank ones.
     */
    public List<String> cleanLines(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    /**
     * Merges wrapped lines back into logical lines. A blank line always ends the current logical line.
     */
    public List<String> repairLineBreaks(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        List<String> repaired = new ArrayList<>();
        int index = 0;
        while (index < lines.size()) {
            String current = lines.get(index).strip();
            if (current.isEmpty()) {
                index++;
                continue;
            }
            while (index + 1 < lines.size()) {
                String next = lines.get(index + 1).strip();
                if (next.isEmpty() || !shouldMerge(current, next)) {
                    break;
                }
                current = current + next;
                index++;
            }
            repaired.add(current);
            index++;
        }
        return repaired;
    }

    public String repairLineBreaks(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return String.join("\n", repairLineBreaks(List.of(text.split("\\R", -1))));
    }

    /**
     * Groups article body lines into logical segments. Enumerated sub-items ({@code （一）}, {@code (2)}) always start a
     * segment of their own and never absorb the lines that follow them.
     */
    public List<String> segmentArticleBody(List<String> lines) {
        List<String> segments = new ArrayList<>();
        boolean lastIsEnumerator = false;
        for (String line : repairLineBreaks(lines)) {
            boolean enumerator = DefaultLineClassifier.startsWithEnumerator(line);
            if (!enumerator && !segments.isEmpty() && !lastIsEnumerator
                    && !endsWithAny(segments.get(segments.size() - 1), TERMINAL_PUNCTUATION)) {
                int last = segments.size() - 1;
                segments.set(last, segments.get(last) + line);
            } else {
                segments.add(line);
                lastIsEnumerator = enumerator;
            }
        }
        return segments;
    }

    /**
     * Maps ASCII punctuation to full-width forms and removes all whitespace. A period touching an ASCII digit stays a
     * period so numeric list markers such as {@code 1.} and decimals survive.
     */
    public String normalizePunctuation(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch) || Character.isSpaceChar(ch)) {
                continue;
            }
            if (ch == '.' && touchesDigit(text, i)) {
                builder.append(ch);
                continue;
            }
            builder.append(FULL_WIDTH.getOrDefault(ch, ch));
        }
        return builder.toString();
    }

    /**
     * Produces the stored form of an article body: segmented, normalized, one segment per line.
     */
    public String cleanArticleContent(String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        List<String> normalized = new ArrayList<>();
        for (String segment : segmentArticleBody(cleanLines(content))) {
            String value = normalizePunctuation(segment);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        return String.join("\n", normalized);
    }

    boolean shouldMerge(String current, String next) {
        if (endsWithAny(current, TERMINAL_PUNCTUATION)) {
            return false;
        }
        char first = next.charAt(0);
        // enumerators and structural keywords always open a new logical line
        return STRUCTURAL_PREFIXES.indexOf(first) < 0 && first != '(' && first != '（';
    }

    private static boolean endsWithAny(String value, String characters) {
        return !value.isEmpty() && characters.indexOf(value.charAt(value.length() - 1)) >= 0;
    }

    private static boolean touchesDigit(String text, int index) {
        return (index > 0 && isAsciiDigit(text.charAt(index - 1)))
                || (index + 1 < text.length() && isAsciiDigit(text.charAt(index + 1)));
    }

    private static boolean isAsciiDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }
}
