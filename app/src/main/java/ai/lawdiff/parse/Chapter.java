package ai.lawdiff.parse;

import java.util.Objects;

/**
 * A chapter header ({@code 第一章 总则}).
 */
public record Chapter(int number, String title, String sourceText) {

    public Chapter {
        title = Objects.requireNonNull(title, "title");
        sourceText = Objects.requireNonNull(sourceText, "sourceText");
    }
}
