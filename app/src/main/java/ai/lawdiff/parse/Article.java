package ai.lawdiff.parse;

import java.util.Objects;

/**
 * A single numbered article.
 *
 * @param number        article number, unique within its document
 * @param content       normalized body with the {@code 第N条} heading removed
 * @param fullText      the article as it appeared in the source, heading included
 * @param chapterNumber enclosing chapter, {@code null} when the article precedes every chapter header
 * @param sectionNumber enclosing section, {@code null} outside any section
 * @param lineCount     number of source lines the article spanned
 */
public record Article(int number, String content, String fullText, Integer chapterNumber, Integer sectionNumber,
                      int lineCount) {

    public Article {
        content = Objects.requireNonNull(content, "content");
        fullText = Objects.requireNonNull(fullText, "fullText");
        if (lineCount < 0) {
            throw new IllegalArgumentException("lineCount must not be negative");
        }
    }
}
