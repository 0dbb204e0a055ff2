package ai.lawdiff.parse;

import java.util.Objects;

/**
 * A section header ({@code 第二节 道路通行条件}). Sections share one namespace across the whole document.
 */
public record Section(int number, String title, String sourceText) {

    public Section {
        title = Objects.requireNonNull(title, "title");
        sourceText = Objects.requireNonNull(sourceText, "sourceText");
    }
}
