package ai.lawdiff.text;

/**
 * Structural classification of a single statute line.
 */
public enum LineType {
    BLANK,
    CHAPTER_HEADER,
    SECTION_HEADER,
    ARTICLE_HEADER,
    HEADER_LOOKALIKE,
    ENUMERATED_ITEM,
    CONTENT;

    public boolean isHeader() {
        return this == CHAPTER_HEADER || this == SECTION_HEADER || this == ARTICLE_HEADER;
    }
}
