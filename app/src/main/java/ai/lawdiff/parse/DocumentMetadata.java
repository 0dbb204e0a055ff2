package ai.lawdiff.parse;

/**
 * Summary counts of a parsed document.
 */
public record DocumentMetadata(int totalChapters, int totalSections, int totalArticles, int totalContentLength) {
}
