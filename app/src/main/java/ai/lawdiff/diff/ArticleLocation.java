package ai.lawdiff.diff;

import ai.lawdiff.parse.Article;
import ai.lawdiff.parse.Chapter;
import ai.lawdiff.parse.LawDocument;
import ai.lawdiff.parse.Section;
import java.util.Objects;

/**
 * Chapter and section an article belongs to, with titles resolved against the document the article came from.
 * Titles are empty when the number is absent or does not resolve.
 */
public record ArticleLocation(Integer chapterNumber, String chapterTitle, Integer sectionNumber, String sectionTitle) {

    public ArticleLocation {
        chapterTitle = chapterTitle == null ? "" : chapterTitle;
        sectionTitle = sectionTitle == null ? "" : sectionTitle;
    }

    public static ArticleLocation of(LawDocument document, Article article) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(article, "article");
        Integer chapterNumber = article.chapterNumber();
        Integer sectionNumber = article.sectionNumber();
        String chapterTitle = chapterNumber == null ? ""
                : document.chapters().getOrDefault(chapterNumber, new Chapter(chapterNumber, "", "")).title();
        String sectionTitle = sectionNumber == null ? ""
                : document.sections().getOrDefault(sectionNumber, new Section(sectionNumber, "", "")).title();
        return new ArticleLocation(chapterNumber, chapterTitle, sectionNumber, sectionTitle);
    }

    /**
     * Renders the location as {@code 第1章《总则》 - 第2节《一般规定》}.
     */
    public String describe() {
        StringBuilder builder = new StringBuilder();
        builder.append('第').append(chapterNumber == null ? "?" : chapterNumber.toString()).append('章');
        if (!chapterTitle.isEmpty()) {
            builder.append('《').append(chapterTitle).append('》');
        }
        if (sectionNumber != null) {
            builder.append(" - 第").append(sectionNumber).append('节');
            if (!sectionTitle.isEmpty()) {
                builder.append('《').append(sectionTitle).append('》');
            }
        }
        return builder.toString();
    }
}
