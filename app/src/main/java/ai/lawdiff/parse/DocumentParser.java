package ai.lawdiff.parse;

import ai.lawdiff.numeral.ChineseNumeralConverter;
import ai.lawdiff.text.DefaultLineClassifier;
import ai.lawdiff.text.HeaderMatch;
import ai.lawdiff.text.LineClassifier;
import ai.lawdiff.text.LineType;
import ai.lawdiff.text.TextNormalizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconstructs the chapter / section / article hierarchy of a statute in one forward scan.
 */
public class DocumentParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentParser.class);

    private final TextNormalizer normalizer;
    private final LineClassifier classifier;

    public DocumentParser() {
        this(new TextNormalizer(), new DefaultLineClassifier());
    }

    public DocumentParser(TextNormalizer normalizer, LineClassifier classifier) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public LawDocument parse(String text) {
        return parse(null, text);
    }

    public LawDocument parse(String sourceName, String text) {
        List<String> cleaned = normalizer.cleanLines(text);
        int contentLength = String.join("\n", cleaned).length();
        List<String> lines = new ArrayList<>();
        for (String line : normalizer.repairLineBreaks(cleaned)) {
            lines.add(normalizer.normalizePunctuation(line));
        }

        ScanState state = new ScanState();
        for (String line : lines) {
            LineType type = classifier.classify(line);
            switch (type) {
                case CHAPTER_HEADER -> state.enterChapter(header(line), line);
                case SECTION_HEADER -> state.enterSection(header(line), line);
                case ARTICLE_HEADER -> {
                    state.flushArticle();
                    state.openArticle(header(line), line);
                }
                case HEADER_LOOKALIKE -> LOGGER.debug("Skipping header fragment '{}'", line);
                case BLANK -> {
                }
                default -> state.append(line);
            }
        }
        state.flushArticle();

        LawDocument document = new LawDocument(sourceName, state.chapters, state.sections, state.articles,
                List.copyOf(state.duplicates), contentLength);
        LOGGER.info("Parsed {}: {} articles, {} chapters, {} sections",
                sourceName == null ? "<memory>" : sourceName,
                document.metadata().totalArticles(),
                document.metadata().totalChapters(),
                document.metadata().totalSections());
        return document;
    }

    private HeaderMatch header(String line) {
        Optional<HeaderMatch> match = classifier.matchHeader(line);
        return match.orElseThrow(() -> new IllegalStateException("Classifier reported a header it cannot match: " + line));
    }

    private final class ScanState {

        private final Map<Integer, Chapter> chapters = new HashMap<>();
        private final Map<Integer, Section> sections = new HashMap<>();
        private final Map<Integer, Article> articles = new HashMap<>();
        private final Set<Integer> duplicates = new LinkedHashSet<>();

        private Integer currentChapter;
        private Integer currentSection;
        private Integer articleNumber;
        private Integer articleChapter;
        private Integer articleSection;
        private HeaderMatch articleHeader;
        private final List<String> articleLines = new ArrayList<>();

        void enterChapter(HeaderMatch header, String line) {
            int number = ChineseNumeralConverter.convert(header.numeral());
            chapters.put(number, new Chapter(number, header.remainder(), line));
            currentChapter = number;
            currentSection = null;
        }

        void enterSection(HeaderMatch header, String line) {
            int number = ChineseNumeralConverter.convert(header.numeral());
            sections.put(number, new Section(number, header.remainder(), line));
            currentSection = number;
        }

        void openArticle(HeaderMatch header, String line) {
            articleNumber = ChineseNumeralConverter.convert(header.numeral());
            articleChapter = currentChapter;
            articleSection = currentSection;
            articleHeader = header;
            articleLines.clear();
            articleLines.add(line);
        }

        void append(String line) {
            // text ahead of the first article (titles, preambles, tables of contents) is not part of any article
            if (articleNumber != null) {
                articleLines.add(line);
            }
        }

        void flushArticle() {
            if (articleNumber == null) {
                return;
            }
            String fullText = String.join("\n", articleLines);
            List<String> body = new ArrayList<>(articleLines);
            body.set(0, articleHeader.remainder());
            String content = normalizer.cleanArticleContent(String.join("\n", body));
            Article article = new Article(articleNumber, content, fullText, articleChapter, articleSection,
                    articleLines.size());
            if (articles.put(articleNumber, article) != null) {
                duplicates.add(articleNumber);
                LOGGER.warn("Article {} appears more than once; keeping the later occurrence", articleNumber);
            }
            articleNumber = null;
            articleHeader = null;
            articleLines.clear();
        }
    }
}
