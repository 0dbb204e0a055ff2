package ai.lawdiff.writer;

import ai.lawdiff.diff.ComparisonReport;
import ai.lawdiff.parse.LawDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes parse and comparison results as UTF-8 JSON with snake_case property names.
 */
public class ReportWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper objectMapper;

    public ReportWriter() {
        this(new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public void writeDocument(Path target, LawDocument document, boolean force) {
        Objects.requireNonNull(document, "document");
        write(target, documentView(document), force);
    }

    public void writeComparison(Path target, ComparisonReport report, LawDocument oldDocument, LawDocument newDocument,
                                double threshold, boolean force) {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(oldDocument, "oldDocument");
        Objects.requireNonNull(newDocument, "newDocument");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("law1_file", oldDocument.sourceName().orElse(null));
        metadata.put("law2_file", newDocument.sourceName().orElse(null));
        metadata.put("threshold", threshold);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("identical", report.identical());
        result.put("modified", report.modified());
        result.put("new", report.added());
        result.put("deleted", report.deleted());
        result.put("mapping", report.mapping());
        result.put("warnings", report.warnings());
        result.put("statistics", report.statistics());

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("metadata", metadata);
        root.put("comparison_result", result);
        root.put("law1_metadata", oldDocument.metadata());
        root.put("law2_metadata", newDocument.metadata());
        write(target, root, force);
    }

    private static Map<String, Object> documentView(LawDocument document) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("file_path", document.sourceName().orElse(null));
        view.put("chapters", document.chapters());
        view.put("sections", document.sections());
        view.put("articles", document.articles());
        view.put("metadata", document.metadata());
        view.put("duplicate_article_numbers", document.duplicateArticleNumbers());
        return view;
    }

    private void write(Path target, Object value, boolean force) {
        if (target == null) {
            throw new IllegalArgumentException("target must be provided");
        }
        if (Files.exists(target) && !force) {
            throw new IllegalArgumentException("Output file already exists (use --force to overwrite): " + target);
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(target.toFile(), value);
            LOGGER.info("Wrote {}", target);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write report: " + target, ex);
        }
    }
}
