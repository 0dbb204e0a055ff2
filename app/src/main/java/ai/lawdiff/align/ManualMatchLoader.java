package ai.lawdiff.align;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads manual matches from JSON of the form {@code {"manual_matches": [{"old_number": 5, "new_number": 9}]}}.
 */
public class ManualMatchLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManualMatchLoader.class);

    private final ObjectMapper objectMapper;

    public ManualMatchLoader() {
        this(new ObjectMapper());
    }

    public ManualMatchLoader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public List<ManualMatch> load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new ManualMatchException("Manual match file not found: " + path);
        }
        try {
            ManualMatchFile file = objectMapper.readValue(path.toFile(), ManualMatchFile.class);
            List<ManualMatch> matches = file.manualMatches() == null ? List.of() : List.copyOf(file.manualMatches());
            LOGGER.info("Loaded {} manual matches from {}", matches.size(), path);
            return matches;
        } catch (IOException ex) {
            throw new ManualMatchException("Failed to read manual match file: " + path, ex);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ManualMatchFile(@JsonProperty("manual_matches") List<ManualMatch> manualMatches) {
    }
}
