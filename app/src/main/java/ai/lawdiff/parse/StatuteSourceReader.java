package ai.lawdiff.parse;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads statute text files, which must be UTF-8 encoded.
 */
public class StatuteSourceReader {

    public String read(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            // drop a leading byte order mark left by some editors
            return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
        } catch (NoSuchFileException ex) {
            throw new SourceReadException("Statute file not found: " + path, ex);
        } catch (CharacterCodingException ex) {
            throw new SourceReadException("Statute file is not valid UTF-8: " + path, ex);
        } catch (IOException ex) {
            throw new SourceReadException("Failed to read statute file: " + path, ex);
        }
    }
}
