package ai.lawdiff.parse;

/**
 * Runtime exception raised when a statute source file cannot be read.
 */
public class SourceReadException extends RuntimeException {

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
