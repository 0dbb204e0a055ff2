package ai.lawdiff.align;

/**
 * Runtime exception raised when a manual match file cannot be loaded.
 */
public class ManualMatchException extends RuntimeException {

    public ManualMatchException(String message) {
        super(message);
    }

    public ManualMatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
