package ai.lawdiff.config;

import java.util.Locale;

/**
 * Log output formats: human readable lines or one JSON object per line.
 */
public enum LogFormat {
    TEXT,
    JSON;

    public static LogFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Log format must be provided");
        }
        try {
            return LogFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log format: " + raw, ex);
        }
    }
}
