package ai.lawdiff.config;

import java.util.Optional;

/**
 * Source of environment values, replaceable in tests.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Value for {@code key} with surrounding whitespace removed; empty when unset or blank.
     */
    default Optional<String> getNonBlank(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
