package ai.lawdiff.text;

import java.util.Optional;

/**
 * Classifies statute lines by structural role.
 */
public interface LineClassifier {

    LineType classify(String line);

    /**
     * Splits a chapter, section or article header into numeral and remainder, or returns empty when the line is not a
     * complete header.
     */
    Optional<HeaderMatch> matchHeader(String line);
}
