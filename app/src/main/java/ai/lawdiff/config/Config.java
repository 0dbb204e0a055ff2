package ai.lawdiff.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        Mode mode,
        List<Path> inputFiles,
        double threshold,
        Optional<Path> manualMatchesFile,
        Optional<Path> outputFile,
        String outputPrefix,
        boolean writeJson,
        boolean force,
        int previewCount,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        inputFiles = List.copyOf(Objects.requireNonNull(inputFiles, "inputFiles"));
        if (inputFiles.size() != mode.requiredInputs()) {
            throw new IllegalArgumentException(mode.name().toLowerCase(Locale.ROOT) + " mode expects " + mode.requiredInputs()
                    + " input file(s) but got " + inputFiles.size());
        }
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0 and 1: " + threshold);
        }
        manualMatchesFile = manualMatchesFile == null ? Optional.empty() : manualMatchesFile;
        outputFile = outputFile == null ? Optional.empty() : outputFile;
        if (outputPrefix == null || outputPrefix.isBlank()) {
            throw new IllegalArgumentException("outputPrefix must not be blank");
        }
        if (previewCount < 0) {
            throw new IllegalArgumentException("previewCount must be zero or greater");
        }
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }

    /**
     * Where the JSON result goes: the explicit output file, or {@code parsed_<name>.json} when parsing and
     * {@code <prefix>-data.json} when comparing.
     */
    public Path resolveOutputPath() {
        if (outputFile.isPresent()) {
            return outputFile.get();
        }
        if (mode == Mode.PARSE) {
            String fileName = inputFiles.get(0).getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
            return Path.of("parsed_" + baseName + ".json");
        }
        return Path.of(outputPrefix + "-data.json");
    }
}
