package ai.lawdiff.config;

import ai.lawdiff.align.ArticleAligner;
import ai.lawdiff.cli.CliArguments;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} by combining CLI arguments with environment variables and defaults. CLI values win over
 * environment values, which win over defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "LAWDIFF_MODE";
    static final String ENV_THRESHOLD = "LAWDIFF_THRESHOLD";
    static final String ENV_MANUAL_MATCHES = "LAWDIFF_MANUAL_MATCHES";
    static final String ENV_OUTPUT_PREFIX = "LAWDIFF_OUTPUT_PREFIX";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final String DEFAULT_OUTPUT_PREFIX = "law-comparison";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = resolveMode(arguments);
        List<Path> inputs = arguments.inputFiles() == null ? List.of() : arguments.inputFiles();
        double threshold = resolveThreshold(arguments);

        Optional<Path> manualMatches = Optional.ofNullable(arguments.manualMatchesFile())
                .or(() -> environmentReader.getNonBlank(ENV_MANUAL_MATCHES).map(Path::of));
        if (mode == Mode.PARSE && manualMatches.isPresent()) {
            throw new IllegalArgumentException("--manual-matches can only be used in compare mode");
        }

        String outputPrefix = Optional.ofNullable(arguments.outputPrefix())
                .filter(value -> !value.isBlank())
                .or(() -> environmentReader.getNonBlank(ENV_OUTPUT_PREFIX))
                .orElse(DEFAULT_OUTPUT_PREFIX);

        if (arguments.previewCount() < 0) {
            throw new IllegalArgumentException("--preview must be zero or greater");
        }

        return new Config(mode,
                inputs,
                threshold,
                manualMatches,
                Optional.ofNullable(arguments.outputFile()),
                outputPrefix,
                !arguments.noJson(),
                arguments.force(),
                arguments.previewCount(),
                resolveLogFormat(arguments),
                arguments.verbose());
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.getNonBlank(ENV_MODE)
                .map(Mode::from)
                .orElse(Mode.COMPARE);
    }

    private double resolveThreshold(CliArguments arguments) {
        Double cliThreshold = arguments.threshold();
        if (cliThreshold != null) {
            return cliThreshold;
        }
        return environmentReader.getNonBlank(ENV_THRESHOLD)
                .map(ConfigLoader::parseThreshold)
                .orElse(ArticleAligner.DEFAULT_THRESHOLD);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static double parseThreshold(String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_THRESHOLD + " must be a number: " + raw, ex);
        }
    }
}
