package ai.lawdiff.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.lawdiff.cli.CliArguments;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesParseConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "parse",
                "-o", "out/result.json",
                "--preview", "5",
                "--no-json",
                "--log-format", "json",
                "-v",
                "docs/traffic.txt");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.PARSE);
        assertThat(config.inputFiles()).containsExactly(Path.of("docs/traffic.txt"));
        assertThat(config.outputFile()).contains(Path.of("out/result.json"));
        assertThat(config.previewCount()).isEqualTo(5);
        assertThat(config.writeJson()).isFalse();
        assertThat(config.force()).isFalse();
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.verbose()).isTrue();
        assertThat(config.threshold()).isEqualTo(0.8);
        assertThat(config.manualMatchesFile()).isEmpty();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_THRESHOLD, "0.75");
        envValues.put(ConfigLoader.ENV_MANUAL_MATCHES, "manual.json");
        envValues.put(ConfigLoader.ENV_OUTPUT_PREFIX, "traffic");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "JSON");

        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "old.txt", "new.txt");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.COMPARE);
        assertThat(config.threshold()).isEqualTo(0.75);
        assertThat(config.manualMatchesFile()).contains(Path.of("manual.json"));
        assertThat(config.outputPrefix()).isEqualTo("traffic");
        assertThat(config.resolveOutputPath()).isEqualTo(Path.of("traffic-data.json"));
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_MODE, ConfigLoader.ENV_THRESHOLD);
    }

    @Test
    void cliValuesOverrideEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_MODE, "parse",
                ConfigLoader.ENV_THRESHOLD, "0.5"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "compare", "-t", "0.9", "old.txt", "new.txt");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.COMPARE);
        assertThat(config.threshold()).isEqualTo(0.9);
        assertThat(config.outputPrefix()).isEqualTo(ConfigLoader.DEFAULT_OUTPUT_PREFIX);
    }

    @Test
    void parseModeDerivesOutputNameFromInput() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "parse", "docs/traffic.txt");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.resolveOutputPath()).isEqualTo(Path.of("parsed_traffic.json"));
    }

    @Test
    void manualMatchesInParseModeCauseValidationError() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "parse", "-m", "manual.json", "law.txt");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("compare mode");
    }

    @Test
    void compareModeRequiresTwoInputs() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "law.txt");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("compare mode expects 2");
    }

    @Test
    void thresholdOutsideUnitIntervalIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "-t", "1.5", "old.txt", "new.txt");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("threshold");
    }

    @Test
    void nonNumericEnvironmentThresholdIsRejected() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_THRESHOLD, "high"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "old.txt", "new.txt");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_THRESHOLD);
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
