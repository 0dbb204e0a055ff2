package ai.lawdiff.cli;

import ai.lawdiff.config.LogFormat;
import ai.lawdiff.config.Mode;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "law-diff", mixinStandardHelpOptions = true, version = "law-diff 0.1.0",
        description = "Parses Chinese statutes into chapters, sections and articles and compares two versions article by article")
public class CliArguments {

    @CommandLine.Parameters(arity = "1..2", paramLabel = "FILE",
            description = "Statute text file(s): one in parse mode, old and new version in compare mode")
    private List<Path> inputFiles;

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class, description = "Execution mode: compare or parse")
    private Mode mode;

    @CommandLine.Option(names = {"-t", "--threshold"}, description = "Similarity threshold for automatic matches (default: 0.8)",
            paramLabel = "RATIO")
    private Double threshold;

    @CommandLine.Option(names = {"-m", "--manual-matches"}, description = "JSON file with manual article matches",
            paramLabel = "FILE")
    private Path manualMatchesFile;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output JSON file", paramLabel = "FILE")
    private Path outputFile;

    @CommandLine.Option(names = "--output-prefix", description = "Prefix for generated comparison files", paramLabel = "PREFIX")
    private String outputPrefix;

    @CommandLine.Option(names = "--no-json", description = "Do not write the JSON result")
    private boolean noJson;

    @CommandLine.Option(names = {"-f", "--force"}, description = "Overwrite an existing output file")
    private boolean force;

    @CommandLine.Option(names = "--preview", defaultValue = "3", description = "Number of parsed articles to log in parse mode",
            paramLabel = "COUNT")
    private int previewCount = 3;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose;

    public List<Path> inputFiles() {
        return inputFiles;
    }

    public Mode mode() {
        return mode;
    }

    public Double threshold() {
        return threshold;
    }

    public Path manualMatchesFile() {
        return manualMatchesFile;
    }

    public Path outputFile() {
        return outputFile;
    }

    public String outputPrefix() {
        return outputPrefix;
    }

    public boolean noJson() {
        return noJson;
    }

    public boolean force() {
        return force;
    }

    public int previewCount() {
        return previewCount;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
