package ai.lawdiff.cli;

import ai.lawdiff.align.AlignmentResult;
import ai.lawdiff.align.ArticleAligner;
import ai.lawdiff.align.ManualMatch;
import ai.lawdiff.align.ManualMatchLoader;
import ai.lawdiff.config.Config;
import ai.lawdiff.config.ConfigLoader;
import ai.lawdiff.config.EnvironmentReader;
import ai.lawdiff.config.Mode;
import ai.lawdiff.diff.ComparisonAnalyzer;
import ai.lawdiff.diff.ComparisonReport;
import ai.lawdiff.diff.ComparisonStatistics;
import ai.lawdiff.logging.LoggingConfigurator;
import ai.lawdiff.parse.Article;
import ai.lawdiff.parse.DocumentParser;
import ai.lawdiff.parse.LawDocument;
import ai.lawdiff.parse.StatuteSourceReader;
import ai.lawdiff.writer.ReportWriter;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the parse / compare pipelines.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final int PREVIEW_LENGTH = 100;

    private final ConfigLoader configLoader;
    private final StatuteSourceReader sourceReader;
    private final DocumentParser parser;
    private final ReportWriter reportWriter;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new StatuteSourceReader(), new DocumentParser(),
                new ReportWriter());
    }

    CliApplication(ConfigLoader configLoader, StatuteSourceReader sourceReader, DocumentParser parser,
                   ReportWriter reportWriter) {
        this.configLoader = configLoader;
        this.sourceReader = sourceReader;
        this.parser = parser;
        this.reportWriter = reportWriter;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        try {
            Config config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat(), config.verbose());
            LOGGER.info("Running in {} mode with inputs {}", config.mode(), config.inputFiles());
            if (config.mode() == Mode.PARSE) {
                runParse(config);
            } else {
                runCompare(config);
            }
            return 0;
        } catch (RuntimeException ex) {
            LOGGER.error("law-diff failed: {}", ex.getMessage(), ex);
            return 1;
        }
    }

    private void runParse(Config config) {
        Path input = config.inputFiles().get(0);
        LawDocument document = parseFile(input);
        logPreview(document, config.previewCount());
        if (config.writeJson()) {
            reportWriter.writeDocument(config.resolveOutputPath(), document, config.force());
        }
    }

    private void runCompare(Config config) {
        List<ManualMatch> manualMatches = config.manualMatchesFile()
                .map(path -> new ManualMatchLoader().load(path))
                .orElse(List.of());
        LawDocument oldDocument = parseFile(config.inputFiles().get(0));
        LawDocument newDocument = parseFile(config.inputFiles().get(1));

        AlignmentResult alignment = new ArticleAligner().align(oldDocument, newDocument, manualMatches,
                config.threshold());
        ComparisonReport report = new ComparisonAnalyzer().analyze(oldDocument, newDocument, alignment);

        ComparisonStatistics statistics = report.statistics();
        LOGGER.info("Articles: {} -> {}; identical {}, modified {}, new {}, deleted {}",
                statistics.totalArticlesV1(), statistics.totalArticlesV2(), statistics.identicalCount(),
                statistics.modifiedCount(), statistics.newCount(), statistics.deletedCount());
        if (!report.warnings().isEmpty()) {
            LOGGER.warn("Alignment produced {} warning(s): {}", report.warnings().size(),
                    String.join("; ", report.warnings()));
        }
        if (config.writeJson()) {
            reportWriter.writeComparison(config.resolveOutputPath(), report, oldDocument, newDocument,
                    config.threshold(), config.force());
        }
    }

    private LawDocument parseFile(Path path) {
        return parser.parse(path.toString(), sourceReader.read(path));
    }

    private static void logPreview(LawDocument document, int count) {
        document.articles().values().stream()
                .limit(count)
                .forEach(article -> LOGGER.info("第{}条 {}", article.number(), abbreviate(article)));
    }

    private static String abbreviate(Article article) {
        String content = article.content().replace('\n', ' ');
        return content.length() <= PREVIEW_LENGTH ? content : content.substring(0, PREVIEW_LENGTH) + "...";
    }
}
