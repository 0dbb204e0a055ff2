package ai.lawdiff.logging;

import ai.lawdiff.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts the logback setup from {@code logback.xml} at runtime: console encoder format and root level.
 */
public final class LoggingConfigurator {

    static final String CONSOLE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg%n";

    private LoggingConfigurator() {
    }

    public static void configure(LogFormat format, boolean verbose) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            // another SLF4J binding owns the configuration
            return;
        }
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(verbose ? Level.DEBUG : Level.INFO);

        List<OutputStreamAppender<ILoggingEvent>> streamAppenders = new ArrayList<>();
        root.iteratorForAppenders().forEachRemaining(appender -> collectStreamAppender(appender, streamAppenders));
        for (OutputStreamAppender<ILoggingEvent> appender : streamAppenders) {
            Encoder<ILoggingEvent> encoder = encoderFor(format, context);
            boolean wasStarted = appender.isStarted();
            appender.stop();
            appender.setEncoder(encoder);
            if (wasStarted) {
                appender.start();
            }
        }
    }

    private static void collectStreamAppender(Appender<ILoggingEvent> appender,
                                              List<OutputStreamAppender<ILoggingEvent>> target) {
        if (appender instanceof OutputStreamAppender<ILoggingEvent> streamAppender) {
            target.add(streamAppender);
        }
    }

    static Encoder<ILoggingEvent> encoderFor(LogFormat format, LoggerContext context) {
        Encoder<ILoggingEvent> encoder = switch (format) {
            case JSON -> {
                JsonLogLayout layout = new JsonLogLayout();
                layout.setContext(context);
                layout.start();
                LayoutWrappingEncoder<ILoggingEvent> wrapping = new LayoutWrappingEncoder<>();
                wrapping.setLayout(layout);
                yield wrapping;
            }
            case TEXT -> {
                PatternLayoutEncoder pattern = new PatternLayoutEncoder();
                pattern.setPattern(CONSOLE_PATTERN);
                yield pattern;
            }
        };
        encoder.setContext(context);
        encoder.start();
        return encoder;
    }
}
