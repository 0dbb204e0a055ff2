package ai.lawdiff.cli;

import ai.lawdiff.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses the {@code --log-format} option.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
