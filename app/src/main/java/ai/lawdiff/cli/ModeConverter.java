package ai.lawdiff.cli;

import ai.lawdiff.config.Mode;
import picocli.CommandLine;

/**
 * Parses the {@code --mode} option case-insensitively.
 */
public class ModeConverter implements CommandLine.ITypeConverter<Mode> {

    @Override
    public Mode convert(String value) {
        try {
            return Mode.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
