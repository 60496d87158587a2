package ai.i18next.parser.cli;

import ai.i18next.parser.config.LineEnding;
import picocli.CommandLine;

public class LineEndingConverter implements CommandLine.ITypeConverter<LineEnding> {
    @Override
    public LineEnding convert(String value) {
        return LineEnding.from(value);
    }
}
