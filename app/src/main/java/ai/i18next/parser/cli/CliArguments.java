package ai.i18next.parser.cli;

import ai.i18next.parser.config.LineEnding;
import ai.i18next.parser.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "i18next-parser", mixinStandardHelpOptions = true,
        description = "Reconciles extracted i18next keys with the translation catalogs on disk")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", defaultValue = ".", description = "Working directory", paramLabel = "DIR")
    private Path workingDir = Path.of(".");

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Print per-namespace counts and debug logging")
    private boolean verbose;

    @CommandLine.Option(names = {"-g", "--generate-types"}, description = "Generate the i18next CustomTypeOptions declaration file")
    private boolean generateTypes;

    @CommandLine.Option(names = "--entries", description = "JSON file holding the extracted entries", paramLabel = "FILE")
    private String entries;

    @CommandLine.Option(names = "--locales", description = "Comma separated locales; the first one is the default locale", paramLabel = "LOCALES")
    private String locales;

    @CommandLine.Option(names = "--output", description = "Catalog path template using $LOCALE and $NAMESPACE", paramLabel = "TEMPLATE")
    private String output;

    @CommandLine.Option(names = "--keep-removed", description = "Keep keys that are no longer referenced")
    private boolean keepRemoved;

    @CommandLine.Option(names = "--create-old-catalogs", description = "Write removed keys to <name>_old catalogs")
    private boolean createOldCatalogs;

    @CommandLine.Option(names = "--fail-on-warnings", description = "Exit with an error when a key conflict is found")
    private boolean failOnWarnings;

    @CommandLine.Option(names = "--fail-on-update", description = "Exit with an error instead of updating catalogs")
    private boolean failOnUpdate;

    @CommandLine.Option(names = "--line-ending", description = "Line ending: auto, lf, crlf or cr", converter = LineEndingConverter.class)
    private LineEnding lineEnding;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path workingDir() {
        return workingDir;
    }

    public boolean verbose() {
        return verbose;
    }

    public boolean generateTypes() {
        return generateTypes;
    }

    public String entries() {
        return entries;
    }

    public String locales() {
        return locales;
    }

    public String output() {
        return output;
    }

    public boolean keepRemoved() {
        return keepRemoved;
    }

    public boolean createOldCatalogs() {
        return createOldCatalogs;
    }

    public boolean failOnWarnings() {
        return failOnWarnings;
    }

    public boolean failOnUpdate() {
        return failOnUpdate;
    }

    public LineEnding lineEnding() {
        return lineEnding;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
