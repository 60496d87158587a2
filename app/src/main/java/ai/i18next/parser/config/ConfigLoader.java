package ai.i18next.parser.config;

import ai.i18next.parser.cli.CliArguments;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by layering defaults, the config file, environment variables and CLI arguments.
 */
public class ConfigLoader {

    static final String ENV_LOCALES = "I18NEXT_LOCALES";
    static final String ENV_OUTPUT = "I18NEXT_OUTPUT";
    static final String ENV_LOG_FORMAT = "I18NEXT_LOG_FORMAT";
    static final String ENV_ENTRIES = "I18NEXT_ENTRIES";

    private final EnvironmentReader environmentReader;
    private final ConfigFileReader configFileReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this(environmentReader, new ConfigFileReader());
    }

    public ConfigLoader(EnvironmentReader environmentReader, ConfigFileReader configFileReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
        this.configFileReader = Objects.requireNonNull(configFileReader, "configFileReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path workingDir = arguments.workingDir() == null ? Path.of(".") : arguments.workingDir();

        Config.Builder builder = Config.builder().workingDir(workingDir);
        configFileReader.apply(workingDir, builder);

        environmentReader.get(ENV_LOCALES)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseLocales)
                .ifPresent(builder::locales);
        environmentReader.get(ENV_OUTPUT)
                .filter(ConfigLoader::isNotBlank)
                .ifPresent(builder::output);
        environmentReader.get(ENV_ENTRIES)
                .filter(ConfigLoader::isNotBlank)
                .ifPresent(builder::entries);
        environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .ifPresent(builder::logFormat);

        applyArguments(arguments, builder);
        return builder.build();
    }

    private void applyArguments(CliArguments arguments, Config.Builder builder) {
        if (isNotBlank(arguments.locales())) {
            builder.locales(parseLocales(arguments.locales()));
        }
        if (isNotBlank(arguments.output())) {
            builder.output(arguments.output());
        }
        if (isNotBlank(arguments.entries())) {
            builder.entries(arguments.entries());
        }
        if (arguments.lineEnding() != null) {
            builder.lineEnding(arguments.lineEnding());
        }
        if (arguments.logFormat() != null) {
            builder.logFormat(arguments.logFormat());
        }
        // Flags only switch features on; the file can enable them too.
        if (arguments.verbose()) {
            builder.verbose(true);
        }
        if (arguments.keepRemoved()) {
            builder.keepRemoved(true);
        }
        if (arguments.createOldCatalogs()) {
            builder.createOldCatalogs(true);
        }
        if (arguments.failOnWarnings()) {
            builder.failOnWarnings(true);
        }
        if (arguments.failOnUpdate()) {
            builder.failOnUpdate(true);
        }
    }

    static List<String> parseLocales(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toList());
    }

    static boolean parseBoolean(String raw) {
        String value = raw.trim();
        if (value.equalsIgnoreCase("true") || value.equals("1")) {
            return true;
        }
        if (value.equalsIgnoreCase("false") || value.equals("0")) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean value: " + raw);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
