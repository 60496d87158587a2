package ai.i18next.parser.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.i18next.parser.cli.CliArguments;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void usesDefaultsWithoutConfigFile() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), tempDir.toString());

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.workingDir()).isEqualTo(tempDir);
        assertThat(config.locales()).containsExactly("en");
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.entriesPath()).isEqualTo(tempDir.resolve("i18next-entries.json"));
    }

    @Test
    void readsJsonConfigFile() throws IOException {
        Files.writeString(tempDir.resolve(".i18next-parser.json"), "{"
                + "\"locales\": [\"en\", \"fr\"],"
                + "\"output\": \"public/$LOCALE/$NAMESPACE.json\","
                + "\"keepRemoved\": true,"
                + "\"key_separator\": \"#\","
                + "\"lineEnding\": \"crlf\","
                + "\"resetDefaultValueLocale\": \"fr\""
                + "}", StandardCharsets.UTF_8);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), tempDir.toString());

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.locales()).containsExactly("en", "fr");
        assertThat(config.output()).isEqualTo("public/$LOCALE/$NAMESPACE.json");
        assertThat(config.keepRemoved()).isTrue();
        assertThat(config.keySeparator()).isEqualTo("#");
        assertThat(config.lineEnding()).isEqualTo(LineEnding.CRLF);
        assertThat(config.resetDefaultValueLocale()).contains("fr");
    }

    @Test
    void readsYamlConfigFile() throws IOException {
        Files.writeString(tempDir.resolve("i18next-parser.yml"),
                "locales: de,it\ncreate_old_catalogs: true\nsort: false\n", StandardCharsets.UTF_8);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), tempDir.toString());

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.locales()).containsExactly("de", "it");
        assertThat(config.createOldCatalogs()).isTrue();
        assertThat(config.sort()).isFalse();
    }

    @Test
    void environmentOverridesFileAndCliOverridesEnvironment() throws IOException {
        Files.writeString(tempDir.resolve(".i18next-parser.json"),
                "{\"locales\": [\"en\"], \"output\": \"file/$LOCALE.json\"}", StandardCharsets.UTF_8);
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_LOCALES, "en, de",
                ConfigLoader.ENV_OUTPUT, "env/$LOCALE/$NAMESPACE.json",
                ConfigLoader.ENV_LOG_FORMAT, "json"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--output", "cli/$LOCALE/$NAMESPACE.json",
                "--keep-removed",
                "--fail-on-update",
                "-v",
                tempDir.toString());

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.locales()).containsExactly("en", "de");
        assertThat(config.output()).isEqualTo("cli/$LOCALE/$NAMESPACE.json");
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.keepRemoved()).isTrue();
        assertThat(config.failOnUpdate()).isTrue();
        assertThat(config.verbose()).isTrue();
        assertThat(environmentReader.requestedKeys())
                .contains(ConfigLoader.ENV_LOCALES, ConfigLoader.ENV_OUTPUT, ConfigLoader.ENV_LOG_FORMAT);
    }

    @Test
    void cliLocalesAndLineEndingAreParsed() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--locales", "en,fr,,ja",
                "--line-ending", "lf",
                "--log-format", "json",
                tempDir.toString());

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.locales()).containsExactly("en", "fr", "ja");
        assertThat(config.lineEnding()).isEqualTo(LineEnding.LF);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void invalidConfigFileIsRejected() throws IOException {
        Files.writeString(tempDir.resolve(".i18next-parser.json"), "{ broken", StandardCharsets.UTF_8);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), tempDir.toString());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(".i18next-parser.json");
    }

    @Test
    void emptyLocaleListInConfigFileIsRejected() throws IOException {
        Files.writeString(tempDir.resolve(".i18next-parser.json"), "{\"locales\": []}", StandardCharsets.UTF_8);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), tempDir.toString());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void convertsCamelCaseToSnakeCase() {
        assertThat(ConfigFileReader.toSnakeCase("resetDefaultValueLocale")).isEqualTo("reset_default_value_locale");
        assertThat(ConfigFileReader.toSnakeCase("sort")).isEqualTo("sort");
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
