package ai.i18next.parser.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.i18next.parser.config.Config;
import ai.i18next.parser.config.ConfigLoader;
import ai.i18next.parser.config.LineEnding;
import ai.i18next.parser.entry.Entry;
import ai.i18next.parser.entry.JsonEntrySource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void runWritesCatalogsAndReturnsZero() throws IOException {
        Config config = config(false);
        CliApplication application = new CliApplication(new FixedConfigLoader(config),
                ignored -> () -> List.of(Entry.of("common", "greeting", "Hello")), false);

        int exitCode = application.run(new String[] {tempDir.toString()});

        assertThat(exitCode).isZero();
        assertThat(Files.readString(tempDir.resolve("locales/en/common.json"), StandardCharsets.UTF_8))
                .isEqualTo("{\n  \"greeting\": \"Hello\"\n}\n");
        assertThat(tempDir.resolve("locales/de/common.json")).exists();
        assertThat(tempDir.resolve("src/@types/i18next.d.ts")).doesNotExist();
    }

    @Test
    void generateTypesWritesDeclarationFile() {
        CliApplication application = new CliApplication(new FixedConfigLoader(config(false)),
                ignored -> () -> List.of(Entry.of("common", "greeting", "Hello")), false);

        int exitCode = application.run(new String[] {"-g", tempDir.toString()});

        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("src/@types/i18next.d.ts")).exists();
    }

    @Test
    void missingEntriesFileFailsWithExitCodeOne() {
        CliApplication application = new CliApplication(new FixedConfigLoader(config(false)),
                config -> new JsonEntrySource(config.entriesPath()), false);

        int exitCode = application.run(new String[] {tempDir.toString()});

        assertThat(exitCode).isEqualTo(1);
        assertThat(tempDir.resolve("locales")).doesNotExist();
    }

    @Test
    void pendingUpdateFailsWhenFailOnUpdateIsSet() {
        CliApplication application = new CliApplication(new FixedConfigLoader(config(true)),
                ignored -> () -> List.of(Entry.of("common", "greeting", "Hello")), false);

        int exitCode = application.run(new String[] {tempDir.toString()});

        assertThat(exitCode).isEqualTo(1);
        assertThat(tempDir.resolve("locales/en/common.json")).doesNotExist();
    }

    @Test
    void invalidOptionReturnsUsageExitCode() {
        CliApplication application = new CliApplication(new FixedConfigLoader(config(false)),
                ignored -> List::of, false);

        int exitCode = application.run(new String[] {"--line-ending", "bogus"});

        assertThat(exitCode).isEqualTo(2);
    }

    private Config config(boolean failOnUpdate) {
        return Config.builder()
                .workingDir(tempDir)
                .locales(List.of("en", "de"))
                .lineEnding(LineEnding.LF)
                .failOnUpdate(failOnUpdate)
                .build();
    }

    private static final class FixedConfigLoader extends ConfigLoader {

        private final Config config;

        FixedConfigLoader(Config config) {
            super(key -> Optional.empty());
            this.config = config;
        }

        @Override
        public Config load(CliArguments arguments) {
            return config;
        }
    }
}
