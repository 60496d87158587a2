package ai.i18next.parser.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class CatalogReaderTest {

    private final CatalogReader reader = new CatalogReader();

    @TempDir
    Path tempDir;

    @Test
    void readsJsonCatalog() throws IOException {
        Path file = tempDir.resolve("en/default.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"key1\": \"value1\", \"nested\": {\"key2\": \"value2\"}}", StandardCharsets.UTF_8);

        CatalogTree catalog = reader.read(file).orElseThrow();

        assertThat(catalog.children()).containsEntry("key1", CatalogValue.of("value1"));
        assertThat(catalog.subtree("nested").orElseThrow().children()).containsEntry("key2", CatalogValue.of("value2"));
    }

    @Test
    void readsYamlCatalog() throws IOException {
        Path file = tempDir.resolve("default.yml");
        Files.writeString(file, "key3: value3\nkey4: value4\n", StandardCharsets.UTF_8);

        CatalogTree catalog = reader.read(file).orElseThrow();

        assertThat(catalog.keys()).containsExactly("key3", "key4");
    }

    @Test
    void missingFileIsAbsent() {
        assertThat(reader.read(tempDir.resolve("en/missing.json"))).isEmpty();
        assertThat(reader.readBackup(tempDir.resolve("en/missing_old.json"))).isEmpty();
    }

    @Test
    void missingCatalogIsReportedWhateverItsName() {
        Logger logger = (Logger) LoggerFactory.getLogger(CatalogReader.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            reader.read(tempDir.resolve("en/gold_oldies.json"));
            reader.readBackup(tempDir.resolve("en/common_old.json"));
        } finally {
            logger.detachAppender(appender);
        }

        List<String> warnings = appender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0)).contains("gold_oldies.json");
    }

    @Test
    void malformedOrNonObjectFilesAreAbsent() throws IOException {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ not json", StandardCharsets.UTF_8);
        Path array = tempDir.resolve("array.json");
        Files.writeString(array, "[\"a\"]", StandardCharsets.UTF_8);

        assertThat(reader.read(broken)).isEmpty();
        assertThat(reader.read(array)).isEmpty();
    }
}
