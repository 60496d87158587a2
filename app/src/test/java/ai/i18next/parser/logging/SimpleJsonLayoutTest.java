package ai.i18next.parser.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        String json = layout().doLayout(event("hello world", Map.of()));

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"hello world\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"WARN\"");
        assertThat(json).doesNotContain("\"mdc\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void promotesCatalogContextAndGroupsOtherMdcEntries() {
        String json = layout().doLayout(event("merged", Map.of("locale", "fr", "namespace", "common", "run", "7")));

        assertThat(json).contains("\"locale\":\"fr\",\"namespace\":\"common\"");
        assertThat(json).contains("\"mdc\":{\"run\":\"7\"}");
    }

    @Test
    void escapesMessageContent() {
        String json = layout().doLayout(event("Found \"key\"\n", Map.of()));

        assertThat(json).contains("\"message\":\"Found \\\"key\\\"\\n\"");
    }

    private static SimpleJsonLayout layout() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(String message, Map<String, String> mdc) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.WARN);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setMDCPropertyMap(mdc);
        return event;
    }
}
