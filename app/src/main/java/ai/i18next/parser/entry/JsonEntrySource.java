package ai.i18next.parser.entry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads entries from a JSON array such as
 * {@code [{"key": "title", "namespace": "common", "value": "Hello", "hasCount": false, "options": {}}]}.
 *
 * <p>{@code defaultValue} is accepted as an alias of {@code value}, and a {@code count} option implies
 * {@code hasCount}.</p>
 */
public class JsonEntrySource implements EntrySource {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonEntrySource.class);

    private final Path path;
    private final ObjectMapper mapper;

    public JsonEntrySource(Path path) {
        this(path, new ObjectMapper());
    }

    JsonEntrySource(Path path, ObjectMapper mapper) {
        this.path = Objects.requireNonNull(path, "path");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public List<Entry> read() {
        if (!Files.isRegularFile(path)) {
            throw new EntrySourceException("Entries file not found: " + path);
        }
        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (IOException ex) {
            throw new EntrySourceException("Failed to read entries from " + path, ex);
        }
        if (root == null || !root.isArray()) {
            throw new EntrySourceException("Entries file must contain a JSON array: " + path);
        }
        List<Entry> entries = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode node : root) {
            entries.add(toEntry(node, index++));
        }
        LOGGER.debug("Read {} entries from {}", entries.size(), path);
        return entries;
    }

    private Entry toEntry(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new EntrySourceException("Entry #" + index + " in " + path + " is not an object");
        }
        JsonNode key = node.get("key");
        if (key == null || !key.isTextual()) {
            throw new EntrySourceException("Entry #" + index + " in " + path + " has no key");
        }
        Optional<String> namespace = text(node, "namespace");
        Optional<String> value = text(node, "value").or(() -> text(node, "defaultValue"));
        Map<String, String> options = options(node.get("options"));
        boolean hasCount = node.path("hasCount").asBoolean(false) || options.containsKey("count");
        return new Entry(key.asText(), namespace, value, hasCount, options);
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    private static Map<String, String> options(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, String> options = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNull()) {
                options.put(field.getKey(), field.getValue().isValueNode() ? field.getValue().asText() : field.getValue().toString());
            }
        }
        return options;
    }
}
