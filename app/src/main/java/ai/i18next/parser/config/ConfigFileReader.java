package ai.i18next.parser.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the parser configuration file in the working directory and applies its values to a {@link Config.Builder}.
 */
public class ConfigFileReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigFileReader.class);

    static final List<String> CANDIDATE_FILE_NAMES = List.of(
            ".i18next-parser.json",
            ".i18next-parser.yaml",
            ".i18next-parser.yml",
            "i18next-parser.json",
            "i18next-parser.yaml",
            "i18next-parser.yml");

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public ConfigFileReader() {
        this(new ObjectMapper(), new YAMLMapper());
    }

    ConfigFileReader(ObjectMapper jsonMapper, ObjectMapper yamlMapper) {
        this.jsonMapper = jsonMapper;
        this.yamlMapper = yamlMapper;
    }

    public Optional<Path> locate(Path workingDir) {
        return CANDIDATE_FILE_NAMES.stream()
                .map(workingDir::resolve)
                .filter(Files::isRegularFile)
                .findFirst();
    }

    /**
     * Applies the first configuration file found under {@code workingDir}. Returns the file that was applied.
     *
     * @throws IllegalArgumentException when the file cannot be parsed or holds an invalid value
     */
    public Optional<Path> apply(Path workingDir, Config.Builder builder) {
        Optional<Path> file = locate(workingDir);
        if (file.isEmpty()) {
            LOGGER.warn("No configuration file found in {}, using defaults", workingDir.toAbsolutePath());
            return Optional.empty();
        }
        Path path = file.get();
        JsonNode root = readTree(path);
        if (!root.isObject()) {
            throw new IllegalArgumentException("Configuration file must contain an object: " + path);
        }
        applyNode(root, builder);
        LOGGER.debug("Loaded configuration from {}", path);
        return file;
    }

    private JsonNode readTree(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? yamlMapper : jsonMapper;
        try {
            JsonNode node = mapper.readTree(path.toFile());
            return node == null ? jsonMapper.createObjectNode() : node;
        } catch (IOException ex) {
            throw new IllegalArgumentException("Failed to read configuration file " + path, ex);
        }
    }

    void applyNode(JsonNode root, Config.Builder builder) {
        text(root, "locales").ifPresent(value -> builder.locales(ConfigLoader.parseLocales(value)));
        list(root, "locales").ifPresent(builder::locales);
        text(root, "output").ifPresent(builder::output);
        text(root, "entries").ifPresent(builder::entries);
        text(root, "contextSeparator").ifPresent(builder::contextSeparator);
        flag(root, "createOldCatalogs", builder::createOldCatalogs);
        text(root, "defaultNamespace").ifPresent(builder::defaultNamespace);
        flag(root, "keepRemoved", builder::keepRemoved);
        text(root, "keySeparator").ifPresent(builder::keySeparator);
        text(root, "lineEnding").map(LineEnding::from).ifPresent(builder::lineEnding);
        text(root, "namespaceSeparator").ifPresent(builder::namespaceSeparator);
        text(root, "pluralSeparator").ifPresent(builder::pluralSeparator);
        flag(root, "sort", builder::sort);
        flag(root, "verbose", builder::verbose);
        flag(root, "failOnWarnings", builder::failOnWarnings);
        flag(root, "failOnUpdate", builder::failOnUpdate);
        text(root, "resetDefaultValueLocale").ifPresent(builder::resetDefaultValueLocale);
        text(root, "generatedTypes").ifPresent(builder::generatedTypes);
        text(root, "logFormat").map(LogFormat::from).ifPresent(builder::logFormat);
    }

    private static Optional<JsonNode> field(JsonNode root, String camelCaseName) {
        JsonNode node = root.get(camelCaseName);
        if (node == null) {
            node = root.get(toSnakeCase(camelCaseName));
        }
        return Optional.ofNullable(node).filter(value -> !value.isNull());
    }

    private static Optional<String> text(JsonNode root, String name) {
        return field(root, name)
                .filter(JsonNode::isValueNode)
                .map(JsonNode::asText);
    }

    private static Optional<List<String>> list(JsonNode root, String name) {
        return field(root, name)
                .filter(JsonNode::isArray)
                .map(array -> {
                    List<String> values = new ArrayList<>();
                    array.forEach(item -> values.add(item.asText()));
                    return values;
                });
    }

    private static void flag(JsonNode root, String name, Consumer<Boolean> setter) {
        field(root, name).ifPresent(node -> {
            if (node.isBoolean()) {
                setter.accept(node.booleanValue());
            } else {
                setter.accept(ConfigLoader.parseBoolean(node.asText()));
            }
        });
    }

    static String toSnakeCase(String camelCase) {
        StringBuilder builder = new StringBuilder(camelCase.length() + 4);
        for (char c : camelCase.toCharArray()) {
            if (Character.isUpperCase(c)) {
                builder.append('_').append(Character.toLowerCase(c));
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }
}
