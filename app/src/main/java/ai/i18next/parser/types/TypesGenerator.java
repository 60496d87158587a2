package ai.i18next.parser.types;

import ai.i18next.parser.config.Config;
import ai.i18next.parser.reconcile.NamespaceReconciliation;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates a TypeScript declaration file that types i18next resources from the written catalogs.
 */
public class TypesGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(TypesGenerator.class);

    private final Config config;

    public TypesGenerator(Config config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Writes the declaration file to {@link Config#generatedTypesPath()} and returns its path.
     */
    public Path generate(List<NamespaceReconciliation> results) {
        Path target = config.generatedTypesPath();
        String content = render(results, target.toAbsolutePath().getParent());
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write type declarations: " + target, ex);
        }
        LOGGER.info("Generated {}", target);
        return target;
    }

    String render(List<NamespaceReconciliation> results, Path declarationDir) {
        List<String> imports = new ArrayList<>();
        Map<String, List<String>> resourcesByLocale = new LinkedHashMap<>();
        TreeSet<String> namespaces = new TreeSet<>();
        for (NamespaceReconciliation result : results) {
            String typeName = camelize(result.namespace()) + "_" + result.locale().replaceAll("[^A-Za-z0-9]", "_");
            imports.add("import type " + typeName + " from '" + importPath(declarationDir, result.path()) + "';");
            resourcesByLocale.computeIfAbsent(result.locale(), locale -> new ArrayList<>())
                    .add(propertyName(result.namespace()) + ": typeof " + typeName + ";");
            namespaces.add("'" + result.namespace() + "'");
        }

        StringBuilder resources = new StringBuilder();
        resourcesByLocale.forEach((locale, entries) -> resources
                .append(propertyName(locale)).append(": {\n        ")
                .append(String.join("\n        ", entries))
                .append("\n      },\n      "));

        return "/* eslint-disable */\n"
                + "\n"
                + "import 'i18next';\n"
                + "\n"
                + String.join("\n", imports) + "\n"
                + "\n"
                + "declare module 'i18next' {\n"
                + "  interface CustomTypeOptions {\n"
                + "    defaultNS: '" + config.defaultNamespace() + "';\n"
                + "    returnNull: false;\n"
                + "    returnObjects: false;\n"
                + "    nsSeparator: '" + config.namespaceSeparator() + "';\n"
                + "    keySeparator: '" + config.keySeparator() + "';\n"
                + "    contextSeparator: '" + config.contextSeparator() + "';\n"
                + "    jsonFormat: 'v4';\n"
                + "    allowObjectInHTMLChildren: false;\n"
                + "    resources: {\n"
                + "      " + resources.toString().stripTrailing() + "\n"
                + "    };\n"
                + "  }\n"
                + "}\n"
                + "\n"
                + "declare global {\n"
                + "  type Ns = " + namespaces.stream().collect(Collectors.joining(" | ")) + ";\n"
                + "}\n"
                + "\n"
                + "export default {};\n";
    }

    private static String importPath(Path declarationDir, Path catalogPath) {
        String relative = declarationDir.relativize(catalogPath.toAbsolutePath().normalize())
                .toString()
                .replace('\\', '/');
        return relative.startsWith("../") ? relative : "./" + relative;
    }

    private static String propertyName(String name) {
        return name.chars().allMatch(Character::isLetterOrDigit) ? name : "'" + name + "'";
    }

    /**
     * Lower camel case of {@code value}, treating every non alphanumeric character as a word break.
     */
    static String camelize(String value) {
        StringBuilder builder = new StringBuilder(value.length());
        boolean atSeparator = false;
        for (char c : value.toCharArray()) {
            if (!Character.isLetterOrDigit(c)) {
                atSeparator = true;
            } else if (builder.length() == 0) {
                builder.append(Character.toLowerCase(c));
                atSeparator = false;
            } else if (atSeparator) {
                builder.append(Character.toUpperCase(c));
                atSeparator = false;
            } else {
                builder.append(Character.toLowerCase(c));
            }
        }
        return builder.toString();
    }
}
