package ai.i18next.parser.catalog;

import ai.i18next.parser.config.LineEnding;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes catalogs back to disk with sorted keys, two-space indentation and the configured line ending.
 */
public class CatalogWriter {

    private final LineEnding lineEnding;
    private final boolean sort;

    public CatalogWriter(LineEnding lineEnding, boolean sort) {
        this.lineEnding = Objects.requireNonNull(lineEnding, "lineEnding");
        this.sort = sort;
    }

    public void write(Path path, CatalogTree catalog) {
        if (path == null || catalog == null) {
            throw new IllegalArgumentException("path and catalog must be provided");
        }
        String content = render(CatalogFormat.of(path), catalog);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write catalog: " + path, ex);
        }
    }

    /**
     * Returns the exact file content {@link #write(Path, CatalogTree)} would produce for the given format.
     */
    public String render(CatalogFormat format, CatalogTree catalog) {
        CatalogTree ordered = sort ? catalog.sorted() : catalog;
        String text;
        try {
            text = switch (format) {
                case JSON -> format.mapper().writer(prettyPrinter()).writeValueAsString(CatalogCodec.toJson(ordered)) + "\n";
                case YAML -> format.mapper().writeValueAsString(CatalogCodec.toJson(ordered));
            };
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize catalog", ex);
        }
        return lineEnding.apply(text);
    }

    private static DefaultPrettyPrinter prettyPrinter() {
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        return printer;
    }
}
