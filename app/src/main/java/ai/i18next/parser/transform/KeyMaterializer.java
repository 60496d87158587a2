package ai.i18next.parser.transform;

import ai.i18next.parser.catalog.CatalogBuilder;
import ai.i18next.parser.catalog.CatalogTree;
import ai.i18next.parser.catalog.CatalogValue;
import ai.i18next.parser.config.Config;
import ai.i18next.parser.entry.Entry;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an entry into a catalog tree at the path {@code namespace + keySeparator + key [+ suffix]}.
 *
 * <p>{@link #materialize} never modifies its input tree and returns a new one. Only the trees along the written
 * path are copied.</p>
 */
public class KeyMaterializer {

    private static final Logger LOGGER = LoggerFactory.getLogger(KeyMaterializer.class);

    private final String keySeparator;
    private final String defaultNamespace;

    public KeyMaterializer(Config config) {
        this(config.keySeparator(), config.defaultNamespace());
    }

    KeyMaterializer(String keySeparator, String defaultNamespace) {
        this.keySeparator = Objects.requireNonNull(keySeparator, "keySeparator");
        this.defaultNamespace = Objects.requireNonNull(defaultNamespace, "defaultNamespace");
    }

    public Materialization materialize(Entry entry, CatalogTree target, Optional<String> suffix) {
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(target, "target");
        if (entry.key().isEmpty()) {
            return Materialization.unchanged(target);
        }
        CatalogBuilder builder = CatalogBuilder.from(target);
        Written written = write(entry, builder, suffix);
        return new Materialization(builder.build(), written.priorValue(), written.conflict());
    }

    /**
     * Writes {@code entry} into {@code target} in place. Used when folding many entries into one catalog.
     *
     * @return the conflict found while writing, if any
     */
    Optional<Conflict> materializeInto(Entry entry, CatalogBuilder target, Optional<String> suffix) {
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(target, "target");
        if (entry.key().isEmpty()) {
            return Optional.empty();
        }
        return write(entry, target, suffix).conflict();
    }

    private Written write(Entry entry, CatalogBuilder root, Optional<String> suffix) {
        String path = path(entry, suffix);
        List<String> segments = Arrays.asList(path.split(Pattern.quote(keySeparator), -1));
        String leaf = segments.get(segments.size() - 1);

        Optional<Conflict> conflict = Optional.empty();
        CatalogBuilder current = root;
        for (String segment : segments.subList(0, segments.size() - 1)) {
            if (segment.isEmpty()) {
                continue;
            }
            Optional<CatalogBuilder> child = current.subtree(segment);
            if (child.isPresent()) {
                current = child.get();
            } else {
                if (current.containsKey(segment) && conflict.isEmpty()) {
                    conflict = Optional.of(new Conflict.KeyConflict(segment));
                }
                current = current.putTree(segment);
            }
        }

        Optional<String> priorValue = current.leaf(leaf)
                .filter(CatalogValue.class::isInstance)
                .map(node -> ((CatalogValue) node).value());
        if (current.holdsTree(leaf) && conflict.isEmpty()) {
            conflict = Optional.of(new Conflict.KeyConflict(leaf));
        }

        String newValue = "";
        if (entry.value().isPresent()) {
            String candidate = entry.value().get();
            newValue = candidate;
            if (priorValue.isPresent() && !priorValue.get().equals(candidate) && !priorValue.get().isEmpty()) {
                if (candidate.isEmpty()) {
                    newValue = priorValue.get();
                } else {
                    conflict = Optional.of(new Conflict.ValueConflict(priorValue.get(), candidate));
                }
            }
        }
        newValue = newValue.trim();
        LOGGER.trace("Setting {} -> {}", path, newValue);

        current.put(leaf, CatalogValue.of(newValue));
        return new Written(priorValue, conflict);
    }

    String path(Entry entry, Optional<String> suffix) {
        String namespace = entry.namespace().orElse(defaultNamespace);
        String path = unescape(namespace + keySeparator + entry.key());
        if (suffix != null && suffix.isPresent()) {
            path += suffix.get();
        }
        if (path.endsWith(keySeparator)) {
            path = path.substring(0, path.length() - keySeparator.length());
        }
        return path;
    }

    /**
     * Collapses escaped control sequences written in source code: a backslash-escaped {@code \n}, {@code \r}
     * or {@code \t} loses its extra backslash and a doubled escaped backslash becomes a single one.
     */
    static String unescape(String value) {
        return value.replace("\\\\n", "\\n")
                .replace("\\\\r", "\\r")
                .replace("\\\\t", "\\t")
                .replace("\\\\\\\\", "\\");
    }

    private record Written(Optional<String> priorValue, Optional<Conflict> conflict) {
    }
}
