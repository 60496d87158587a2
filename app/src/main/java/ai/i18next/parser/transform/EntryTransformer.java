package ai.i18next.parser.transform;

import ai.i18next.parser.catalog.CatalogBuilder;
import ai.i18next.parser.config.Config;
import ai.i18next.parser.entry.Entry;
import ai.i18next.parser.report.CharDiff;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds the extracted entries of one locale into a single source catalog.
 */
public class EntryTransformer {

    private static final Logger LOGGER = LoggerFactory.getLogger(EntryTransformer.class);

    private final Config config;
    private final KeyMaterializer materializer;
    private final PluralExpander expander;

    public EntryTransformer(Config config, KeyMaterializer materializer, PluralExpander expander) {
        this.config = Objects.requireNonNull(config, "config");
        this.materializer = Objects.requireNonNull(materializer, "materializer");
        this.expander = Objects.requireNonNull(expander, "expander");
    }

    /**
     * @throws KeyConflictException on a key conflict when {@code failOnWarnings} is set
     */
    public TransformResult transform(List<Entry> entries, String locale) {
        Map<String, Integer> uniqueCounts = new LinkedHashMap<>();
        Map<String, Integer> uniquePluralsCounts = new LinkedHashMap<>();
        CatalogBuilder catalog = CatalogBuilder.empty();

        for (Entry entry : entries) {
            String namespace = entry.namespace().orElse(config.defaultNamespace());
            uniqueCounts.putIfAbsent(namespace, 0);
            uniquePluralsCounts.putIfAbsent(namespace, 0);
            for (Optional<String> suffix : expander.expand(entry, locale)) {
                Optional<Conflict> conflict = materializer.materializeInto(entry, catalog, suffix);
                if (conflict.isEmpty()) {
                    uniqueCounts.merge(namespace, 1, Integer::sum);
                    if (suffix.isPresent()) {
                        uniquePluralsCounts.merge(namespace, 1, Integer::sum);
                    }
                    continue;
                }
                if (conflict.get() instanceof Conflict.KeyConflict keyConflict) {
                    LOGGER.warn("Found translation key already mapped to a map or parent of new key already mapped to a string: {}",
                            keyConflict.segment());
                    if (config.failOnWarnings()) {
                        throw new KeyConflictException(keyConflict.segment());
                    }
                } else if (conflict.get() instanceof Conflict.ValueConflict valueConflict) {
                    LOGGER.warn("Found same keys with different values: {}{}{}: {}", namespace,
                            config.namespaceSeparator(), entry.key(),
                            CharDiff.diff(valueConflict.oldValue(), valueConflict.newValue()));
                }
            }
        }
        return new TransformResult(locale, catalog.build(), uniqueCounts, uniquePluralsCounts);
    }
}
