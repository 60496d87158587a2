package ai.i18next.parser.merge;

import ai.i18next.parser.catalog.CatalogFlag;
import ai.i18next.parser.catalog.CatalogNode;
import ai.i18next.parser.catalog.CatalogTree;
import ai.i18next.parser.catalog.CatalogValue;
import ai.i18next.parser.config.Config;
import ai.i18next.parser.plural.PluralCategory;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursively merges a source catalog into an existing one.
 *
 * <p>Only the keys of {@code source} are visited. For each key:</p>
 * <ul>
 *   <li>both sides are trees: merge them recursively;</li>
 *   <li>exactly one side is a tree: the source value goes to {@code old};</li>
 *   <li>the key must be reset: the source value goes to {@code old} and the key is flagged in {@code reset};</li>
 *   <li>the key exists: the source value replaces the existing one, unless it would blank a non-empty string;</li>
 *   <li>the key is missing: it is pulled back when it belongs to a plural or context family that is present,
 *   kept when {@code keepRemoved} is set, and otherwise moved to {@code old}.</li>
 * </ul>
 * Keys only present in {@code existing} pass through unchanged.
 */
public class HashMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(HashMerger.class);

    /**
     * @param source       values to merge in, or {@code null} to return {@code existing} as is
     * @param existing     catalog the values are merged into
     * @param resetValues  keys that must be reset regardless of their value, or {@code null}
     * @param keyPrefix    dotted path of {@code existing}, used in log messages
     * @param resetAndFlag whether differing non-plural values are reset and flagged instead of merged
     */
    public MergeResult merge(CatalogTree source, CatalogTree existing, CatalogTree resetValues, String keyPrefix,
                             boolean resetAndFlag, Config config) {
        Objects.requireNonNull(existing, "existing");
        Objects.requireNonNull(config, "config");
        if (source == null) {
            return MergeResult.unchanged(existing);
        }
        CatalogTree resets = resetValues == null ? CatalogTree.empty() : resetValues;

        Map<String, CatalogNode> merged = existing.toMutableMap();
        Map<String, CatalogNode> old = new LinkedHashMap<>();
        Map<String, CatalogNode> reset = new LinkedHashMap<>();
        int mergeCount = 0;
        int pullCount = 0;
        int oldCount = 0;
        int resetCount = 0;

        for (Map.Entry<String, CatalogNode> field : source.children().entrySet()) {
            String key = field.getKey();
            CatalogNode value = field.getValue();
            CatalogNode target = merged.get(key);

            if (target instanceof CatalogTree targetTree && value instanceof CatalogTree sourceTree) {
                MergeResult nested = merge(sourceTree, targetTree, resets.subtree(key).orElse(null),
                        keyPrefix + key + config.keySeparator(), resetAndFlag, config);
                merged.put(key, nested.newValues());
                mergeCount += nested.mergeCount();
                pullCount += nested.pullCount();
                oldCount += nested.oldCount();
                resetCount += nested.resetCount();
                if (!nested.oldValues().isEmpty()) {
                    old.put(key, nested.oldValues());
                }
                if (!nested.resetFlags().isEmpty()) {
                    reset.put(key, nested.resetFlags());
                }
            } else if (target != null && target.isTree() != value.isTree()) {
                LOGGER.warn("Key {}{} changed between a nested object and a value, moving the old value out",
                        keyPrefix, key);
                old.put(key, value);
                oldCount++;
            } else if (target != null
                    && ((resetAndFlag && !isPlural(key, config) && !value.equals(target)) || resets.containsKey(key))) {
                LOGGER.debug("Resetting key {}{}", keyPrefix, key);
                old.put(key, value);
                reset.put(key, CatalogFlag.TRUE);
                oldCount++;
                resetCount++;
            } else if (target != null) {
                if (!(value.isBlankValue() && target instanceof CatalogValue current && !current.value().isEmpty())) {
                    merged.put(key, value);
                }
                mergeCount++;
            } else if (belongsToPresentFamily(key, merged, config)) {
                LOGGER.debug("Pulling key {}{}", keyPrefix, key);
                merged.put(key, value);
                pullCount++;
            } else {
                if (config.keepRemoved()) {
                    merged.put(key, value);
                } else {
                    old.put(key, value);
                }
                oldCount++;
            }
        }

        return new MergeResult(new CatalogTree(merged), new CatalogTree(old), new CatalogTree(reset),
                mergeCount, pullCount, oldCount, resetCount);
    }

    static boolean isPlural(String key, Config config) {
        for (PluralCategory category : PluralCategory.values()) {
            if (key.endsWith(config.pluralSeparator() + category.key())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code key} without a trailing plural suffix such as {@code _other}.
     */
    static String singularForm(String key, Config config) {
        for (PluralCategory category : PluralCategory.values()) {
            String suffix = config.pluralSeparator() + category.key();
            if (key.endsWith(suffix)) {
                return key.substring(0, key.length() - suffix.length());
            }
        }
        return key;
    }

    private static boolean belongsToPresentFamily(String key, Map<String, CatalogNode> merged, Config config) {
        String singularKey = singularForm(key, config);
        boolean pluralMatch = !key.equals(singularKey);
        int contextStart = singularKey.lastIndexOf(config.contextSeparator());
        if (contextStart >= 0 && merged.containsKey(singularKey.substring(0, contextStart))) {
            return true;
        }
        if (pluralMatch) {
            for (PluralCategory category : PluralCategory.values()) {
                if (merged.containsKey(singularKey + config.pluralSeparator() + category.key())) {
                    return true;
                }
            }
        }
        return false;
    }
}
