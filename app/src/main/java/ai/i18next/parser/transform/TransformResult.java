package ai.i18next.parser.transform;

import ai.i18next.parser.catalog.CatalogTree;
import java.util.Map;
import java.util.Objects;

/**
 * Source catalog of one locale, keyed by namespace at the top level, with per-namespace key counts.
 */
public record TransformResult(String locale, CatalogTree catalog, Map<String, Integer> uniqueCounts,
                              Map<String, Integer> uniquePluralsCounts) {

    public TransformResult {
        Objects.requireNonNull(locale, "locale");
        Objects.requireNonNull(catalog, "catalog");
        uniqueCounts = Map.copyOf(uniqueCounts);
        uniquePluralsCounts = Map.copyOf(uniquePluralsCounts);
    }

    public int uniqueCount(String namespace) {
        return uniqueCounts.getOrDefault(namespace, 0);
    }

    public int uniquePluralsCount(String namespace) {
        return uniquePluralsCounts.getOrDefault(namespace, 0);
    }

    public CatalogTree namespace(String namespace) {
        return catalog.subtree(namespace).orElseGet(CatalogTree::empty);
    }
}
