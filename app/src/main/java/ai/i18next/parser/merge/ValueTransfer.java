package ai.i18next.parser.merge;

import ai.i18next.parser.catalog.CatalogNode;
import ai.i18next.parser.catalog.CatalogTree;
import java.util.Map;

/**
 * Structural union of two catalogs.
 */
public final class ValueTransfer {

    private ValueTransfer() {
    }

    /**
     * Returns {@code target} extended with the keys only present in {@code source}. Where both hold trees the
     * union recurses; everywhere else the target value is kept.
     */
    public static CatalogTree transfer(CatalogTree source, CatalogTree target) {
        Map<String, CatalogNode> result = target.toMutableMap();
        source.children().forEach((key, sourceValue) -> {
            CatalogNode targetValue = result.get(key);
            if (targetValue == null) {
                result.put(key, sourceValue);
            } else if (sourceValue instanceof CatalogTree sourceTree && targetValue instanceof CatalogTree targetTree) {
                result.put(key, transfer(sourceTree, targetTree));
            }
        });
        return new CatalogTree(result);
    }
}
