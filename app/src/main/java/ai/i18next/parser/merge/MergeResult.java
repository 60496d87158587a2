package ai.i18next.parser.merge;

import ai.i18next.parser.catalog.CatalogTree;
import java.util.Objects;

/**
 * Outcome of one {@link HashMerger#merge} call.
 *
 * @param newValues  the reconciled catalog
 * @param oldValues  source values that were dropped, replaced by a reset or structurally incompatible
 * @param resetFlags {@code true} flags for every key whose source value was reset
 * @param mergeCount source values copied over existing keys
 * @param pullCount  orphaned plural or context variants pulled back into the catalog
 * @param oldCount   source values that did not make it into {@code newValues} unchanged
 * @param resetCount keys flagged in {@code resetFlags}
 */
public record MergeResult(
        CatalogTree newValues,
        CatalogTree oldValues,
        CatalogTree resetFlags,
        int mergeCount,
        int pullCount,
        int oldCount,
        int resetCount
) {

    public MergeResult {
        Objects.requireNonNull(newValues, "newValues");
        Objects.requireNonNull(oldValues, "oldValues");
        Objects.requireNonNull(resetFlags, "resetFlags");
    }

    public static MergeResult unchanged(CatalogTree existing) {
        return new MergeResult(existing, CatalogTree.empty(), CatalogTree.empty(), 0, 0, 0, 0);
    }
}
