package ai.i18next.parser.reconcile;

import ai.i18next.parser.catalog.CatalogTree;
import ai.i18next.parser.merge.MergeResult;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reconciled catalog of one namespace in one locale, ready to be written.
 *
 * @param existing   catalog that was on disk before the run, if any
 * @param merged     result of merging the on-disk catalog into the extracted keys
 * @param restored   result of merging the backup catalog into {@code merged}; its merge count is the number of
 *                   restored keys
 * @param oldCatalog content for the backup catalog
 */
public record NamespaceReconciliation(
        String locale,
        String namespace,
        Path path,
        Path backupPath,
        Optional<CatalogTree> existing,
        MergeResult merged,
        MergeResult restored,
        CatalogTree oldCatalog,
        int uniqueCount,
        int uniquePluralsCount
) {

    public NamespaceReconciliation {
        Objects.requireNonNull(locale, "locale");
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(backupPath, "backupPath");
        existing = existing == null ? Optional.empty() : existing;
        Objects.requireNonNull(merged, "merged");
        Objects.requireNonNull(restored, "restored");
        Objects.requireNonNull(oldCatalog, "oldCatalog");
    }

    public CatalogTree catalog() {
        return merged.newValues();
    }

    /**
     * Whether writing this result would create the catalog or alter its content.
     */
    public boolean changed() {
        return existing.map(current -> !current.equals(merged.newValues())).orElse(true);
    }
}
