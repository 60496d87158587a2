package ai.i18next.parser.reconcile;

import ai.i18next.parser.catalog.CatalogReader;
import ai.i18next.parser.catalog.CatalogTree;
import ai.i18next.parser.catalog.CatalogWriter;
import ai.i18next.parser.config.Config;
import ai.i18next.parser.entry.Entry;
import ai.i18next.parser.merge.HashMerger;
import ai.i18next.parser.merge.MergeResult;
import ai.i18next.parser.merge.ValueTransfer;
import ai.i18next.parser.report.CountReport;
import ai.i18next.parser.transform.EntryTransformer;
import ai.i18next.parser.transform.TransformResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Reconciles extracted entries with the catalogs on disk for every configured locale and namespace.
 */
public class CatalogReconciler {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogReconciler.class);

    static final String MDC_LOCALE = "locale";
    static final String MDC_NAMESPACE = "namespace";

    private final Config config;
    private final Config restoreConfig;
    private final EntryTransformer transformer;
    private final HashMerger merger;
    private final CatalogReader reader;
    private final CatalogWriter writer;

    public CatalogReconciler(Config config, EntryTransformer transformer, HashMerger merger,
                             CatalogReader reader, CatalogWriter writer) {
        this.config = Objects.requireNonNull(config, "config");
        this.restoreConfig = config.toBuilder().keepRemoved(false).build();
        this.transformer = Objects.requireNonNull(transformer, "transformer");
        this.merger = Objects.requireNonNull(merger, "merger");
        this.reader = Objects.requireNonNull(reader, "reader");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    public List<NamespaceReconciliation> reconcile(List<Entry> entries) {
        Objects.requireNonNull(entries, "entries");
        List<NamespaceReconciliation> results = new ArrayList<>();
        for (String locale : config.locales()) {
            MDC.put(MDC_LOCALE, locale);
            try {
                TransformResult transformed = transformer.transform(entries, locale);
                for (String namespace : transformed.catalog().keys()) {
                    MDC.put(MDC_NAMESPACE, namespace);
                    try {
                        results.add(reconcileNamespace(transformed, namespace));
                    } finally {
                        MDC.remove(MDC_NAMESPACE);
                    }
                }
            } finally {
                MDC.remove(MDC_LOCALE);
            }
        }
        return results;
    }

    private NamespaceReconciliation reconcileNamespace(TransformResult transformed, String namespace) {
        String locale = transformed.locale();
        Path path = config.outputPath(locale, namespace);
        Path backupPath = Config.backupPath(path);
        Optional<CatalogTree> existing = reader.read(path);
        Optional<CatalogTree> backup = reader.readBackup(backupPath);
        String keyPrefix = namespace + config.keySeparator();

        MergeResult merged = merger.merge(existing.orElse(null), transformed.namespace(namespace),
                backup.orElse(null), keyPrefix, config.resetsDefaultValues(locale), config);
        MergeResult restored = merger.merge(backup.orElse(null), merged.newValues(), null, keyPrefix, false,
                restoreConfig);
        CatalogTree oldCatalog = ValueTransfer.transfer(merged.oldValues(), restored.oldValues());

        NamespaceReconciliation result = new NamespaceReconciliation(locale, namespace, path, backupPath, existing,
                merged, restored, oldCatalog, transformed.uniqueCount(namespace),
                transformed.uniquePluralsCount(namespace));
        if (config.verbose()) {
            CountReport.lines(result, config).forEach(line -> LOGGER.info("{}", line));
        }
        return result;
    }

    /**
     * Writes every reconciled catalog, and its backup when old catalogs are enabled and not empty.
     *
     * @return the written files
     * @throws CatalogUpdateException when {@code failOnUpdate} is set and any catalog would change; nothing is
     *                                written in that case
     */
    public List<Path> write(List<NamespaceReconciliation> results) {
        if (config.failOnUpdate()) {
            List<Path> changed = results.stream()
                    .filter(NamespaceReconciliation::changed)
                    .map(NamespaceReconciliation::path)
                    .toList();
            if (!changed.isEmpty()) {
                changed.forEach(path -> LOGGER.error("Catalog would be updated: {}", path));
                throw new CatalogUpdateException(changed);
            }
        }
        List<Path> written = new ArrayList<>();
        for (NamespaceReconciliation result : results) {
            writer.write(result.path(), result.catalog());
            written.add(result.path());
            if (config.createOldCatalogs() && !result.oldCatalog().isEmpty()) {
                writer.write(result.backupPath(), result.oldCatalog());
                written.add(result.backupPath());
            }
            LOGGER.debug("Wrote catalog {}", result.path());
        }
        return written;
    }
}
