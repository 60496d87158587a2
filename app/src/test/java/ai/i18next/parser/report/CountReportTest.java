package ai.i18next.parser.report;

import static org.assertj.core.api.Assertions.assertThat;

import ai.i18next.parser.catalog.CatalogTree;
import ai.i18next.parser.config.Config;
import ai.i18next.parser.merge.MergeResult;
import ai.i18next.parser.reconcile.NamespaceReconciliation;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CountReportTest {

    private final NamespaceReconciliation result = new NamespaceReconciliation("en", "common",
            Path.of("locales/en/common.json"), Path.of("locales/en/common_old.json"), Optional.empty(),
            new MergeResult(CatalogTree.empty(), CatalogTree.empty(), CatalogTree.empty(), 3, 1, 2, 1),
            new MergeResult(CatalogTree.empty(), CatalogTree.empty(), CatalogTree.empty(), 4, 0, 0, 0),
            CatalogTree.empty(), 5, 2);

    @Test
    void reportsAddedRestoredAndRemovedKeys() {
        assertThat(CountReport.lines(result, Config.builder().build())).containsExactly(
                "[en] common",
                "Unique keys: 5 (2 are plurals)",
                "Added keys: 2",
                "Restored keys: 4",
                "Removed keys: 2");
    }

    @Test
    void keepRemovedReportsUnreferencedKeysAndResetLocaleAddsResetCount() {
        Config config = Config.builder().keepRemoved(true).resetDefaultValueLocale("en").build();

        assertThat(CountReport.lines(result, config))
                .contains("Unreferenced keys: 2", "Reset keys: 1")
                .doesNotContain("Removed keys: 2");
    }
}
