package ai.i18next.parser.report;

import ai.i18next.parser.config.Config;
import ai.i18next.parser.reconcile.NamespaceReconciliation;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-namespace key statistics printed in verbose mode.
 */
public final class CountReport {

    private CountReport() {
    }

    public static List<String> lines(NamespaceReconciliation result, Config config) {
        List<String> lines = new ArrayList<>();
        int mergeCount = result.merged().mergeCount();
        lines.add("[" + result.locale() + "] " + result.namespace());
        lines.add("Unique keys: " + result.uniqueCount() + " (" + result.uniquePluralsCount() + " are plurals)");
        lines.add("Added keys: " + Math.max(0, result.uniqueCount() - mergeCount));
        lines.add("Restored keys: " + result.restored().mergeCount());
        if (config.keepRemoved()) {
            lines.add("Unreferenced keys: " + result.merged().oldCount());
        } else {
            lines.add("Removed keys: " + result.merged().oldCount());
        }
        if (config.resetDefaultValueLocale().isPresent()) {
            lines.add("Reset keys: " + result.merged().resetCount());
        }
        return lines;
    }
}
