package ai.i18next.parser.report;

import ai.i18next.parser.config.Config;
import java.io.PrintWriter;

/**
 * Prints the configuration banner shown at the start of a run.
 */
public final class ConfigPrinter {

    private static final String SEPARATOR = "-------------------";

    private ConfigPrinter() {
    }

    public static void print(Config config, PrintWriter out) {
        out.println("  i18next Parser");
        out.println("  " + SEPARATOR);
        info(out, "Dir:    ", config.workingDir().toString());
        info(out, "Entries:", config.entries());
        info(out, "Output: ", config.output());
        if (config.verbose()) {
            out.println("  " + SEPARATOR);
            info(out, "Default namespace:   ", config.defaultNamespace());
            out.println("  " + SEPARATOR);
            info(out, "Context separator:   ", config.contextSeparator());
            info(out, "Namespace separator: ", config.namespaceSeparator());
            info(out, "Key separator:       ", config.keySeparator());
            info(out, "Plural separator:    ", config.pluralSeparator());
            out.println("  " + SEPARATOR);
            info(out, "Locales:             ", String.join(", ", config.locales()));
            out.println("  " + SEPARATOR);
        }
        out.println();
        out.flush();
    }

    private static void info(PrintWriter out, String title, String value) {
        out.println("  " + title + " " + value);
    }
}
