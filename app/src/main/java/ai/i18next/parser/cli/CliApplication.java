package ai.i18next.parser.cli;

import ai.i18next.parser.catalog.CatalogReader;
import ai.i18next.parser.catalog.CatalogWriter;
import ai.i18next.parser.config.Config;
import ai.i18next.parser.config.ConfigLoader;
import ai.i18next.parser.config.SystemEnvironmentReader;
import ai.i18next.parser.entry.Entry;
import ai.i18next.parser.entry.EntrySource;
import ai.i18next.parser.entry.EntrySourceException;
import ai.i18next.parser.entry.JsonEntrySource;
import ai.i18next.parser.logging.LoggingConfigurator;
import ai.i18next.parser.merge.HashMerger;
import ai.i18next.parser.plural.CldrPluralRules;
import ai.i18next.parser.reconcile.CatalogReconciler;
import ai.i18next.parser.reconcile.CatalogUpdateException;
import ai.i18next.parser.reconcile.NamespaceReconciliation;
import ai.i18next.parser.report.ConfigPrinter;
import ai.i18next.parser.transform.EntryTransformer;
import ai.i18next.parser.transform.KeyConflictException;
import ai.i18next.parser.transform.KeyMaterializer;
import ai.i18next.parser.transform.PluralExpander;
import ai.i18next.parser.types.TypesGenerator;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and reconciliation pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final Function<Config, EntrySource> entrySourceFactory;
    private final boolean configureLogging;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), config -> new JsonEntrySource(config.entriesPath()), true);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, EntrySource> entrySourceFactory, boolean configureLogging) {
        this.configLoader = configLoader;
        this.entrySourceFactory = entrySourceFactory;
        this.configureLogging = configureLogging;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        try {
            Config config = configLoader.load(cliArguments);
            if (configureLogging) {
                LoggingConfigurator.configure(config.logFormat(), config.verbose());
            }
            ConfigPrinter.print(config, new PrintWriter(System.err, true));
            return execute(config, cliArguments.generateTypes());
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
        } catch (EntrySourceException | KeyConflictException | CatalogUpdateException ex) {
            LOGGER.error(ex.getMessage());
        } catch (UncheckedIOException ex) {
            LOGGER.error(ex.getMessage(), ex.getCause());
        }
        return 1;
    }

    private int execute(Config config, boolean generateTypes) {
        List<Entry> entries = entrySourceFactory.apply(config).read();
        LOGGER.info("Reconciling {} entries for locales {}", entries.size(), config.locales());

        CatalogReconciler reconciler = new CatalogReconciler(config,
                new EntryTransformer(config, new KeyMaterializer(config),
                        new PluralExpander(new CldrPluralRules(), config.pluralSeparator())),
                new HashMerger(),
                new CatalogReader(),
                new CatalogWriter(config.lineEnding(), config.sort()));

        List<NamespaceReconciliation> results = reconciler.reconcile(entries);
        List<Path> written = reconciler.write(results);
        LOGGER.info("Wrote {} catalog files", written.size());

        if (generateTypes) {
            new TypesGenerator(config).generate(results);
        }
        return 0;
    }
}
