package ai.i18next.parser.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from defaults, the config file, the environment and CLI arguments.
 */
public record Config(
        Path workingDir,
        List<String> locales,
        String output,
        String entries,
        String contextSeparator,
        boolean createOldCatalogs,
        String defaultNamespace,
        boolean keepRemoved,
        String keySeparator,
        LineEnding lineEnding,
        String namespaceSeparator,
        String pluralSeparator,
        boolean sort,
        boolean verbose,
        boolean failOnWarnings,
        boolean failOnUpdate,
        Optional<String> resetDefaultValueLocale,
        String generatedTypes,
        LogFormat logFormat
) {

    public static final String LOCALE_TOKEN = "$LOCALE";
    public static final String NAMESPACE_TOKEN = "$NAMESPACE";

    static final String DEFAULT_OUTPUT = "locales/" + LOCALE_TOKEN + "/" + NAMESPACE_TOKEN + ".json";
    static final String DEFAULT_ENTRIES = "i18next-entries.json";
    static final String DEFAULT_GENERATED_TYPES = "src/@types/i18next.d.ts";

    public Config {
        Objects.requireNonNull(workingDir, "workingDir");
        locales = List.copyOf(Objects.requireNonNull(locales, "locales"));
        if (locales.isEmpty()) {
            throw new IllegalArgumentException("At least one locale must be configured");
        }
        if (locales.stream().anyMatch(String::isBlank)) {
            throw new IllegalArgumentException("locales must not contain blank values");
        }
        output = requireNonBlank(output, "output");
        entries = requireNonBlank(entries, "entries");
        contextSeparator = requireNonEmpty(contextSeparator, "contextSeparator");
        defaultNamespace = requireNonBlank(defaultNamespace, "defaultNamespace");
        keySeparator = requireNonEmpty(keySeparator, "keySeparator");
        lineEnding = Objects.requireNonNull(lineEnding, "lineEnding");
        namespaceSeparator = requireNonEmpty(namespaceSeparator, "namespaceSeparator");
        pluralSeparator = requireNonEmpty(pluralSeparator, "pluralSeparator");
        resetDefaultValueLocale = resetDefaultValueLocale == null
                ? Optional.empty()
                : resetDefaultValueLocale.filter(value -> !value.isBlank());
        generatedTypes = requireNonBlank(generatedTypes, "generatedTypes");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .workingDir(workingDir)
                .locales(locales)
                .output(output)
                .entries(entries)
                .contextSeparator(contextSeparator)
                .createOldCatalogs(createOldCatalogs)
                .defaultNamespace(defaultNamespace)
                .keepRemoved(keepRemoved)
                .keySeparator(keySeparator)
                .lineEnding(lineEnding)
                .namespaceSeparator(namespaceSeparator)
                .pluralSeparator(pluralSeparator)
                .sort(sort)
                .verbose(verbose)
                .failOnWarnings(failOnWarnings)
                .failOnUpdate(failOnUpdate)
                .resetDefaultValueLocale(resetDefaultValueLocale.orElse(null))
                .generatedTypes(generatedTypes)
                .logFormat(logFormat);
    }

    public String defaultLocale() {
        return locales.get(0);
    }

    /**
     * Whether catalogs of {@code locale} take extracted default values over the ones on disk, flagging the
     * replaced values as reset. Applies to {@code resetDefaultValueLocale} when set, else to the first locale.
     */
    public boolean resetsDefaultValues(String locale) {
        return resetDefaultValueLocale.map(locale::equals).orElseGet(() -> defaultLocale().equals(locale));
    }

    public Path outputPath(String locale, String namespace) {
        String relative = output.replace(LOCALE_TOKEN, locale).replace(NAMESPACE_TOKEN, namespace);
        return workingDir.resolve(relative).normalize();
    }

    public Path entriesPath() {
        return workingDir.resolve(entries).normalize();
    }

    public Path generatedTypesPath() {
        return workingDir.resolve(generatedTypes).normalize();
    }

    /**
     * Returns the backup catalog path: the same file name with {@code _old} before the extension.
     */
    public static Path backupPath(Path catalogPath) {
        String fileName = catalogPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String backupName = dot <= 0
                ? fileName + "_old"
                : fileName.substring(0, dot) + "_old" + fileName.substring(dot);
        return catalogPath.resolveSibling(backupName);
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }

    private static String requireNonEmpty(String value, String fieldName) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be empty");
        }
        return value;
    }

    /**
     * Mutable builder pre-filled with the defaults.
     */
    public static final class Builder {

        private Path workingDir = Path.of(".");
        private List<String> locales = List.of("en");
        private String output = DEFAULT_OUTPUT;
        private String entries = DEFAULT_ENTRIES;
        private String contextSeparator = "_";
        private boolean createOldCatalogs;
        private String defaultNamespace = "translation";
        private boolean keepRemoved;
        private String keySeparator = ".";
        private LineEnding lineEnding = LineEnding.AUTO;
        private String namespaceSeparator = ":";
        private String pluralSeparator = "_";
        private boolean sort = true;
        private boolean verbose;
        private boolean failOnWarnings;
        private boolean failOnUpdate;
        private String resetDefaultValueLocale;
        private String generatedTypes = DEFAULT_GENERATED_TYPES;
        private LogFormat logFormat = LogFormat.TEXT;

        private Builder() {
        }

        public Builder workingDir(Path workingDir) {
            this.workingDir = workingDir;
            return this;
        }

        public Builder locales(List<String> locales) {
            this.locales = locales;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder entries(String entries) {
            this.entries = entries;
            return this;
        }

        public Builder contextSeparator(String contextSeparator) {
            this.contextSeparator = contextSeparator;
            return this;
        }

        public Builder createOldCatalogs(boolean createOldCatalogs) {
            this.createOldCatalogs = createOldCatalogs;
            return this;
        }

        public Builder defaultNamespace(String defaultNamespace) {
            this.defaultNamespace = defaultNamespace;
            return this;
        }

        public Builder keepRemoved(boolean keepRemoved) {
            this.keepRemoved = keepRemoved;
            return this;
        }

        public Builder keySeparator(String keySeparator) {
            this.keySeparator = keySeparator;
            return this;
        }

        public Builder lineEnding(LineEnding lineEnding) {
            this.lineEnding = lineEnding;
            return this;
        }

        public Builder namespaceSeparator(String namespaceSeparator) {
            this.namespaceSeparator = namespaceSeparator;
            return this;
        }

        public Builder pluralSeparator(String pluralSeparator) {
            this.pluralSeparator = pluralSeparator;
            return this;
        }

        public Builder sort(boolean sort) {
            this.sort = sort;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder failOnWarnings(boolean failOnWarnings) {
            this.failOnWarnings = failOnWarnings;
            return this;
        }

        public Builder failOnUpdate(boolean failOnUpdate) {
            this.failOnUpdate = failOnUpdate;
            return this;
        }

        public Builder resetDefaultValueLocale(String resetDefaultValueLocale) {
            this.resetDefaultValueLocale = resetDefaultValueLocale;
            return this;
        }

        public Builder generatedTypes(String generatedTypes) {
            this.generatedTypes = generatedTypes;
            return this;
        }

        public Builder logFormat(LogFormat logFormat) {
            this.logFormat = logFormat;
            return this;
        }

        public Config build() {
            return new Config(workingDir, locales, output, entries, contextSeparator, createOldCatalogs,
                    defaultNamespace, keepRemoved, keySeparator, lineEnding, namespaceSeparator, pluralSeparator,
                    sort, verbose, failOnWarnings, failOnUpdate, Optional.ofNullable(resetDefaultValueLocale),
                    generatedTypes, logFormat);
        }
    }
}
