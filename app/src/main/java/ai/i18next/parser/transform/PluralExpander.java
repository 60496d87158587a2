package ai.i18next.parser.transform;

import ai.i18next.parser.entry.Entry;
import ai.i18next.parser.plural.PluralSuffixProvider;
import ai.i18next.parser.plural.UnknownLocaleException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which key suffixes an entry is materialized with for a locale.
 */
public class PluralExpander {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluralExpander.class);

    private final PluralSuffixProvider suffixProvider;
    private final String pluralSeparator;

    public PluralExpander(PluralSuffixProvider suffixProvider, String pluralSeparator) {
        this.suffixProvider = Objects.requireNonNull(suffixProvider, "suffixProvider");
        this.pluralSeparator = Objects.requireNonNull(pluralSeparator, "pluralSeparator");
    }

    /**
     * Returns a single empty suffix for entries without a count, otherwise one {@code pluralSeparator + category}
     * per plural category of the locale. An unknown locale yields no suffix at all.
     */
    public List<Optional<String>> expand(Entry entry, String locale) {
        if (!entry.hasCount()) {
            return List.of(Optional.empty());
        }
        try {
            return suffixProvider.suffixesFor(locale).stream()
                    .map(category -> Optional.of(pluralSeparator + category))
                    .toList();
        } catch (UnknownLocaleException ex) {
            LOGGER.error("Skipping plural key '{}': {}", entry.key(), ex.getMessage());
            return List.of();
        }
    }
}
