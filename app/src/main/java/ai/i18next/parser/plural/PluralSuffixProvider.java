package ai.i18next.parser.plural;

import java.util.List;

/**
 * Supplies the plural categories a locale distinguishes.
 */
@FunctionalInterface
public interface PluralSuffixProvider {

    /**
     * Returns the category keys of {@code locale} (e.g. {@code one}, {@code other}) in CLDR order.
     *
     * @throws UnknownLocaleException if the locale has no known plural rules
     */
    List<String> suffixesFor(String locale);
}
