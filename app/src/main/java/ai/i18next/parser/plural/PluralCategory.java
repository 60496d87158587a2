package ai.i18next.parser.plural;

import java.util.Locale;

/**
 * CLDR plural categories, declared in the order i18next expects their suffixed keys.
 */
public enum PluralCategory {
    ZERO,
    ONE,
    TWO,
    FEW,
    MANY,
    OTHER;

    /**
     * Returns the lowercase key used as plural suffix, e.g. {@code one}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
