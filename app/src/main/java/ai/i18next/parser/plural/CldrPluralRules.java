package ai.i18next.parser.plural;

import static ai.i18next.parser.plural.PluralCategory.FEW;
import static ai.i18next.parser.plural.PluralCategory.MANY;
import static ai.i18next.parser.plural.PluralCategory.ONE;
import static ai.i18next.parser.plural.PluralCategory.OTHER;
import static ai.i18next.parser.plural.PluralCategory.TWO;
import static ai.i18next.parser.plural.PluralCategory.ZERO;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Cardinal plural categories per language, taken from the CLDR plural rules.
 *
 * <p>Locale tags are matched case-insensitively with {@code _} treated as {@code -}. A full tag such as
 * {@code pt-PT} is tried first, then its language subtag.</p>
 */
public final class CldrPluralRules implements PluralSuffixProvider {

    private static final Map<String, Set<PluralCategory>> RULES = new HashMap<>();

    static {
        register(EnumSet.of(OTHER),
                "bm", "bo", "dz", "id", "ig", "ii", "ja", "jbo", "jv", "kde", "kea", "km", "ko", "lo", "ms", "my",
                "sah", "ses", "sg", "su", "th", "to", "vi", "wo", "yo", "yue", "zh");
        register(EnumSet.of(ONE, OTHER),
                "af", "am", "an", "ast", "az", "bg", "bn", "da", "de", "el", "en", "eo", "et", "eu", "fa", "fi",
                "fo", "fur", "fy", "gl", "gu", "ha", "hi", "hu", "hy", "is", "ka", "kk", "kn", "ku", "ky", "lb",
                "mk", "ml", "mn", "mr", "nb", "ne", "nl", "nn", "no", "or", "pa", "ps", "rm", "si", "so", "sq",
                "sv", "sw", "ta", "te", "tk", "tr", "ug", "ur", "uz", "xh", "zu", "fil", "tl");
        register(EnumSet.of(ONE, MANY, OTHER), "ca", "es", "fr", "it", "pt", "pt-pt");
        register(EnumSet.of(ONE, FEW, MANY, OTHER), "be", "cs", "lt", "pl", "ru", "sk", "uk");
        register(EnumSet.of(ONE, FEW, OTHER), "bs", "hr", "ro", "mo", "sh", "shi", "sr");
        register(EnumSet.of(ZERO, ONE, TWO, FEW, MANY, OTHER), "ar", "ars", "cy", "kw");
        register(EnumSet.of(ONE, TWO, FEW, MANY, OTHER), "br", "ga", "gv", "mt");
        register(EnumSet.of(ONE, TWO, FEW, OTHER), "dsb", "gd", "hsb", "sl");
        register(EnumSet.of(ONE, TWO, OTHER), "he", "iu", "iw", "se", "smn", "sms");
        register(EnumSet.of(ZERO, ONE, OTHER), "ksh", "lag", "lv", "prg");
    }

    private static void register(Set<PluralCategory> categories, String... languages) {
        for (String language : languages) {
            RULES.put(language, categories);
        }
    }

    /**
     * Returns the categories of {@code locale} in CLDR order.
     *
     * @throws UnknownLocaleException if neither the full tag nor its language subtag is known
     */
    public List<PluralCategory> categoriesFor(String locale) {
        return lookup(locale)
                .map(List::copyOf)
                .orElseThrow(() -> new UnknownLocaleException(locale));
    }

    @Override
    public List<String> suffixesFor(String locale) {
        return categoriesFor(locale).stream().map(PluralCategory::key).toList();
    }

    private static Optional<Set<PluralCategory>> lookup(String locale) {
        if (locale == null || locale.isBlank()) {
            return Optional.empty();
        }
        String tag = locale.trim().replace('_', '-').toLowerCase(Locale.ROOT);
        Set<PluralCategory> categories = RULES.get(tag);
        if (categories == null) {
            int dash = tag.indexOf('-');
            if (dash > 0) {
                categories = RULES.get(tag.substring(0, dash));
            }
        }
        return Optional.ofNullable(categories);
    }
}
