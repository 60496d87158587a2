package ai.i18next.parser.plural;

/**
 * Raised when no plural rules are known for a locale.
 */
public class UnknownLocaleException extends RuntimeException {

    private final String locale;

    public UnknownLocaleException(String locale) {
        super("No plural rules known for locale '" + locale + "'");
        this.locale = locale;
    }

    public String locale() {
        return locale;
    }
}
