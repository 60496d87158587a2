package ai.i18next.parser.config;

import java.util.Locale;

/**
 * Line ending applied to written catalogs.
 */
public enum LineEnding {
    AUTO,
    LF,
    CRLF,
    CR;

    public static LineEnding from(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "auto" -> AUTO;
            case "lf", "\n" -> LF;
            case "crlf", "\r\n" -> CRLF;
            case "cr", "\r" -> CR;
            default -> throw new IllegalArgumentException("Unsupported line ending: " + raw);
        };
    }

    /**
     * Rewrites text whose lines end with {@code \n} to use this line ending.
     */
    public String apply(String text) {
        return switch (this) {
            case LF -> text;
            case CRLF -> text.replace("\n", "\r\n");
            case CR -> text.replace('\n', '\r');
            case AUTO -> "\n".equals(System.lineSeparator()) ? text : text.replace("\n", System.lineSeparator());
        };
    }
}
