package ai.i18next.parser.entry;

/**
 * Raised when extracted entries cannot be read.
 */
public class EntrySourceException extends RuntimeException {

    public EntrySourceException(String message) {
        super(message);
    }

    public EntrySourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
