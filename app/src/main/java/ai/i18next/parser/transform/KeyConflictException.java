package ai.i18next.parser.transform;

/**
 * Raised for a key conflict when warnings are configured to be fatal.
 */
public class KeyConflictException extends RuntimeException {

    private final String segment;

    public KeyConflictException(String segment) {
        super("Found translation key already mapped to a map or parent of new key already mapped to a string: " + segment);
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }
}
