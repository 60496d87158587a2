package ai.i18next.parser.transform;

import java.util.Objects;

/**
 * A clash detected while writing an entry into a catalog tree.
 */
public sealed interface Conflict permits Conflict.KeyConflict, Conflict.ValueConflict {

    /**
     * A path segment already held a leaf where a nested tree was needed, or the reverse.
     */
    record KeyConflict(String segment) implements Conflict {
        public KeyConflict {
            Objects.requireNonNull(segment, "segment");
        }
    }

    /**
     * The same key was found with two different non-empty values. The newer value wins.
     */
    record ValueConflict(String oldValue, String newValue) implements Conflict {
        public ValueConflict {
            Objects.requireNonNull(oldValue, "oldValue");
            Objects.requireNonNull(newValue, "newValue");
        }
    }
}
