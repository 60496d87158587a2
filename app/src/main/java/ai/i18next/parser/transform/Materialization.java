package ai.i18next.parser.transform;

import ai.i18next.parser.catalog.CatalogTree;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of writing one entry into a catalog tree.
 *
 * @param target     the updated tree
 * @param priorValue string previously stored at the entry's path, if any
 * @param conflict   conflict detected while writing, if any
 */
public record Materialization(CatalogTree target, Optional<String> priorValue, Optional<Conflict> conflict) {

    public Materialization {
        Objects.requireNonNull(target, "target");
        priorValue = priorValue == null ? Optional.empty() : priorValue;
        conflict = conflict == null ? Optional.empty() : conflict;
    }

    static Materialization unchanged(CatalogTree target) {
        return new Materialization(target, Optional.empty(), Optional.empty());
    }
}
