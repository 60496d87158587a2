package ai.i18next.parser.reconcile;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised instead of writing when catalogs would change and updates are configured to fail the run.
 */
public class CatalogUpdateException extends RuntimeException {

    private final List<Path> changedPaths;

    public CatalogUpdateException(List<Path> changedPaths) {
        super("Catalogs are out of date: " + changedPaths.stream().map(Path::toString).collect(Collectors.joining(", ")));
        this.changedPaths = List.copyOf(changedPaths);
    }

    public List<Path> changedPaths() {
        return changedPaths;
    }
}
