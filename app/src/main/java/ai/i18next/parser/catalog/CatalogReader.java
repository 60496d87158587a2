package ai.i18next.parser.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads JSON or YAML catalogs from disk. A file that is missing, unreadable or not an object is reported as absent.
 */
public class CatalogReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogReader.class);

    public Optional<CatalogTree> read(Path path) {
        return read(path, false);
    }

    /**
     * Reads a backup catalog. Unlike {@link #read(Path)}, a missing file is expected and not reported.
     */
    public Optional<CatalogTree> readBackup(Path path) {
        return read(path, true);
    }

    private Optional<CatalogTree> read(Path path, boolean backup) {
        if (!Files.isRegularFile(path)) {
            if (backup) {
                LOGGER.debug("No backup catalog at {}", path);
            } else {
                LOGGER.warn("Catalog {} does not exist, starting from an empty one", path);
            }
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = CatalogFormat.of(path).mapper().readTree(path.toFile());
        } catch (IOException ex) {
            LOGGER.warn("Ignoring unreadable catalog {}: {}", path, ex.getMessage());
            return Optional.empty();
        }
        if (root == null || root.isMissingNode()) {
            return Optional.of(CatalogTree.empty());
        }
        if (CatalogCodec.fromJson(root) instanceof CatalogTree tree) {
            return Optional.of(tree);
        }
        LOGGER.warn("Ignoring catalog {}: root is not an object", path);
        return Optional.empty();
    }
}
