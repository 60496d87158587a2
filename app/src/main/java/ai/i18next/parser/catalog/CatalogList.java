package ai.i18next.parser.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Array leaf, kept verbatim from catalogs that store i18next array values.
 */
public record CatalogList(List<CatalogNode> items) implements CatalogNode {

    public CatalogList {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
    }
}
