package ai.i18next.parser.catalog;

import java.util.Objects;

/**
 * String leaf of a catalog.
 */
public record CatalogValue(String value) implements CatalogNode {

    public static final CatalogValue EMPTY = new CatalogValue("");

    public CatalogValue {
        Objects.requireNonNull(value, "value");
    }

    public static CatalogValue of(String value) {
        return value == null || value.isEmpty() ? EMPTY : new CatalogValue(value);
    }
}
