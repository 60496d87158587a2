package ai.i18next.parser.catalog;

/**
 * A node of a translation catalog: either a nested {@link CatalogTree} or one of the leaf kinds.
 */
public sealed interface CatalogNode permits CatalogTree, CatalogValue, CatalogList, CatalogFlag {

    default boolean isTree() {
        return this instanceof CatalogTree;
    }

    /**
     * Returns true for a string leaf holding the empty string.
     */
    default boolean isBlankValue() {
        return this instanceof CatalogValue value && value.value().isEmpty();
    }
}
