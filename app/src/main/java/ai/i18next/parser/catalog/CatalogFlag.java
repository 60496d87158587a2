package ai.i18next.parser.catalog;

/**
 * Boolean leaf. Used to mark reset keys.
 */
public record CatalogFlag(boolean value) implements CatalogNode {

    public static final CatalogFlag TRUE = new CatalogFlag(true);
    public static final CatalogFlag FALSE = new CatalogFlag(false);

    public static CatalogFlag of(boolean value) {
        return value ? TRUE : FALSE;
    }
}
