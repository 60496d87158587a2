package ai.i18next.parser.catalog;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable catalog for folding many writes into one tree.
 *
 * <p>A nested tree of the starting catalog is copied the first time a write descends into it; untouched trees are
 * shared with the result of {@link #build()}. The {@link CatalogTree} the builder started from is never changed.</p>
 */
public final class CatalogBuilder {

    // values are CatalogNode or CatalogBuilder
    private final LinkedHashMap<String, Object> children;

    private CatalogBuilder(Map<String, ? extends CatalogNode> children) {
        this.children = new LinkedHashMap<>(children);
    }

    public static CatalogBuilder empty() {
        return new CatalogBuilder(Map.of());
    }

    public static CatalogBuilder from(CatalogTree tree) {
        return new CatalogBuilder(tree.children());
    }

    public boolean containsKey(String key) {
        return children.containsKey(key);
    }

    /**
     * Returns the nested builder under {@code key}, or empty if the key is absent or holds a leaf.
     */
    public Optional<CatalogBuilder> subtree(String key) {
        Object child = children.get(key);
        if (child instanceof CatalogBuilder builder) {
            return Optional.of(builder);
        }
        if (child instanceof CatalogTree tree) {
            CatalogBuilder thawed = from(tree);
            children.put(key, thawed);
            return Optional.of(thawed);
        }
        return Optional.empty();
    }

    /**
     * Replaces whatever {@code key} holds with an empty nested tree and returns it.
     */
    public CatalogBuilder putTree(String key) {
        CatalogBuilder tree = empty();
        children.put(key, tree);
        return tree;
    }

    /**
     * Returns the leaf under {@code key}; empty when the key is absent or holds a tree.
     */
    public Optional<CatalogNode> leaf(String key) {
        Object child = children.get(key);
        return child instanceof CatalogNode node && !node.isTree() ? Optional.of(node) : Optional.empty();
    }

    public boolean holdsTree(String key) {
        Object child = children.get(key);
        return child instanceof CatalogBuilder || child instanceof CatalogTree;
    }

    public CatalogBuilder put(String key, CatalogNode node) {
        children.put(key, node);
        return this;
    }

    public CatalogTree build() {
        LinkedHashMap<String, CatalogNode> frozen = new LinkedHashMap<>();
        children.forEach((key, child) -> frozen.put(key,
                child instanceof CatalogBuilder builder ? builder.build() : (CatalogNode) child));
        return new CatalogTree(frozen);
    }
}
