package ai.i18next.parser.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable object node of a catalog. Keys keep their insertion order; equality ignores it.
 */
public record CatalogTree(Map<String, CatalogNode> children) implements CatalogNode {

    private static final CatalogTree EMPTY = new CatalogTree(Map.of());

    public CatalogTree {
        Objects.requireNonNull(children, "children");
        children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
    }

    public static CatalogTree empty() {
        return EMPTY;
    }

    /**
     * Returns the child tree under {@code key}, or empty if the key is absent or holds a leaf.
     */
    public Optional<CatalogTree> subtree(String key) {
        return children.get(key) instanceof CatalogTree tree ? Optional.of(tree) : Optional.empty();
    }

    public boolean containsKey(String key) {
        return children.containsKey(key);
    }

    public Set<String> keys() {
        return children.keySet();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    /**
     * Returns a mutable copy of the children, for callers that assemble a new tree in several steps.
     */
    public LinkedHashMap<String, CatalogNode> toMutableMap() {
        return new LinkedHashMap<>(children);
    }

    /**
     * Returns a copy with keys ordered lexicographically at every level.
     */
    public CatalogTree sorted() {
        TreeMap<String, CatalogNode> ordered = new TreeMap<>();
        children.forEach((key, node) -> ordered.put(key, node instanceof CatalogTree tree ? tree.sorted() : node));
        return new CatalogTree(ordered);
    }
}
