package ai.i18next.parser.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between Jackson trees and catalog nodes.
 *
 * <p>Numbers are kept as their textual form and {@code null} becomes an empty string, since i18next
 * catalogs only carry strings at the leaves.</p>
 */
public final class CatalogCodec {

    private CatalogCodec() {
    }

    public static CatalogNode fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return CatalogValue.EMPTY;
        }
        if (node.isObject()) {
            Map<String, CatalogNode> children = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                children.put(field.getKey(), fromJson(field.getValue()));
            }
            return new CatalogTree(children);
        }
        if (node.isArray()) {
            List<CatalogNode> items = new ArrayList<>(node.size());
            node.forEach(item -> items.add(fromJson(item)));
            return new CatalogList(items);
        }
        if (node.isBoolean()) {
            return CatalogFlag.of(node.booleanValue());
        }
        return CatalogValue.of(node.asText());
    }

    public static JsonNode toJson(CatalogNode node) {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        if (node instanceof CatalogTree tree) {
            ObjectNode object = factory.objectNode();
            tree.children().forEach((key, child) -> object.set(key, toJson(child)));
            return object;
        }
        if (node instanceof CatalogList list) {
            ArrayNode array = factory.arrayNode();
            list.items().forEach(item -> array.add(toJson(item)));
            return array;
        }
        if (node instanceof CatalogFlag flag) {
            return factory.booleanNode(flag.value());
        }
        return factory.textNode(((CatalogValue) node).value());
    }
}
