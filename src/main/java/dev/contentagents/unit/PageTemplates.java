package dev.contentagents.unit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Assembles page payloads from product data and generated fragments. Missing fragments
 * are left out so the schema check reports them.
 */
public final class PageTemplates {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private PageTemplates() {}

    public static ObjectNode faqPage(String productName, JsonNode faqItems) {
        ObjectNode page = NODES.objectNode();
        page.put("page_type", "faq");
        page.put("product_name", productName);
        page.set("faqs", faqItems.deepCopy());
        return page;
    }

    public static ObjectNode productPage(JsonNode product, JsonNode generated) {
        ObjectNode sections = NODES.objectNode();
        copy(product, "name", sections, "name");
        copy(generated, "description", sections, "description");
        copy(product, "concentration", sections, "concentration");
        copy(product, "benefits", sections, "benefits");
        copy(product, "how_to_use", sections, "usage");
        copy(product, "key_ingredients", sections, "ingredients");
        copy(product, "skin_type", sections, "skin_type");
        copy(product, "side_effects", sections, "side_effects");
        copy(product, "price", sections, "price");
        copy(generated, "highlights", sections, "highlights");

        ObjectNode page = NODES.objectNode();
        page.put("page_type", "product");
        page.set("sections", sections);
        return page;
    }

    public static ObjectNode comparisonPage(JsonNode productA, JsonNode productB, JsonNode metrics) {
        ArrayNode products = NODES.arrayNode();
        products.add(productA.deepCopy());
        products.add(productB.deepCopy());

        ObjectNode page = NODES.objectNode();
        page.put("page_type", "comparison");
        page.set("products", products);
        page.set("comparison_metrics", metrics.deepCopy());
        return page;
    }

    /**
     * Generators sometimes wrap a requested array in an object; unwrap {@code {key: [...]}}.
     */
    public static JsonNode unwrapList(JsonNode payload, String key) {
        if (payload.isObject() && payload.size() == 1 && payload.path(key).isArray()) {
            return payload.get(key);
        }
        return payload;
    }

    private static void copy(JsonNode from, String fromField, ObjectNode to, String toField) {
        JsonNode value = from.get(fromField);
        if (value != null && !value.isNull()) {
            to.set(toField, value.deepCopy());
        }
    }
}
