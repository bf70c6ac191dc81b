package dev.contentagents.unit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.contentagents.engine.OutputValidator;
import dev.contentagents.error.SchemaViolationException;
import dev.contentagents.model.InputRecord;
import dev.contentagents.model.ValidatedOutput;

import java.util.List;

/**
 * Normalizes the input record into the parsed-product shape. Does not call the generator.
 */
public record ParserUnit() implements ContentUnit {

    public static final String NAME = "parser";

    private static final List<String> TEXT_FIELDS =
        List.of("name", "concentration", "how_to_use", "side_effects", "price");
    private static final List<String> LIST_FIELDS =
        List.of("skin_type", "key_ingredients", "benefits");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> dependencies() {
        return List.of();
    }

    @Override
    public ValidatedOutput execute(UnitContext context) throws SchemaViolationException {
        return OutputValidator.validate(normalize(context.input()), ContentSchemas.PARSED_PRODUCT);
    }

    static ObjectNode normalize(InputRecord input) {
        ObjectNode product = JsonNodeFactory.instance.objectNode();
        for (String field : TEXT_FIELDS) {
            JsonNode value = input.field(field);
            if (value == null) {
                continue;
            }
            if (value.isTextual() || value.isNumber()) {
                product.put(field, value.asText().trim());
            } else {
                product.set(field, value);
            }
        }
        for (String field : LIST_FIELDS) {
            JsonNode value = input.field(field);
            if (value != null) {
                product.set(field, toList(value));
            }
        }
        return product;
    }

    // "Oily, Combination" and ["Oily", "Combination"] both become a list of trimmed strings
    private static JsonNode toList(JsonNode value) {
        ArrayNode list = JsonNodeFactory.instance.arrayNode();
        if (value.isTextual()) {
            for (String part : value.asText().split(",")) {
                if (!part.isBlank()) {
                    list.add(part.trim());
                }
            }
            return list;
        }
        if (!value.isArray()) {
            return value;
        }
        for (JsonNode entry : value) {
            list.add(entry.isTextual() ? JsonNodeFactory.instance.textNode(entry.asText().trim()) : entry);
        }
        return list;
    }
}
