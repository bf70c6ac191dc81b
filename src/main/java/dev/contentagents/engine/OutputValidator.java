package dev.contentagents.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contentagents.error.SchemaViolationException;
import dev.contentagents.model.ArtifactSchema;
import dev.contentagents.model.FieldSpec;
import dev.contentagents.model.FieldType;
import dev.contentagents.model.ValidatedOutput;

import java.util.TreeSet;

/**
 * Checks a candidate payload against its artifact schema. The first violation is
 * reported; nothing is repaired or defaulted.
 * <p>
 * Each mapping is checked in three passes: required fields present and typed (including
 * constants and allowed values), then list counts, then nested entries and mappings,
 * which are checked the same way.
 */
public final class OutputValidator {

    private OutputValidator() {}

    public static ValidatedOutput validate(JsonNode payload, ArtifactSchema schema) throws SchemaViolationException {
        checkMapping(payload, schema, "", schema.name());
        return new ValidatedOutput(schema.name(), payload);
    }

    private static void checkMapping(JsonNode node, ArtifactSchema schema, String prefix, String root)
            throws SchemaViolationException {
        if (node == null || !node.isObject()) {
            throw new SchemaViolationException(root, prefix.isEmpty() ? "$" : prefix,
                FieldType.MAPPING.label(), FieldType.describe(node));
        }

        // Pass 1: presence and type
        for (FieldSpec field : schema.fields()) {
            JsonNode value = node.get(field.name());
            String path = path(prefix, field.name());
            if (value == null || value.isNull()) {
                if (field.required()) {
                    throw new SchemaViolationException(root, path, field.type().label(), FieldType.describe(value));
                }
                continue;
            }
            if (!field.type().matches(value)) {
                throw new SchemaViolationException(root, path, field.type().label(), FieldType.describe(value));
            }
            if (field.constant() != null && !field.constant().equals(value.asText())) {
                throw new SchemaViolationException(root, path, quote(field.constant()), quote(value.asText()));
            }
            if (!field.allowedValues().isEmpty() && !field.allowedValues().contains(value.asText())) {
                throw new SchemaViolationException(root, path,
                    "one of " + new TreeSet<>(field.allowedValues()), quote(value.asText()));
            }
        }

        // Pass 2: list counts
        for (FieldSpec field : schema.fields()) {
            JsonNode value = node.get(field.name());
            if (field.type() != FieldType.LIST || value == null || !value.isArray()) {
                continue;
            }
            int size = value.size();
            boolean tooFew = field.minCount() != null && size < field.minCount();
            boolean tooMany = field.maxCount() != null && size > field.maxCount();
            if (tooFew || tooMany) {
                throw new SchemaViolationException(root, path(prefix, field.name()),
                    field.describeCount(), size + " entries");
            }
        }

        // Pass 3: nested shapes
        for (FieldSpec field : schema.fields()) {
            JsonNode value = node.get(field.name());
            if (value == null || value.isNull()) {
                continue;
            }
            String path = path(prefix, field.name());
            if (field.type() == FieldType.LIST) {
                for (int i = 0; i < value.size(); i++) {
                    JsonNode entry = value.get(i);
                    String entryPath = path + "[" + i + "]";
                    if (field.itemType() != null && !field.itemType().matches(entry)) {
                        throw new SchemaViolationException(root, entryPath,
                            field.itemType().label(), FieldType.describe(entry));
                    }
                    if (field.nested() != null) {
                        checkMapping(entry, field.nested(), entryPath, root);
                    }
                }
            } else if (field.type() == FieldType.MAPPING && field.nested() != null) {
                checkMapping(value, field.nested(), path, root);
            }
        }
    }

    private static String path(String prefix, String field) {
        return prefix.isEmpty() ? field : prefix + "." + field;
    }

    private static String quote(String value) {
        return "\"" + value + "\"";
    }
}
