package dev.contentagents.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * Structural type of a payload field.
 */
public enum FieldType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    LIST("list"),
    MAPPING("mapping");

    private final String label;

    FieldType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean matches(JsonNode node) {
        return switch (this) {
            case STRING -> node.isTextual();
            case NUMBER -> node.isNumber();
            case BOOLEAN -> node.isBoolean();
            case LIST -> node.isArray();
            case MAPPING -> node.isObject();
        };
    }

    /** Describes the type of an arbitrary node, for violation messages. */
    public static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) return "missing";
        if (node.isNull()) return "null";
        for (FieldType type : values()) {
            if (type.matches(node)) return type.label;
        }
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
