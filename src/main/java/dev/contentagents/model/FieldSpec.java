package dev.contentagents.model;

import java.util.Set;

/**
 * Declares one field of an {@link ArtifactSchema}. List fields may bound their entry
 * count and declare an entry type or an entry schema; mapping fields may declare a
 * nested schema.
 */
public record FieldSpec(
    String name,
    FieldType type,
    boolean required,
    String constant,          // nullable: exact string value
    Set<String> allowedValues, // empty = unrestricted
    Integer minCount,         // nullable
    Integer maxCount,         // nullable
    FieldType itemType,       // nullable: primitive type of list entries
    ArtifactSchema nested     // nullable: schema of list entries or of the mapping itself
) {
    public FieldSpec {
        allowedValues = allowedValues == null ? Set.of() : Set.copyOf(allowedValues);
    }

    public static FieldSpec string(String name) {
        return new FieldSpec(name, FieldType.STRING, true, null, Set.of(), null, null, null, null);
    }

    public static FieldSpec number(String name) {
        return new FieldSpec(name, FieldType.NUMBER, true, null, Set.of(), null, null, null, null);
    }

    public static FieldSpec list(String name) {
        return new FieldSpec(name, FieldType.LIST, true, null, Set.of(), null, null, null, null);
    }

    public static FieldSpec mapping(String name, ArtifactSchema schema) {
        return new FieldSpec(name, FieldType.MAPPING, true, null, Set.of(), null, null, null, schema);
    }

    public FieldSpec optional() {
        return new FieldSpec(name, type, false, constant, allowedValues, minCount, maxCount, itemType, nested);
    }

    public FieldSpec constant(String value) {
        return new FieldSpec(name, type, required, value, allowedValues, minCount, maxCount, itemType, nested);
    }

    public FieldSpec oneOf(Set<String> values) {
        return new FieldSpec(name, type, required, constant, values, minCount, maxCount, itemType, nested);
    }

    public FieldSpec minCount(int min) {
        return new FieldSpec(name, type, required, constant, allowedValues, min, maxCount, itemType, nested);
    }

    public FieldSpec exactCount(int count) {
        return new FieldSpec(name, type, required, constant, allowedValues, count, count, itemType, nested);
    }

    public FieldSpec ofStrings() {
        return new FieldSpec(name, type, required, constant, allowedValues, minCount, maxCount, FieldType.STRING, null);
    }

    public FieldSpec of(ArtifactSchema itemSchema) {
        return new FieldSpec(name, type, required, constant, allowedValues, minCount, maxCount, null, itemSchema);
    }

    public String describeCount() {
        if (minCount != null && minCount.equals(maxCount)) return "exactly " + minCount + " entries";
        if (maxCount == null) return "at least " + minCount + " entries";
        if (minCount == null) return "at most " + maxCount + " entries";
        return "between " + minCount + " and " + maxCount + " entries";
    }
}
