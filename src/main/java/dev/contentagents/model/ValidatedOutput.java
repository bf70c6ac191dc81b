package dev.contentagents.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * An artifact payload that passed its schema. Immutable after acceptance.
 */
public final class ValidatedOutput {

    private final String schema;
    private final JsonNode payload;

    public ValidatedOutput(String schema, JsonNode payload) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.payload = Objects.requireNonNull(payload, "payload").deepCopy();
    }

    /** Name of the schema the payload was validated against. */
    public String schema() {
        return schema;
    }

    public JsonNode payload() {
        return payload.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ValidatedOutput other
            && schema.equals(other.schema) && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, payload);
    }

    @Override
    public String toString() {
        return "ValidatedOutput[" + schema + "]";
    }
}
