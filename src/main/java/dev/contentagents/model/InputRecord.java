package dev.contentagents.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The validated domain record a run starts from. Held as a private copy; every accessor
 * returns a fresh copy so units cannot mutate it.
 */
public final class InputRecord {

    private final ObjectNode fields;

    public InputRecord(ObjectNode fields) {
        this.fields = Objects.requireNonNull(fields, "fields").deepCopy();
    }

    public boolean has(String field) {
        return fields.hasNonNull(field);
    }

    /** Returns a copy of the named field, or null when absent. */
    public JsonNode field(String field) {
        JsonNode node = fields.get(field);
        return node == null ? null : node.deepCopy();
    }

    public List<String> fieldNames() {
        var names = new ArrayList<String>();
        fields.fieldNames().forEachRemaining(names::add);
        return names;
    }

    public ObjectNode asJson() {
        return fields.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InputRecord other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "InputRecord" + fields;
    }
}
