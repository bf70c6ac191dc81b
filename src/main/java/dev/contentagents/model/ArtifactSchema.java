package dev.contentagents.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Structural description of an artifact kind: its fields in declaration order.
 */
public record ArtifactSchema(String name, List<FieldSpec> fields) {

    public ArtifactSchema {
        fields = List.copyOf(fields);
        var seen = new LinkedHashSet<String>();
        for (FieldSpec field : fields) {
            if (!seen.add(field.name())) {
                throw new IllegalArgumentException(
                    "Schema '%s' declares field '%s' twice".formatted(name, field.name()));
            }
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final List<FieldSpec> fields = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder field(FieldSpec field) {
            fields.add(field);
            return this;
        }

        public Builder strings(String... names) {
            for (String n : names) {
                fields.add(FieldSpec.string(n));
            }
            return this;
        }

        public ArtifactSchema build() {
            return new ArtifactSchema(name, fields);
        }
    }
}
