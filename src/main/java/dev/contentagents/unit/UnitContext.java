package dev.contentagents.unit;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contentagents.model.InputRecord;
import dev.contentagents.model.ValidatedOutput;

import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * What a unit sees while executing: the run's input record and the finalized outputs of
 * its declared dependencies, nothing else.
 */
public record UnitContext(
    String unit,
    InputRecord input,
    Map<String, ValidatedOutput> dependencies,
    BooleanSupplier cancelled
) {
    public UnitContext {
        dependencies = Map.copyOf(dependencies);
    }

    /** Payload of a declared dependency. */
    public JsonNode dependency(String name) {
        ValidatedOutput output = dependencies.get(name);
        if (output == null) {
            throw new IllegalArgumentException(
                "Unit '%s' has no finalized dependency '%s'".formatted(unit, name));
        }
        return output.payload();
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }
}
