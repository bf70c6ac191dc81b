package dev.contentagents.engine;

import dev.contentagents.model.InputRecord;
import dev.contentagents.model.ValidatedOutput;
import dev.contentagents.unit.UnitContext;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BooleanSupplier;

/**
 * The run's input record plus the finalized output of every completed unit.
 * Each key is written at most once and never removed.
 */
public final class SharedState {

    private final InputRecord input;
    private final ConcurrentMap<String, ValidatedOutput> outputs = new ConcurrentHashMap<>();

    public SharedState(InputRecord input) {
        this.input = input;
    }

    public InputRecord input() {
        return input;
    }

    /**
     * Publish a unit's output.
     *
     * @throws IllegalStateException if the unit already published
     */
    public void publish(String unit, ValidatedOutput output) {
        ValidatedOutput previous = outputs.putIfAbsent(unit, output);
        if (previous != null) {
            throw new IllegalStateException("Output for unit '%s' is already published".formatted(unit));
        }
    }

    public Optional<ValidatedOutput> get(String unit) {
        return Optional.ofNullable(outputs.get(unit));
    }

    public boolean isPublished(String unit) {
        return outputs.containsKey(unit);
    }

    public Set<String> publishedUnits() {
        return Set.copyOf(outputs.keySet());
    }

    /**
     * Build the execution context for a unit from its dependencies' outputs.
     *
     * @throws IllegalStateException if a dependency has not been published
     */
    public UnitContext contextFor(String unit, Collection<String> dependencies, BooleanSupplier cancelled) {
        Map<String, ValidatedOutput> view = new LinkedHashMap<>();
        for (String dependency : dependencies) {
            ValidatedOutput output = outputs.get(dependency);
            if (output == null) {
                throw new IllegalStateException(
                    "Unit '%s' read dependency '%s' before it was published".formatted(unit, dependency));
            }
            view.put(dependency, output);
        }
        return new UnitContext(unit, input, view, cancelled);
    }
}
