package dev.contentagents.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a scheduler run: one terminal outcome per unit, in registration order,
 * plus the execution trace.
 */
public record RunResult(
    Map<String, UnitOutcome> outcomes,
    List<TraceEvent> trace,
    boolean cancelled
) {
    public RunResult {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        trace = List.copyOf(trace);
    }

    public UnitOutcome outcome(String unit) {
        UnitOutcome outcome = outcomes.get(unit);
        if (outcome == null) {
            throw new IllegalArgumentException("Unknown unit: " + unit);
        }
        return outcome;
    }

    public Map<String, ValidatedOutput> succeeded() {
        var result = new LinkedHashMap<String, ValidatedOutput>();
        outcomes.forEach((name, outcome) -> {
            if (outcome instanceof UnitOutcome.Succeeded s) {
                result.put(name, s.output());
            }
        });
        return result;
    }

    public Map<String, UnitError> failed() {
        var result = new LinkedHashMap<String, UnitError>();
        outcomes.forEach((name, outcome) -> {
            if (outcome instanceof UnitOutcome.Failed f) {
                result.put(name, f.error());
            }
        });
        return result;
    }

    public Map<String, UnitOutcome.Skipped> skipped() {
        var result = new LinkedHashMap<String, UnitOutcome.Skipped>();
        outcomes.forEach((name, outcome) -> {
            if (outcome instanceof UnitOutcome.Skipped s) {
                result.put(name, s);
            }
        });
        return result;
    }

    public boolean allSucceeded() {
        return succeeded().size() == outcomes.size();
    }

    /** Unit names in the order they were dispatched. */
    public List<String> dispatchOrder() {
        return trace.stream()
            .filter(e -> e.state() == UnitState.DISPATCHED)
            .map(TraceEvent::unit)
            .toList();
    }
}
