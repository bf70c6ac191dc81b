package dev.contentagents.engine;

import dev.contentagents.error.DependencyException;
import dev.contentagents.unit.Unit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable dependency graph over unit names, in registration order.
 * <p>
 * Construction never fails; problems (duplicates, unknown dependencies, cycles) are
 * reported together by {@link #validate()} so a run can be rejected before anything
 * executes.
 */
public final class DependencyGraph {

    private final Map<String, List<String>> dependencies;
    private final List<String> duplicates;

    private DependencyGraph(Map<String, List<String>> dependencies, List<String> duplicates) {
        this.dependencies = dependencies;
        this.duplicates = duplicates;
    }

    public static DependencyGraph of(Collection<? extends Unit> units) {
        Builder builder = builder();
        for (Unit unit : units) {
            builder.addUnit(unit.name(), unit.dependencies());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> dependenciesOf(String name) {
        List<String> deps = dependencies.get(name);
        if (deps == null) {
            throw new IllegalArgumentException("Unknown unit: " + name);
        }
        return deps;
    }

    /** Units that list {@code name} as a direct dependency, in registration order. */
    public List<String> dependentsOf(String name) {
        var result = new ArrayList<String>();
        dependencies.forEach((unit, deps) -> {
            if (deps.contains(name)) {
                result.add(unit);
            }
        });
        return result;
    }

    /** Every unit that depends on {@code name} directly or transitively, in registration order. */
    public List<String> transitiveDependents(String name) {
        Set<String> reached = new LinkedHashSet<>();
        List<String> frontier = new ArrayList<>(List.of(name));
        while (!frontier.isEmpty()) {
            List<String> next = new ArrayList<>();
            for (String current : frontier) {
                for (String dependent : dependentsOf(current)) {
                    if (reached.add(dependent)) {
                        next.add(dependent);
                    }
                }
            }
            frontier = next;
        }
        return dependencies.keySet().stream().filter(reached::contains).toList();
    }

    /**
     * Check that names are unique, every dependency is registered, and the graph is acyclic.
     */
    public void validate() throws DependencyException {
        List<String> problems = structuralProblems();
        if (!problems.isEmpty()) {
            throw new DependencyException(problems);
        }
    }

    /**
     * {@link #validate()} plus a check that the graph covers exactly the given units.
     */
    public void validateAgainst(Collection<String> unitNames) throws DependencyException {
        List<String> problems = structuralProblems();
        for (String unit : unitNames) {
            if (!dependencies.containsKey(unit)) {
                problems.add("Unit '%s' is not part of the dependency graph".formatted(unit));
            }
        }
        for (String node : dependencies.keySet()) {
            if (!unitNames.contains(node)) {
                problems.add("Graph node '%s' has no registered unit".formatted(node));
            }
        }
        if (!problems.isEmpty()) {
            throw new DependencyException(problems);
        }
    }

    /**
     * Topological order, ties broken by registration order.
     */
    public List<String> topologicalOrder() throws DependencyException {
        validate();
        return kahn();
    }

    private List<String> structuralProblems() {
        var problems = new ArrayList<String>();
        for (String duplicate : duplicates) {
            problems.add("Duplicate unit name: " + duplicate);
        }
        dependencies.forEach((unit, deps) -> {
            for (String dep : deps) {
                if (dep.equals(unit)) {
                    problems.add("Unit '%s' depends on itself".formatted(unit));
                } else if (!dependencies.containsKey(dep)) {
                    problems.add("Unit '%s' depends on unknown unit '%s'".formatted(unit, dep));
                }
            }
        });
        if (problems.isEmpty()) {
            List<String> order = kahn();
            if (order.size() != dependencies.size()) {
                var stuck = new ArrayList<>(dependencies.keySet());
                stuck.removeAll(order);
                problems.add("Cycle detected among units " + stuck);
            }
        }
        return problems;
    }

    // Kahn's algorithm; returns a partial order when the graph has a cycle.
    private List<String> kahn() {
        List<String> names = new ArrayList<>(dependencies.keySet());
        Map<String, Integer> inDegree = new HashMap<>();
        for (String name : names) {
            inDegree.put(name, dependencies.get(name).size());
        }

        List<String> order = new ArrayList<>();
        Set<String> done = new LinkedHashSet<>();
        boolean progressed = true;
        while (progressed) {
            progressed = false;
            for (String name : names) {
                if (!done.contains(name) && inDegree.get(name) == 0) {
                    done.add(name);
                    order.add(name);
                    for (String dependent : dependentsOf(name)) {
                        inDegree.merge(dependent, -1, Integer::sum);
                    }
                    progressed = true;
                }
            }
        }
        return order;
    }

    @Override
    public String toString() {
        return "DependencyGraph" + dependencies;
    }

    public static final class Builder {
        private final Map<String, List<String>> dependencies = new LinkedHashMap<>();
        private final List<String> duplicates = new ArrayList<>();

        private Builder() {}

        public Builder addUnit(String name, List<String> deps) {
            if (dependencies.containsKey(name)) {
                duplicates.add(name);
                return this;
            }
            dependencies.put(name, List.copyOf(new LinkedHashSet<>(deps)));
            return this;
        }

        public Builder addUnit(String name, String... deps) {
            return addUnit(name, List.of(deps));
        }

        public DependencyGraph build() {
            return new DependencyGraph(
                Collections.unmodifiableMap(new LinkedHashMap<>(dependencies)), List.copyOf(duplicates));
        }
    }
}
