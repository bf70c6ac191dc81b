package dev.contentagents.error;

import java.util.List;

/**
 * The unit graph is cyclic or references unknown units. Raised before any unit runs.
 */
public class DependencyException extends ContentAgentException {

    private final List<String> problems;

    public DependencyException(List<String> problems) {
        super("Invalid unit graph: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
