package dev.contentagents.unit;

import dev.contentagents.error.UnitFailureException;
import dev.contentagents.model.ValidatedOutput;

import java.util.List;

/**
 * A named work item with declared dependencies. The scheduler calls {@link #execute}
 * once all dependencies have succeeded and publishes the returned output under
 * {@link #name()}.
 */
public interface Unit {

    String name();

    /** Names of the units whose outputs this unit reads, in declaration order. */
    List<String> dependencies();

    ValidatedOutput execute(UnitContext context) throws UnitFailureException;

    @FunctionalInterface
    interface Body {
        ValidatedOutput apply(UnitContext context) throws UnitFailureException;
    }

    /** Ad-hoc unit, mostly for wiring and tests. */
    static Unit of(String name, List<String> dependencies, Body body) {
        List<String> deps = List.copyOf(dependencies);
        return new Unit() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<String> dependencies() {
                return deps;
            }

            @Override
            public ValidatedOutput execute(UnitContext context) throws UnitFailureException {
                return body.apply(context);
            }

            @Override
            public String toString() {
                return "Unit[" + name + " <- " + deps + "]";
            }
        };
    }
}
