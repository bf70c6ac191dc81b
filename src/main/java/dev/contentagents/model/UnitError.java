package dev.contentagents.model;

import dev.contentagents.error.FailureKind;
import dev.contentagents.error.UnitFailureException;

/**
 * Failure detail reported for a unit in the run result.
 */
public record UnitError(FailureKind kind, String message) {

    public static UnitError of(UnitFailureException e) {
        return new UnitError(e.kind(), e.getMessage());
    }

    public static UnitError unexpected(Throwable t) {
        return new UnitError(FailureKind.UNEXPECTED, t.getClass().getSimpleName() + ": " + t.getMessage());
    }
}
