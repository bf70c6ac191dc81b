package dev.contentagents.model;

/**
 * Terminal status of a unit after a run.
 */
public sealed interface UnitOutcome {

    record Succeeded(ValidatedOutput output) implements UnitOutcome {}

    record Failed(UnitError error) implements UnitOutcome {}

    /** Never attempted; {@code cause} names the failed upstream unit, or is null when cancelled. */
    record Skipped(SkipReason reason, String cause) implements UnitOutcome {}
}
