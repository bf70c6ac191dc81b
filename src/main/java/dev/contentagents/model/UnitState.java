package dev.contentagents.model;

/**
 * State transitions recorded in the execution trace.
 */
public enum UnitState {
    DISPATCHED,
    SUCCEEDED,
    FAILED,
    SKIPPED
}
