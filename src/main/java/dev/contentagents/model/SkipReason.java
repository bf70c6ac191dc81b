package dev.contentagents.model;

public enum SkipReason {
    /** An upstream dependency failed. */
    UNREACHABLE,
    /** The run was cancelled before the unit was dispatched. */
    CANCELLED
}
