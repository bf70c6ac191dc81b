package dev.contentagents.backend;

/**
 * Shape of the delay schedule between retries.
 */
public enum BackoffStrategy {
    /** base, 2×base, 4×base, ... */
    EXPONENTIAL,
    /** base, 2×base, 3×base, ... */
    LINEAR
}
