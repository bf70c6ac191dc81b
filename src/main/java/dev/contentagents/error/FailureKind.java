package dev.contentagents.error;

/**
 * Classification of a failure. Transient kinds are retried inside the generator client
 * and never reach a unit.
 */
public enum FailureKind {
    RATE_LIMITED(true),
    TIMEOUT(true),
    AUTHENTICATION(false),
    MALFORMED_REQUEST(false),
    PROVIDER_ERROR(false),
    RATE_LIMIT_EXHAUSTED(false),
    CANCELLED(false),
    NO_STRUCTURED_PAYLOAD(false),
    SCHEMA_VIOLATION(false),
    UNEXPECTED(false);

    private final boolean transientFailure;

    FailureKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
