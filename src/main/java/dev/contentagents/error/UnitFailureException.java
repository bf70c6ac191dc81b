package dev.contentagents.error;

/**
 * A failure local to one unit. It marks that unit failed and its descendants skipped;
 * independent branches keep running.
 */
public abstract class UnitFailureException extends ContentAgentException {

    private final FailureKind kind;

    protected UnitFailureException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected UnitFailureException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
