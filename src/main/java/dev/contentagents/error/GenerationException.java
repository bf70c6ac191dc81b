package dev.contentagents.error;

/**
 * Raised by a generation backend or the generator client. Only fatal kinds escape
 * {@link dev.contentagents.backend.GeneratorClient}.
 */
public class GenerationException extends UnitFailureException {

    public GenerationException(FailureKind kind, String message) {
        super(kind, message);
    }

    public GenerationException(FailureKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public boolean isTransient() {
        return kind().isTransient();
    }

    public static GenerationException rateLimited(String message) {
        return new GenerationException(FailureKind.RATE_LIMITED, message);
    }

    public static GenerationException fatal(String message) {
        return new GenerationException(FailureKind.PROVIDER_ERROR, message);
    }
}
