package dev.contentagents.error;

/**
 * Base type for every failure the content agent core reports.
 */
public abstract class ContentAgentException extends Exception {

    protected ContentAgentException(String message) {
        super(message);
    }

    protected ContentAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
