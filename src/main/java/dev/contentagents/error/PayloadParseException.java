package dev.contentagents.error;

/**
 * No structured payload could be recovered from generator text.
 */
public class PayloadParseException extends UnitFailureException {

    private final String rawText;

    public PayloadParseException(String message, String rawText) {
        super(FailureKind.NO_STRUCTURED_PAYLOAD, message);
        this.rawText = rawText;
    }

    /** The response text that failed to parse, kept for diagnostics. */
    public String rawText() {
        return rawText;
    }
}
