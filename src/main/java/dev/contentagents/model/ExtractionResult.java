package dev.contentagents.model;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contentagents.error.PayloadParseException;

/**
 * Result of extracting a structured payload from generator text.
 */
public sealed interface ExtractionResult {

    record Success(JsonNode payload) implements ExtractionResult {}

    record Failure(String error, String rawText) implements ExtractionResult {}

    default JsonNode orElseThrow() throws PayloadParseException {
        if (this instanceof Success success) {
            return success.payload();
        }
        Failure failure = (Failure) this;
        throw new PayloadParseException(failure.error(), failure.rawText());
    }
}
