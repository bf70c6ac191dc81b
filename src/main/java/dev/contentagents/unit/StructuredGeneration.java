package dev.contentagents.unit;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contentagents.backend.GeneratorClient;
import dev.contentagents.backend.RetryPolicy;
import dev.contentagents.engine.PromptBuilder;
import dev.contentagents.engine.ResponseParser;
import dev.contentagents.error.GenerationException;
import dev.contentagents.error.PayloadParseException;
import dev.contentagents.model.ExtractionResult;
import dev.contentagents.model.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generate → extract for units that need a structured payload. A response without a
 * payload is re-requested with a reminder, up to {@code parseAttempts} responses in total.
 */
public final class StructuredGeneration {

    private static final Logger log = LoggerFactory.getLogger(StructuredGeneration.class);

    private final GeneratorClient client;
    private final RetryPolicy retryPolicy;
    private final int parseAttempts;

    public StructuredGeneration(GeneratorClient client, RetryPolicy retryPolicy, int parseAttempts) {
        if (parseAttempts < 1) {
            throw new IllegalArgumentException("parseAttempts must be >= 1: " + parseAttempts);
        }
        this.client = client;
        this.retryPolicy = retryPolicy;
        this.parseAttempts = parseAttempts;
    }

    public JsonNode request(GenerationRequest request, UnitContext context)
            throws GenerationException, PayloadParseException {
        GenerationRequest current = request.withSystemPrompt(
            PromptBuilder.withJsonInstructions(request.systemPrompt(), request.shapeHint()));
        log.debug("Prompt for '{}':\n{}", request.label(), current.prompt());

        ExtractionResult result = null;
        for (int attempt = 1; attempt <= parseAttempts; attempt++) {
            String text = client.generate(current, retryPolicy, context.cancelled());
            result = ResponseParser.extract(text);
            if (result instanceof ExtractionResult.Success) {
                return result.orElseThrow();
            }
            ExtractionResult.Failure failure = (ExtractionResult.Failure) result;
            log.warn("Response for '{}' had no structured payload (attempt {}/{})",
                request.label(), attempt, parseAttempts);
            current = current.withPrompt(
                PromptBuilder.buildReminderPrompt(request.prompt(), failure.error(), request.shapeHint()));
        }
        return result.orElseThrow();
    }
}
