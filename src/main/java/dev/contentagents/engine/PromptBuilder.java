package dev.contentagents.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contentagents.model.ShapeHint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the prompts sent to the generator: product fact blocks, the JSON-only
 * instruction block for structured requests, and the reminder sent when a response
 * carried no structured payload.
 */
public final class PromptBuilder {

    private static final Map<String, String> FACT_LABELS = Map.of(
        "name", "Name",
        "concentration", "Concentration",
        "skin_type", "Skin Type",
        "key_ingredients", "Ingredients",
        "benefits", "Benefits",
        "how_to_use", "Usage",
        "side_effects", "Side Effects",
        "price", "Price"
    );

    private static final List<String> FACT_ORDER = List.of(
        "name", "concentration", "skin_type", "key_ingredients", "benefits", "how_to_use", "side_effects", "price");

    private PromptBuilder() {}

    /**
     * Append the structured-output instructions to a system prompt. Text requests are
     * returned unchanged.
     */
    public static String withJsonInstructions(String systemPrompt, ShapeHint shape) {
        if (shape == ShapeHint.TEXT) {
            return systemPrompt;
        }
        var sb = new StringBuilder();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            sb.append(systemPrompt).append("\n\n");
        }
        sb.append("CRITICAL INSTRUCTIONS:\n");
        sb.append("1. Respond with ONLY valid JSON\n");
        sb.append("2. Do NOT include any text before or after the JSON\n");
        sb.append("3. Do NOT use markdown code blocks\n");
        sb.append(shape == ShapeHint.ARRAY
            ? "4. Start your response with [ and end with ]"
            : "4. Start your response with { and end with }");
        return sb.toString();
    }

    /**
     * Render a product payload as labelled lines, one per known field, lists joined by
     * commas.
     */
    public static String productFacts(JsonNode product) {
        var sb = new StringBuilder();
        for (String field : FACT_ORDER) {
            JsonNode value = product.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            sb.append(FACT_LABELS.get(field)).append(": ").append(render(value)).append("\n");
        }
        return sb.toString().stripTrailing();
    }

    /**
     * Build the follow-up prompt for a response that contained no structured payload.
     */
    public static String buildReminderPrompt(String originalPrompt, String errorDetails, ShapeHint shape) {
        var sb = new StringBuilder();
        sb.append(originalPrompt);
        sb.append("\n\nYour previous response did not contain the required JSON.\n");
        sb.append("Error: ").append(errorDetails).append("\n\n");
        sb.append(shape == ShapeHint.ARRAY
            ? "Respond with ONLY the JSON array, nothing else."
            : "Respond with ONLY the JSON object, nothing else.");
        return sb.toString();
    }

    static String render(JsonNode value) {
        if (!value.isArray()) {
            return value.asText();
        }
        List<String> parts = new ArrayList<>();
        value.forEach(v -> parts.add(v.asText()));
        return String.join(", ", parts);
    }
}
