package dev.contentagents.model;

/**
 * A single logical request to the text-generation provider.
 */
public record GenerationRequest(
    String label,
    String systemPrompt, // nullable
    String prompt,
    ShapeHint shapeHint,
    int maxTokens
) {
    public static final int DEFAULT_MAX_TOKENS = 2000;

    public static GenerationRequest of(String label, String systemPrompt, String prompt, ShapeHint shapeHint) {
        return new GenerationRequest(label, systemPrompt, prompt, shapeHint, DEFAULT_MAX_TOKENS);
    }

    public GenerationRequest withSystemPrompt(String newSystemPrompt) {
        return new GenerationRequest(label, newSystemPrompt, prompt, shapeHint, maxTokens);
    }

    public GenerationRequest withPrompt(String newPrompt) {
        return new GenerationRequest(label, systemPrompt, newPrompt, shapeHint, maxTokens);
    }

    public GenerationRequest withMaxTokens(int tokens) {
        return new GenerationRequest(label, systemPrompt, prompt, shapeHint, tokens);
    }
}
