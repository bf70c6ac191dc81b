package dev.contentagents.unit;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contentagents.engine.OutputValidator;
import dev.contentagents.engine.PromptBuilder;
import dev.contentagents.error.UnitFailureException;
import dev.contentagents.model.GenerationRequest;
import dev.contentagents.model.ShapeHint;
import dev.contentagents.model.ValidatedOutput;

import java.util.List;
import java.util.Optional;

/**
 * Answers the generated questions and assembles the FAQ page.
 */
public record FaqUnit(StructuredGeneration generation, int minFaqCount) implements ContentUnit {

    public static final String NAME = "faq";

    static final String SYSTEM_PROMPT = """
        You are a skincare product expert and customer service specialist.
        Answer questions helpfully and accurately, using only the product data given (2-4 sentences each).""";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> dependencies() {
        return List.of(ParserUnit.NAME, QuestionsUnit.NAME);
    }

    @Override
    public Optional<String> artifactFile() {
        return Optional.of("faq.json");
    }

    @Override
    public ValidatedOutput execute(UnitContext context) throws UnitFailureException {
        JsonNode product = context.dependency(ParserUnit.NAME);
        JsonNode questions = context.dependency(QuestionsUnit.NAME).get("questions");

        var numbered = new StringBuilder();
        for (int i = 0; i < questions.size(); i++) {
            JsonNode q = questions.get(i);
            numbered.append(i + 1).append(". [").append(q.path("category").asText()).append("] ")
                .append(q.path("text").asText()).append("\n");
        }

        String prompt = """
            Generate FAQ answers for this product:

            %s

            Questions to answer:
            %s
            Return a JSON array with one entry per question:
            [
              {"question": "exact question text", "answer": "answer based on the product data"},
              ...
            ]""".formatted(PromptBuilder.productFacts(product), numbered);

        JsonNode payload = generation.request(
            GenerationRequest.of(NAME, SYSTEM_PROMPT, prompt, ShapeHint.ARRAY), context);
        JsonNode page = PageTemplates.faqPage(product.path("name").asText(), PageTemplates.unwrapList(payload, "faqs"));
        return OutputValidator.validate(page, ContentSchemas.faq(minFaqCount));
    }
}
