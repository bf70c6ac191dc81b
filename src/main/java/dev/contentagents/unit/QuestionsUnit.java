package dev.contentagents.unit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.contentagents.engine.OutputValidator;
import dev.contentagents.engine.PromptBuilder;
import dev.contentagents.error.UnitFailureException;
import dev.contentagents.model.GenerationRequest;
import dev.contentagents.model.ShapeHint;
import dev.contentagents.model.ValidatedOutput;

import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Generates categorized customer questions about the product.
 */
public record QuestionsUnit(StructuredGeneration generation, int minQuestions) implements ContentUnit {

    public static final String NAME = "questions";

    static final String SYSTEM_PROMPT =
        "You are a customer research specialist. Write the questions real shoppers ask about a product.";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> dependencies() {
        return List.of(ParserUnit.NAME);
    }

    @Override
    public ValidatedOutput execute(UnitContext context) throws UnitFailureException {
        JsonNode product = context.dependency(ParserUnit.NAME);
        String prompt = """
            Generate at least %d distinct customer questions about this product:

            %s

            Use these categories: %s.
            Return a JSON array with this structure:
            [
              {"id": "q1", "text": "question text", "category": "INFORMATIONAL"},
              ...
            ]""".formatted(minQuestions, PromptBuilder.productFacts(product),
                String.join(", ", new TreeSet<>(ContentSchemas.QUESTION_CATEGORIES)));

        JsonNode payload = generation.request(
            GenerationRequest.of(NAME, SYSTEM_PROMPT, prompt, ShapeHint.ARRAY), context);

        ObjectNode output = JsonNodeFactory.instance.objectNode();
        output.set("questions", normalize(PageTemplates.unwrapList(payload, "questions")));
        return OutputValidator.validate(output, ContentSchemas.questions(minQuestions));
    }

    // ids are positional when the generator omits them; categories are upper-cased
    static JsonNode normalize(JsonNode questions) {
        if (!questions.isArray()) {
            return questions;
        }
        ArrayNode result = JsonNodeFactory.instance.arrayNode();
        for (int i = 0; i < questions.size(); i++) {
            JsonNode entry = questions.get(i);
            if (!entry.isObject()) {
                result.add(entry);
                continue;
            }
            ObjectNode question = entry.deepCopy();
            if (!question.hasNonNull("id")) {
                question.put("id", "q" + (i + 1));
            }
            JsonNode category = question.get("category");
            if (category != null && category.isTextual()) {
                question.put("category", category.asText().trim().toUpperCase(Locale.ROOT));
            }
            result.add(question);
        }
        return result;
    }
}
