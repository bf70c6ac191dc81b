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
 * Builds the product page from the parsed product plus a generated description.
 */
public record ProductUnit(StructuredGeneration generation) implements ContentUnit {

    public static final String NAME = "product";

    static final String SYSTEM_PROMPT = "You are a product copywriter. Describe products factually.";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> dependencies() {
        return List.of(ParserUnit.NAME);
    }

    @Override
    public Optional<String> artifactFile() {
        return Optional.of("product_page.json");
    }

    @Override
    public ValidatedOutput execute(UnitContext context) throws UnitFailureException {
        JsonNode product = context.dependency(ParserUnit.NAME);
        String prompt = """
            Write product page copy for this product:

            %s

            Return a JSON object with this structure:
            {
              "description": "2-3 sentence description",
              "highlights": ["short highlight", "..."]
            }""".formatted(PromptBuilder.productFacts(product));

        JsonNode generated = generation.request(
            GenerationRequest.of(NAME, SYSTEM_PROMPT, prompt, ShapeHint.OBJECT).withMaxTokens(800), context);
        return OutputValidator.validate(PageTemplates.productPage(product, generated), ContentSchemas.PRODUCT);
    }
}
