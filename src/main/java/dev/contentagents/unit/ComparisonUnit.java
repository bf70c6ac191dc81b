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
 * Invents a fictional competitor, then generates comparison metrics against it.
 * The competitor must satisfy the product schema on its own; no fields are defaulted.
 */
public record ComparisonUnit(StructuredGeneration generation) implements ContentUnit {

    public static final String NAME = "comparison";
    public static final String COMPETITOR_LABEL = "comparison.competitor";
    public static final String METRICS_LABEL = "comparison.metrics";

    static final String COMPETITOR_SYSTEM_PROMPT =
        "You are a product data specialist. Create realistic fictional competitor products for comparison.";
    static final String METRICS_SYSTEM_PROMPT =
        "You are a product comparison expert. Analyze and compare products objectively.";

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
        return Optional.of("comparison_page.json");
    }

    @Override
    public ValidatedOutput execute(UnitContext context) throws UnitFailureException {
        JsonNode productA = context.dependency(ParserUnit.NAME);

        String competitorPrompt = """
            Given this real product:
            %s

            Create a fictional competitor product (Product B) with this exact JSON structure:
            {
              "name": "fictional product name",
              "concentration": "concentration of a similar active ingredient",
              "skin_type": ["skin types"],
              "key_ingredients": ["3-4 ingredients"],
              "benefits": ["2-3 benefits"],
              "how_to_use": "usage instructions",
              "side_effects": "potential side effects",
              "price": "price, 15-30%% different"
            }""".formatted(PromptBuilder.productFacts(productA));
        JsonNode competitor = generation.request(
            GenerationRequest.of(COMPETITOR_LABEL, COMPETITOR_SYSTEM_PROMPT, competitorPrompt, ShapeHint.OBJECT)
                .withMaxTokens(800), context);
        JsonNode productB = OutputValidator.validate(competitor, ContentSchemas.COMPETITOR).payload();

        String metricsPrompt = """
            Compare these two products.

            Product A:
            %s

            Product B:
            %s

            Return a JSON object with this structure:
            {
              "ingredient_comparison": {
                "common": ["shared ingredients"],
                "unique_to_a": ["ingredients only in A"],
                "unique_to_b": ["ingredients only in B"],
                "analysis": "2 sentence comparison"
              },
              "price_comparison": {
                "price_difference": "amount and percentage",
                "value_assessment": "which offers better value and why"
              },
              "effectiveness_comparison": {
                "concentration_analysis": "comparison of active concentrations",
                "benefit_overlap": ["shared benefits"]
              },
              "recommendation": "which product suits which skin type better"
            }""".formatted(PromptBuilder.productFacts(productA), PromptBuilder.productFacts(productB));
        JsonNode metrics = generation.request(
            GenerationRequest.of(METRICS_LABEL, METRICS_SYSTEM_PROMPT, metricsPrompt, ShapeHint.OBJECT)
                .withMaxTokens(1200), context);

        return OutputValidator.validate(
            PageTemplates.comparisonPage(productA, productB, metrics), ContentSchemas.COMPARISON);
    }
}
