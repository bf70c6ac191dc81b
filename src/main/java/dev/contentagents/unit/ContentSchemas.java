package dev.contentagents.unit;

import dev.contentagents.model.ArtifactSchema;
import dev.contentagents.model.FieldSpec;

import java.util.Set;

/**
 * Artifact schemas of the content pipeline.
 */
public final class ContentSchemas {

    public static final Set<String> QUESTION_CATEGORIES =
        Set.of("INFORMATIONAL", "USAGE", "SAFETY", "PURCHASE", "COMPARISON");

    public static final ArtifactSchema PARSED_PRODUCT = productSchema("parsed_product");

    /** A fictional competitor has the same shape as a parsed product. */
    public static final ArtifactSchema COMPETITOR = productSchema("competitor_product");

    public static final ArtifactSchema PRODUCT = ArtifactSchema.builder("product")
        .field(FieldSpec.string("page_type").constant("product"))
        .field(FieldSpec.mapping("sections", ArtifactSchema.builder("product.sections")
            .strings("name", "description")
            .field(FieldSpec.list("benefits").minCount(1).ofStrings())
            .field(FieldSpec.string("usage"))
            .field(FieldSpec.list("ingredients").minCount(1).ofStrings())
            .field(FieldSpec.string("price"))
            .field(FieldSpec.list("highlights").ofStrings().optional())
            .build()))
        .build();

    public static final ArtifactSchema COMPARISON_METRICS = ArtifactSchema.builder("comparison_metrics")
        .field(FieldSpec.mapping("ingredient_comparison", ArtifactSchema.builder("ingredient_comparison")
            .field(FieldSpec.list("common").ofStrings())
            .field(FieldSpec.list("unique_to_a").ofStrings())
            .field(FieldSpec.list("unique_to_b").ofStrings())
            .strings("analysis")
            .build()))
        .field(FieldSpec.mapping("price_comparison", ArtifactSchema.builder("price_comparison")
            .strings("price_difference", "value_assessment")
            .build()))
        .field(FieldSpec.mapping("effectiveness_comparison", null).optional())
        .field(FieldSpec.string("recommendation"))
        .build();

    public static final ArtifactSchema COMPARISON = ArtifactSchema.builder("comparison")
        .field(FieldSpec.string("page_type").constant("comparison"))
        .field(FieldSpec.list("products").exactCount(2).of(ArtifactSchema.builder("comparison.product")
            .strings("name", "price")
            .field(FieldSpec.list("key_ingredients").ofStrings())
            .field(FieldSpec.list("benefits").ofStrings())
            .build()))
        .field(FieldSpec.mapping("comparison_metrics", COMPARISON_METRICS))
        .build();

    private ContentSchemas() {}

    public static ArtifactSchema questions(int minQuestions) {
        return ArtifactSchema.builder("questions")
            .field(FieldSpec.list("questions").minCount(minQuestions).of(ArtifactSchema.builder("question")
                .strings("id", "text")
                .field(FieldSpec.string("category").oneOf(QUESTION_CATEGORIES))
                .build()))
            .build();
    }

    public static ArtifactSchema faq(int minFaqCount) {
        return ArtifactSchema.builder("faq")
            .field(FieldSpec.string("page_type").constant("faq"))
            .field(FieldSpec.string("product_name"))
            .field(FieldSpec.list("faqs").minCount(minFaqCount).of(ArtifactSchema.builder("faq.entry")
                .strings("question", "answer")
                .build()))
            .build();
    }

    private static ArtifactSchema productSchema(String name) {
        return ArtifactSchema.builder(name)
            .strings("name", "concentration")
            .field(FieldSpec.list("skin_type").minCount(1).ofStrings())
            .field(FieldSpec.list("key_ingredients").minCount(1).ofStrings())
            .field(FieldSpec.list("benefits").minCount(1).ofStrings())
            .strings("how_to_use", "side_effects", "price")
            .build();
    }
}
