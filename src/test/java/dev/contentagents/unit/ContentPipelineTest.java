package dev.contentagents.unit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.contentagents.backend.FakeTimeSource;
import dev.contentagents.backend.ScriptedBackend;
import dev.contentagents.engine.ArtifactWriter;
import dev.contentagents.error.FailureKind;
import dev.contentagents.error.GenerationException;
import dev.contentagents.model.InputRecord;
import dev.contentagents.model.RunResult;
import dev.contentagents.model.RunSettings;
import dev.contentagents.model.SkipReason;
import dev.contentagents.model.TraceEvent;
import dev.contentagents.model.UnitOutcome;
import dev.contentagents.model.ValidatedOutput;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dev.contentagents.unit.ContentFixtures.faqs;
import static dev.contentagents.unit.ContentFixtures.happyBackend;
import static dev.contentagents.unit.ContentFixtures.product;
import static org.assertj.core.api.Assertions.assertThat;

class ContentPipelineTest {

    private static final RunSettings SETTINGS = RunSettings.defaults().withCallTimeoutMillis(0);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-01T12:00:00Z"), ZoneOffset.UTC);

    private static RunResult run(ScriptedBackend backend) throws Exception {
        return run(backend, product());
    }

    private static RunResult run(ScriptedBackend backend, InputRecord input) throws Exception {
        try (var pipeline = new ContentPipeline(SETTINGS, backend, new FakeTimeSource(), CLOCK)) {
            return pipeline.run(input);
        }
    }

    @Test
    void allUnitsSucceedInDependencyOrder() throws Exception {
        RunResult result = run(happyBackend());

        assertThat(result.allSucceeded()).isTrue();
        assertThat(result.dispatchOrder()).containsExactly("parser", "questions", "product", "comparison", "faq");
        assertThat(result.trace()).extracting(e -> e.unit() + ":" + e.state()).containsExactly(
            "parser:DISPATCHED", "parser:SUCCEEDED",
            "questions:DISPATCHED", "product:DISPATCHED", "comparison:DISPATCHED",
            "questions:SUCCEEDED", "product:SUCCEEDED", "comparison:SUCCEEDED",
            "faq:DISPATCHED", "faq:SUCCEEDED");
    }

    @Test
    void repeatedRunsRecordTheSameTrace() throws Exception {
        List<TraceEvent> first = run(happyBackend()).trace();

        for (int i = 0; i < 50; i++) {
            assertThat(run(happyBackend()).trace()).isEqualTo(first);
        }
    }

    @Test
    void pagesAreAssembledFromProductDataAndGeneratedText() throws Exception {
        RunResult result = run(happyBackend());
        Map<String, ValidatedOutput> outputs = result.succeeded();

        JsonNode faq = outputs.get("faq").payload();
        assertThat(faq.get("page_type").asText()).isEqualTo("faq");
        assertThat(faq.get("product_name").asText()).isEqualTo("GlowBoost Vitamin C Serum");
        assertThat(faq.get("faqs")).hasSize(15);

        JsonNode sections = outputs.get("product").payload().get("sections");
        assertThat(sections.get("usage").asText()).isEqualTo("Apply 2-3 drops in the morning before sunscreen");
        assertThat(sections.get("ingredients")).hasSize(2);
        assertThat(sections.get("description").asText()).startsWith("A lightweight");
        assertThat(sections.get("highlights")).hasSize(2);

        JsonNode comparison = outputs.get("comparison").payload();
        assertThat(comparison.get("products").get(0).get("name").asText()).isEqualTo("GlowBoost Vitamin C Serum");
        assertThat(comparison.get("products").get(1).get("name").asText()).isEqualTo("RadiantC Daily Serum");
        assertThat(comparison.get("comparison_metrics").get("recommendation").asText()).contains("oily skin");
    }

    @Test
    void faqOneShortOfMinimumFailsAloneWhileOthersSucceed() throws Exception {
        RunResult result = run(happyBackend().reply(FaqUnit.NAME, faqs(14)));

        assertThat(result.succeeded()).containsOnlyKeys("parser", "questions", "product", "comparison");
        assertThat(result.failed().get("faq").kind()).isEqualTo(FailureKind.SCHEMA_VIOLATION);
        assertThat(result.failed().get("faq").message()).contains("'faqs'").contains("14 entries");
    }

    @Test
    void identicalRunsProduceIdenticalArtifacts() throws Exception {
        Map<String, String> first = rendered(run(happyBackend()));
        Map<String, String> second = rendered(run(happyBackend()));

        assertThat(first).containsOnlyKeys("parser", "questions", "product", "comparison", "faq");
        assertThat(second).isEqualTo(first);
    }

    private static Map<String, String> rendered(RunResult result) throws Exception {
        var rendered = new LinkedHashMap<String, String>();
        for (var entry : result.succeeded().entrySet()) {
            rendered.put(entry.getKey(), ArtifactWriter.render(entry.getValue()));
        }
        return rendered;
    }

    @Test
    void proseReplyIsRequestedAgainWithReminder() throws Exception {
        var backend = happyBackend()
            .thenReply(QuestionsUnit.NAME, "Here are some great questions customers might ask!");

        RunResult result = run(backend);

        assertThat(result.allSucceeded()).isTrue();
        assertThat(backend.callCount(QuestionsUnit.NAME)).isEqualTo(2);
        var retry = backend.calls().stream()
            .filter(c -> c.label().equals(QuestionsUnit.NAME))
            .skip(1).findFirst().orElseThrow();
        assertThat(retry.prompt()).contains("Your previous response did not contain the required JSON.");
        assertThat(retry.systemPrompt()).contains("CRITICAL INSTRUCTIONS:");
    }

    @Test
    void persistentProseFailsQuestionsAndSkipsFaq() throws Exception {
        var backend = happyBackend().reply(QuestionsUnit.NAME, "I would rather not answer in JSON.");

        RunResult result = run(backend);

        assertThat(result.failed().get("questions").kind()).isEqualTo(FailureKind.NO_STRUCTURED_PAYLOAD);
        assertThat(result.outcome("faq")).isEqualTo(new UnitOutcome.Skipped(SkipReason.UNREACHABLE, "questions"));
        assertThat(result.succeeded()).containsOnlyKeys("parser", "product", "comparison");
        assertThat(backend.callCount(QuestionsUnit.NAME)).isEqualTo(SETTINGS.parseAttempts());
        assertThat(backend.callCount(FaqUnit.NAME)).isZero();
    }

    @Test
    void exhaustedRateLimitFailsOnlyComparison() throws Exception {
        var backend = happyBackend();
        for (int i = 0; i < SETTINGS.maxRetries(); i++) {
            backend.thenFail(ComparisonUnit.COMPETITOR_LABEL, GenerationException.rateLimited("429 Too Many Requests"));
        }

        RunResult result = run(backend);

        assertThat(result.failed()).containsOnlyKeys("comparison");
        assertThat(result.failed().get("comparison").kind()).isEqualTo(FailureKind.RATE_LIMIT_EXHAUSTED);
        assertThat(result.succeeded()).containsOnlyKeys("parser", "questions", "product", "faq");
        assertThat(backend.callCount(ComparisonUnit.COMPETITOR_LABEL)).isEqualTo(3);
        assertThat(backend.callCount(ComparisonUnit.METRICS_LABEL)).isZero();
    }

    @Test
    void incompleteCompetitorIsRejectedRatherThanFilledIn() throws Exception {
        ObjectNode competitor = (ObjectNode) ContentFixtures.MAPPER.readTree(ContentFixtures.COMPETITOR);
        competitor.remove("side_effects");
        var backend = happyBackend().reply(ComparisonUnit.COMPETITOR_LABEL, competitor.toString());

        RunResult result = run(backend);

        assertThat(result.failed().get("comparison").kind()).isEqualTo(FailureKind.SCHEMA_VIOLATION);
        assertThat(result.failed().get("comparison").message()).contains("side_effects");
        assertThat(backend.callCount(ComparisonUnit.METRICS_LABEL)).isZero();
    }

    @Test
    void invalidInputSkipsEverythingDownstream() throws Exception {
        ObjectNode record = product().asJson();
        record.remove("name");
        var backend = happyBackend();

        RunResult result = run(backend, new InputRecord(record));

        assertThat(result.failed().get("parser").kind()).isEqualTo(FailureKind.SCHEMA_VIOLATION);
        assertThat(result.skipped()).containsOnlyKeys("questions", "product", "comparison", "faq");
        assertThat(result.skipped().values()).allMatch(s -> "parser".equals(s.cause()));
        assertThat(backend.calls()).isEmpty();
    }

    @Test
    void unitsExposeTheirArtifactFiles() {
        try (var pipeline = new ContentPipeline(SETTINGS, happyBackend())) {
            var files = new LinkedHashMap<String, String>();
            pipeline.units().forEach(u -> u.artifactFile().ifPresent(f -> files.put(u.name(), f)));

            assertThat(files).containsExactly(
                Map.entry("product", "product_page.json"),
                Map.entry("comparison", "comparison_page.json"),
                Map.entry("faq", "faq.json"));
        }
    }
}
