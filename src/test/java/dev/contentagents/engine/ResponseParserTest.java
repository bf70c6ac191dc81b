package dev.contentagents.engine;

import dev.contentagents.error.FailureKind;
import dev.contentagents.error.PayloadParseException;
import dev.contentagents.model.ExtractionResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseParserTest {

    @Test
    void parsesCleanObject() throws Exception {
        var result = ResponseParser.extract("{\"description\": \"Bright\", \"highlights\": [\"a\"]}");

        assertThat(result).isInstanceOf(ExtractionResult.Success.class);
        assertThat(result.orElseThrow().get("description").asText()).isEqualTo("Bright");
    }

    @Test
    void fencedPayloadEqualsCleanPayload() throws Exception {
        String clean = """
            [{"question": "Is it safe?", "answer": "Yes."}]""";
        String fenced = """
            ```json
            [{"question": "Is it safe?", "answer": "Yes."}]
            ```""";

        assertThat(ResponseParser.extract(fenced).orElseThrow())
            .isEqualTo(ResponseParser.extract(clean).orElseThrow());
    }

    @Test
    void bareFenceWithoutLanguageIsStripped() throws Exception {
        var result = ResponseParser.extract("```\n{\"a\": 1}\n```");

        assertThat(result.orElseThrow().get("a").asInt()).isEqualTo(1);
    }

    @Test
    void extractsPayloadSurroundedByProse() throws Exception {
        String response = """
            Sure! Here is the data you asked for:
            {"name": "GlowBoost", "price": "699"}
            Let me know if you need anything else.""";

        var payload = ResponseParser.extract(response).orElseThrow();

        assertThat(payload.get("name").asText()).isEqualTo("GlowBoost");
    }

    @Test
    void bracesInsideStringsDoNotBreakBalance() throws Exception {
        String response = "Result: {\"text\": \"use {sparingly} and \\\"never\\\" [twice]\", \"n\": 2} done";

        var payload = ResponseParser.extract(response).orElseThrow();

        assertThat(payload.get("text").asText()).isEqualTo("use {sparingly} and \"never\" [twice]");
        assertThat(payload.get("n").asInt()).isEqualTo(2);
    }

    @Test
    void skipsUnparseableSpanAndTakesNextOne() throws Exception {
        String response = "Note {not json} then [1, 2, 3]";

        var payload = ResponseParser.extract(response).orElseThrow();

        assertThat(payload.isArray()).isTrue();
        assertThat(payload).hasSize(3);
    }

    @Test
    void malformedOuterObjectDoesNotYieldInnerFragment() {
        var result = ResponseParser.extract("{\"questions\": [{\"id\":\"q1\"}], \"note\": oops}");

        assertThat(result).isInstanceOf(ExtractionResult.Failure.class);
    }

    @Test
    void truncatedOuterObjectDoesNotYieldInnerFragment() {
        var result = ResponseParser.extract("Here you go: {\"questions\": [{\"id\": \"q1\"}], \"note\": \"cut");

        assertThat(result).isInstanceOf(ExtractionResult.Failure.class);
    }

    @Test
    void backticksInsideStringValuesSurvive() throws Exception {
        String response = """
            ```json
            {"answer": "Wrap code in ```js blocks```"}
            ```""";

        var payload = ResponseParser.extract(response).orElseThrow();

        assertThat(payload.get("answer").asText()).isEqualTo("Wrap code in ```js blocks```");
    }

    @Test
    void firstBalancedSpanWins() throws Exception {
        var payload = ResponseParser.extract("A: {\"id\": 1} B: {\"id\": 2}").orElseThrow();

        assertThat(payload.get("id").asInt()).isEqualTo(1);
    }

    @Test
    void proseWithoutPayloadFails() {
        var result = ResponseParser.extract("I could not come up with any questions for this product.");

        assertThat(result).isInstanceOf(ExtractionResult.Failure.class);
        var failure = (ExtractionResult.Failure) result;
        assertThat(failure.error()).contains("No structured payload");
        assertThat(failure.rawText()).startsWith("I could not");
    }

    @Test
    void unterminatedPayloadFails() {
        var result = ResponseParser.extract("{\"faqs\": [{\"question\": \"Q\"");

        assertThat(result).isInstanceOf(ExtractionResult.Failure.class);
    }

    @Test
    void scalarJsonIsNotAPayload() {
        assertThat(ResponseParser.extract("42")).isInstanceOf(ExtractionResult.Failure.class);
        assertThat(ResponseParser.extract("\"just a string\"")).isInstanceOf(ExtractionResult.Failure.class);
    }

    @Test
    void emptyResponseFails() {
        assertThat(ResponseParser.extract("   ")).isInstanceOf(ExtractionResult.Failure.class);
        assertThat(ResponseParser.extract(null)).isInstanceOf(ExtractionResult.Failure.class);
    }

    @Test
    void failureRaisesNoStructuredPayload() {
        assertThatThrownBy(() -> ResponseParser.extract("nothing here").orElseThrow())
            .isInstanceOf(PayloadParseException.class)
            .satisfies(e -> {
                var pe = (PayloadParseException) e;
                assertThat(pe.kind()).isEqualTo(FailureKind.NO_STRUCTURED_PAYLOAD);
                assertThat(pe.rawText()).isEqualTo("nothing here");
            });
    }

    @Test
    void balancedEndRejectsMismatchedDelimiters() {
        assertThat(ResponseParser.balancedEnd("{]", 0)).isEqualTo(ResponseParser.MISMATCHED);
        assertThat(ResponseParser.balancedEnd("{[", 0)).isEqualTo(ResponseParser.UNTERMINATED);
        assertThat(ResponseParser.balancedEnd("{[]}", 0)).isEqualTo(3);
        assertThat(ResponseParser.balancedEnd("x [\"]\"] y", 2)).isEqualTo(6);
    }
}
