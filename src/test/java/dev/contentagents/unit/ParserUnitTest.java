package dev.contentagents.unit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.contentagents.error.SchemaViolationException;
import dev.contentagents.model.InputRecord;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static dev.contentagents.unit.ContentFixtures.MAPPER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserUnitTest {

    private static UnitContext contextFor(InputRecord input) {
        return new UnitContext(ParserUnit.NAME, input, Map.of(), () -> false);
    }

    @Test
    void passesWellFormedRecordThrough() throws Exception {
        var output = new ParserUnit().execute(contextFor(ContentFixtures.product()));

        assertThat(output.schema()).isEqualTo("parsed_product");
        assertThat(output.payload()).isEqualTo(ContentFixtures.product().asJson());
    }

    @Test
    void splitsCommaSeparatedListsAndTrimsText() throws Exception {
        ObjectNode record = ContentFixtures.product().asJson();
        record.put("name", "  GlowBoost Vitamin C Serum ");
        record.put("skin_type", "Oily, Combination ,");
        record.putArray("benefits").add(" Brightening ").add("Fades dark spots");
        record.put("price", 699);

        JsonNode parsed = new ParserUnit().execute(contextFor(new InputRecord(record))).payload();

        assertThat(parsed.get("name").asText()).isEqualTo("GlowBoost Vitamin C Serum");
        assertThat(parsed.get("skin_type")).extracting(JsonNode::asText).containsExactly("Oily", "Combination");
        assertThat(parsed.get("benefits").get(0).asText()).isEqualTo("Brightening");
        assertThat(parsed.get("price").isTextual()).isTrue();
        assertThat(parsed.get("price").asText()).isEqualTo("699");
    }

    @Test
    void dropsFieldsOutsideTheProductShape() throws Exception {
        ObjectNode record = ContentFixtures.product().asJson();
        record.put("internal_sku", "GB-001");

        JsonNode parsed = new ParserUnit().execute(contextFor(new InputRecord(record))).payload();

        assertThat(parsed.has("internal_sku")).isFalse();
    }

    @Test
    void rejectsRecordWithEmptyIngredientList() {
        ObjectNode record = ContentFixtures.product().asJson();
        record.putArray("key_ingredients");

        assertThatThrownBy(() -> new ParserUnit().execute(contextFor(new InputRecord(record))))
            .isInstanceOf(SchemaViolationException.class)
            .hasMessageContaining("key_ingredients");
    }

    @Test
    void rejectsRecordWithWrongType() throws Exception {
        ObjectNode record = (ObjectNode) MAPPER.readTree("{\"name\": {\"first\": \"Glow\"}}");

        assertThatThrownBy(() -> new ParserUnit().execute(contextFor(new InputRecord(record))))
            .isInstanceOf(SchemaViolationException.class)
            .satisfies(e -> assertThat(((SchemaViolationException) e).path()).isEqualTo("name"));
    }

    @Test
    void hasNoDependenciesAndNoArtifact() {
        var parser = new ParserUnit();

        assertThat(parser.dependencies()).isEmpty();
        assertThat(parser.artifactFile()).isEmpty();
    }
}
