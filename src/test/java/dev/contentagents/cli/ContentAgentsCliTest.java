package dev.contentagents.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.contentagents.backend.ScriptedBackend;
import dev.contentagents.unit.ContentFixtures;
import dev.contentagents.unit.FaqUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ContentAgentsCliTest {

    private static final Map<String, String> ENV = Map.of("GROQ_API_KEY", "test-key");

    @TempDir
    Path dir;

    private ScriptedBackend backend;
    private AtomicInteger backendsCreated;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        backend = ContentFixtures.happyBackend();
        backendsCreated = new AtomicInteger();
        out = new StringWriter();
        err = new StringWriter();
    }

    private int execute(Map<String, String> env, String... args) {
        var cli = new ContentAgentsCli((settings, apiKey) -> {
            backendsCreated.incrementAndGet();
            return backend;
        }, env::get);
        var commandLine = new CommandLine(cli);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private int execute(String... args) {
        String[] fast = new String[args.length + 4];
        fast[0] = "--min-interval-ms=0";
        fast[1] = "--timeout-ms=0";
        fast[2] = "--output-dir=" + dir.resolve("out");
        fast[3] = "--base-delay-ms=1";
        System.arraycopy(args, 0, fast, 4, args.length);
        return execute(ENV, fast);
    }

    @Test
    void dryRunPrintsPlanWithoutGenerating() {
        int exit = execute(Map.of(), "--dry-run");

        assertThat(exit).isZero();
        assertThat(out.toString())
            .contains("Dispatch order:")
            .contains("  parser\n")
            .contains("faq <- parser, questions")
            .contains("comparison_page.json");
        assertThat(out.toString().indexOf("questions <-")).isLessThan(out.toString().indexOf("faq <-"));
        assertThat(backendsCreated).hasValue(0);
    }

    @Test
    void missingApiKeyIsAnError() {
        int exit = execute(Map.of(), "--output-dir=" + dir);

        assertThat(exit).isEqualTo(ContentAgentsCli.EXIT_ERROR);
        assertThat(err.toString()).contains("GROQ_API_KEY");
        assertThat(backendsCreated).hasValue(0);
    }

    @Test
    void successfulRunWritesAllPages() throws Exception {
        int exit = execute();

        assertThat(exit).isEqualTo(ContentAgentsCli.EXIT_OK);
        Path outDir = dir.resolve("out");
        assertThat(outDir.resolve("faq.json")).exists();
        assertThat(outDir.resolve("product_page.json")).exists();
        assertThat(outDir.resolve("comparison_page.json")).exists();
        assertThat(outDir.resolve("run_report.json")).doesNotExist();
        var faq = new ObjectMapper().readTree(outDir.resolve("faq.json").toFile());
        assertThat(faq.get("product_name").asText()).isEqualTo("GlowBoost Vitamin C Serum");
        assertThat(out.toString()).contains("[OK]      faq -> faq.json");
    }

    @Test
    void partialFailureWritesSurvivingPagesAndReport() {
        backend.reply(FaqUnit.NAME, ContentFixtures.faqs(14));

        int exit = execute("--report");

        assertThat(exit).isEqualTo(ContentAgentsCli.EXIT_INCOMPLETE);
        Path outDir = dir.resolve("out");
        assertThat(outDir.resolve("faq.json")).doesNotExist();
        assertThat(outDir.resolve("product_page.json")).exists();
        assertThat(outDir.resolve("run_report.json")).exists();
        assertThat(out.toString()).contains("[FAILED]  faq: SCHEMA_VIOLATION");
    }

    @Test
    void datasetProductIsSelectedByIndex() throws Exception {
        Path dataset = dir.resolve("products.json");
        Files.writeString(dataset, """
            {"products": [
              {"name": "Ignored"},
              {
                "name": "HydraCalm Gel",
                "concentration": "2% Niacinamide",
                "skin_type": "Sensitive, Dry",
                "key_ingredients": ["Niacinamide", "Aloe Vera"],
                "benefits": ["Soothing"],
                "how_to_use": "Apply twice daily",
                "side_effects": "None known",
                "price": "₹549"
              }
            ]}""");

        int exit = execute("--dataset=" + dataset, "--product-index=1");

        assertThat(exit).isEqualTo(ContentAgentsCli.EXIT_OK);
        var faq = new ObjectMapper().readTree(dir.resolve("out/faq.json").toFile());
        assertThat(faq.get("product_name").asText()).isEqualTo("HydraCalm Gel");
    }

    @Test
    void badProductIndexIsAnError() {
        int exit = execute("--product-index=4");

        assertThat(exit).isEqualTo(ContentAgentsCli.EXIT_ERROR);
        assertThat(err.toString()).contains("out of bounds");
        assertThat(backendsCreated).hasValue(0);
    }

    @Test
    void negativeDurationsAreReportedAsErrors() {
        int timeoutExit = execute(ENV, "--timeout-ms=-1", "--output-dir=" + dir.resolve("out"));
        int delayExit = execute(ENV, "--base-delay-ms=-1", "--output-dir=" + dir.resolve("out"));

        assertThat(timeoutExit).isEqualTo(ContentAgentsCli.EXIT_ERROR);
        assertThat(delayExit).isEqualTo(ContentAgentsCli.EXIT_ERROR);
        assertThat(err.toString())
            .contains("Error: callTimeoutMillis must be >= 0: -1")
            .contains("Error: baseDelayMillis must be >= 0: -1");
        assertThat(backendsCreated).hasValue(0);
    }

    @Test
    void unreadableConfigIsAnError() {
        int exit = execute("--config=" + dir.resolve("missing-settings.json"));

        assertThat(exit).isEqualTo(ContentAgentsCli.EXIT_ERROR);
        assertThat(err.toString()).startsWith("Error:");
    }

    @Test
    void configFileFeedsSettingsAndCliOverridesIt() throws Exception {
        Path config = dir.resolve("settings.json");
        Files.writeString(config, "{\"apiKeyEnv\": \"CUSTOM_KEY\", \"model\": \"from-file\"}");

        int exit = execute(Map.of(), "--config=" + config, "--model=from-cli", "--dry-run");

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("Model: from-cli @ ");
    }
}
