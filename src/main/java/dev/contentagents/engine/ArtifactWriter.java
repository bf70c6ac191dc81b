package dev.contentagents.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.contentagents.model.RunResult;
import dev.contentagents.model.TraceEvent;
import dev.contentagents.model.UnitOutcome;
import dev.contentagents.model.ValidatedOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Persists succeeded artifacts as pretty-printed UTF-8 JSON.
 */
public final class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    public static final String REPORT_FILE = "run_report.json";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path outputDir;

    public ArtifactWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * Write the output of every succeeded unit that has a file name in {@code files}.
     * Units that did not succeed are left out; no placeholder file is written for them.
     *
     * @param files unit name to artifact file name
     * @return the written paths, in result order
     */
    public List<Path> writeArtifacts(RunResult result, Map<String, String> files) throws IOException {
        Files.createDirectories(outputDir);
        var written = new ArrayList<Path>();
        for (var entry : result.succeeded().entrySet()) {
            String file = files.get(entry.getKey());
            if (file == null) {
                continue;
            }
            written.add(write(file, entry.getValue()));
        }
        return written;
    }

    public Path write(String file, ValidatedOutput output) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(file);
        Files.writeString(target, render(output), StandardCharsets.UTF_8);
        log.info("Wrote {}", target);
        return target;
    }

    /** Pretty JSON with a trailing newline. Identical outputs render to identical bytes. */
    public static String render(ValidatedOutput output) throws IOException {
        return MAPPER.writeValueAsString(output.payload()) + "\n";
    }

    public Path writeReport(RunResult result) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(REPORT_FILE);
        Files.writeString(target, MAPPER.writeValueAsString(report(result)) + "\n", StandardCharsets.UTF_8);
        log.info("Wrote {}", target);
        return target;
    }

    static ObjectNode report(RunResult result) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("cancelled", result.cancelled());
        root.put("all_succeeded", result.allSucceeded());

        ObjectNode units = root.putObject("units");
        result.outcomes().forEach((name, outcome) -> units.set(name, describe(outcome)));

        ArrayNode trace = root.putArray("trace");
        for (TraceEvent event : result.trace()) {
            trace.addObject()
                .put("unit", event.unit())
                .put("state", event.state().name())
                .put("timestamp", event.timestamp().toString());
        }
        return root;
    }

    private static ObjectNode describe(UnitOutcome outcome) {
        ObjectNode node = MAPPER.createObjectNode();
        if (outcome instanceof UnitOutcome.Succeeded s) {
            node.put("status", "SUCCEEDED");
            node.put("schema", s.output().schema());
        } else if (outcome instanceof UnitOutcome.Failed f) {
            node.put("status", "FAILED");
            node.put("kind", f.error().kind().name());
            node.put("message", f.error().message());
        } else if (outcome instanceof UnitOutcome.Skipped s) {
            node.put("status", "SKIPPED");
            node.put("reason", s.reason().name());
            if (s.cause() != null) {
                node.put("cause", s.cause());
            }
        }
        return node;
    }
}
