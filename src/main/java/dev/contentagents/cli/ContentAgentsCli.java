package dev.contentagents.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import dev.contentagents.backend.GenerationBackend;
import dev.contentagents.backend.OpenAiCompatibleBackend;
import dev.contentagents.engine.ArtifactWriter;
import dev.contentagents.engine.DatasetLoader;
import dev.contentagents.engine.DependencyGraph;
import dev.contentagents.engine.SettingsLoader;
import dev.contentagents.error.DependencyException;
import dev.contentagents.error.GenerationException;
import dev.contentagents.model.GenerationRequest;
import dev.contentagents.model.InputRecord;
import dev.contentagents.model.RunResult;
import dev.contentagents.model.RunSettings;
import dev.contentagents.model.UnitOutcome;
import dev.contentagents.unit.ContentPipeline;
import dev.contentagents.unit.ContentUnit;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * CLI entry point: generate the FAQ, product and comparison pages for one product.
 */
@Command(
    name = "content-agents",
    mixinStandardHelpOptions = true,
    description = "Generate structured content pages for a product with dependency-scheduled agents."
)
public class ContentAgentsCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_INCOMPLETE = 2;

    /** Creates the generation backend once settings and API key are known. */
    @FunctionalInterface
    interface BackendFactory {
        GenerationBackend create(RunSettings settings, String apiKey);
    }

    @Spec
    private CommandSpec spec;

    @Option(names = "--dataset", description = "Dataset JSON file (default: bundled sample product)")
    private Path dataset;

    @Option(names = "--product-index", defaultValue = "0", description = "Index of the product in the dataset")
    private int productIndex;

    @Option(names = "--output-dir", defaultValue = "output", description = "Directory for generated pages")
    private Path outputDir;

    @Option(names = "--config", description = "Settings JSON file")
    private Path config;

    @Option(names = "--model", description = "Override the generation model")
    private String model;

    @Option(names = "--max-retries", description = "Total attempts per generation call")
    private Integer maxRetries;

    @Option(names = "--base-delay-ms", description = "Base backoff delay in milliseconds")
    private Long baseDelayMs;

    @Option(names = "--min-interval-ms", description = "Minimum spacing between generation calls")
    private Long minIntervalMs;

    @Option(names = "--timeout-ms", description = "Per-call timeout in milliseconds, 0 for none")
    private Long timeoutMs;

    @Option(names = "--workers", description = "Maximum units running in parallel")
    private Integer workers;

    @Option(names = "--report", description = "Also write " + ArtifactWriter.REPORT_FILE)
    private boolean report;

    @Option(names = "--dry-run", description = "Print the unit graph in dispatch order without generating")
    private boolean dryRun;

    @Option(names = "--verbose", description = "Log throttle waits and prompts")
    private boolean verbose;

    private final BackendFactory backendFactory;
    private final Function<String, String> environment;

    public ContentAgentsCli() {
        this(OpenAiCompatibleBackend::create, System::getenv);
    }

    ContentAgentsCli(BackendFactory backendFactory, Function<String, String> environment) {
        this.backendFactory = backendFactory;
        this.environment = environment;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (verbose) {
            ((Logger) LoggerFactory.getLogger("dev.contentagents")).setLevel(Level.DEBUG);
        }

        RunSettings settings;
        InputRecord input;
        try {
            settings = applyOverrides(config == null ? RunSettings.defaults() : SettingsLoader.loadFromFile(config));
            input = dataset == null
                ? DatasetLoader.select(List.of(DatasetLoader.loadSample()), productIndex)
                : DatasetLoader.load(dataset, productIndex);
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        if (dryRun) {
            return printPlan(settings, out, err);
        }

        String apiKey = environment.apply(settings.apiKeyEnv());
        if (apiKey == null || apiKey.isBlank()) {
            err.println("Error: missing API key. Set the " + settings.apiKeyEnv() + " environment variable.");
            return EXIT_ERROR;
        }

        RunResult result;
        Map<String, String> files;
        try (var pipeline = new ContentPipeline(settings, backendFactory.create(settings, apiKey))) {
            files = artifactFiles(pipeline);
            result = pipeline.run(input);
        } catch (DependencyException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        try {
            var writer = new ArtifactWriter(outputDir);
            writer.writeArtifacts(result, files);
            if (report) {
                writer.writeReport(result);
            }
        } catch (IOException e) {
            err.println("Error: could not write artifacts: " + e.getMessage());
            return EXIT_ERROR;
        }

        printSummary(result, files, out);
        return result.allSucceeded() ? EXIT_OK : EXIT_INCOMPLETE;
    }

    private RunSettings applyOverrides(RunSettings settings) {
        if (model != null) settings = settings.withModel(model);
        if (maxRetries != null) settings = settings.withMaxRetries(maxRetries);
        if (baseDelayMs != null) settings = settings.withBaseDelayMillis(baseDelayMs);
        if (minIntervalMs != null) settings = settings.withMinCallIntervalMillis(minIntervalMs);
        if (timeoutMs != null) settings = settings.withCallTimeoutMillis(timeoutMs);
        if (workers != null) settings = settings.withMaxParallelUnits(workers);
        return settings;
    }

    private int printPlan(RunSettings settings, PrintWriter out, PrintWriter err) {
        try (var pipeline = new ContentPipeline(settings, new OfflineBackend())) {
            DependencyGraph graph = pipeline.graph();
            Map<String, String> files = artifactFiles(pipeline);
            out.println("Model: " + settings.model() + " @ " + settings.baseUrl());
            out.println("Dispatch order:");
            for (String name : graph.topologicalOrder()) {
                var line = new StringBuilder("  ").append(name);
                if (!graph.dependenciesOf(name).isEmpty()) {
                    line.append(" <- ").append(String.join(", ", graph.dependenciesOf(name)));
                }
                if (files.containsKey(name)) {
                    line.append(" => ").append(outputDir.resolve(files.get(name)));
                }
                out.println(line);
            }
            return EXIT_OK;
        } catch (DependencyException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static void printSummary(RunResult result, Map<String, String> files, PrintWriter out) {
        result.outcomes().forEach((name, outcome) -> {
            if (outcome instanceof UnitOutcome.Succeeded) {
                out.println("  [OK]      " + name + (files.containsKey(name) ? " -> " + files.get(name) : ""));
            } else if (outcome instanceof UnitOutcome.Failed f) {
                out.println("  [FAILED]  " + name + ": " + f.error().kind() + " " + f.error().message());
            } else if (outcome instanceof UnitOutcome.Skipped s) {
                out.println("  [SKIPPED] " + name + ": " + s.reason()
                    + (s.cause() != null ? " (after " + s.cause() + ")" : ""));
            }
        });
    }

    private static Map<String, String> artifactFiles(ContentPipeline pipeline) {
        var files = new LinkedHashMap<String, String>();
        for (ContentUnit unit : pipeline.units()) {
            unit.artifactFile().ifPresent(file -> files.put(unit.name(), file));
        }
        return files;
    }

    /** Stands in for the provider during --dry-run, where no unit executes. */
    private static final class OfflineBackend implements GenerationBackend {
        @Override
        public String complete(GenerationRequest request) throws GenerationException {
            throw GenerationException.fatal("Generation is disabled in dry-run mode");
        }

        @Override
        public String getName() {
            return "offline";
        }
    }
}
