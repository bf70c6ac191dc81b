package dev.contentagents.unit;

import dev.contentagents.backend.CallThrottle;
import dev.contentagents.backend.GenerationBackend;
import dev.contentagents.backend.GeneratorClient;
import dev.contentagents.backend.TimeSource;
import dev.contentagents.engine.DependencyGraph;
import dev.contentagents.engine.Scheduler;
import dev.contentagents.error.DependencyException;
import dev.contentagents.model.InputRecord;
import dev.contentagents.model.RunResult;
import dev.contentagents.model.RunSettings;

import java.time.Clock;
import java.util.List;

/**
 * The five content units wired to one generator client and one scheduler.
 * Registration order is parser, questions, product, comparison, faq.
 */
public final class ContentPipeline implements AutoCloseable {

    private final GeneratorClient client;
    private final List<ContentUnit> units;
    private final Scheduler scheduler;

    public ContentPipeline(RunSettings settings, GenerationBackend backend) {
        this(settings, backend, TimeSource.SYSTEM, Clock.systemUTC());
    }

    public ContentPipeline(RunSettings settings, GenerationBackend backend, TimeSource time, Clock clock) {
        this.client = new GeneratorClient(backend, new CallThrottle(settings.minCallInterval(), time), time);
        var generation = new StructuredGeneration(client, settings.retryPolicy(), settings.parseAttempts());
        this.units = List.of(
            new ParserUnit(),
            new QuestionsUnit(generation, settings.minQuestions()),
            new ProductUnit(generation),
            new ComparisonUnit(generation),
            new FaqUnit(generation, settings.minFaqCount()));
        this.scheduler = new Scheduler(units, settings.maxParallelUnits(), clock);
    }

    public List<ContentUnit> units() {
        return units;
    }

    public DependencyGraph graph() {
        return DependencyGraph.of(units);
    }

    public RunResult run(InputRecord input) throws DependencyException {
        return scheduler.run(input);
    }

    public void cancel() {
        scheduler.cancel();
    }

    @Override
    public void close() {
        client.close();
    }
}
