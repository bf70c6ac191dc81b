package dev.contentagents.engine;

import dev.contentagents.error.DependencyException;
import dev.contentagents.error.UnitFailureException;
import dev.contentagents.model.InputRecord;
import dev.contentagents.model.RunResult;
import dev.contentagents.model.SkipReason;
import dev.contentagents.model.TraceEvent;
import dev.contentagents.model.UnitError;
import dev.contentagents.model.UnitOutcome;
import dev.contentagents.model.UnitState;
import dev.contentagents.model.ValidatedOutput;
import dev.contentagents.unit.Unit;
import dev.contentagents.unit.UnitContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a fixed set of units over their dependency graph.
 * <p>
 * Works in waves: every unit whose dependencies have all succeeded is dispatched in
 * registration order and run concurrently on a bounded worker pool. Once the whole wave
 * has finished, its outcomes are recorded in registration order and the transitive
 * dependents of any failed unit are marked skipped. The trace therefore depends only on
 * unit outcomes, never on which worker finished first. A failure never affects units
 * outside the failed unit's descendant set.
 */
public final class Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final List<Unit> units;
    private final int maxParallel;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public Scheduler(List<? extends Unit> units, int maxParallel) {
        this(units, maxParallel, Clock.systemUTC());
    }

    public Scheduler(List<? extends Unit> units, int maxParallel, Clock clock) {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be >= 1: " + maxParallel);
        }
        this.units = List.copyOf(units);
        this.maxParallel = maxParallel;
        this.clock = clock;
    }

    /**
     * Stop dispatching. Units already running finish; their pending retries are abandoned.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("Run cancellation requested");
        }
    }

    public RunResult run(InputRecord input) throws DependencyException {
        return run(DependencyGraph.of(units), input);
    }

    /**
     * Execute every unit reachable under {@code graph}.
     *
     * @throws DependencyException if two registered units share a name, or the graph is
     *                             cyclic, references unknown units or does not match the
     *                             registered units; nothing has run in that case
     */
    public RunResult run(DependencyGraph graph, InputRecord input) throws DependencyException {
        List<String> names = units.stream().map(Unit::name).toList();
        try {
            rejectDuplicateNames(names);
            graph.validateAgainst(names);
        } catch (DependencyException e) {
            log.error("Run aborted before dispatch: {}", e.getMessage());
            throw e;
        }

        String previousRun = MDC.get("run");
        MDC.put("run", UUID.randomUUID().toString().substring(0, 8));
        ExecutorService pool = Executors.newFixedThreadPool(maxParallel, workerThreads());
        try {
            return new Execution(graph, new SharedState(input), pool).execute();
        } finally {
            pool.shutdown();
            awaitQuietly(pool);
            if (previousRun == null) {
                MDC.remove("run");
            } else {
                MDC.put("run", previousRun);
            }
        }
    }

    private record Completion(String unit, ValidatedOutput output, UnitError error, long elapsedMillis) {}

    private enum Status { PENDING, RUNNING, DONE }

    /** State of one run; touched only by the scheduling thread. */
    private final class Execution {
        private final DependencyGraph graph;
        private final SharedState state;
        private final CompletionService<Completion> completions;
        private final Map<String, Status> status = new HashMap<>();
        private final Map<String, UnitOutcome> outcomes = new HashMap<>();
        private final List<TraceEvent> trace = new ArrayList<>();

        Execution(DependencyGraph graph, SharedState state, ExecutorService pool) {
            this.graph = graph;
            this.state = state;
            this.completions = new ExecutorCompletionService<>(new MdcAwareExecutor(pool));
            for (Unit unit : units) {
                status.put(unit.name(), Status.PENDING);
            }
        }

        RunResult execute() {
            boolean interrupted = false;
            while (!cancelled.get()) {
                List<Unit> wave = readyUnits();
                if (wave.isEmpty()) {
                    break;
                }
                for (Unit unit : wave) {
                    dispatch(unit);
                }
                Map<String, Completion> finished = new HashMap<>();
                while (finished.size() < wave.size()) {
                    try {
                        Completion completion = completions.take().get();
                        finished.put(completion.unit(), completion);
                    } catch (InterruptedException e) {
                        interrupted = true;
                        cancel();
                    } catch (ExecutionException e) {
                        // worker tasks catch everything they can; reaching here means an Error
                        throw new IllegalStateException("Unit worker crashed", e.getCause());
                    }
                }
                for (Unit unit : wave) {
                    complete(finished.get(unit.name()));
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }

            for (Unit unit : units) {
                if (status.get(unit.name()) == Status.PENDING) {
                    SkipReason reason = cancelled.get() ? SkipReason.CANCELLED : SkipReason.UNREACHABLE;
                    skip(unit.name(), reason, null);
                }
            }

            Map<String, UnitOutcome> ordered = new LinkedHashMap<>();
            for (Unit unit : units) {
                ordered.put(unit.name(), outcomes.get(unit.name()));
            }
            RunResult result = new RunResult(ordered, trace, cancelled.get());
            log.info("Run finished: {} succeeded, {} failed, {} skipped",
                result.succeeded().size(), result.failed().size(), result.skipped().size());
            return result;
        }

        private List<Unit> readyUnits() {
            List<Unit> ready = new ArrayList<>();
            for (Unit unit : units) {
                if (status.get(unit.name()) == Status.PENDING && dependenciesSucceeded(unit.name())) {
                    ready.add(unit);
                }
            }
            return ready;
        }

        private boolean dependenciesSucceeded(String name) {
            for (String dep : graph.dependenciesOf(name)) {
                if (!(outcomes.get(dep) instanceof UnitOutcome.Succeeded)) {
                    return false;
                }
            }
            return true;
        }

        private void dispatch(Unit unit) {
            String name = unit.name();
            status.put(name, Status.RUNNING);
            record(name, UnitState.DISPATCHED);
            log.info("Dispatching unit '{}'", name);
            UnitContext context = state.contextFor(name, graph.dependenciesOf(name), cancelled::get);
            completions.submit(() -> runUnit(unit, context));
        }

        private Completion runUnit(Unit unit, UnitContext context) {
            String name = unit.name();
            MDC.put("unit", name);
            long start = System.nanoTime();
            try {
                ValidatedOutput output = unit.execute(context);
                if (output == null) {
                    return new Completion(name, null,
                        UnitError.unexpected(new IllegalStateException("unit returned no output")), elapsed(start));
                }
                state.publish(name, output);
                return new Completion(name, output, null, elapsed(start));
            } catch (UnitFailureException e) {
                return new Completion(name, null, UnitError.of(e), elapsed(start));
            } catch (RuntimeException e) {
                log.error("Unit '{}' threw unexpectedly", name, e);
                return new Completion(name, null, UnitError.unexpected(e), elapsed(start));
            } finally {
                MDC.remove("unit");
            }
        }

        private void complete(Completion completion) {
            String name = completion.unit();
            status.put(name, Status.DONE);
            if (completion.error() == null) {
                outcomes.put(name, new UnitOutcome.Succeeded(completion.output()));
                record(name, UnitState.SUCCEEDED);
                log.info("Unit '{}' succeeded in {} ms", name, completion.elapsedMillis());
                return;
            }

            outcomes.put(name, new UnitOutcome.Failed(completion.error()));
            record(name, UnitState.FAILED);
            log.warn("Unit '{}' failed after {} ms ({}): {}", name, completion.elapsedMillis(),
                completion.error().kind(), completion.error().message());
            var skipped = new LinkedHashSet<String>();
            for (String dependent : graph.transitiveDependents(name)) {
                if (status.get(dependent) == Status.PENDING) {
                    skip(dependent, SkipReason.UNREACHABLE, name);
                    skipped.add(dependent);
                }
            }
            if (!skipped.isEmpty()) {
                log.warn("Skipping {} because '{}' failed", skipped, name);
            }
        }

        private void skip(String name, SkipReason reason, String cause) {
            status.put(name, Status.DONE);
            outcomes.put(name, new UnitOutcome.Skipped(reason, cause));
            record(name, UnitState.SKIPPED);
        }

        private void record(String name, UnitState unitState) {
            trace.add(new TraceEvent(name, unitState, clock.instant()));
        }
    }

    private static void rejectDuplicateNames(List<String> names) throws DependencyException {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                duplicates.add(name);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new DependencyException(duplicates.stream()
                .map(name -> "Unit name '%s' is registered more than once".formatted(name))
                .toList());
        }
    }

    private static long elapsed(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "unit-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static void awaitQuietly(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Unit workers still busy after run completed");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
