package dev.contentagents.backend;

import dev.contentagents.error.FailureKind;
import dev.contentagents.error.GenerationException;
import dev.contentagents.model.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Issues logical generation requests with throttling, a per-call timeout and bounded
 * retry on transient failures. Shared by all units of a run.
 */
public final class GeneratorClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GeneratorClient.class);

    private final GenerationBackend backend;
    private final CallThrottle throttle;
    private final TimeSource time;
    private final ExecutorService callExecutor;

    public GeneratorClient(GenerationBackend backend, CallThrottle throttle, TimeSource time) {
        this.backend = backend;
        this.throttle = throttle;
        this.time = time;
        this.callExecutor = Executors.newCachedThreadPool(daemonThreads());
    }

    public String generate(GenerationRequest request, RetryPolicy policy) throws GenerationException {
        return generate(request, policy, () -> false);
    }

    /**
     * Generate text for {@code request}.
     *
     * @param cancelled checked before every attempt and backoff; once true, no further
     *                  attempt is started
     * @throws GenerationException with a fatal kind: the provider's own fatal kind,
     *                             {@code RATE_LIMIT_EXHAUSTED} once {@code policy.maxRetries()}
     *                             attempts all failed transiently, or {@code CANCELLED}
     */
    public String generate(GenerationRequest request, RetryPolicy policy, BooleanSupplier cancelled)
            throws GenerationException {
        GenerationException lastTransient = null;
        for (int attempt = 1; attempt <= policy.maxRetries(); attempt++) {
            abortIfCancelled(request, cancelled);
            try {
                throttle.acquire();
                String text = callWithTimeout(request, policy.callTimeout());
                if (attempt > 1) {
                    log.info("Request '{}' succeeded on attempt {}/{}", request.label(), attempt, policy.maxRetries());
                }
                return text;
            } catch (GenerationException e) {
                if (!e.isTransient()) {
                    log.warn("Request '{}' failed permanently ({}): {}", request.label(), e.kind(), e.getMessage());
                    throw e;
                }
                lastTransient = e;
                if (attempt == policy.maxRetries()) {
                    break;
                }
                Duration delay = policy.delayBeforeRetry(attempt);
                log.warn("Request '{}' hit {} on attempt {}/{}; retrying in {} ms",
                    request.label(), e.kind(), attempt, policy.maxRetries(), delay.toMillis());
                abortIfCancelled(request, cancelled);
                sleep(request, delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GenerationException(FailureKind.CANCELLED,
                    "Interrupted while waiting to call the provider for '%s'".formatted(request.label()), e);
            }
        }
        throw new GenerationException(FailureKind.RATE_LIMIT_EXHAUSTED,
            "Gave up on '%s' after %d attempts; last error: %s"
                .formatted(request.label(), policy.maxRetries(), lastTransient.getMessage()),
            lastTransient);
    }

    private String callWithTimeout(GenerationRequest request, Duration timeout)
            throws GenerationException, InterruptedException {
        if (timeout.isZero()) {
            try {
                return backend.complete(request);
            } catch (RuntimeException e) {
                throw new GenerationException(FailureKind.PROVIDER_ERROR,
                    "Backend %s failed for '%s': %s".formatted(backend.getName(), request.label(), e), e);
            }
        }
        Future<String> call = callExecutor.submit(() -> backend.complete(request));
        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new GenerationException(FailureKind.TIMEOUT,
                "Call for '%s' exceeded %d ms".formatted(request.label(), timeout.toMillis()));
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GenerationException ge) {
                throw ge;
            }
            throw new GenerationException(FailureKind.PROVIDER_ERROR,
                "Backend %s failed for '%s': %s".formatted(backend.getName(), request.label(), cause), cause);
        }
    }

    private void sleep(GenerationRequest request, Duration delay) throws GenerationException {
        try {
            time.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(FailureKind.CANCELLED,
                "Interrupted during backoff for '%s'".formatted(request.label()), e);
        }
    }

    private static void abortIfCancelled(GenerationRequest request, BooleanSupplier cancelled)
            throws GenerationException {
        if (cancelled.getAsBoolean()) {
            throw new GenerationException(FailureKind.CANCELLED,
                "Run cancelled; abandoning request '%s'".formatted(request.label()));
        }
    }

    private static ThreadFactory daemonThreads() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "generator-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }
}
