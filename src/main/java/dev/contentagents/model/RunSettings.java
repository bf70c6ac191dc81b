package dev.contentagents.model;

import dev.contentagents.backend.BackoffStrategy;
import dev.contentagents.backend.RetryPolicy;

import java.time.Duration;

/**
 * Tunables for a run: provider endpoint, retry and throttle policy, worker count and
 * artifact minimums.
 */
public record RunSettings(
    String baseUrl,
    String model,
    String apiKeyEnv,
    double temperature,
    int maxTokens,
    long minCallIntervalMillis,
    int maxRetries,
    long baseDelayMillis,
    long maxDelayMillis,
    BackoffStrategy backoff,
    long callTimeoutMillis,
    int maxParallelUnits,
    int minFaqCount,
    int minQuestions,
    int parseAttempts
) {
    public static final String DEFAULT_BASE_URL = "https://api.groq.com/openai/v1";
    public static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";
    public static final String DEFAULT_API_KEY_ENV = "GROQ_API_KEY";
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 2000;
    public static final long DEFAULT_MIN_CALL_INTERVAL_MILLIS = 2_000;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_BASE_DELAY_MILLIS = 10_000;
    public static final long DEFAULT_MAX_DELAY_MILLIS = 60_000;
    public static final BackoffStrategy DEFAULT_BACKOFF = BackoffStrategy.LINEAR;
    public static final long DEFAULT_CALL_TIMEOUT_MILLIS = 60_000;
    public static final int DEFAULT_MAX_PARALLEL_UNITS = 4;
    public static final int DEFAULT_MIN_FAQ_COUNT = 15;
    public static final int DEFAULT_MIN_QUESTIONS = 15;
    public static final int DEFAULT_PARSE_ATTEMPTS = 2;

    public RunSettings {
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be >= 1: " + maxRetries);
        if (maxParallelUnits < 1) throw new IllegalArgumentException("maxParallelUnits must be >= 1: " + maxParallelUnits);
        if (parseAttempts < 1) throw new IllegalArgumentException("parseAttempts must be >= 1: " + parseAttempts);
        if (minCallIntervalMillis < 0) throw new IllegalArgumentException("minCallIntervalMillis must be >= 0");
        if (baseDelayMillis < 0) throw new IllegalArgumentException("baseDelayMillis must be >= 0: " + baseDelayMillis);
        if (maxDelayMillis < 0) throw new IllegalArgumentException("maxDelayMillis must be >= 0: " + maxDelayMillis);
        if (callTimeoutMillis < 0) throw new IllegalArgumentException("callTimeoutMillis must be >= 0: " + callTimeoutMillis);
    }

    public static RunSettings defaults() {
        return new RunSettings(DEFAULT_BASE_URL, DEFAULT_MODEL, DEFAULT_API_KEY_ENV, DEFAULT_TEMPERATURE,
            DEFAULT_MAX_TOKENS, DEFAULT_MIN_CALL_INTERVAL_MILLIS, DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY_MILLIS,
            DEFAULT_MAX_DELAY_MILLIS, DEFAULT_BACKOFF, DEFAULT_CALL_TIMEOUT_MILLIS, DEFAULT_MAX_PARALLEL_UNITS,
            DEFAULT_MIN_FAQ_COUNT, DEFAULT_MIN_QUESTIONS, DEFAULT_PARSE_ATTEMPTS);
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxRetries, Duration.ofMillis(baseDelayMillis), Duration.ofMillis(maxDelayMillis),
            backoff, Duration.ofMillis(callTimeoutMillis));
    }

    public Duration minCallInterval() {
        return Duration.ofMillis(minCallIntervalMillis);
    }

    public RunSettings withModel(String value) {
        return new RunSettings(baseUrl, value, apiKeyEnv, temperature, maxTokens, minCallIntervalMillis, maxRetries,
            baseDelayMillis, maxDelayMillis, backoff, callTimeoutMillis, maxParallelUnits, minFaqCount, minQuestions,
            parseAttempts);
    }

    public RunSettings withMaxRetries(int value) {
        return new RunSettings(baseUrl, model, apiKeyEnv, temperature, maxTokens, minCallIntervalMillis, value,
            baseDelayMillis, maxDelayMillis, backoff, callTimeoutMillis, maxParallelUnits, minFaqCount, minQuestions,
            parseAttempts);
    }

    public RunSettings withBaseDelayMillis(long value) {
        return new RunSettings(baseUrl, model, apiKeyEnv, temperature, maxTokens, minCallIntervalMillis, maxRetries,
            value, maxDelayMillis, backoff, callTimeoutMillis, maxParallelUnits, minFaqCount, minQuestions,
            parseAttempts);
    }

    public RunSettings withMinCallIntervalMillis(long value) {
        return new RunSettings(baseUrl, model, apiKeyEnv, temperature, maxTokens, value, maxRetries,
            baseDelayMillis, maxDelayMillis, backoff, callTimeoutMillis, maxParallelUnits, minFaqCount, minQuestions,
            parseAttempts);
    }

    public RunSettings withCallTimeoutMillis(long value) {
        return new RunSettings(baseUrl, model, apiKeyEnv, temperature, maxTokens, minCallIntervalMillis, maxRetries,
            baseDelayMillis, maxDelayMillis, backoff, value, maxParallelUnits, minFaqCount, minQuestions,
            parseAttempts);
    }

    public RunSettings withMaxParallelUnits(int value) {
        return new RunSettings(baseUrl, model, apiKeyEnv, temperature, maxTokens, minCallIntervalMillis, maxRetries,
            baseDelayMillis, maxDelayMillis, backoff, callTimeoutMillis, value, minFaqCount, minQuestions,
            parseAttempts);
    }
}
