package dev.contentagents.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.contentagents.backend.BackoffStrategy;
import dev.contentagents.model.RunSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads {@link RunSettings} from a JSON file. Keys that are absent keep their defaults.
 */
public final class SettingsLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SettingsLoader() {}

    public static RunSettings loadFromFile(Path path) throws IOException {
        return parseSettings(MAPPER.readTree(path.toFile()));
    }

    public static RunSettings loadFromString(String json) throws IOException {
        return parseSettings(MAPPER.readTree(json));
    }

    static RunSettings parseSettings(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return RunSettings.defaults();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Settings must be a JSON object");
        }
        return new RunSettings(
            text(node, "baseUrl", RunSettings.DEFAULT_BASE_URL),
            text(node, "model", RunSettings.DEFAULT_MODEL),
            text(node, "apiKeyEnv", RunSettings.DEFAULT_API_KEY_ENV),
            node.has("temperature") ? node.get("temperature").asDouble() : RunSettings.DEFAULT_TEMPERATURE,
            node.has("maxTokens") ? node.get("maxTokens").asInt() : RunSettings.DEFAULT_MAX_TOKENS,
            node.has("minCallIntervalMillis")
                ? node.get("minCallIntervalMillis").asLong() : RunSettings.DEFAULT_MIN_CALL_INTERVAL_MILLIS,
            node.has("maxRetries") ? node.get("maxRetries").asInt() : RunSettings.DEFAULT_MAX_RETRIES,
            node.has("baseDelayMillis") ? node.get("baseDelayMillis").asLong() : RunSettings.DEFAULT_BASE_DELAY_MILLIS,
            node.has("maxDelayMillis") ? node.get("maxDelayMillis").asLong() : RunSettings.DEFAULT_MAX_DELAY_MILLIS,
            node.has("backoff") ? parseBackoff(node.get("backoff").asText()) : RunSettings.DEFAULT_BACKOFF,
            node.has("callTimeoutMillis")
                ? node.get("callTimeoutMillis").asLong() : RunSettings.DEFAULT_CALL_TIMEOUT_MILLIS,
            node.has("maxParallelUnits")
                ? node.get("maxParallelUnits").asInt() : RunSettings.DEFAULT_MAX_PARALLEL_UNITS,
            node.has("minFaqCount") ? node.get("minFaqCount").asInt() : RunSettings.DEFAULT_MIN_FAQ_COUNT,
            node.has("minQuestions") ? node.get("minQuestions").asInt() : RunSettings.DEFAULT_MIN_QUESTIONS,
            node.has("parseAttempts") ? node.get("parseAttempts").asInt() : RunSettings.DEFAULT_PARSE_ATTEMPTS);
    }

    private static String text(JsonNode node, String field, String fallback) {
        return node.has(field) ? node.get(field).asText() : fallback;
    }

    private static BackoffStrategy parseBackoff(String value) {
        try {
            return BackoffStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown backoff strategy: " + value, e);
        }
    }
}
