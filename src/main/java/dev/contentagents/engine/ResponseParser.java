package dev.contentagents.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.contentagents.model.ExtractionResult;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * Extracts a JSON object or array from free-form generator text.
 * <p>
 * Markdown fence lines are stripped first. If the remaining text is not itself a JSON
 * container, the first balanced {@code {...}} or {@code [...]} span that parses is
 * taken; delimiters inside string literals do not count towards balance. A span that
 * is balanced but does not parse, or that never closes, is rejected as a whole: nothing
 * nested inside it is ever returned.
 */
public final class ResponseParser {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();

    private static final Pattern FENCE = Pattern.compile("(?m)^[ \\t]*```[A-Za-z0-9_-]*[ \\t]*$");

    static final int MISMATCHED = -1;
    static final int UNTERMINATED = -2;

    private ResponseParser() {}

    /**
     * Extract the structured payload from {@code responseText}.
     *
     * @return success with the payload, or failure carrying the raw text
     */
    public static ExtractionResult extract(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return new ExtractionResult.Failure("Response is empty", responseText);
        }

        // Step 1: strip markdown fences
        String text = stripFences(responseText);

        // Step 2: clean payload
        JsonNode whole = parseContainer(text);
        if (whole != null) {
            return new ExtractionResult.Success(whole);
        }

        // Step 3: first balanced span that parses
        for (int start = 0; start < text.length(); start++) {
            char c = text.charAt(start);
            if (c != '{' && c != '[') {
                continue;
            }
            int end = balancedEnd(text, start);
            if (end == UNTERMINATED) {
                break;
            }
            if (end == MISMATCHED) {
                continue;
            }
            JsonNode node = parseContainer(text.substring(start, end + 1));
            if (node != null) {
                return new ExtractionResult.Success(node);
            }
            start = end;
        }

        return new ExtractionResult.Failure("No structured payload found in response", responseText);
    }

    static String stripFences(String text) {
        return FENCE.matcher(text).replaceAll("").trim();
    }

    /**
     * Index of the delimiter closing the one at {@code start}, {@link #MISMATCHED} when the
     * span is closed by the wrong delimiter, or {@link #UNTERMINATED} when the text ends first.
     */
    static int balancedEnd(String text, int start) {
        Deque<Character> expected = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{' -> expected.push('}');
                case '[' -> expected.push(']');
                case '}', ']' -> {
                    if (expected.isEmpty() || expected.pop() != c) {
                        return MISMATCHED;
                    }
                    if (expected.isEmpty()) {
                        return i;
                    }
                }
                default -> { }
            }
        }
        return UNTERMINATED;
    }

    private static JsonNode parseContainer(String candidate) {
        try {
            JsonNode node = MAPPER.readTree(candidate);
            return node != null && node.isContainerNode() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
