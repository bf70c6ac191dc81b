package dev.contentagents.backend;

import dev.contentagents.error.FailureKind;
import dev.contentagents.error.GenerationException;
import dev.contentagents.model.GenerationRequest;
import dev.contentagents.model.RunSettings;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Backend for any OpenAI-compatible chat completion endpoint (Groq by default), built on
 * langchain4j's {@link OpenAiChatModel}.
 */
public final class OpenAiCompatibleBackend implements GenerationBackend {

    private final ChatModel model;
    private final String name;

    public OpenAiCompatibleBackend(ChatModel model, String name) {
        this.model = model;
        this.name = name;
    }

    public static OpenAiCompatibleBackend create(RunSettings settings, String apiKey) {
        ChatModel model = OpenAiChatModel.builder()
            .baseUrl(settings.baseUrl())
            .apiKey(apiKey)
            .modelName(settings.model())
            .temperature(settings.temperature())
            .maxTokens(settings.maxTokens())
            .timeout(Duration.ofMillis(settings.callTimeoutMillis()))
            // retries are owned by GeneratorClient so the throttle sees every attempt
            .maxRetries(1)
            .build();
        return new OpenAiCompatibleBackend(model, settings.model());
    }

    @Override
    public String complete(GenerationRequest request) throws GenerationException {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.systemPrompt()));
        }
        messages.add(UserMessage.from(request.prompt()));

        ChatResponse response;
        try {
            response = model.chat(ChatRequest.builder()
                .messages(messages)
                .maxOutputTokens(request.maxTokens())
                .build());
        } catch (RuntimeException e) {
            throw classify(request, e);
        }

        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new GenerationException(FailureKind.PROVIDER_ERROR,
                "Empty response from %s for '%s'".formatted(name, request.label()));
        }
        return text;
    }

    @Override
    public String getName() {
        return name;
    }

    static GenerationException classify(GenerationRequest request, RuntimeException e) {
        FailureKind kind = kindOf(e);
        return new GenerationException(kind,
            "%s request '%s' failed: %s".formatted(kind, request.label(), e.getMessage()), e);
    }

    private static FailureKind kindOf(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof RateLimitException) return FailureKind.RATE_LIMITED;
            if (t instanceof dev.langchain4j.exception.TimeoutException
                || t instanceof HttpTimeoutException
                || t instanceof SocketTimeoutException) return FailureKind.TIMEOUT;
            if (t instanceof AuthenticationException) return FailureKind.AUTHENTICATION;
            if (t instanceof InvalidRequestException) return FailureKind.MALFORMED_REQUEST;
            if (t instanceof HttpException http) return kindOfStatus(http.statusCode());
            if (t.getCause() == t) break;
        }
        // Some providers only signal throttling in the message text.
        String message = String.valueOf(error.getMessage()).toLowerCase(Locale.ROOT);
        if (message.contains("429") || message.contains("rate limit") || message.contains("rate_limit")) {
            return FailureKind.RATE_LIMITED;
        }
        return FailureKind.PROVIDER_ERROR;
    }

    static FailureKind kindOfStatus(int status) {
        return switch (status) {
            case 429 -> FailureKind.RATE_LIMITED;
            case 408 -> FailureKind.TIMEOUT;
            case 401, 403 -> FailureKind.AUTHENTICATION;
            case 400, 404, 413, 422 -> FailureKind.MALFORMED_REQUEST;
            default -> FailureKind.PROVIDER_ERROR;
        };
    }
}
