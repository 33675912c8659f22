package com.zzf.miniagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Builds the completion client for a configured provider name.
 */
public final class LLMClientFactory {

    public static final String MINIMAX_API_URL = "https://api.minimaxi.com/anthropic/v1/messages";

    private LLMClientFactory() {
    }

    public static LLMClient create(String provider, String model, String apiKey, String apiUrl, ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(60))
                .build();
        String normalized = normalize(provider);
        switch (normalized) {
            case "openai":
                return new OpenAiClient(httpClient, objectMapper, apiKey, model, apiUrl);
            case "claude":
                return new AnthropicClient(httpClient, objectMapper, apiKey, model, apiUrl);
            case "minimax":
                return new AnthropicClient(httpClient, objectMapper, apiKey, model,
                        apiUrl == null || apiUrl.isBlank() ? MINIMAX_API_URL : apiUrl);
            default:
                throw new IllegalArgumentException("Unknown provider: " + provider);
        }
    }

    /**
     * Explicit key first, then the provider's conventional environment variable.
     */
    public static String resolveApiKey(String provider, String explicitKey, UnaryOperator<String> env) {
        if (explicitKey != null && !explicitKey.isBlank()) {
            return explicitKey.trim();
        }
        String variable = apiKeyVariable(provider);
        String value = variable == null ? null : env.apply(variable);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(
                    "API key must be provided via --miniagent.api-key or env var (e.g. ANTHROPIC_API_KEY)");
        }
        return value.trim();
    }

    static String apiKeyVariable(String provider) {
        switch (normalize(provider)) {
            case "openai":
                return "OPENAI_API_KEY";
            case "claude":
                return "ANTHROPIC_API_KEY";
            case "minimax":
                return "MINIMAX_API_KEY";
            default:
                return null;
        }
    }

    private static String normalize(String provider) {
        return provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
    }
}
