package com.zzf.miniagent.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Client for OpenAI compatible chat-completions endpoints (non-streaming).
 */
@Slf4j
public class OpenAiClient implements LLMClient {

    public static final String DEFAULT_API_URL = "https://api.openai.com/v1/chat/completions";
    private static final int MAX_ERROR_BODY_LENGTH = 1200;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final String apiUrl;

    public OpenAiClient(HttpClient httpClient, ObjectMapper objectMapper, String apiKey, String model, String apiUrl) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
        this.apiUrl = apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl;
    }

    @Override
    public CompletableFuture<String> complete(List<Message> messages) {
        String jsonBody;
        try {
            jsonBody = objectMapper.writeValueAsString(buildRequest(messages));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new LLMException("Failed to encode OpenAI request", e));
        }
        log.debug("llm.openai.request model={} url={} messages={}", model, apiUrl, messages.size());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .timeout(Duration.ofMinutes(10))
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() / 100 != 2) {
                        log.error("llm.openai.error status={} body={}", response.statusCode(),
                                truncateForLog(response.body(), MAX_ERROR_BODY_LENGTH));
                        throw new LLMException("OpenAI API error: " + response.body());
                    }
                    return extractContent(response.body());
                });
    }

    ObjectNode buildRequest(List<Message> messages) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        ArrayNode array = body.putArray("messages");
        for (Message message : messages) {
            array.addObject()
                    .put("role", message.getRole().wireName())
                    .put("content", message.getContent());
        }
        return body;
    }

    String extractContent(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new LLMException("Failed to parse OpenAI response", e);
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            log.error("llm.openai.no_choices body={}", truncateForLog(responseBody, MAX_ERROR_BODY_LENGTH));
            throw new LLMException("No choices in OpenAI response");
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new LLMException("OpenAI response has no message content");
        }
        return content.asText();
    }

    static String truncateForLog(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
