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
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Client for the Anthropic messages API and compatible gateways. The response is
 * requested as an SSE stream and folded into a single completion text.
 */
@Slf4j
public class AnthropicClient implements LLMClient {

    public static final String DEFAULT_API_URL = "https://api.anthropic.com/v1/messages";
    static final String API_VERSION = "2023-06-01";
    static final int MAX_OUTPUT_TOKENS = 4096;
    private static final int MAX_ERROR_BODY_LENGTH = 1200;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final String apiUrl;

    public AnthropicClient(HttpClient httpClient, ObjectMapper objectMapper, String apiKey, String model, String apiUrl) {
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
            return CompletableFuture.failedFuture(new LLMException("Failed to encode Claude request", e));
        }
        log.debug("llm.claude.request model={} url={} messages={}", model, apiUrl, messages.size());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl))
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .header("content-type", "application/json")
                .timeout(Duration.ofMinutes(10))
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofLines())
                .thenApply(response -> {
                    try (Stream<String> lines = response.body()) {
                        if (response.statusCode() / 100 != 2) {
                            String errorBody = lines.collect(Collectors.joining("\n"));
                            log.error("llm.claude.error status={} body={}", response.statusCode(),
                                    OpenAiClient.truncateForLog(errorBody, MAX_ERROR_BODY_LENGTH));
                            throw new LLMException("Claude API error: " + errorBody);
                        }
                        return foldStream(lines.iterator());
                    }
                });
    }

    ObjectNode buildRequest(List<Message> messages) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", MAX_OUTPUT_TOKENS);
        body.put("stream", true);

        // The messages API takes system text out of band; a compaction summary
        // follows the primary system prompt, so every system entry is kept.
        List<String> systemParts = new ArrayList<>();
        ArrayNode array = body.putArray("messages");
        for (Message message : messages) {
            if (message.getRole() == Role.SYSTEM) {
                systemParts.add(message.getContent());
                continue;
            }
            array.addObject()
                    .put("role", message.getRole().wireName())
                    .put("content", message.getContent());
        }
        if (!systemParts.isEmpty()) {
            body.put("system", String.join("\n\n", systemParts));
        }
        return body;
    }

    String foldStream(Iterator<String> lines) {
        StringBuilder thinking = new StringBuilder();
        StringBuilder text = new StringBuilder();
        while (lines.hasNext()) {
            String line = lines.next();
            if (!line.startsWith("data: ")) {
                continue;
            }
            String data = line.substring("data: ".length()).trim();
            if ("[DONE]".equals(data)) {
                break;
            }
            JsonNode event;
            try {
                event = objectMapper.readTree(data);
            } catch (JsonProcessingException e) {
                log.debug("llm.claude.sse.skip err={} data={}", e.getOriginalMessage(), data);
                continue;
            }
            String type = event.path("type").asText("");
            if ("content_block_start".equals(type)) {
                JsonNode block = event.path("content_block");
                String blockType = block.path("type").asText("");
                if ("text".equals(blockType)) {
                    text.append(block.path("text").asText(""));
                } else if ("thinking".equals(blockType)) {
                    thinking.append(block.path("thinking").asText(""));
                }
            } else if ("content_block_delta".equals(type)) {
                JsonNode delta = event.path("delta");
                String deltaType = delta.path("type").asText("");
                if ("text_delta".equals(deltaType)) {
                    text.append(delta.path("text").asText(""));
                } else if ("thinking_delta".equals(deltaType)) {
                    thinking.append(delta.path("thinking").asText(""));
                }
            }
        }
        log.debug("llm.claude.response thinkingChars={} textChars={}", thinking.length(), text.length());
        if (thinking.length() > 0) {
            return "<thinking>\n" + thinking + "\n</thinking>\n" + text;
        }
        return text.toString();
    }
}
