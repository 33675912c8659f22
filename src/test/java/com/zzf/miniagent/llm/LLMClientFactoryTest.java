package com.zzf.miniagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LLMClientFactoryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void createsClientPerProvider() {
        assertInstanceOf(OpenAiClient.class, LLMClientFactory.create("openai", "m", "k", null, objectMapper));
        assertInstanceOf(AnthropicClient.class, LLMClientFactory.create("Claude", "m", "k", null, objectMapper));
        assertInstanceOf(AnthropicClient.class, LLMClientFactory.create("minimax", "m", "k", null, objectMapper));
    }

    @Test
    void unknownProviderIsRejected() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> LLMClientFactory.create("gemini", "m", "k", null, objectMapper));
        assertEquals("Unknown provider: gemini", error.getMessage());
    }

    @Test
    void explicitKeyWinsOverEnvironment() {
        Map<String, String> env = Map.of("ANTHROPIC_API_KEY", "from-env");
        assertEquals("explicit", LLMClientFactory.resolveApiKey("claude", " explicit ", env::get));
        assertEquals("from-env", LLMClientFactory.resolveApiKey("claude", null, env::get));
    }

    @Test
    void eachProviderReadsItsOwnVariable() {
        assertEquals("OPENAI_API_KEY", LLMClientFactory.apiKeyVariable("openai"));
        assertEquals("MINIMAX_API_KEY", LLMClientFactory.apiKeyVariable("minimax"));
        assertThrows(IllegalStateException.class,
                () -> LLMClientFactory.resolveApiKey("openai", "", Map.of("ANTHROPIC_API_KEY", "x")::get));
    }
}
