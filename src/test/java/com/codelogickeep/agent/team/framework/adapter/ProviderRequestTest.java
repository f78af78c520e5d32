package com.codelogickeep.agent.team.framework.adapter;

import com.codelogickeep.agent.team.framework.adapter.chat.AssistantMessage;
import com.codelogickeep.agent.team.framework.adapter.chat.ChatMessage;
import com.codelogickeep.agent.team.framework.adapter.chat.SystemMessage;
import com.codelogickeep.agent.team.framework.adapter.chat.UserMessage;
import com.codelogickeep.agent.team.framework.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Request bodies built for the non-OpenAI providers.
 */
class ProviderRequestTest {

    private static final List<ChatMessage> MESSAGES = List.of(
            SystemMessage.of("You are a coach."),
            new UserMessage("What is SOUP?", "user"),
            AssistantMessage.text("Software of unknown provenance."),
            new UserMessage("Add the clause.", "Reviewer"));

    @Test
    @DisplayName("Claude: system prompt goes to the top-level field, authors are inlined")
    void testClaudeRequest() throws Exception {
        ClaudeAdapter adapter = ClaudeAdapter.builder().apiKey("k").model("claude-x").build();

        JsonNode request = JsonUtil.parse(adapter.buildClaudeRequest(MESSAGES));

        assertEquals("claude-x", request.get("model").asText());
        assertEquals(4096, request.get("max_tokens").asInt());
        assertEquals("You are a coach.", request.get("system").asText());
        JsonNode messages = request.get("messages");
        assertEquals(3, messages.size());
        assertEquals("assistant", messages.get(1).get("role").asText());
        assertEquals("Reviewer: Add the clause.", messages.get(2).get("content").asText());
    }

    @Test
    @DisplayName("Gemini: assistant turns use the model role")
    void testGeminiRequest() throws Exception {
        GeminiAdapter adapter = GeminiAdapter.builder().apiKey("k").model("gemini-x").temperature(0.2).build();

        JsonNode request = JsonUtil.parse(adapter.buildGeminiRequest(MESSAGES));

        assertEquals("You are a coach.", request.get("systemInstruction").get("parts").get(0).get("text").asText());
        JsonNode contents = request.get("contents");
        assertEquals(3, contents.size());
        assertEquals("model", contents.get(1).get("role").asText());
        assertEquals(0.2, request.get("generationConfig").get("temperature").asDouble(), 1e-9);
        assertFalse(request.get("generationConfig").has("maxOutputTokens"));
    }
}
