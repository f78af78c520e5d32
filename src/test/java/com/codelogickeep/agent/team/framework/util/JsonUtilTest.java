package com.codelogickeep.agent.team.framework.util;

import com.codelogickeep.agent.team.framework.adapter.chat.AssistantMessage;
import com.codelogickeep.agent.team.framework.adapter.chat.SystemMessage;
import com.codelogickeep.agent.team.framework.adapter.chat.UserMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonUtil Tests")
class JsonUtilTest {

    // ========== Messages ==========

    @Test
    @DisplayName("System message to JSON")
    void testSystemMessageToJson() {
        ObjectNode json = JsonUtil.messageToJson(SystemMessage.of("You are a reviewer."));

        assertEquals("system", json.get("role").asText());
        assertEquals("You are a reviewer.", json.get("content").asText());
        assertFalse(json.has("name"));
    }

    @Test
    @DisplayName("User message keeps its author as name")
    void testUserMessageWithName() {
        ObjectNode json = JsonUtil.messageToJson(new UserMessage("Looks good", "Compliance_Reviewer"));

        assertEquals("user", json.get("role").asText());
        assertEquals("Compliance_Reviewer", json.get("name").asText());
    }

    @Test
    @DisplayName("Assistant message to JSON")
    void testAssistantMessageToJson() {
        ObjectNode json = JsonUtil.messageToJson(AssistantMessage.text(null));

        assertEquals("assistant", json.get("role").asText());
        assertEquals("", json.get("content").asText());
    }

    @Test
    @DisplayName("Names are reduced to the characters OpenAI accepts")
    void testSanitizeName() {
        assertEquals("ZenTH_ISO_Coach", JsonUtil.sanitizeName("ZenTH ISO.Coach"));
        assertEquals(64, JsonUtil.sanitizeName("x".repeat(80)).length());
    }

    // ========== Requests ==========

    @Test
    @DisplayName("Chat request carries only the options that are set")
    void testBuildChatRequest() throws JsonProcessingException {
        String body = JsonUtil.buildChatRequest("gpt-5-mini-2025-08-07",
                List.of(SystemMessage.of("s"), UserMessage.of("q")), null, 512);

        JsonNode request = JsonUtil.parse(body);
        assertEquals("gpt-5-mini-2025-08-07", request.get("model").asText());
        assertEquals(2, request.get("messages").size());
        assertFalse(request.has("temperature"));
        assertEquals(512, request.get("max_completion_tokens").asInt());
    }

    @Test
    @DisplayName("Temperature is included when set")
    void testTemperature() throws JsonProcessingException {
        JsonNode request = JsonUtil.parse(JsonUtil.buildChatRequest("m", List.of(UserMessage.of("q")), 0.3, null));

        assertEquals(0.3, request.get("temperature").asDouble(), 1e-9);
        assertFalse(request.has("max_completion_tokens"));
    }

    @Test
    @DisplayName("Invalid JSON is reported")
    void testParseInvalid() {
        assertThrows(JsonProcessingException.class, () -> JsonUtil.parse("{not json"));
    }
}
