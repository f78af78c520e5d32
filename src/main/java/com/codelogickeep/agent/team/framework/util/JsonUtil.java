package com.codelogickeep.agent.team.framework.util;

import com.codelogickeep.agent.team.framework.adapter.chat.ChatMessage;
import com.codelogickeep.agent.team.framework.adapter.chat.UserMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * JSON helpers for the chat completion wire formats.
 */
public class JsonUtil {

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * Converts messages to an OpenAI style JSON array.
     */
    public static ArrayNode messagesToJson(List<ChatMessage> messages) {
        ArrayNode array = mapper.createArrayNode();

        for (ChatMessage msg : messages) {
            array.add(messageToJson(msg));
        }

        return array;
    }

    /**
     * Converts one message to OpenAI JSON. User messages keep their author in the {@code name} field.
     */
    public static ObjectNode messageToJson(ChatMessage message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("role", message.role());
        node.put("content", message.content() != null ? message.content() : "");

        if (message instanceof UserMessage user && user.name() != null && !user.name().isEmpty()) {
            node.put("name", sanitizeName(user.name()));
        }

        return node;
    }

    /**
     * OpenAI only accepts {@code [a-zA-Z0-9_-]{1,64}} as a name.
     */
    public static String sanitizeName(String name) {
        String cleaned = name.replaceAll("[^a-zA-Z0-9_-]", "_");
        return cleaned.length() > 64 ? cleaned.substring(0, 64) : cleaned;
    }

    /**
     * Builds an OpenAI Chat Completion request body.
     */
    public static String buildChatRequest(String model, List<ChatMessage> messages, Double temperature,
                                          Integer maxTokens) {
        ObjectNode request = mapper.createObjectNode();
        request.put("model", model);
        request.set("messages", messagesToJson(messages));

        if (temperature != null) {
            request.put("temperature", temperature);
        }

        if (maxTokens != null) {
            request.put("max_completion_tokens", maxTokens);
        }

        return toJson(request);
    }

    public static JsonNode parse(String json) throws JsonProcessingException {
        return mapper.readTree(json);
    }

    public static String toJson(Object obj) {
        try {
            return mapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to build request JSON", e);
        }
    }

    public static ObjectMapper getMapper() {
        return mapper;
    }
}
