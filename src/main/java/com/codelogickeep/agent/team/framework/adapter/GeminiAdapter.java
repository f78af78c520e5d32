package com.codelogickeep.agent.team.framework.adapter;

import com.codelogickeep.agent.team.framework.adapter.chat.AssistantMessage;
import com.codelogickeep.agent.team.framework.adapter.chat.ChatMessage;
import com.codelogickeep.agent.team.framework.adapter.chat.SystemMessage;
import com.codelogickeep.agent.team.framework.adapter.chat.UserMessage;
import com.codelogickeep.agent.team.framework.team.CancellationToken;
import com.codelogickeep.agent.team.framework.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Google Gemini adapter.
 *
 * <p>Uses the {@code generateContent} endpoint: messages become a {@code contents} array with
 * roles {@code user} and {@code model}, the system prompt goes to {@code systemInstruction}.
 */
public class GeminiAdapter extends HttpLlmAdapter {
    private static final Logger log = LoggerFactory.getLogger(GeminiAdapter.class);

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final Double temperature;
    private final Integer maxTokens;

    private GeminiAdapter(Builder builder) {
        super(builder.timeout, builder.logRequests);
        String url = builder.baseUrl != null && !builder.baseUrl.isEmpty()
                ? builder.baseUrl
                : "https://generativelanguage.googleapis.com";
        url = url.replaceAll("/+$", "");
        if (!url.endsWith("/v1beta")) {
            url = url + "/v1beta";
        }
        this.baseUrl = url;
        this.apiKey = builder.apiKey;
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
    }

    @Override
    public String getName() {
        return "Google Gemini";
    }

    @Override
    public String chat(List<ChatMessage> messages, CancellationToken cancellation) {
        String endpoint = baseUrl + "/models/" + model + ":generateContent?key="
                + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
        String requestBody = buildGeminiRequest(messages);

        log.debug("Sending {} messages to Gemini (model={})", messages.size(), model);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .timeout(timeout)
                .build();

        return parseGeminiResponse(parseJson(send(request, cancellation)));
    }

    String buildGeminiRequest(List<ChatMessage> messages) {
        ObjectNode request = JsonUtil.getMapper().createObjectNode();
        ArrayNode contents = JsonUtil.getMapper().createArrayNode();
        StringBuilder system = new StringBuilder();

        for (ChatMessage msg : messages) {
            if (msg instanceof SystemMessage sys) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(sys.content());
            } else if (msg instanceof UserMessage user) {
                contents.add(content("user", user.attributedContent()));
            } else if (msg instanceof AssistantMessage assistant) {
                contents.add(content("model", assistant.content()));
            }
        }

        if (system.length() > 0) {
            ObjectNode instruction = JsonUtil.getMapper().createObjectNode();
            instruction.set("parts", parts(system.toString()));
            request.set("systemInstruction", instruction);
        }
        request.set("contents", contents);

        if (temperature != null || maxTokens != null) {
            ObjectNode generationConfig = JsonUtil.getMapper().createObjectNode();
            if (temperature != null) {
                generationConfig.put("temperature", temperature);
            }
            if (maxTokens != null) {
                generationConfig.put("maxOutputTokens", maxTokens);
            }
            request.set("generationConfig", generationConfig);
        }

        return JsonUtil.toJson(request);
    }

    private ObjectNode content(String role, String text) {
        ObjectNode node = JsonUtil.getMapper().createObjectNode();
        node.put("role", role);
        node.set("parts", parts(text));
        return node;
    }

    private ArrayNode parts(String text) {
        ArrayNode parts = JsonUtil.getMapper().createArrayNode();
        ObjectNode part = JsonUtil.getMapper().createObjectNode();
        part.put("text", text);
        parts.add(part);
        return parts;
    }

    private String parseGeminiResponse(JsonNode json) {
        JsonNode candidates = json.get("candidates");
        if (candidates == null || !candidates.isArray() || candidates.isEmpty()) {
            throw malformed("no candidates in response", null);
        }

        JsonNode parts = candidates.get(0).path("content").path("parts");
        if (!parts.isArray()) {
            throw malformed("first candidate has no parts", null);
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            if (part.has("text")) {
                text.append(part.get("text").asText());
            }
        }
        return text.toString();
    }

    // ==================== Builder ====================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiKey;
        private String model;
        private Double temperature;
        private Integer maxTokens;
        private Duration timeout = Duration.ofSeconds(120);
        private boolean logRequests = false;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logRequests(boolean log) {
            this.logRequests = log;
            return this;
        }

        public GeminiAdapter build() {
            if (apiKey == null || apiKey.isEmpty()) {
                throw new IllegalArgumentException("API key is required");
            }
            if (model == null || model.isEmpty()) {
                throw new IllegalArgumentException("Model name is required");
            }
            return new GeminiAdapter(this);
        }
    }
}
