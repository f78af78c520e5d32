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
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;

/**
 * Claude (Anthropic) adapter.
 *
 * <p>Differences from OpenAI: the system prompt is a separate field, {@code max_tokens} is
 * mandatory and messages have no author name, so user content is prefixed with it.
 */
public class ClaudeAdapter extends HttpLlmAdapter {
    private static final Logger log = LoggerFactory.getLogger(ClaudeAdapter.class);

    private static final String API_VERSION = "2023-06-01";

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final Double temperature;
    private final int maxTokens;

    private ClaudeAdapter(Builder builder) {
        super(builder.timeout, builder.logRequests);
        this.baseUrl = builder.baseUrl != null && !builder.baseUrl.isEmpty()
                ? builder.baseUrl.replaceAll("/+$", "")
                : "https://api.anthropic.com";
        this.apiKey = builder.apiKey;
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
    }

    @Override
    public String getName() {
        return "Claude (Anthropic)";
    }

    @Override
    public String chat(List<ChatMessage> messages, CancellationToken cancellation) {
        String endpoint = baseUrl + "/v1/messages";
        String requestBody = buildClaudeRequest(messages);

        log.debug("Sending {} messages to {} (model={})", messages.size(), endpoint, model);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint))
                .header("Content-Type", "application/json")
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .timeout(timeout)
                .build();

        return parseClaudeResponse(parseJson(send(request, cancellation)));
    }

    String buildClaudeRequest(List<ChatMessage> messages) {
        ObjectNode request = JsonUtil.getMapper().createObjectNode();
        request.put("model", model);
        request.put("max_tokens", maxTokens);

        if (temperature != null) {
            request.put("temperature", temperature);
        }

        StringBuilder system = new StringBuilder();
        ArrayNode messagesArray = JsonUtil.getMapper().createArrayNode();

        for (ChatMessage msg : messages) {
            if (msg instanceof SystemMessage sys) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(sys.content());
            } else if (msg instanceof UserMessage user) {
                messagesArray.add(textMessage("user", user.attributedContent()));
            } else if (msg instanceof AssistantMessage assistant) {
                messagesArray.add(textMessage("assistant", assistant.content()));
            }
        }

        if (system.length() > 0) {
            request.put("system", system.toString());
        }
        request.set("messages", messagesArray);

        return JsonUtil.toJson(request);
    }

    private ObjectNode textMessage(String role, String content) {
        ObjectNode node = JsonUtil.getMapper().createObjectNode();
        node.put("role", role);
        node.put("content", content);
        return node;
    }

    private String parseClaudeResponse(JsonNode json) {
        JsonNode contentArray = json.get("content");
        if (contentArray == null || !contentArray.isArray()) {
            throw malformed("no content blocks in response", null);
        }

        StringBuilder content = new StringBuilder();
        for (JsonNode block : contentArray) {
            if ("text".equals(block.path("type").asText())) {
                content.append(block.path("text").asText());
            }
        }
        return content.toString();
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
        private Duration timeout = Duration.ofSeconds(120);
        private boolean logRequests = false;
        private int maxTokens = 4096;

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

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logRequests(boolean log) {
            this.logRequests = log;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            if (maxTokens != null) {
                this.maxTokens = maxTokens;
            }
            return this;
        }

        public ClaudeAdapter build() {
            if (apiKey == null || apiKey.isEmpty()) {
                throw new IllegalArgumentException("API key is required");
            }
            if (model == null || model.isEmpty()) {
                throw new IllegalArgumentException("Model name is required");
            }
            return new ClaudeAdapter(this);
        }
    }
}
