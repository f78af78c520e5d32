package com.codelogickeep.agent.team.framework.adapter;

import com.codelogickeep.agent.team.framework.adapter.chat.ChatMessage;
import com.codelogickeep.agent.team.framework.team.CancellationToken;
import com.codelogickeep.agent.team.framework.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;

/**
 * OpenAI compatible adapter - OpenAI itself and any service exposing {@code /chat/completions}.
 */
public class OpenAiAdapter extends HttpLlmAdapter {
    private static final Logger log = LoggerFactory.getLogger(OpenAiAdapter.class);

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final Double temperature;
    private final Integer maxTokens;

    private OpenAiAdapter(Builder builder) {
        super(builder.timeout, builder.logRequests);
        this.baseUrl = normalizeBaseUrl(builder.baseUrl);
        this.apiKey = builder.apiKey;
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
    }

    /**
     * Strips trailing slashes and appends {@code /v1} unless the URL already carries a version path.
     */
    static String normalizeBaseUrl(String url) {
        if (url == null || url.isEmpty()) {
            return "https://api.openai.com/v1";
        }
        url = url.replaceAll("/+$", "");
        if (!url.matches(".*/v\\d+$") && !url.contains("/paas/") && !url.contains("/coding/")) {
            url = url + "/v1";
        }
        return url;
    }

    @Override
    public String getName() {
        return "OpenAI Compatible";
    }

    @Override
    public String chat(List<ChatMessage> messages, CancellationToken cancellation) {
        String endpoint = baseUrl + "/chat/completions";
        String requestBody = JsonUtil.buildChatRequest(model, messages, temperature, maxTokens);

        log.debug("Sending {} messages to {} (model={})", messages.size(), endpoint, model);
        if (requestBody.length() < 10000) {
            log.trace("Full request body: {}", requestBody);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .timeout(timeout)
                .build();

        JsonNode jsonResponse = parseJson(send(request, cancellation));
        JsonNode choices = jsonResponse.get("choices");

        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw malformed("no choices in response", null);
        }

        JsonNode message = choices.get(0).get("message");
        if (message == null || !message.has("content") || message.get("content").isNull()) {
            throw malformed("first choice has no content", null);
        }
        return message.get("content").asText();
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

        public OpenAiAdapter build() {
            if (apiKey == null || apiKey.isEmpty()) {
                throw new IllegalArgumentException("API key is required");
            }
            if (model == null || model.isEmpty()) {
                throw new IllegalArgumentException("Model name is required");
            }
            return new OpenAiAdapter(this);
        }
    }
}
