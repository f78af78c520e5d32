package com.codelogickeep.agent.team.framework.adapter;

import com.codelogickeep.agent.team.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Creates the adapter matching the configured protocol.
 */
public class LlmAdapterFactory {
    private static final Logger log = LoggerFactory.getLogger(LlmAdapterFactory.class);

    private LlmAdapterFactory() {
    }

    public static LlmAdapter create(AppConfig.LlmConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("LLM config is required");
        }

        String protocol = config.getProtocol() != null ? config.getProtocol().toLowerCase() : "openai";
        String baseUrl = config.getBaseUrl();
        String apiKey = config.getApiKey();
        String model = config.getModelName();
        Double temperature = config.getTemperature();
        Duration timeout = config.getTimeout() != null
                ? Duration.ofSeconds(config.getTimeout())
                : Duration.ofSeconds(120);
        boolean logRequests = config.isLogRequests()
                || Boolean.parseBoolean(System.getProperty("llm.log.requests", "false"));

        log.info("Creating LLM adapter: protocol={}, model={}, baseUrl={}", protocol, model, baseUrl);

        return switch (protocol) {
            case "openai", "openai-compatible" -> OpenAiAdapter.builder()
                    .baseUrl(baseUrl)
                    .apiKey(apiKey)
                    .model(model)
                    .temperature(temperature)
                    .maxTokens(config.getMaxTokens())
                    .timeout(timeout)
                    .logRequests(logRequests)
                    .build();

            case "anthropic", "claude" -> ClaudeAdapter.builder()
                    .baseUrl(baseUrl)
                    .apiKey(apiKey)
                    .model(model)
                    .temperature(temperature)
                    .maxTokens(config.getMaxTokens())
                    .timeout(timeout)
                    .logRequests(logRequests)
                    .build();

            case "gemini", "google" -> GeminiAdapter.builder()
                    .baseUrl(baseUrl)
                    .apiKey(apiKey)
                    .model(model)
                    .temperature(temperature)
                    .maxTokens(config.getMaxTokens())
                    .timeout(timeout)
                    .logRequests(logRequests)
                    .build();

            default -> throw new IllegalArgumentException(
                    "Unsupported protocol: " + protocol + ". Supported: openai, anthropic, gemini");
        };
    }
}
