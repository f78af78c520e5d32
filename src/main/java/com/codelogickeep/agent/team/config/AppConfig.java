package com.codelogickeep.agent.team.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of agent.yml. Keys are kebab-case; unknown keys are ignored so older files keep loading.
 */
@Data
@JsonNaming(PropertyNamingStrategies.KebabCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    @JsonMerge
    private LlmConfig llm;
    private TeamConfig team; // replaced as a whole by a later layer
    @JsonMerge
    private SessionConfig session;

    @Data
    @JsonNaming(PropertyNamingStrategies.KebabCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LlmConfig {
        private String protocol;

        @JsonProperty("provider")
        public void setProvider(String provider) {
            this.protocol = provider;
        }

        private String apiKey;
        private String modelName;
        private Double temperature;
        private String baseUrl;
        private Long timeout; // seconds
        private Integer maxTokens;
        private boolean logRequests = false;
    }

    /**
     * A team: ordered participants plus its stop rules. Nested teams use the same shape.
     */
    @Data
    @JsonNaming(PropertyNamingStrategies.KebabCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TeamConfig {
        private String name;
        private List<ParticipantConfig> participants = new ArrayList<>();
        private TerminationConfig termination;
        private Integer maxTurns;
    }

    /**
     * A participant is either a leaf agent (persona or inline instructions) or a composite
     * agent wrapping its own team.
     */
    @Data
    @JsonNaming(PropertyNamingStrategies.KebabCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ParticipantConfig {
        private String name;
        private String description;
        private String type = "assistant"; // assistant | composite
        private String persona;            // prompt file, filesystem or classpath
        private String instructions;       // inline persona, wins over persona file
        private TeamConfig team;           // composite only
        private String instruction;        // composite only, summary preamble
        private String responsePrompt;     // composite only, closing request

        public boolean isComposite() {
            return "composite".equalsIgnoreCase(type);
        }
    }

    /**
     * Exactly one of the fields is set. {@code any} is OR, {@code all} is AND.
     */
    @Data
    @JsonNaming(PropertyNamingStrategies.KebabCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TerminationConfig {
        private Integer maxMessages;
        private String textMention;
        private List<TerminationConfig> any;
        private List<TerminationConfig> all;
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.KebabCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SessionConfig {
        private String title = "Multi-Agent Assistant";
        private List<String> topics = new ArrayList<>();
        private String farewell = "Goodbye!";
        private List<String> exitCommands = new ArrayList<>(List.of("quit", "exit", "q", "bye"));
        private boolean showInnerMessages = false;
    }
}
