package com.codelogickeep.agent.team.config;

import com.codelogickeep.agent.team.exception.ConfigurationException;
import com.codelogickeep.agent.team.exception.OrchestrationException.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates AppConfig and fills in defaults.
 */
public class ConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

    private static final long DEFAULT_TIMEOUT = 120L;
    private static final Set<String> SUPPORTED_PROTOCOLS =
            Set.of("openai", "openai-compatible", "anthropic", "claude", "gemini", "google");

    private ConfigValidator() {
    }

    /**
     * Validates the configuration.
     *
     * @throws ConfigurationException listing every problem found
     */
    public static void validate(AppConfig config) {
        if (config == null) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID, "Configuration is null", "No configuration loaded");
        }

        List<String> errors = new ArrayList<>();

        if (config.getLlm() == null) {
            errors.add("llm: LLM configuration is required");
        } else {
            validateLlmConfig(config.getLlm(), errors);
        }

        if (config.getTeam() == null) {
            errors.add("team: a team definition is required");
        } else {
            validateTeam(config.getTeam(), "team", errors);
        }

        if (!errors.isEmpty()) {
            String errorMessage = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            throw new ConfigurationException(ErrorCode.CONFIG_MISSING_FIELD, errorMessage,
                    "Check your agent.yml or command line parameters");
        }

        log.info("Configuration validation passed");
    }

    private static void validateLlmConfig(AppConfig.LlmConfig llm, List<String> errors) {
        if (isNullOrEmpty(llm.getApiKey())) {
            errors.add("llm.api-key: API key is required (use --api-key or set OPENAI_API_KEY)");
        }

        if (isNullOrEmpty(llm.getModelName())) {
            errors.add("llm.model-name: Model name is required (use --model)");
        }

        if (isNullOrEmpty(llm.getProtocol())) {
            errors.add("llm.protocol: Protocol is required (openai | anthropic | gemini)");
        } else if (!SUPPORTED_PROTOCOLS.contains(llm.getProtocol().toLowerCase())) {
            errors.add("llm.protocol: Invalid protocol '" + llm.getProtocol()
                    + "'. Supported: openai, anthropic, gemini");
        }

        if (llm.getTimeout() != null && llm.getTimeout() <= 0) {
            errors.add("llm.timeout: must be a positive number of seconds");
        }
    }

    private static void validateTeam(AppConfig.TeamConfig team, String path, List<String> errors) {
        if (isNullOrEmpty(team.getName())) {
            errors.add(path + ".name: team name is required");
        }
        if (team.getMaxTurns() != null && team.getMaxTurns() < 0) {
            errors.add(path + ".max-turns: must be >= 0");
        }
        if (team.getTermination() == null && team.getMaxTurns() == null) {
            errors.add(path + ": needs a termination condition or max-turns, otherwise it never stops");
        }
        if (team.getTermination() != null) {
            validateTermination(team.getTermination(), path + ".termination", errors);
        }

        List<AppConfig.ParticipantConfig> participants =
                team.getParticipants() != null ? team.getParticipants() : List.of();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < participants.size(); i++) {
            AppConfig.ParticipantConfig participant = participants.get(i);
            String participantPath = path + ".participants[" + i + "]";
            if (isNullOrEmpty(participant.getName())) {
                errors.add(participantPath + ".name: participant name is required");
            } else if (!names.add(participant.getName())) {
                errors.add(participantPath + ".name: duplicate participant '" + participant.getName() + "'");
            }

            if (participant.isComposite()) {
                if (participant.getTeam() == null) {
                    errors.add(participantPath + ".team: composite participant needs an inner team");
                } else {
                    validateTeam(participant.getTeam(), participantPath + ".team", errors);
                }
            } else if (!"assistant".equalsIgnoreCase(participant.getType())) {
                errors.add(participantPath + ".type: unknown type '" + participant.getType()
                        + "' (assistant | composite)");
            } else if (isNullOrEmpty(participant.getPersona()) && isNullOrEmpty(participant.getInstructions())) {
                errors.add(participantPath + ": needs a persona file or inline instructions");
            }
        }
    }

    private static void validateTermination(AppConfig.TerminationConfig termination, String path,
                                            List<String> errors) {
        int kinds = 0;
        if (termination.getMaxMessages() != null) {
            kinds++;
            if (termination.getMaxMessages() < 1) {
                errors.add(path + ".max-messages: must be >= 1");
            }
        }
        if (termination.getTextMention() != null) {
            kinds++;
            if (termination.getTextMention().isEmpty()) {
                errors.add(path + ".text-mention: keyword must not be empty");
            }
        }
        kinds += validateChildren(termination.getAny(), path + ".any", errors);
        kinds += validateChildren(termination.getAll(), path + ".all", errors);

        if (kinds != 1) {
            errors.add(path + ": exactly one of max-messages, text-mention, any, all must be set");
        }
    }

    private static int validateChildren(List<AppConfig.TerminationConfig> children, String path, List<String> errors) {
        if (children == null) {
            return 0;
        }
        if (children.isEmpty()) {
            errors.add(path + ": must list at least one condition");
        }
        for (int i = 0; i < children.size(); i++) {
            validateTermination(children.get(i), path + "[" + i + "]", errors);
        }
        return 1;
    }

    /**
     * Applies default values where the configuration is silent.
     */
    public static void applyDefaults(AppConfig config) {
        if (config == null) {
            return;
        }

        if (config.getLlm() != null) {
            AppConfig.LlmConfig llm = config.getLlm();
            if (llm.getProtocol() == null) {
                llm.setProtocol("openai");
                log.debug("Applied default protocol: openai");
            }
            if (llm.getTimeout() == null) {
                llm.setTimeout(DEFAULT_TIMEOUT);
                log.debug("Applied default timeout: {}s", DEFAULT_TIMEOUT);
            }
        }

        if (config.getSession() == null) {
            config.setSession(new AppConfig.SessionConfig());
        }

        log.info("Configuration defaults applied");
    }

    /**
     * Applies defaults, then validates.
     *
     * @throws ConfigurationException if required fields are missing
     */
    public static void validateAndApplyDefaults(AppConfig config) {
        applyDefaults(config);
        validate(config);
    }

    /**
     * Effective configuration for display, with the API key masked.
     */
    public static String getConfigSummary(AppConfig config) {
        if (config == null || config.getLlm() == null) {
            return "Configuration not loaded";
        }

        AppConfig.LlmConfig llm = config.getLlm();
        StringBuilder sb = new StringBuilder();
        sb.append("=== Configuration Summary ===\n");
        sb.append("LLM:\n");
        sb.append("  Protocol: ").append(llm.getProtocol()).append("\n");
        sb.append("  Model: ").append(llm.getModelName()).append("\n");
        sb.append("  API Key: ").append(mask(llm.getApiKey())).append("\n");
        if (llm.getTemperature() != null) {
            sb.append("  Temperature: ").append(llm.getTemperature()).append("\n");
        }
        sb.append("  Timeout: ").append(llm.getTimeout()).append("s\n");
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isEmpty()) {
            sb.append("  Base URL: ").append(llm.getBaseUrl()).append("\n");
        }
        if (config.getTeam() != null) {
            sb.append("Team:\n");
            appendTeam(sb, config.getTeam(), "  ");
        }
        sb.append("=============================\n");

        return sb.toString();
    }

    private static void appendTeam(StringBuilder sb, AppConfig.TeamConfig team, String indent) {
        sb.append(indent).append(team.getName());
        if (team.getMaxTurns() != null) {
            sb.append(" (max-turns ").append(team.getMaxTurns()).append(")");
        }
        sb.append("\n");
        if (team.getParticipants() == null) {
            return;
        }
        for (AppConfig.ParticipantConfig participant : team.getParticipants()) {
            sb.append(indent).append("  - ").append(participant.getName());
            if (participant.isComposite() && participant.getTeam() != null) {
                sb.append(" [composite]\n");
                appendTeam(sb, participant.getTeam(), indent + "    ");
            } else {
                sb.append("\n");
            }
        }
    }

    private static String mask(String apiKey) {
        if (isNullOrEmpty(apiKey)) {
            return "(not set)";
        }
        return apiKey.length() <= 8 ? "****" : apiKey.substring(0, 4) + "****" + apiKey.substring(apiKey.length() - 4);
    }

    private static boolean isNullOrEmpty(String str) {
        if (str == null || str.trim().isEmpty()) {
            return true;
        }
        // an unresolved environment placeholder counts as missing
        return str.contains("${env:") && str.contains("}");
    }
}
