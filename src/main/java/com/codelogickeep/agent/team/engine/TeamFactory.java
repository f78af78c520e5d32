package com.codelogickeep.agent.team.engine;

import com.codelogickeep.agent.team.config.AppConfig;
import com.codelogickeep.agent.team.exception.ConfigurationException;
import com.codelogickeep.agent.team.exception.OrchestrationException.ErrorCode;
import com.codelogickeep.agent.team.framework.agent.Agent;
import com.codelogickeep.agent.team.framework.agent.CompositeAgent;
import com.codelogickeep.agent.team.framework.agent.LeafAgent;
import com.codelogickeep.agent.team.framework.backend.ReasoningBackend;
import com.codelogickeep.agent.team.framework.sink.ConsoleTranscriptSink;
import com.codelogickeep.agent.team.framework.sink.TranscriptSink;
import com.codelogickeep.agent.team.framework.team.RoundRobinTeam;
import com.codelogickeep.agent.team.framework.termination.TerminationCondition;
import com.codelogickeep.agent.team.framework.util.PromptTemplateLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a validated team definition into the agent object graph. Every agent, nested ones
 * included, shares the same backend.
 */
public class TeamFactory {
    private static final Logger log = LoggerFactory.getLogger(TeamFactory.class);

    private static final String INDENT = "    ";

    private final ReasoningBackend backend;
    private final boolean showInnerMessages;
    private final PrintStream out;

    public TeamFactory(ReasoningBackend backend) {
        this(backend, false, System.out);
    }

    /**
     * @param showInnerMessages print nested team conversations, indented one level per depth
     */
    public TeamFactory(ReasoningBackend backend, boolean showInnerMessages, PrintStream out) {
        this.backend = backend;
        this.showInnerMessages = showInnerMessages;
        this.out = out;
    }

    /**
     * @throws ConfigurationException if the definition cannot be turned into a team
     */
    public RoundRobinTeam create(AppConfig.TeamConfig config) {
        if (config == null) {
            throw new ConfigurationException(ErrorCode.CONFIG_MISSING_FIELD, "Team definition is missing");
        }
        RoundRobinTeam team = buildTeam(config, 0);
        log.info("Built team {}", team);
        return team;
    }

    private RoundRobinTeam buildTeam(AppConfig.TeamConfig config, int depth) {
        List<Agent> agents = new ArrayList<>();
        if (config.getParticipants() != null) {
            for (AppConfig.ParticipantConfig participant : config.getParticipants()) {
                agents.add(buildAgent(participant, depth));
            }
        }
        try {
            return RoundRobinTeam.builder()
                    .name(config.getName())
                    .participants(agents)
                    .termination(buildTermination(config.getTermination()))
                    .maxTurns(config.getMaxTurns())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID,
                    "Invalid team '" + config.getName() + "': " + e.getMessage(), null, e);
        }
    }

    private Agent buildAgent(AppConfig.ParticipantConfig participant, int depth) {
        try {
            if (participant.isComposite()) {
                if (participant.getTeam() == null) {
                    throw new ConfigurationException(ErrorCode.CONFIG_MISSING_FIELD,
                            "Composite participant '" + participant.getName() + "' has no team");
                }
                return CompositeAgent.builder()
                        .name(participant.getName())
                        .description(participant.getDescription())
                        .team(buildTeam(participant.getTeam(), depth + 1))
                        .backend(backend)
                        .instruction(participant.getInstruction())
                        .responsePrompt(participant.getResponsePrompt())
                        .innerObserver(innerObserver(depth + 1))
                        .build();
            }
            return new LeafAgent(participant.getName(), participant.getDescription(),
                    resolveInstructions(participant), backend);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID,
                    "Invalid participant '" + participant.getName() + "': " + e.getMessage(), null, e);
        }
    }

    private TranscriptSink innerObserver(int depth) {
        if (!showInnerMessages) {
            return TranscriptSink.silent();
        }
        return new ConsoleTranscriptSink(out).prefix(INDENT.repeat(depth));
    }

    private static String resolveInstructions(AppConfig.ParticipantConfig participant) {
        if (participant.getInstructions() != null && !participant.getInstructions().isBlank()) {
            return participant.getInstructions().strip();
        }
        return PromptTemplateLoader.loadTemplate(participant.getPersona());
    }

    /**
     * Maps the declarative form to a condition; {@code any} folds into OR, {@code all} into AND.
     * Returns null when no condition is configured.
     */
    static TerminationCondition buildTermination(AppConfig.TerminationConfig config) {
        if (config == null) {
            return null;
        }
        if (config.getMaxMessages() != null) {
            return TerminationCondition.maxMessages(config.getMaxMessages());
        }
        if (config.getTextMention() != null) {
            return TerminationCondition.textMention(config.getTextMention());
        }
        if (config.getAny() != null && !config.getAny().isEmpty()) {
            return fold(config.getAny(), true);
        }
        if (config.getAll() != null && !config.getAll().isEmpty()) {
            return fold(config.getAll(), false);
        }
        throw new ConfigurationException(ErrorCode.CONFIG_INVALID, "Empty termination condition");
    }

    private static TerminationCondition fold(List<AppConfig.TerminationConfig> children, boolean any) {
        TerminationCondition result = null;
        for (AppConfig.TerminationConfig child : children) {
            TerminationCondition next = buildTermination(child);
            if (result == null) {
                result = next;
            } else {
                result = any ? result.or(next) : result.and(next);
            }
        }
        return result;
    }
}
