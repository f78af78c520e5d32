package com.codelogickeep.agent.team.framework.team;

import com.codelogickeep.agent.team.framework.agent.Agent;
import com.codelogickeep.agent.team.framework.termination.TerminationCondition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Team whose participants take turns in a fixed order, wrapping to the first after the last.
 * Participant {@code (i - 1) mod n} handles turn {@code i}.
 *
 * <p>The participant list, termination condition and turn bound are fixed at construction.
 * Runs share nothing but the participants, so the same instance can be run again.
 */
public class RoundRobinTeam implements Team {

    private final String name;
    private final List<Agent> participants;
    private final TerminationCondition termination;
    private final Integer maxTurns;

    private RoundRobinTeam(Builder builder) {
        this.name = builder.name;
        this.participants = List.copyOf(builder.participants);
        this.termination = builder.termination;
        this.maxTurns = builder.maxTurns;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public TeamRun runStream(String task, CancellationToken cancellation) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(cancellation, "cancellation");
        return new TeamRun(name, participants, termination, maxTurns, task, cancellation);
    }

    public List<Agent> getParticipants() {
        return participants;
    }

    public TerminationCondition getTermination() {
        return termination;
    }

    public Integer getMaxTurns() {
        return maxTurns;
    }

    @Override
    public String toString() {
        return "RoundRobinTeam{name=" + name + ", participants=" + participants.stream().map(Agent::getName).toList()
                + ", termination=" + termination + ", maxTurns=" + maxTurns + "}";
    }

    // ==================== Builder ====================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name = "team";
        private final List<Agent> participants = new ArrayList<>();
        private TerminationCondition termination;
        private Integer maxTurns;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder participant(Agent agent) {
            this.participants.add(agent);
            return this;
        }

        public Builder participants(List<? extends Agent> agents) {
            this.participants.addAll(agents);
            return this;
        }

        public Builder participants(Agent... agents) {
            return participants(List.of(agents));
        }

        public Builder termination(TerminationCondition termination) {
            this.termination = termination;
            return this;
        }

        public Builder maxTurns(Integer maxTurns) {
            this.maxTurns = maxTurns;
            return this;
        }

        public RoundRobinTeam build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Team name is required");
            }
            Set<String> names = new HashSet<>();
            for (Agent agent : participants) {
                if (agent == null) {
                    throw new IllegalArgumentException("Team '" + name + "' has a null participant");
                }
                if (!names.add(agent.getName())) {
                    throw new IllegalArgumentException("Duplicate participant name '" + agent.getName()
                            + "' in team '" + name + "'");
                }
            }
            if (maxTurns != null && maxTurns < 0) {
                throw new IllegalArgumentException("maxTurns must be >= 0: " + maxTurns);
            }
            if (termination == null && maxTurns == null) {
                throw new IllegalArgumentException("Team '" + name
                        + "' needs a termination condition or a maximum number of turns");
            }
            return new RoundRobinTeam(this);
        }
    }
}
