package com.codelogickeep.agent.team.framework.termination;

import com.codelogickeep.agent.team.framework.model.Transcript;

import java.util.Optional;

/**
 * Predicate over a transcript that decides whether a run must stop.
 *
 * <p>Implementations must be a pure function of the transcript they are given: no counters,
 * no reset between runs. The same instance can therefore be shared by several teams and
 * reused across runs.
 */
public interface TerminationCondition {

    /**
     * Evaluates the condition against the current transcript.
     *
     * @return the stop reason if the run must stop, empty otherwise
     */
    Optional<String> check(Transcript transcript);

    default boolean evaluate(Transcript transcript) {
        return check(transcript).isPresent();
    }

    default TerminationCondition or(TerminationCondition other) {
        return new OrTermination(this, other);
    }

    default TerminationCondition and(TerminationCondition other) {
        return new AndTermination(this, other);
    }

    static TerminationCondition maxMessages(int maxMessages) {
        return new MaxMessageTermination(maxMessages);
    }

    static TerminationCondition textMention(String keyword) {
        return new TextMentionTermination(keyword);
    }
}
