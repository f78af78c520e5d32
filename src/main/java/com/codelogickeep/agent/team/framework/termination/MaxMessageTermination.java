package com.codelogickeep.agent.team.framework.termination;

import com.codelogickeep.agent.team.framework.model.Transcript;

import java.util.Optional;

/**
 * Stops once the transcript holds at least {@code maxMessages} messages, the task included.
 */
public final class MaxMessageTermination implements TerminationCondition {

    private final int maxMessages;

    public MaxMessageTermination(int maxMessages) {
        if (maxMessages < 1) {
            throw new IllegalArgumentException("maxMessages must be >= 1: " + maxMessages);
        }
        this.maxMessages = maxMessages;
    }

    @Override
    public Optional<String> check(Transcript transcript) {
        int count = transcript.size();
        if (count >= maxMessages) {
            return Optional.of("Maximum number of messages " + maxMessages
                    + " reached, current message count: " + count);
        }
        return Optional.empty();
    }

    public int getMaxMessages() {
        return maxMessages;
    }

    @Override
    public String toString() {
        return "MaxMessages(" + maxMessages + ")";
    }
}
