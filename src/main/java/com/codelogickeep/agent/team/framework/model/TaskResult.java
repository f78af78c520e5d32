package com.codelogickeep.agent.team.framework.model;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a completed team run.
 *
 * @param messages   full transcript, task message first
 * @param stopReason why the run stopped
 */
public record TaskResult(List<Message> messages, String stopReason) {

    public TaskResult {
        messages = List.copyOf(messages);
    }

    public Optional<Message> lastMessage() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }

    /**
     * Number of agent turns, excluding the task message.
     */
    public int turns() {
        return Math.max(0, messages.size() - 1);
    }

    public String getSummary() {
        return String.format("%d messages, %d agent turns, stopped: %s", messages.size(), turns(), stopReason);
    }
}
