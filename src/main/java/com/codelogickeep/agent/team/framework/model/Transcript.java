package com.codelogickeep.agent.team.framework.model;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the ordered messages of one run. Every participant sees the full
 * prefix; only the owning run can append.
 */
public interface Transcript {

    /**
     * Messages in append order, unmodifiable.
     */
    List<Message> messages();

    default int size() {
        return messages().size();
    }

    default boolean isEmpty() {
        return messages().isEmpty();
    }

    default Optional<Message> latest() {
        List<Message> messages = messages();
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }

    /**
     * Sequence number the next appended message must carry.
     */
    default long nextSequenceNumber() {
        return latest().map(m -> m.sequenceNumber() + 1).orElse(0L);
    }

    static Transcript of(List<Message> messages) {
        List<Message> copy = List.copyOf(messages);
        return () -> copy;
    }
}
