package com.codelogickeep.agent.team.framework.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Transcript owned by a single team run. Messages can only be appended, and each one must
 * carry a sequence number greater than the previous one.
 *
 * <p>Only the owning run appends. {@link #snapshot()} may be called from any thread and
 * returns the messages as of the last completed append.
 */
public class AppendOnlyTranscript implements Transcript {

    private final List<Message> messages = new ArrayList<>();
    private final List<Message> readOnly = Collections.unmodifiableList(messages);
    private final Transcript view = () -> readOnly;
    private volatile List<Message> published = List.of();

    public void append(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        if (!messages.isEmpty()) {
            long last = messages.get(messages.size() - 1).sequenceNumber();
            if (message.sequenceNumber() <= last) {
                throw new IllegalStateException("Sequence number " + message.sequenceNumber()
                        + " from '" + message.source() + "' does not follow " + last);
            }
        }
        messages.add(message);
        published = List.copyOf(messages);
    }

    @Override
    public List<Message> messages() {
        return readOnly;
    }

    /**
     * View handed to participants; it cannot be cast back to this class.
     */
    public Transcript view() {
        return view;
    }

    public List<Message> snapshot() {
        return published;
    }
}
