package com.codelogickeep.agent.team.framework.model;

import java.util.Objects;

/**
 * One entry of a conversation transcript.
 *
 * @param source         name of the participant that authored the message ({@code user} for the task)
 * @param content        message text, never null
 * @param sequenceNumber position in the owning transcript, strictly increasing from 0
 */
public record Message(String source, String content, long sequenceNumber) {

    /** Source name used for the task message that opens every run. */
    public static final String USER = "user";

    public Message {
        Objects.requireNonNull(source, "source");
        if (content == null) {
            content = "";
        }
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("sequenceNumber must be >= 0: " + sequenceNumber);
        }
    }

    public static Message task(String content) {
        return new Message(USER, content, 0);
    }

    public boolean isFrom(String name) {
        return source.equals(name);
    }
}
