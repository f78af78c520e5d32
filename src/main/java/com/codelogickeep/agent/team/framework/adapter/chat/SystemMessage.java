package com.codelogickeep.agent.team.framework.adapter.chat;

/**
 * Instructions that set the role and behavior of the model.
 */
public record SystemMessage(String content) implements ChatMessage {

    @Override
    public String role() {
        return "system";
    }

    public static SystemMessage of(String content) {
        return new SystemMessage(content);
    }
}
