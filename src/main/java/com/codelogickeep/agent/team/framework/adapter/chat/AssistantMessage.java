package com.codelogickeep.agent.team.framework.adapter.chat;

/**
 * Earlier output of the model itself.
 */
public record AssistantMessage(String content) implements ChatMessage {

    public AssistantMessage {
        // some providers reject a missing content field
        if (content == null) {
            content = "";
        }
    }

    @Override
    public String role() {
        return "assistant";
    }

    public static AssistantMessage text(String content) {
        return new AssistantMessage(content);
    }
}
