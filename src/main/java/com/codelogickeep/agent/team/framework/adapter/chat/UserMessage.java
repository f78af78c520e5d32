package com.codelogickeep.agent.team.framework.adapter.chat;

/**
 * Input from the user or from another participant of the conversation.
 *
 * @param content message text
 * @param name    author of the message, null when anonymous
 */
public record UserMessage(String content, String name) implements ChatMessage {

    public UserMessage {
        if (content == null) {
            content = "";
        }
    }

    public UserMessage(String content) {
        this(content, null);
    }

    @Override
    public String role() {
        return "user";
    }

    /**
     * Content prefixed with the author, for providers that have no name field.
     */
    public String attributedContent() {
        return name == null || name.isEmpty() ? content : name + ": " + content;
    }

    public static UserMessage of(String content) {
        return new UserMessage(content);
    }
}
