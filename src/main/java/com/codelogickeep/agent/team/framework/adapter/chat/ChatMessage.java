package com.codelogickeep.agent.team.framework.adapter.chat;

/**
 * Provider-neutral chat message sent to an LLM adapter.
 */
public sealed interface ChatMessage permits SystemMessage, UserMessage, AssistantMessage {

    /**
     * Role of the message: system, user or assistant.
     */
    String role();

    String content();
}
