package com.codelogickeep.agent.team.framework.adapter;

import com.codelogickeep.agent.team.framework.adapter.chat.ChatMessage;
import com.codelogickeep.agent.team.framework.team.CancellationToken;

import java.util.List;

/**
 * LLM adapter - hides the wire format of one chat completion provider.
 */
public interface LlmAdapter {

    /**
     * Sends a chat request and blocks until the completion text is available.
     *
     * @param messages     conversation, system message first
     * @param cancellation cancels the in-flight request when triggered
     * @return the completion text
     * @throws com.codelogickeep.agent.team.exception.BackendException on any failure
     */
    String chat(List<ChatMessage> messages, CancellationToken cancellation);

    /**
     * Adapter name, for logs.
     */
    String getName();
}
