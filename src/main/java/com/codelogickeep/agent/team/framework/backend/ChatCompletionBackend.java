package com.codelogickeep.agent.team.framework.backend;

import com.codelogickeep.agent.team.exception.BackendException;
import com.codelogickeep.agent.team.exception.OrchestrationException.ErrorCode;
import com.codelogickeep.agent.team.framework.adapter.LlmAdapter;
import com.codelogickeep.agent.team.framework.adapter.chat.AssistantMessage;
import com.codelogickeep.agent.team.framework.adapter.chat.ChatMessage;
import com.codelogickeep.agent.team.framework.adapter.chat.SystemMessage;
import com.codelogickeep.agent.team.framework.adapter.chat.UserMessage;
import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.team.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reasoning backend on top of a chat completion adapter.
 *
 * <p>The persona becomes the system message, the agent's own earlier messages become assistant
 * messages and everything else becomes a user message tagged with its author.
 */
public class ChatCompletionBackend implements ReasoningBackend {
    private static final Logger log = LoggerFactory.getLogger(ChatCompletionBackend.class);

    private final LlmAdapter adapter;

    public ChatCompletionBackend(LlmAdapter adapter) {
        this.adapter = adapter;
    }

    @Override
    public String complete(List<Message> transcript, Persona persona, CancellationToken cancellation) {
        List<ChatMessage> chat = toChatMessages(transcript, persona);
        log.debug("Completion for {} over {} messages via {}", persona.name(), transcript.size(), adapter.getName());

        String text = adapter.chat(chat, cancellation);
        if (text == null) {
            throw new BackendException(ErrorCode.BACKEND_MALFORMED_RESPONSE,
                    adapter.getName() + " returned no text for " + persona.name());
        }
        return text;
    }

    static List<ChatMessage> toChatMessages(List<Message> transcript, Persona persona) {
        List<ChatMessage> chat = new ArrayList<>(transcript.size() + 1);
        if (!persona.instructions().isBlank()) {
            chat.add(SystemMessage.of(persona.instructions()));
        }
        for (Message message : transcript) {
            if (message.isFrom(persona.name())) {
                chat.add(AssistantMessage.text(message.content()));
            } else {
                chat.add(new UserMessage(message.content(), message.source()));
            }
        }
        return chat;
    }
}
