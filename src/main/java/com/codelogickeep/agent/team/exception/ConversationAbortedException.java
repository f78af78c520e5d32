package com.codelogickeep.agent.team.exception;

import com.codelogickeep.agent.team.framework.model.Message;

import java.util.List;

/**
 * A team run stopped before reaching a terminal state, either because it was cancelled or
 * because a participant failed. The transcript up to the last appended message is kept
 * for diagnostics.
 */
public class ConversationAbortedException extends OrchestrationException {

    private final String teamName;
    private final List<Message> partialTranscript;

    public ConversationAbortedException(ErrorCode errorCode, String teamName, String message,
                                        List<Message> partialTranscript, Throwable cause) {
        super(errorCode, message, "team=" + teamName + ", messages=" + partialTranscript.size(), cause);
        this.teamName = teamName;
        this.partialTranscript = List.copyOf(partialTranscript);
    }

    public String getTeamName() {
        return teamName;
    }

    public List<Message> getPartialTranscript() {
        return partialTranscript;
    }

    public boolean isCancelled() {
        return getErrorCode() == ErrorCode.CONVERSATION_CANCELLED;
    }
}
