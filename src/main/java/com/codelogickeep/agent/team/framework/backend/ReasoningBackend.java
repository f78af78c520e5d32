package com.codelogickeep.agent.team.framework.backend;

import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.team.CancellationToken;

import java.util.List;

/**
 * Turns a transcript plus a persona into the next piece of text.
 *
 * <p>One instance is shared by every agent of the process; implementations must be safe to call
 * from whichever thread is running a team and keep no per-conversation state.
 */
public interface ReasoningBackend {

    /**
     * @param transcript   messages the agent can see, oldest first
     * @param persona      who is speaking and with which instructions
     * @param cancellation cancels the in-flight call
     * @return the completion text
     * @throws com.codelogickeep.agent.team.exception.BackendException on auth, quota, network,
     *                                                                 timeout or malformed-response failures
     */
    String complete(List<Message> transcript, Persona persona, CancellationToken cancellation);
}
