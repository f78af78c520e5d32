package com.codelogickeep.agent.team.framework.agent;

import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.model.Transcript;
import com.codelogickeep.agent.team.framework.team.CancellationToken;

/**
 * Participant of a team. Given the transcript so far it produces exactly one new message.
 *
 * <p>The returned message must be authored by this agent and carry
 * {@link Transcript#nextSequenceNumber()}. Implementations keep no state between runs.
 */
public interface Agent {

    /**
     * Name of the agent, unique within its team.
     */
    String getName();

    /**
     * Short description used in logs and on the console.
     */
    default String getDescription() {
        return getName();
    }

    /**
     * Produces the next message of the conversation.
     *
     * @param transcript   read-only view of the whole conversation so far
     * @param cancellation token of the current run, to be forwarded to blocking calls
     * @return the new message
     * @throws com.codelogickeep.agent.team.exception.BackendException if the reasoning backend fails
     */
    Message respond(Transcript transcript, CancellationToken cancellation);
}
