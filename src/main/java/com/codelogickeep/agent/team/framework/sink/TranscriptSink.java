package com.codelogickeep.agent.team.framework.sink;

import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.model.TaskResult;

/**
 * Consumer of a run's messages, called in append order on the scheduling thread.
 * A slow sink delays the next turn.
 */
public interface TranscriptSink {

    /**
     * Called once per appended message.
     */
    void onMessage(Message message);

    /**
     * Called once when the run reaches a terminal state.
     */
    default void onComplete(TaskResult result) {
    }

    /**
     * Called once when the run is aborted, before the error is rethrown to the caller.
     */
    default void onError(Throwable error) {
    }

    static TranscriptSink silent() {
        return message -> { };
    }
}
