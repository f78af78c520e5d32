package com.codelogickeep.agent.team.framework.team;

import com.codelogickeep.agent.team.exception.ConversationAbortedException;
import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.model.TaskResult;
import com.codelogickeep.agent.team.framework.sink.TranscriptSink;

/**
 * Scheduler that drives a fixed, ordered set of agents through turns until it stops.
 *
 * <p>A team is reusable: each run starts a fresh transcript from the task message.
 */
public interface Team {

    String getName();

    /**
     * Starts a run. Nothing happens until the caller pulls the first message.
     */
    TeamRun runStream(String task, CancellationToken cancellation);

    default TeamRun runStream(String task) {
        return runStream(task, new CancellationToken());
    }

    default TaskResult run(String task) {
        return run(task, TranscriptSink.silent(), new CancellationToken());
    }

    /**
     * Runs to termination, handing each message to the sink as soon as it is appended.
     *
     * @throws ConversationAbortedException if the run is cancelled or a participant fails
     */
    default TaskResult run(String task, TranscriptSink sink, CancellationToken cancellation) {
        TeamRun run = runStream(task, cancellation);
        try {
            while (run.hasNext()) {
                Message message = run.next();
                sink.onMessage(message);
            }
        } catch (ConversationAbortedException e) {
            sink.onError(e);
            throw e;
        }
        TaskResult result = run.toResult();
        sink.onComplete(result);
        return result;
    }
}
