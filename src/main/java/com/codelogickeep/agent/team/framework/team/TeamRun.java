package com.codelogickeep.agent.team.framework.team;

import com.codelogickeep.agent.team.exception.BackendException;
import com.codelogickeep.agent.team.exception.ConversationAbortedException;
import com.codelogickeep.agent.team.exception.OrchestrationException.ErrorCode;
import com.codelogickeep.agent.team.framework.agent.Agent;
import com.codelogickeep.agent.team.framework.model.AppendOnlyTranscript;
import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.model.TaskResult;
import com.codelogickeep.agent.team.framework.termination.TerminationCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * One execution of a team, delivered lazily one message at a time.
 *
 * <p>The first {@link #next()} appends the task message; every following call runs exactly one
 * participant turn. Termination is evaluated after each appended message. A run is not
 * restartable: once terminal (or aborted) {@link #hasNext()} stays false.
 *
 * <p>{@link #next()} is serialized and blocks for the whole participant turn. The accessors
 * do not take that lock, so another thread can inspect a run while a turn is in progress.
 */
public class TeamRun implements Iterator<Message> {
    private static final Logger log = LoggerFactory.getLogger(TeamRun.class);

    private enum State { NEW, RUNNING, TERMINATED, ABORTED }

    private final String teamName;
    private final List<Agent> participants;
    private final TerminationCondition termination;
    private final Integer maxTurns;
    private final String task;
    private final CancellationToken cancellation;
    private final AppendOnlyTranscript transcript = new AppendOnlyTranscript();

    private volatile State state = State.NEW;
    private volatile int turns = 0;
    private volatile String stopReason;

    TeamRun(String teamName, List<Agent> participants, TerminationCondition termination,
            Integer maxTurns, String task, CancellationToken cancellation) {
        this.teamName = teamName;
        this.participants = participants;
        this.termination = termination;
        this.maxTurns = maxTurns;
        this.task = task;
        this.cancellation = cancellation;
    }

    @Override
    public boolean hasNext() {
        return state == State.NEW || state == State.RUNNING;
    }

    /**
     * Appends and returns the next message.
     *
     * @throws ConversationAbortedException if the run was cancelled or the participant failed
     * @throws NoSuchElementException       if the run is already terminal or aborted
     */
    @Override
    public synchronized Message next() {
        return switch (state) {
            case NEW -> appendTask();
            case RUNNING -> takeTurn();
            case TERMINATED, ABORTED -> throw new NoSuchElementException(
                    "Run of team '" + teamName + "' is " + state.name().toLowerCase());
        };
    }

    private Message appendTask() {
        log.info("Team '{}' started with {} participants", teamName, participants.size());
        Message message = Message.task(task);
        transcript.append(message);
        state = State.RUNNING;
        evaluateStop();
        return message;
    }

    private Message takeTurn() {
        if (cancellation.isCancelled()) {
            throw abort(ErrorCode.CONVERSATION_CANCELLED, "Run cancelled before turn " + (turns + 1), null);
        }

        Agent speaker = participants.get(turns % participants.size());
        log.debug("Team '{}' turn #{} -> {}", teamName, turns + 1, speaker.getName());

        Message message;
        try {
            message = speaker.respond(transcript.view(), cancellation);
        } catch (RuntimeException e) {
            ErrorCode code = isCancellation(e) ? ErrorCode.CONVERSATION_CANCELLED : ErrorCode.CONVERSATION_ABORTED;
            throw abort(code, "Participant '" + speaker.getName() + "' failed: " + e.getMessage(), e);
        }

        if (message == null || !message.isFrom(speaker.getName())) {
            throw abort(ErrorCode.CONVERSATION_ABORTED, "Participant '" + speaker.getName()
                    + "' returned a message it did not author", null);
        }
        try {
            transcript.append(message);
        } catch (IllegalStateException e) {
            throw abort(ErrorCode.CONVERSATION_ABORTED, e.getMessage(), e);
        }

        turns++;
        evaluateStop();
        return message;
    }

    private void evaluateStop() {
        String reason = null;
        if (participants.isEmpty()) {
            reason = "No participants";
        } else {
            Optional<String> conditionReason = termination != null
                    ? termination.check(transcript.view())
                    : Optional.empty();
            if (conditionReason.isPresent()) {
                reason = conditionReason.get();
            } else if (maxTurns != null && turns >= maxTurns) {
                reason = "Maximum number of turns " + maxTurns + " reached.";
            }
        }

        if (reason != null) {
            stopReason = reason;
            state = State.TERMINATED;
            log.info("Team '{}' stopped after {} turns: {}", teamName, turns, reason);
        }
    }

    private ConversationAbortedException abort(ErrorCode code, String message, Throwable cause) {
        state = State.ABORTED;
        log.info("Team '{}' aborted after {} turns: {}", teamName, turns, message);
        return new ConversationAbortedException(code, teamName, message, transcript.snapshot(), cause);
    }

    private boolean isCancellation(RuntimeException e) {
        if (cancellation.isCancelled()) {
            return true;
        }
        if (e instanceof BackendException backend) {
            return backend.isCancellation();
        }
        if (e instanceof ConversationAbortedException aborted) {
            return aborted.isCancelled();
        }
        return false;
    }

    public boolean isTerminal() {
        return state == State.TERMINATED;
    }

    public boolean isAborted() {
        return state == State.ABORTED;
    }

    /**
     * Why the run stopped, or null while it is still going (or was aborted).
     */
    public String getStopReason() {
        return stopReason;
    }

    public int getTurns() {
        return turns;
    }

    public String getTeamName() {
        return teamName;
    }

    public List<Message> getTranscript() {
        return transcript.snapshot();
    }

    /**
     * Builds the result of a terminal run.
     *
     * @throws IllegalStateException if the run has not terminated
     */
    public TaskResult toResult() {
        if (state != State.TERMINATED) {
            throw new IllegalStateException("Run of team '" + teamName + "' has not terminated");
        }
        return new TaskResult(transcript.snapshot(), stopReason);
    }

    /**
     * Remaining messages as a sequential stream.
     */
    public Stream<Message> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false);
    }
}
