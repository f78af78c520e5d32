package com.codelogickeep.agent.team.framework.agent;

import com.codelogickeep.agent.team.exception.ConversationAbortedException;
import com.codelogickeep.agent.team.framework.backend.Persona;
import com.codelogickeep.agent.team.framework.backend.ReasoningBackend;
import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.model.Transcript;
import com.codelogickeep.agent.team.framework.sink.TranscriptSink;
import com.codelogickeep.agent.team.framework.team.CancellationToken;
import com.codelogickeep.agent.team.framework.team.Team;
import com.codelogickeep.agent.team.framework.team.TeamRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Agent that answers by running a whole inner team and collapsing its conversation into one
 * message.
 *
 * <p>On each turn the latest outer message becomes the inner task. The inner team runs to its
 * own termination, then one backend call turns the inner transcript into a standalone answer
 * authored by this agent. The inner transcript never reaches the outer one and is dropped once
 * the summary exists; an optional observer sink can mirror it for display.
 */
public class CompositeAgent implements Agent {
    private static final Logger log = LoggerFactory.getLogger(CompositeAgent.class);

    public static final String DEFAULT_INSTRUCTION = "Earlier you were asked to fulfill a request. "
            + "You and your team worked diligently to address that request. "
            + "Here is a transcript of that conversation:";

    public static final String DEFAULT_RESPONSE_PROMPT = "Output a standalone response to the original request, "
            + "without mentioning any of the intermediate discussion.";

    private final String name;
    private final String description;
    private final Team innerTeam;
    private final ReasoningBackend backend;
    private final String instruction;
    private final String responsePrompt;
    private final TranscriptSink innerObserver;
    private final AtomicBoolean responding = new AtomicBoolean(false);

    private CompositeAgent(Builder builder) {
        this.name = builder.name;
        this.description = builder.description != null ? builder.description : builder.name;
        this.innerTeam = builder.innerTeam;
        this.backend = builder.backend;
        this.instruction = builder.instruction;
        this.responsePrompt = builder.responsePrompt;
        this.innerObserver = builder.innerObserver;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    public Team getInnerTeam() {
        return innerTeam;
    }

    @Override
    public Message respond(Transcript transcript, CancellationToken cancellation) {
        if (!responding.compareAndSet(false, true)) {
            throw new IllegalStateException("Composite agent '" + name + "' is already responding");
        }
        try {
            long sequence = transcript.nextSequenceNumber();
            String task = transcript.latest()
                    .map(Message::content)
                    .orElseThrow(() -> new IllegalStateException("Composite agent '" + name
                            + "' needs at least one message to use as its task"));

            List<Message> inner = runInnerTeam(task, cancellation);
            String summary = backend.complete(summaryContext(inner), new Persona(name, instruction), cancellation);

            log.info("{} collapsed {} inner messages into one reply", name, inner.size());
            return new Message(name, summary, sequence);
        } finally {
            responding.set(false);
        }
    }

    private List<Message> runInnerTeam(String task, CancellationToken cancellation) {
        log.debug("{} running inner team '{}'", name, innerTeam.getName());
        TeamRun run = innerTeam.runStream(task, cancellation);
        List<Message> inner = new ArrayList<>();
        try {
            while (run.hasNext()) {
                Message message = run.next();
                inner.add(message);
                innerObserver.onMessage(message);
            }
        } catch (ConversationAbortedException e) {
            innerObserver.onError(e);
            throw e;
        }
        innerObserver.onComplete(run.toResult());
        log.debug("Inner team '{}' finished after {} turns: {}", innerTeam.getName(), run.getTurns(),
                run.getStopReason());
        return inner;
    }

    /**
     * Inner transcript followed by the closing request, as seen by the summarising call.
     */
    private List<Message> summaryContext(List<Message> inner) {
        List<Message> context = new ArrayList<>(inner);
        long next = inner.isEmpty() ? 0 : inner.get(inner.size() - 1).sequenceNumber() + 1;
        context.add(new Message(Message.USER, responsePrompt, next));
        return context;
    }

    @Override
    public String toString() {
        return "CompositeAgent{" + name + ", inner=" + innerTeam.getName() + "}";
    }

    // ==================== Builder ====================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String description;
        private Team innerTeam;
        private ReasoningBackend backend;
        private String instruction = DEFAULT_INSTRUCTION;
        private String responsePrompt = DEFAULT_RESPONSE_PROMPT;
        private TranscriptSink innerObserver = TranscriptSink.silent();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder team(Team innerTeam) {
            this.innerTeam = innerTeam;
            return this;
        }

        public Builder backend(ReasoningBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder instruction(String instruction) {
            if (instruction != null) {
                this.instruction = instruction;
            }
            return this;
        }

        public Builder responsePrompt(String responsePrompt) {
            if (responsePrompt != null) {
                this.responsePrompt = responsePrompt;
            }
            return this;
        }

        public Builder innerObserver(TranscriptSink innerObserver) {
            this.innerObserver = Objects.requireNonNull(innerObserver, "innerObserver");
            return this;
        }

        public CompositeAgent build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Agent name is required");
            }
            if (innerTeam == null) {
                throw new IllegalArgumentException("Composite agent '" + name + "' needs an inner team");
            }
            if (backend == null) {
                throw new IllegalArgumentException("Composite agent '" + name + "' needs a reasoning backend");
            }
            return new CompositeAgent(this);
        }
    }
}
