package com.codelogickeep.agent.team.framework.agent;

import com.codelogickeep.agent.team.framework.backend.Persona;
import com.codelogickeep.agent.team.framework.backend.ReasoningBackend;
import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.model.Transcript;
import com.codelogickeep.agent.team.framework.team.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Agent backed directly by the reasoning backend with a fixed persona.
 */
public class LeafAgent implements Agent {
    private static final Logger log = LoggerFactory.getLogger(LeafAgent.class);

    private final String name;
    private final String description;
    private final Persona persona;
    private final ReasoningBackend backend;

    public LeafAgent(String name, String instructions, ReasoningBackend backend) {
        this(name, name, instructions, backend);
    }

    public LeafAgent(String name, String description, String instructions, ReasoningBackend backend) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Agent name is required");
        }
        this.name = name;
        this.description = description != null ? description : name;
        this.persona = new Persona(name, instructions);
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    public Persona getPersona() {
        return persona;
    }

    @Override
    public Message respond(Transcript transcript, CancellationToken cancellation) {
        long sequence = transcript.nextSequenceNumber();
        String text = backend.complete(transcript.messages(), persona, cancellation);
        log.debug("{} produced message #{} ({} chars)", name, sequence, text.length());
        return new Message(name, text, sequence);
    }

    @Override
    public String toString() {
        return "LeafAgent{" + name + "}";
    }
}
