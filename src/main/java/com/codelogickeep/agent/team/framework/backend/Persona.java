package com.codelogickeep.agent.team.framework.backend;

import java.util.Objects;

/**
 * Identity and standing instructions an agent sends with every completion request.
 *
 * @param name         agent name; messages with this source are the agent's own
 * @param instructions system prompt
 */
public record Persona(String name, String instructions) {

    public Persona {
        Objects.requireNonNull(name, "name");
        if (instructions == null) {
            instructions = "";
        }
    }
}
