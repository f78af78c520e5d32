package com.codelogickeep.agent.team.framework.testsupport;

import com.codelogickeep.agent.team.framework.agent.Agent;
import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.model.Transcript;
import com.codelogickeep.agent.team.framework.team.CancellationToken;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Agent whose replies are computed from the transcript it is shown. Records every call.
 */
public class ScriptedAgent implements Agent {

    private final String name;
    private final Function<Transcript, String> script;
    private final List<List<Message>> seen = new ArrayList<>();

    public ScriptedAgent(String name, Function<Transcript, String> script) {
        this.name = name;
        this.script = script;
    }

    /**
     * Replies "name#k" on its k-th call, starting at 1.
     */
    public static ScriptedAgent counting(String name) {
        int[] calls = {0};
        return new ScriptedAgent(name, t -> name + "#" + (++calls[0]));
    }

    /**
     * Replies with the given texts in order, repeating the last one once they run out.
     */
    public static ScriptedAgent replying(String name, String... replies) {
        int[] calls = {0};
        return new ScriptedAgent(name, t -> replies[Math.min(calls[0]++, replies.length - 1)]);
    }

    public static ScriptedAgent failing(String name, RuntimeException error) {
        return new ScriptedAgent(name, t -> {
            throw error;
        });
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Message respond(Transcript transcript, CancellationToken cancellation) {
        seen.add(List.copyOf(transcript.messages()));
        return new Message(name, script.apply(transcript), transcript.nextSequenceNumber());
    }

    public int getCalls() {
        return seen.size();
    }

    /**
     * Transcripts as seen on each call.
     */
    public List<List<Message>> getSeen() {
        return seen;
    }
}
