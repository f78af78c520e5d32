package com.codelogickeep.agent.team.engine;

import com.codelogickeep.agent.team.config.AppConfig;
import com.codelogickeep.agent.team.exception.ConversationAbortedException;
import com.codelogickeep.agent.team.framework.model.TaskResult;
import com.codelogickeep.agent.team.framework.sink.ConsoleTranscriptSink;
import com.codelogickeep.agent.team.framework.team.CancellationToken;
import com.codelogickeep.agent.team.framework.team.Team;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Console front end: runs the outer team once per question and prints every message as it
 * arrives.
 */
public class ConsultationRunner {
    private static final Logger log = LoggerFactory.getLogger(ConsultationRunner.class);

    private static final String SEPARATOR = "=".repeat(80);

    private final Team team;
    private final AppConfig.SessionConfig session;
    private final PrintStream out;
    private volatile CancellationToken active;

    public ConsultationRunner(Team team, AppConfig.SessionConfig session) {
        this(team, session, System.out);
    }

    public ConsultationRunner(Team team, AppConfig.SessionConfig session, PrintStream out) {
        this.team = team;
        this.session = session != null ? session : new AppConfig.SessionConfig();
        this.out = out;
    }

    public void printWelcome() {
        out.println(SEPARATOR);
        out.println(session.getTitle());
        out.println(SEPARATOR);
        List<String> topics = session.getTopics();
        if (topics != null && !topics.isEmpty()) {
            out.println("\nI can help you with:");
            topics.forEach(topic -> out.println("  * " + topic));
            out.println();
        }
        out.println("Type " + exitCommandList() + " to end the session.");
        out.println(SEPARATOR);
    }

    /**
     * Runs one question to completion.
     *
     * @throws ConversationAbortedException if the run is cancelled or a participant fails
     */
    public TaskResult runSingle(String query) {
        printHeader(query);
        CancellationToken token = new CancellationToken();
        active = token;
        try {
            TaskResult result = team.run(query, new ConsoleTranscriptSink(out), token);
            log.info("Query finished: {} messages, {}", result.messages().size(), result.stopReason());
            return result;
        } finally {
            active = null;
            out.println(SEPARATOR);
        }
    }

    /**
     * Reads questions line by line until an exit command or end of input. A failed question
     * is reported and the session goes on.
     */
    public void runInteractive(BufferedReader in) throws IOException {
        printWelcome();
        while (true) {
            out.print("\nYour question: ");
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                break;
            }
            String query = line.trim();
            if (query.isEmpty()) {
                out.println("Please enter a question.");
                continue;
            }
            if (isExitCommand(query)) {
                out.println(session.getFarewell());
                break;
            }
            try {
                runSingle(query);
            } catch (ConversationAbortedException e) {
                log.warn("Query aborted: {}", e.getMessage());
                out.println(e.toDisplayMessage());
                out.println("You can continue with a new question.");
            }
        }
        log.info("Interactive session ended");
    }

    boolean isExitCommand(String input) {
        List<String> commands = session.getExitCommands();
        if (commands == null) {
            return false;
        }
        String normalized = input.trim().toLowerCase(Locale.ROOT);
        return commands.stream().anyMatch(c -> c.toLowerCase(Locale.ROOT).equals(normalized));
    }

    /**
     * Cancels the question in progress, if any.
     */
    public void cancelActive() {
        CancellationToken token = active;
        if (token != null) {
            log.info("Cancelling active run");
            token.cancel();
        }
    }

    /**
     * Registers a JVM shutdown hook that cancels the question in progress.
     */
    public Thread installShutdownHook() {
        Thread hook = new Thread(this::cancelActive, "consultation-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    private void printHeader(String query) {
        out.println();
        out.println(SEPARATOR);
        out.println("Question: " + query);
        out.println(SEPARATOR);
    }

    private String exitCommandList() {
        List<String> commands = session.getExitCommands();
        if (commands == null || commands.isEmpty()) {
            return "Ctrl+D";
        }
        return commands.stream().map(c -> "'" + c + "'").collect(Collectors.joining(", "));
    }
}
