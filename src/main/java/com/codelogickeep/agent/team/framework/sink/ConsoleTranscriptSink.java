package com.codelogickeep.agent.team.framework.sink;

import com.codelogickeep.agent.team.exception.OrchestrationException;
import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints each message to the console as soon as it is appended.
 */
public class ConsoleTranscriptSink implements TranscriptSink {
    private static final Logger log = LoggerFactory.getLogger(ConsoleTranscriptSink.class);

    private final PrintStream out;
    private String prefix = "";
    private boolean showStopReason = true;
    private int messageCount = 0;

    public ConsoleTranscriptSink() {
        this(System.out);
    }

    public ConsoleTranscriptSink(PrintStream out) {
        this.out = out;
    }

    /**
     * Prefix put in front of every printed line, used to indent nested team output.
     */
    public ConsoleTranscriptSink prefix(String prefix) {
        this.prefix = prefix != null ? prefix : "";
        return this;
    }

    public ConsoleTranscriptSink showStopReason(boolean show) {
        this.showStopReason = show;
        return this;
    }

    @Override
    public void onMessage(Message message) {
        messageCount++;
        out.printf("%s---------- %s ----------%n", prefix, message.source());
        for (String line : message.content().split("\\R", -1)) {
            out.println(prefix + line);
        }
        out.flush();
        log.debug("Rendered message #{} from {}", message.sequenceNumber(), message.source());
    }

    @Override
    public void onComplete(TaskResult result) {
        if (showStopReason) {
            out.printf("%s[Stop reason: %s]%n", prefix, result.stopReason());
            out.flush();
        }
    }

    @Override
    public void onError(Throwable error) {
        String text = error instanceof OrchestrationException oe ? oe.getMessage() : String.valueOf(error);
        out.printf("%n%s[Error: %s]%n", prefix, text);
        out.flush();
    }

    public int getMessageCount() {
        return messageCount;
    }
}
