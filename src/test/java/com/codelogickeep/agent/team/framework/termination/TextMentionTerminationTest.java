package com.codelogickeep.agent.team.framework.termination;

import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.model.Transcript;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TextMentionTermination Tests")
class TextMentionTerminationTest {

    private final TextMentionTermination approve = new TextMentionTermination("APPROVE");

    @Test
    @DisplayName("Fires when the latest message contains the keyword")
    void testMentionInLatest() {
        Transcript transcript = Transcript.of(List.of(
                Message.task("Is clause 7.3 covered?"),
                new Message("Coach", "Yes, see design controls.", 1),
                new Message("Reviewer", "Looks complete. APPROVE", 2)));

        assertEquals(Optional.of("Text 'APPROVE' mentioned"), approve.check(transcript));
    }

    @Test
    @DisplayName("Fires when an earlier message contains the keyword")
    void testMentionEarlier() {
        Transcript transcript = Transcript.of(List.of(
                Message.task("q"),
                new Message("Reviewer", "I APPROVE this", 1),
                new Message("Coach", "Thanks", 2)));

        assertTrue(approve.evaluate(transcript));
    }

    @Test
    @DisplayName("The task message counts too")
    void testMentionInTask() {
        assertTrue(approve.evaluate(Transcript.of(List.of(Message.task("Say APPROVE when done")))));
    }

    @Test
    @DisplayName("Matching is a case-sensitive substring match")
    void testCaseSensitiveSubstring() {
        Transcript lower = Transcript.of(List.of(Message.task("q"), new Message("R", "approve", 1)));
        Transcript embedded = Transcript.of(List.of(Message.task("q"), new Message("R", "APPROVED.", 1)));

        assertFalse(approve.evaluate(lower));
        assertTrue(approve.evaluate(embedded));
    }

    @Test
    @DisplayName("Empty transcript never fires")
    void testEmptyTranscript() {
        assertTrue(approve.check(Transcript.of(List.of())).isEmpty());
    }

    @Test
    @DisplayName("Rejects null and empty keywords")
    void testRejectsEmptyKeyword() {
        assertThrows(IllegalArgumentException.class, () -> new TextMentionTermination(""));
        assertThrows(IllegalArgumentException.class, () -> TerminationCondition.textMention(null));
    }
}
