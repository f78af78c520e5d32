package com.codelogickeep.agent.team.framework.agent;

import com.codelogickeep.agent.team.exception.BackendException;
import com.codelogickeep.agent.team.exception.ConversationAbortedException;
import com.codelogickeep.agent.team.exception.OrchestrationException.ErrorCode;
import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.model.TaskResult;
import com.codelogickeep.agent.team.framework.model.Transcript;
import com.codelogickeep.agent.team.framework.sink.TranscriptSink;
import com.codelogickeep.agent.team.framework.team.CancellationToken;
import com.codelogickeep.agent.team.framework.team.RoundRobinTeam;
import com.codelogickeep.agent.team.framework.team.Team;
import com.codelogickeep.agent.team.framework.termination.TerminationCondition;
import com.codelogickeep.agent.team.framework.testsupport.ScriptedAgent;
import com.codelogickeep.agent.team.framework.testsupport.StubBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("CompositeAgent Tests")
class CompositeAgentTest {

    private ScriptedAgent coach;
    private ScriptedAgent reviewer;
    private RoundRobinTeam innerTeam;
    private StubBackend backend;

    @BeforeEach
    void setUp() {
        coach = ScriptedAgent.counting("Coach");
        reviewer = ScriptedAgent.counting("Reviewer");
        innerTeam = RoundRobinTeam.builder()
                .name("standards_team")
                .participants(coach, reviewer)
                .termination(TerminationCondition.maxMessages(4))
                .build();
        backend = new StubBackend((messages, persona) -> "summary of " + (messages.size() - 1) + " messages");
    }

    private CompositeAgent composite() {
        return CompositeAgent.builder().name("SoM").team(innerTeam).backend(backend).build();
    }

    @Test
    @DisplayName("Nested team collapses into exactly one outer message")
    void testNestedScenario() {
        ScriptedAgent formatter = ScriptedAgent.replying("Formatter", "formatted");
        RoundRobinTeam outer = RoundRobinTeam.builder()
                .name("final_team")
                .participants(composite(), formatter)
                .maxTurns(2)
                .build();

        TaskResult result = outer.run("Explain ISO 14971");

        assertEquals(List.of("user", "SoM", "Formatter"),
                result.messages().stream().map(Message::source).toList());
        assertEquals("summary of 4 messages", result.messages().get(1).content());
        assertEquals(2, coach.getCalls());
        assertEquals(1, reviewer.getCalls());
        // inner messages never leak into the outer transcript
        assertTrue(result.messages().stream().noneMatch(m -> m.isFrom("Coach") || m.isFrom("Reviewer")));
        assertEquals(1, formatter.getCalls());
    }

    @Test
    @DisplayName("Latest outer message becomes the inner task")
    void testInnerTask() {
        Transcript outer = Transcript.of(List.of(
                Message.task("original question"),
                new Message("Formatter", "latest text", 1)));

        composite().respond(outer, new CancellationToken());

        assertEquals("latest text", coach.getSeen().get(0).get(0).content());
        assertEquals(Message.USER, coach.getSeen().get(0).get(0).source());
    }

    @Test
    @DisplayName("Summary call sees the inner transcript, the preamble and the closing request")
    void testSummaryContext() {
        Message reply = composite().respond(Transcript.of(List.of(Message.task("q"))), new CancellationToken());

        assertEquals(1, backend.getCalls().size());
        StubBackend.Call call = backend.getCalls().get(0);
        assertEquals("SoM", call.persona().name());
        assertEquals(CompositeAgent.DEFAULT_INSTRUCTION, call.persona().instructions());

        List<Message> context = call.messages();
        assertEquals(List.of("user", "Coach", "Reviewer", "Coach", "user"),
                context.stream().map(Message::source).toList());
        assertEquals(CompositeAgent.DEFAULT_RESPONSE_PROMPT, context.get(4).content());

        assertEquals("SoM", reply.source());
        assertEquals(1, reply.sequenceNumber());
    }

    @Test
    @DisplayName("Custom preamble and closing request are used")
    void testCustomPrompts() {
        CompositeAgent agent = CompositeAgent.builder()
                .name("SoM")
                .team(innerTeam)
                .backend(backend)
                .instruction("Summarise this:")
                .responsePrompt("Answer in one line.")
                .build();

        agent.respond(Transcript.of(List.of(Message.task("q"))), new CancellationToken());

        StubBackend.Call call = backend.getCalls().get(0);
        assertEquals("Summarise this:", call.persona().instructions());
        assertEquals("Answer in one line.", call.messages().get(call.messages().size() - 1).content());
    }

    @Test
    @DisplayName("Each response runs the inner team from scratch")
    void testFreshInnerRun() {
        CompositeAgent agent = composite();

        agent.respond(Transcript.of(List.of(Message.task("first"))), new CancellationToken());
        agent.respond(Transcript.of(List.of(Message.task("second"))), new CancellationToken());

        assertEquals(4, coach.getCalls());
        List<Message> secondRun = coach.getSeen().get(2);
        assertEquals(1, secondRun.size());
        assertEquals("second", secondRun.get(0).content());
    }

    @Test
    @DisplayName("Observer sees inner messages and the inner stop reason")
    void testObserver() {
        List<String> events = new ArrayList<>();
        TranscriptSink observer = new TranscriptSink() {
            @Override
            public void onMessage(Message message) {
                events.add(message.source());
            }

            @Override
            public void onComplete(TaskResult result) {
                events.add("stop");
            }
        };
        CompositeAgent agent = CompositeAgent.builder()
                .name("SoM").team(innerTeam).backend(backend).innerObserver(observer).build();

        agent.respond(Transcript.of(List.of(Message.task("q"))), new CancellationToken());

        assertEquals(List.of("user", "Coach", "Reviewer", "Coach", "stop"), events);
    }

    @Test
    @DisplayName("Inner failure propagates and no summary is requested")
    void testInnerFailure() {
        RoundRobinTeam failing = RoundRobinTeam.builder()
                .name("standards_team")
                .participant(ScriptedAgent.failing("Coach",
                        new BackendException(ErrorCode.BACKEND_QUOTA, "API error: 429")))
                .maxTurns(2)
                .build();
        TranscriptSink observer = mock(TranscriptSink.class);
        CompositeAgent agent = CompositeAgent.builder()
                .name("SoM").team(failing).backend(backend).innerObserver(observer).build();

        ConversationAbortedException e = assertThrows(ConversationAbortedException.class,
                () -> agent.respond(Transcript.of(List.of(Message.task("q"))), new CancellationToken()));

        assertEquals("standards_team", e.getTeamName());
        assertTrue(backend.getCalls().isEmpty());
        verify(observer).onError(any());
    }

    @Test
    @DisplayName("Inner failure aborts the outer run too")
    void testInnerFailureAbortsOuter() {
        RoundRobinTeam failing = RoundRobinTeam.builder()
                .name("standards_team")
                .participant(ScriptedAgent.failing("Coach", new IllegalStateException("down")))
                .maxTurns(2)
                .build();
        RoundRobinTeam outer = RoundRobinTeam.builder()
                .name("final_team")
                .participants(CompositeAgent.builder().name("SoM").team(failing).backend(backend).build(),
                        ScriptedAgent.counting("Formatter"))
                .maxTurns(2)
                .build();

        ConversationAbortedException e = assertThrows(ConversationAbortedException.class, () -> outer.run("q"));

        assertEquals("final_team", e.getTeamName());
        assertEquals(1, e.getPartialTranscript().size());
        assertInstanceOf(ConversationAbortedException.class, e.getCause());
    }

    @Test
    @DisplayName("Cancellation reaches the inner run")
    void testCancellationShared() {
        CancellationToken token = new CancellationToken();
        ScriptedAgent cancelling = new ScriptedAgent("Coach", t -> {
            token.cancel();
            return "partial";
        });
        RoundRobinTeam inner = RoundRobinTeam.builder()
                .name("standards_team")
                .participants(cancelling, ScriptedAgent.counting("Reviewer"))
                .maxTurns(4)
                .build();
        CompositeAgent agent = CompositeAgent.builder().name("SoM").team(inner).backend(backend).build();

        ConversationAbortedException e = assertThrows(ConversationAbortedException.class,
                () -> agent.respond(Transcript.of(List.of(Message.task("q"))), token));

        assertTrue(e.isCancelled());
        assertTrue(backend.getCalls().isEmpty());
    }

    @Test
    @DisplayName("Re-entrant use is rejected")
    void testReentrancy() {
        CompositeAgent[] self = new CompositeAgent[1];
        Team reentrant = mock(Team.class);
        when(reentrant.getName()).thenReturn("loop");
        when(reentrant.runStream(any(), any())).thenAnswer(invocation -> {
            self[0].respond(Transcript.of(List.of(Message.task("again"))), new CancellationToken());
            return null;
        });
        self[0] = CompositeAgent.builder().name("SoM").team(reentrant).backend(backend).build();

        assertThrows(IllegalStateException.class,
                () -> self[0].respond(Transcript.of(List.of(Message.task("q"))), new CancellationToken()));
    }

    @Test
    @DisplayName("Empty transcript has no task to hand down")
    void testEmptyTranscript() {
        assertThrows(IllegalStateException.class,
                () -> composite().respond(Transcript.of(List.of()), new CancellationToken()));
    }

    @Test
    @DisplayName("Builder requires name, team and backend")
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> CompositeAgent.builder().team(innerTeam).backend(backend).build());
        assertThrows(IllegalArgumentException.class,
                () -> CompositeAgent.builder().name("SoM").backend(backend).build());
        assertThrows(IllegalArgumentException.class,
                () -> CompositeAgent.builder().name("SoM").team(innerTeam).build());
    }
}
