package com.codelogickeep.agent.team.framework.agent;

import com.codelogickeep.agent.team.exception.BackendException;
import com.codelogickeep.agent.team.exception.OrchestrationException.ErrorCode;
import com.codelogickeep.agent.team.framework.backend.Persona;
import com.codelogickeep.agent.team.framework.backend.ReasoningBackend;
import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.model.Transcript;
import com.codelogickeep.agent.team.framework.team.CancellationToken;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeafAgentTest {

    @Mock
    private ReasoningBackend backend;

    @Test
    void testRespondStampsNameAndSequence() {
        Transcript transcript = Transcript.of(List.of(
                Message.task("q"),
                new Message("Coach", "draft", 1)));
        CancellationToken token = new CancellationToken();
        when(backend.complete(eq(transcript.messages()), eq(new Persona("Reviewer", "Review it.")), eq(token)))
                .thenReturn("APPROVE");

        Message reply = new LeafAgent("Reviewer", "Review it.", backend).respond(transcript, token);

        assertEquals(new Message("Reviewer", "APPROVE", 2), reply);
    }

    @Test
    void testBackendErrorPropagates() {
        BackendException error = new BackendException(ErrorCode.BACKEND_AUTH, "API error: 401");
        when(backend.complete(any(), any(), any())).thenThrow(error);
        LeafAgent agent = new LeafAgent("Coach", "persona", backend);

        BackendException thrown = assertThrows(BackendException.class,
                () -> agent.respond(Transcript.of(List.of(Message.task("q"))), new CancellationToken()));
        assertSame(error, thrown);
    }

    @Test
    void testDescriptionDefaultsToName() {
        LeafAgent agent = new LeafAgent("Coach", null, "persona", backend);

        assertEquals("Coach", agent.getDescription());
        assertEquals("persona", agent.getPersona().instructions());
    }

    @Test
    void testRejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> new LeafAgent(" ", "p", backend));
        assertThrows(NullPointerException.class, () -> new LeafAgent("A", "p", null));
    }
}
