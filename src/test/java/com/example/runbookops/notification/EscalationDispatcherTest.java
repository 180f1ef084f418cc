package com.example.runbookops.notification;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.routing.Action;
import com.example.runbookops.routing.CredentialResolver;
import com.example.runbookops.routing.RoutingDecision;
import com.example.runbookops.routing.RoutingEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EscalationDispatcherTest {

    @Mock
    private RoutingEngine routingEngine;
    @Mock
    private CredentialResolver credentials;
    @Mock
    private NotificationSender sender;

    private SimpleMeterRegistry meterRegistry;
    private EscalationDispatcher dispatcher;

    private final EscalationEvent event = EscalationEvent.builder()
            .execId("exec-1")
            .schemaId("restart-api")
            .name("Restart API")
            .status(ExecutionStatus.FAILED)
            .severity("Sev1")
            .logs("boom")
            .build();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new EscalationDispatcher(routingEngine, credentials, sender,
                new EscalationMessageFactory(new RunbookOpsProperties()), meterRegistry);
    }

    @Test
    void actionsAreAttemptedIndependently() {
        RoutingDecision decision = RoutingDecision.matched(List.of(
                Action.slack("platform", "#ops", null),
                Action.opsgenie("platform", "key-platform")), 0, "platform");
        when(sender.sendPage(eq("key-platform"), any(PageAlert.class))).thenReturn(true);

        assertTrue(dispatcher.executeActions(decision, event));

        verify(sender, never()).sendChat(anyString(), anyString(), any());
        verify(sender, times(1)).sendPage(anyString(), any());
        assertEquals(1.0, meterRegistry.counter("runbook_ops.escalations", "type", "slack", "result", "failed").count());
        assertEquals(1.0, meterRegistry.counter("runbook_ops.escalations", "type", "opsgenie", "result", "sent").count());
    }

    @Test
    void allActionsFailingTriggersOneLastResortPage() {
        RoutingDecision decision = RoutingDecision.matched(List.of(
                Action.slack("platform", "#ops", "xoxb"),
                Action.opsgenie("platform", null)), 0, "platform");
        when(sender.sendChat(eq("xoxb"), eq("#ops"), any(ChatMessage.class))).thenReturn(false);
        when(credentials.opsgenieApiKey(null)).thenReturn("key-default");
        when(sender.sendPage(eq("key-default"), any(PageAlert.class))).thenReturn(true);

        assertFalse(dispatcher.executeActions(decision, event));

        verify(sender, times(1)).sendPage(eq("key-default"), any(PageAlert.class));
    }

    @Test
    void fallbackWithoutKeyStillTriesTheDefaultKey() {
        when(credentials.opsgenieApiKey(null)).thenReturn(null);

        assertFalse(dispatcher.executeActions(RoutingDecision.fallback(Action.opsgenie("default", null)), event));

        verify(sender, never()).sendPage(anyString(), any());
    }

    @Test
    void noActionDecisionSendsNothing() {
        assertFalse(dispatcher.executeActions(RoutingDecision.noAction(), event));

        verifyNoInteractions(sender, credentials);
    }

    @Test
    void escalateNeverThrows() {
        when(routingEngine.route(any())).thenThrow(new IllegalStateException("rules broken"));

        assertDoesNotThrow(() -> dispatcher.escalate(event));
    }
}
