package com.example.runbookops.approval;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.dispatch.JobDispatcher;
import com.example.runbookops.domain.ExecutionRecord;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.domain.RunbookSchema;
import com.example.runbookops.domain.WorkerRegistration;
import com.example.runbookops.exception.ApprovalConflictException;
import com.example.runbookops.exception.InvalidApprovalTokenException;
import com.example.runbookops.exception.NoWorkerAvailableException;
import com.example.runbookops.exception.ValidationException;
import com.example.runbookops.message.JobMessage;
import com.example.runbookops.notification.EscalationDispatcher;
import com.example.runbookops.notification.EscalationEvent;
import com.example.runbookops.repository.ExecutionRecordRepository;
import com.example.runbookops.service.AlertContext;
import com.example.runbookops.service.ExecutionLogService;
import com.example.runbookops.service.JobFactory;
import com.example.runbookops.service.SchemaResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApprovalGateServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String PARTITION = "20260301";

    @Mock
    private ExecutionRecordRepository recordRepository;
    @Mock
    private SchemaResolver schemaResolver;
    @Mock
    private JobDispatcher dispatcher;
    @Mock
    private EscalationDispatcher escalation;
    @Mock
    private ApprovalNotifier notifier;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private RunbookOpsProperties properties;
    private ApprovalTokenCodec codec;
    private ApprovalGateService gate;
    private RunbookSchema schema;

    @BeforeEach
    void setUp() {
        properties = new RunbookOpsProperties();
        properties.getApproval().setSecret("gate-secret");
        properties.getOrchestrator().setPublicBaseUrl("https://ops.example.com/");
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        codec = new ApprovalTokenCodec(properties, objectMapper, clock);
        ExecutionLogService logService = new ExecutionLogService(recordRepository, properties,
                new SimpleMeterRegistry(), clock);
        gate = new ApprovalGateService(codec, logService, schemaResolver, new JobFactory(), dispatcher,
                escalation, notifier, properties, objectMapper);
        schema = RunbookSchema.builder()
                .id("restart-api")
                .name("Restart API")
                .runbook("restart.sh")
                .runArgs("--force")
                .worker("aks")
                .requireApproval(true)
                .build();
    }

    private SignedApprovalToken sign(String execId, Instant exp) {
        return codec.sign(ApprovalToken.builder()
                .execId(execId)
                .schemaId("restart-api")
                .exp(exp.toString())
                .requestedAt("2026-03-01 10:00:00")
                .resourceInfo(Map.of("resource_name", "aks-prod"))
                .build());
    }

    private static ExecutionRecord row(ExecutionStatus status) {
        return ExecutionRecord.builder().execId("exec-1").partitionKey(PARTITION).status(status).build();
    }

    @Test
    @DisplayName("requestApproval appends a pending row and returns signed links under the public base URL")
    void requestApprovalAppendsPending() {
        AlertContext alert = AlertContext.builder()
                .schemaId("restart-api")
                .severity("Sev1")
                .resourceInfo(Map.of("resource_name", "aks-prod"))
                .build();

        ApprovalTicket ticket = gate.requestApproval(schema, alert, "http://ignored");

        assertEquals(PARTITION, ticket.getPartitionKey());
        assertTrue(ticket.getApprove().startsWith(
                "https://ops.example.com/approvals/" + PARTITION + "/" + ticket.getExecId() + "/approve?p="));
        assertTrue(ticket.getReject().contains("/reject?p="));
        assertEquals(NOW.plusSeconds(3600), ticket.getExpiresAt());

        ArgumentCaptor<ExecutionRecord> saved = ArgumentCaptor.forClass(ExecutionRecord.class);
        verify(recordRepository).save(saved.capture());
        assertEquals(ExecutionStatus.PENDING, saved.getValue().getStatus());
        assertEquals(ticket.getExecId(), saved.getValue().getRowKey());
        assertTrue(saved.getValue().isApprovalRequired());
        assertTrue(saved.getValue().getLog().contains("Awaiting approval"));
        verify(notifier).approvalRequested(any(JobMessage.class), eq(ticket));
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void approveDispatchesAndRecordsAccepted() {
        SignedApprovalToken signed = sign("exec-1", NOW.plusSeconds(600));
        when(recordRepository.findByPartitionKeyAndExecIdOrderByRecordedAtAsc(PARTITION, "exec-1"))
                .thenReturn(List.of(row(ExecutionStatus.PENDING)));
        when(schemaResolver.resolve("restart-api")).thenReturn(schema);
        when(dispatcher.dispatch(any(JobMessage.class))).thenReturn(WorkerRegistration.builder()
                .capability("aks").workerId("w1").queueName("jobs-aks").lastSeen(NOW).build());

        ApprovalDecision decision = gate.approve(PARTITION, "exec-1", signed.getPayload(), signed.getSignature(), "alice");

        assertEquals(ExecutionStatus.ACCEPTED, decision.getStatus());
        assertEquals("alice", decision.getDecidedBy());
        ArgumentCaptor<ExecutionRecord> saved = ArgumentCaptor.forClass(ExecutionRecord.class);
        verify(recordRepository).save(saved.capture());
        assertEquals(ExecutionStatus.ACCEPTED, saved.getValue().getStatus());
        assertEquals("alice", saved.getValue().getApprovalDecisionBy());
        verify(escalation, never()).escalateAsync(any());
    }

    @Test
    void approverDefaultsToUnknown() {
        SignedApprovalToken signed = sign("exec-1", NOW.plusSeconds(600));
        when(recordRepository.findByPartitionKeyAndExecIdOrderByRecordedAtAsc(PARTITION, "exec-1"))
                .thenReturn(List.of(row(ExecutionStatus.PENDING)));
        when(schemaResolver.resolve("restart-api")).thenReturn(schema);
        when(dispatcher.dispatch(any(JobMessage.class))).thenReturn(WorkerRegistration.builder()
                .capability("aks").workerId("w1").queueName("jobs-aks").lastSeen(NOW).build());

        ApprovalDecision decision = gate.approve(PARTITION, "exec-1", signed.getPayload(), signed.getSignature(), null);

        assertEquals("unknown", decision.getDecidedBy());
    }

    @Test
    @DisplayName("A second decision on an already approved execution is refused and appends nothing")
    void alreadyDecidedIsConflict() {
        SignedApprovalToken signed = sign("exec-1", NOW.plusSeconds(600));
        when(recordRepository.findByPartitionKeyAndExecIdOrderByRecordedAtAsc(PARTITION, "exec-1"))
                .thenReturn(List.of(row(ExecutionStatus.PENDING), row(ExecutionStatus.ACCEPTED)));

        assertThrows(ApprovalConflictException.class,
                () -> gate.approve(PARTITION, "exec-1", signed.getPayload(), signed.getSignature(), "bob"));
        assertThrows(ApprovalConflictException.class,
                () -> gate.reject(PARTITION, "exec-1", signed.getPayload(), signed.getSignature(), "bob"));

        verify(recordRepository, never()).save(any());
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    @DisplayName("A token that expired one second ago fails closed before any state is read")
    void expiredTokenIsUnauthorized() {
        SignedApprovalToken signed = sign("exec-1", NOW.minusSeconds(1));

        assertThrows(InvalidApprovalTokenException.class,
                () -> gate.approve(PARTITION, "exec-1", signed.getPayload(), signed.getSignature(), "alice"));

        verify(recordRepository, never()).findByPartitionKeyAndExecIdOrderByRecordedAtAsc(anyString(), anyString());
        verify(recordRepository, never()).save(any());
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void missingParametersAreBadRequest() {
        assertThrows(ValidationException.class, () -> gate.approve(PARTITION, "exec-1", null, "abc", null));
        assertThrows(ValidationException.class, () -> gate.approve(PARTITION, " ", "p", "s", null));
    }

    @Test
    void dispatchFailureRecordsErrorAndEscalates() {
        SignedApprovalToken signed = sign("exec-1", NOW.plusSeconds(600));
        when(recordRepository.findByPartitionKeyAndExecIdOrderByRecordedAtAsc(PARTITION, "exec-1"))
                .thenReturn(List.of(row(ExecutionStatus.PENDING)));
        when(schemaResolver.resolve("restart-api")).thenReturn(schema);
        when(dispatcher.dispatch(any(JobMessage.class))).thenThrow(new NoWorkerAvailableException("aks"));

        assertThrows(NoWorkerAvailableException.class,
                () -> gate.approve(PARTITION, "exec-1", signed.getPayload(), signed.getSignature(), "alice"));

        ArgumentCaptor<ExecutionRecord> saved = ArgumentCaptor.forClass(ExecutionRecord.class);
        verify(recordRepository).save(saved.capture());
        assertEquals(ExecutionStatus.ERROR, saved.getValue().getStatus());
        ArgumentCaptor<EscalationEvent> event = ArgumentCaptor.forClass(EscalationEvent.class);
        verify(escalation).escalateAsync(event.capture());
        assertEquals(ExecutionStatus.ERROR, event.getValue().getStatus());
    }

    @Test
    void rejectRecordsAndEscalatesWithoutDispatch() {
        SignedApprovalToken signed = sign("exec-1", NOW.plusSeconds(600));
        when(recordRepository.findByPartitionKeyAndExecIdOrderByRecordedAtAsc(PARTITION, "exec-1"))
                .thenReturn(List.of(row(ExecutionStatus.PENDING)));
        when(schemaResolver.resolve("restart-api")).thenReturn(schema);

        ApprovalDecision decision = gate.reject(PARTITION, "exec-1", signed.getPayload(), signed.getSignature(), "carol");

        assertEquals(ExecutionStatus.REJECTED, decision.getStatus());
        ArgumentCaptor<ExecutionRecord> saved = ArgumentCaptor.forClass(ExecutionRecord.class);
        verify(recordRepository).save(saved.capture());
        assertEquals(ExecutionStatus.REJECTED, saved.getValue().getStatus());
        assertEquals("Restart API", saved.getValue().getName());
        verify(escalation).escalateAsync(any(EscalationEvent.class));
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    @DisplayName("A link replayed under another partition fails closed without reading history")
    void foreignPartitionIsUnauthorized() {
        SignedApprovalToken signed = codec.sign(ApprovalToken.builder()
                .execId("exec-1")
                .schemaId("restart-api")
                .exp(NOW.plusSeconds(600).toString())
                .callbackKey(PARTITION)
                .build());

        assertThrows(InvalidApprovalTokenException.class,
                () -> gate.approve("20260302", "exec-1", signed.getPayload(), signed.getSignature(), "mallory"));

        verify(recordRepository, never()).findByPartitionKeyAndExecIdOrderByRecordedAtAsc(anyString(), anyString());
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void approvedCapabilityWinsOverLaterSchemaChange() {
        SignedApprovalToken signed = codec.sign(ApprovalToken.builder()
                .execId("exec-1")
                .schemaId("restart-api")
                .exp(NOW.plusSeconds(600).toString())
                .workerCapability("aks-west")
                .callbackKey(PARTITION)
                .build());
        when(recordRepository.findByPartitionKeyAndExecIdOrderByRecordedAtAsc(PARTITION, "exec-1"))
                .thenReturn(List.of(row(ExecutionStatus.PENDING)));
        when(schemaResolver.resolve("restart-api")).thenReturn(schema);
        when(dispatcher.dispatch(any(JobMessage.class))).thenReturn(WorkerRegistration.builder()
                .capability("aks-west").workerId("w2").queueName("jobs-aks-west").lastSeen(NOW).build());

        gate.approve(PARTITION, "exec-1", signed.getPayload(), signed.getSignature(), "alice");

        ArgumentCaptor<JobMessage> job = ArgumentCaptor.forClass(JobMessage.class);
        verify(dispatcher).dispatch(job.capture());
        assertEquals("aks-west", job.getValue().getWorker());
    }
}
