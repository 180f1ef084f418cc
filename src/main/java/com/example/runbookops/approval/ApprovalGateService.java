package com.example.runbookops.approval;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.dispatch.JobDispatcher;
import com.example.runbookops.domain.ExecutionRecord;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.domain.RunbookSchema;
import com.example.runbookops.domain.WorkerRegistration;
import com.example.runbookops.exception.ApprovalConflictException;
import com.example.runbookops.exception.DispatchException;
import com.example.runbookops.exception.InvalidApprovalTokenException;
import com.example.runbookops.exception.ValidationException;
import com.example.runbookops.message.JobMessage;
import com.example.runbookops.notification.EscalationDispatcher;
import com.example.runbookops.service.AlertContext;
import com.example.runbookops.service.ExecutionLogService;
import com.example.runbookops.service.JobFactory;
import com.example.runbookops.service.SchemaResolver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Human approval in front of dispatch.
 *
 * <p>An execution moves from pending to exactly one decision. Decisions are guarded by the signed
 * token and by the execution's log history: once any non-pending row exists for the execId, further
 * decisions are refused. The history check is not transactional; two simultaneous decisions can
 * both pass it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalGateService {

    private final ApprovalTokenCodec codec;
    private final ExecutionLogService logService;
    private final SchemaResolver schemaResolver;
    private final JobFactory jobFactory;
    private final JobDispatcher dispatcher;
    private final EscalationDispatcher escalation;
    private final ApprovalNotifier notifier;
    private final RunbookOpsProperties properties;
    private final ObjectMapper objectMapper;

    public ApprovalTicket requestApproval(RunbookSchema schema, AlertContext alert, String callerBaseUrl) {
        String execId = UUID.randomUUID().toString();
        Instant now = logService.now();
        Instant expiresAt = now.plus(Duration.ofMinutes(properties.getApproval().getTtlMinutes()));
        String partitionKey = logService.partitionKey(now);
        String requestedAt = logService.formatRequestedAt(now);

        ApprovalToken token = ApprovalToken.builder()
                .execId(execId)
                .schemaId(schema.getId())
                .exp(expiresAt.toString())
                .resourceInfo(alert.getResourceInfo())
                .routingInfo(alert.getRoutingInfo())
                .monitorCondition(alert.getMonitorCondition())
                .severity(alert.getSeverity())
                .requestedAt(requestedAt)
                .workerCapability(schema.getWorker())
                .callbackKey(partitionKey)
                .build();
        SignedApprovalToken signed = codec.sign(token);

        String base = baseUrl(callerBaseUrl) + "/approvals/" + partitionKey + "/" + execId;
        String query = "?p=" + URLEncoder.encode(signed.getPayload(), StandardCharsets.UTF_8) + "&s=" + signed.getSignature();
        ApprovalTicket ticket = ApprovalTicket.builder()
                .execId(execId)
                .partitionKey(partitionKey)
                .approve(base + "/approve" + query)
                .reject(base + "/reject" + query)
                .expiresAt(expiresAt)
                .build();

        JobMessage job = jobFactory.job(schema, alert, execId, requestedAt);
        Map<String, Object> pendingLog = new LinkedHashMap<>();
        pendingLog.put("message", "Awaiting approval");
        pendingLog.put("approve", ticket.getApprove());
        pendingLog.put("reject", ticket.getReject());
        pendingLog.put("resource_info", alert.getResourceInfo());
        ExecutionRecord pending = jobFactory.record(job, ExecutionStatus.PENDING, partitionKey, now, toJson(pendingLog));
        pending.setRowKey(execId);
        pending.setApprovalRequired(true);
        pending.setApprovalExpiresAt(expiresAt);
        logService.append(pending);

        log.info("[{}] Approval requested for schema {} until {}", execId, schema.getId(), expiresAt);
        notifier.approvalRequested(job, ticket);
        return ticket;
    }

    /**
     * Verifies the decision link and dispatches the job.
     *
     * @throws DispatchException after recording the error and escalating, when no worker accepts the job
     */
    public ApprovalDecision approve(String partitionKey, String execId, String payload, String signature,
                                    String approver) {
        ApprovalToken token = verifyDecision(partitionKey, execId, payload, signature);
        String decidedBy = approver(approver);
        RunbookSchema schema = schemaResolver.resolve(token.getSchemaId());
        JobMessage job = jobFactory.job(schema, alertOf(token), execId, requestedAt(token));
        String approvedWorker = token.getWorkerCapability();
        if (approvedWorker != null && !approvedWorker.isBlank() && !approvedWorker.equals(job.getWorker())) {
            log.warn("[{}] Schema {} now targets {}, dispatching to approved capability {}",
                    execId, schema.getId(), job.getWorker(), approvedWorker);
            job.setWorker(approvedWorker);
        }
        Instant requestedAt = logService.parseRequestedAt(job.getRequestedAt());

        try {
            WorkerRegistration worker = dispatcher.dispatch(job);
            String message = "Approved by " + decidedBy + "; dispatched to worker " + worker.getWorkerId();
            appendDecision(job, ExecutionStatus.ACCEPTED, partitionKey, requestedAt, message, decidedBy);
            ApprovalDecision decision = new ApprovalDecision(execId, schema.getId(), ExecutionStatus.ACCEPTED,
                    decidedBy, message);
            notifier.decision(decision);
            return decision;
        } catch (DispatchException e) {
            String message = "Approved by " + decidedBy + " but dispatch failed: " + e.getMessage();
            log.error("[{}] {}", execId, message);
            appendDecision(job, ExecutionStatus.ERROR, partitionKey, requestedAt, message, decidedBy);
            escalation.escalateAsync(jobFactory.escalation(job, ExecutionStatus.ERROR, message));
            notifier.decision(new ApprovalDecision(execId, schema.getId(), ExecutionStatus.ERROR, decidedBy, message));
            throw e;
        }
    }

    public ApprovalDecision reject(String partitionKey, String execId, String payload, String signature,
                                   String approver) {
        ApprovalToken token = verifyDecision(partitionKey, execId, payload, signature);
        String decidedBy = approver(approver);
        String message = "Rejected by " + decidedBy;

        JobMessage job = JobMessage.builder()
                .id(token.getSchemaId())
                .execId(execId)
                .requestedAt(requestedAt(token))
                .monitorCondition(token.getMonitorCondition())
                .severity(token.getSeverity())
                .resourceInfo(token.getResourceInfo())
                .routingInfo(token.getRoutingInfo())
                .build();
        try {
            RunbookSchema schema = schemaResolver.resolve(token.getSchemaId());
            job = jobFactory.job(schema, alertOf(token), execId, requestedAt(token));
        } catch (RuntimeException e) {
            log.warn("[{}] Schema {} unavailable while rejecting: {}", execId, token.getSchemaId(), e.getMessage());
        }

        appendDecision(job, ExecutionStatus.REJECTED, partitionKey,
                logService.parseRequestedAt(job.getRequestedAt()), message, decidedBy);
        escalation.escalateAsync(jobFactory.escalation(job, ExecutionStatus.REJECTED, message));
        ApprovalDecision decision = new ApprovalDecision(execId, token.getSchemaId(), ExecutionStatus.REJECTED,
                decidedBy, message);
        notifier.decision(decision);
        log.info("[{}] {}", execId, message);
        return decision;
    }

    private ApprovalToken verifyDecision(String partitionKey, String execId, String payload, String signature) {
        if (execId == null || execId.isBlank()) {
            throw new ValidationException("Missing ExecId");
        }
        if (partitionKey == null || partitionKey.isBlank()) {
            throw new ValidationException("Missing partitionKey");
        }
        if (payload == null || payload.isBlank() || signature == null || signature.isBlank()) {
            throw new ValidationException("Missing approval parameters p and s");
        }
        ApprovalToken token = codec.verify(execId, payload, signature);
        if (token.getCallbackKey() != null && !token.getCallbackKey().equals(partitionKey)) {
            log.debug("[{}] Token partition {} does not match route partition {}",
                    execId, token.getCallbackKey(), partitionKey);
            throw new InvalidApprovalTokenException();
        }
        if (!logService.onlyPending(partitionKey, execId)) {
            log.warn("[{}] Decision refused, execution already decided", execId);
            throw new ApprovalConflictException(execId);
        }
        return token;
    }

    private void appendDecision(JobMessage job, ExecutionStatus status, String partitionKey, Instant requestedAt,
                                String message, String decidedBy) {
        ExecutionRecord record = jobFactory.record(job, status, partitionKey, requestedAt, message);
        record.setApprovalRequired(true);
        record.setApprovalDecisionBy(decidedBy);
        logService.append(record);
    }

    private AlertContext alertOf(ApprovalToken token) {
        return AlertContext.builder()
                .schemaId(token.getSchemaId())
                .monitorCondition(token.getMonitorCondition())
                .severity(token.getSeverity())
                .resourceInfo(token.getResourceInfo() != null ? token.getResourceInfo() : Map.of())
                .routingInfo(token.getRoutingInfo() != null ? token.getRoutingInfo() : Map.of())
                .build();
    }

    private String requestedAt(ApprovalToken token) {
        return token.getRequestedAt() != null ? token.getRequestedAt() : logService.formatRequestedAt(logService.now());
    }

    private String baseUrl(String callerBaseUrl) {
        String configured = properties.getOrchestrator().getPublicBaseUrl();
        String base = configured != null && !configured.isBlank() ? configured : callerBaseUrl;
        if (base == null) return "";
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static String approver(String header) {
        return header == null || header.isBlank() ? "unknown" : header.trim();
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
