package com.example.runbookops.service;

import com.example.runbookops.approval.ApprovalGateService;
import com.example.runbookops.approval.ApprovalTicket;
import com.example.runbookops.dispatch.JobDispatcher;
import com.example.runbookops.domain.ExecutionRecord;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.domain.RunbookSchema;
import com.example.runbookops.domain.WorkerRegistration;
import com.example.runbookops.exception.DispatchException;
import com.example.runbookops.exception.ValidationException;
import com.example.runbookops.message.JobMessage;
import com.example.runbookops.notification.EscalationDispatcher;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Inbound alert flow: resolve the schema, then either open an approval or dispatch right away.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TriggerService {

    private final SchemaResolver schemaResolver;
    private final ApprovalGateService approvalGate;
    private final JobFactory jobFactory;
    private final JobDispatcher dispatcher;
    private final ExecutionLogService logService;
    private final EscalationDispatcher escalation;

    public TriggerResult trigger(AlertContext alert, String callerBaseUrl) {
        if (alert.getSchemaId() == null || alert.getSchemaId().isBlank()) {
            throw new ValidationException("Unable to resolve schema id (missing id parameter and alertId/schemaId in body)");
        }
        RunbookSchema schema = schemaResolver.resolve(alert.getSchemaId());

        if (schema.isRequireApproval()) {
            ApprovalTicket ticket = approvalGate.requestApproval(schema, alert, callerBaseUrl);
            return new TriggerResult(ExecutionStatus.PENDING, ticket.getExecId(), ticket.getPartitionKey(),
                    schema.getId(), "Job is pending approval", ticket);
        }

        String execId = UUID.randomUUID().toString();
        Instant now = logService.now();
        String partitionKey = logService.partitionKey(now);
        JobMessage job = jobFactory.job(schema, alert, execId, logService.formatRequestedAt(now));
        return dispatchAndRecord(job, partitionKey, now, ExecutionStatus.ACCEPTED);
    }

    /**
     * Dispatches {@code job} and records {@code successStatus}; on failure records an error and escalates it.
     */
    public TriggerResult dispatchAndRecord(JobMessage job, String partitionKey, Instant requestedAt,
                                           ExecutionStatus successStatus) {
        try {
            WorkerRegistration worker = dispatcher.dispatch(job);
            String message = "Dispatched to worker " + worker.getWorkerId() + " (" + worker.getQueueName() + ")";
            ExecutionRecord record = jobFactory.record(job, successStatus, partitionKey, requestedAt, message);
            record.setRowKey(job.getExecId());
            logService.append(record);
            return new TriggerResult(successStatus, job.getExecId(), partitionKey, job.getId(), message, null);
        } catch (DispatchException e) {
            log.error("[{}] Dispatch of {} failed: {}", job.getExecId(), job.getRunbook(), e.getMessage());
            ExecutionRecord record = jobFactory.record(job, ExecutionStatus.ERROR, partitionKey, requestedAt, e.getMessage());
            record.setRowKey(job.getExecId());
            logService.append(record);
            escalation.escalateAsync(jobFactory.escalation(job, ExecutionStatus.ERROR, e.getMessage()));
            return new TriggerResult(ExecutionStatus.ERROR, job.getExecId(), partitionKey, job.getId(), e.getMessage(), null);
        }
    }

    @Data
    @AllArgsConstructor
    public static class TriggerResult {
        private ExecutionStatus status;
        private String execId;
        private String partitionKey;
        private String schemaId;
        private String message;
        private ApprovalTicket approval;
    }
}
