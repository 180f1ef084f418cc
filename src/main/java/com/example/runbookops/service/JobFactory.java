package com.example.runbookops.service;

import com.example.runbookops.domain.ExecutionRecord;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.domain.RunbookSchema;
import com.example.runbookops.message.JobMessage;
import com.example.runbookops.notification.EscalationEvent;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;

/**
 * Builds the job message, log records and escalation events of one execution from the same inputs.
 */
@Component
public class JobFactory {

    public JobMessage job(RunbookSchema schema, AlertContext alert, String execId, String requestedAt) {
        return JobMessage.builder()
                .runbook(schema.getRunbook())
                .runArgs(schema.getRunArgs() != null ? schema.getRunArgs() : "")
                .id(schema.getId())
                .name(schema.getName())
                .requestedAt(requestedAt)
                .execId(execId)
                .oncall(schema.getOncall() != null ? schema.getOncall().trim().toLowerCase() : "false")
                .monitorCondition(alert.getMonitorCondition())
                .severity(alert.getSeverity())
                .worker(schema.getWorker())
                .resourceInfo(new HashMap<>(alert.getResourceInfo()))
                .routingInfo(new HashMap<>(alert.getRoutingInfo()))
                .build();
    }

    public ExecutionRecord record(JobMessage job, ExecutionStatus status, String partitionKey, Instant requestedAt,
                                  String log) {
        return ExecutionRecord.builder()
                .partitionKey(partitionKey)
                .execId(job.getExecId())
                .status(status)
                .requestedAt(requestedAt)
                .schemaId(job.getId())
                .name(job.getName())
                .runbook(job.getRunbook())
                .runArgs(job.getRunArgs())
                .worker(job.getWorker())
                .oncall(job.getOncall())
                .monitorCondition(job.getMonitorCondition())
                .severity(job.getSeverity())
                .log(log)
                .build();
    }

    public EscalationEvent escalation(JobMessage job, ExecutionStatus status, String logs) {
        return EscalationEvent.builder()
                .execId(job.getExecId())
                .schemaId(job.getId())
                .name(job.getName())
                .runbook(job.getRunbook())
                .runArgs(job.getRunArgs())
                .worker(job.getWorker())
                .status(status)
                .oncall(job.getOncall())
                .monitorCondition(job.getMonitorCondition())
                .severity(job.getSeverity())
                .resourceInfo(job.getResourceInfo())
                .routingInfo(job.getRoutingInfo())
                .logs(logs)
                .build();
    }
}
