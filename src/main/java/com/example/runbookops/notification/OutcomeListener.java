package com.example.runbookops.notification;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.ExecutionRecord;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.message.OutcomeMessage;
import com.example.runbookops.queue.DurableQueue;
import com.example.runbookops.queue.ReceivedMessage;
import com.example.runbookops.service.ExecutionLogService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Drains worker outcomes from the notification queue: records each one and escalates everything but {@code running}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutcomeListener {

    private static final int MAX_PER_POLL = 20;

    private final DurableQueue queue;
    private final ExecutionLogService logService;
    private final EscalationDispatcher escalation;
    private final RunbookOpsProperties properties;
    private final ObjectMapper objectMapper;

    @Scheduled(fixedDelayString = "${runbook-ops.orchestrator.outcome-poll-interval-ms:1000}")
    public void poll() {
        if (!properties.getOrchestrator().isEnabled()) {
            return;
        }
        String queueName = properties.getOrchestrator().getNotificationQueue();
        for (int i = 0; i < MAX_PER_POLL; i++) {
            Optional<ReceivedMessage> message = queue.receive(queueName);
            if (message.isEmpty()) {
                return;
            }
            handle(message.get());
        }
    }

    /**
     * Processes one message and acknowledges it. Messages that cannot be parsed are dropped with an error log.
     */
    public void handle(ReceivedMessage message) {
        OutcomeMessage outcome;
        ExecutionStatus status;
        try {
            outcome = objectMapper.readValue(message.getBody(), OutcomeMessage.class);
            status = ExecutionStatus.fromWire(outcome.getStatus());
        } catch (Exception e) {
            log.error("Dropping unreadable outcome message {}: {}", message.getId(), e.getMessage());
            queue.acknowledge(message);
            return;
        }

        String logs = decode(outcome.getLogsB64());
        Instant now = logService.now();
        ExecutionRecord record = ExecutionRecord.builder()
                .partitionKey(logService.partitionKey(now))
                .execId(outcome.getExecId())
                .status(status)
                .requestedAt(logService.parseRequestedAt(outcome.getRequestedAt()))
                .schemaId(outcome.getId())
                .name(outcome.getName())
                .runbook(outcome.getRunbook())
                .runArgs(outcome.getRunArgs())
                .worker(outcome.getWorker())
                .oncall(outcome.getOncall())
                .monitorCondition(outcome.getMonitorCondition())
                .severity(outcome.getSeverity())
                .log(logs)
                .build();
        logService.append(record);

        if (status != ExecutionStatus.RUNNING) {
            escalation.escalate(EscalationEvent.fromOutcome(outcome, status, logs));
        }
        queue.acknowledge(message);
    }

    private static String decode(String logsB64) {
        if (logsB64 == null || logsB64.isBlank()) return "";
        try {
            return new String(Base64.getDecoder().decode(logsB64.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return logsB64;
        }
    }
}
