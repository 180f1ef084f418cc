package com.example.runbookops.worker;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.message.JobMessage;
import com.example.runbookops.message.OutcomeMessage;
import com.example.runbookops.queue.DurableQueue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Base64;
import java.util.HashMap;

/**
 * Publishes run outcomes to the orchestrator's notification queue.
 */
@Slf4j
@Component
public class OutcomePublisher {

    private static final DateTimeFormatter SENT_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final String TRUNCATED_MARKER = "\n...[truncated]";

    private final DurableQueue queue;
    private final RunbookOpsProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ZoneId zone;

    public OutcomePublisher(DurableQueue queue, RunbookOpsProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.queue = queue;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getTimeZone());
    }

    /**
     * Sends the outcome. Publishing failures are logged, never thrown, so they cannot mask the run result.
     */
    public void publish(JobMessage job, ExecutionStatus status, String logs) {
        OutcomeMessage outcome = OutcomeMessage.builder()
                .requestedAt(job.getRequestedAt())
                .id(job.getId())
                .name(job.getName())
                .execId(job.getExecId())
                .runbook(job.getRunbook())
                .runArgs(job.getRunArgs())
                .worker(job.getWorker())
                .status(status.wireValue())
                .oncall(job.getOncall())
                .monitorCondition(job.getMonitorCondition())
                .severity(job.getSeverity())
                .resourceInfo(job.getResourceInfo() != null ? job.getResourceInfo() : new HashMap<>())
                .routingInfo(job.getRoutingInfo() != null ? job.getRoutingInfo() : new HashMap<>())
                .logsB64(encodeLogs(logs, properties.getWorker().getMaxLogBodyBytes()))
                .sentAt(SENT_AT.format(clock.instant().atZone(zone)))
                .build();
        try {
            queue.enqueue(properties.getOrchestrator().getNotificationQueue(), objectMapper.writeValueAsString(outcome));
            log.info("[{}] Published outcome {}", job.getExecId(), outcome.getStatus());
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("[{}] Failed to publish outcome {}: {}", job.getExecId(), outcome.getStatus(), e.getMessage());
        }
    }

    /**
     * Base64 of the UTF-8 log text, cut so the encoded form stays within {@code maxEncodedBytes}.
     */
    static String encodeLogs(String logs, int maxEncodedBytes) {
        if (logs == null || logs.isEmpty()) return "";
        byte[] raw = logs.getBytes(StandardCharsets.UTF_8);
        int budget = Math.max(0, maxEncodedBytes / 4 * 3);
        if (raw.length > budget) {
            byte[] marker = TRUNCATED_MARKER.getBytes(StandardCharsets.UTF_8);
            int keep = Math.max(0, budget - marker.length);
            byte[] cut = Arrays.copyOf(raw, keep + marker.length);
            System.arraycopy(marker, 0, cut, keep, marker.length);
            raw = cut.length > budget ? Arrays.copyOf(cut, budget) : cut;
        }
        return Base64.getEncoder().encodeToString(raw);
    }
}
