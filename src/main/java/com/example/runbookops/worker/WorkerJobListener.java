package com.example.runbookops.worker;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.message.JobMessage;
import com.example.runbookops.queue.DurableQueue;
import com.example.runbookops.queue.ReceivedMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Pulls jobs from this worker's queue while run slots are free.
 * A job is acknowledged once its run has finished and its outcome was published; until then its
 * claim on the queue message is renewed so no other consumer receives it.
 */
@Slf4j
@Component
public class WorkerJobListener {

    private final DurableQueue queue;
    private final ExecutionEngine engine;
    private final WorkerIdentity identity;
    private final RunbookOpsProperties properties;
    private final ObjectMapper objectMapper;
    private final TaskExecutor executor;
    private final Semaphore slots;
    private final Map<String, ReceivedMessage> inFlight = new ConcurrentHashMap<>();

    public WorkerJobListener(DurableQueue queue, ExecutionEngine engine, WorkerIdentity identity,
                             RunbookOpsProperties properties, ObjectMapper objectMapper,
                             @Qualifier("runbookExecutor") TaskExecutor executor) {
        this.queue = queue;
        this.engine = engine;
        this.identity = identity;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.slots = new Semaphore(Math.max(1, properties.getWorker().getConcurrency()));
    }

    @Scheduled(fixedDelayString = "${runbook-ops.worker.poll-interval-ms:1000}")
    public void poll() {
        if (!properties.getWorker().isEnabled()) {
            return;
        }
        while (slots.tryAcquire()) {
            Optional<ReceivedMessage> message;
            try {
                message = queue.receive(identity.getQueueName());
            } catch (RuntimeException e) {
                slots.release();
                log.error("Receiving from {} failed: {}", identity.getQueueName(), e.getMessage());
                return;
            }
            if (message.isEmpty()) {
                slots.release();
                return;
            }
            if (!submit(message.get())) {
                return;
            }
        }
    }

    /**
     * Renews the claim on every message whose run is still going.
     */
    @Scheduled(fixedDelayString = "${runbook-ops.queue.lease-renew-interval-ms:300000}")
    public void renewLeases() {
        Duration timeout = visibilityTimeout();
        for (ReceivedMessage message : inFlight.values()) {
            try {
                if (!queue.extendVisibility(message, timeout)) {
                    log.warn("Lost the claim on message {}; another consumer may receive it", message.getId());
                }
            } catch (RuntimeException e) {
                log.error("Renewing the claim on message {} failed: {}", message.getId(), e.getMessage());
            }
        }
    }

    /**
     * Hands a received message to a run slot. The caller holds one slot, which is returned here
     * unless a run takes it over.
     *
     * @return false when polling should stop for this round
     */
    boolean submit(ReceivedMessage message) {
        JobMessage job;
        try {
            job = objectMapper.readValue(message.getBody(), JobMessage.class);
        } catch (JsonProcessingException e) {
            slots.release();
            log.error("Dropping unreadable job message {}: {}", message.getId(), e.getOriginalMessage());
            queue.acknowledge(message);
            return true;
        }

        if (inFlight.replace(message.getId(), message) != null) {
            slots.release();
            log.info("[{}] Message {} redelivered while its run is active here, keeping the run's claim",
                    job.getExecId(), message.getId());
            queue.extendVisibility(message, visibilityTimeout());
            return true;
        }

        inFlight.put(message.getId(), message);
        try {
            executor.execute(() -> {
                try {
                    engine.process(job);
                    queue.acknowledge(message);
                } catch (RuntimeException e) {
                    log.error("[{}] Run aborted, message left for redelivery: {}", job.getExecId(), e.getMessage(), e);
                } finally {
                    inFlight.remove(message.getId());
                    slots.release();
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            inFlight.remove(message.getId());
            slots.release();
            log.warn("[{}] No run slot available, returning message {} to the queue", job.getExecId(), message.getId());
            queue.extendVisibility(message, Duration.ZERO);
            return false;
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private Duration visibilityTimeout() {
        return Duration.ofSeconds(properties.getQueue().getVisibilityTimeoutSeconds());
    }
}
