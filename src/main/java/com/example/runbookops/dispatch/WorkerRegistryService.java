package com.example.runbookops.dispatch;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.WorkerRegistration;
import com.example.runbookops.exception.UnauthorizedException;
import com.example.runbookops.exception.ValidationException;
import com.example.runbookops.repository.WorkerRegistrationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Worker liveness registry: heartbeats upsert a row, a periodic sweep deletes rows past the liveness window.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkerRegistryService {

    private final WorkerRegistrationRepository repository;
    private final RunbookOpsProperties properties;
    private final Clock clock;

    public WorkerRegistration register(String sharedSecret, WorkerHeartbeat heartbeat) {
        String expected = properties.getWorkers().getSharedSecret();
        if (expected == null || expected.isBlank() || sharedSecret == null
                || !MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                sharedSecret.getBytes(StandardCharsets.UTF_8))) {
            throw new UnauthorizedException("Invalid worker key");
        }
        if (heartbeat == null || isBlank(heartbeat.getCapability()) || isBlank(heartbeat.getWorkerId()) || isBlank(heartbeat.getQueue())) {
            throw new ValidationException("capability, worker_id and queue are required");
        }

        WorkerRegistration registration = WorkerRegistration.builder()
                .capability(heartbeat.getCapability().trim())
                .workerId(heartbeat.getWorkerId().trim())
                .queueName(heartbeat.getQueue().trim())
                .region(heartbeat.getRegion())
                .load(heartbeat.getLoad())
                .lastSeen(clock.instant())
                .build();
        WorkerRegistration saved = repository.save(registration);
        log.debug("Heartbeat from worker {} ({}) on queue {}",
                saved.getWorkerId(), saved.getCapability(), saved.getQueueName());
        return saved;
    }

    public List<WorkerRegistration> listAll() {
        return repository.findAllByOrderByCapabilityAscWorkerIdAsc();
    }

    /**
     * Removes workers whose last heartbeat is older than the liveness window.
     */
    @Scheduled(fixedDelayString = "${runbook-ops.workers.gc-interval-seconds:60}", timeUnit = TimeUnit.SECONDS)
    @Transactional
    public int collectStaleWorkers() {
        if (!properties.getOrchestrator().isEnabled()) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(properties.getWorkers().getLivenessWindowMinutes()));
        int removed = repository.deleteByLastSeenBefore(cutoff);
        if (removed > 0) {
            log.info("Removed {} stale worker registration(s) last seen before {}", removed, cutoff);
        }
        return removed;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
