package com.example.runbookops.dispatch;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.WorkerRegistration;
import com.example.runbookops.exception.NoWorkerAvailableException;
import com.example.runbookops.repository.WorkerRegistrationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

/**
 * Picks a live worker of one capability uniformly at random.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkerSelector {

    private final WorkerRegistrationRepository repository;
    private final RunbookOpsProperties properties;
    private final Clock clock;
    private final Random random;

    /**
     * @throws NoWorkerAvailableException when no worker of {@code capability} heartbeated within the freshness window
     */
    public WorkerRegistration selectWorker(String capability) {
        if (capability == null || capability.isBlank()) {
            throw new NoWorkerAvailableException(String.valueOf(capability));
        }
        Instant freshAfter = clock.instant()
                .minus(Duration.ofMinutes(properties.getWorkers().getFreshnessWindowMinutes()));
        List<WorkerRegistration> candidates = repository.findByCapability(capability.trim()).stream()
                .filter(w -> capability.trim().equals(w.getCapability()))
                .filter(w -> w.getLastSeen() != null && !w.getLastSeen().isBefore(freshAfter))
                .toList();
        if (candidates.isEmpty()) {
            throw new NoWorkerAvailableException(capability);
        }
        WorkerRegistration chosen = candidates.get(random.nextInt(candidates.size()));
        log.debug("Selected worker {} of {} live for capability {}", chosen.getWorkerId(), candidates.size(), capability);
        return chosen;
    }
}
