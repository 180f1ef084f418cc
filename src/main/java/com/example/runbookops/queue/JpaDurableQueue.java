package com.example.runbookops.queue;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.QueueMessage;
import com.example.runbookops.repository.QueueMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Queue stored in the {@code queue_messages} table. Claims race through the entity version,
 * so two consumers never hold the same message at once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaDurableQueue implements DurableQueue {

    private static final int CLAIM_BATCH = 5;

    private final QueueMessageRepository repository;
    private final RunbookOpsProperties properties;
    private final Clock clock;

    @Override
    public void enqueue(String queueName, String body) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("Queue name is required");
        }
        Instant now = clock.instant();
        QueueMessage saved = repository.save(QueueMessage.builder()
                .queueName(queueName)
                .body(body)
                .enqueuedAt(now)
                .visibleAt(now)
                .build());
        log.debug("Enqueued message {} on {}", saved.getId(), queueName);
    }

    @Override
    public Optional<ReceivedMessage> receive(String queueName) {
        Instant now = clock.instant();
        List<QueueMessage> candidates = repository.findVisible(queueName, now, PageRequest.of(0, CLAIM_BATCH));
        Duration timeout = Duration.ofSeconds(properties.getQueue().getVisibilityTimeoutSeconds());
        for (QueueMessage candidate : candidates) {
            candidate.setVisibleAt(now.plus(timeout));
            candidate.setDequeueCount(candidate.getDequeueCount() + 1);
            try {
                QueueMessage claimed = repository.saveAndFlush(candidate);
                return Optional.of(new ReceivedMessage(claimed.getId(), claimed.getQueueName(),
                        claimed.getBody(), claimed.getDequeueCount(), claimed.getVersion()));
            } catch (ObjectOptimisticLockingFailureException e) {
                log.debug("Message {} claimed by another consumer", candidate.getId());
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean extendVisibility(ReceivedMessage message, Duration duration) {
        Instant visibleAt = clock.instant().plus(duration);
        if (repository.extendClaim(message.getId(), message.getVersion(), visibleAt) != 1) {
            log.warn("Claim on message {} (version {}) is no longer held", message.getId(), message.getVersion());
            return false;
        }
        message.setVersion(message.getVersion() + 1);
        return true;
    }

    @Override
    public void acknowledge(ReceivedMessage message) {
        repository.deleteById(message.getId());
    }
}
