package com.example.runbookops.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * At-least-once message queue. Ordering is not guaranteed and consumers must
 * tolerate redelivery of a message that was received but not acknowledged.
 */
public interface DurableQueue {

    void enqueue(String queueName, String body);

    /**
     * Claims the next visible message, hiding it from other consumers for the visibility timeout.
     */
    Optional<ReceivedMessage> receive(String queueName);

    /**
     * Keeps a claimed message hidden for {@code duration} from now. {@link Duration#ZERO} releases it
     * for immediate redelivery.
     *
     * @return false when the claim was lost: the message was acknowledged or claimed again since
     */
    boolean extendVisibility(ReceivedMessage message, Duration duration);

    void acknowledge(ReceivedMessage message);
}
