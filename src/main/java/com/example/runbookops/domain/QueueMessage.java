package com.example.runbookops.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Message of the table-backed durable queue. A claimed message is invisible until
 * {@code visibleAt}; it is redelivered if not acknowledged by then.
 */
@Entity
@Table(name = "queue_messages", indexes = {
        @Index(name = "idx_queue_messages_queue", columnList = "queue_name, visible_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "queue_name", nullable = false)
    private String queueName;

    @Column(nullable = false, length = 200000)
    private String body;

    @Column(name = "enqueued_at", nullable = false)
    private Instant enqueuedAt;

    @Column(name = "visible_at", nullable = false)
    private Instant visibleAt;

    @Column(name = "dequeue_count")
    private int dequeueCount;

    @Version
    private long version;
}
