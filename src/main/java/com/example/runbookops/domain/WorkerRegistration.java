package com.example.runbookops.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Heartbeat row of one worker instance, keyed by capability and worker id.
 */
@Entity
@Table(name = "worker_registry")
@IdClass(WorkerRegistration.Key.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerRegistration {

    @Id
    @Column(nullable = false)
    private String capability;

    @Id
    @Column(name = "worker_id", nullable = false)
    private String workerId;

    @Column(name = "queue_name", nullable = false)
    private String queueName;

    @Column(name = "last_seen", nullable = false)
    private Instant lastSeen;

    private String region;

    private Integer load;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String capability;
        private String workerId;
    }
}
