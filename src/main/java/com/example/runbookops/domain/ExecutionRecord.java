package com.example.runbookops.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row per status transition of an execution. Rows are appended, never updated.
 */
@Entity
@Table(name = "runbook_logs", indexes = {
        @Index(name = "idx_runbook_logs_partition", columnList = "partition_key"),
        @Index(name = "idx_runbook_logs_exec", columnList = "exec_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /** Date bucket, yyyyMMdd. */
    @Column(name = "partition_key", nullable = false, length = 8)
    private String partitionKey;

    @Column(name = "row_key", nullable = false)
    private String rowKey;

    @Column(name = "exec_id", nullable = false)
    private String execId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionStatus status;

    @Column(name = "requested_at", nullable = false)
    private Instant requestedAt;

    @Column(name = "schema_id")
    private String schemaId;

    private String name;

    private String runbook;

    @Column(name = "run_args", length = 2048)
    private String runArgs;

    private String worker;

    private String oncall;

    @Column(name = "monitor_condition")
    private String monitorCondition;

    private String severity;

    @Column(length = 32000)
    private String log;

    @Column(name = "approval_required")
    private boolean approvalRequired;

    @Column(name = "approval_expires_at")
    private Instant approvalExpiresAt;

    @Column(name = "approval_decision_by")
    private String approvalDecisionBy;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @PrePersist
    protected void onCreate() {
        if (recordedAt == null) recordedAt = Instant.now();
    }
}
