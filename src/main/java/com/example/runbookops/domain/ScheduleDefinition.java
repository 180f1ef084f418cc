package com.example.runbookops.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Recurring runbook run driven by a six-field cron expression.
 */
@Entity
@Table(name = "schedules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleDefinition {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String cron;

    @Column(nullable = false)
    private String runbook;

    @Column(name = "run_args", length = 2048)
    private String runArgs;

    @Column(nullable = false)
    private String worker;

    @Builder.Default
    private boolean enabled = true;

    @Column(name = "last_run")
    private Instant lastRun;
}
