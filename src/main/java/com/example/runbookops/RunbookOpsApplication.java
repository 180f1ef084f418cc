package com.example.runbookops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Runbook Ops - alert-to-remediation orchestrator.
 *
 * Architecture:
 * - Alert intake → schema resolution, optional signed approval gate
 * - Dispatcher → capability-matched worker selection over durable queues
 * - Worker → runbook subprocess execution with duplicate suppression and cancellation
 * - Escalation → rule-based routing of outcomes to chat and paging
 *
 * The orchestrator and worker roles are switched on and off through
 * {@code runbook-ops.orchestrator.enabled} and {@code runbook-ops.worker.enabled}.
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class RunbookOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(RunbookOpsApplication.class, args);
    }
}
