package com.example.runbookops.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Named runbook definition an alert resolves to.
 */
@Entity
@Table(name = "runbook_schemas")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunbookSchema {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(length = 1024)
    private String description;

    @Column(nullable = false)
    private String runbook;

    @Column(name = "run_args", length = 2048)
    private String runArgs;

    /** Capability of the worker pool that runs this runbook. */
    @Column(nullable = false)
    private String worker;

    @Builder.Default
    private String oncall = "false";

    @Column(name = "require_approval")
    private boolean requireApproval;

    @Builder.Default
    private boolean enabled = true;
}
