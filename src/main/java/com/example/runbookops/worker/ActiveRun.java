package com.example.runbookops.worker;

import com.example.runbookops.message.JobMessage;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A job this worker instance is currently running.
 */
@Data
@Builder
public class ActiveRun {

    @JsonProperty("exec_id")
    private String execId;

    @JsonProperty("id")
    private String schemaId;

    private String name;

    private String runbook;

    @JsonProperty("run_args")
    private String runArgs;

    private String worker;

    private String requestedAt;

    private Instant startedAt;

    @JsonProperty("resource_info")
    @Builder.Default
    private Map<String, String> resourceInfo = new HashMap<>();

    @Builder.Default
    private volatile String status = "running";

    @JsonIgnore
    @ToString.Exclude
    private JobMessage job;

    @JsonIgnore
    @ToString.Exclude
    private volatile Process process;

    @JsonIgnore
    private volatile boolean stopRequested;

    /** Output captured so far, so a stopped run still reports partial logs. */
    @JsonIgnore
    @ToString.Exclude
    @Builder.Default
    private StringBuffer output = new StringBuffer();

    @JsonIgnore
    @Builder.Default
    private AtomicBoolean reported = new AtomicBoolean();

    /** Claims the single terminal outcome of this run; false if it was already reported. */
    boolean claimReport() {
        return reported.compareAndSet(false, true);
    }

    /** Whether the terminal outcome of this run has already been published. */
    boolean isReported() {
        return reported.get();
    }

    boolean sameWorkAs(ActiveRun other) {
        return eq(name, other.name) && eq(runbook, other.runbook) && eq(runArgs, other.runArgs);
    }

    private static boolean eq(String a, String b) {
        return (a == null ? "" : a).equals(b == null ? "" : b);
    }
}
