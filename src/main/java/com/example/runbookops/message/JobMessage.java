package com.example.runbookops.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Job handed from the orchestrator to a worker queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobMessage {

    private String runbook;

    @JsonProperty("run_args")
    private String runArgs;

    /** Schema id. */
    private String id;

    private String name;

    @JsonProperty("requestedAt")
    private String requestedAt;

    @JsonProperty("exec_id")
    private String execId;

    private String oncall;

    @JsonProperty("monitor_condition")
    private String monitorCondition;

    private String severity;

    private String worker;

    @JsonProperty("resource_info")
    @Builder.Default
    private Map<String, String> resourceInfo = new HashMap<>();

    @JsonProperty("routing_info")
    @Builder.Default
    private Map<String, String> routingInfo = new HashMap<>();
}
