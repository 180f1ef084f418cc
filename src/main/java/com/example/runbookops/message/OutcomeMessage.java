package com.example.runbookops.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Result of a job, published by the worker on the notification queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeMessage {

    public static final String TEXT_CONTENT_TYPE = "text/plain; charset=utf-8";

    @JsonProperty("requestedAt")
    private String requestedAt;

    private String id;

    private String name;

    @JsonProperty("exec_id")
    private String execId;

    private String runbook;

    @JsonProperty("run_args")
    private String runArgs;

    private String worker;

    private String status;

    private String oncall;

    @JsonProperty("monitor_condition")
    private String monitorCondition;

    private String severity;

    @JsonProperty("resource_info")
    @Builder.Default
    private Map<String, String> resourceInfo = new HashMap<>();

    @JsonProperty("routing_info")
    @Builder.Default
    private Map<String, String> routingInfo = new HashMap<>();

    @JsonProperty("logs_b64")
    private String logsB64;

    @JsonProperty("content_type")
    @Builder.Default
    private String contentType = TEXT_CONTENT_TYPE;

    @JsonProperty("sent_at")
    private String sentAt;
}
