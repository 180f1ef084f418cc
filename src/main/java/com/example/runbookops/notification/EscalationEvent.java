package com.example.runbookops.notification;

import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.message.OutcomeMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Everything the router and the message builders need to know about one outcome.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationEvent {

    private String execId;
    private String schemaId;
    private String name;
    private String runbook;
    private String runArgs;
    private String worker;
    private ExecutionStatus status;
    private String oncall;
    private String monitorCondition;
    private String severity;
    @Builder.Default
    private Map<String, String> resourceInfo = new HashMap<>();
    @Builder.Default
    private Map<String, String> routingInfo = new HashMap<>();
    private String logs;

    public static EscalationEvent fromOutcome(OutcomeMessage outcome, ExecutionStatus status, String logs) {
        return EscalationEvent.builder()
                .execId(outcome.getExecId())
                .schemaId(outcome.getId())
                .name(outcome.getName())
                .runbook(outcome.getRunbook())
                .runArgs(outcome.getRunArgs())
                .worker(outcome.getWorker())
                .status(status)
                .oncall(outcome.getOncall())
                .monitorCondition(outcome.getMonitorCondition())
                .severity(outcome.getSeverity())
                .resourceInfo(outcome.getResourceInfo() != null ? outcome.getResourceInfo() : new HashMap<>())
                .routingInfo(outcome.getRoutingInfo() != null ? outcome.getRoutingInfo() : new HashMap<>())
                .logs(logs)
                .build();
    }

    public String resource(String key) {
        return resourceInfo == null ? null : resourceInfo.get(key);
    }
}
