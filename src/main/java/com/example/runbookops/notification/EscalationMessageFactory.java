package com.example.runbookops.notification;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.routing.SeverityLevels;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the Slack and Opsgenie bodies for an escalation.
 */
@Component
@RequiredArgsConstructor
public class EscalationMessageFactory {

    private final RunbookOpsProperties properties;

    public ChatMessage chat(EscalationEvent event) {
        String status = event.getStatus() != null ? event.getStatus().wireValue() : "unknown";
        String emoji = event.getStatus() == ExecutionStatus.SUCCEEDED ? ":white_check_mark:" : ":x:";
        String text = String.format("[%s] Status: %s: %s", event.getExecId(), status, event.getName());

        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(Map.of("type", "header",
                "text", Map.of("type", "plain_text", "text", "Runbook " + status + " " + emoji, "emoji", true)));
        blocks.add(Map.of("type", "section", "fields", List.of(
                field("Name", event.getName()),
                field("Id", event.getSchemaId()),
                field("ExecId", event.getExecId()),
                field("Status", status),
                field("Severity", event.getSeverity()),
                field("OnCall", event.getOncall()),
                field("MonitorCondition", event.getMonitorCondition()),
                field("Worker", event.getWorker()))));
        blocks.add(section("*Runbook:* `" + nullToDash(event.getRunbook()) + "`\n*Run Args:* ```"
                + nullToDash(event.getRunArgs()) + "```"));
        blocks.add(section("*Logs (truncated):*\n```" + preview(event.getLogs()) + "```"));
        blocks.add(Map.of("type", "divider"));
        return ChatMessage.builder().text(text).blocks(blocks).build();
    }

    public PageAlert page(EscalationEvent event) {
        String status = event.getStatus() != null ? event.getStatus().wireValue() : "unknown";
        Map<String, String> details = new LinkedHashMap<>();
        details.put("Name", nullToDash(event.getName()));
        details.put("Id", nullToDash(event.getSchemaId()));
        details.put("ExecId", nullToDash(event.getExecId()));
        details.put("Status", status);
        details.put("Runbook", nullToDash(event.getRunbook()));
        details.put("Run_Args", nullToDash(event.getRunArgs()));
        details.put("OnCall", nullToDash(event.getOncall()));
        details.put("MonitorCondition", nullToDash(event.getMonitorCondition()));
        details.put("Severity", nullToDash(event.getSeverity()));

        return PageAlert.builder()
                .message(String.format("[%s] [%s] %s", event.getSchemaId(), nullToDash(event.getSeverity()), event.getName()))
                .alias(event.getExecId())
                .priority(SeverityLevels.opsgeniePriority(event.getSeverity()))
                .description("Execution " + status + " for " + event.getExecId() + ":\n\n"
                        + (event.getLogs() != null ? event.getLogs() : ""))
                .details(details)
                .close("resolved".equalsIgnoreCase(event.getMonitorCondition()))
                .build();
    }

    private String preview(String logs) {
        if (logs == null || logs.isEmpty()) return "-";
        int max = properties.getNotifications().getSlack().getLogPreviewChars();
        return logs.length() <= max ? logs : logs.substring(0, max);
    }

    private static Map<String, Object> field(String label, String value) {
        return Map.of("type", "mrkdwn", "text", "*" + label + ":*\n" + nullToDash(value));
    }

    private static Map<String, Object> section(String markdown) {
        return Map.of("type", "section", "text", Map.of("type", "mrkdwn", "text", markdown));
    }

    private static String nullToDash(String s) {
        return s == null || s.isBlank() ? "-" : s;
    }
}
