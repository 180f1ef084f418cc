package com.example.runbookops.approval;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.message.JobMessage;
import com.example.runbookops.notification.ChatMessage;
import com.example.runbookops.notification.NotificationSender;
import com.example.runbookops.routing.SettingsLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Posts approval requests and decisions to the operations Slack channel. Best effort: failures are logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApprovalNotifier {

    private final RunbookOpsProperties properties;
    private final NotificationSender sender;
    private final SettingsLookup settings;

    public void approvalRequested(JobMessage job, ApprovalTicket ticket) {
        String text = String.format("APPROVAL REQUIRED [%s] %s (%s)", job.getExecId(), job.getName(), job.getRunbook());
        List<Map<String, Object>> blocks = List.of(
                Map.of("type", "header", "text", Map.of("type", "plain_text", "text", "APPROVAL REQUIRED")),
                Map.of("type", "section", "fields", List.of(
                        Map.of("type", "mrkdwn", "text", "*Name:*\n" + job.getName()),
                        Map.of("type", "mrkdwn", "text", "*Runbook:*\n" + job.getRunbook()),
                        Map.of("type", "mrkdwn", "text", "*ExecId:*\n" + job.getExecId()),
                        Map.of("type", "mrkdwn", "text", "*Expires:*\n" + ticket.getExpiresAt()))),
                Map.of("type", "actions", "elements", List.of(
                        Map.of("type", "button", "style", "primary", "url", ticket.getApprove(),
                                "text", Map.of("type", "plain_text", "text", "Approve")),
                        Map.of("type", "button", "style", "danger", "url", ticket.getReject(),
                                "text", Map.of("type", "plain_text", "text", "Reject")))));
        post(job.getExecId(), ChatMessage.builder().text(text).blocks(blocks).build());
    }

    public void decision(ApprovalDecision decision) {
        String verb = decision.getStatus() == ExecutionStatus.REJECTED ? "rejected" : "approved";
        String text = String.format("[%s] Execution %s by %s: %s", decision.getExecId(), verb,
                decision.getDecidedBy(), decision.getStatus().wireValue());
        post(decision.getExecId(), ChatMessage.builder().text(text).build());
    }

    private void post(String execId, ChatMessage message) {
        RunbookOpsProperties.NotificationConfig.SlackConfig slack = properties.getNotifications().getSlack();
        String token = isBlank(slack.getToken()) ? settings.get("SLACK_TOKEN") : slack.getToken();
        String channel = isBlank(slack.getChannel()) ? settings.get("SLACK_CHANNEL") : slack.getChannel();
        if (token == null || channel == null) {
            log.debug("[{}] Approval Slack notification skipped, no token or channel", execId);
            return;
        }
        try {
            sender.sendChat(token, channel, message);
        } catch (Exception e) {
            log.warn("[{}] Approval Slack notification failed: {}", execId, e.getMessage());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
