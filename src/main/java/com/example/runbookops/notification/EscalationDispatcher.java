package com.example.runbookops.notification;

import com.example.runbookops.message.ResourceInfo;
import com.example.runbookops.routing.Action;
import com.example.runbookops.routing.CredentialResolver;
import com.example.runbookops.routing.RoutingContext;
import com.example.runbookops.routing.RoutingDecision;
import com.example.runbookops.routing.RoutingEngine;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Routes an outcome and delivers every resulting action. Escalation never throws to its caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationDispatcher {

    private final RoutingEngine routingEngine;
    private final CredentialResolver credentials;
    private final NotificationSender sender;
    private final EscalationMessageFactory messages;
    private final MeterRegistry meterRegistry;

    public void escalate(EscalationEvent event) {
        try {
            RoutingDecision decision = routingEngine.route(toContext(event));
            executeActions(decision, event);
        } catch (Exception e) {
            log.error("[{}] Escalation failed: {}", event.getExecId(), e.getMessage(), e);
        }
    }

    @Async("escalationExecutor")
    public void escalateAsync(EscalationEvent event) {
        escalate(event);
    }

    /**
     * Attempts each action independently. When none succeeded and the decision was not the
     * no-action case, sends one last-resort page with the default key.
     *
     * @return whether at least one action was delivered
     */
    public boolean executeActions(RoutingDecision decision, EscalationEvent event) {
        boolean anySuccess = false;
        for (Action action : decision.getActions()) {
            try {
                boolean sent = deliver(action, event);
                record(action.getType().wireValue(), sent);
                anySuccess |= sent;
            } catch (Exception e) {
                record(action.getType().wireValue(), false);
                log.error("[{}] Routing action failed (type={}, team={}): {}",
                        event.getExecId(), action.getType().wireValue(), action.getTeam(), e.getMessage());
            }
        }

        if (anySuccess || decision.getReason() == RoutingDecision.Reason.NO_ACTION_NON_FINAL) {
            log.info("[{}] Escalation finished ({} action(s), reason={})",
                    event.getExecId(), decision.getActions().size(), decision.getReason());
            return anySuccess;
        }

        try {
            String apiKey = credentials.opsgenieApiKey(null);
            if (apiKey == null) {
                log.error("[{}] Escalation finished with errors; last-resort page skipped, no default Opsgenie key",
                        event.getExecId());
                return false;
            }
            boolean paged = sender.sendPage(apiKey, messages.page(event));
            record("last_resort", paged);
            if (paged) {
                log.warn("[{}] Escalation finished with errors; last-resort page sent (reason={})",
                        event.getExecId(), decision.getReason());
            } else {
                log.error("[{}] Escalation finished with errors; last-resort page failed", event.getExecId());
            }
        } catch (Exception e) {
            log.error("[{}] Last-resort page failed: {}", event.getExecId(), e.getMessage());
        }
        return false;
    }

    private boolean deliver(Action action, EscalationEvent event) {
        switch (action.getType()) {
            case SLACK -> {
                if (action.getToken() == null) throw new IllegalStateException("Missing Slack token");
                if (action.getChannel() == null) throw new IllegalStateException("Missing Slack channel");
                return sender.sendChat(action.getToken(), action.getChannel(), messages.chat(event));
            }
            case OPSGENIE -> {
                if (action.getApiKey() == null) throw new IllegalStateException("Missing Opsgenie apiKey");
                return sender.sendPage(action.getApiKey(), messages.page(event));
            }
            default -> throw new IllegalStateException("Unsupported action type: " + action.getType());
        }
    }

    static RoutingContext toContext(EscalationEvent event) {
        return RoutingContext.builder()
                .execId(event.getExecId())
                .status(event.getStatus() != null ? event.getStatus().wireValue() : null)
                .resourceId(event.resource(ResourceInfo.RESOURCE_ID))
                .resourceGroup(event.resource(ResourceInfo.RESOURCE_RG))
                .resourceName(event.resource(ResourceInfo.RESOURCE_NAME))
                .namespace(event.resource(ResourceInfo.AKS_NAMESPACE))
                .schemaName(event.getName())
                .severity(event.getSeverity())
                .oncall(event.getOncall() == null ? "" : event.getOncall().trim().toLowerCase())
                .routingInfo(event.getRoutingInfo())
                .build();
    }

    private void record(String type, boolean success) {
        meterRegistry.counter("runbook_ops.escalations", "type", type, "result", success ? "sent" : "failed")
                .increment();
    }
}
