package com.example.runbookops.routing;

import com.example.runbookops.domain.ExecutionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Escalation routing: decides which chat and paging actions an outcome produces.
 *
 * <p>Rules are evaluated in order and the first rule whose conditions all hold and which
 * resolves at least one action wins. When nothing matches, final failure statuses get a single
 * Opsgenie page; any other status produces no action.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoutingEngine {

    private static final Set<String> FINAL_STATUSES = wireValues(ExecutionStatus.FINAL);
    private static final Set<String> FALLBACK_STATUSES = wireValues(ExecutionStatus.FALLBACK);
    private static final Set<String> FAILURE_STATUSES = Set.of("failed", "error", "timeout");
    private static final Set<String> SECRET_HINTS = Set.of("slack_token", "opsgenie_token");

    private final RoutingConfigLoader configLoader;
    private final CredentialResolver credentials;

    public RoutingDecision route(RoutingContext ctx) {
        RoutingConfig config = configLoader.load();
        String status = lower(ctx.getStatus());
        String execId = ctx.getExecId() != null ? ctx.getExecId() : "unknown";

        log.info("[{}] Routing: evaluating {} rules for status={} hints={}",
                execId, config.getRules().size(), status, redacted(ctx.getRoutingInfo()));

        String hintTeam = ctx.hint("team");
        List<RoutingRule> rules = config.getRules();
        for (int i = 0; i < rules.size(); i++) {
            RoutingRule rule = rules.get(i);
            if (!matches(rule.getWhen(), ctx)) {
                continue;
            }
            List<Action> actions = new ArrayList<>();
            String matchedTeam = null;
            for (ActionSpec spec : rule.getThen()) {
                String team = firstNonBlank(spec.getTeam(), hintTeam);
                if (matchedTeam == null) matchedTeam = team;
                actions.add(resolve(spec, team, config, ctx));
            }
            addSupplementalActions(actions, config, ctx);

            if (!actions.isEmpty()) {
                log.info("[{}] Routing: matched rule #{} (team={}) with {} action(s)",
                        execId, i, matchedTeam, actions.size());
                return RoutingDecision.matched(actions, i, matchedTeam);
            }
        }

        if (FALLBACK_STATUSES.contains(status)) {
            String team = firstNonBlank(hintTeam, config.getDefaults().getOpsgenie().getTeam());
            String apiKey = firstNonBlank(ctx.hint("opsgenie_token"), credentials.opsgenieApiKey(team));
            log.info("[{}] Routing: no rule matched, using Opsgenie fallback", execId);
            return RoutingDecision.fallback(Action.opsgenie(team, apiKey));
        }

        log.info("[{}] Routing: status {} matched no rule, no actions", execId, status);
        return RoutingDecision.noAction();
    }

    /**
     * True when every predicate set on {@code when} holds for {@code ctx}.
     */
    public boolean matches(RuleCondition when, RoutingContext ctx) {
        if (when == null) return false;
        if ("*".equals(when.getAny())) {
            return true;
        }

        String status = lower(ctx.getStatus());
        boolean finalOnly = when.getFinalOnly() == null || when.getFinalOnly();
        if (finalOnly && !FINAL_STATUSES.contains(status)) {
            return false;
        }
        if (when.getStatusIn() != null && !when.getStatusIn().isEmpty()) {
            Set<String> allowed = when.getStatusIn().stream()
                    .filter(Objects::nonNull)
                    .map(RoutingEngine::lower)
                    .collect(Collectors.toSet());
            if (!allowed.contains(status)) {
                return false;
            }
        }

        if (when.getResourceId() != null && !equalsIgnoreCase(ctx.getResourceId(), when.getResourceId())) return false;
        if (when.getResourceGroup() != null && !equalsIgnoreCase(ctx.getResourceGroup(), when.getResourceGroup())) return false;
        if (when.getResourceName() != null && !equalsIgnoreCase(ctx.getResourceName(), when.getResourceName())) return false;
        if (when.getSubscriptionId() != null
                && !equalsIgnoreCase(subscriptionOf(ctx.getResourceId()), when.getSubscriptionId())) return false;
        if (when.getNamespace() != null && !equalsIgnoreCase(ctx.getNamespace(), when.getNamespace())) return false;
        if (when.getSchemaName() != null && !equalsIgnoreCase(ctx.getSchemaName(), when.getSchemaName())) return false;
        if (when.getOncall() != null
                && !equalsIgnoreCase(ctx.getOncall() == null ? "" : ctx.getOncall(), when.getOncall())) return false;

        if (when.getResourceGroupPrefix() != null) {
            if (ctx.getResourceGroup() == null || !ctx.getResourceGroup().toLowerCase(Locale.ROOT)
                    .startsWith(when.getResourceGroupPrefix().toLowerCase(Locale.ROOT))) {
                return false;
            }
        }

        Integer severity = SeverityLevels.parse(ctx.getSeverity());
        if (when.getIsAlert() != null) {
            boolean wantAlert = "true".equalsIgnoreCase(when.getIsAlert().trim());
            boolean isAlert = severity != null || FAILURE_STATUSES.contains(status);
            if (wantAlert != isAlert) {
                return false;
            }
        }
        if (when.getSeverityMin() != null) {
            Integer min = SeverityLevels.parse(when.getSeverityMin());
            if (min != null && (severity == null || severity < min)) return false;
        }
        if (when.getSeverityMax() != null) {
            Integer max = SeverityLevels.parse(when.getSeverityMax());
            if (max != null && (severity == null || severity > max)) return false;
        }
        return true;
    }

    private Action resolve(ActionSpec spec, String team, RoutingConfig config, RoutingContext ctx) {
        RoutingConfig.TeamRouting teamRouting = config.team(team);
        if (spec.getType() == ActionType.SLACK) {
            String channel = firstNonBlank(spec.getChannel(),
                    teamRouting.getSlack() != null ? teamRouting.getSlack().getChannel() : null,
                    config.getDefaults().getSlack().getChannel(),
                    ctx.hint("slack_channel"));
            String token = firstNonBlank(spec.getToken(), credentials.slackToken(team), ctx.hint("slack_token"));
            return Action.slack(team, channel, token);
        }
        String opsgenieTeam = firstNonBlank(team,
                teamRouting.getOpsgenie() != null ? teamRouting.getOpsgenie().getTeam() : null,
                config.getDefaults().getOpsgenie().getTeam());
        String apiKey = firstNonBlank(spec.getApiKey(), credentials.opsgenieApiKey(opsgenieTeam),
                ctx.hint("opsgenie_token"));
        return Action.opsgenie(opsgenieTeam, SettingsLookup.clean(apiKey));
    }

    /**
     * Adds a Slack and/or Opsgenie action for the hinted team when the matched rule
     * notified through that channel but not for that team.
     */
    private void addSupplementalActions(List<Action> actions, RoutingConfig config, RoutingContext ctx) {
        String hintTeam = ctx.hint("team");
        boolean hasSlack = actions.stream().anyMatch(a -> a.getType() == ActionType.SLACK);
        boolean hasOpsgenie = actions.stream().anyMatch(a -> a.getType() == ActionType.OPSGENIE);

        if (hasSlack && hintTeam != null
                && actions.stream().noneMatch(a -> a.getType() == ActionType.SLACK && hintTeam.equals(a.getTeam()))) {
            RoutingConfig.TeamRouting teamRouting = config.team(hintTeam);
            String channel = firstNonBlank(ctx.hint("slack_channel"),
                    teamRouting.getSlack() != null ? teamRouting.getSlack().getChannel() : null,
                    config.getDefaults().getSlack().getChannel());
            String token = firstNonBlank(ctx.hint("slack_token"), credentials.slackToken(hintTeam));
            if (channel != null || token != null) {
                actions.add(Action.slack(hintTeam, channel, token));
            }
        }

        String hintKey = ctx.hint("opsgenie_token");
        if (hasOpsgenie && (hintTeam != null || hintKey != null)) {
            String team = firstNonBlank(hintTeam, config.getDefaults().getOpsgenie().getTeam());
            boolean covered = actions.stream()
                    .anyMatch(a -> a.getType() == ActionType.OPSGENIE && Objects.equals(team, a.getTeam()));
            if (!covered) {
                String apiKey = SettingsLookup.clean(firstNonBlank(hintKey, credentials.opsgenieApiKey(team)));
                if (apiKey != null) {
                    actions.add(Action.opsgenie(team, apiKey));
                }
            }
        }
    }

    static String subscriptionOf(String resourceId) {
        if (resourceId == null) return null;
        String[] parts = resourceId.split("/");
        return parts.length > 2 && "subscriptions".equalsIgnoreCase(parts[1]) ? parts[2] : null;
    }

    private static boolean equalsIgnoreCase(String actual, String expected) {
        if (actual == null || expected == null) return false;
        return actual.trim().equalsIgnoreCase(expected.trim());
    }

    private static String lower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }

    private static Map<String, String> redacted(Map<String, String> hints) {
        Map<String, String> safe = new HashMap<>();
        if (hints != null) {
            hints.forEach((k, v) -> {
                if (!SECRET_HINTS.contains(k)) safe.put(k, v);
            });
        }
        return safe;
    }

    private static Set<String> wireValues(Set<ExecutionStatus> statuses) {
        return statuses.stream().map(ExecutionStatus::wireValue).collect(Collectors.toUnmodifiableSet());
    }
}
