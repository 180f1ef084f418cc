package com.example.runbookops.routing;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class RoutingDecision {

    public enum Reason {
        MATCHED, FALLBACK_OPSGENIE, NO_ACTION_NON_FINAL
    }

    private List<Action> actions;
    /** Index of the matching rule, null for fallback and no-action decisions. */
    private Integer matchedRuleIndex;
    private String matchedTeam;
    private Reason reason;

    public static RoutingDecision matched(List<Action> actions, int ruleIndex, String team) {
        return new RoutingDecision(List.copyOf(actions), ruleIndex, team, Reason.MATCHED);
    }

    public static RoutingDecision fallback(Action page) {
        return new RoutingDecision(List.of(page), null, null, Reason.FALLBACK_OPSGENIE);
    }

    public static RoutingDecision noAction() {
        return new RoutingDecision(List.of(), null, null, Reason.NO_ACTION_NON_FINAL);
    }
}
