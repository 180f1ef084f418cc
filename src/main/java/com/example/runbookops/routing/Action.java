package com.example.runbookops.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Routing action with its credentials resolved. Credentials may still be missing,
 * in which case delivering the action fails on its own.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Action {

    private ActionType type;
    private String team;
    private String channel;
    @ToString.Exclude
    private String token;
    @ToString.Exclude
    private String apiKey;

    public static Action slack(String team, String channel, String token) {
        return Action.builder().type(ActionType.SLACK).team(team).channel(channel).token(token).build();
    }

    public static Action opsgenie(String team, String apiKey) {
        return Action.builder().type(ActionType.OPSGENIE).team(team).apiKey(apiKey).build();
    }
}
