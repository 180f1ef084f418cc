package com.example.runbookops.routing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Routing rules document: global defaults, per-team channel settings and ordered rules.
 * Holds no secrets; tokens and keys come from {@link CredentialResolver}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoutingConfig {

    @Builder.Default
    private int version = 1;

    @Builder.Default
    private TeamRouting defaults = new TeamRouting();

    @Builder.Default
    private Map<String, TeamRouting> teams = new HashMap<>();

    @Builder.Default
    private List<RoutingRule> rules = new ArrayList<>();

    public TeamRouting team(String name) {
        if (name == null || teams == null) return new TeamRouting();
        TeamRouting team = teams.get(name);
        return team != null ? team : new TeamRouting();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TeamRouting {
        private Target slack = new Target();
        private Target opsgenie = new Target();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Target {
        private String channel;
        private String team;
    }
}
