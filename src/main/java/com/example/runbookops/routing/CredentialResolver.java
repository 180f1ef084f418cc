package com.example.runbookops.routing;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Convention-based credential lookup: {@code SLACK_TOKEN_<TEAM>} then {@code SLACK_TOKEN_DEFAULT};
 * {@code OPSGENIE_API_KEY_<TEAM>} then {@code OPSGENIE_API_KEY_DEFAULT} then {@code OPSGENIE_API_KEY}.
 * Team names are upper-cased with dashes turned into underscores.
 */
@Component
@RequiredArgsConstructor
public class CredentialResolver {

    private final SettingsLookup settings;

    public String slackToken(String team) {
        if (team != null && !team.isBlank()) {
            String token = settings.get(teamKey("SLACK_TOKEN_", team));
            if (token != null) return token;
        }
        return settings.get("SLACK_TOKEN_DEFAULT");
    }

    public String opsgenieApiKey(String team) {
        if (team != null && !team.isBlank()) {
            String key = settings.get(teamKey("OPSGENIE_API_KEY_", team));
            if (key != null) return key;
        }
        String key = settings.get("OPSGENIE_API_KEY_DEFAULT");
        return key != null ? key : settings.get("OPSGENIE_API_KEY");
    }

    static String teamKey(String prefix, String team) {
        return (prefix + team.trim()).toUpperCase(Locale.ROOT).replace('-', '_');
    }
}
