package com.example.runbookops.routing;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Normalized view of an outcome for rule matching.
 */
@Data
@Builder
public class RoutingContext {

    private String execId;
    private String status;
    private String resourceId;
    private String resourceGroup;
    private String resourceName;
    private String namespace;
    private String schemaName;
    private String severity;
    private String oncall;

    /** Hints carried with the alert: team, slack_channel, slack_token, opsgenie_token. */
    @Builder.Default
    private Map<String, String> routingInfo = new HashMap<>();

    public String hint(String key) {
        if (routingInfo == null) return null;
        String value = routingInfo.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
