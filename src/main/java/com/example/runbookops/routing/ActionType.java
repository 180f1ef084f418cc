package com.example.runbookops.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Notification channel of a routing action. Parsed once when the rules are loaded.
 */
public enum ActionType {
    SLACK, OPSGENIE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the matching type, or {@code null} for an unsupported name
     */
    @JsonCreator
    public static ActionType fromValue(String value) {
        if (value == null) return null;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "slack" -> SLACK;
            case "opsgenie" -> OPSGENIE;
            default -> null;
        };
    }
}
