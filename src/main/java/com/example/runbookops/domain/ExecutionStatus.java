package com.example.runbookops.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of one execution, as written to the log table and carried on the wire.
 */
public enum ExecutionStatus {
    PENDING, ACCEPTED, RUNNING, SUCCEEDED, ERROR, FAILED, REJECTED, ROUTED, SCHEDULED, STOPPED, SKIPPED, TIMEOUT;

    /** Statuses the escalation router treats as final when a rule keeps {@code finalOnly}. */
    public static final Set<ExecutionStatus> FINAL = EnumSet.of(SUCCEEDED, ERROR, FAILED, TIMEOUT, ROUTED);

    /** Statuses that trigger the fallback page when no rule produced an action. */
    public static final Set<ExecutionStatus> FALLBACK = EnumSet.of(ERROR, FAILED, TIMEOUT, ROUTED, SCHEDULED);

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire status. {@code completed} is the worker's name for a clean exit.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static ExecutionStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Status is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("completed".equals(normalized)) {
            return SUCCEEDED;
        }
        return valueOf(normalized.toUpperCase(Locale.ROOT));
    }
}
