package com.example.runbookops.routing;

import java.util.Locale;

/**
 * SevN convention: Sev0 is critical, Sev4 informational.
 */
public final class SeverityLevels {

    private SeverityLevels() {
    }

    /**
     * @return the numeric level of {@code Sev2}, {@code sev2} or {@code 2}; null when unparsable
     */
    public static Integer parse(String severity) {
        if (severity == null || severity.isBlank()) return null;
        String s = severity.trim().toLowerCase(Locale.ROOT);
        if (s.startsWith("sev")) {
            s = s.substring(3).trim();
        }
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Opsgenie priority for a severity: Sev0 maps to P1, Sev4 to P5. Unknown severities get P3.
     */
    public static String opsgeniePriority(String severity) {
        Integer level = parse(severity);
        if (level == null) return "P3";
        return "P" + Math.max(1, Math.min(5, level + 1));
    }
}
