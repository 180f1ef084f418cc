package com.example.runbookops.schedule;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.BitSet;
import java.util.Locale;

/**
 * Six-field cron expression: {@code second minute hour day-of-month month day-of-week}.
 *
 * <p>Each field accepts {@code *}, single values, lists ({@code 1,5}), ranges ({@code 1-5}) and
 * steps ({@code *}{@code /15}, {@code 10-40/10}). Day of week runs 0-7 with both 0 and 7 meaning
 * Sunday. When day-of-month and day-of-week are both restricted, either one matching is enough.
 * A five-field expression is read with the seconds field fixed at 0.
 */
public final class CronExpression {

    private final String expression;
    private final BitSet seconds;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean domRestricted;
    private final boolean dowRestricted;

    private CronExpression(String expression, String[] f) {
        this.expression = expression;
        this.seconds = parseField(f[0], 0, 59, "second");
        this.minutes = parseField(f[1], 0, 59, "minute");
        this.hours = parseField(f[2], 0, 23, "hour");
        this.daysOfMonth = parseField(f[3], 1, 31, "day of month");
        this.months = parseField(f[4], 1, 12, "month");
        BitSet dow = parseField(f[5], 0, 7, "day of week");
        if (dow.get(7)) {
            dow.set(0);
            dow.clear(7);
        }
        this.daysOfWeek = dow;
        this.domRestricted = !isWildcard(f[3]);
        this.dowRestricted = !isWildcard(f[5]);
    }

    /**
     * @throws IllegalArgumentException when the expression is malformed or a value is out of range
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length == 5) {
            fields = new String[]{"0", fields[0], fields[1], fields[2], fields[3], fields[4]};
        }
        if (fields.length != 6) {
            throw new IllegalArgumentException("Cron expression must have 6 fields: " + expression);
        }
        return new CronExpression(expression.trim(), fields);
    }

    public static boolean matches(String expression, Instant instant, ZoneId zone) {
        return parse(expression).matches(instant.atZone(zone));
    }

    public boolean matches(ZonedDateTime time) {
        return seconds.get(time.getSecond()) && matchesMinute(time);
    }

    /**
     * True when the expression fires at some second of the minute containing {@code time}.
     */
    public boolean matchesAnySecondOf(ZonedDateTime time) {
        return !seconds.isEmpty() && matchesMinute(time);
    }

    private boolean matchesMinute(ZonedDateTime time) {
        if (!minutes.get(time.getMinute()) || !hours.get(time.getHour()) || !months.get(time.getMonthValue())) {
            return false;
        }
        boolean dom = daysOfMonth.get(time.getDayOfMonth());
        boolean dow = daysOfWeek.get(cronDayOfWeek(time.getDayOfWeek()));
        if (domRestricted && dowRestricted) {
            return dom || dow;
        }
        return dom && dow;
    }

    private static int cronDayOfWeek(DayOfWeek day) {
        return day.getValue() % 7;
    }

    private static boolean isWildcard(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    private static BitSet parseField(String field, int min, int max, String name) {
        BitSet bits = new BitSet(max + 1);
        for (String part : field.split(",")) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty list element in " + name + " field: " + field);
            }
            int step = 1;
            String range = part;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                step = parseNumber(part.substring(slash + 1), name);
                if (step <= 0) {
                    throw new IllegalArgumentException("Step must be positive in " + name + " field: " + part);
                }
                range = part.substring(0, slash);
            }

            int from;
            int to;
            if (isWildcard(range)) {
                from = min;
                to = max;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", 2);
                from = parseNumber(bounds[0], name);
                to = parseNumber(bounds[1], name);
            } else {
                from = parseNumber(range, name);
                to = slash >= 0 ? max : from;
            }
            if (from < min || to > max || from > to) {
                throw new IllegalArgumentException(String.format(Locale.ROOT,
                        "Value out of range in %s field (%d-%d): %s", name, min, max, part));
            }
            for (int v = from; v <= to; v += step) {
                bits.set(v);
            }
        }
        return bits;
    }

    private static int parseNumber(String s, String name) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number in " + name + " field: " + s);
        }
    }

    @Override
    public String toString() {
        return expression;
    }
}
