package com.example.jobscheduler.cron;

import com.example.jobscheduler.exception.InvalidScheduleException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parser for the scheduler's cron dialect.
 * <p>
 * Format: {@code second minute hour day month dayOfWeek}, e.g. {@code "31 10-15 1 * * MON-FRI"}.
 * <p>
 * Per field, the first matching form wins:
 * <ul>
 *     <li>{@code *} - any value</li>
 *     <li>{@code a,b,c} - list of single values</li>
 *     <li>{@code a-b} - inclusive range</li>
 *     <li>{@code base/step} or {@code *}{@code /step} - every step from base (or the field minimum) to the maximum</li>
 *     <li>{@code n} - single value</li>
 * </ul>
 * Day-of-week also takes SUN..SAT (case-insensitive) wherever a number is allowed, and its
 * ranges wrap past Saturday.
 */
public final class CronParser {

    private static final String FORMAT_ERROR =
            "Invalid CRON expression. Expected format: second minute hour day month dayOfWeek";

    private static final Map<String, Integer> DAY_NAMES = Map.of(
            "SUN", 0, "MON", 1, "TUE", 2, "WED", 3, "THU", 4, "FRI", 5, "SAT", 6);

    private CronParser() {
    }

    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(expression, FORMAT_ERROR);
        }
        var parts = expression.trim().split("\\s+");
        if (parts.length != 6) {
            throw new InvalidScheduleException(expression, FORMAT_ERROR);
        }

        return new CronSchedule(
                expression.trim(),
                new FieldParser(expression, "second", 0, 59, false).parse(parts[0]),
                new FieldParser(expression, "minute", 0, 59, false).parse(parts[1]),
                new FieldParser(expression, "hour", 0, 23, false).parse(parts[2]),
                new FieldParser(expression, "day", 1, 31, false).parse(parts[3]),
                new FieldParser(expression, "month", 1, 12, false).parse(parts[4]),
                new FieldParser(expression, "dayOfWeek", 0, 6, true).parse(parts[5]));
    }

    private static final class FieldParser {

        private final String expression;
        private final String name;
        private final int min;
        private final int max;
        private final boolean dayOfWeek;

        private FieldParser(String expression, String name, int min, int max, boolean dayOfWeek) {
            this.expression = expression;
            this.name = name;
            this.min = min;
            this.max = max;
            this.dayOfWeek = dayOfWeek;
        }

        CronField parse(String field) {
            if (field.equals("*")) {
                return CronField.all();
            }
            if (field.contains(",")) {
                return CronField.of(FieldKind.LIST, parseList(field));
            }
            if (field.contains("-")) {
                return CronField.of(FieldKind.RANGE, parseRange(field));
            }
            if (field.contains("/")) {
                return CronField.of(FieldKind.STEP, parseStep(field));
            }
            return CronField.of(FieldKind.SINGLE, List.of(value(field)));
        }

        private List<Integer> parseList(String field) {
            var values = new ArrayList<Integer>();
            for (var item : field.split(",", -1)) {
                values.add(value(item));
            }
            return values;
        }

        private List<Integer> parseRange(String field) {
            var bounds = field.split("-", -1);
            if (bounds.length != 2) {
                throw error("Invalid range in " + name + " field: " + field);
            }
            var start = value(bounds[0]);
            var end = value(bounds[1]);

            var values = new ArrayList<Integer>();
            if (dayOfWeek && isDayName(bounds[0]) && isDayName(bounds[1])) {
                // Walk forward modulo 7 so FRI-MON covers the weekend; ends within 7 steps
                var current = start;
                while (true) {
                    values.add(current);
                    if (current == end) {
                        break;
                    }
                    current = (current + 1) % 7;
                }
                return values;
            }

            if (start > end) {
                throw error("Invalid range in " + name + " field: " + field);
            }
            for (var v = start; v <= end; v++) {
                values.add(v);
            }
            return values;
        }

        private List<Integer> parseStep(String field) {
            var parts = field.split("/", -1);
            if (parts.length != 2) {
                throw error("Invalid step in " + name + " field: " + field);
            }
            var start = parts[0].equals("*") ? min : value(parts[0]);
            int step;
            try {
                step = Integer.parseInt(parts[1].trim());
            } catch (NumberFormatException e) {
                throw error("Invalid step in " + name + " field: " + field);
            }
            if (step < 1) {
                throw error("Invalid step in " + name + " field: " + field);
            }

            var values = new ArrayList<Integer>();
            for (var v = start; v <= max; v += step) {
                values.add(v);
            }
            return values;
        }

        private int value(String token) {
            var trimmed = token.trim();
            if (dayOfWeek) {
                var named = DAY_NAMES.get(trimmed.toUpperCase(Locale.ROOT));
                if (named != null) {
                    return named;
                }
            }

            int v;
            try {
                v = Integer.parseInt(trimmed);
            } catch (NumberFormatException e) {
                throw error("Invalid value in " + name + " field: " + token);
            }
            if (v < min || v > max) {
                throw error("Invalid value in " + name + " field: " + token);
            }
            return v;
        }

        private static boolean isDayName(String token) {
            return DAY_NAMES.containsKey(token.trim().toUpperCase(Locale.ROOT));
        }

        private InvalidScheduleException error(String message) {
            return new InvalidScheduleException(expression, message);
        }
    }
}
