package com.example.jobscheduler.cron;

import lombok.Getter;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Immutable result of parsing a six-field cron expression
 * ({@code second minute hour day month dayOfWeek}).
 */
@Getter
public final class CronSchedule {

    /**
     * Search horizon for {@link #nextOccurrence}: one year of seconds.
     */
    public static final long MAX_SEARCH_SECONDS = 365L * 24 * 60 * 60;

    private final String expression;
    private final CronField second;
    private final CronField minute;
    private final CronField hour;
    private final CronField day;
    private final CronField month;
    private final CronField dayOfWeek;

    CronSchedule(String expression, CronField second, CronField minute, CronField hour,
                 CronField day, CronField month, CronField dayOfWeek) {
        this.expression = expression;
        this.second = second;
        this.minute = minute;
        this.hour = hour;
        this.day = day;
        this.month = month;
        this.dayOfWeek = dayOfWeek;
    }

    /**
     * Parse an expression. Shorthand for {@link CronParser#parse(String)}.
     */
    public static CronSchedule parse(String expression) {
        return CronParser.parse(expression);
    }

    public boolean matches(Instant instant, ZoneId zone) {
        return matches(LocalDateTime.ofInstant(instant, zone));
    }

    /**
     * An instant matches when each of its six calendar components is permitted
     * by the corresponding field. Day-of-week is 0-6 with 0 = Sunday.
     */
    public boolean matches(LocalDateTime t) {
        return second.matches(t.getSecond())
                && minute.matches(t.getMinute())
                && hour.matches(t.getHour())
                && day.matches(t.getDayOfMonth())
                && month.matches(t.getMonthValue())
                && dayOfWeek.matches(dayOfWeekIndex(t));
    }

    /**
     * Earliest matching instant strictly after {@code from}, looking no further than
     * {@link #MAX_SEARCH_SECONDS} ahead. Fractional seconds of {@code from} are dropped.
     * <p>
     * Calendar fields are read as wall-clock time in {@code zone}. A local time skipped by a
     * forward offset change never matches; a local time repeated by a backward change matches
     * at each instant that shows it.
     *
     * @return the next occurrence, or empty when the schedule has none within the horizon
     */
    public Optional<Instant> nextOccurrence(Instant from, ZoneId zone) {
        var rules = zone.getRules();
        var cursor = from.truncatedTo(ChronoUnit.SECONDS);
        var limit = cursor.plusSeconds(MAX_SEARCH_SECONDS);

        // Each pass covers (cursor, end] under a single offset, where local time maps one-to-one onto instants
        while (cursor.isBefore(limit)) {
            var first = cursor.plusSeconds(1);
            var offset = rules.getOffset(first);
            var transition = rules.nextTransition(first);
            var end = limit;
            if (transition != null && transition.getInstant().minusSeconds(1).isBefore(limit)) {
                end = transition.getInstant().minusSeconds(1);
            }

            var match = scan(LocalDateTime.ofInstant(cursor, offset), LocalDateTime.ofInstant(end, offset));
            if (match.isPresent()) {
                return Optional.of(match.get().toInstant(offset));
            }
            cursor = end;
        }
        return Optional.empty();
    }

    /**
     * Equivalent to testing every second in {@code (from, end]} in order, but whole
     * months, days, hours and minutes whose field cannot match are skipped in one step.
     */
    private Optional<LocalDateTime> scan(LocalDateTime from, LocalDateTime end) {
        var t = from.plusSeconds(1);

        while (!t.isAfter(end)) {
            if (!month.matches(t.getMonthValue())) {
                t = t.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!day.matches(t.getDayOfMonth()) || !dayOfWeek.matches(dayOfWeekIndex(t))) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (!hour.matches(t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minute.matches(t.getMinute())) {
                t = t.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
                continue;
            }
            if (!second.matches(t.getSecond())) {
                t = t.plusSeconds(1);
                continue;
            }
            return Optional.of(t);
        }
        return Optional.empty();
    }

    private static int dayOfWeekIndex(LocalDateTime t) {
        // java.time numbers Monday..Sunday as 1..7
        return t.getDayOfWeek().getValue() % 7;
    }

    @Override
    public String toString() {
        return "CronSchedule{" + expression + "}";
    }
}
