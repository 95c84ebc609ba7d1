package com.example.jobscheduler.cron;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CronSchedule Tests")
class CronScheduleTest {

    private static final ZoneId UTC = ZoneOffset.UTC;
    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @Nested
    @DisplayName("matches")
    class MatchesTests {

        @Test
        @DisplayName("Should match the literal instant of a concrete schedule")
        void shouldMatchConcreteInstant() {
            var schedule = CronSchedule.parse("0 0 12 1 1 *");

            assertThat(schedule.matches(Instant.parse("2031-01-01T12:00:00Z"), UTC)).isTrue();
            assertThat(schedule.matches(Instant.parse("2031-01-01T12:00:01Z"), UTC)).isFalse();
            assertThat(schedule.matches(Instant.parse("2031-01-02T12:00:00Z"), UTC)).isFalse();
        }

        @Test
        @DisplayName("Should number Sunday as 0")
        void shouldNumberSundayAsZero() {
            var sundays = CronSchedule.parse("* * * * * 0");

            // 2030-06-02 is a Sunday
            assertThat(sundays.matches(LocalDateTime.of(2030, 6, 2, 8, 0))).isTrue();
            assertThat(sundays.matches(LocalDateTime.of(2030, 6, 3, 8, 0))).isFalse();
        }

        @Test
        @DisplayName("Should evaluate calendar fields in the given zone")
        void shouldUseZone() {
            var schedule = CronSchedule.parse("0 0 9 * * *");
            var instant = Instant.parse("2030-06-03T07:00:00Z");

            assertThat(schedule.matches(instant, ZoneId.of("Europe/Paris"))).isTrue();
            assertThat(schedule.matches(instant, UTC)).isFalse();
        }
    }

    @Nested
    @DisplayName("nextOccurrence")
    class NextOccurrenceTests {

        @ParameterizedTest
        @CsvSource({
                "'* * * * * *',         2030-06-03T10:15:30Z, 2030-06-03T10:15:31Z",
                "'0 * * * * *',         2030-06-03T10:15:30Z, 2030-06-03T10:16:00Z",
                "'0 0 12 1 1 *',        2030-06-03T10:15:30Z, 2031-01-01T12:00:00Z",
                "'31 10-15 1 * * MON-FRI', 2030-06-01T00:00:00Z, 2030-06-03T01:10:31Z",
                "'0 0 0 29 2 *',        2031-03-01T00:00:00Z, 2032-02-29T00:00:00Z",
                "'*/20 * * * * *',      2030-12-31T23:59:59Z, 2031-01-01T00:00:00Z"
        })
        @DisplayName("Should find the next matching instant")
        void shouldFindNext(String expression, String from, String expected) {
            var next = CronSchedule.parse(expression).nextOccurrence(Instant.parse(from), UTC);

            assertThat(next).contains(Instant.parse(expected));
        }

        @Test
        @DisplayName("Should be strictly after the reference, even when the reference matches")
        void shouldBeStrictlyAfter() {
            var schedule = CronSchedule.parse("0 0 12 * * *");
            var from = Instant.parse("2030-06-03T12:00:00Z");

            assertThat(schedule.nextOccurrence(from, UTC)).contains(Instant.parse("2030-06-04T12:00:00Z"));
        }

        @Test
        @DisplayName("Should drop fractional seconds of the reference")
        void shouldDropFractionalSeconds() {
            var schedule = CronSchedule.parse("* * * * * *");

            assertThat(schedule.nextOccurrence(Instant.parse("2030-06-03T10:00:00.900Z"), UTC))
                    .contains(Instant.parse("2030-06-03T10:00:01Z"));
        }

        @Test
        @DisplayName("Should agree with a per-second scan")
        void shouldAgreeWithPerSecondScan() {
            var expressions = new String[]{
                    "*/7 3,17 * * * *", "45 59 23 * * SAT", "0 30 6-8 * * FRI-MON", "10 0 0 1,15 * *", "0 0 */5 * 2-3 *"
            };
            var from = Instant.parse("2030-01-30T22:58:11Z");

            for (var zone : new ZoneId[]{UTC, NEW_YORK}) {
                for (var expression : expressions) {
                    var schedule = CronSchedule.parse(expression);
                    assertThat(schedule.nextOccurrence(from, zone))
                            .as(expression + " in " + zone)
                            .contains(scan(schedule, from, zone));
                }
            }
        }

        @Test
        @DisplayName("Should report none for an impossible date")
        void shouldReportNoneForImpossibleDate() {
            var schedule = CronSchedule.parse("0 0 0 31 2 *");

            assertThat(schedule.nextOccurrence(Instant.parse("2030-01-01T00:00:00Z"), UTC)).isEmpty();
        }

        @Test
        @DisplayName("Should report none when the only match lies past the one-year horizon")
        void shouldReportNonePastHorizon() {
            // Next Feb 29 after 2030-03-01 is in 2032
            var schedule = CronSchedule.parse("0 0 0 29 2 *");

            assertThat(schedule.nextOccurrence(Instant.parse("2030-03-01T00:00:00Z"), UTC)).isEmpty();
        }

        @Test
        @DisplayName("Should include the last second of the horizon")
        void shouldIncludeHorizonEnd() {
            var from = Instant.parse("2030-03-01T00:00:00Z");
            var end = from.plusSeconds(CronSchedule.MAX_SEARCH_SECONDS);
            var local = LocalDateTime.ofInstant(end, UTC);
            var schedule = CronSchedule.parse(String.format("%d %d %d %d %d *",
                    local.getSecond(), local.getMinute(), local.getHour(), local.getDayOfMonth(), local.getMonthValue()));

            assertThat(schedule.nextOccurrence(from, UTC)).contains(end);
        }
    }

    @Nested
    @DisplayName("nextOccurrence across offset changes")
    class OffsetChangeTests {

        @ParameterizedTest
        @CsvSource({
                // 2026-11-01 06:00Z: New York falls back from 02:00 EDT to 01:00 EST
                "'0 20 1 * * *',   2026-11-01T05:00:00Z, 2026-11-01T05:20:00Z",
                "'0 20 1 * * *',   2026-11-01T05:30:00Z, 2026-11-01T06:20:00Z",
                "'0 20 1 * * *',   2026-11-01T06:10:00Z, 2026-11-01T06:20:00Z",
                "'0 59 1 * * *',   2026-11-01T05:59:30Z, 2026-11-01T06:59:00Z",
                "'0 0 * * * *',    2026-11-01T04:30:00Z, 2026-11-01T05:00:00Z",
                "'0 0 * * * *',    2026-11-01T05:30:00Z, 2026-11-01T06:00:00Z",
                // 2026-03-08 07:00Z: New York springs forward from 02:00 EST to 03:00 EDT
                "'0 30 2 * * *',   2026-03-08T05:00:00Z, 2026-03-09T06:30:00Z",
                "'0 0 2 * * *',    2026-03-08T06:30:00Z, 2026-03-09T06:00:00Z",
                "'0 0 3 * * *',    2026-03-08T06:30:00Z, 2026-03-08T07:00:00Z",
                "'*/15 * * * * *', 2026-03-08T06:59:50Z, 2026-03-08T07:00:00Z"
        })
        @DisplayName("Should follow wall-clock time through New York transitions")
        void shouldFollowWallClock(String expression, String from, String expected) {
            var next = CronSchedule.parse(expression).nextOccurrence(Instant.parse(from), NEW_YORK);

            assertThat(next).contains(Instant.parse(expected));
        }

        @ParameterizedTest
        @CsvSource({
                "'0 20 1 * * *',    2026-11-01T06:10:00Z",
                "'0 20 1 * * *',    2026-11-01T05:30:00Z",
                "'0 59 1 * * *',    2026-11-01T05:59:30Z",
                "'30 0 * * * *',    2026-11-01T05:59:59Z",
                "'0 30 2 * * *',    2026-03-08T05:00:00Z",
                "'0 0 3 * * *',     2026-03-08T06:30:00Z",
                "'*/15 * * * * *',  2026-03-08T06:59:50Z",
                "'0 */20 1-3 * * *', 2026-03-08T06:45:00Z",
                "'0 */20 0-2 * * *', 2026-11-01T04:45:00Z"
        })
        @DisplayName("Should agree with an instant-by-instant scan and stay strictly after the reference")
        void shouldAgreeWithInstantScan(String expression, String from) {
            var schedule = CronSchedule.parse(expression);
            var reference = Instant.parse(from);

            var next = schedule.nextOccurrence(reference, NEW_YORK);

            assertThat(next).isPresent();
            assertThat(next.get()).isAfter(reference);
            assertThat(schedule.matches(next.get(), NEW_YORK)).isTrue();
            assertThat(next).contains(scan(schedule, reference, NEW_YORK));
        }
    }

    private static Instant scan(CronSchedule schedule, Instant from, ZoneId zone) {
        var t = from.plusSeconds(1);
        while (!schedule.matches(t, zone)) {
            t = t.plusSeconds(1);
        }
        return t;
    }
}
