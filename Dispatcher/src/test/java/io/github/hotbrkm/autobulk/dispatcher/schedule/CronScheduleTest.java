package io.github.hotbrkm.autobulk.dispatcher.schedule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CronSchedule evaluation test")
class CronScheduleTest {

    private static ZonedDateTime utc(String iso) {
        return ZonedDateTime.parse(iso).withZoneSameInstant(ZoneOffset.UTC);
    }

    @Test
    @DisplayName("Weekday 08:00 rule created Monday 07:00 UTC fires the same day at 08:00")
    void weekdayRule_firesSameDay() {
        CronSchedule schedule = CronSchedule.parse("0 8 * * 1-5");

        assertThat(schedule.next(utc("2024-01-01T07:00:00Z"))).contains(utc("2024-01-01T08:00:00Z"));
    }

    @Test
    @DisplayName("Next run is strictly after the reference time")
    void next_isStrictlyAfter() {
        CronSchedule schedule = CronSchedule.parse("0 8 * * 1-5");

        assertThat(schedule.next(utc("2024-01-01T08:00:00Z"))).contains(utc("2024-01-02T08:00:00Z"));
    }

    @Test
    @DisplayName("Weekday rule skips the weekend")
    void weekdayRule_skipsWeekend() {
        CronSchedule schedule = CronSchedule.parse("0 8 * * 1-5");

        assertThat(schedule.next(utc("2024-01-05T09:00:00Z"))).contains(utc("2024-01-08T08:00:00Z"));
    }

    @Test
    @DisplayName("Restricted day-of-month and day-of-week fire when either matches")
    void dayOfMonthAndDayOfWeek_areOred() {
        CronSchedule schedule = CronSchedule.parse("0 9 13 * 5");

        // Friday 5th
        assertThat(schedule.next(utc("2024-01-01T00:00:00Z"))).contains(utc("2024-01-05T09:00:00Z"));
        // Friday 12th comes before Saturday 13th
        assertThat(schedule.next(utc("2024-01-06T00:00:00Z"))).contains(utc("2024-01-12T09:00:00Z"));
        // Saturday 13th matches on day-of-month alone
        assertThat(schedule.next(utc("2024-01-12T10:00:00Z"))).contains(utc("2024-01-13T09:00:00Z"));
    }

    @Test
    @DisplayName("Expression is evaluated in the zone of the reference time")
    void next_usesReferenceZone() {
        CronSchedule schedule = CronSchedule.parse("0 8 * * *");
        ZonedDateTime after = utc("2024-01-01T12:00:00Z").withZoneSameInstant(ZoneId.of("America/New_York"));

        ZonedDateTime next = schedule.next(after).orElseThrow();

        assertThat(next.toInstant()).isEqualTo(utc("2024-01-01T13:00:00Z").toInstant());
        assertThat(next.getZone()).isEqualTo(ZoneId.of("America/New_York"));
    }

    @Test
    @DisplayName("An expression that can never fire yields no next run")
    void impossibleDate_yieldsEmpty() {
        CronSchedule schedule = CronSchedule.parse("0 0 30 2 *");

        assertThat(schedule.next(utc("2024-01-01T00:00:00Z"))).isEmpty();
    }

    @Test
    @DisplayName("Macros expand to their 5-field equivalent")
    void macros_areExpanded() {
        ZonedDateTime after = utc("2024-03-10T15:30:00Z");

        assertThat(CronSchedule.parse("@daily").next(after)).isEqualTo(CronSchedule.parse("0 0 * * *").next(after));
        assertThat(CronSchedule.parse("@hourly").next(after)).contains(utc("2024-03-10T16:00:00Z"));
        assertThat(CronSchedule.parse("@monthly").next(after)).contains(utc("2024-04-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Malformed expressions are rejected with ScheduleParseException")
    void malformedExpressions_areRejected() {
        assertThatThrownBy(() -> CronSchedule.parse("61 * * * *")).isInstanceOf(ScheduleParseException.class);
        assertThatThrownBy(() -> CronSchedule.parse("0 0 8 * * *"))
                .isInstanceOf(ScheduleParseException.class)
                .hasMessageContaining("5 fields");
        assertThatThrownBy(() -> CronSchedule.parse("not a cron")).isInstanceOf(ScheduleParseException.class);
        assertThatThrownBy(() -> CronSchedule.parse("  ")).isInstanceOf(ScheduleParseException.class);
        assertThatThrownBy(() -> CronSchedule.parse(null)).isInstanceOf(ScheduleParseException.class);
    }

    @Test
    @DisplayName("Same expression and reference time always yield the same instant")
    void next_isDeterministic() {
        ZonedDateTime after = utc("2024-02-28T23:59:00Z");

        assertThat(CronSchedule.parse("*/15 * * * *").next(after))
                .isEqualTo(CronSchedule.parse("*/15 * * * *").next(after))
                .contains(utc("2024-02-29T00:00:00Z"));
    }
}
