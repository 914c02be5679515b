package com.phantom.service;

import com.phantom.exception.InvalidTimezoneException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TemporalExpressionResolver Tests")
class TemporalExpressionResolverTest {

    private static final Instant MONDAY_9AM = Instant.parse("2024-01-15T09:00:00Z");
    private static final ZoneId UTC = ZoneId.of("UTC");

    private final TemporalExpressionResolver resolver = new TemporalExpressionResolver();

    private static OffsetDateTime utc(int day, int hour, int minute) {
        return OffsetDateTime.of(2024, 1, day, hour, minute, 0, 0, ZoneOffset.UTC);
    }

    private TimeRange single(String text) {
        List<TimeRange> ranges = resolver.resolve(text, UTC, MONDAY_9AM);
        assertThat(ranges).hasSize(1);
        return ranges.get(0);
    }

    @Nested
    @DisplayName("Relative days")
    class RelativeDays {

        @Test
        @DisplayName("now starts at the reference instant with default duration")
        void now_StartsAtReference() {
            TimeRange range = single("I am gaming right now");
            assertThat(range.start().toInstant()).isEqualTo(MONDAY_9AM);
            assertThat(range.duration()).isEqualTo(Duration.ofHours(1));
        }

        @Test
        @DisplayName("today with explicit time and minutes duration")
        void today_ExplicitTimeAndMinutes() {
            TimeRange range = single("review notes today at 9:30 am for 30 minutes");
            assertThat(range.start()).isEqualTo(utc(15, 9, 30));
            assertThat(range.end()).isEqualTo(utc(15, 10, 0));
        }

        @Test
        @DisplayName("tonight before 18:00 is forced to 20:00")
        void tonight_EarlyHourForcedToEvening() {
            assertThat(single("call mom tonight at 3pm").start()).isEqualTo(utc(15, 20, 0));
            assertThat(single("party tonight").start()).isEqualTo(utc(15, 20, 0));
        }

        @Test
        @DisplayName("tonight keeps an explicit evening time")
        void tonight_EveningTimeKept() {
            assertThat(single("party tonight at 9pm").start()).isEqualTo(utc(15, 21, 0));
        }

        @Test
        @DisplayName("tomorrow morning resolves to 09:00 next day")
        void tomorrowMorning() {
            assertThat(single("gym tomorrow morning").start()).isEqualTo(utc(16, 9, 0));
        }

        @Test
        @DisplayName("tomorrow without a time defaults to 14:00")
        void tomorrow_DefaultTime() {
            TimeRange range = single("dentist tomorrow");
            assertThat(range.start()).isEqualTo(utc(16, 14, 0));
            assertThat(range.end()).isEqualTo(utc(16, 15, 0));
        }

        @Test
        @DisplayName("24-hour clock time is honoured")
        void tomorrow_TwentyFourHourClock() {
            assertThat(single("tomorrow at 18:30").start()).isEqualTo(utc(16, 18, 30));
        }

        @Test
        @DisplayName("12am and 12pm map to midnight and noon")
        void meridiemEdges() {
            assertThat(single("tomorrow at 12am").start()).isEqualTo(utc(16, 0, 0));
            assertThat(single("tomorrow at 12pm").start()).isEqualTo(utc(16, 12, 0));
        }

        @Test
        @DisplayName("decimal hours duration")
        void decimalHours() {
            assertThat(single("study for 1.5 hours tomorrow").duration()).isEqualTo(Duration.ofMinutes(90));
        }

        @Test
        @DisplayName("in N days and in N weeks")
        void inDaysAndWeeks() {
            assertThat(single("in 3 days").start()).isEqualTo(utc(18, 14, 0));
            assertThat(single("in 2 weeks").start()).isEqualTo(utc(29, 14, 0));
        }

        @Test
        @DisplayName("next week is seven days ahead")
        void nextWeek() {
            assertThat(single("project review next week").start()).isEqualTo(utc(22, 14, 0));
        }
    }

    @Nested
    @DisplayName("Weekdays")
    class Weekdays {

        @Test
        @DisplayName("next Friday at 2pm for 2 hours is four days ahead")
        void nextFriday_TwoHours() {
            TimeRange range = single("next Friday at 2pm for 2 hours");
            assertThat(range.start()).isEqualTo(utc(19, 14, 0));
            assertThat(range.end()).isEqualTo(utc(19, 16, 0));
        }

        @Test
        @DisplayName("next <same weekday> is a week later")
        void nextSameWeekday() {
            assertThat(single("next monday").start()).isEqualTo(utc(22, 14, 0));
        }

        @Test
        @DisplayName("this <today> stays today, this <past day> rolls to next week")
        void thisWeekday() {
            assertThat(single("this monday").start()).isEqualTo(utc(15, 14, 0));
            assertThat(single("this sunday").start()).isEqualTo(utc(21, 14, 0));
        }

        @Test
        @DisplayName("bare weekday behaves like next weekday")
        void bareWeekday() {
            assertThat(single("monday").start()).isEqualTo(utc(22, 14, 0));
            assertThat(single("thurs at 10am").start()).isEqualTo(utc(18, 10, 0));
        }

        @Test
        @DisplayName("wednesday and thursday evening gives two chronological ranges")
        void multiDay_WednesdayAndThursday() {
            List<TimeRange> ranges = resolver.resolve("wednesday and thursday evening", UTC, MONDAY_9AM);

            assertThat(ranges).hasSize(2);
            assertThat(ranges.get(0).start()).isEqualTo(utc(17, 18, 0));
            assertThat(ranges.get(0).end()).isEqualTo(utc(17, 19, 0));
            assertThat(ranges.get(1).start()).isEqualTo(utc(18, 18, 0));
            assertThat(ranges.get(1).end()).isEqualTo(utc(18, 19, 0));
        }

        @Test
        @DisplayName("second weekday before the first wraps a week and fills every day between")
        void multiDay_Wraps() {
            List<TimeRange> ranges = resolver.resolve("friday and wednesday", UTC, MONDAY_9AM);

            assertThat(ranges).extracting(r -> r.start().getDayOfMonth()).containsExactly(19, 20, 21, 22, 23, 24);
        }

        @Test
        @DisplayName("identical weekdays give exactly one range")
        void multiDay_SameDay() {
            assertThat(resolver.resolve("tue and tue", UTC, MONDAY_9AM)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Clock time only")
    class ClockTimeOnly {

        @Test
        @DisplayName("a time later today stays today")
        void laterToday() {
            assertThat(single("at 5pm").start()).isEqualTo(utc(15, 17, 0));
        }

        @Test
        @DisplayName("a time already passed moves to tomorrow")
        void alreadyPassed() {
            assertThat(single("at 8am").start()).isEqualTo(utc(16, 8, 0));
        }
    }

    @Nested
    @DisplayName("Timezones and edge cases")
    class Edges {

        @Test
        @DisplayName("results are localized into the user's zone")
        void userZone() {
            TimeRange range = resolver.resolve("tomorrow at 9am", "America/New_York", MONDAY_9AM).get(0);

            assertThat(range.start()).isEqualTo(OffsetDateTime.parse("2024-01-16T09:00:00-05:00"));
        }

        @Test
        @DisplayName("a time inside a DST gap shifts forward")
        void dstGap() {
            Instant saturday = Instant.parse("2024-03-30T10:00:00Z");

            TimeRange range = resolver.resolve("tomorrow at 2:30am", "Europe/Berlin", saturday).get(0);

            assertThat(range.start()).isEqualTo(OffsetDateTime.parse("2024-03-31T03:30:00+02:00"));
        }

        @Test
        @DisplayName("unknown timezone is a validation failure")
        void unknownZone() {
            assertThatThrownBy(() -> resolver.resolve("tomorrow", "Mars/Olympus", MONDAY_9AM))
                    .isInstanceOf(InvalidTimezoneException.class)
                    .hasMessageContaining("Mars/Olympus");
        }

        @Test
        @DisplayName("blank or unrecognized text yields an empty list")
        void noMatch() {
            assertThat(resolver.resolve("   ", UTC, MONDAY_9AM)).isEmpty();
            assertThat(resolver.resolve("sometime soon", UTC, MONDAY_9AM)).isEmpty();
        }

        @Test
        @DisplayName("day and week offsets beyond the calendar range yield an empty list")
        void outOfRangeOffsets() {
            assertThat(resolver.resolve("study in 99999999999999999999 days", UTC, MONDAY_9AM)).isEmpty();
            assertThat(resolver.resolve("gym in 999999999999 weeks", UTC, MONDAY_9AM)).isEmpty();
        }

        @Test
        @DisplayName("an oversized duration falls back to one hour")
        void oversizedDuration() {
            TimeRange minutes = single("gym tomorrow for 99999999999999999999 minutes");
            assertThat(minutes.start()).isEqualTo(utc(16, 14, 0));
            assertThat(minutes.duration()).isEqualTo(Duration.ofHours(1));

            assertThat(single("gym tomorrow for 99999999999 hours").duration()).isEqualTo(Duration.ofHours(1));
        }

        @Test
        @DisplayName("resolving the same text twice gives identical output")
        void idempotent() {
            String text = "wednesday and thursday evening for 45 minutes";
            assertThat(resolver.resolve(text, UTC, MONDAY_9AM)).isEqualTo(resolver.resolve(text, UTC, MONDAY_9AM));
        }
    }
}
