package com.phantom.service;

import com.phantom.exception.InvalidTimezoneException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
public class TemporalExpressionResolver {

    static final String WEEKDAY_ALTERNATION =
            "monday|mon|tuesday|tues|tue|wednesday|wed|thursday|thurs|thur|thu|friday|fri|saturday|sat|sunday|sun";

    private static final Map<String, DayOfWeek> WEEKDAYS = Map.ofEntries(
            Map.entry("monday", DayOfWeek.MONDAY),
            Map.entry("mon", DayOfWeek.MONDAY),
            Map.entry("tuesday", DayOfWeek.TUESDAY),
            Map.entry("tue", DayOfWeek.TUESDAY),
            Map.entry("tues", DayOfWeek.TUESDAY),
            Map.entry("wednesday", DayOfWeek.WEDNESDAY),
            Map.entry("wed", DayOfWeek.WEDNESDAY),
            Map.entry("thursday", DayOfWeek.THURSDAY),
            Map.entry("thu", DayOfWeek.THURSDAY),
            Map.entry("thur", DayOfWeek.THURSDAY),
            Map.entry("thurs", DayOfWeek.THURSDAY),
            Map.entry("friday", DayOfWeek.FRIDAY),
            Map.entry("fri", DayOfWeek.FRIDAY),
            Map.entry("saturday", DayOfWeek.SATURDAY),
            Map.entry("sat", DayOfWeek.SATURDAY),
            Map.entry("sunday", DayOfWeek.SUNDAY),
            Map.entry("sun", DayOfWeek.SUNDAY)
    );

    private static final Pattern HOURS_PATTERN = Pattern.compile("(?:for\\s+)?(\\d+(?:\\.\\d+)?)\\s*(?:hour|hr|hours|hrs)");
    private static final Pattern MINUTES_PATTERN = Pattern.compile("(?:for\\s+)?(\\d+)\\s*(?:minute|min|minutes|mins)");
    private static final Pattern MERIDIEM_TIME_PATTERN = Pattern.compile("(?:at\\s+)?(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)");
    private static final Pattern CLOCK_TIME_PATTERN = Pattern.compile("\\b(\\d{1,2}):(\\d{2})\\b");

    private static final Pattern NOW_PATTERN = Pattern.compile("\\b(right now|currently|now)\\b");
    private static final Pattern TODAY_PATTERN = Pattern.compile("\\btoday\\b");
    private static final Pattern TONIGHT_PATTERN = Pattern.compile("\\btonight\\b");
    private static final Pattern TOMORROW_PATTERN = Pattern.compile("\\btomorrow\\b");
    private static final Pattern NEXT_WEEKDAY_PATTERN = Pattern.compile("\\bnext\\s+(" + WEEKDAY_ALTERNATION + ")\\b");
    private static final Pattern THIS_WEEKDAY_PATTERN = Pattern.compile("\\bthis\\s+(" + WEEKDAY_ALTERNATION + ")\\b");
    private static final Pattern MULTI_DAY_PATTERN = Pattern.compile(
            "\\b(" + WEEKDAY_ALTERNATION + ")\\s+and\\s+(" + WEEKDAY_ALTERNATION + ")\\b");
    private static final Pattern WEEKDAY_PATTERN = Pattern.compile("\\b(" + WEEKDAY_ALTERNATION + ")\\b");
    private static final Pattern IN_DAYS_PATTERN = Pattern.compile("\\bin\\s+(\\d+)\\s+(day|days)\\b");
    private static final Pattern IN_WEEKS_PATTERN = Pattern.compile("\\bin\\s+(\\d+)\\s+(week|weeks)\\b");
    private static final Pattern NEXT_WEEK_PATTERN = Pattern.compile("\\bnext\\s+week\\b");
    private static final Pattern AT_TIME_PATTERN = Pattern.compile("\\bat\\s+(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)");

    private static final LocalTime DEFAULT_TIME = LocalTime.of(14, 0);
    private static final LocalTime TONIGHT_TIME = LocalTime.of(20, 0);
    private static final Duration DEFAULT_DURATION = Duration.ofHours(1);
    // longer durations are treated as unparseable
    private static final Duration MAX_DURATION = Duration.ofDays(366);

    public List<TimeRange> resolve(String text, String timezone, Instant reference) {
        return resolve(text, toZoneId(timezone), reference);
    }

    public List<TimeRange> resolve(String text, ZoneId zoneId, Instant reference) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        try {
            return resolveNormalized(normalized, zoneId, reference);
        } catch (DateTimeException | ArithmeticException e) {
            log.debug("Temporal expression out of range in '{}': {}", text, e.getMessage());
            return List.of();
        }
    }

    private List<TimeRange> resolveNormalized(String normalized, ZoneId zoneId, Instant reference) {
        ZonedDateTime now = reference.atZone(zoneId);
        Duration duration = extractDuration(normalized);
        LocalTime timeOfDay = extractTimeOfDay(normalized);
        LocalDate today = now.toLocalDate();

        if (NOW_PATTERN.matcher(normalized).find()) {
            return single(now, duration);
        }
        if (TODAY_PATTERN.matcher(normalized).find()) {
            return single(localize(today, timeOfDay, zoneId), duration);
        }
        if (TONIGHT_PATTERN.matcher(normalized).find()) {
            LocalTime time = timeOfDay.getHour() < 18 ? TONIGHT_TIME : timeOfDay;
            return single(localize(today, time, zoneId), duration);
        }
        if (TOMORROW_PATTERN.matcher(normalized).find()) {
            return single(localize(today.plusDays(1), timeOfDay, zoneId), duration);
        }

        Matcher next = NEXT_WEEKDAY_PATTERN.matcher(normalized);
        if (next.find()) {
            return single(localize(nextOccurrence(today, weekday(next.group(1))), timeOfDay, zoneId), duration);
        }

        Matcher thisWeek = THIS_WEEKDAY_PATTERN.matcher(normalized);
        if (thisWeek.find()) {
            return single(localize(occurrenceThisWeek(today, weekday(thisWeek.group(1))), timeOfDay, zoneId), duration);
        }

        Matcher multiDay = MULTI_DAY_PATTERN.matcher(normalized);
        if (multiDay.find()) {
            return multiDayRange(today, weekday(multiDay.group(1)), weekday(multiDay.group(2)), timeOfDay, zoneId, duration);
        }

        Matcher bareWeekday = WEEKDAY_PATTERN.matcher(normalized);
        if (bareWeekday.find()) {
            return single(localize(nextOccurrence(today, weekday(bareWeekday.group(1))), timeOfDay, zoneId), duration);
        }

        Matcher inDays = IN_DAYS_PATTERN.matcher(normalized);
        if (inDays.find()) {
            Long days = parseCount(inDays.group(1));
            return days == null ? List.of() : single(localize(today.plusDays(days), timeOfDay, zoneId), duration);
        }

        Matcher inWeeks = IN_WEEKS_PATTERN.matcher(normalized);
        if (inWeeks.find()) {
            Long weeks = parseCount(inWeeks.group(1));
            return weeks == null ? List.of() : single(localize(today.plusWeeks(weeks), timeOfDay, zoneId), duration);
        }

        if (NEXT_WEEK_PATTERN.matcher(normalized).find()) {
            return single(localize(today.plusDays(7), timeOfDay, zoneId), duration);
        }

        if (AT_TIME_PATTERN.matcher(normalized).find()) {
            ZonedDateTime start = localize(today, timeOfDay, zoneId);
            if (start.isBefore(now)) {
                start = localize(today.plusDays(1), timeOfDay, zoneId);
            }
            return single(start, duration);
        }

        log.debug("No temporal expression recognized in '{}'", normalized);
        return List.of();
    }

    public ZoneId toZoneId(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidTimezoneException(String.valueOf(timezone), null);
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new InvalidTimezoneException(timezone, e);
        }
    }

    Duration extractDuration(String normalized) {
        Matcher hours = HOURS_PATTERN.matcher(normalized);
        if (hours.find()) {
            long seconds = Math.round(Double.parseDouble(hours.group(1)) * 3600);
            return seconds > 0 && seconds <= MAX_DURATION.getSeconds() ? Duration.ofSeconds(seconds) : DEFAULT_DURATION;
        }
        Matcher minutes = MINUTES_PATTERN.matcher(normalized);
        if (minutes.find()) {
            Long value = parseCount(minutes.group(1));
            return value != null && value > 0 && value <= MAX_DURATION.toMinutes()
                    ? Duration.ofMinutes(value)
                    : DEFAULT_DURATION;
        }
        return DEFAULT_DURATION;
    }

    private Long parseCount(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            log.debug("Number '{}' out of range", digits);
            return null;
        }
    }

    LocalTime extractTimeOfDay(String normalized) {
        Matcher meridiem = MERIDIEM_TIME_PATTERN.matcher(normalized);
        if (meridiem.find()) {
            int hour = Integer.parseInt(meridiem.group(1));
            int minute = meridiem.group(2) != null ? Integer.parseInt(meridiem.group(2)) : 0;
            if (hour <= 12 && minute <= 59) {
                if ("pm".equals(meridiem.group(3)) && hour != 12) {
                    hour += 12;
                } else if ("am".equals(meridiem.group(3)) && hour == 12) {
                    hour = 0;
                }
                return LocalTime.of(hour, minute);
            }
        }

        Matcher clock = CLOCK_TIME_PATTERN.matcher(normalized);
        if (clock.find()) {
            int hour = Integer.parseInt(clock.group(1));
            int minute = Integer.parseInt(clock.group(2));
            if (hour <= 23 && minute <= 59) {
                return LocalTime.of(hour, minute);
            }
        }

        // substring match, so "tonight" counts as night
        if (normalized.contains("morning")) {
            return LocalTime.of(9, 0);
        }
        if (normalized.contains("afternoon")) {
            return LocalTime.of(14, 0);
        }
        if (normalized.contains("evening")) {
            return LocalTime.of(18, 0);
        }
        if (normalized.contains("night")) {
            return LocalTime.of(20, 0);
        }
        return DEFAULT_TIME;
    }

    private List<TimeRange> multiDayRange(LocalDate today, DayOfWeek first, DayOfWeek second,
                                          LocalTime timeOfDay, ZoneId zoneId, Duration duration) {
        LocalDate firstDate = nextOccurrence(today, first);
        if (first == second) {
            return single(localize(firstDate, timeOfDay, zoneId), duration);
        }
        LocalDate lastDate = nextOccurrence(today, second);
        if (!lastDate.isAfter(firstDate)) {
            lastDate = lastDate.plusDays(7);
        }
        List<TimeRange> ranges = new ArrayList<>();
        for (LocalDate day = firstDate; !day.isAfter(lastDate); day = day.plusDays(1)) {
            ZonedDateTime start = localize(day, timeOfDay, zoneId);
            ranges.add(new TimeRange(start.toOffsetDateTime(), start.plus(duration).toOffsetDateTime()));
        }
        return ranges;
    }

    private LocalDate nextOccurrence(LocalDate today, DayOfWeek target) {
        int daysAhead = target.getValue() - today.getDayOfWeek().getValue();
        if (daysAhead <= 0) {
            daysAhead += 7;
        }
        return today.plusDays(daysAhead);
    }

    private LocalDate occurrenceThisWeek(LocalDate today, DayOfWeek target) {
        int daysAhead = target.getValue() - today.getDayOfWeek().getValue();
        if (daysAhead < 0) {
            daysAhead += 7;
        }
        return today.plusDays(daysAhead);
    }

    private ZonedDateTime localize(LocalDate date, LocalTime time, ZoneId zoneId) {
        return date.atTime(time).atZone(zoneId);
    }

    private List<TimeRange> single(ZonedDateTime start, Duration duration) {
        return List.of(new TimeRange(start.toOffsetDateTime(), start.plus(duration).toOffsetDateTime()));
    }

    private DayOfWeek weekday(String name) {
        return WEEKDAYS.get(name);
    }
}
