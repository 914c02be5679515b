package com.phantom.config;

import com.phantom.domain.enums.DefaultCategory;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app.scheduling")
public record SchedulingProperties(
        @Positive Integer searchHorizonDays,
        @Min(2) @Max(3) Integer studySessionCount,
        @Positive Integer studySessionDurationMinutes,
        @Min(0) @Max(23) Integer studySessionHour,
        String defaultTimezone,
        Map<String, Integer> categoryPriorities
) {
    public static final int MIN_STUDY_SESSIONS = 2;
    public static final int MAX_STUDY_SESSIONS = 3;

    public static SchedulingProperties defaults() {
        return new SchedulingProperties(null, null, null, null, null, null);
    }

    public int safeSearchHorizonDays() {
        return searchHorizonDays != null && searchHorizonDays > 0 ? searchHorizonDays : 30;
    }

    public int safeStudySessionCount() {
        if (studySessionCount == null
                || studySessionCount < MIN_STUDY_SESSIONS
                || studySessionCount > MAX_STUDY_SESSIONS) {
            return MAX_STUDY_SESSIONS;
        }
        return studySessionCount;
    }

    public int safeStudySessionDurationMinutes() {
        return studySessionDurationMinutes != null && studySessionDurationMinutes > 0
                ? studySessionDurationMinutes
                : 120;
    }

    public int safeStudySessionHour() {
        return studySessionHour != null && studySessionHour >= 0 && studySessionHour <= 23
                ? studySessionHour
                : 14;
    }

    public ZoneId safeDefaultZone() {
        if (defaultTimezone == null || defaultTimezone.isBlank()) {
            return ZoneId.of("UTC");
        }
        try {
            return ZoneId.of(defaultTimezone.trim());
        } catch (DateTimeException e) {
            return ZoneId.of("UTC");
        }
    }

    public Map<String, Integer> safeCategoryPriorities() {
        if (categoryPriorities != null && !categoryPriorities.isEmpty()) {
            return categoryPriorities;
        }
        Map<String, Integer> defaults = new LinkedHashMap<>();
        for (DefaultCategory category : DefaultCategory.values()) {
            defaults.put(category.displayName(), category.priorityLevel());
        }
        return defaults;
    }
}
