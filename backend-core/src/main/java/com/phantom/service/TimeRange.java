package com.phantom.service;

import com.phantom.exception.InvalidEventTimeException;

import java.time.Duration;
import java.time.OffsetDateTime;

public record TimeRange(OffsetDateTime start, OffsetDateTime end) {

    public TimeRange {
        if (start == null || end == null) {
            throw new InvalidEventTimeException("Time range needs both start and end");
        }
        if (!end.isAfter(start)) {
            throw new InvalidEventTimeException("End time must be after start time: start=" + start + ", end=" + end);
        }
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean overlaps(TimeRange other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }
}
