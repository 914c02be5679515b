package com.phantom.service;

import com.phantom.domain.model.Event;
import com.phantom.exception.InvalidSchedulingRequestException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
public class FreeSlotFinder {

    public List<TimeRange> findFreeSlots(OffsetDateTime windowStart,
                                         OffsetDateTime windowEnd,
                                         Duration minDuration,
                                         List<Event> busyEvents) {
        if (windowStart == null || windowEnd == null || !windowEnd.isAfter(windowStart)) {
            throw new InvalidSchedulingRequestException(
                    "Search window end must be after its start: start=" + windowStart + ", end=" + windowEnd);
        }
        if (minDuration == null || minDuration.isNegative() || minDuration.isZero()) {
            throw new InvalidSchedulingRequestException("Minimum slot duration must be positive: " + minDuration);
        }

        List<Event> busy = new ArrayList<>();
        if (busyEvents != null) {
            for (Event event : busyEvents) {
                if (event.getStartsAt().isBefore(windowEnd) && event.getEndsAt().isAfter(windowStart)) {
                    busy.add(event);
                }
            }
        }
        busy.sort(Comparator.comparing(Event::getStartsAt));

        List<TimeRange> slots = new ArrayList<>();
        OffsetDateTime cursor = windowStart;
        for (Event event : busy) {
            if (event.getStartsAt().isAfter(cursor)) {
                addIfLongEnough(slots, cursor, event.getStartsAt(), minDuration);
            }
            if (event.getEndsAt().isAfter(cursor)) {
                cursor = event.getEndsAt();
            }
        }
        if (cursor.isBefore(windowEnd)) {
            addIfLongEnough(slots, cursor, windowEnd, minDuration);
        }
        return slots;
    }

    private void addIfLongEnough(List<TimeRange> slots, OffsetDateTime start, OffsetDateTime end, Duration minDuration) {
        if (Duration.between(start, end).compareTo(minDuration) >= 0) {
            slots.add(new TimeRange(start, end));
        }
    }
}
