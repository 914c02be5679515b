package com.phantom.service;

import com.phantom.domain.enums.ResolutionStatus;
import com.phantom.domain.model.Event;

import java.util.List;

/**
 * Outcome of one conflict-resolution pass. {@code events} holds every input event exactly once;
 * {@code unresolved} lists events left at their original, still conflicting, time.
 */
public record ResolutionResult(List<Event> events, List<Event> rescheduled, List<Event> unresolved) {

    public ResolutionResult {
        events = List.copyOf(events);
        rescheduled = List.copyOf(rescheduled);
        unresolved = List.copyOf(unresolved);
    }

    public static ResolutionResult empty() {
        return new ResolutionResult(List.of(), List.of(), List.of());
    }

    public boolean hasUnresolved() {
        return !unresolved.isEmpty();
    }

    public ResolutionStatus statusOf(Event event) {
        if (containsSame(unresolved, event)) {
            return ResolutionStatus.UNRESOLVED;
        }
        if (containsSame(rescheduled, event)) {
            return ResolutionStatus.RESCHEDULED;
        }
        return ResolutionStatus.KEPT;
    }

    private static boolean containsSame(List<Event> events, Event event) {
        for (Event candidate : events) {
            if (candidate == event) {
                return true;
            }
        }
        return false;
    }
}
