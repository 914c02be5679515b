package com.phantom.service;

import com.phantom.config.SchedulingProperties;
import com.phantom.domain.model.Event;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy priority-first resolution: events are ranked by {@code (-priority, start)}, the first
 * non-overlapping ones are kept, and each loser moves to the earliest free slot of its own length
 * after its original start. This is a first-fit heuristic, not an optimal packing.
 * <p>
 * {@code fixedBusy} are events outside the resolved set that still occupy time during the slot
 * search; they are never moved and are not part of the result.
 * Mutates start and end of moved events in place; nothing is persisted here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConflictResolver {

    private final CategoryPriorityTable priorityTable;
    private final FreeSlotFinder freeSlotFinder;
    private final SchedulingProperties properties;

    public ResolutionResult resolveConflicts(List<Event> events) {
        return resolveConflicts(events, List.of());
    }

    public ResolutionResult resolveConflicts(List<Event> events, List<Event> fixedBusy) {
        if (events == null || events.isEmpty()) {
            return ResolutionResult.empty();
        }

        List<Event> ranked = new ArrayList<>(events);
        ranked.sort(Comparator
                .comparingInt((Event e) -> priorityTable.priorityOf(e.getCategory()))
                .reversed()
                .thenComparing(Event::getStartsAt));

        List<Event> finalized = new ArrayList<>();
        List<Event> deferred = new ArrayList<>();
        for (Event event : ranked) {
            if (overlapsAny(event, finalized)) {
                deferred.add(event);
            } else {
                finalized.add(event);
            }
        }

        List<Event> rescheduled = new ArrayList<>();
        List<Event> unresolved = new ArrayList<>();
        int horizonDays = properties.safeSearchHorizonDays();
        for (Event event : deferred) {
            if (!event.isFlexible()) {
                log.warn("Event {} is not flexible and stays in conflict at {}", event.getId(), event.getStartsAt());
                finalized.add(event);
                unresolved.add(event);
                continue;
            }

            Duration duration = event.duration();
            OffsetDateTime searchStart = event.getStartsAt();
            List<Event> busy = new ArrayList<>(finalized);
            if (fixedBusy != null) {
                busy.addAll(fixedBusy);
            }
            List<TimeRange> slots = freeSlotFinder.findFreeSlots(
                    searchStart, searchStart.plusDays(horizonDays), duration, busy);
            if (slots.isEmpty()) {
                log.warn("No free slot within {} days for event {} ('{}'), keeping original time {}",
                        horizonDays, event.getId(), event.getTitle(), event.getStartsAt());
                finalized.add(event);
                unresolved.add(event);
                continue;
            }

            OffsetDateTime newStart = slots.get(0).start();
            event.setStartsAt(newStart);
            event.setEndsAt(newStart.plus(duration));
            finalized.add(event);
            rescheduled.add(event);
        }

        return new ResolutionResult(finalized, rescheduled, unresolved);
    }

    private boolean overlapsAny(Event event, List<Event> others) {
        for (Event other : others) {
            if (event.overlaps(other)) {
                return true;
            }
        }
        return false;
    }
}
