package com.phantom.service;

import com.phantom.domain.model.Event;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
public class ConflictDetector {

    public List<ConflictPair> detectConflicts(List<Event> events) {
        if (events == null || events.size() < 2) {
            return List.of();
        }
        List<Event> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(Event::getStartsAt));

        List<ConflictPair> conflicts = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            Event current = sorted.get(i);
            for (int j = i + 1; j < sorted.size(); j++) {
                Event later = sorted.get(j);
                // sorted by start: nothing after this one can overlap current
                if (!later.getStartsAt().isBefore(current.getEndsAt())) {
                    break;
                }
                conflicts.add(new ConflictPair(current, later));
            }
        }
        return conflicts;
    }
}
