package com.phantom.service;

import com.phantom.domain.model.Event;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.phantom.domain.enums.DefaultCategory.GAMING;
import static com.phantom.domain.enums.DefaultCategory.GYM;
import static com.phantom.domain.enums.DefaultCategory.STUDY;
import static com.phantom.service.SchedulingFixtures.MONDAY_9AM;
import static com.phantom.service.SchedulingFixtures.at;
import static com.phantom.service.SchedulingFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConflictDetector Tests")
class ConflictDetectorTest {

    private final ConflictDetector detector = new ConflictDetector();

    @Test
    @DisplayName("Reports nested and partial overlaps but not disjoint events")
    void detectConflicts_NestedAndPartial() {
        Event outer = event("outer", STUDY, at(15, 10), at(15, 14));
        Event nested = event("nested", GYM, at(15, 11), at(15, 12));
        Event tail = event("tail", GAMING, at(15, 13), at(15, 15));

        List<ConflictPair> conflicts = detector.detectConflicts(List.of(tail, nested, outer));

        assertThat(conflicts).containsExactly(new ConflictPair(outer, nested), new ConflictPair(outer, tail));
    }

    @Test
    @DisplayName("Touching ranges do not conflict")
    void detectConflicts_TouchingRanges() {
        Event first = event("first", STUDY, at(15, 10), at(15, 11));
        Event second = event("second", GYM, at(15, 11), at(15, 12));

        assertThat(detector.detectConflicts(List.of(first, second))).isEmpty();
    }

    @Test
    @DisplayName("Empty and single-event inputs have no conflicts")
    void detectConflicts_TrivialInputs() {
        assertThat(detector.detectConflicts(List.of())).isEmpty();
        assertThat(detector.detectConflicts(List.of(event("solo", GYM, at(15, 10), at(15, 11))))).isEmpty();
    }

    @Test
    @DisplayName("A pair is reported exactly when the half-open ranges overlap")
    void detectConflicts_MatchesPairwiseOverlap() {
        Random random = new Random(42);
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            OffsetDateTime start = MONDAY_9AM.plusMinutes(15L * random.nextInt(96));
            events.add(event("e" + i, GYM, start, start.plusMinutes(15L * (1 + random.nextInt(12)))));
        }

        List<ConflictPair> conflicts = detector.detectConflicts(events);

        int expected = 0;
        for (int i = 0; i < events.size(); i++) {
            for (int j = i + 1; j < events.size(); j++) {
                Event a = events.get(i);
                Event b = events.get(j);
                boolean overlap = a.getStartsAt().isBefore(b.getEndsAt()) && b.getStartsAt().isBefore(a.getEndsAt());
                if (overlap) {
                    expected++;
                    assertThat(conflicts).anyMatch(p -> (p.first() == a && p.second() == b)
                            || (p.first() == b && p.second() == a));
                }
            }
        }
        assertThat(conflicts).hasSize(expected);
    }
}
