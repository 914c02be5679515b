package com.phantom.service;

import com.phantom.config.SchedulingProperties;
import com.phantom.domain.enums.DefaultCategory;
import com.phantom.domain.enums.SchedulingAction;
import com.phantom.domain.model.Category;
import com.phantom.domain.model.Event;
import com.phantom.domain.model.SchedulingLog;
import com.phantom.domain.model.User;
import com.phantom.exception.CategoryNotFoundException;
import com.phantom.exception.EventNotFoundException;
import com.phantom.exception.InvalidEventTimeException;
import com.phantom.exception.InvalidSchedulingRequestException;
import com.phantom.exception.UserNotFoundException;
import com.phantom.repository.CategoryRepository;
import com.phantom.repository.EventRepository;
import com.phantom.repository.SchedulingLogRepository;
import com.phantom.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Single writer of events. Each public mutating method is one transaction: the owner's row is
 * locked first, every write and the audit record commit together, and any failure rolls back
 * everything and is re-thrown unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PrioritySchedulingService {

    private final UserRepository userRepository;
    private final CategoryRepository categoryRepository;
    private final EventRepository eventRepository;
    private final SchedulingLogRepository schedulingLogRepository;
    private final ConflictDetector conflictDetector;
    private final FreeSlotFinder freeSlotFinder;
    private final ConflictResolver conflictResolver;
    private final StudySessionGenerator studySessionGenerator;
    private final TemporalExpressionResolver temporalExpressionResolver;
    private final CategoryKeywordExtractor categoryKeywordExtractor;
    private final SchedulingProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<ConflictPair> detectConflicts(UUID userId, OffsetDateTime windowStart, OffsetDateTime windowEnd) {
        User owner = userRepository.findById(userId).orElseThrow(() -> new UserNotFoundException(userId));
        requireWindow(windowStart, windowEnd);
        return conflictDetector.detectConflicts(eventRepository.findOverlapping(owner, windowStart, windowEnd));
    }

    @Transactional(readOnly = true)
    public List<TimeRange> findFreeSlots(UUID userId, OffsetDateTime windowStart, OffsetDateTime windowEnd,
                                         Duration minDuration) {
        User owner = userRepository.findById(userId).orElseThrow(() -> new UserNotFoundException(userId));
        requireWindow(windowStart, windowEnd);
        List<Event> busy = eventRepository.findOverlapping(owner, windowStart, windowEnd);
        return freeSlotFinder.findFreeSlots(windowStart, windowEnd, minDuration, busy);
    }

    @Transactional
    public ResolutionResult optimize(UUID userId, OffsetDateTime windowStart, OffsetDateTime windowEnd) {
        try {
            User owner = lockOwner(userId);
            requireWindow(windowStart, windowEnd);

            List<Event> events = eventRepository.findOverlapping(owner, windowStart, windowEnd);
            ResolutionResult result = resolveWithinHorizon(owner, events);
            eventRepository.saveAll(result.events());

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("start_date", windowStart.toString());
            details.put("end_date", windowEnd.toString());
            details.put("num_events", result.events().size());
            details.put("event_ids", ids(result.events()));
            details.put("rescheduled_event_ids", ids(result.rescheduled()));
            details.put("unresolved_event_ids", ids(result.unresolved()));
            schedulingLogRepository.save(SchedulingLog.of(owner, SchedulingAction.OPTIMIZE, details, clock));

            publishChange(owner, result.rescheduled(), List.of());
            log.info("Schedule optimization completed for user {}: {} events, {} rescheduled, {} unresolved",
                    userId, result.events().size(), result.rescheduled().size(), result.unresolved().size());
            return result;
        } catch (RuntimeException e) {
            log.error("Schedule optimization failed for user {} in window {} - {}: {}",
                    userId, windowStart, windowEnd, e.getMessage(), e);
            throw e;
        }
    }

    @Transactional
    public StudySessionPlan createExamStudySessions(UUID userId, UUID examEventId,
                                                    Integer sessionCount, Integer durationMinutes) {
        try {
            User owner = lockOwner(userId);
            Event exam = eventRepository.findByIdAndUser(examEventId, owner)
                    .orElseThrow(() -> new EventNotFoundException(examEventId));

            int count = sessionCount != null ? sessionCount : properties.safeStudySessionCount();
            if (count < SchedulingProperties.MIN_STUDY_SESSIONS || count > SchedulingProperties.MAX_STUDY_SESSIONS) {
                throw new InvalidSchedulingRequestException("Number of study sessions must be between "
                        + SchedulingProperties.MIN_STUDY_SESSIONS + " and "
                        + SchedulingProperties.MAX_STUDY_SESSIONS + ": " + count);
            }
            int minutes = durationMinutes != null ? durationMinutes : properties.safeStudySessionDurationMinutes();

            List<Event> sessions = studySessionGenerator.generate(
                    exam, studyCategory(), count, minutes, properties.safeStudySessionHour());
            eventRepository.saveAll(sessions);

            OffsetDateTime earliest = sessions.stream().map(Event::getStartsAt).min(Comparator.naturalOrder()).orElseThrow();
            OffsetDateTime latest = sessions.stream().map(Event::getEndsAt).max(Comparator.naturalOrder()).orElseThrow();
            List<Event> affected = withAll(eventRepository.findOverlapping(owner, earliest, latest), sessions);
            ResolutionResult result = resolveWithinHorizon(owner, affected);
            eventRepository.saveAll(result.events());

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("action_type", "exam_study_sessions");
            details.put("exam_id", String.valueOf(exam.getId()));
            details.put("exam_title", exam.getTitle());
            details.put("num_sessions", sessions.size());
            details.put("study_session_ids", ids(sessions));
            details.put("rescheduled_event_ids", ids(result.rescheduled()));
            details.put("unresolved_event_ids", ids(result.unresolved()));
            SchedulingLog auditRecord = SchedulingLog.of(owner, SchedulingAction.CREATE, details, clock);
            auditRecord.setEvent(exam);
            schedulingLogRepository.save(auditRecord);

            publishChange(owner, withAll(new ArrayList<>(result.rescheduled()), sessions), List.of());
            log.info("Created {} study sessions for exam {} ('{}') of user {}",
                    sessions.size(), exam.getId(), exam.getTitle(), userId);
            return new StudySessionPlan(exam, sessions, result);
        } catch (RuntimeException e) {
            log.error("Failed to create study sessions for exam {} of user {}: {}",
                    examEventId, userId, e.getMessage(), e);
            throw e;
        }
    }

    @Transactional
    public List<Event> bulkUpdate(UUID userId, List<EventUpdate> updates) {
        if (updates == null || updates.isEmpty()) {
            return List.of();
        }
        try {
            User owner = lockOwner(userId);
            List<Event> updated = new ArrayList<>();
            for (EventUpdate update : updates) {
                Event event = eventRepository.findByIdAndUser(update.eventId(), owner)
                        .orElseThrow(() -> new EventNotFoundException(update.eventId()));
                apply(event, update);
                event.validateTimeRange();
                eventRepository.save(event);
                updated.add(event);
            }

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("operation", "bulk_update");
            details.put("num_events", updated.size());
            details.put("event_ids", ids(updated));
            schedulingLogRepository.save(SchedulingLog.of(owner, SchedulingAction.BULK_UPDATE, details, clock));

            publishChange(owner, updated, List.of());
            log.info("Bulk update completed for user {}: {} events updated", userId, updated.size());
            return updated;
        } catch (RuntimeException e) {
            log.error("Bulk update failed for user {} on events {}: {}",
                    userId, updates.stream().map(EventUpdate::eventId).toList(), e.getMessage(), e);
            throw e;
        }
    }

    @Transactional
    public List<UUID> bulkDelete(UUID userId, List<UUID> eventIds) {
        if (eventIds == null || eventIds.isEmpty()) {
            return List.of();
        }
        try {
            User owner = lockOwner(userId);
            Set<UUID> requested = new HashSet<>(eventIds);
            List<Event> events = eventRepository.findByUserAndIdIn(owner, requested);
            if (events.size() != requested.size()) {
                Set<UUID> found = new HashSet<>();
                events.forEach(e -> found.add(e.getId()));
                UUID missing = requested.stream().filter(id -> !found.contains(id)).findFirst().orElseThrow();
                throw new EventNotFoundException(missing);
            }

            List<Map<String, Object>> deleted = new ArrayList<>();
            List<String> externalIds = new ArrayList<>();
            for (Event event : events) {
                Map<String, Object> snapshot = new LinkedHashMap<>();
                snapshot.put("id", String.valueOf(event.getId()));
                snapshot.put("title", event.getTitle());
                snapshot.put("start_time", event.getStartsAt().toString());
                deleted.add(snapshot);
                if (event.getGoogleEventId() != null) {
                    externalIds.add(event.getGoogleEventId());
                }
            }
            eventRepository.deleteAll(events);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("operation", "bulk_delete");
            details.put("num_events", events.size());
            details.put("deleted_events", deleted);
            schedulingLogRepository.save(SchedulingLog.of(owner, SchedulingAction.BULK_DELETE, details, clock));

            publishChange(owner, List.of(), externalIds);
            log.info("Bulk delete completed for user {}: {} events deleted", userId, events.size());
            return events.stream().map(Event::getId).toList();
        } catch (RuntimeException e) {
            log.error("Bulk delete failed for user {} on events {}: {}", userId, eventIds, e.getMessage(), e);
            throw e;
        }
    }

    @Transactional
    public ResolutionResult scheduleEvents(UUID userId, List<EventDraft> drafts) {
        try {
            User owner = lockOwner(userId);
            return schedule(owner, drafts);
        } catch (RuntimeException e) {
            log.error("Scheduling {} events failed for user {}: {}",
                    drafts == null ? 0 : drafts.size(), userId, e.getMessage(), e);
            throw e;
        }
    }

    @Transactional
    public TextScheduleOutcome scheduleFromText(UUID userId, String text) {
        try {
            User owner = lockOwner(userId);
            if (categoryKeywordExtractor.isAmbiguous(text)) {
                return TextScheduleOutcome.clarification("Please describe what you want to schedule and when.");
            }

            ZoneId zoneId = temporalExpressionResolver.toZoneId(owner.getTimezone());
            List<TimeRange> ranges = temporalExpressionResolver.resolve(text, zoneId, clock.instant());
            if (ranges.isEmpty()) {
                return TextScheduleOutcome.clarification("When should this happen? No date or time was recognized.");
            }
            Optional<String> category = categoryKeywordExtractor.extractCategory(text);
            if (category.isEmpty()) {
                return TextScheduleOutcome.clarification(
                        "Which kind of activity is this: exam, study, gym, social or gaming?");
            }

            String title = categoryKeywordExtractor.extractTitle(text);
            List<EventDraft> drafts = ranges.stream()
                    .map(range -> EventDraft.of(title, category.get(), range))
                    .toList();
            ResolutionResult result = schedule(owner, drafts);
            return TextScheduleOutcome.scheduled(title, category.get(), ranges, result);
        } catch (RuntimeException e) {
            log.error("Scheduling from text failed for user {}: {}", userId, e.getMessage(), e);
            throw e;
        }
    }

    private ResolutionResult schedule(User owner, List<EventDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            throw new InvalidSchedulingRequestException("Nothing to schedule");
        }
        List<Event> created = new ArrayList<>(drafts.size());
        for (EventDraft draft : drafts) {
            created.add(toEvent(owner, draft));
        }

        OffsetDateTime earliest = created.stream().map(Event::getStartsAt).min(Comparator.naturalOrder()).orElseThrow();
        OffsetDateTime latest = created.stream().map(Event::getEndsAt).max(Comparator.naturalOrder()).orElseThrow();
        List<Event> affected = withAll(eventRepository.findOverlapping(owner, earliest, latest), created);
        ResolutionResult result = resolveWithinHorizon(owner, affected);
        eventRepository.saveAll(result.events());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action_type", "schedule_events");
        details.put("num_events", created.size());
        details.put("event_ids", ids(created));
        details.put("rescheduled_event_ids", ids(result.rescheduled()));
        details.put("unresolved_event_ids", ids(result.unresolved()));
        SchedulingLog auditRecord = SchedulingLog.of(owner, SchedulingAction.CREATE, details, clock);
        if (created.size() == 1) {
            auditRecord.setEvent(created.get(0));
        }
        schedulingLogRepository.save(auditRecord);

        publishChange(owner, withAll(new ArrayList<>(result.rescheduled()), created), List.of());
        log.info("Scheduled {} events for user {}: {} rescheduled, {} unresolved",
                created.size(), owner.getId(), result.rescheduled().size(), result.unresolved().size());
        return result;
    }

    // persisted events within the search horizon that are not being resolved still block relocation
    private ResolutionResult resolveWithinHorizon(User owner, List<Event> affected) {
        if (affected.isEmpty()) {
            return ResolutionResult.empty();
        }
        OffsetDateTime from = affected.stream().map(Event::getStartsAt).min(Comparator.naturalOrder()).orElseThrow();
        OffsetDateTime to = affected.stream().map(Event::getEndsAt).max(Comparator.naturalOrder()).orElseThrow()
                .plusDays(properties.safeSearchHorizonDays());

        Set<UUID> involved = new HashSet<>();
        affected.forEach(e -> {
            if (e.getId() != null) {
                involved.add(e.getId());
            }
        });
        List<Event> fixedBusy = new ArrayList<>();
        for (Event candidate : eventRepository.findOverlapping(owner, from, to)) {
            if (!involved.contains(candidate.getId()) && !containsSame(affected, candidate)) {
                fixedBusy.add(candidate);
            }
        }
        return conflictResolver.resolveConflicts(affected, fixedBusy);
    }

    private Event toEvent(User owner, EventDraft draft) {
        if (draft.title() == null || draft.title().isBlank()) {
            throw new InvalidSchedulingRequestException("Event title is required");
        }
        if (draft.startsAt() == null || draft.endsAt() == null || !draft.endsAt().isAfter(draft.startsAt())) {
            throw new InvalidEventTimeException(
                    "End time must be after start time: start=" + draft.startsAt() + ", end=" + draft.endsAt());
        }
        Event event = new Event();
        event.setUser(owner);
        event.setTitle(draft.title().trim());
        event.setDescription(draft.description());
        event.setCategory(requireCategory(draft.categoryName()));
        event.setStartsAt(draft.startsAt());
        event.setEndsAt(draft.endsAt());
        event.setFlexible(draft.flexible());
        return event;
    }

    private void apply(Event event, EventUpdate update) {
        if (update.title() != null && !update.title().isBlank()) {
            event.setTitle(update.title().trim());
        }
        if (update.description() != null) {
            event.setDescription(update.description());
        }
        if (update.categoryName() != null) {
            event.setCategory(requireCategory(update.categoryName()));
        }
        if (update.startsAt() != null) {
            event.setStartsAt(update.startsAt());
        }
        if (update.endsAt() != null) {
            event.setEndsAt(update.endsAt());
        }
        if (update.flexible() != null) {
            event.setFlexible(update.flexible());
        }
        if (update.completed() != null) {
            event.setCompleted(update.completed());
        }
    }

    private Category requireCategory(String name) {
        if (name == null || name.isBlank()) {
            throw new CategoryNotFoundException(String.valueOf(name));
        }
        return categoryRepository.findByName(name.trim())
                .or(() -> categoryRepository.findByNameIgnoreCase(name.trim()))
                .orElseThrow(() -> new CategoryNotFoundException(name));
    }

    private Category studyCategory() {
        DefaultCategory study = DefaultCategory.STUDY;
        return categoryRepository.findByName(study.displayName())
                .orElseGet(() -> categoryRepository.save(new Category(
                        study.displayName(), study.priorityLevel(), study.color(), study.description())));
    }

    private User lockOwner(UUID userId) {
        return userRepository.findForUpdateById(userId).orElseThrow(() -> new UserNotFoundException(userId));
    }

    private void requireWindow(OffsetDateTime windowStart, OffsetDateTime windowEnd) {
        if (windowStart == null || windowEnd == null || !windowEnd.isAfter(windowStart)) {
            throw new InvalidSchedulingRequestException(
                    "Window end must be after its start: start=" + windowStart + ", end=" + windowEnd);
        }
    }

    private void publishChange(User owner, List<Event> upserted, List<String> deletedExternalIds) {
        List<UUID> upsertedIds = upserted.stream().map(Event::getId).filter(Objects::nonNull).distinct().toList();
        ScheduleChangedEvent change = new ScheduleChangedEvent(owner.getId(), upsertedIds, deletedExternalIds);
        if (!change.isEmpty()) {
            eventPublisher.publishEvent(change);
        }
    }

    private static List<Event> withAll(List<Event> target, List<Event> additions) {
        List<Event> merged = new ArrayList<>(target);
        for (Event addition : additions) {
            if (!containsSame(merged, addition)) {
                merged.add(addition);
            }
        }
        return merged;
    }

    private static boolean containsSame(List<Event> events, Event candidate) {
        for (Event event : events) {
            if (event == candidate) {
                return true;
            }
        }
        return false;
    }

    private static List<String> ids(List<Event> events) {
        return events.stream().map(e -> String.valueOf(e.getId())).toList();
    }
}
