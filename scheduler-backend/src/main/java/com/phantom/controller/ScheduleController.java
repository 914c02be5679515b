package com.phantom.controller;

import com.phantom.config.SchedulingProperties;
import com.phantom.domain.enums.ResolutionStatus;
import com.phantom.domain.model.Event;
import com.phantom.service.ConflictPair;
import com.phantom.service.EventUpdate;
import com.phantom.service.PrioritySchedulingService;
import com.phantom.service.ResolutionResult;
import com.phantom.service.StudySessionPlan;
import com.phantom.service.TemporalExpressionResolver;
import com.phantom.service.TextScheduleOutcome;
import com.phantom.service.TimeRange;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/schedule")
public class ScheduleController {

    private static final String USER_HEADER = "X-User-Id";

    private final PrioritySchedulingService schedulingService;
    private final TemporalExpressionResolver temporalExpressionResolver;
    private final SchedulingProperties properties;
    private final Clock clock;

    @PostMapping("/resolve")
    public ResponseEntity<?> resolve(@RequestBody ResolveRequest request) {
        if (request.text() == null || request.text().isBlank()) {
            return ResponseEntity.ok(new ResolveResponse(List.of(), true));
        }
        ZoneId zoneId = request.timezone() == null || request.timezone().isBlank()
                ? properties.safeDefaultZone()
                : temporalExpressionResolver.toZoneId(request.timezone());
        Instant reference = request.reference() != null ? request.reference().toInstant() : clock.instant();
        List<TimeRange> ranges = temporalExpressionResolver.resolve(request.text(), zoneId, reference);
        return ResponseEntity.ok(new ResolveResponse(ranges, ranges.isEmpty()));
    }

    @PostMapping("/conflicts")
    public ResponseEntity<?> conflicts(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestBody WindowRequest request
    ) {
        List<ConflictPair> conflicts = schedulingService.detectConflicts(userId, request.start(), request.end());
        return ResponseEntity.ok(conflicts.stream().map(ConflictDto::from).toList());
    }

    @GetMapping("/free-slots")
    public ResponseEntity<?> freeSlots(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(value = "minutes", defaultValue = "60") long minutes
    ) {
        return ResponseEntity.ok(schedulingService.findFreeSlots(userId, from, to, Duration.ofMinutes(minutes)));
    }

    @PostMapping("/optimize")
    public ResponseEntity<?> optimize(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestBody WindowRequest request
    ) {
        ResolutionResult result = schedulingService.optimize(userId, request.start(), request.end());
        return ResponseEntity.ok(ResolutionDto.from(result));
    }

    @PostMapping("/from-text")
    public ResponseEntity<?> fromText(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestBody TextRequest request
    ) {
        TextScheduleOutcome outcome = schedulingService.scheduleFromText(userId, request.text());
        if (outcome.needsClarification()) {
            return ResponseEntity.unprocessableEntity().body(new ClarificationDto(outcome.clarificationMessage()));
        }
        return ResponseEntity.ok(new TextScheduleDto(
                outcome.title(), outcome.categoryName(), ResolutionDto.from(outcome.resolution())));
    }

    @PostMapping("/exams/{id}/study-sessions")
    public ResponseEntity<?> studySessions(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable("id") UUID examId,
            @RequestBody(required = false) StudySessionRequest request
    ) {
        Integer count = request != null ? request.count() : null;
        Integer minutes = request != null ? request.durationMinutes() : null;
        StudySessionPlan plan = schedulingService.createExamStudySessions(userId, examId, count, minutes);
        ResolutionResult resolution = plan.resolution();
        return ResponseEntity.ok(new StudySessionPlanDto(
                EventDto.from(plan.exam(), resolution.statusOf(plan.exam())),
                plan.sessions().stream().map(s -> EventDto.from(s, resolution.statusOf(s))).toList(),
                ResolutionDto.from(resolution)));
    }

    @PatchMapping("/events")
    public ResponseEntity<?> bulkUpdate(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestBody List<EventUpdate> updates
    ) {
        List<Event> updated = schedulingService.bulkUpdate(userId, updates);
        return ResponseEntity.ok(updated.stream().map(e -> EventDto.from(e, ResolutionStatus.KEPT)).toList());
    }

    @DeleteMapping("/events")
    public ResponseEntity<?> bulkDelete(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestBody List<UUID> eventIds
    ) {
        List<UUID> deleted = schedulingService.bulkDelete(userId, eventIds);
        return ResponseEntity.ok(new DeletedDto(deleted));
    }

    public record ResolveRequest(String text, String timezone, OffsetDateTime reference) {
    }

    public record ResolveResponse(List<TimeRange> ranges, boolean insufficientTemporalInformation) {
    }

    public record WindowRequest(OffsetDateTime start, OffsetDateTime end) {
    }

    public record TextRequest(String text) {
    }

    public record StudySessionRequest(Integer count, Integer durationMinutes) {
    }

    public record ClarificationDto(String clarification) {
    }

    public record DeletedDto(List<UUID> deleted) {
    }

    public record TextScheduleDto(String title, String category, ResolutionDto resolution) {
    }

    public record StudySessionPlanDto(EventDto exam, List<EventDto> sessions, ResolutionDto resolution) {
    }

    public record EventDto(
            UUID id,
            String title,
            String category,
            OffsetDateTime startsAt,
            OffsetDateTime endsAt,
            boolean flexible,
            boolean completed,
            ResolutionStatus status
    ) {
        static EventDto from(Event event, ResolutionStatus status) {
            return new EventDto(
                    event.getId(),
                    event.getTitle(),
                    event.getCategory() != null ? event.getCategory().getName() : null,
                    event.getStartsAt(),
                    event.getEndsAt(),
                    event.isFlexible(),
                    event.isCompleted(),
                    status
            );
        }
    }

    public record ConflictDto(EventDto first, EventDto second) {
        static ConflictDto from(ConflictPair pair) {
            return new ConflictDto(
                    EventDto.from(pair.first(), ResolutionStatus.KEPT),
                    EventDto.from(pair.second(), ResolutionStatus.KEPT));
        }
    }

    public record ResolutionDto(List<EventDto> events, int rescheduled, int unresolved) {
        static ResolutionDto from(ResolutionResult result) {
            return new ResolutionDto(
                    result.events().stream().map(e -> EventDto.from(e, result.statusOf(e))).toList(),
                    result.rescheduled().size(),
                    result.unresolved().size());
        }
    }
}
