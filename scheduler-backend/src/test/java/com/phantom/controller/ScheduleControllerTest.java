package com.phantom.controller;

import com.phantom.config.SchedulingProperties;
import com.phantom.domain.model.Category;
import com.phantom.domain.model.Event;
import com.phantom.exception.EventNotFoundException;
import com.phantom.service.PrioritySchedulingService;
import com.phantom.service.ResolutionResult;
import com.phantom.service.TemporalExpressionResolver;
import com.phantom.service.TextScheduleOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScheduleController Tests")
class ScheduleControllerTest {

    private static final Instant MONDAY_9AM = Instant.parse("2024-01-15T09:00:00Z");

    @Mock
    private PrioritySchedulingService schedulingService;

    private MockMvc mockMvc;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        ScheduleController controller = new ScheduleController(
                schedulingService,
                new TemporalExpressionResolver(),
                SchedulingProperties.defaults(),
                Clock.fixed(MONDAY_9AM, ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json().build()))
                .build();
    }

    private static Event event(String title, int startHour, int endHour) {
        Category category = new Category("Study", 4, "#FFA500", null);
        Event event = new Event();
        event.setId(UUID.randomUUID());
        event.setTitle(title);
        event.setCategory(category);
        event.setStartsAt(OffsetDateTime.of(2024, 1, 16, startHour, 0, 0, 0, ZoneOffset.UTC));
        event.setEndsAt(OffsetDateTime.of(2024, 1, 16, endHour, 0, 0, 0, ZoneOffset.UTC));
        return event;
    }

    @Nested
    @DisplayName("POST /api/schedule/resolve")
    class Resolve {

        @Test
        @DisplayName("Resolves a phrase against the clock when no reference is given")
        void resolvesAgainstClock() throws Exception {
            mockMvc.perform(post("/api/schedule/resolve")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"text\":\"next Friday at 2pm for 2 hours\",\"timezone\":\"UTC\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ranges[0].start", startsWith("2024-01-19T14:00")))
                    .andExpect(jsonPath("$.ranges[0].end", startsWith("2024-01-19T16:00")))
                    .andExpect(jsonPath("$.insufficientTemporalInformation").value(false));
        }

        @Test
        @DisplayName("Flags phrases without temporal information")
        void insufficientInformation() throws Exception {
            mockMvc.perform(post("/api/schedule/resolve")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"text\":\"sometime soon\",\"reference\":\"2024-01-15T09:00:00Z\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ranges").isEmpty())
                    .andExpect(jsonPath("$.insufficientTemporalInformation").value(true));
        }

        @Test
        @DisplayName("Blank text resolves to an empty result")
        void blankText() throws Exception {
            mockMvc.perform(post("/api/schedule/resolve")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"text\":\"   \"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ranges").isEmpty())
                    .andExpect(jsonPath("$.insufficientTemporalInformation").value(true));
        }

        @Test
        @DisplayName("Out-of-range day offsets resolve to an empty result, not a server error")
        void outOfRangeOffset() throws Exception {
            mockMvc.perform(post("/api/schedule/resolve")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"text\":\"study in 99999999999999999999 days\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ranges").isEmpty())
                    .andExpect(jsonPath("$.insufficientTemporalInformation").value(true));
        }

        @Test
        @DisplayName("Unknown timezone is a validation failure")
        void unknownTimezone() throws Exception {
            mockMvc.perform(post("/api/schedule/resolve")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"text\":\"tomorrow\",\"timezone\":\"Mars/Olympus\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
        }
    }

    @Nested
    @DisplayName("Owner-scoped endpoints")
    class OwnerScoped {

        @Test
        @DisplayName("Missing user header is rejected before reaching the service")
        void missingHeader() throws Exception {
            mockMvc.perform(post("/api/schedule/optimize")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"start\":\"2024-01-16T00:00:00Z\",\"end\":\"2024-01-17T00:00:00Z\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
            verifyNoInteractions(schedulingService);
        }

        @Test
        @DisplayName("Optimize delegates to the service and reports statuses")
        void optimize() throws Exception {
            Event moved = event("Raid night", 20, 22);
            Event kept = event("Calculus review", 18, 20);
            when(schedulingService.optimize(eq(userId), any(), any()))
                    .thenReturn(new ResolutionResult(List.of(kept, moved), List.of(moved), List.of()));

            mockMvc.perform(post("/api/schedule/optimize")
                            .header("X-User-Id", userId.toString())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"start\":\"2024-01-16T00:00:00Z\",\"end\":\"2024-01-17T00:00:00Z\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.rescheduled").value(1))
                    .andExpect(jsonPath("$.unresolved").value(0))
                    .andExpect(jsonPath("$.events[0].status").value("KEPT"))
                    .andExpect(jsonPath("$.events[1].status").value("RESCHEDULED"))
                    .andExpect(jsonPath("$.events[1].category").value("Study"));

            verify(schedulingService).optimize(eq(userId), any(OffsetDateTime.class), any(OffsetDateTime.class));
        }

        @Test
        @DisplayName("Unknown exam maps to 404")
        void examNotFound() throws Exception {
            UUID examId = UUID.randomUUID();
            when(schedulingService.createExamStudySessions(userId, examId, 2, null))
                    .thenThrow(new EventNotFoundException(examId));

            mockMvc.perform(post("/api/schedule/exams/{id}/study-sessions", examId)
                            .header("X-User-Id", userId.toString())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"count\":2}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("Ambiguous text asks for clarification with 422")
        void clarification() throws Exception {
            when(schedulingService.scheduleFromText(userId, "hang out tomorrow"))
                    .thenReturn(TextScheduleOutcome.clarification(
                            "Which kind of activity is this: exam, study, gym, social or gaming?"));

            mockMvc.perform(post("/api/schedule/from-text")
                            .header("X-User-Id", userId.toString())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"text\":\"hang out tomorrow\"}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.clarification", startsWith("Which kind of activity")));
        }
    }
}
