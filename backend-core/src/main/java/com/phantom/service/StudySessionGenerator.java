package com.phantom.service;

import com.phantom.domain.model.Category;
import com.phantom.domain.model.Event;
import com.phantom.exception.InvalidSchedulingRequestException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Component
public class StudySessionGenerator {

    public List<Event> generate(Event exam, Category studyCategory, int count, int durationMinutes, int hour) {
        if (count < 1) {
            throw new InvalidSchedulingRequestException("Number of study sessions must be positive: " + count);
        }
        if (durationMinutes <= 0) {
            throw new InvalidSchedulingRequestException("Study session duration must be positive: " + durationMinutes);
        }

        OffsetDateTime examStart = exam.getStartsAt();
        LocalDate examDate = examStart.toLocalDate();
        List<Event> sessions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            OffsetDateTime start = examDate.minusDays(count - i)
                    .atTime(hour, 0)
                    .atOffset(examStart.getOffset());
            OffsetDateTime end = start.plusMinutes(durationMinutes);
            if (end.isAfter(examStart)) {
                throw new InvalidSchedulingRequestException(
                        "Study session " + (i + 1) + " would end after the exam starts: " + end + " > " + examStart);
            }

            Event session = new Event();
            session.setUser(exam.getUser());
            session.setTitle("Study for " + exam.getTitle());
            session.setDescription("Preparation session " + (i + 1) + " for " + exam.getTitle());
            session.setCategory(studyCategory);
            session.setStartsAt(start);
            session.setEndsAt(end);
            session.setFlexible(true);
            sessions.add(session);
        }
        return sessions;
    }
}
