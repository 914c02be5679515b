package com.phantom.service;

import com.phantom.domain.model.Event;
import com.phantom.domain.model.User;
import com.phantom.repository.EventRepository;
import com.phantom.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class CalendarSyncListener {

    private final CalendarSyncGateway calendarSyncGateway;
    private final UserRepository userRepository;
    private final EventRepository eventRepository;

    @Async("calendarSyncExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onScheduleChanged(ScheduleChangedEvent change) {
        if (!calendarSyncGateway.isEnabled()) {
            log.debug("Calendar sync disabled, skipping change for user {}", change.userId());
            return;
        }
        User user = userRepository.findById(change.userId()).orElse(null);
        if (user == null) {
            log.warn("Calendar sync skipped: user {} no longer exists", change.userId());
            return;
        }
        try {
            if (!change.upsertedEventIds().isEmpty()) {
                List<Event> events = eventRepository.findAllById(change.upsertedEventIds());
                calendarSyncGateway.pushEvents(user, events);
            }
            if (!change.deletedExternalIds().isEmpty()) {
                calendarSyncGateway.removeEvents(user, change.deletedExternalIds());
            }
        } catch (Exception e) {
            log.warn("Calendar sync failed for user {}: {}", change.userId(), e.getMessage());
        }
    }
}
