package com.phantom.service;

import java.util.List;
import java.util.UUID;

public record ScheduleChangedEvent(UUID userId, List<UUID> upsertedEventIds, List<String> deletedExternalIds) {

    public ScheduleChangedEvent {
        upsertedEventIds = List.copyOf(upsertedEventIds);
        deletedExternalIds = List.copyOf(deletedExternalIds);
    }

    public boolean isEmpty() {
        return upsertedEventIds.isEmpty() && deletedExternalIds.isEmpty();
    }
}
