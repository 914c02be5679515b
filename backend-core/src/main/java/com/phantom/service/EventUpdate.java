package com.phantom.service;

import java.time.OffsetDateTime;
import java.util.UUID;

// null fields are left unchanged
public record EventUpdate(
        UUID eventId,
        String title,
        String description,
        String categoryName,
        OffsetDateTime startsAt,
        OffsetDateTime endsAt,
        Boolean flexible,
        Boolean completed
) {
}
