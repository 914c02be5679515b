package com.phantom.service;

import java.time.OffsetDateTime;

public record EventDraft(
        String title,
        String description,
        String categoryName,
        OffsetDateTime startsAt,
        OffsetDateTime endsAt,
        boolean flexible
) {
    public static EventDraft of(String title, String categoryName, TimeRange range) {
        return new EventDraft(title, null, categoryName, range.start(), range.end(), true);
    }
}
