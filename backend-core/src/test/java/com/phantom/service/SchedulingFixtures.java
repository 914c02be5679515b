package com.phantom.service;

import com.phantom.config.SchedulingProperties;
import com.phantom.domain.enums.DefaultCategory;
import com.phantom.domain.model.Category;
import com.phantom.domain.model.Event;
import com.phantom.domain.model.User;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

final class SchedulingFixtures {

    /** Monday 2024-01-15 09:00 UTC. */
    static final OffsetDateTime MONDAY_9AM = OffsetDateTime.of(2024, 1, 15, 9, 0, 0, 0, ZoneOffset.UTC);

    private SchedulingFixtures() {
    }

    static Category category(DefaultCategory defaults) {
        Category category = new Category(
                defaults.displayName(), defaults.priorityLevel(), defaults.color(), defaults.description());
        category.setId(UUID.randomUUID());
        return category;
    }

    static User user() {
        User user = new User();
        user.setId(UUID.randomUUID());
        user.setUsername("alice");
        user.setTimezone("UTC");
        return user;
    }

    static Event event(String title, DefaultCategory category, OffsetDateTime start, OffsetDateTime end) {
        Event event = new Event();
        event.setTitle(title);
        event.setCategory(category(category));
        event.setStartsAt(start);
        event.setEndsAt(end);
        return event;
    }

    static OffsetDateTime at(int dayOfMonth, int hour) {
        return OffsetDateTime.of(2024, 1, dayOfMonth, hour, 0, 0, 0, ZoneOffset.UTC);
    }

    static ConflictResolver defaultResolver() {
        SchedulingProperties properties = SchedulingProperties.defaults();
        return new ConflictResolver(
                CategoryPriorityTable.of(properties.safeCategoryPriorities()), new FreeSlotFinder(), properties);
    }
}
