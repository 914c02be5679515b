package com.phantom.service;

import com.phantom.domain.model.Category;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class CategoryPriorityTable {

    private final Map<String, Integer> priorities;

    private CategoryPriorityTable(Map<String, Integer> priorities) {
        this.priorities = Collections.unmodifiableMap(priorities);
    }

    public static CategoryPriorityTable of(Map<String, Integer> priorities) {
        Map<String, Integer> normalized = new LinkedHashMap<>();
        priorities.forEach((name, level) -> {
            if (name != null && level != null) {
                normalized.put(name.trim().toLowerCase(Locale.ROOT), level);
            }
        });
        return new CategoryPriorityTable(normalized);
    }

    public Optional<Integer> priorityOf(String categoryName) {
        if (categoryName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(priorities.get(categoryName.trim().toLowerCase(Locale.ROOT)));
    }

    public int priorityOf(Category category) {
        if (category == null) {
            return 0;
        }
        return priorityOf(category.getName()).orElse(category.getPriorityLevel());
    }
}
