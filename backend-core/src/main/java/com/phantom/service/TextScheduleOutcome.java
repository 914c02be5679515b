package com.phantom.service;

import java.util.List;

public record TextScheduleOutcome(
        boolean needsClarification,
        String clarificationMessage,
        String title,
        String categoryName,
        List<TimeRange> ranges,
        ResolutionResult resolution
) {
    public static TextScheduleOutcome clarification(String message) {
        return new TextScheduleOutcome(true, message, null, null, List.of(), ResolutionResult.empty());
    }

    public static TextScheduleOutcome scheduled(String title, String categoryName, List<TimeRange> ranges,
                                                ResolutionResult resolution) {
        return new TextScheduleOutcome(false, null, title, categoryName, List.copyOf(ranges), resolution);
    }
}
