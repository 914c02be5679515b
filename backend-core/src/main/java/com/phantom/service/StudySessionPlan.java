package com.phantom.service;

import com.phantom.domain.model.Event;

import java.util.List;

public record StudySessionPlan(Event exam, List<Event> sessions, ResolutionResult resolution) {
}
