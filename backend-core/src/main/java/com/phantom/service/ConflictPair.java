package com.phantom.service;

import com.phantom.domain.model.Event;

public record ConflictPair(Event first, Event second) {
}
