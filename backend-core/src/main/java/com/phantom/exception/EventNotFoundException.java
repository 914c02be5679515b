package com.phantom.exception;

import java.util.UUID;

public class EventNotFoundException extends SchedulingException {

    public EventNotFoundException(UUID eventId) {
        super("Event not found: " + eventId);
    }
}
