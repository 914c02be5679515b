package com.phantom.service;

import com.phantom.domain.model.Event;
import com.phantom.domain.model.User;

import java.util.List;

public interface CalendarSyncGateway {

    boolean isEnabled();

    void pushEvents(User user, List<Event> events);

    void removeEvents(User user, List<String> externalEventIds);
}
