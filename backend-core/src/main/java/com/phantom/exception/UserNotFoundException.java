package com.phantom.exception;

import java.util.UUID;

public class UserNotFoundException extends SchedulingException {

    public UserNotFoundException(UUID userId) {
        super("User not found: " + userId);
    }
}
