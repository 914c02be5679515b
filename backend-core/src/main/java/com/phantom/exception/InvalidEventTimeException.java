package com.phantom.exception;

public class InvalidEventTimeException extends SchedulingException {

    public InvalidEventTimeException(String message) {
        super(message);
    }
}
