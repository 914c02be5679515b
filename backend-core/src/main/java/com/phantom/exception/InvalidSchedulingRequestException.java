package com.phantom.exception;

public class InvalidSchedulingRequestException extends SchedulingException {

    public InvalidSchedulingRequestException(String message) {
        super(message);
    }
}
