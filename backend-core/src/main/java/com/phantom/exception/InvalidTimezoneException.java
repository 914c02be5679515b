package com.phantom.exception;

public class InvalidTimezoneException extends SchedulingException {

    private final String timezone;

    public InvalidTimezoneException(String timezone, Throwable cause) {
        super("Unknown timezone: " + timezone, cause);
        this.timezone = timezone;
    }

    public String getTimezone() {
        return timezone;
    }
}
