package com.nei10u.panchanga.exception;

public class InvalidTimezoneException extends PanchangaException {

    private final String timezone;

    public InvalidTimezoneException(String timezone) {
        super("Invalid timezone: " + timezone);
        this.timezone = timezone;
    }

    public InvalidTimezoneException(String timezone, Throwable cause) {
        super("Invalid timezone: " + timezone, cause);
        this.timezone = timezone;
    }

    public String getTimezone() {
        return timezone;
    }
}
