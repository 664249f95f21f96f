package com.autobulk.error;

public class UnsupportedScheduleException extends InvalidScheduleException {

    public UnsupportedScheduleException(String message) {
        super(message);
    }
}
