package com.autopilot.exception;

public class UnknownActionTypeException extends RuntimeException {

    public UnknownActionTypeException(String message) {
        super(message);
    }
}
