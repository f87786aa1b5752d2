package com.autopilot.action.service;

public class ActionOperationException extends RuntimeException {

    public ActionOperationException(String message) {
        super(message);
    }
}
