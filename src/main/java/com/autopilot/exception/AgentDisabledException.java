package com.autopilot.exception;

public class AgentDisabledException extends RuntimeException {

    public AgentDisabledException(String message) {
        super(message);
    }
}
