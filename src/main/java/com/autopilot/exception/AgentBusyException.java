package com.autopilot.exception;

public class AgentBusyException extends RuntimeException {

    public AgentBusyException(String message) {
        super(message);
    }
}
