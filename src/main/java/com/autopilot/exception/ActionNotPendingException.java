package com.autopilot.exception;

/**
 * Решение по действию уже принято или действие нельзя выполнить этим способом.
 */
public class ActionNotPendingException extends RuntimeException {

    public ActionNotPendingException(String message) {
        super(message);
    }
}
