package com.autopilot.event.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Типы событий между агентами. В БД хранится {@link #value()}.
 */
public enum EventType {

    FORECAST_UPDATED("forecast_updated"),
    CASH_FORECAST_UPDATED("cash_forecast_updated"),
    CAC_UPDATED("cac_updated");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<EventType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
