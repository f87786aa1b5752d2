package com.autopilot.action.model;

public enum ActionStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED,
    CANCELLED,
    /**
     * Решение по отложенному действию не принято: запись уже не ждет решения
     * или ее уровень не допускает такого решения. Запись не меняется, операция не вызывается.
     * Только в ответе исполнителя, в БД не хранится.
     */
    REFUSED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED;
    }
}
