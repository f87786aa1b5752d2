package com.autopilot.action.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Известные типы действий. Тип хранится в БД строкой {@link #value()}.
 * Брифы (dispatchable = false) система никогда не выполняет сама.
 */
public enum ActionType {

    SEND_EMAIL("send_email", true),
    SEND_INVOICE_REMINDER("send_invoice_reminder", true),
    SEND_NURTURE_EMAIL("send_nurture_email", true),
    TAG_DEAL("tag_deal", true),
    ADD_DEAL_NOTE("add_deal_note", true),
    ESCALATION_BRIEF("escalation_brief", false),
    DEAL_PRIORITY_BRIEF("deal_priority_brief", false);

    private final String value;
    private final boolean dispatchable;

    ActionType(String value, boolean dispatchable) {
        this.value = value;
        this.dispatchable = dispatchable;
    }

    public String value() {
        return value;
    }

    public boolean isDispatchable() {
        return dispatchable;
    }

    public static Optional<ActionType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
