package com.autopilot.connector;

import java.util.Locale;

/**
 * Категория инструмента. Ключ {@link #key()} используется в tenants.tools_connected.
 */
public enum ConnectorCategory {
    CRM,
    FINANCE,
    PROJECT,
    PAYMENTS,
    EMAIL;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
