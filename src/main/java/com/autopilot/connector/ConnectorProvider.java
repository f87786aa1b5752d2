package com.autopilot.connector;

import java.util.Map;
import java.util.UUID;

/**
 * Фабрика коннекторов одного инструмента ("hubspot", "xero" и т.д.).
 */
public interface ConnectorProvider {

    String toolName();

    Connector create(UUID tenantId, Map<String, Object> credentials);
}
