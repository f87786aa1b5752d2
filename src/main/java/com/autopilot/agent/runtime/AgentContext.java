package com.autopilot.agent.runtime;

import com.autopilot.util.Payloads;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Тенант и его настройки агента на момент запуска.
 */
public record AgentContext(UUID tenantId, Map<String, Object> config) {

    public AgentContext {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public String getString(String key, String defaultValue) {
        return Payloads.getString(config, key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        return Payloads.getInt(config, key, defaultValue);
    }

    public double getDouble(String key, double defaultValue) {
        return Payloads.getDouble(config, key, defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return Payloads.getBoolean(config, key, defaultValue);
    }

    public List<String> getStringList(String key) {
        return Payloads.getStringList(config, key);
    }
}
