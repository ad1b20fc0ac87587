package io.proofproxy.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the dispatcher picks among idle workers.
 */
public enum LoadBalancingStrategy {
    ROUND_ROBIN,
    LEAST_RECENTLY_USED,
    LEAST_LOADED;

    @JsonValue
    public String configValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static LoadBalancingStrategy fromConfigValue(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown load balancing strategy: " + value);
        }
    }
}
