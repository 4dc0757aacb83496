package com.trustbridge.models.config;

import com.trustbridge.models.enums.ConfigSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * One merged configuration value together with the source it came from.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConfigEntry {

    /**
     * Dot-delimited path, e.g. {@code infrastructure.redis.url}.
     */
    private String key;

    private Object value;

    private ConfigSource source;

    /**
     * Merge priority, lower wins. Defaults to the priority of the source.
     */
    private int priority;

    private Instant lastUpdated;

    private boolean secret;

    @Builder.Default
    private Set<String> tags = new HashSet<>();

    public static ConfigEntry of(String key, Object value, ConfigSource source, boolean secret, Instant now) {
        return ConfigEntry.builder()
                .key(key)
                .value(value)
                .source(source)
                .priority(source.getPriority())
                .lastUpdated(now)
                .secret(secret)
                .build();
    }

    /**
     * An entry replaces an existing one only when its priority is numerically lower or equal.
     */
    public boolean overrides(ConfigEntry existing) {
        return existing == null || priority <= existing.getPriority();
    }
}
