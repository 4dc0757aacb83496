package com.trustbridge.config;

import com.trustbridge.models.config.ConfigEntry;
import com.trustbridge.models.enums.ConfigSource;
import com.trustbridge.utils.CloseableReentrantLock;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Merged configuration keyed by dot path. An entry replaces the current one only when its priority is lower or
 * equal, so the result does not depend on the order in which sources are applied.
 */
public class ConfigEntryTable {

    private final CloseableReentrantLock lock = new CloseableReentrantLock();
    private final Map<String, ConfigEntry> entries = new HashMap<>();

    /**
     * @return true if the entry was stored
     */
    public boolean put(ConfigEntry entry) {
        try (var ignored = lock.lockAsResource()) {
            if (!entry.overrides(entries.get(entry.getKey()))) {
                return false;
            }
            entries.put(entry.getKey(), entry);
            return true;
        }
    }

    public Optional<ConfigEntry> get(String key) {
        try (var ignored = lock.lockAsResource()) {
            return Optional.ofNullable(entries.get(key));
        }
    }

    public Map<String, ConfigEntry> snapshot() {
        try (var ignored = lock.lockAsResource()) {
            return Map.copyOf(entries);
        }
    }

    /**
     * Swaps the whole content, used after a reload was merged into a fresh table.
     *
     * @return the previous content
     */
    public Map<String, ConfigEntry> replaceWith(ConfigEntryTable other) {
        Map<String, ConfigEntry> incoming = other.snapshot();
        try (var ignored = lock.lockAsResource()) {
            Map<String, ConfigEntry> previous = Map.copyOf(entries);
            entries.clear();
            entries.putAll(incoming);
            return previous;
        }
    }

    public Map<ConfigSource, Integer> countBySource() {
        Map<ConfigSource, Integer> counts = new EnumMap<>(ConfigSource.class);
        try (var ignored = lock.lockAsResource()) {
            entries.values().forEach(e -> counts.merge(e.getSource(), 1, Integer::sum));
        }
        return counts;
    }

    public int size() {
        try (var ignored = lock.lockAsResource()) {
            return entries.size();
        }
    }
}
