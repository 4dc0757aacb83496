package com.trustbridge.config;

import com.trustbridge.models.config.ConfigEntry;
import com.trustbridge.models.enums.ConfigSource;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigEntryTableTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldKeepLowestPriorityRegardlessOfOrder() {
        List<ConfigEntry> entries = new ArrayList<>(List.of(
                ConfigEntry.of("infrastructure.redis.url", "default", ConfigSource.DEFAULT, false, NOW),
                ConfigEntry.of("infrastructure.redis.url", "file", ConfigSource.ENV_FILE, false, NOW),
                ConfigEntry.of("infrastructure.redis.url", "env", ConfigSource.ENVIRONMENT, false, NOW),
                ConfigEntry.of("infrastructure.redis.url", "remote", ConfigSource.REMOTE_BACKEND, false, NOW)));

        for (int round = 0; round < 10; round++) {
            // Given
            Collections.shuffle(entries);
            ConfigEntryTable table = new ConfigEntryTable();

            // When
            entries.forEach(table::put);

            // Then
            assertThat(table.get("infrastructure.redis.url")).map(ConfigEntry::getValue).contains("remote");
        }
    }

    @Test
    void shouldLetLaterEntryOfSamePriorityWin() {
        ConfigEntryTable table = new ConfigEntryTable();

        assertThat(table.put(ConfigEntry.of("k", "first", ConfigSource.ENV_FILE, false, NOW))).isTrue();
        assertThat(table.put(ConfigEntry.of("k", "second", ConfigSource.ENV_FILE, false, NOW))).isTrue();
        assertThat(table.put(ConfigEntry.of("k", "ignored", ConfigSource.DEFAULT, false, NOW))).isFalse();

        assertThat(table.get("k")).map(ConfigEntry::getValue).contains("second");
    }

    @Test
    void shouldSwapContentAndReturnPrevious() {
        // Given
        ConfigEntryTable table = new ConfigEntryTable();
        table.put(ConfigEntry.of("old", 1, ConfigSource.DEFAULT, false, NOW));
        ConfigEntryTable fresh = new ConfigEntryTable();
        fresh.put(ConfigEntry.of("new", 2, ConfigSource.ENVIRONMENT, false, NOW));
        fresh.put(ConfigEntry.of("other", 3, ConfigSource.ENVIRONMENT, false, NOW));

        // When
        Map<String, ConfigEntry> previous = table.replaceWith(fresh);

        // Then
        assertThat(previous).containsOnlyKeys("old");
        assertThat(table.snapshot()).containsOnlyKeys("new", "other");
        assertEquals(2, table.countBySource().get(ConfigSource.ENVIRONMENT));
        assertEquals(2, table.size());
    }
}
