package com.trustbridge.config;

import com.trustbridge.models.enums.ConfigSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ConfigStatus(boolean initialized,
                           boolean fallbackMode,
                           String environment,
                           int totalEntries,
                           Map<ConfigSource, Integer> entriesBySource,
                           Instant lastRefresh,
                           Instant lastBackendSync,
                           List<String> watchedFiles,
                           int listeners) {
}
