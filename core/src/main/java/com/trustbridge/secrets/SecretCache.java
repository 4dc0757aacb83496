package com.trustbridge.secrets;

import com.trustbridge.models.secrets.SecretCacheEntry;
import com.trustbridge.models.secrets.SecretMetadata;
import com.trustbridge.utils.CloseableReentrantLock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Encrypted secret cache with a single refresh timestamp.
 * <p>
 * The cache is valid while {@code now - lastRefresh < ttl}. Once expired every entry is dropped at once, so values
 * served together always come from the same refresh window. Entries added while the cache is valid do not extend it.
 */
public class SecretCache {

    private final CloseableReentrantLock lock = new CloseableReentrantLock();
    private final Map<String, SecretCacheEntry> entries = new HashMap<>();
    private final Duration ttl;
    private final Clock clock;
    private Instant lastRefresh;

    public SecretCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public static String cacheKey(String environment, String key) {
        return environment + ":" + key;
    }

    /**
     * Returns a valid entry and records the access on its metadata.
     */
    public Optional<SecretCacheEntry> access(String cacheKey) {
        try (var ignored = lock.lockAsResource()) {
            if (!validLocked()) {
                return Optional.empty();
            }
            SecretCacheEntry entry = entries.get(cacheKey);
            if (entry != null) {
                entry.getMetadata().recordAccess(clock.instant());
            }
            return Optional.ofNullable(entry);
        }
    }

    /**
     * Looks up many keys under one lock acquisition.
     *
     * @return the entries found, keyed by cache key
     */
    public Map<String, SecretCacheEntry> accessAll(Collection<String> cacheKeys) {
        Map<String, SecretCacheEntry> found = new LinkedHashMap<>();
        try (var ignored = lock.lockAsResource()) {
            if (!validLocked()) {
                return found;
            }
            Instant now = clock.instant();
            for (String cacheKey : cacheKeys) {
                SecretCacheEntry entry = entries.get(cacheKey);
                if (entry != null) {
                    entry.getMetadata().recordAccess(now);
                    found.put(cacheKey, entry);
                }
            }
        }
        return found;
    }

    public void put(String cacheKey, SecretCacheEntry entry) {
        putAll(Map.of(cacheKey, entry));
    }

    /**
     * Adds entries. An expired cache is cleared first and starts a new refresh window.
     */
    public void putAll(Map<String, SecretCacheEntry> newEntries) {
        try (var ignored = lock.lockAsResource()) {
            if (!validLocked()) {
                lastRefresh = clock.instant();
            }
            entries.putAll(newEntries);
        }
    }

    /**
     * @return a copy of the metadata of a valid entry
     */
    public Optional<SecretMetadata> metadata(String cacheKey) {
        try (var ignored = lock.lockAsResource()) {
            if (!validLocked()) {
                return Optional.empty();
            }
            return Optional.ofNullable(entries.get(cacheKey)).map(e -> e.getMetadata().toBuilder().build());
        }
    }

    public void invalidate() {
        try (var ignored = lock.lockAsResource()) {
            entries.clear();
            lastRefresh = null;
        }
    }

    public boolean isValid() {
        try (var ignored = lock.lockAsResource()) {
            return validLocked();
        }
    }

    public int size() {
        try (var ignored = lock.lockAsResource()) {
            validLocked();
            return entries.size();
        }
    }

    public Optional<Instant> getLastRefresh() {
        try (var ignored = lock.lockAsResource()) {
            return Optional.ofNullable(lastRefresh);
        }
    }

    // clears the whole map on expiry
    private boolean validLocked() {
        boolean valid = lastRefresh != null && Duration.between(lastRefresh, clock.instant()).compareTo(ttl) < 0;
        if (!valid && !entries.isEmpty()) {
            entries.clear();
        }
        return valid;
    }
}
