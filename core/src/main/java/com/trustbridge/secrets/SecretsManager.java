package com.trustbridge.secrets;

import com.trustbridge.audit.AuditLogger;
import com.trustbridge.crypto.SecretCipher;
import com.trustbridge.exception.CryptoException;
import com.trustbridge.models.enums.AuditAction;
import com.trustbridge.models.enums.AuditLevel;
import com.trustbridge.models.enums.SecretStatus;
import com.trustbridge.models.secrets.SecretCacheEntry;
import com.trustbridge.models.secrets.SecretMetadata;
import com.trustbridge.utils.CloseableReentrantLock;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Reads and writes secrets in the remote environment store, keeping an encrypted TTL cache in front of it.
 * <p>
 * Every access and mutation is audited with the secret key as resource. Secret values never reach the audit trail
 * or the application log.
 */
@Slf4j
public class SecretsManager {

    private final EscClient escClient;
    private final SecretCipher cipher;
    private final SecretCache cache;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final Map<String, CloseableReentrantLock> environmentLocks = new ConcurrentHashMap<>();
    private final Set<String> rotating = ConcurrentHashMap.newKeySet();
    private final Map<String, Instant> lastRotations = new ConcurrentHashMap<>();

    public SecretsManager(EscClient escClient, SecretCipher cipher, SecretCache cache, AuditLogger auditLogger, Clock clock) {
        this.escClient = escClient;
        this.cipher = cipher;
        this.cache = cache;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    /**
     * @return the full value tree of the environment, empty when the backend is unavailable
     */
    public Map<String, Object> getEnvironmentConfig(String environment) {
        return fetchEnvironmentConfig(environment).orElseGet(LinkedHashMap::new);
    }

    /**
     * Like {@link #getEnvironmentConfig(String)} but tells an unavailable backend apart from an empty environment.
     */
    public Optional<Map<String, Object>> fetchEnvironmentConfig(String environment) {
        return escClient.getEnvironment(environment);
    }

    public Optional<String> getSecret(String key, String environment) {
        return getSecret(key, environment, true);
    }

    public Optional<String> getSecret(String key, String environment, boolean useCache) {
        long started = System.nanoTime();
        String cacheKey = SecretCache.cacheKey(environment, key);
        if (useCache) {
            Optional<SecretCacheEntry> cached = cache.access(cacheKey);
            if (cached.isPresent()) {
                Optional<String> value = decrypt(key, cached.get());
                if (value.isPresent()) {
                    auditLogger.logEvent(AuditLevel.DEBUG, AuditAction.CACHE_HIT, key, "Secret served from cache",
                            auditLogger.context(environment));
                    auditLogger.logSecretAccess(key, environment, true, elapsedMillis(started));
                    return value;
                }
            }
            auditLogger.logEvent(AuditLevel.DEBUG, AuditAction.CACHE_MISS, key, "Secret not cached",
                    auditLogger.context(environment));
        }
        Optional<String> value = escClient.getEnvironment(environment)
                .flatMap(tree -> KeyPaths.get(tree, key))
                .map(SecretMarker::unwrap)
                .map(String::valueOf);
        if (value.isPresent() && useCache) {
            cache.put(cacheKey, newEntry(key, value.get(), clock.instant()));
        }
        auditLogger.logSecretAccess(key, environment, value.isPresent(), elapsedMillis(started));
        return value;
    }

    /**
     * Serves cached keys under one cache lock acquisition and fetches all misses with a single request.
     *
     * @return the secrets found; missing keys are absent from the map
     */
    public Map<String, String> bulkGetSecrets(Collection<String> keys, String environment) {
        long started = System.nanoTime();
        Map<String, String> result = new LinkedHashMap<>();
        Map<String, String> cacheKeys = new LinkedHashMap<>();
        keys.forEach(key -> cacheKeys.put(SecretCache.cacheKey(environment, key), key));
        Map<String, SecretCacheEntry> hits = cache.accessAll(cacheKeys.keySet());
        hits.forEach((cacheKey, entry) -> {
            String key = cacheKeys.get(cacheKey);
            decrypt(key, entry).ifPresent(value -> result.put(key, value));
        });
        var missing = keys.stream().filter(key -> !result.containsKey(key)).toList();
        if (!missing.isEmpty()) {
            Optional<Map<String, Object>> tree = escClient.getEnvironment(environment);
            Map<String, SecretCacheEntry> fetched = new LinkedHashMap<>();
            Instant now = clock.instant();
            tree.ifPresent(values -> missing.forEach(key -> KeyPaths.get(values, key)
                    .map(SecretMarker::unwrap)
                    .map(String::valueOf)
                    .ifPresent(value -> {
                        result.put(key, value);
                        fetched.put(SecretCache.cacheKey(environment, key), newEntry(key, value, now));
                    })));
            if (!fetched.isEmpty()) {
                cache.putAll(fetched);
            }
        }
        long duration = elapsedMillis(started);
        keys.forEach(key -> auditLogger.logSecretAccess(key, environment, result.containsKey(key), duration));
        return result;
    }

    public boolean setSecret(String key, String value, String environment) {
        return setSecret(key, value, environment, true);
    }

    /**
     * Writes a secret by fetching the whole environment tree, setting the key and writing the tree back.
     * Writers of this process are serialized per environment; writers in other processes still race and the last
     * write wins.
     *
     * @param encrypt mark the value as a secret in the environment definition
     */
    public boolean setSecret(String key, String value, String environment, boolean encrypt) {
        long started = System.nanoTime();
        CloseableReentrantLock environmentLock = environmentLocks.computeIfAbsent(environment, e -> new CloseableReentrantLock());
        try (var ignored = environmentLock.lockAsResource()) {
            Optional<Map<String, Object>> tree = escClient.getEnvironment(environment);
            if (tree.isEmpty()) {
                audit(AuditAction.SECRET_UPDATE, key, environment, false, "environment could not be fetched", started);
                return false;
            }
            Map<String, Object> values = tree.get();
            boolean existed = KeyPaths.get(values, key).isPresent();
            KeyPaths.set(values, key, encrypt ? SecretMarker.wrap(value) : value);
            boolean written = escClient.putEnvironment(environment, values);
            AuditAction action = existed ? AuditAction.SECRET_UPDATE : AuditAction.SECRET_CREATE;
            if (written) {
                log.debug("Replaced environment {} tree to write {}", environment, key);
                cache.put(SecretCache.cacheKey(environment, key), newEntry(key, value, clock.instant()));
                audit(action, key, environment, true, null, started);
            } else {
                audit(action, key, environment, false, "environment could not be written", started);
            }
            return written;
        }
    }

    /**
     * Writes a freshly generated placeholder to {@code <key>_new}. The live key is untouched and reports
     * {@link SecretStatus#ROTATING} until a rotation of it completes.
     */
    public boolean rotateSecret(String key, String environment) {
        String placeholder = "rotated_" + clock.instant().getEpochSecond() + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        boolean written = setSecret(key + "_new", placeholder, environment, true);
        if (written) {
            markRotating(key, environment);
        }
        auditLogger.logEvent(written ? AuditLevel.SECURITY : AuditLevel.ERROR, AuditAction.SECRET_ROTATE, key,
                written ? "Rotation value staged" : "Rotation value could not be staged", auditLogger.context(environment),
                Map.of("target", key + "_new"), written, written ? null : "write failed", null);
        return written;
    }

    public void invalidateCache() {
        cache.invalidate();
        log.info("secret cache invalidated");
    }

    /**
     * Drops the cache and reloads every value of the environment into a new refresh window.
     */
    public boolean refresh(String environment) {
        cache.invalidate();
        Optional<Map<String, Object>> tree = escClient.getEnvironment(environment);
        if (tree.isEmpty()) {
            auditLogger.logEvent(AuditLevel.WARNING, AuditAction.CONFIG_REFRESH, environment, "Secret refresh failed",
                    auditLogger.context(environment), Map.of(), false, "environment could not be fetched", null);
            return false;
        }
        Instant now = clock.instant();
        Map<String, SecretCacheEntry> entries = new LinkedHashMap<>();
        KeyPaths.flatten(tree.get()).forEach((key, value) -> {
            Object unwrapped = SecretMarker.unwrap(value);
            if (unwrapped != null) {
                entries.put(SecretCache.cacheKey(environment, key), newEntry(key, String.valueOf(unwrapped), now));
            }
        });
        cache.putAll(entries);
        auditLogger.logEvent(AuditLevel.INFO, AuditAction.CONFIG_REFRESH, environment, "Secret cache refreshed",
                auditLogger.context(environment), Map.of("entries", entries.size()), true, null, null);
        return true;
    }

    /**
     * Flags the secret as {@link SecretStatus#ROTATING} until {@link #completeRotation} is called for it.
     */
    public void markRotating(String key, String environment) {
        rotating.add(SecretCache.cacheKey(environment, key));
    }

    /**
     * Clears the rotating flag. A successful rotation stamps {@code lastRotated}; a failed one keeps the previous stamp.
     */
    public void completeRotation(String key, String environment, boolean rotated) {
        String cacheKey = SecretCache.cacheKey(environment, key);
        if (rotated) {
            lastRotations.put(cacheKey, clock.instant());
        }
        rotating.remove(cacheKey);
    }

    /**
     * @return the cached metadata with the rotation state of the secret; empty when the secret is neither cached nor
     * was ever rotated
     */
    public Optional<SecretMetadata> getSecretMetadata(String key, String environment) {
        String cacheKey = SecretCache.cacheKey(environment, key);
        Instant rotatedAt = lastRotations.get(cacheKey);
        boolean inFlight = rotating.contains(cacheKey);
        Optional<SecretMetadata> cached = cache.metadata(cacheKey);
        if (cached.isEmpty() && rotatedAt == null && !inFlight) {
            return Optional.empty();
        }
        SecretMetadata metadata = cached.orElseGet(() -> SecretMetadata.builder().key(key).build());
        if (rotatedAt != null) {
            metadata.setLastRotated(rotatedAt);
        }
        if (inFlight) {
            metadata.setStatus(SecretStatus.ROTATING);
        }
        return Optional.of(metadata);
    }

    public HealthStatus healthCheck() {
        boolean reachable = escClient.ping();
        return new HealthStatus(reachable ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY, reachable, cache.size(),
                cache.isValid(), auditLogger.getLastEventTime().orElse(null), clock.instant());
    }

    private Optional<String> decrypt(String key, SecretCacheEntry entry) {
        try {
            return Optional.of(cipher.decrypt(entry.getEncryptedValue()));
        } catch (CryptoException e) {
            log.error("Cached value of {} could not be decrypted: {}", key, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private SecretCacheEntry newEntry(String key, String value, Instant now) {
        SecretMetadata metadata = SecretMetadata.builder()
                .key(key)
                .createdAt(now)
                .lastAccessed(now)
                .build();
        return new SecretCacheEntry(cipher.encrypt(value), metadata, now);
    }

    private void audit(AuditAction action, String key, String environment, boolean success, String error, long started) {
        auditLogger.logEvent(success ? AuditLevel.INFO : AuditLevel.ERROR, action, key,
                success ? "Secret written" : "Secret write failed", auditLogger.context(environment),
                Map.of("environment", environment), success, error, elapsedMillis(started));
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
