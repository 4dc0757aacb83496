package com.trustbridge.config;

import com.trustbridge.audit.AuditLogger;
import com.trustbridge.configuration.properties.ConfigLoaderProperties;
import com.trustbridge.models.config.ConfigEntry;
import com.trustbridge.models.enums.AuditAction;
import com.trustbridge.models.enums.AuditLevel;
import com.trustbridge.models.enums.ConfigSource;
import com.trustbridge.secrets.KeyPaths;
import com.trustbridge.secrets.SecretMarker;
import com.trustbridge.secrets.SecretsManager;
import com.trustbridge.spi.ConfigChangeListener;
import com.trustbridge.utils.CloseableReentrantLock;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Merges configuration from built-in defaults, env files, process environment and the remote backend into one
 * table. Lower priority numbers win: remote (1) over environment (2) over env files (3) over defaults (4).
 * <p>
 * When the remote backend cannot be reached the loader keeps serving the local sources in fallback mode and
 * leaves it again with the next successful refresh. Reads never block on I/O.
 */
@Slf4j
public class ConfigLoader {

    static final Map<String, Object> BUILT_IN_DEFAULTS = Map.of(
            "application.name", "trustbridge",
            "application.debug", false,
            "application.log_level", "INFO",
            "infrastructure.redis.url", "redis://localhost:6379",
            "infrastructure.redis.max_connections", 50,
            "infrastructure.vector_db.qdrant.url", "http://localhost:6333",
            "infrastructure.vector_db.weaviate.url", "http://localhost:8080");

    private static final Pattern SECRET_LEAF = Pattern.compile("(?i).*(key|secret|password|token).*");

    private final SecretsManager secretsManager;
    private final AuditLogger auditLogger;
    private final ConfigLoaderProperties properties;
    private final String environment;
    private final Supplier<Map<String, String>> environmentVariables;
    private final Clock clock;
    private final EnvKeyMapper keyMapper;
    private final EnvironmentDefinitionLoader definitionLoader = new EnvironmentDefinitionLoader();

    private final ConfigEntryTable table = new ConfigEntryTable();
    private final CloseableReentrantLock reloadLock = new CloseableReentrantLock();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService scheduler;

    private Map<String, ConfigEntry> remoteEntries = Map.of();
    private volatile boolean initialized;
    private volatile boolean fallbackMode;
    private volatile Instant lastRefresh;
    private volatile Instant lastBackendSync;
    private ConfigFileWatcher watcher;
    private ScheduledFuture<?> refreshTask;

    public ConfigLoader(SecretsManager secretsManager, AuditLogger auditLogger, ConfigLoaderProperties properties,
                        String environment, Supplier<Map<String, String>> environmentVariables, Clock clock) {
        this.secretsManager = secretsManager;
        this.auditLogger = auditLogger;
        this.properties = properties;
        this.environment = environment;
        this.environmentVariables = environmentVariables;
        this.clock = clock;
        this.keyMapper = new EnvKeyMapper(properties.getEnvironmentPrefixes());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(ConfigLoader::newRefreshThread);
    }

    private static Thread newRefreshThread(final Runnable runnable) {
        Thread thread = new Thread(runnable, "Config-Refresh-Scheduler");
        thread.setDaemon(true);
        return thread;
    }

    /**
     * Loads every source, then starts file watching and auto refresh when enabled. Never throws.
     *
     * @return false when the remote backend was unavailable and the loader runs in fallback mode
     */
    public boolean initialize() {
        boolean remoteLoaded = reload(true);
        initialized = true;
        if (remoteLoaded) {
            auditLogger.logConfigLoad("remote:" + environment, table.size(), true, null);
        } else {
            log.warn("Remote configuration for {} unavailable, serving local sources only", environment);
            auditLogger.logEvent(AuditLevel.ERROR, AuditAction.ERROR_OCCURRED, "config_loader",
                    "Fallback mode enabled: remote configuration unavailable", auditLogger.context(environment),
                    Map.of("entries", table.size()), false, "remote configuration for " + environment + " unavailable", null);
        }
        if (properties.isWatchFiles()) {
            startWatching();
        }
        if (properties.isAutoRefresh()) {
            startAutoRefresh();
        }
        return remoteLoaded;
    }

    public Object get(String key) {
        return get(key, null);
    }

    public Object get(String key, Object defaultValue) {
        return table.get(key).map(ConfigEntry::getValue).orElse(defaultValue);
    }

    public Optional<ConfigEntry> getEntry(String key) {
        return table.get(key);
    }

    /**
     * @param prefix dot path prefix, stripped from the returned keys; blank returns everything
     */
    public Map<String, Object> getAll(String prefix) {
        Map<String, Object> result = new LinkedHashMap<>();
        String normalized = prefix == null || prefix.isBlank() ? "" : (prefix.endsWith(".") ? prefix : prefix + ".");
        table.snapshot().values().stream()
                .filter(e -> e.getKey().startsWith(normalized))
                .sorted((a, b) -> a.getKey().compareTo(b.getKey()))
                .forEach(e -> result.put(e.getKey().substring(normalized.length()), e.getValue()));
        return result;
    }

    /**
     * Reads a secret through the secrets layer instead of the merged table, so the value is never older than the
     * secret cache TTL. Falls back to the local value when the backend does not have it.
     */
    public Object getSecret(String key, Object defaultValue) {
        Optional<String> value = secretsManager.getSecret(key, environment);
        if (value.isPresent()) {
            return value.get();
        }
        return get(key, defaultValue);
    }

    /**
     * Reloads every source when the last refresh is older than the refresh interval, or always when forced.
     *
     * @return false if the remote backend could not be reached
     */
    public boolean refreshConfig(boolean force) {
        Instant last = lastRefresh;
        if (!force && last != null && Duration.between(last, clock.instant()).compareTo(properties.getRefreshInterval()) < 0) {
            return true;
        }
        boolean wasFallback = fallbackMode;
        boolean remoteLoaded = reload(true);
        auditLogger.logEvent(remoteLoaded ? AuditLevel.INFO : AuditLevel.WARNING, AuditAction.CONFIG_REFRESH,
                "remote:" + environment, remoteLoaded ? "Configuration refreshed" : "Configuration refresh without remote backend",
                auditLogger.context(environment), Map.of("entries", table.size(), "forced", force), remoteLoaded, null, null);
        if (wasFallback && remoteLoaded) {
            log.info("Remote configuration for {} available again, fallback mode cleared", environment);
        }
        return remoteLoaded;
    }

    void onFileChanged(Path file) {
        reload(false);
        auditLogger.logConfigLoad("file:" + file, table.size(), true, null);
        notifyListeners("file:" + file, file.toString(), null);
    }

    // merges into a fresh table and swaps it in, then notifies listeners of the differences
    private boolean reload(boolean includeRemote) {
        Map<String, ConfigEntry> previous;
        Map<String, ConfigEntry> current;
        boolean remoteLoaded;
        try (var ignored = reloadLock.lockAsResource()) {
            Instant now = clock.instant();
            ConfigEntryTable fresh = new ConfigEntryTable();
            loadDefaults(fresh, now);
            loadFiles(fresh, now);
            loadEnvironment(fresh, now);
            if (includeRemote) {
                Optional<Map<String, ConfigEntry>> remote = loadRemote(now);
                remoteLoaded = remote.isPresent();
                if (remoteLoaded) {
                    remoteEntries = remote.get();
                    lastBackendSync = now;
                }
                fallbackMode = !remoteLoaded;
                lastRefresh = now;
            } else {
                remoteLoaded = !fallbackMode;
            }
            remoteEntries.values().forEach(fresh::put);
            previous = table.replaceWith(fresh);
            current = table.snapshot();
        }
        fireDifferences(previous, current);
        return remoteLoaded;
    }

    private void loadDefaults(ConfigEntryTable target, Instant now) {
        BUILT_IN_DEFAULTS.forEach((key, value) -> target.put(ConfigEntry.of(key, value, ConfigSource.DEFAULT, false, now)));
        properties.getDefaults().forEach((key, value) -> target.put(ConfigEntry.of(key, value, ConfigSource.DEFAULT, false, now)));
    }

    private void loadFiles(ConfigEntryTable target, Instant now) {
        for (String name : properties.getFiles()) {
            Path file = Path.of(name);
            if (!Files.isRegularFile(file)) {
                log.debug("configuration file {} does not exist, skipped", file);
                continue;
            }
            try {
                if (EnvironmentDefinitionLoader.isDefinitionFile(file)) {
                    definitionLoader.load(file).forEach((key, definition) -> target.put(
                            ConfigEntry.of(key, definition.value(), ConfigSource.ENV_FILE, definition.secret() || looksSecret(key), now)));
                } else {
                    EnvFileParser.parse(file).forEach((variable, value) -> {
                        String key = keyMapper.toConfigKey(variable);
                        target.put(ConfigEntry.of(key, value, ConfigSource.ENV_FILE, looksSecret(key), now));
                    });
                }
            } catch (IOException | RuntimeException e) {
                log.error("Failed to load configuration file {}: {}", file, e.getMessage(), e);
                auditLogger.logConfigLoad("file:" + file, 0, false, e.getMessage());
            }
        }
    }

    private void loadEnvironment(ConfigEntryTable target, Instant now) {
        environmentVariables.get().forEach((variable, value) -> {
            if (value == null || value.isEmpty()) {
                return;
            }
            keyMapper.mapIfImported(variable).ifPresent(key ->
                    target.put(ConfigEntry.of(key, value, ConfigSource.ENVIRONMENT, looksSecret(key), now)));
        });
    }

    private Optional<Map<String, ConfigEntry>> loadRemote(Instant now) {
        Optional<Map<String, Object>> tree;
        try {
            tree = secretsManager.fetchEnvironmentConfig(environment);
        } catch (RuntimeException e) {
            log.warn("Failed to fetch remote configuration for {}: {}", environment, e.getMessage(), e);
            tree = Optional.empty();
        }
        if (tree.isEmpty() || tree.get().isEmpty()) {
            return Optional.empty();
        }
        Map<String, ConfigEntry> entries = new LinkedHashMap<>();
        KeyPaths.flatten(tree.get()).forEach((key, value) -> {
            boolean marked = SecretMarker.isMarker(value);
            Object unwrapped = SecretMarker.unwrap(value);
            if (unwrapped != null) {
                entries.put(key, ConfigEntry.of(key, unwrapped, ConfigSource.REMOTE_BACKEND, marked || looksSecret(key), now));
            }
        });
        return Optional.of(entries);
    }

    static boolean looksSecret(String key) {
        int lastDot = key.lastIndexOf('.');
        return SECRET_LEAF.matcher(lastDot < 0 ? key : key.substring(lastDot + 1)).matches()
                || key.startsWith("llm_providers.direct_keys.");
    }

    private void fireDifferences(Map<String, ConfigEntry> previous, Map<String, ConfigEntry> current) {
        if (listeners.isEmpty()) {
            return;
        }
        Set<String> keys = new HashSet<>(previous.keySet());
        keys.addAll(current.keySet());
        for (String key : keys) {
            Object oldValue = Optional.ofNullable(previous.get(key)).map(ConfigEntry::getValue).orElse(null);
            Object newValue = Optional.ofNullable(current.get(key)).map(ConfigEntry::getValue).orElse(null);
            if (!Objects.equals(oldValue, newValue)) {
                notifyListeners(key, newValue, oldValue);
            }
        }
    }

    private void notifyListeners(String key, Object newValue, Object oldValue) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChange(key, newValue, oldValue);
            } catch (Exception e) {
                log.error("Configuration change listener failed for {}: {}", key, e.getMessage(), e);
            }
        }
    }

    public void addChangeListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeChangeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    public synchronized void startWatching() {
        if (watcher != null || properties.getFiles().isEmpty()) {
            return;
        }
        List<Path> files = properties.getFiles().stream().map(Path::of).toList();
        watcher = new ConfigFileWatcher(files, properties.getWatchInterval(), this::onFileChanged);
        watcher.start();
        log.info("watching configuration files {}", files);
    }

    public synchronized void startAutoRefresh() {
        if (refreshTask != null) {
            return;
        }
        long interval = properties.getRefreshInterval().toMillis();
        refreshTask = scheduler.scheduleWithFixedDelay(this::scheduledRefresh, interval, interval, TimeUnit.MILLISECONDS);
    }

    // runs on the scheduler, must not throw
    private void scheduledRefresh() {
        try {
            refreshConfig(false);
        } catch (Exception e) {
            log.error("Scheduled configuration refresh failed: {}", e.getMessage(), e);
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isFallbackMode() {
        return fallbackMode;
    }

    public String getEnvironment() {
        return environment;
    }

    public ConfigStatus getStatus() {
        List<String> watched;
        synchronized (this) {
            watched = watcher == null ? List.of() : watcher.getFiles().stream().map(Path::toString).toList();
        }
        return new ConfigStatus(initialized, fallbackMode, environment, table.size(), table.countBySource(),
                lastRefresh, lastBackendSync, new ArrayList<>(watched), listeners.size());
    }

    public synchronized void shutdown() {
        if (watcher != null) {
            watcher.stop();
            watcher = null;
        }
        if (refreshTask != null) {
            refreshTask.cancel(false);
            refreshTask = null;
        }
        scheduler.shutdown();
        initialized = false;
        log.info("configuration loader stopped");
    }
}
