package com.trustbridge;

import com.trustbridge.audit.AuditLogger;
import com.trustbridge.config.ConfigLoader;
import com.trustbridge.config.ConfigStatus;
import com.trustbridge.configuration.properties.IntegrationProperties;
import com.trustbridge.configuration.properties.RotationProperties;
import com.trustbridge.models.enums.AuditAction;
import com.trustbridge.models.enums.AuditLevel;
import com.trustbridge.rotation.RotationOrchestrator;
import com.trustbridge.secrets.HealthStatus;
import com.trustbridge.secrets.SecretsManager;
import com.trustbridge.spi.ConfigChangeListener;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for the surrounding service: starts the components in order, watches the health of the remote
 * backend and exposes configuration reads and status summaries.
 */
@Slf4j
public class EscIntegration {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String FAILED = "failed";
    public static final String UNKNOWN = "unknown";

    private static final String RESOURCE = "trustbridge";

    private final ConfigLoader configLoader;
    private final SecretsManager secretsManager;
    private final RotationOrchestrator rotationOrchestrator;
    private final AuditLogger auditLogger;
    private final IntegrationProperties integrationProperties;
    private final RotationProperties rotationProperties;
    private final Clock clock;
    private final ScheduledExecutorService healthScheduler;

    private volatile boolean initialized;
    private volatile String integrationHealth = UNKNOWN;
    private volatile Instant lastRefresh;
    private volatile List<String> missingCriticalKeys = List.of();
    private ScheduledFuture<?> healthTask;

    public record IntegrationStatus(boolean initialized,
                                    boolean fallbackMode,
                                    String integrationHealth,
                                    String environment,
                                    Instant lastRefresh,
                                    List<String> missingCriticalKeys,
                                    boolean rotationSchedulerRunning,
                                    ConfigStatus configLoader) {
    }

    public record HealthSummary(boolean healthy,
                                String status,
                                boolean fallbackMode,
                                Instant lastRefresh,
                                int configEntries,
                                boolean initialized) {
    }

    public EscIntegration(ConfigLoader configLoader,
                          SecretsManager secretsManager,
                          RotationOrchestrator rotationOrchestrator,
                          AuditLogger auditLogger,
                          IntegrationProperties integrationProperties,
                          RotationProperties rotationProperties,
                          Clock clock) {
        this.configLoader = configLoader;
        this.secretsManager = secretsManager;
        this.rotationOrchestrator = rotationOrchestrator;
        this.auditLogger = auditLogger;
        this.integrationProperties = integrationProperties;
        this.rotationProperties = rotationProperties;
        this.clock = clock;
        this.healthScheduler = Executors.newSingleThreadScheduledExecutor(EscIntegration::newHealthThread);
    }

    private static Thread newHealthThread(final Runnable runnable) {
        Thread thread = new Thread(runnable, "Integration-Health-Monitor");
        thread.setDaemon(true);
        return thread;
    }

    /**
     * Never throws.
     *
     * @return false when running in fallback mode
     */
    public synchronized boolean initialize() {
        if (initialized) {
            return !configLoader.isFallbackMode();
        }
        String environment = configLoader.getEnvironment();
        try {
            auditLogger.logEvent(AuditLevel.INFO, AuditAction.SYSTEM_START, RESOURCE, "Integration starting", auditLogger.context(environment));
            HealthStatus backend = secretsManager.healthCheck();
            boolean remoteLoaded = configLoader.initialize();
            configLoader.addChangeListener(this::onConfigChange);
            initialized = true;
            lastRefresh = clock.instant();
            if (!remoteLoaded) {
                integrationHealth = FAILED;
            } else {
                integrationHealth = backend.isHealthy() ? HEALTHY : DEGRADED;
            }
            validateCriticalKeys();
            startHealthMonitor();
            if (rotationProperties.isSchedulerEnabled()) {
                rotationOrchestrator.startRotationScheduler(rotationProperties.getCheckIntervalSeconds());
            }
            auditLogger.logEvent(AuditLevel.INFO, AuditAction.SYSTEM_START, RESOURCE, "Integration initialized",
                    auditLogger.context(environment),
                    Map.of("configEntries", configLoader.getStatus().totalEntries(), "fallbackMode", !remoteLoaded), true, null, null);
            log.info("Integration initialized for {} with health {}", environment, integrationHealth);
            return remoteLoaded;
        } catch (RuntimeException e) {
            log.error("Integration initialization failed: {}", e.getMessage(), e);
            integrationHealth = FAILED;
            auditLogger.logEvent(AuditLevel.ERROR, AuditAction.ERROR_OCCURRED, RESOURCE, "Integration initialization failed",
                    auditLogger.context(environment), Map.of(), false, e.getMessage(), null);
            return false;
        }
    }

    private void validateCriticalKeys() {
        List<String> missing = integrationProperties.getCriticalKeys().stream()
                .filter(key -> isBlank(configLoader.get(key)))
                .toList();
        missingCriticalKeys = missing;
        if (!missing.isEmpty()) {
            log.warn("Missing critical configuration: {}", missing);
            if (HEALTHY.equals(integrationHealth)) {
                integrationHealth = DEGRADED;
            }
            auditLogger.logEvent(AuditLevel.WARNING, AuditAction.CONFIG_LOAD, "critical_config",
                    "Missing critical configuration keys", auditLogger.context(configLoader.getEnvironment()),
                    Map.of("missing", missing), true, null, null);
        }
    }

    private static boolean isBlank(Object value) {
        return value == null || String.valueOf(value).isBlank();
    }

    void onConfigChange(String key, Object newValue, Object oldValue) {
        String environment = configLoader.getEnvironment();
        if (integrationProperties.getCriticalKeys().contains(key)) {
            log.warn("Critical configuration changed: {}", key);
            auditLogger.logEvent(AuditLevel.SECURITY, AuditAction.CONFIG_CHANGE, key, "Critical configuration changed",
                    auditLogger.context(environment), Map.of("critical", true), true, null, null);
        } else {
            auditLogger.logEvent(AuditLevel.INFO, AuditAction.CONFIG_CHANGE, key, "Configuration changed",
                    auditLogger.context(environment),
                    Map.of("oldType", typeName(oldValue), "newType", typeName(newValue)), true, null, null);
        }
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private synchronized void startHealthMonitor() {
        if (healthTask != null) {
            return;
        }
        long interval = integrationProperties.getHealthInterval().toMillis();
        healthTask = healthScheduler.scheduleWithFixedDelay(this::checkIntegrationHealth, interval, interval, TimeUnit.MILLISECONDS);
    }

    /**
     * Runs on the health monitor thread, never throws.
     */
    public void checkIntegrationHealth() {
        try {
            HealthStatus health = secretsManager.healthCheck();
            if (health.isHealthy() && !configLoader.isFallbackMode()) {
                if (!HEALTHY.equals(integrationHealth)) {
                    log.info("Integration health restored");
                }
                integrationHealth = missingCriticalKeys.isEmpty() ? HEALTHY : DEGRADED;
            } else {
                if (!DEGRADED.equals(integrationHealth)) {
                    log.warn("Integration health degraded: backend reachable={}, fallback={}", health.backendReachable(), configLoader.isFallbackMode());
                }
                integrationHealth = DEGRADED;
            }
        } catch (Exception e) {
            integrationHealth = FAILED;
            log.error("Integration health check failed: {}", e.getMessage(), e);
        }
    }

    public Object get(String key, Object defaultValue) {
        return configLoader.get(key, defaultValue);
    }

    public Object getSecret(String key, Object defaultValue) {
        return configLoader.getSecret(key, defaultValue);
    }

    public Map<String, Object> getAll(String prefix) {
        return configLoader.getAll(prefix);
    }

    public boolean refreshConfig(boolean force) {
        boolean refreshed = configLoader.refreshConfig(force);
        if (refreshed) {
            lastRefresh = clock.instant();
        }
        return refreshed;
    }

    public void addChangeListener(ConfigChangeListener listener) {
        configLoader.addChangeListener(listener);
    }

    public void removeChangeListener(ConfigChangeListener listener) {
        configLoader.removeChangeListener(listener);
    }

    public String getIntegrationHealth() {
        return integrationHealth;
    }

    public IntegrationStatus getStatus() {
        return new IntegrationStatus(initialized, configLoader.isFallbackMode(), integrationHealth, configLoader.getEnvironment(),
                lastRefresh, missingCriticalKeys, rotationOrchestrator.isSchedulerRunning(), configLoader.getStatus());
    }

    public HealthSummary getHealthSummary() {
        return new HealthSummary(HEALTHY.equals(integrationHealth), integrationHealth, configLoader.isFallbackMode(),
                lastRefresh, configLoader.getStatus().totalEntries(), initialized);
    }

    public synchronized void shutdown() {
        log.info("Shutting down integration");
        try {
            if (healthTask != null) {
                healthTask.cancel(false);
                healthTask = null;
            }
            healthScheduler.shutdown();
            configLoader.shutdown();
            rotationOrchestrator.shutdown();
            auditLogger.logEvent(AuditLevel.INFO, AuditAction.SYSTEM_STOP, RESOURCE, "Integration stopped",
                    auditLogger.context(configLoader.getEnvironment()));
            auditLogger.stop();
        } catch (RuntimeException e) {
            log.error("Error during integration shutdown: {}", e.getMessage(), e);
        }
        initialized = false;
    }
}
