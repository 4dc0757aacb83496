package com.trustbridge.audit;

import com.trustbridge.configuration.properties.AuditProperties;
import com.trustbridge.models.audit.AuditContext;
import com.trustbridge.models.audit.AuditEvent;
import com.trustbridge.models.enums.AuditAction;
import com.trustbridge.models.enums.AuditLevel;
import com.trustbridge.spi.AuditStorageBackend;
import com.trustbridge.utils.CloseableReentrantLock;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Buffered, tamper-evident audit trail.
 * <p>
 * Events are sanitized and sealed with a checksum when logged, kept in a buffer guarded by a single lock and
 * handed in batches to every configured {@link AuditStorageBackend}. The buffer is flushed when it is full,
 * when an event is critical or failed, and periodically by a background task.
 */
@Slf4j
public class AuditLogger {

    private final CloseableReentrantLock lock = new CloseableReentrantLock();
    // keeps batches in logging order when an immediate flush races the periodic one
    private final Object flushMonitor = new Object();
    private final List<AuditEvent> buffer = new ArrayList<>();

    private final List<AuditStorageBackend> backends;
    private final AuditProperties auditProperties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private final AtomicLong totalEvents = new AtomicLong();
    private final Map<AuditLevel, AtomicLong> eventsByLevel = new ConcurrentHashMap<>();
    private final Map<AuditAction, AtomicLong> eventsByAction = new ConcurrentHashMap<>();
    private final AtomicLong integrityViolations = new AtomicLong();
    private final AtomicLong storageErrors = new AtomicLong();
    private final AtomicLong flushes = new AtomicLong();
    private volatile Instant lastFlush;
    private volatile Instant lastEvent;

    private ScheduledFuture<?> flushTask;
    private ScheduledFuture<?> rotationTask;
    private boolean stopped;

    public AuditLogger(AuditProperties auditProperties, List<AuditStorageBackend> backends, MeterRegistry meterRegistry, Clock clock) {
        this.auditProperties = auditProperties;
        this.backends = List.copyOf(backends);
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(AuditLogger::newAuditThread);
    }

    private static Thread newAuditThread(final Runnable runnable) {
        Thread thread = new Thread(runnable, "Audit-Scheduler");
        thread.setDaemon(true);
        return thread;
    }

    public synchronized void start() {
        if (flushTask != null || stopped) {
            return;
        }
        long flushMillis = auditProperties.getFlushInterval().toMillis();
        long rotationMillis = auditProperties.getRotationInterval().toMillis();
        flushTask = scheduler.scheduleWithFixedDelay(this::flushEvents, flushMillis, flushMillis, TimeUnit.MILLISECONDS);
        rotationTask = scheduler.scheduleWithFixedDelay(this::rotateLogs, rotationMillis, rotationMillis, TimeUnit.MILLISECONDS);
        log.info("audit logger started with backends {}", backends.stream().map(AuditStorageBackend::type).toList());
    }

    /**
     * Stops the background tasks, flushes what is buffered and closes the backends.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        if (flushTask != null) {
            flushTask.cancel(false);
            rotationTask.cancel(false);
            flushTask = null;
            rotationTask = null;
        }
        scheduler.shutdown();
        flushEvents();
        for (AuditStorageBackend backend : backends) {
            try {
                backend.close();
            } catch (IOException e) {
                log.error("Failed to close audit backend {}: {}", backend.type(), e.getMessage(), e);
            }
        }
    }

    public boolean logEvent(AuditLevel level, AuditAction action, String resource, String message, AuditContext context) {
        return logEvent(level, action, resource, message, context, Map.of(), true, null, null);
    }

    /**
     * Records an audit event. Never throws: a failure is logged and counted.
     *
     * @return true if the event was accepted
     */
    public boolean logEvent(AuditLevel level, AuditAction action, String resource, String message, AuditContext context,
                            Map<String, ?> data, boolean success, String errorDetails, Long durationMs) {
        if (!auditProperties.isEnabled()) {
            return false;
        }
        try {
            AuditEvent event = AuditEvent.builder()
                    .timestamp(clock.instant())
                    .level(level)
                    .action(action)
                    .resource(AuditSanitizer.sanitizeText(resource))
                    .message(AuditSanitizer.sanitizeText(message))
                    .context(context != null ? context : AuditContext.system(auditProperties.getServiceName(), null))
                    .data(AuditSanitizer.sanitizeData(data))
                    .success(success)
                    .errorDetails(AuditSanitizer.sanitizeText(errorDetails))
                    .durationMs(durationMs)
                    .build()
                    .seal();
            boolean flushNow;
            try (var ignored = lock.lockAsResource()) {
                buffer.add(event);
                flushNow = buffer.size() >= auditProperties.getBufferSize();
            }
            count(event);
            if (flushNow || !success || level.requiresImmediateFlush()) {
                flushEvents();
            }
            return true;
        } catch (Exception e) {
            log.error("Failed to log audit event {} on {}: {}", action, resource, e.getMessage(), e);
            meterRegistry.counter("audit-log-error", "action", String.valueOf(action), "exception", e.getClass().getSimpleName()).increment();
            return false;
        }
    }

    private void count(AuditEvent event) {
        totalEvents.incrementAndGet();
        eventsByLevel.computeIfAbsent(event.getLevel(), k -> new AtomicLong()).incrementAndGet();
        eventsByAction.computeIfAbsent(event.getAction(), k -> new AtomicLong()).incrementAndGet();
        lastEvent = event.getTimestamp();
    }

    /**
     * Writes the buffered events to every backend. This method never throws, it also runs on the scheduler
     * which stops the periodic task on the first exception.
     *
     * @return the number of events that passed verification
     */
    public int flushEvents() {
        synchronized (flushMonitor) {
            List<AuditEvent> batch;
            try (var ignored = lock.lockAsResource()) {
                if (buffer.isEmpty()) {
                    return 0;
                }
                batch = new ArrayList<>(buffer);
                buffer.clear();
            }
            try {
                List<AuditEvent> verified = new ArrayList<>(batch.size());
                for (AuditEvent event : batch) {
                    if (event.verifyIntegrity()) {
                        verified.add(event);
                    } else {
                        integrityViolations.incrementAndGet();
                        meterRegistry.counter("audit-integrity-violation").increment();
                        log.error("Audit event {} failed integrity verification and was dropped", event.getEventId());
                    }
                }
                if (!verified.isEmpty()) {
                    storeInAll(verified);
                }
                flushes.incrementAndGet();
                lastFlush = clock.instant();
                return verified.size();
            } catch (Exception e) {
                log.error("Failed to flush {} audit events: {}", batch.size(), e.getMessage(), e);
                meterRegistry.counter("audit-log-error", "action", "FLUSH", "exception", e.getClass().getSimpleName()).increment();
                return 0;
            }
        }
    }

    private void storeInAll(List<AuditEvent> events) {
        for (AuditStorageBackend backend : backends) {
            try {
                backend.store(events);
            } catch (Exception e) {
                storageErrors.incrementAndGet();
                log.error("Audit backend {} failed to store {} events: {}", backend.type(), events.size(), e.getMessage(), e);
                meterRegistry.counter("audit-log-error", "action", "STORE", "exception", e.getClass().getSimpleName()).increment();
            }
        }
    }

    /**
     * Asks every backend to rotate its storage. Runs on the scheduler, so it never throws.
     */
    public void rotateLogs() {
        for (AuditStorageBackend backend : backends) {
            try {
                backend.rotate();
            } catch (Exception e) {
                log.error("Audit backend {} failed to rotate: {}", backend.type(), e.getMessage(), e);
                meterRegistry.counter("audit-log-error", "action", "ROTATE", "exception", e.getClass().getSimpleName()).increment();
            }
        }
    }

    public AuditStatistics getStatistics() {
        int buffered;
        try (var ignored = lock.lockAsResource()) {
            buffered = buffer.size();
        }
        Map<AuditLevel, Long> byLevel = new EnumMap<>(AuditLevel.class);
        eventsByLevel.forEach((k, v) -> byLevel.put(k, v.get()));
        Map<AuditAction, Long> byAction = new EnumMap<>(AuditAction.class);
        eventsByAction.forEach((k, v) -> byAction.put(k, v.get()));
        return new AuditStatistics(totalEvents.get(), byLevel, byAction, integrityViolations.get(), storageErrors.get(),
                flushes.get(), buffered, lastFlush, lastEvent);
    }

    public Optional<Instant> getLastEventTime() {
        return Optional.ofNullable(lastEvent);
    }

    /**
     * Builds a report over the events stored by readable backends and the events still buffered.
     *
     * @param reportType {@link ComplianceReport#SUMMARY} or {@link ComplianceReport#DETAILED}
     */
    public ComplianceReport generateComplianceReport(Instant start, Instant end, String reportType) {
        Map<String, AuditEvent> events = new LinkedHashMap<>();
        for (AuditStorageBackend backend : backends) {
            try {
                backend.readEvents(start, end).forEach(e -> events.putIfAbsent(e.getEventId(), e));
            } catch (Exception e) {
                log.warn("Audit backend {} could not be read for the compliance report: {}", backend.type(), e.getMessage());
            }
        }
        try (var ignored = lock.lockAsResource()) {
            buffer.forEach(e -> events.putIfAbsent(e.getEventId(), e));
        }
        List<AuditEvent> window = events.values().stream()
                .filter(e -> !e.getTimestamp().isBefore(start) && !e.getTimestamp().isAfter(end))
                .toList();

        Map<AuditLevel, Long> byLevel = new EnumMap<>(AuditLevel.class);
        Map<AuditAction, Long> byAction = new EnumMap<>(AuditAction.class);
        long authentication = 0;
        long authorization = 0;
        long security = 0;
        long secretAccesses = 0;
        long violations = 0;
        List<AuditEvent> failed = new ArrayList<>();
        for (AuditEvent event : window) {
            byLevel.merge(event.getLevel(), 1L, Long::sum);
            byAction.merge(event.getAction(), 1L, Long::sum);
            switch (event.getAction()) {
                case AUTHENTICATION -> authentication++;
                case AUTHORIZATION -> authorization++;
                case SECRET_ACCESS -> secretAccesses++;
                default -> {
                    // counted by action only
                }
            }
            if (event.getLevel() == AuditLevel.SECURITY) {
                security++;
            }
            if (!event.isSuccess()) {
                failed.add(event);
            }
            if (!event.verifyIntegrity()) {
                violations++;
            }
        }
        boolean detailed = ComplianceReport.DETAILED.equalsIgnoreCase(reportType);
        return new ComplianceReport(reportType, start, end, clock.instant(), window.size(), byLevel, byAction,
                violations + integrityViolations.get(), storageErrors.get(),
                new ComplianceReport.SecuritySummary(authentication, authorization, failed.size(), security, secretAccesses),
                detailed ? failed : List.of());
    }

    public boolean logSecretAccess(String key, String environment, boolean success, Long durationMs) {
        return logEvent(success ? AuditLevel.INFO : AuditLevel.WARNING, AuditAction.SECRET_ACCESS, key,
                success ? "Secret accessed" : "Secret access failed", context(environment),
                Map.of("environment", String.valueOf(environment)), success, success ? null : "secret not available", durationMs);
    }

    public boolean logSecretRotation(String key, String environment, String rotationId, boolean success, String error) {
        return logEvent(success ? AuditLevel.SECURITY : AuditLevel.ERROR, AuditAction.SECRET_ROTATE, key,
                success ? "Secret rotated" : "Secret rotation failed", context(environment),
                Map.of("environment", String.valueOf(environment), "rotationId", String.valueOf(rotationId)), success, error, null);
    }

    public boolean logConfigLoad(String source, int entries, boolean success, String error) {
        return logEvent(success ? AuditLevel.INFO : AuditLevel.ERROR, AuditAction.CONFIG_LOAD, source,
                success ? "Configuration loaded" : "Configuration load failed", null,
                Map.of("entries", entries), success, error, null);
    }

    public AuditContext context(String environment) {
        return AuditContext.system(auditProperties.getServiceName(), environment);
    }
}
