package com.trustbridge.rotation;

import com.trustbridge.audit.AuditLogger;
import com.trustbridge.models.enums.AuditAction;
import com.trustbridge.models.enums.AuditLevel;
import com.trustbridge.models.enums.RotationStatus;
import com.trustbridge.models.enums.RotationType;
import com.trustbridge.models.rotation.RotationEvent;
import com.trustbridge.models.rotation.RotationPolicy;
import com.trustbridge.models.rotation.ValidationOutcome;
import com.trustbridge.secrets.SecretsManager;
import com.trustbridge.spi.RotationNotificationHook;
import com.trustbridge.spi.SecretGenerator;
import com.trustbridge.spi.SecretValidator;
import com.trustbridge.utils.CloseableReentrantLock;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Generates, validates and writes new secret values according to rotation policies, and restores the previous
 * value on request while the rollback window is open.
 * <p>
 * At most one rotation runs per key and environment: a second request while one is in flight is rejected, not
 * queued. Every attempt is recorded in the rotation history and every status change is sent to the notification
 * hooks.
 */
@Slf4j
public class RotationOrchestrator {

    private final SecretsManager secretsManager;
    private final AuditLogger auditLogger;
    private final Map<String, RotationPolicy> policies = new LinkedHashMap<>();
    private final Map<RotationType, SecretGenerator> generators = new EnumMap<>(RotationType.class);
    private final List<SecretValidator> validators;
    private final List<RotationNotificationHook> hooks = new CopyOnWriteArrayList<>();
    private final RollbackStore rollbackStore;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final CloseableReentrantLock lock = new CloseableReentrantLock();
    // rotation id -> event in flight
    private final Map<String, RotationEvent> activeRotations = new LinkedHashMap<>();
    private final List<RotationEvent> history = new ArrayList<>();
    // rotation id -> completion time of the last successful rotation
    private final Map<String, Instant> lastRotated = new HashMap<>();

    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> schedulerTask;

    public RotationOrchestrator(SecretsManager secretsManager,
                                AuditLogger auditLogger,
                                Collection<RotationPolicy> policies,
                                Collection<SecretGenerator> generators,
                                List<SecretValidator> validators,
                                Collection<RotationNotificationHook> hooks,
                                RollbackStore rollbackStore,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.secretsManager = secretsManager;
        this.auditLogger = auditLogger;
        this.validators = List.copyOf(validators);
        this.hooks.addAll(hooks);
        this.rollbackStore = rollbackStore;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        for (RotationPolicy policy : policies) {
            policy.validate();
            if (this.policies.putIfAbsent(policy.getSecretKey(), policy) != null) {
                throw new IllegalArgumentException("duplicate rotation policy for " + policy.getSecretKey());
            }
        }
        // the first generator of a type wins, callers pass them in precedence order
        generators.forEach(generator -> this.generators.putIfAbsent(generator.type(), generator));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(RotationOrchestrator::newSchedulerThread);
    }

    private static Thread newSchedulerThread(final Runnable runnable) {
        Thread thread = new Thread(runnable, "Rotation-Scheduler");
        thread.setDaemon(true);
        return thread;
    }

    public static String rotationId(String secretKey, String environment) {
        return secretKey + ":" + environment;
    }

    public RotationResult rotateSecret(String secretKey, String environment) {
        return rotateSecret(secretKey, environment, false);
    }

    /**
     * @param force rotate even if the rotation interval has not elapsed
     */
    public RotationResult rotateSecret(String secretKey, String environment, boolean force) {
        RotationPolicy policy = policies.get(secretKey);
        if (policy == null) {
            return RotationResult.rejected("no policy for " + secretKey);
        }
        if (!policy.appliesTo(environment)) {
            return RotationResult.rejected("environment not managed: " + environment);
        }
        if (!force && !isRotationDue(policy, environment)) {
            return RotationResult.rejected("not due");
        }
        String rotationId = rotationId(secretKey, environment);
        Instant startedAt = clock.instant();
        RotationEvent event = RotationEvent.builder()
                .eventId(rotationId + ":" + startedAt.toEpochMilli())
                .rotationId(rotationId)
                .secretKey(secretKey)
                .environment(environment)
                .startedAt(startedAt)
                .status(RotationStatus.PENDING)
                .build();
        try (var ignored = lock.lockAsResource()) {
            if (activeRotations.containsKey(rotationId)) {
                log.info("Rotation of {} already in progress, request rejected", rotationId);
                return RotationResult.rejected("rotation already in progress for " + rotationId);
            }
            activeRotations.put(rotationId, event);
            history.add(event);
        }
        try {
            notifyHooks(event);
            return execute(policy, event);
        } catch (RuntimeException e) {
            log.error("Rotation {} failed unexpectedly: {}", event.getEventId(), e.getMessage(), e);
            if (event.getStatus().isTerminal()) {
                return new RotationResult(event.getStatus() == RotationStatus.COMPLETED, event, "unexpected error: " + e.getMessage());
            }
            return fail(event, "unexpected error: " + e.getMessage());
        } finally {
            try (var ignored = lock.lockAsResource()) {
                activeRotations.remove(rotationId);
            }
        }
    }

    private RotationResult execute(RotationPolicy policy, RotationEvent event) {
        event.markInProgress();
        notifyHooks(event);
        String secretKey = event.getSecretKey();
        String environment = event.getEnvironment();
        secretsManager.markRotating(secretKey, environment);

        SecretGenerator generator = generators.get(policy.getRotationType());
        if (generator == null) {
            return fail(event, "no generator for " + policy.getRotationType());
        }
        Optional<String> current = secretsManager.getSecret(secretKey, environment, false);
        String candidate = generator.generate(policy, current.orElse(null));
        if (current.isPresent() && current.get().equals(candidate)) {
            return fail(event, "generated value equals the current value");
        }
        if (policy.isValidationRequired()) {
            for (SecretValidator validator : validators) {
                if (!validator.supports(policy.getRotationType())) {
                    continue;
                }
                ValidationOutcome outcome = validator.validate(policy, candidate);
                if (!outcome.valid()) {
                    return fail(event, "validation failed (" + outcome.validator() + "): " + outcome.message());
                }
            }
        }
        if (!secretsManager.setSecret(secretKey, candidate, environment)) {
            return fail(event, "failed to write the new value");
        }
        Instant completedAt = clock.instant();
        boolean rollbackAvailable = current.isPresent() && policy.getRollbackTimeoutMinutes() > 0;
        if (rollbackAvailable) {
            rollbackStore.put(event.getEventId(), current.get(),
                    completedAt.plus(Duration.ofMinutes(policy.getRollbackTimeoutMinutes())));
        }
        event.markCompleted(completedAt, RotationEvent.hint(current.orElse(null)), RotationEvent.hint(candidate), rollbackAvailable);
        try (var ignored = lock.lockAsResource()) {
            lastRotated.put(event.getRotationId(), completedAt);
        }
        secretsManager.completeRotation(secretKey, environment, true);
        auditLogger.logSecretRotation(secretKey, environment, event.getRotationId(), true, null);
        meterRegistry.counter("secret-rotation", "status", RotationStatus.COMPLETED.name()).increment();
        log.info("Rotated {} in {}", secretKey, environment);
        notifyHooks(event);
        return RotationResult.succeeded(event, "rotated");
    }

    private RotationResult fail(RotationEvent event, String message) {
        event.markFailed(clock.instant(), message);
        secretsManager.completeRotation(event.getSecretKey(), event.getEnvironment(), false);
        auditLogger.logSecretRotation(event.getSecretKey(), event.getEnvironment(), event.getRotationId(), false, message);
        meterRegistry.counter("secret-rotation", "status", RotationStatus.FAILED.name()).increment();
        log.warn("Rotation {} failed: {}", event.getEventId(), message);
        notifyHooks(event);
        return RotationResult.failed(event, message);
    }

    /**
     * Restores the value replaced by a completed rotation while its rollback window is open. A rejected rollback
     * leaves the secret and the event untouched. The event state and the stored value are checked while holding the
     * rotation slot, so at most one of several concurrent rollbacks of the same event succeeds.
     */
    public RotationResult rollbackRotation(String eventId) {
        RotationEvent event = findEvent(eventId).orElse(null);
        if (event == null) {
            return RotationResult.rejected("unknown rotation event " + eventId);
        }
        String rotationId = event.getRotationId();
        Optional<String> previous;
        try (var ignored = lock.lockAsResource()) {
            if (activeRotations.containsKey(rotationId)) {
                return RotationResult.failed(event, "rotation in progress for " + rotationId);
            }
            if (event.getStatus() != RotationStatus.COMPLETED) {
                return RotationResult.failed(event, "rotation is " + event.getStatus());
            }
            previous = rollbackStore.get(eventId, clock.instant());
            if (previous.isEmpty()) {
                return RotationResult.failed(event, "rollback not available");
            }
            activeRotations.put(rotationId, event);
        }
        try {
            if (!secretsManager.setSecret(event.getSecretKey(), previous.get(), event.getEnvironment())) {
                auditLogger.logEvent(AuditLevel.ERROR, AuditAction.SECRET_ROTATE, event.getSecretKey(), "Rotation rollback failed",
                        auditLogger.context(event.getEnvironment()), Map.of("rotationId", rotationId), false, "failed to restore previous value", null);
                return RotationResult.failed(event, "failed to restore the previous value");
            }
            rollbackStore.remove(eventId);
            event.markRolledBack(clock.instant());
            auditLogger.logEvent(AuditLevel.SECURITY, AuditAction.SECRET_ROTATE, event.getSecretKey(), "Rotation rolled back",
                    auditLogger.context(event.getEnvironment()), Map.of("rotationId", rotationId, "eventId", eventId), true, null, null);
            meterRegistry.counter("secret-rotation", "status", RotationStatus.ROLLBACK.name()).increment();
            notifyHooks(event);
            return RotationResult.succeeded(event, "rolled back");
        } finally {
            try (var ignored = lock.lockAsResource()) {
                activeRotations.remove(rotationId);
            }
        }
    }

    public boolean isRotationDue(RotationPolicy policy, String environment) {
        Instant last;
        try (var ignored = lock.lockAsResource()) {
            last = lastRotated.get(rotationId(policy.getSecretKey(), environment));
        }
        return last == null || !clock.instant().isBefore(last.plus(Duration.ofDays(policy.getIntervalDays())));
    }

    /**
     * A secret is overdue once its last rotation is older than {@code maxAgeDays} plus the grace period. Secrets never
     * rotated by this orchestrator have no known age and are not overdue.
     */
    public boolean isRotationOverdue(RotationPolicy policy, String environment) {
        Instant last;
        try (var ignored = lock.lockAsResource()) {
            last = lastRotated.get(rotationId(policy.getSecretKey(), environment));
        }
        if (last == null) {
            return false;
        }
        Instant deadline = last.plus(Duration.ofDays(policy.getMaxAgeDays())).plus(Duration.ofHours(policy.getGracePeriodHours()));
        return !clock.instant().isBefore(deadline);
    }

    /**
     * Starts the periodic due check.
     *
     * @return false if the scheduler is already running
     */
    public synchronized boolean startRotationScheduler(long checkIntervalSeconds) {
        if (schedulerTask != null) {
            return false;
        }
        schedulerTask = scheduler.scheduleWithFixedDelay(this::runScheduledCheck, 0, checkIntervalSeconds, TimeUnit.SECONDS);
        log.info("rotation scheduler started, checking every {}s", checkIntervalSeconds);
        return true;
    }

    /**
     * Stops the periodic check. A check already running completes.
     */
    public synchronized void stopRotationScheduler() {
        if (schedulerTask != null) {
            schedulerTask.cancel(false);
            schedulerTask = null;
            log.info("rotation scheduler stopped");
        }
    }

    public synchronized boolean isSchedulerRunning() {
        return schedulerTask != null;
    }

    /**
     * One scheduler tick: closes expired rollback windows and rotates every due secret of auto-rotating policies.
     * Never throws.
     *
     * @return the number of rotations attempted
     */
    public int runScheduledCheck() {
        int attempted = 0;
        try {
            purgeExpiredRollbacks();
            for (RotationPolicy policy : policies.values()) {
                if (!policy.isAutoRotate()) {
                    policy.getEnvironments().stream()
                            .filter(environment -> isRotationOverdue(policy, environment))
                            .forEach(environment -> log.warn("{} in {} is older than {} days and needs a manual rotation",
                                    policy.getSecretKey(), environment, policy.getMaxAgeDays()));
                    continue;
                }
                for (String environment : policy.getEnvironments()) {
                    if (isRotationDue(policy, environment)) {
                        attempted++;
                        rotateSecret(policy.getSecretKey(), environment, false);
                    }
                }
            }
        } catch (Exception e) {
            log.error("Scheduled rotation check failed: {}", e.getMessage(), e);
            meterRegistry.counter("secret-rotation", "status", "SCHEDULER_ERROR").increment();
        }
        return attempted;
    }

    private void purgeExpiredRollbacks() {
        for (String eventId : rollbackStore.purgeExpired(clock.instant())) {
            findEvent(eventId).ifPresent(RotationEvent::expireRollback);
        }
    }

    private Optional<RotationEvent> findEvent(String eventId) {
        try (var ignored = lock.lockAsResource()) {
            return history.stream().filter(e -> e.getEventId().equals(eventId)).findFirst();
        }
    }

    private void notifyHooks(RotationEvent event) {
        for (RotationNotificationHook hook : hooks) {
            try {
                hook.onRotationEvent(event);
            } catch (Exception e) {
                log.error("Rotation notification hook failed for {}: {}", event.getEventId(), e.getMessage(), e);
            }
        }
    }

    public void addNotificationHook(RotationNotificationHook hook) {
        hooks.add(hook);
    }

    public Map<String, RotationPolicy> getPolicies() {
        return Map.copyOf(policies);
    }

    public List<RotationEvent> getActiveRotations() {
        try (var ignored = lock.lockAsResource()) {
            return List.copyOf(activeRotations.values());
        }
    }

    /**
     * @param secretKey filter, null for every secret
     */
    public List<RotationEvent> getRotationHistory(String secretKey) {
        try (var ignored = lock.lockAsResource()) {
            return history.stream().filter(e -> secretKey == null || e.getSecretKey().equals(secretKey)).toList();
        }
    }

    public RotationStatistics getRotationStatistics() {
        List<RotationEvent> events;
        int active;
        try (var ignored = lock.lockAsResource()) {
            events = List.copyOf(history);
            active = activeRotations.size();
        }
        long completed = events.stream().filter(e -> e.getStatus() == RotationStatus.COMPLETED).count();
        long failed = events.stream().filter(e -> e.getStatus() == RotationStatus.FAILED).count();
        long rolledBack = events.stream().filter(e -> e.getStatus() == RotationStatus.ROLLBACK).count();
        long finished = completed + failed + rolledBack;
        // a rolled back rotation did complete before it was reverted
        double successRate = finished == 0 ? 0.0 : (double) (completed + rolledBack) / finished;
        return new RotationStatistics(events.size(), completed, failed, rolledBack, active, rollbackStore.size(),
                policies.size(), successRate);
    }

    public RotationReport createRotationReport() {
        List<RotationReport.SecretRotationSummary> secrets = new ArrayList<>();
        for (RotationPolicy policy : policies.values()) {
            Map<String, Instant> last = new LinkedHashMap<>();
            Map<String, Instant> nextDue = new LinkedHashMap<>();
            try (var ignored = lock.lockAsResource()) {
                for (String environment : policy.getEnvironments()) {
                    Instant rotated = lastRotated.get(rotationId(policy.getSecretKey(), environment));
                    last.put(environment, rotated);
                    nextDue.put(environment, rotated == null ? clock.instant() : rotated.plus(Duration.ofDays(policy.getIntervalDays())));
                }
            }
            List<String> overdue = policy.getEnvironments().stream()
                    .filter(environment -> isRotationOverdue(policy, environment))
                    .toList();
            secrets.add(new RotationReport.SecretRotationSummary(policy.getSecretKey(), policy.getRotationType(),
                    policy.getIntervalDays(), policy.isAutoRotate(), List.copyOf(policy.getEnvironments()),
                    last, nextDue, overdue, getRotationHistory(policy.getSecretKey())));
        }
        return new RotationReport(clock.instant(), getRotationStatistics(), secrets);
    }

    public void shutdown() {
        stopRotationScheduler();
        scheduler.shutdown();
    }
}
