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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EscIntegrationTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");
    private static final String CRITICAL_KEY = "infrastructure.redis.url";

    private ConfigLoader configLoader;
    private SecretsManager secretsManager;
    private RotationOrchestrator rotationOrchestrator;
    private AuditLogger auditLogger;
    private IntegrationProperties integrationProperties;
    private RotationProperties rotationProperties;
    private MutableClock clock;
    private EscIntegration integration;

    @BeforeEach
    void setUp() {
        configLoader = mock(ConfigLoader.class);
        secretsManager = mock(SecretsManager.class);
        rotationOrchestrator = mock(RotationOrchestrator.class);
        auditLogger = mock(AuditLogger.class);
        clock = new MutableClock(START);

        integrationProperties = new IntegrationProperties();
        integrationProperties.setHealthInterval(Duration.ofHours(1));
        integrationProperties.setCriticalKeys(List.of(CRITICAL_KEY));
        rotationProperties = new RotationProperties();

        when(configLoader.getEnvironment()).thenReturn("prod");
        when(configLoader.getStatus()).thenReturn(new ConfigStatus(true, false, "prod", 12, Map.of(), START, START, List.of(), 1));
        when(configLoader.get(CRITICAL_KEY)).thenReturn("redis://cache:6379");
        when(configLoader.initialize()).thenReturn(true);
        when(secretsManager.healthCheck()).thenReturn(health(true));

        integration = new EscIntegration(configLoader, secretsManager, rotationOrchestrator, auditLogger,
                integrationProperties, rotationProperties, clock);
    }

    @AfterEach
    void tearDown() {
        integration.shutdown();
    }

    private static HealthStatus health(boolean healthy) {
        return new HealthStatus(healthy ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY, healthy, 0, true, null, START);
    }

    @Test
    void shouldReportHealthyWhenRemoteConfigurationLoads() {
        // When
        boolean loaded = integration.initialize();

        // Then
        assertThat(loaded).isTrue();
        assertThat(integration.getIntegrationHealth()).isEqualTo(EscIntegration.HEALTHY);
        EscIntegration.IntegrationStatus status = integration.getStatus();
        assertThat(status.initialized()).isTrue();
        assertThat(status.lastRefresh()).isEqualTo(START);
        assertThat(status.missingCriticalKeys()).isEmpty();
        verify(configLoader).addChangeListener(any());
        verify(rotationOrchestrator, never()).startRotationScheduler(anyLong());
        verify(auditLogger).logEvent(eq(AuditLevel.INFO), eq(AuditAction.SYSTEM_START), eq("trustbridge"),
                eq("Integration initialized"), any(), eq(Map.of("configEntries", 12, "fallbackMode", false)),
                eq(true), isNull(), isNull());
    }

    @Test
    void shouldDegradeAndAuditWhenCriticalKeysAreMissing() {
        // Given
        when(configLoader.get(CRITICAL_KEY)).thenReturn("  ");

        // When
        integration.initialize();

        // Then
        assertThat(integration.getIntegrationHealth()).isEqualTo(EscIntegration.DEGRADED);
        assertThat(integration.getStatus().missingCriticalKeys()).containsExactly(CRITICAL_KEY);
        verify(auditLogger).logEvent(eq(AuditLevel.WARNING), eq(AuditAction.CONFIG_LOAD), eq("critical_config"),
                anyString(), any(), eq(Map.of("missing", List.of(CRITICAL_KEY))), eq(true), isNull(), isNull());
    }

    @Test
    void shouldReportFailedWhenStartingInFallbackMode() {
        // Given
        when(configLoader.initialize()).thenReturn(false);

        // When
        boolean loaded = integration.initialize();

        // Then
        assertThat(loaded).isFalse();
        assertThat(integration.getIntegrationHealth()).isEqualTo(EscIntegration.FAILED);
        assertThat(integration.getStatus().initialized()).isTrue();
    }

    @Test
    void shouldReportDegradedWhenBackendIsUnhealthy() {
        // Given
        when(secretsManager.healthCheck()).thenReturn(health(false));

        // When
        integration.initialize();

        // Then
        assertThat(integration.getIntegrationHealth()).isEqualTo(EscIntegration.DEGRADED);
    }

    @Test
    void shouldStartRotationSchedulerWhenEnabled() {
        // Given
        rotationProperties.setSchedulerEnabled(true);
        rotationProperties.setCheckIntervalSeconds(120);

        // When
        integration.initialize();

        // Then
        verify(rotationOrchestrator).startRotationScheduler(120);
    }

    @Test
    void shouldNotThrowWhenInitializationFails() {
        // Given
        when(configLoader.initialize()).thenThrow(new IllegalStateException("boom"));

        // When
        boolean loaded = integration.initialize();

        // Then
        assertThat(loaded).isFalse();
        assertThat(integration.getIntegrationHealth()).isEqualTo(EscIntegration.FAILED);
        verify(auditLogger).logEvent(eq(AuditLevel.ERROR), eq(AuditAction.ERROR_OCCURRED), eq("trustbridge"),
                anyString(), any(), anyMap(), eq(false), eq("boom"), isNull());
    }

    @Test
    void shouldInitializeOnlyOnce() {
        // Given
        integration.initialize();

        // When
        boolean second = integration.initialize();

        // Then
        assertThat(second).isTrue();
        verify(configLoader, times(1)).initialize();
    }

    @Test
    void shouldRecoverHealthOnceBackendAndRemoteConfigAreBack() {
        // Given
        when(configLoader.initialize()).thenReturn(false);
        integration.initialize();
        when(configLoader.isFallbackMode()).thenReturn(false);

        // When
        integration.checkIntegrationHealth();

        // Then
        assertThat(integration.getIntegrationHealth()).isEqualTo(EscIntegration.HEALTHY);
    }

    @Test
    void shouldDegradeWhileLoaderStaysInFallbackMode() {
        // Given
        integration.initialize();
        when(configLoader.isFallbackMode()).thenReturn(true);

        // When
        integration.checkIntegrationHealth();

        // Then
        assertThat(integration.getIntegrationHealth()).isEqualTo(EscIntegration.DEGRADED);
    }

    @Test
    void shouldReportFailedWhenHealthCheckThrows() {
        // Given
        integration.initialize();
        when(secretsManager.healthCheck()).thenThrow(new IllegalStateException("unreachable"));

        // When
        integration.checkIntegrationHealth();

        // Then
        assertThat(integration.getIntegrationHealth()).isEqualTo(EscIntegration.FAILED);
    }

    @Test
    void shouldAuditCriticalChangesAsSecurityEvents() {
        // When
        integration.onConfigChange(CRITICAL_KEY, "redis://new:6379", "redis://cache:6379");

        // Then
        verify(auditLogger).logEvent(eq(AuditLevel.SECURITY), eq(AuditAction.CONFIG_CHANGE), eq(CRITICAL_KEY),
                anyString(), any(), eq(Map.of("critical", true)), eq(true), isNull(), isNull());
    }

    @Test
    void shouldAuditOrdinaryChangesWithValueTypesOnly() {
        // When
        integration.onConfigChange("app.debug", Boolean.TRUE, null);

        // Then
        verify(auditLogger).logEvent(eq(AuditLevel.INFO), eq(AuditAction.CONFIG_CHANGE), eq("app.debug"),
                anyString(), any(), eq(Map.of("oldType", "null", "newType", "Boolean")), eq(true), isNull(), isNull());
    }

    @Test
    void shouldMoveLastRefreshOnlyWhenRefreshSucceeds() {
        // Given
        integration.initialize();
        clock.advance(Duration.ofMinutes(10));
        when(configLoader.refreshConfig(true)).thenReturn(false);

        // When
        integration.refreshConfig(true);

        // Then
        assertThat(integration.getHealthSummary().lastRefresh()).isEqualTo(START);

        // When
        when(configLoader.refreshConfig(true)).thenReturn(true);
        integration.refreshConfig(true);

        // Then
        assertThat(integration.getHealthSummary().lastRefresh()).isEqualTo(START.plus(Duration.ofMinutes(10)));
    }

    @Test
    void shouldSummarizeHealth() {
        // Given
        integration.initialize();

        // When
        EscIntegration.HealthSummary summary = integration.getHealthSummary();

        // Then
        assertThat(summary.healthy()).isTrue();
        assertThat(summary.status()).isEqualTo(EscIntegration.HEALTHY);
        assertThat(summary.configEntries()).isEqualTo(12);
        assertThat(summary.initialized()).isTrue();
    }

    @Test
    void shouldDelegateReadsToTheLoader() {
        // Given
        when(configLoader.get("app.name", "x")).thenReturn("trustbridge");
        when(configLoader.getSecret("db.password", null)).thenReturn("hunter2");
        when(configLoader.getAll("app.")).thenReturn(Map.of("app.name", "trustbridge"));

        // Then
        assertThat(integration.get("app.name", "x")).isEqualTo("trustbridge");
        assertThat(integration.getSecret("db.password", null)).isEqualTo("hunter2");
        assertThat(integration.getAll("app.")).containsOnlyKeys("app.name");
    }

    @Test
    void shouldStopComponentsOnShutdown() {
        // Given
        integration.initialize();

        // When
        integration.shutdown();

        // Then
        assertThat(integration.getStatus().initialized()).isFalse();
        verify(configLoader).shutdown();
        verify(rotationOrchestrator).shutdown();
        verify(auditLogger).stop();
        verify(auditLogger).logEvent(eq(AuditLevel.INFO), eq(AuditAction.SYSTEM_STOP), eq("trustbridge"), anyString(), any());
    }
}
