package com.trustbridge.app.audit;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DerbyAuditConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class, DerbyAuditConfiguration.class))
            .withBean(Clock.class, Clock::systemUTC);

    @Test
    void shouldStayOffByDefault() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(DerbyAuditStorageBackend.class));
    }

    @Test
    void shouldCreateBackendWhenEnabled() {
        contextRunner
                .withPropertyValues(
                        "audit.database.enabled=true",
                        "audit.database.derby-url=jdbc:derby:memory:" + UUID.randomUUID() + ";create=true")
                .run(context -> {
                    assertThat(context).hasSingleBean(DerbyDao.class);
                    assertThat(context).hasSingleBean(DerbyAuditStorageBackend.class);
                    assertThat(context.getBean(DerbyDao.class).countAuditEvents()).isZero();
                });
    }
}
