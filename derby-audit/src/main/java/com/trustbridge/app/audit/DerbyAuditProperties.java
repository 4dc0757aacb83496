package com.trustbridge.app.audit;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "audit.database")
@Validated
public class DerbyAuditProperties {

    private boolean enabled = false;

    @NotEmpty
    private String derbyUrl = "jdbc:derby:audit-db;create=true";

    /**
     * events older than this are deleted by the audit rotation loop
     */
    @NotNull
    private Duration retention = Duration.ofDays(365);
}
