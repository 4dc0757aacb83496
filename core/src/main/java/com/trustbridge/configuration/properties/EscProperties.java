package com.trustbridge.configuration.properties;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection to the remote secrets backend (Pulumi ESC compatible API).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "trustbridge.esc")
@Validated
public class EscProperties {

    @NotEmpty
    private String baseUrl = "https://api.pulumi.com";

    @NotEmpty
    private String organization = "default";

    /**
     * bearer token sent with every request. Requests are sent without authorization when blank.
     */
    private String apiToken;

    /**
     * environment used by the configuration loader and the health checks
     */
    @NotEmpty
    private String environment = "dev";

    @NotNull
    private Duration cacheTtl = Duration.ofMinutes(5);

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(30);
}
