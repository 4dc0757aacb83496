package com.trustbridge.configuration.properties;

import com.trustbridge.models.rotation.RotationPolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "trustbridge.rotation")
@Validated
public class RotationProperties {

    private boolean schedulerEnabled = false;

    @Min(1)
    private long checkIntervalSeconds = 3600;

    private List<RotationPolicy> policies = new ArrayList<>();

    private ExternalValidation externalValidation = new ExternalValidation();

    @Getter
    @Setter
    public static class ExternalValidation {
        private boolean enabled = false;

        /**
         * treat an unreachable provider as a failed validation
         */
        private boolean strict = false;

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * provider calls allowed per provider and hour; validations over the limit are inconclusive
         */
        @Min(1)
        private int rateLimitPerHour = 100;

        /**
         * provider name to the endpoint answering 200 for a valid key, e.g. openai: https://api.openai.com/v1/models
         */
        private Map<String, String> endpoints = new LinkedHashMap<>(Map.of(
                "openai", "https://api.openai.com/v1/models",
                "anthropic", "https://api.anthropic.com/v1/models",
                "huggingface", "https://huggingface.co/api/whoami-v2"));
    }
}
