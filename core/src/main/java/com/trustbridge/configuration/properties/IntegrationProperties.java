package com.trustbridge.configuration.properties;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "trustbridge")
@Validated
public class IntegrationProperties {

    @NotNull
    private Duration healthInterval = Duration.ofMinutes(1);

    /**
     * keys that must resolve after initialization, otherwise the integration reports itself degraded
     */
    private List<String> criticalKeys = new ArrayList<>(List.of(
            "infrastructure.redis.url",
            "infrastructure.redis.password",
            "llm_providers.portkey.api_key",
            "infrastructure.vector_db.qdrant.api_key",
            "infrastructure.vector_db.weaviate.api_key"));
}
