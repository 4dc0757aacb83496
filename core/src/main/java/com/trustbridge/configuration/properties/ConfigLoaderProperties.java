package com.trustbridge.configuration.properties;

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
@ConfigurationProperties(prefix = "trustbridge.config")
@Validated
public class ConfigLoaderProperties {

    /**
     * .env files and YAML environment definitions, loaded in order
     */
    private List<String> files = new ArrayList<>();

    /**
     * defaults merged over the built-in ones, lowest priority
     */
    private Map<String, String> defaults = new LinkedHashMap<>();

    /**
     * environment variables starting with one of these prefixes are imported, with the prefix stripped. The empty
     * prefix imports every other variable with the generic key mapping.
     */
    private List<String> environmentPrefixes = new ArrayList<>(List.of("TRUSTBRIDGE_", ""));

    private boolean watchFiles = true;

    @NotNull
    private Duration watchInterval = Duration.ofSeconds(1);

    private boolean autoRefresh = true;

    @NotNull
    private Duration refreshInterval = Duration.ofMinutes(5);
}
