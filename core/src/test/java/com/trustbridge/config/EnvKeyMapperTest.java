package com.trustbridge.config;

import com.trustbridge.configuration.properties.ConfigLoaderProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EnvKeyMapperTest {

    private final EnvKeyMapper mapper = new EnvKeyMapper(List.of("TRUSTBRIDGE_"));

    @ParameterizedTest
    @CsvSource({
            "REDIS_URL, infrastructure.redis.url",
            "REDIS_PASSWORD, infrastructure.redis.password",
            "QDRANT_API_KEY, infrastructure.vector_db.qdrant.api_key",
            "MEM0_API_KEY, infrastructure_providers.mem0.api_key",
            "PULUMI_API_KEY, pulumi.api_key",
            "OPENAI_API_KEY, llm_providers.direct_keys.openai",
            "HUGGINGFACE_API_KEY, llm_providers.direct_keys.huggingface",
            "APPLICATION_LOG_LEVEL, application.log.level"
    })
    void shouldMapVariableToConfigKey(String variable, String expected) {
        assertThat(mapper.toConfigKey(variable)).isEqualTo(expected);
    }

    @Test
    void shouldImportKnownAndPrefixedVariablesOnly() {
        assertThat(mapper.mapIfImported("ANTHROPIC_API_KEY")).contains("llm_providers.direct_keys.anthropic");
        assertThat(mapper.mapIfImported("WEAVIATE_URL")).contains("infrastructure.vector_db.weaviate.url");
        assertThat(mapper.mapIfImported("TRUSTBRIDGE_APPLICATION_NAME")).contains("application.name");
        assertThat(mapper.mapIfImported("PATH")).isEmpty();
        assertThat(mapper.mapIfImported("UNKNOWN_API_KEY")).isEmpty();
        assertThat(mapper.mapIfImported("TRUSTBRIDGE_")).isEmpty();
    }

    @Test
    void shouldImportEverythingWithDefaultPrefixes() {
        EnvKeyMapper defaults = new EnvKeyMapper(new ConfigLoaderProperties().getEnvironmentPrefixes());

        assertThat(defaults.mapIfImported("FOO_BAR")).contains("foo.bar");
        assertThat(defaults.mapIfImported("APPLICATION_DEBUG")).contains("application.debug");
        assertThat(defaults.mapIfImported("TRUSTBRIDGE_APPLICATION_NAME")).contains("application.name");
        assertThat(defaults.mapIfImported("TRUSTBRIDGE_REDIS_URL")).contains("infrastructure.redis.url");
        assertThat(defaults.mapIfImported("TRUSTBRIDGE_")).isEmpty();
    }
}
