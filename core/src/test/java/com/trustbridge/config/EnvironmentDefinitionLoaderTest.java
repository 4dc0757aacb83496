package com.trustbridge.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EnvironmentDefinitionLoaderTest {

    @TempDir
    Path tempDir;

    private final EnvironmentDefinitionLoader loader = new EnvironmentDefinitionLoader();

    @Test
    void shouldFlattenValuesAndFlagSecrets() throws IOException {
        // Given
        Path file = tempDir.resolve("prod.yaml");
        Files.writeString(file, """
                imports:
                  - base
                values:
                  infrastructure:
                    redis:
                      url: redis://cache:6379
                      max_connections: 80
                      password:
                        fn::secret: r3dis
                  llm_providers:
                    direct_keys:
                      openai:
                        fn::secret: sk-proj-123
                """);

        // When
        Map<String, EnvironmentDefinitionLoader.DefinitionValue> values = loader.load(file);

        // Then
        assertThat(values).containsOnlyKeys(
                "infrastructure.redis.url",
                "infrastructure.redis.max_connections",
                "infrastructure.redis.password",
                "llm_providers.direct_keys.openai");
        assertThat(values.get("infrastructure.redis.url").secret()).isFalse();
        assertThat(values.get("infrastructure.redis.max_connections").value()).isEqualTo(80);
        assertThat(values.get("infrastructure.redis.password")).isEqualTo(new EnvironmentDefinitionLoader.DefinitionValue("r3dis", true));
        assertThat(values.get("llm_providers.direct_keys.openai").secret()).isTrue();
    }

    @Test
    void shouldUseWholeDocumentWithoutValuesSection() throws IOException {
        Path file = tempDir.resolve("plain.yml");
        Files.writeString(file, "application:\n  name: svc\n");

        assertThat(loader.load(file)).containsOnlyKeys("application.name");
    }

    @Test
    void shouldRecognizeYamlFiles() {
        assertThat(EnvironmentDefinitionLoader.isDefinitionFile(Path.of("env/prod.YAML"))).isTrue();
        assertThat(EnvironmentDefinitionLoader.isDefinitionFile(Path.of("env/prod.yml"))).isTrue();
        assertThat(EnvironmentDefinitionLoader.isDefinitionFile(Path.of(".env"))).isFalse();
    }
}
