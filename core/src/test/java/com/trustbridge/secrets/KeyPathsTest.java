package com.trustbridge.secrets;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KeyPathsTest {

    @Test
    void shouldTraverseNestedMaps() {
        Map<String, Object> tree = Map.of("infrastructure", Map.of("redis", Map.of("url", "redis://cache:6379")));

        assertThat(KeyPaths.get(tree, "infrastructure.redis.url")).contains("redis://cache:6379");
        assertThat(KeyPaths.get(tree, "infrastructure.redis.password")).isEmpty();
        assertThat(KeyPaths.get(tree, "infrastructure.redis.url.host")).isEmpty();
    }

    @Test
    void shouldPreferVerbatimTopLevelKey() {
        Map<String, Object> tree = Map.of(
                "a.b", "flat",
                "a", Map.of("b", "nested"));

        assertThat(KeyPaths.get(tree, "a.b")).contains("flat");
    }

    @Test
    void shouldCreateIntermediateMapsOnSet() {
        // Given
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("llm_providers", "not a map");

        // When
        KeyPaths.set(tree, "llm_providers.direct_keys.openai_api_key", "sk-1");
        KeyPaths.set(tree, "llm_providers.direct_keys.anthropic_api_key", "sk-ant-1");

        // Then
        assertThat(KeyPaths.get(tree, "llm_providers.direct_keys.openai_api_key")).contains("sk-1");
        assertThat(KeyPaths.get(tree, "llm_providers.direct_keys.anthropic_api_key")).contains("sk-ant-1");
    }

    @Test
    void shouldKeepSiblingsWhenSettingIntoImmutableNestedMaps() {
        // Given
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("infrastructure", Map.of("redis", Map.of("url", "redis://cache:6379")));

        // When
        KeyPaths.set(tree, "infrastructure.redis.password", "hunter2");

        // Then
        assertThat(KeyPaths.get(tree, "infrastructure.redis.url")).contains("redis://cache:6379");
        assertThat(KeyPaths.get(tree, "infrastructure.redis.password")).contains("hunter2");
        assertThat(KeyPaths.flatten(tree)).containsOnlyKeys("infrastructure.redis.url", "infrastructure.redis.password");
    }

    @Test
    void shouldFlattenTreeKeepingSecretMarkersAsLeaves() {
        // Given
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("application", Map.of("name", "svc"));
        tree.put("pulumi", Map.of("api_key", SecretMarker.wrap("pul-123")));

        // When
        Map<String, Object> flat = KeyPaths.flatten(tree);

        // Then
        assertThat(flat).containsOnlyKeys("application.name", "pulumi.api_key");
        assertThat(SecretMarker.unwrap(flat.get("pulumi.api_key"))).isEqualTo("pul-123");
    }

    @Test
    void shouldRecognizeOnlySingleEntryMarkers() {
        assertThat(SecretMarker.isMarker(Map.of("fn::secret", "x"))).isTrue();
        assertThat(SecretMarker.isMarker(Map.of("fn::secret", "x", "other", "y"))).isFalse();
        assertThat(SecretMarker.unwrap("plain")).isEqualTo("plain");
    }
}
