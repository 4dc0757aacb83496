package com.trustbridge.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.trustbridge.secrets.KeyPaths;
import com.trustbridge.secrets.SecretMarker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads YAML environment definitions. The {@code values} subtree (or the whole document when there is none) is
 * flattened to dot keys, and {@code {"fn::secret": ...}} objects are unwrapped and flagged as secrets.
 */
public class EnvironmentDefinitionLoader {

    private static final TypeReference<Map<String, Object>> TREE = new TypeReference<>() {
    };

    private final YAMLMapper yamlMapper = new YAMLMapper();

    public record DefinitionValue(Object value, boolean secret) {
    }

    public static boolean isDefinitionFile(Path file) {
        String name = file.getFileName().toString().toLowerCase();
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    public Map<String, DefinitionValue> load(Path file) throws IOException {
        Map<String, Object> document;
        try (var in = Files.newInputStream(file)) {
            document = yamlMapper.readValue(in, TREE);
        }
        Map<String, DefinitionValue> result = new LinkedHashMap<>();
        if (document == null) {
            return result;
        }
        Object values = document.get("values");
        Map<String, Object> tree = values instanceof Map<?, ?> ? yamlMapper.convertValue(values, TREE) : document;
        KeyPaths.flatten(tree).forEach((key, value) -> {
            if (SecretMarker.isMarker(value)) {
                result.put(key, new DefinitionValue(SecretMarker.unwrap(value), true));
            } else if (value != null) {
                result.put(key, new DefinitionValue(value, false));
            }
        });
        return result;
    }
}
