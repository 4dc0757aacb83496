package com.trustbridge.config;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps environment variable names to configuration keys.
 * <p>
 * Well known variables have an explicit mapping, {@code <PROVIDER>_API_KEY} of a known LLM provider maps to
 * {@code llm_providers.direct_keys.<provider>}, everything else is lower-cased with {@code _} turned into {@code .}.
 * Only variables starting with one of the import prefixes are imported, the longest matching prefix is stripped
 * first. The empty prefix imports every variable.
 */
public class EnvKeyMapper {

    static final Map<String, String> EXPLICIT = Map.ofEntries(
            Map.entry("REDIS_URL", "infrastructure.redis.url"),
            Map.entry("REDIS_PASSWORD", "infrastructure.redis.password"),
            Map.entry("PORTKEY_API_KEY", "llm_providers.portkey.api_key"),
            Map.entry("QDRANT_API_KEY", "infrastructure.vector_db.qdrant.api_key"),
            Map.entry("QDRANT_URL", "infrastructure.vector_db.qdrant.url"),
            Map.entry("WEAVIATE_API_KEY", "infrastructure.vector_db.weaviate.api_key"),
            Map.entry("WEAVIATE_URL", "infrastructure.vector_db.weaviate.url"),
            Map.entry("MEM0_API_KEY", "infrastructure_providers.mem0.api_key"),
            Map.entry("N8N_API_KEY", "infrastructure_providers.n8n.api_key"),
            Map.entry("PULUMI_API_KEY", "pulumi.api_key"));

    static final Set<String> LLM_PROVIDERS = Set.of(
            "openai", "anthropic", "deepseek", "gemini", "groq", "mistral", "openrouter",
            "perplexity", "together", "xai", "cohere", "huggingface");

    private static final String API_KEY_SUFFIX = "_API_KEY";

    private final List<String> allowedPrefixes;

    public EnvKeyMapper(Collection<String> allowedPrefixes) {
        this.allowedPrefixes = allowedPrefixes.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    public String toConfigKey(String variable) {
        String explicit = EXPLICIT.get(variable);
        if (explicit != null) {
            return explicit;
        }
        return providerKey(variable).orElseGet(() -> variable.toLowerCase(Locale.ROOT).replace('_', '.'));
    }

    /**
     * @return the configuration key for a variable that should be imported, empty for any other variable
     */
    public Optional<String> mapIfImported(String variable) {
        if (EXPLICIT.containsKey(variable) || providerKey(variable).isPresent()) {
            return Optional.of(toConfigKey(variable));
        }
        for (String prefix : allowedPrefixes) {
            if (variable.startsWith(prefix)) {
                String name = variable.substring(prefix.length());
                return name.isEmpty() ? Optional.empty() : Optional.of(toConfigKey(name));
            }
        }
        return Optional.empty();
    }

    private static Optional<String> providerKey(String variable) {
        if (!variable.endsWith(API_KEY_SUFFIX)) {
            return Optional.empty();
        }
        String provider = variable.substring(0, variable.length() - API_KEY_SUFFIX.length()).toLowerCase(Locale.ROOT);
        return LLM_PROVIDERS.contains(provider) ? Optional.of("llm_providers.direct_keys." + provider) : Optional.empty();
    }
}
