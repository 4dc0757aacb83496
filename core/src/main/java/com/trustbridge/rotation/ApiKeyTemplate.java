package com.trustbridge.rotation;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shape of provider API keys, selected by the name of the secret key.
 */
@Getter
@AllArgsConstructor
public enum ApiKeyTemplate {
    ANTHROPIC("anthropic", "sk-ant-api03-", 95, RandomSecrets.URL_SAFE, Pattern.compile("^sk-ant-api03-[A-Za-z0-9_-]{95}$")),
    OPENAI("openai", "sk-", 48, RandomSecrets.ALPHANUMERIC, Pattern.compile("^sk-[A-Za-z0-9]{48}$")),
    DEEPSEEK("deepseek", "sk-", 32, RandomSecrets.HEX, Pattern.compile("^sk-[a-f0-9]{32}$")),
    GEMINI("gemini", "AIzaSy", 33, RandomSecrets.URL_SAFE, Pattern.compile("^AIzaSy[A-Za-z0-9_-]{33}$")),
    HUGGINGFACE("huggingface", "hf_", 34, RandomSecrets.ALPHANUMERIC, Pattern.compile("^hf_[A-Za-z0-9]{34}$")),
    GENERIC("generic", "sk-", 48, RandomSecrets.ALPHANUMERIC, Pattern.compile("^sk-[A-Za-z0-9]{48}$"));

    private final String provider;
    private final String prefix;
    private final int randomLength;
    private final String alphabet;
    private final Pattern format;

    public static ApiKeyTemplate forKey(String secretKey) {
        String lower = secretKey == null ? "" : secretKey.toLowerCase(Locale.ROOT);
        for (ApiKeyTemplate template : values()) {
            if (template != GENERIC && lower.contains(template.provider)) {
                return template;
            }
        }
        return GENERIC;
    }

    public boolean matches(String candidate) {
        return candidate != null && format.matcher(candidate).matches();
    }
}
