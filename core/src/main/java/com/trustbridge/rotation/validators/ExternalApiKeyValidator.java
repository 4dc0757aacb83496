package com.trustbridge.rotation.validators;

import com.trustbridge.configuration.properties.RotationProperties;
import com.trustbridge.models.enums.RotationType;
import com.trustbridge.models.rotation.RotationPolicy;
import com.trustbridge.models.rotation.ValidationOutcome;
import com.trustbridge.rotation.ApiKeyTemplate;
import com.trustbridge.spi.SecretValidator;
import com.trustbridge.utils.CloseableReentrantLock;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Asks the provider whether an API key is accepted by calling a cheap authenticated endpoint.
 * 200 is valid, 401 and 403 are invalid. Any other answer is inconclusive and only fails the validation in
 * strict mode.
 */
@Slf4j
public class ExternalApiKeyValidator implements SecretValidator {

    public static final String NAME = "external";

    private final OkHttpClient httpClient;
    private final RotationProperties.ExternalValidation properties;
    private final Clock clock;
    private final CloseableReentrantLock lock = new CloseableReentrantLock();
    private final Map<String, Deque<Instant>> callsByProvider = new HashMap<>();

    public ExternalApiKeyValidator(RotationProperties.ExternalValidation properties, Clock clock) {
        this(new OkHttpClient.Builder()
                .callTimeout(properties.getTimeout())
                .build(), properties, clock);
    }

    public ExternalApiKeyValidator(OkHttpClient httpClient, RotationProperties.ExternalValidation properties, Clock clock) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public boolean supports(RotationType rotationType) {
        return rotationType == RotationType.API_KEY;
    }

    @Override
    public ValidationOutcome validate(RotationPolicy policy, String candidate) {
        ApiKeyTemplate template = ApiKeyTemplate.forKey(policy.getSecretKey());
        String endpoint = properties.getEndpoints().get(template.getProvider());
        if (endpoint == null) {
            return ValidationOutcome.valid(NAME);
        }
        if (!acquireCall(template.getProvider())) {
            log.warn("Rate limit reached for {} key validation", template.getProvider());
            return inconclusive("rate limit reached for " + template.getProvider());
        }
        Request.Builder request = new Request.Builder().url(endpoint).get();
        if (template == ApiKeyTemplate.ANTHROPIC) {
            request.header("x-api-key", candidate).header("anthropic-version", "2023-06-01");
        } else {
            request.header("Authorization", "Bearer " + candidate);
        }
        try (Response response = httpClient.newCall(request.build()).execute()) {
            int code = response.code();
            if (code == 200) {
                return ValidationOutcome.valid(NAME);
            }
            if (code == 401 || code == 403) {
                return ValidationOutcome.invalid(NAME, template.getProvider() + " rejected the key with HTTP " + code);
            }
            return inconclusive(template.getProvider() + " answered HTTP " + code);
        } catch (IOException e) {
            log.warn("Validating a {} key failed: {}", template.getProvider(), e.getMessage());
            return inconclusive("provider unreachable: " + e.getMessage());
        }
    }

    private ValidationOutcome inconclusive(String message) {
        return properties.isStrict()
                ? ValidationOutcome.invalid(NAME, message)
                : new ValidationOutcome(true, NAME, "inconclusive: " + message);
    }

    private boolean acquireCall(String provider) {
        Instant now = clock.instant();
        Instant windowStart = now.minus(Duration.ofHours(1));
        try (var ignored = lock.lockAsResource()) {
            Deque<Instant> calls = callsByProvider.computeIfAbsent(provider, p -> new ArrayDeque<>());
            while (!calls.isEmpty() && !calls.peekFirst().isAfter(windowStart)) {
                calls.pollFirst();
            }
            if (calls.size() >= properties.getRateLimitPerHour()) {
                return false;
            }
            calls.addLast(now);
            return true;
        }
    }
}
