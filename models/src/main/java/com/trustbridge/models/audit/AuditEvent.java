package com.trustbridge.models.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.trustbridge.models.enums.AuditAction;
import com.trustbridge.models.enums.AuditLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * A single entry of the audit trail.
 * <p>
 * The {@code checksum} is computed over every other field when the event is sealed. Any later change to the event
 * makes {@link #verifyIntegrity()} fail, and storage backends refuse to persist events that fail verification.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    /**
     * Unique identifier of the event.
     */
    @Builder.Default
    private String eventId = UUID.randomUUID().toString();

    /**
     * When the audited operation happened, UTC.
     */
    @Builder.Default
    private Instant timestamp = Instant.now();

    private AuditLevel level;

    private AuditAction action;

    /**
     * The resource the operation acted on, e.g. a secret key or a configuration source. Never a secret value.
     */
    private String resource;

    private String message;

    private AuditContext context;

    /**
     * Free-form, already sanitized details of the operation.
     */
    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    @Builder.Default
    private boolean success = true;

    private String errorDetails;

    private Long durationMs;

    private String checksum;

    /**
     * Computes the checksum and stores it on the event.
     *
     * @return this event
     */
    public AuditEvent seal() {
        this.checksum = computeChecksum();
        return this;
    }

    /**
     * Hex encoded SHA-256 over a canonical rendering of every field except the checksum itself.
     */
    public String computeChecksum() {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("eventId", eventId);
        canonical.put("timestamp", timestamp == null ? null : timestamp.toString());
        canonical.put("level", level == null ? null : level.name());
        canonical.put("action", action == null ? null : action.name());
        canonical.put("resource", resource);
        canonical.put("message", message);
        canonical.put("context", context == null ? null : canonicalContext(context));
        canonical.put("data", canonicalValue(data));
        canonical.put("success", success);
        canonical.put("errorDetails", errorDetails);
        canonical.put("durationMs", durationMs);
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(CANONICAL_MAPPER.writeValueAsString(canonical).getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                hex.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException | JsonProcessingException e) {
            throw new IllegalStateException("Unable to compute audit checksum", e);
        }
    }

    /**
     * @return true when the stored checksum matches a fresh computation
     */
    public boolean verifyIntegrity() {
        return checksum != null && Objects.equals(checksum, computeChecksum());
    }

    private static Map<String, Object> canonicalContext(AuditContext context) {
        Map<String, Object> map = new TreeMap<>();
        map.put("userId", context.getUserId());
        map.put("sessionId", context.getSessionId());
        map.put("ipAddress", context.getIpAddress());
        map.put("userAgent", context.getUserAgent());
        map.put("environment", context.getEnvironment());
        map.put("serviceName", context.getServiceName());
        map.put("requestId", context.getRequestId());
        map.put("traceId", context.getTraceId());
        return map;
    }

    // numbers are rendered as text so that a value read back from JSON as Integer matches the Long it was built from
    private static Object canonicalValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonicalValue(v)));
            return sorted;
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> list = new ArrayList<>();
            iterable.forEach(v -> list.add(canonicalValue(v)));
            return list;
        }
        if (value instanceof Number || value instanceof Enum<?> || value instanceof Instant) {
            return value.toString();
        }
        return value;
    }
}
