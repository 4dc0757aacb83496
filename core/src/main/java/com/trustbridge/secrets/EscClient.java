package com.trustbridge.secrets;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustbridge.configuration.properties.EscProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP client for the remote environment store.
 * <ul>
 *     <li>{@code GET /api/environments/{org}/{environment}} returns {@code {"values": {...}}}</li>
 *     <li>{@code PUT /api/environments/{org}/{environment}} replaces the whole tree</li>
 *     <li>{@code GET /api/user} is the health probe</li>
 * </ul>
 * Failures are logged and reported as empty results, never thrown.
 */
@Slf4j
public class EscClient implements AutoCloseable {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> TREE = new TypeReference<>() {
    };

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final String organization;
    private final String apiToken;
    private final ObjectMapper objectMapper;

    public EscClient(EscProperties escProperties, ObjectMapper objectMapper) {
        this(new OkHttpClient.Builder()
                        .connectTimeout(escProperties.getConnectTimeout())
                        .readTimeout(escProperties.getReadTimeout())
                        .writeTimeout(escProperties.getReadTimeout())
                        .build(),
                escProperties, objectMapper);
    }

    public EscClient(OkHttpClient httpClient, EscProperties escProperties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.baseUrl = HttpUrl.get(escProperties.getBaseUrl());
        this.organization = escProperties.getOrganization();
        this.apiToken = escProperties.getApiToken();
        this.objectMapper = objectMapper;
    }

    /**
     * @return the value tree of the environment, or empty if it could not be fetched
     */
    public Optional<Map<String, Object>> getEnvironment(String environment) {
        Request request = authorized(new Request.Builder().url(environmentUrl(environment)).get()).build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() != 200) {
                log.warn("Fetching environment {} returned HTTP {}", environment, response.code());
                return Optional.empty();
            }
            ResponseBody body = response.body();
            if (body == null) {
                return Optional.of(new LinkedHashMap<>());
            }
            Map<String, Object> document = objectMapper.readValue(body.string(), TREE);
            Object values = document == null ? null : document.get("values");
            if (values instanceof Map<?, ?>) {
                return Optional.of(objectMapper.convertValue(values, TREE));
            }
            return Optional.of(new LinkedHashMap<>());
        } catch (IOException e) {
            log.warn("Fetching environment {} failed: {}", environment, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Replaces the whole value tree of the environment.
     */
    public boolean putEnvironment(String environment, Map<String, Object> values) {
        try {
            String json = objectMapper.writeValueAsString(Map.of("values", values));
            Request request = authorized(new Request.Builder().url(environmentUrl(environment)).put(RequestBody.create(json, JSON))).build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("Updating environment {} returned HTTP {}", environment, response.code());
                    return false;
                }
                return true;
            }
        } catch (IOException e) {
            log.warn("Updating environment {} failed: {}", environment, e.getMessage());
            return false;
        }
    }

    public boolean ping() {
        HttpUrl url = baseUrl.newBuilder().addPathSegments("api/user").build();
        Request request = authorized(new Request.Builder().url(url).get()).build();
        try (Response response = httpClient.newCall(request).execute()) {
            return response.code() == 200;
        } catch (IOException e) {
            log.debug("Health probe failed: {}", e.getMessage());
            return false;
        }
    }

    private HttpUrl environmentUrl(String environment) {
        return baseUrl.newBuilder()
                .addPathSegments("api/environments")
                .addPathSegment(organization)
                .addPathSegment(environment)
                .build();
    }

    private Request.Builder authorized(Request.Builder builder) {
        if (apiToken != null && !apiToken.isBlank()) {
            builder.header("Authorization", "Bearer " + apiToken);
        }
        return builder.header("Accept", "application/json");
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
