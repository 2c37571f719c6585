package com.auraide.sandbox.workspace;

import com.auraide.sandbox.SandboxException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * JSON-over-HTTP client for the workspace service.
 *
 * <p>Every request carries {@code Authorization: Bearer <api-key>}. A non-2xx answer becomes a
 * {@link WorkspaceApiException} carrying the status code; transport failures become a
 * plain {@link SandboxException}.
 */
public class WorkspaceApiClient {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceApiClient.class);

    private final WorkspaceProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WorkspaceApiClient(WorkspaceProperties properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build());
    }

    WorkspaceApiClient(WorkspaceProperties properties, HttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public JsonNode get(String path) {
        return send("GET", path, null, properties.getRequestTimeout());
    }

    public JsonNode post(String path, Object body) {
        return send("POST", path, body, properties.getRequestTimeout());
    }

    /**
     * POST with a longer deadline, for calls that wait on work inside the workspace.
     */
    public JsonNode post(String path, Object body, Duration extraTime) {
        return send("POST", path, body, properties.getRequestTimeout().plus(extraTime));
    }

    public JsonNode put(String path, Object body) {
        return send("PUT", path, body, properties.getRequestTimeout());
    }

    public JsonNode patch(String path, Object body) {
        return send("PATCH", path, body, properties.getRequestTimeout());
    }

    public JsonNode delete(String path) {
        return send("DELETE", path, null, properties.getRequestTimeout());
    }

    JsonNode send(String method, String path, Object body, Duration timeout) {
        HttpRequest.BodyPublisher publisher;
        try {
            publisher = body == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new SandboxException("Cannot serialize workspace request for " + method + " " + path, e);
        }

        var builder = HttpRequest.newBuilder()
                .uri(URI.create(properties.getApiUrl() + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .method(method, publisher);
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        if (properties.hasApiKey()) {
            builder.header("Authorization", "Bearer " + properties.getApiKey());
        }

        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new WorkspaceApiException(response.statusCode(), "Workspace API %s %s failed (HTTP %d): %s"
                        .formatted(method, path, response.statusCode(), response.body()));
            }
            log.debug("Workspace API {} {} -> {}", method, path, response.statusCode());
            String responseBody = response.body();
            if (responseBody == null || responseBody.isBlank()) {
                return MissingNode.getInstance();
            }
            return objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new SandboxException("Workspace API request failed: " + method + " " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted during workspace API request: " + method + " " + path, e);
        }
    }

    /**
     * Builds a query string from the non-null entries, in insertion order.
     */
    static String query(Map<String, ?> params) {
        var joiner = new StringJoiner("&", "?", "");
        joiner.setEmptyValue("");
        params.forEach((key, value) -> {
            if (value != null) {
                joiner.add(encode(key) + "=" + encode(value.toString()));
            }
        });
        return joiner.toString();
    }

    static Map<String, Object> params() {
        return new LinkedHashMap<>();
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
