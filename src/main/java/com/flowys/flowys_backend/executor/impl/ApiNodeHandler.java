package com.flowys.flowys_backend.executor.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowys.flowys_backend.executor.ConfigValues;
import com.flowys.flowys_backend.executor.NodeHandler;
import com.flowys.flowys_backend.executor.PathResolver;
import com.flowys.flowys_backend.model.domain.NodeType;
import com.flowys.flowys_backend.model.execution.ConfigValidation;
import com.flowys.flowys_backend.model.execution.NodeContext;
import com.flowys.flowys_backend.model.execution.NodeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Calls an HTTP API and turns the response into node output.
 *
 * Config shape:
 * {
 *   "url":     "https://api.example.com/users/{{userId}}",
 *   "method":  "POST",
 *   "headers": { "Authorization": "Bearer {{token}}" },
 *   "body":    "{\"name\": \"{{name}}\"}",
 *   "responseMapping": { "email": "profile.email" }
 * }
 *
 * Placeholders that resolve to nothing become empty strings here, unlike the other handlers.
 */
@Slf4j
@Component
public class ApiNodeHandler implements NodeHandler {

    static final String PLACEHOLDER_URL = "https://api.example.com/data";

    private static final List<String> METHODS = List.of("GET", "POST", "PUT", "DELETE", "PATCH");
    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");

    private final RestTemplate restTemplate;
    private final PathResolver resolver;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public ApiNodeHandler(RestTemplate restTemplate,
                          PathResolver resolver,
                          ObjectMapper objectMapper,
                          @Value("${flowys.http.api-timeout:30s}") Duration timeout) {
        this.restTemplate = restTemplate;
        this.resolver = resolver;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public NodeType supportedType() {
        return NodeType.API;
    }

    @Override
    public NodeResult execute(NodeContext context) {
        Map<String, Object> config = context.getConfig();
        Map<String, Object> inputs = context.getInputs();

        String url = resolver.interpolateOrBlank(ConfigValues.string(config, "url"), inputs);
        if (url == null || url.isBlank() || PLACEHOLDER_URL.equals(url)) {
            return NodeResult.failure("Please configure a valid API URL. "
                    + "Click on this node and update the 'url' field with your API endpoint.");
        }
        URI uri;
        try {
            uri = OutboundUrls.parse(url);
        } catch (URISyntaxException e) {
            return NodeResult.failure("Invalid URL format: \"" + url + "\". Make sure the URL starts with http:// or https://");
        }

        String method = ConfigValues.string(config, "method", "GET").toUpperCase();
        HttpHeaders headers = new HttpHeaders();
        ConfigValues.map(config, "headers").forEach((name, value) ->
                headers.set(name, resolver.interpolateOrBlank(String.valueOf(value), inputs)));

        String body = null;
        if (config.get("body") != null && BODY_METHODS.contains(method)) {
            try {
                body = renderBody(config.get("body"), inputs);
            } catch (JsonProcessingException e) {
                return NodeResult.failure("API request failed: request body is not serializable: " + e.getOriginalMessage());
            }
            if (!headers.containsKey(HttpHeaders.CONTENT_TYPE)) {
                headers.setContentType(MediaType.APPLICATION_JSON);
            }
        }

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.valueOf(method), new HttpEntity<>(body, headers), String.class);
        } catch (RestClientResponseException ex) {
            return NodeResult.failure(describeErrorStatus(ex));
        } catch (ResourceAccessException ex) {
            return NodeResult.failure(describeIoFailure(context.getNodeId(), ex));
        } catch (RestClientException | IllegalArgumentException ex) {
            log.warn("[ApiNode] {} request to {} failed: {}", context.getNodeId(), uri.getHost(), ex.getMessage());
            return NodeResult.failure("API request failed: " + ex.getMessage());
        }

        Object data;
        MediaType contentType = response.getHeaders().getContentType();
        String responseBody = response.getBody();
        if (contentType != null && contentType.includes(MediaType.APPLICATION_JSON)) {
            try {
                data = responseBody == null || responseBody.isBlank() ? null : objectMapper.readValue(responseBody, Object.class);
            } catch (JsonProcessingException e) {
                return NodeResult.failure("The API returned invalid JSON. Check that the API endpoint returns valid JSON data.");
            }
        } else {
            data = responseBody != null ? responseBody : "";
        }

        return NodeResult.ok(toOutput(data, ConfigValues.map(config, "responseMapping")));
    }

    @Override
    public ConfigValidation validateConfig(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        if (!(config.get("url") instanceof String url) || url.isEmpty()) {
            errors.add("url is required and must be a string");
        }
        if (!METHODS.contains(config.get("method"))) {
            errors.add("method must be GET, POST, PUT, DELETE, or PATCH");
        }
        return ConfigValidation.of(errors);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toOutput(Object data, Map<String, Object> responseMapping) {
        Map<String, Object> output = new LinkedHashMap<>();
        if (!responseMapping.isEmpty() && (data instanceof Map || data instanceof List)) {
            responseMapping.forEach((key, path) -> output.put(key, resolver.getNestedValue(data, String.valueOf(path))));
        } else if (data instanceof List<?> list) {
            output.put("data", list);
            output.put("count", list.size());
        } else if (data instanceof Map<?, ?> map) {
            output.putAll((Map<String, Object>) map);
        } else {
            output.put("response", data);
        }
        return output;
    }

    private String renderBody(Object body, Map<String, Object> inputs) throws JsonProcessingException {
        if (body instanceof String s) {
            return resolver.interpolateOrBlank(s, inputs);
        }
        return objectMapper.writeValueAsString(resolver.resolveStructure(body, inputs));
    }

    private String describeErrorStatus(RestClientResponseException ex) {
        int status = ex.getStatusCode().value();
        String reason = ex.getStatusText();
        if (reason == null || reason.isBlank()) {
            HttpStatus known = HttpStatus.resolve(status);
            reason = known != null ? known.getReasonPhrase() : "";
        }
        String errorBody = ex.getResponseBodyAsString();
        if (errorBody.length() > 200) {
            errorBody = errorBody.substring(0, 200) + "...";
        }
        return "API returned error " + status + " (" + reason + ")"
                + (errorBody.isEmpty() ? "" : ": " + errorBody)
                + ". Check the API URL and any required authentication.";
    }

    private String describeIoFailure(String nodeId, ResourceAccessException ex) {
        if (Thread.currentThread().isInterrupted()) {
            return "API request cancelled";
        }
        Throwable cause = ex.getCause();
        if (cause instanceof HttpTimeoutException || cause instanceof SocketTimeoutException) {
            return "The API request timed out after " + timeout.toSeconds() + " seconds. The server may be slow or unreachable.";
        }
        if (cause instanceof ConnectException || cause instanceof UnknownHostException) {
            return "Could not connect to the API. Check your internet connection and verify the API URL is correct.";
        }
        log.warn("[ApiNode] {} I/O failure: {}", nodeId, ex.getMessage());
        return "API request failed: " + ex.getMessage();
    }
}
