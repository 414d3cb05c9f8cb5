package com.flowys.flowys_backend.integration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic authenticated HTTP call. The connection holds the auth material and optionally a
 * baseUrl in its metadata; the node supplies url (or path), method, headers and body.
 *
 * Credentials, first match wins:
 *   accessToken (+ tokenType)       -> Authorization: Bearer ...
 *   apiKey (+ headerName, prefix)   -> Authorization: Bearer ... or a custom header
 *   username + password             -> Authorization: Basic ...
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpRequestIntegration implements Integration {

    static final String ID = "http-request";
    static final String ACTION_REQUEST = "request";

    private static final IntegrationDefinition DEFINITION = new IntegrationDefinition(
            ID,
            "HTTP Request",
            "Call any HTTP API using credentials stored in a connection",
            IntegrationDefinition.AuthType.API_KEY,
            List.of(new IntegrationAction(ACTION_REQUEST, "Send request",
                    "Send an HTTP request and return status, headers and body",
                    List.of("url", "path", "method", "headers", "body"))));

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public IntegrationDefinition definition() {
        return DEFINITION;
    }

    @Override
    @SuppressWarnings("unchecked")
    public ActionResult executeAction(String actionId, ActionContext context) {
        if (!ACTION_REQUEST.equals(actionId)) {
            return ActionResult.failure("Unknown action: " + actionId);
        }
        Map<String, Object> input = context.input();
        String url = buildUrl(context.connection(), input);
        if (url == null) {
            return ActionResult.failure("url is required (or a baseUrl on the connection plus a path)");
        }
        String method = input.get("method") instanceof String m ? m.toUpperCase() : "GET";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (input.get("headers") instanceof Map<?, ?> extra) {
            ((Map<String, Object>) extra).forEach((k, v) -> headers.set(k, String.valueOf(v)));
        }
        applyAuth(context.connection(), headers);

        Object body = "GET".equals(method) ? null : input.get("body");
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    url, HttpMethod.valueOf(method), new HttpEntity<>(body, headers), String.class);
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("statusCode", response.getStatusCode().value());
            output.put("body", parseBody(response.getBody()));
            output.put("headers", response.getHeaders().toSingleValueMap());
            return ActionResult.ok(output);
        } catch (HttpStatusCodeException ex) {
            return ActionResult.failure("Request failed with status " + ex.getStatusCode().value()
                    + ": " + ex.getResponseBodyAsString());
        } catch (RestClientException | IllegalArgumentException ex) {
            log.warn("[Integration:{}] {} {} failed: {}", ID, method, url, ex.getMessage());
            return ActionResult.failure(ex.getMessage());
        }
    }

    private String buildUrl(ConnectionData connection, Map<String, Object> input) {
        if (input.get("url") instanceof String url && !url.isBlank()) {
            return url;
        }
        Object baseUrl = connection.metadata() != null ? connection.metadata().get("baseUrl") : null;
        if (!(baseUrl instanceof String base) || base.isBlank()) {
            return null;
        }
        String path = input.get("path") instanceof String p ? p : "";
        if (path.isEmpty()) return base;
        return base.replaceAll("/+$", "") + "/" + path.replaceAll("^/+", "");
    }

    private void applyAuth(ConnectionData connection, HttpHeaders headers) {
        String accessToken = connection.credential("accessToken");
        String apiKey = connection.credential("apiKey");
        String username = connection.credential("username");
        String password = connection.credential("password");

        if (accessToken != null) {
            String tokenType = connection.credential("tokenType");
            headers.set(HttpHeaders.AUTHORIZATION, (tokenType != null ? tokenType : "Bearer") + " " + accessToken);
        } else if (apiKey != null) {
            String headerName = connection.credential("headerName");
            String prefix = connection.credential("prefix");
            if (headerName == null || HttpHeaders.AUTHORIZATION.equalsIgnoreCase(headerName)) {
                headers.set(HttpHeaders.AUTHORIZATION, (prefix != null ? prefix : "Bearer") + " " + apiKey);
            } else {
                headers.set(headerName, prefix != null ? prefix + " " + apiKey : apiKey);
            }
        } else if (username != null && password != null) {
            String encoded = Base64.getEncoder()
                    .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
            headers.set(HttpHeaders.AUTHORIZATION, "Basic " + encoded);
        }
    }

    private Object parseBody(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            return body;
        }
    }
}
