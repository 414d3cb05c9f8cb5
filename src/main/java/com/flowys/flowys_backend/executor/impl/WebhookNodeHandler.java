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
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivers the node's inputs to an external URL as JSON.
 *
 * Config shape:
 * {
 *   "url": "https://hooks.example.com/orders",
 *   "method": "POST",
 *   "headers": { "X-Team": "ops" },
 *   "headerMappings": { "X-Order-Id": "order.id" },
 *   "payloadTemplate": { "order": "{{order}}", "note": "Order {{order.id}} ready" },
 *   "secret": "whsec_...",
 *   "timeout": 30000,
 *   "continueOnError": false
 * }
 *
 * With a secret the serialized payload is signed: X-Webhook-Signature: sha256=&lt;hex hmac&gt;.
 */
@Slf4j
@Component
public class WebhookNodeHandler implements NodeHandler {

    static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    static final String USER_AGENT = "Flowys-Workflow/1.0";
    static final long DEFAULT_TIMEOUT_MS = 30_000;

    private static final List<String> METHODS = List.of("GET", "POST", "PUT", "PATCH", "DELETE");

    private final HttpClient httpClient;
    private final PathResolver resolver;
    private final ObjectMapper objectMapper;

    public WebhookNodeHandler(@Qualifier("webhookHttpClient") HttpClient httpClient,
                              PathResolver resolver,
                              ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.resolver = resolver;
        this.objectMapper = objectMapper;
    }

    @Override
    public NodeType supportedType() {
        return NodeType.WEBHOOK;
    }

    @Override
    public NodeResult execute(NodeContext context) {
        Map<String, Object> cfg = context.getConfig();
        String url = ConfigValues.string(cfg, "url");
        if (url == null || url.isBlank()) {
            return NodeResult.failure("Webhook URL is required");
        }
        URI uri;
        try {
            uri = OutboundUrls.parse(url);
        } catch (URISyntaxException e) {
            return NodeResult.failure("Invalid webhook URL: " + url);
        }

        Double configuredTimeout = ConfigValues.number(cfg, "timeout");
        long timeoutMs = configuredTimeout != null && configuredTimeout > 0
                ? configuredTimeout.longValue()
                : DEFAULT_TIMEOUT_MS;
        String method = ConfigValues.string(cfg, "method", "POST").toUpperCase();

        try {
            String payload = objectMapper.writeValueAsString(buildPayload(context));
            HttpRequest request = buildRequest(uri, method, payload, cfg, context.getInputs(), timeoutMs);

            long start = System.currentTimeMillis();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            long duration = System.currentTimeMillis() - start;

            Object responseData = readResponse(response);
            int status = response.statusCode();
            boolean ok = status >= 200 && status < 300;
            log.info("[WebhookNode] {} {} {} -> {} in {}ms", context.getNodeId(), method, uri.getHost(), status, duration);

            if (!ok) {
                if (ConfigValues.flag(cfg, "continueOnError")) {
                    Map<String, Object> output = new LinkedHashMap<>();
                    output.put("success", false);
                    output.put("statusCode", status);
                    output.put("statusText", reasonPhrase(status));
                    output.put("response", responseData);
                    output.put("duration", duration);
                    output.put("url", uri.toString());
                    return NodeResult.ok(output);
                }
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("statusCode", status);
                details.put("response", responseData);
                return NodeResult.failure("Webhook failed with status " + status + ": " + reasonPhrase(status), details);
            }

            Map<String, Object> output = new LinkedHashMap<>();
            output.put("success", true);
            output.put("statusCode", status);
            output.put("response", responseData);
            output.put("duration", duration);
            output.put("url", uri.toString());
            return NodeResult.ok(output);
        } catch (HttpTimeoutException e) {
            return NodeResult.failure("Webhook request timed out after " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return NodeResult.failure("Webhook error: request cancelled");
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            log.warn("[WebhookNode] {} delivery failed: {}", context.getNodeId(), e.getMessage());
            return NodeResult.failure("Webhook error: " + e.getMessage());
        }
    }

    @Override
    public ConfigValidation validateConfig(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        if (!(config.get("url") instanceof String url) || url.isEmpty()) {
            errors.add("url is required and must be a string");
        } else {
            try {
                OutboundUrls.parse(url);
            } catch (URISyntaxException e) {
                errors.add("url must be a valid URL");
            }
        }
        if (config.get("method") != null && !METHODS.contains(config.get("method"))) {
            errors.add("method must be one of: " + String.join(", ", METHODS));
        }
        if (config.get("timeout") != null) {
            if (!(config.get("timeout") instanceof Number t) || t.doubleValue() < 1000 || t.doubleValue() > 120000) {
                errors.add("timeout must be a number between 1000 and 120000 milliseconds");
            }
        }
        return ConfigValidation.of(errors);
    }

    static String sign(String payload, String secret) throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return "sha256=" + HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    }

    private Object buildPayload(NodeContext context) {
        Object template = context.getConfig().get("payloadTemplate");
        if (template instanceof Map<?, ?> || template instanceof List<?>) {
            return resolver.resolveStructure(template, context.templateScope());
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("workflowId", context.getGlobalContext().get("workflowId"));
        meta.put("executionId", context.getGlobalContext().get("executionId"));
        meta.put("nodeId", context.getNodeId());
        meta.put("timestamp", Instant.now().toString());

        Map<String, Object> payload = new LinkedHashMap<>(context.getInputs());
        payload.put("_meta", meta);
        return payload;
    }

    private HttpRequest buildRequest(URI uri, String method, String payload, Map<String, Object> cfg,
                                     Map<String, Object> inputs, long timeoutMs) throws GeneralSecurityException {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("User-Agent", USER_AGENT);
        ConfigValues.map(cfg, "headers").forEach((name, value) -> headers.put(name, String.valueOf(value)));
        ConfigValues.map(cfg, "headerMappings").forEach((name, path) -> {
            Object value = resolver.getNestedValue(inputs, String.valueOf(path));
            if (value != null) {
                headers.put(name, resolver.render(value));
            }
        });
        String secret = ConfigValues.string(cfg, "secret");
        if (secret != null && !secret.isEmpty()) {
            headers.put(SIGNATURE_HEADER, sign(payload, secret));
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofMillis(timeoutMs))
                .method(method, "GET".equals(method)
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(payload));
        headers.forEach(builder::header);
        return builder.build();
    }

    private Object readResponse(HttpResponse<String> response) {
        String body = response.body() != null ? response.body() : "";
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        if (contentType.contains("application/json") && !body.isBlank()) {
            try {
                return objectMapper.readValue(body, Object.class);
            } catch (JsonProcessingException e) {
                log.debug("[WebhookNode] JSON content type but unparsable body, keeping text");
            }
        }
        return body;
    }

    private static String reasonPhrase(int status) {
        HttpStatus known = HttpStatus.resolve(status);
        return known != null ? known.getReasonPhrase() : "";
    }
}
