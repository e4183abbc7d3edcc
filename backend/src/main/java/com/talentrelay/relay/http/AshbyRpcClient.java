package com.talentrelay.relay.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentrelay.config.RelayProperties;
import com.talentrelay.relay.model.WriteAudit;
import com.talentrelay.relay.service.RelayValidationException;
import com.talentrelay.relay.util.LogRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Authenticated POST client for the Ashby RPC API. Every call passes through the {@link WriteSafetyGate}
 * before anything is sent.
 */
@Service
public class AshbyRpcClient {
    private static final Logger log = LoggerFactory.getLogger(AshbyRpcClient.class);
    private static final String UPSTREAM = "ashby";
    private static final int DEFAULT_ERROR_STATUS = 400;

    private final RelayProperties.Ashby settings;
    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final WriteSafetyGate writeSafetyGate;

    public AshbyRpcClient(
        RelayProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        ObjectMapper objectMapper,
        WriteSafetyGate writeSafetyGate
    ) {
        this.settings = properties.getAshby();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(settings.getConnectTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.objectMapper = objectMapper;
        this.writeSafetyGate = writeSafetyGate;
    }

    public JsonNode call(String methodName, Map<String, ?> payload, WriteAudit audit) {
        return call(methodName, payload, audit, RpcCallOptions.none());
    }

    /**
     * Sends one RPC call and returns the decoded envelope. Only a body with {@code success: true} counts
     * as success; anything else raises an {@link UpstreamApiException}.
     */
    public JsonNode call(String methodName, Map<String, ?> payload, WriteAudit audit, RpcCallOptions options) {
        if (settings.getApiKey().isEmpty()) {
            throw new RelayValidationException("Server is missing ASHBY_API_KEY.");
        }
        String method = WriteSafetyGate.normalizeMethodName(methodName);
        if (method.isEmpty()) {
            throw new RelayValidationException("Ashby method name is required.");
        }
        WriteAudit safeAudit = audit == null ? WriteAudit.background("") : audit;
        writeSafetyGate.guard(method, payload, safeAudit, options);

        String url = settings.getBaseUrl() + "/" + method;
        Map<String, Object> body = omitEmpty(payload);
        String json = serialize(method, body);
        if (log.isDebugEnabled()) {
            log.debug(
                "ashby.request.start method={} requestId={} route={} runId={} actionId={} payload={}",
                method,
                safeAudit.requestId(),
                safeAudit.route(),
                safeAudit.runId(),
                safeAudit.actionId(),
                LogRedactor.redact(objectMapper.valueToTree(body))
            );
        }

        long startedAt = System.currentTimeMillis();
        HttpResponse<String> response = send(method, url, json, safeAudit);
        long durationMs = System.currentTimeMillis() - startedAt;
        String text = response.body() == null ? "" : response.body();
        JsonNode parsed = parse(text);

        boolean transportOk = response.statusCode() >= 200 && response.statusCode() < 300;
        boolean success = transportOk
            && parsed != null
            && parsed.isObject()
            && parsed.path("success").isBoolean()
            && parsed.path("success").booleanValue();
        if (!success) {
            String message = errorMessage(parsed, text, response.statusCode());
            int status = response.statusCode() > 0 ? response.statusCode() : DEFAULT_ERROR_STATUS;
            log.error(
                "ashby.request.error method={} status={} durationMs={} requestId={} route={} runId={} actionId={} message={} response={}",
                method,
                response.statusCode(),
                durationMs,
                safeAudit.requestId(),
                safeAudit.route(),
                safeAudit.runId(),
                safeAudit.actionId(),
                message,
                LogRedactor.redact(parsed)
            );
            throw new UpstreamApiException(UPSTREAM, message, status, parsed);
        }

        log.info(
            "ashby.request.success method={} status={} durationMs={} requestId={} route={} runId={} actionId={} summary=[{}]",
            method,
            response.statusCode(),
            durationMs,
            safeAudit.requestId(),
            safeAudit.route(),
            safeAudit.runId(),
            safeAudit.actionId(),
            LogRedactor.summarize(parsed.get("results"))
        );
        return parsed;
    }

    /**
     * Convenience for callers that only need {@code results}.
     */
    public JsonNode results(String methodName, Map<String, ?> payload, WriteAudit audit) {
        return call(methodName, payload, audit).path("results");
    }

    static Map<String, Object> omitEmpty(Map<String, ?> payload) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (payload == null) {
            return out;
        }
        for (Map.Entry<String, ?> entry : payload.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (value instanceof CharSequence sequence && sequence.length() == 0) {
                continue;
            }
            out.put(entry.getKey(), value);
        }
        return out;
    }

    static String errorMessage(JsonNode parsed, String text, int status) {
        if (parsed != null && parsed.isObject()) {
            String structured = parsed.path("errorInfo").path("message").asText("");
            if (!structured.isBlank()) {
                return structured;
            }
            JsonNode errors = parsed.path("errors");
            if (errors.isArray() && errors.size() > 0) {
                List<String> parts = new ArrayList<>();
                for (JsonNode error : errors) {
                    parts.add(error.isTextual() ? error.asText() : error.toString());
                }
                String joined = String.join(", ", parts);
                if (!joined.isBlank()) {
                    return joined;
                }
            }
            String message = parsed.path("message").asText("");
            if (!message.isBlank()) {
                return message;
            }
        }
        if (text != null && !text.isBlank()) {
            return text;
        }
        return "Ashby API request failed with status " + status;
    }

    private HttpResponse<String> send(String method, String url, String json, WriteAudit audit) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .header("Authorization", authorizationHeader())
            .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
            .build();
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("ashby.request.error method={} requestId={} transport={}", method, audit.requestId(), e.getMessage());
            throw new UpstreamApiException(UPSTREAM, "Ashby request failed: " + e.getMessage(), DEFAULT_ERROR_STATUS, null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamApiException(UPSTREAM, "Ashby request interrupted", DEFAULT_ERROR_STATUS, null, e);
        }
    }

    private String authorizationHeader() {
        String credentials = settings.getApiKey() + ":";
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private String serialize(String method, Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new RelayValidationException("Unable to serialize payload for " + method + ": " + e.getOriginalMessage());
        }
    }

    private JsonNode parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return objectMapper.getNodeFactory().textNode(text);
        }
    }
}
