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
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Read-only client for the Gem REST API, used to load the candidate being uploaded.
 */
@Service
public class GemApiClient {
    private static final Logger log = LoggerFactory.getLogger(GemApiClient.class);
    private static final String UPSTREAM = "gem";

    private final RelayProperties.Gem settings;
    private final HttpClient client;
    private final ObjectMapper objectMapper;

    public GemApiClient(
        RelayProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        ObjectMapper objectMapper
    ) {
        this.settings = properties.getGem();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getAshby().getConnectTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.objectMapper = objectMapper;
    }

    public JsonNode getCandidate(String candidateId, WriteAudit audit) {
        String id = candidateId == null ? "" : candidateId.trim();
        if (id.isEmpty()) {
            throw new RelayValidationException("candidateId is required.");
        }
        return get("/v0/candidates/" + URLEncoder.encode(id, StandardCharsets.UTF_8), audit);
    }

    private JsonNode get(String path, WriteAudit audit) {
        if (settings.getApiKey().isEmpty()) {
            throw new RelayValidationException("Server is missing GEM_API_KEY.");
        }
        WriteAudit safeAudit = audit == null ? WriteAudit.background("") : audit;
        String url = settings.getBaseUrl() + path;
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .header("X-API-Key", settings.getApiKey())
            .header("Authorization", "Bearer " + settings.getApiKey())
            .GET()
            .build();

        long startedAt = System.currentTimeMillis();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UpstreamApiException(UPSTREAM, "Gem request failed: " + e.getMessage(), 400, null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamApiException(UPSTREAM, "Gem request interrupted", 400, null, e);
        }
        long durationMs = System.currentTimeMillis() - startedAt;
        String text = response.body() == null ? "" : response.body();
        JsonNode data = parse(text);

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            String message = data != null && data.isObject() && !data.path("message").asText("").isBlank()
                ? data.path("message").asText()
                : (!text.isBlank() ? text : "Gem API request failed with " + response.statusCode());
            log.error(
                "gem.request.error path={} status={} durationMs={} requestId={} route={} message={} response={}",
                path,
                response.statusCode(),
                durationMs,
                safeAudit.requestId(),
                safeAudit.route(),
                message,
                LogRedactor.redact(data)
            );
            throw new UpstreamApiException(UPSTREAM, message, response.statusCode(), data);
        }
        log.info(
            "gem.request.success path={} status={} durationMs={} requestId={} route={} summary=[{}]",
            path,
            response.statusCode(),
            durationMs,
            safeAudit.requestId(),
            safeAudit.route(),
            LogRedactor.summarize(data)
        );
        return data;
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
