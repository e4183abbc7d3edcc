package com.talentrelay.relay.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentrelay.config.RelayProperties;
import com.talentrelay.relay.model.WriteAudit;
import com.talentrelay.relay.service.RelayValidationException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AshbyRpcClientTest {
    private static final WriteAudit AUDIT = new WriteAudit("req-1", "/api/test", "", "");

    private MockWebServer server;
    private ExecutorService executor;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void postsJsonWithBasicAuthAndDropsEmptyFields() throws Exception {
        server.enqueue(json(200, "{\"success\":true,\"results\":[{\"id\":\"c1\"}],\"moreDataAvailable\":false}"));
        AshbyRpcClient client = client(properties());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("limit", 100);
        payload.put("cursor", null);
        payload.put("syncToken", "");
        JsonNode response = client.call("/candidate.list", payload, AUDIT);

        assertThat(response.path("results").get(0).path("id").asText()).isEqualTo("c1");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/candidate.list");
        String expectedAuth = "Basic " + Base64.getEncoder().encodeToString("ashby-key:".getBytes(StandardCharsets.UTF_8));
        assertThat(request.getHeader("Authorization")).isEqualTo(expectedAuth);
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("limit").asInt()).isEqualTo(100);
        assertThat(body.has("cursor")).isFalse();
        assertThat(body.has("syncToken")).isFalse();
    }

    @Test
    void httpOkWithoutSuccessFlagIsAFailure() {
        server.enqueue(json(200, "{\"success\":false,\"errorInfo\":{\"message\":\"invalid sync token\"},\"message\":\"ignored\"}"));
        AshbyRpcClient client = client(properties());

        assertThatThrownBy(() -> client.call("candidate.list", Map.of("limit", 1), AUDIT))
            .isInstanceOf(UpstreamApiException.class)
            .hasMessage("invalid sync token")
            .satisfies(error -> {
                UpstreamApiException upstream = (UpstreamApiException) error;
                assertThat(upstream.getUpstream()).isEqualTo("ashby");
                assertThat(upstream.getStatus()).isEqualTo(200);
                assertThat(upstream.getBody().path("success").asBoolean(true)).isFalse();
            });
    }

    @Test
    void errorsArrayIsJoinedWhenNoStructuredMessage() {
        server.enqueue(json(200, "{\"success\":false,\"errors\":[\"first\",\"second\"],\"message\":\"ignored\"}"));
        AshbyRpcClient client = client(properties());

        assertThatThrownBy(() -> client.call("candidate.search", Map.of("name", "Jane"), AUDIT))
            .isInstanceOf(UpstreamApiException.class)
            .hasMessage("first, second");
    }

    @Test
    void nonJsonErrorBodyIsUsedVerbatimWithUpstreamStatus() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("upstream down"));
        AshbyRpcClient client = client(properties());

        assertThatThrownBy(() -> client.call("candidate.search", Map.of("name", "Jane"), AUDIT))
            .isInstanceOf(UpstreamApiException.class)
            .hasMessage("upstream down")
            .satisfies(error -> assertThat(((UpstreamApiException) error).getStatus()).isEqualTo(503));
    }

    @Test
    void emptyErrorBodyFallsBackToStatusMessage() {
        assertThat(AshbyRpcClient.errorMessage(null, "", 502)).isEqualTo("Ashby API request failed with status 502");
    }

    @Test
    void missingApiKeyFailsBeforeAnyRequest() {
        RelayProperties properties = properties();
        properties.getAshby().setApiKey("");
        AshbyRpcClient client = client(properties);

        assertThatThrownBy(() -> client.call("candidate.list", Map.of("limit", 1), AUDIT))
            .isInstanceOf(RelayValidationException.class)
            .hasMessageContaining("ASHBY_API_KEY");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void blockedWriteNeverReachesUpstream() {
        AshbyRpcClient client = client(properties());

        assertThatThrownBy(() -> client.call("candidate.create", Map.of("name", "Jane"), AUDIT))
            .isInstanceOf(WriteBlockedException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    private RelayProperties properties() {
        RelayProperties properties = new RelayProperties();
        properties.getAshby().setApiKey("ashby-key");
        properties.getAshby().setBaseUrl(server.url("/").toString());
        return properties;
    }

    private AshbyRpcClient client(RelayProperties properties) {
        return new AshbyRpcClient(properties, executor, objectMapper, new WriteSafetyGate(properties));
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }
}
