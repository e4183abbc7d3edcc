package com.talentrelay.relay.http;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An upstream API call failed. Carries the upstream HTTP status and the parsed body for diagnostics.
 */
public class UpstreamApiException extends RuntimeException {
    private final String upstream;
    private final int status;
    private final transient JsonNode body;

    public UpstreamApiException(String upstream, String message, int status, JsonNode body) {
        super(message);
        this.upstream = upstream;
        this.status = status;
        this.body = body;
    }

    public UpstreamApiException(String upstream, String message, int status, JsonNode body, Throwable cause) {
        super(message, cause);
        this.upstream = upstream;
        this.status = status;
        this.body = body;
    }

    public String getUpstream() {
        return upstream;
    }

    public int getStatus() {
        return status;
    }

    public JsonNode getBody() {
        return body;
    }
}
