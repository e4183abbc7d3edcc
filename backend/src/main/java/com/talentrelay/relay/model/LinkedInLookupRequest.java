package com.talentrelay.relay.model;

public record LinkedInLookupRequest(
    String linkedInUrl,
    String linkedInHandle,
    String profileName,
    Boolean forceRefresh,
    String runId,
    String actionId
) {
    public boolean forceRefreshRequested() {
        return Boolean.TRUE.equals(forceRefresh);
    }
}
