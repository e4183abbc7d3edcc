package com.talentrelay.relay.model;

public record IndexRefreshRequest(
    Boolean forceFull,
    String runId,
    String actionId
) {
}
