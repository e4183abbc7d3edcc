package com.talentrelay.relay.model;

public record IndexMetadata(
    String builtAt,
    long ageMs,
    boolean isComplete,
    int scannedCount,
    int candidateCount,
    boolean refreshInFlight,
    boolean hasSyncToken
) {
}
