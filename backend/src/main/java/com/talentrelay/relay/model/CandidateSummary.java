package com.talentrelay.relay.model;

import java.util.List;

public record CandidateSummary(
    String id,
    String name,
    String profileUrl,
    List<String> linkedInUrls,
    List<String> linkedInKeys,
    long updatedAtMs,
    String updatedAt,
    String createdAt,
    String email
) {
    public CandidateSummary {
        linkedInUrls = linkedInUrls == null ? List.of() : List.copyOf(linkedInUrls);
        linkedInKeys = linkedInKeys == null ? List.of() : List.copyOf(linkedInKeys);
    }

    public boolean hasProfileUrl() {
        return profileUrl != null && !profileUrl.isBlank();
    }
}
