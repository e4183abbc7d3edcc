package com.talentrelay.relay.model;

import java.util.List;

public record LinkedInLookupResult(
    boolean found,
    CandidateSummary candidate,
    List<CandidateSummary> collisions,
    String strategy,
    IndexMetadata index,
    LookupQuery query
) {
}
