package com.talentrelay.relay.model;

import java.util.List;

public record LookupQuery(
    String linkedInUrl,
    String linkedInHandle,
    String profileName,
    List<String> keys
) {
}
