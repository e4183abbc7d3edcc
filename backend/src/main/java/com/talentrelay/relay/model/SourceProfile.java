package com.talentrelay.relay.model;

/**
 * Canonical profile fields of the candidate being uploaded, as read from Gem.
 */
public record SourceProfile(
    String id,
    String name,
    String email,
    String phone,
    String linkedInUrl
) {
}
