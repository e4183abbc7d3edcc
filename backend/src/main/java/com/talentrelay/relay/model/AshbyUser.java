package com.talentrelay.relay.model;

public record AshbyUser(
    String id,
    String firstName,
    String lastName,
    String email,
    boolean enabled
) {
}
