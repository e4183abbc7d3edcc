package com.talentrelay.relay.model;

public record CreditedUserResolution(
    String userId,
    String strategy
) {
    public static CreditedUserResolution unresolved() {
        return new CreditedUserResolution(null, "unresolved");
    }

    public boolean isResolved() {
        return userId != null && !userId.isBlank();
    }
}
