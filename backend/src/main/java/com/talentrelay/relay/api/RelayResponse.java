package com.talentrelay.relay.api;

public record RelayResponse<T>(
    boolean ok,
    T data,
    String requestId
) {
    public static <T> RelayResponse<T> success(T data, String requestId) {
        return new RelayResponse<>(true, data, requestId);
    }
}
