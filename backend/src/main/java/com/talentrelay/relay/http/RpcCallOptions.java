package com.talentrelay.relay.http;

public record RpcCallOptions(String writeConfirmation) {
    private static final RpcCallOptions NONE = new RpcCallOptions("");

    public RpcCallOptions {
        writeConfirmation = writeConfirmation == null ? "" : writeConfirmation.trim();
    }

    public static RpcCallOptions none() {
        return NONE;
    }

    public static RpcCallOptions confirmed(String writeConfirmation) {
        return new RpcCallOptions(writeConfirmation);
    }
}
