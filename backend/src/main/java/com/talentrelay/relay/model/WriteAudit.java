package com.talentrelay.relay.model;

/**
 * Correlation ids carried through every upstream call made on behalf of one relay request.
 */
public record WriteAudit(
    String requestId,
    String route,
    String runId,
    String actionId
) {
    public WriteAudit {
        requestId = requestId == null ? "" : requestId;
        route = route == null ? "" : route;
        runId = runId == null ? "" : runId;
        actionId = actionId == null ? "" : actionId;
    }

    public static WriteAudit background(String route) {
        return new WriteAudit("", route, "", "");
    }
}
