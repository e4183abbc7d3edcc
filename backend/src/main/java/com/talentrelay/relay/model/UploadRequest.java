package com.talentrelay.relay.model;

public record UploadRequest(
    String gemCandidateId,
    String jobId,
    String jobName,
    String writeConfirmation,
    String runId,
    String actionId
) {
}
