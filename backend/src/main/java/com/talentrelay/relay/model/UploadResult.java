package com.talentrelay.relay.model;

import java.util.List;

public record UploadResult(
    String candidateId,
    String candidateProfileUrl,
    boolean candidateCreated,
    String candidateMatchStrategy,
    String applicationId,
    boolean applicationCreated,
    String jobId,
    String sourceId,
    String creditedToUserId,
    String creditedToUserStrategy,
    StageSelection stage,
    List<String> updatesApplied,
    String currentStageId
) {
}
