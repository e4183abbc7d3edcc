package com.talentrelay.relay.model;

public record InterviewStage(
    String id,
    String title,
    Integer orderInInterviewPlan
) {
}
