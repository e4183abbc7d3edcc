package com.talentrelay.relay.service;

import com.talentrelay.relay.model.InterviewStage;
import com.talentrelay.relay.model.StageSelection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StageSelectorTest {
    private final StageSelector selector = new StageSelector();

    @Test
    void recruiterScreenBeatsLeadRegardlessOfListOrder() {
        StageSelection selection = selector.pickStage(List.of(
            new InterviewStage("s1", "Lead", 1),
            new InterviewStage("s2", "Recruiter Screen", 2),
            new InterviewStage("s3", "Onsite", 3)
        ));

        assertThat(selection.stage().id()).isEqualTo("s2");
        assertThat(selection.strategy()).isEqualTo("recruiter_screen_exact");
    }

    @Test
    void fallsBackToEarliestStageInPlan() {
        StageSelection selection = selector.pickStage(List.of(
            new InterviewStage("sourced", "Sourced", 2),
            new InterviewStage("onsite", "Onsite", 1)
        ));

        assertThat(selection.stage().id()).isEqualTo("onsite");
        assertThat(selection.strategy()).isEqualTo("earliest_by_order");
    }

    @Test
    void titlesAreComparedCaseAndWhitespaceInsensitively() {
        StageSelection selection = selector.pickStage(List.of(
            new InterviewStage("s1", "Phone   RECRUITING  screen", 4),
            new InterviewStage("s2", "  recruiting screen ", 5)
        ));

        assertThat(selection.stage().id()).isEqualTo("s2");
        assertThat(selection.strategy()).isEqualTo("recruiting_screen_exact");
    }

    @Test
    void looserRulesApplyInOrder() {
        assertThat(selector.pickStage(List.of(
            new InterviewStage("s1", "Initial Recruiting Screen Call", 1),
            new InterviewStage("s2", "Lead", 0)
        )).strategy()).isEqualTo("recruiting_screen_contains");
        assertThat(selector.pickStage(List.of(
            new InterviewStage("s1", "Recruiter: phone screen", 1)
        )).strategy()).isEqualTo("recruit_and_screen_tokens");
        assertThat(selector.pickStage(List.of(
            new InterviewStage("s1", "New Leads", 3),
            new InterviewStage("s2", "Applied", 1)
        )).strategy()).isEqualTo("lead_contains");
    }

    @Test
    void emptyInputSelectsNothing() {
        assertThat(selector.pickStage(List.of())).isEqualTo(StageSelection.none());
        assertThat(selector.pickStage(null).stage()).isNull();
    }

    @Test
    void stagesWithoutOrderSortLast() {
        StageSelection selection = selector.pickStage(List.of(
            new InterviewStage("s1", "Applied", null),
            new InterviewStage("s2", "Onsite", 7)
        ));

        assertThat(selection.stage().id()).isEqualTo("s2");
    }
}
