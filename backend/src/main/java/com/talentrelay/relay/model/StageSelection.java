package com.talentrelay.relay.model;

/**
 * The picked stage and the name of the rule that picked it. The strategy is only reported, never branched on.
 */
public record StageSelection(
    InterviewStage stage,
    String strategy
) {
    public static StageSelection none() {
        return new StageSelection(null, "none");
    }
}
