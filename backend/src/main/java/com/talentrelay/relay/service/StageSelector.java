package com.talentrelay.relay.service;

import com.talentrelay.relay.model.InterviewStage;
import com.talentrelay.relay.model.StageSelection;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Picks the interview stage a sourced candidate should land in. Rules are tried in order and the first
 * rule with a match wins; within a rule the first stage in list order wins.
 */
@Component
public class StageSelector {
    private static final List<Rule> RULES = List.of(
        new Rule("recruiting_screen_exact", title -> title.equals("recruiting screen")),
        new Rule("recruiter_screen_exact", title -> title.equals("recruiter screen")),
        new Rule("recruiting_screen_contains", title -> title.contains("recruiting screen")),
        new Rule("recruiter_screen_contains", title -> title.contains("recruiter screen")),
        new Rule("recruit_and_screen_tokens", title -> title.contains("recruit") && title.contains("screen")),
        new Rule("lead_exact", title -> title.equals("lead")),
        new Rule("lead_contains", title -> title.contains("lead"))
    );

    public StageSelection pickStage(List<InterviewStage> stages) {
        if (stages == null || stages.isEmpty()) {
            return StageSelection.none();
        }
        for (Rule rule : RULES) {
            for (InterviewStage stage : stages) {
                if (stage != null && rule.matches().test(normalizeTitle(stage.title()))) {
                    return new StageSelection(stage, rule.strategy());
                }
            }
        }
        InterviewStage earliest = null;
        for (InterviewStage stage : stages) {
            if (stage == null) {
                continue;
            }
            if (earliest == null || order(stage) < order(earliest)) {
                earliest = stage;
            }
        }
        return earliest == null ? StageSelection.none() : new StageSelection(earliest, "earliest_by_order");
    }

    static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        return title.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static int order(InterviewStage stage) {
        return stage.orderInInterviewPlan() == null ? Integer.MAX_VALUE : stage.orderInInterviewPlan();
    }

    private record Rule(String strategy, Predicate<String> matches) {
    }
}
