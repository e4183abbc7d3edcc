package com.talentrelay.relay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.talentrelay.relay.http.AshbyRpcClient;
import com.talentrelay.relay.index.CandidateSummaryMapper;
import com.talentrelay.relay.model.CandidateSummary;
import com.talentrelay.relay.model.SourceProfile;
import com.talentrelay.relay.model.WriteAudit;
import com.talentrelay.relay.util.LinkedInKeys;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds an existing Ashby candidate for a source profile using email and name search.
 */
@Component
public class CandidateMatcher {
    public static final String STRATEGY_LINKEDIN = "search_linkedin";
    public static final String STRATEGY_EMAIL = "search_email";
    public static final String STRATEGY_NAME = "search_name";
    public static final String STRATEGY_FIRST_RESULT = "search_first_result";

    private final AshbyRpcClient rpcClient;
    private final CandidateSummaryMapper mapper;

    public CandidateMatcher(AshbyRpcClient rpcClient, CandidateSummaryMapper mapper) {
        this.rpcClient = rpcClient;
        this.mapper = mapper;
    }

    public Match findExisting(SourceProfile profile, WriteAudit audit) {
        Map<String, CandidateSummary> union = new LinkedHashMap<>();
        if (!isBlank(profile.email())) {
            collect(rpcClient.results("candidate.search", Map.of("email", profile.email()), audit), union);
        }
        if (!isBlank(profile.name())) {
            collect(rpcClient.results("candidate.search", Map.of("name", profile.name()), audit), union);
        }
        return choose(profile, new ArrayList<>(union.values()));
    }

    /**
     * LinkedIn key beats email, email beats full name, and anything beats nothing.
     */
    static Match choose(SourceProfile profile, List<CandidateSummary> candidates) {
        if (candidates.isEmpty()) {
            return null;
        }
        String linkedInKey = LinkedInKeys.normalize(profile.linkedInUrl());
        if (linkedInKey != null) {
            for (CandidateSummary candidate : candidates) {
                if (candidate.linkedInKeys().contains(linkedInKey)) {
                    return new Match(candidate, STRATEGY_LINKEDIN);
                }
            }
        }
        if (!isBlank(profile.email())) {
            String email = profile.email().trim();
            for (CandidateSummary candidate : candidates) {
                if (email.equalsIgnoreCase(trim(candidate.email()))) {
                    return new Match(candidate, STRATEGY_EMAIL);
                }
            }
        }
        if (!isBlank(profile.name())) {
            String name = profile.name().trim();
            for (CandidateSummary candidate : candidates) {
                if (name.equalsIgnoreCase(trim(candidate.name()))) {
                    return new Match(candidate, STRATEGY_NAME);
                }
            }
        }
        return new Match(candidates.get(0), STRATEGY_FIRST_RESULT);
    }

    private void collect(JsonNode results, Map<String, CandidateSummary> into) {
        if (!results.isArray()) {
            return;
        }
        for (JsonNode row : results) {
            CandidateSummary summary = mapper.toSummary(row);
            if (summary != null) {
                into.putIfAbsent(summary.id(), summary);
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }

    public record Match(CandidateSummary candidate, String strategy) {
    }
}
