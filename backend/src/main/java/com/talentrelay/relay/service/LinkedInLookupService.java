package com.talentrelay.relay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.talentrelay.relay.http.AshbyRpcClient;
import com.talentrelay.relay.http.UpstreamApiException;
import com.talentrelay.relay.index.CandidateIndex;
import com.talentrelay.relay.index.CandidateIndexBuilder;
import com.talentrelay.relay.index.CandidateIndexScheduler;
import com.talentrelay.relay.index.CandidateSummaryMapper;
import com.talentrelay.relay.index.RefreshOptions;
import com.talentrelay.relay.model.CandidateSummary;
import com.talentrelay.relay.model.LinkedInLookupRequest;
import com.talentrelay.relay.model.LinkedInLookupResult;
import com.talentrelay.relay.model.LookupQuery;
import com.talentrelay.relay.model.WriteAudit;
import com.talentrelay.relay.util.LinkedInKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves a LinkedIn profile to an Ashby candidate: index lookup first, then a name search filtered by
 * LinkedIn key, then one forced index refresh and retry.
 */
@Service
public class LinkedInLookupService {
    private static final Logger log = LoggerFactory.getLogger(LinkedInLookupService.class);
    private static final int MAX_COLLISIONS = 9;

    public static final String STRATEGY_INDEX = "index";
    public static final String STRATEGY_NAME_SEARCH = "name_search";
    public static final String STRATEGY_INDEX_REFRESH = "index_refresh";
    public static final String STRATEGY_NONE = "none";

    private final CandidateIndexScheduler scheduler;
    private final AshbyRpcClient rpcClient;
    private final CandidateSummaryMapper mapper;

    public LinkedInLookupService(
        CandidateIndexScheduler scheduler,
        AshbyRpcClient rpcClient,
        CandidateSummaryMapper mapper
    ) {
        this.scheduler = scheduler;
        this.rpcClient = rpcClient;
        this.mapper = mapper;
    }

    public LinkedInLookupResult resolveByLinkedIn(LinkedInLookupRequest request, WriteAudit audit) {
        if (request == null) {
            throw new RelayValidationException("linkedInUrl or linkedInHandle is required.");
        }
        Set<String> keys = lookupKeys(request.linkedInUrl(), request.linkedInHandle());
        if (keys.isEmpty()) {
            throw new RelayValidationException("linkedInUrl or linkedInHandle is required and must point to a LinkedIn profile.");
        }
        String profileName = request.profileName() == null ? "" : request.profileName().trim();
        boolean forceRefresh = request.forceRefreshRequested();
        LookupQuery query = new LookupQuery(request.linkedInUrl(), request.linkedInHandle(), profileName, List.copyOf(keys));

        CandidateIndex cached = scheduler.current();
        CandidateIndex index;
        if (forceRefresh || cached.isBuilt() || profileName.isEmpty()) {
            index = scheduler.ensureFresh(audit, RefreshOptions.blocking());
        } else {
            scheduler.refreshInBackground(audit);
            index = cached;
        }

        List<CandidateSummary> matches = matchIndex(index, keys);
        String strategy = STRATEGY_INDEX;

        if (matches.isEmpty() && !profileName.isEmpty()) {
            matches = searchByName(profileName, keys, audit);
            strategy = STRATEGY_NAME_SEARCH;
        }

        if (matches.isEmpty() && shouldRetryAfterRefresh(index, forceRefresh)) {
            index = scheduler.ensureFresh(audit, RefreshOptions.forced(false));
            matches = matchIndex(index, keys);
            strategy = STRATEGY_INDEX_REFRESH;
        }

        if (matches.isEmpty()) {
            log.info("LinkedIn lookup found no candidate keys={} requestId={}", keys, audit == null ? "" : audit.requestId());
            return new LinkedInLookupResult(false, null, List.of(), STRATEGY_NONE, scheduler.metadata(index), query);
        }
        List<CandidateSummary> collisions = matches.subList(1, Math.min(matches.size(), MAX_COLLISIONS + 1));
        log.info(
            "LinkedIn lookup resolved candidateId={} strategy={} collisions={} requestId={}",
            matches.get(0).id(),
            strategy,
            collisions.size(),
            audit == null ? "" : audit.requestId()
        );
        return new LinkedInLookupResult(
            true,
            matches.get(0),
            List.copyOf(collisions),
            strategy,
            scheduler.metadata(index),
            query
        );
    }

    /**
     * Both inputs are tried; either may be a full URL or a bare handle.
     */
    static Set<String> lookupKeys(String linkedInUrl, String linkedInHandle) {
        Set<String> keys = new LinkedHashSet<>();
        if (linkedInUrl != null && !linkedInUrl.isBlank()) {
            String key = LinkedInKeys.normalize(linkedInUrl);
            if (key == null) {
                key = LinkedInKeys.fromHandle(linkedInUrl);
            }
            if (key != null) {
                keys.add(key);
            }
        }
        String handleKey = LinkedInKeys.fromHandle(linkedInHandle);
        if (handleKey != null) {
            keys.add(handleKey);
        }
        return keys;
    }

    static List<CandidateSummary> matchIndex(CandidateIndex index, Collection<String> keys) {
        Map<String, CandidateSummary> unique = new LinkedHashMap<>();
        for (String key : keys) {
            List<String> ids = index.linkedInToCandidateIds().get(key);
            if (ids == null) {
                continue;
            }
            for (String id : ids) {
                CandidateSummary summary = index.candidatesById().get(id);
                if (summary != null && summary.hasProfileUrl()) {
                    unique.putIfAbsent(id, summary);
                }
            }
        }
        return ordered(unique.values());
    }

    private List<CandidateSummary> searchByName(String profileName, Set<String> keys, WriteAudit audit) {
        JsonNode results;
        try {
            results = rpcClient.results("candidate.search", Map.of("name", profileName), audit);
        } catch (UpstreamApiException e) {
            log.warn("Name search fallback failed for LinkedIn lookup requestId={} status={} error={}",
                audit == null ? "" : audit.requestId(), e.getStatus(), e.getMessage());
            return List.of();
        }
        Map<String, CandidateSummary> unique = new LinkedHashMap<>();
        if (results.isArray()) {
            for (JsonNode row : results) {
                CandidateSummary summary = mapper.toSummary(row);
                if (summary == null || !summary.hasProfileUrl()) {
                    continue;
                }
                for (String key : summary.linkedInKeys()) {
                    if (keys.contains(key)) {
                        unique.putIfAbsent(summary.id(), summary);
                        break;
                    }
                }
            }
        }
        return ordered(unique.values());
    }

    private boolean shouldRetryAfterRefresh(CandidateIndex index, boolean forceRefresh) {
        if (forceRefresh) {
            return true;
        }
        return index.candidateCount() > 0 && (!scheduler.isFresh(index) || !index.isComplete());
    }

    private static List<CandidateSummary> ordered(Collection<CandidateSummary> summaries) {
        List<CandidateSummary> out = new ArrayList<>(summaries);
        out.sort(CandidateIndexBuilder.KEY_ORDER);
        return out;
    }
}
