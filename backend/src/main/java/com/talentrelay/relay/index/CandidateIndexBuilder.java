package com.talentrelay.relay.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.talentrelay.config.RelayProperties;
import com.talentrelay.relay.http.AshbyRpcClient;
import com.talentrelay.relay.model.CandidateSummary;
import com.talentrelay.relay.model.WriteAudit;
import com.talentrelay.relay.util.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scans {@code candidate.list} into a new {@link CandidateIndex}, either extending the previous snapshot
 * through its sync token or rebuilding from scratch.
 */
@Service
public class CandidateIndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(CandidateIndexBuilder.class);
    static final String LIST_METHOD = "candidate.list";

    /**
     * Same key: most recently updated first, then name, then id so collision lists page stably.
     */
    public static final Comparator<CandidateSummary> KEY_ORDER = Comparator
        .comparingLong(CandidateSummary::updatedAtMs).reversed()
        .thenComparing(summary -> nullToEmpty(summary.name()).toLowerCase(Locale.ROOT))
        .thenComparing(CandidateSummary::id);

    private final AshbyRpcClient rpcClient;
    private final CandidateSummaryMapper mapper;
    private final RelayProperties.Index settings;
    private final Clock clock;

    public CandidateIndexBuilder(
        AshbyRpcClient rpcClient,
        CandidateSummaryMapper mapper,
        RelayProperties properties,
        Clock clock
    ) {
        this.rpcClient = rpcClient;
        this.mapper = mapper;
        this.settings = properties.getIndex();
        this.clock = clock;
    }

    public CandidateIndex buildOrExtend(CandidateIndex previous, WriteAudit audit, boolean forceFull) {
        CandidateIndex base = previous == null ? CandidateIndex.empty() : previous;
        boolean incremental = usesIncrementalSync(base, forceFull);
        Map<String, CandidateSummary> working = incremental
            ? new LinkedHashMap<>(base.candidatesById())
            : new LinkedHashMap<>();
        String syncToken = incremental ? base.syncToken() : "";
        int scanMax = settings.getScanMax();

        String cursor = null;
        int scanned = 0;
        int pages = 0;
        String stopReason;
        while (true) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("limit", settings.getPageSize());
            payload.put("cursor", cursor);
            if (incremental) {
                payload.put("syncToken", base.syncToken());
            }
            JsonNode page = rpcClient.call(LIST_METHOD, payload, audit);
            pages++;

            JsonNode results = page.path("results");
            if (results.isArray()) {
                for (JsonNode row : results) {
                    scanned++;
                    CandidateSummary summary = mapper.toSummary(row);
                    if (summary != null) {
                        working.put(summary.id(), summary);
                    }
                }
            }
            String pageSyncToken = JsonFields.text(page, "syncToken");
            if (!pageSyncToken.isEmpty()) {
                syncToken = pageSyncToken;
            }

            boolean moreData = page.path("moreDataAvailable").asBoolean(false);
            String nextCursor = JsonFields.text(page, "nextCursor");
            if (!moreData) {
                stopReason = "exhausted";
                break;
            }
            if (scanned >= scanMax) {
                stopReason = "scan_cap";
                break;
            }
            if (nextCursor.isEmpty()) {
                stopReason = "missing_cursor";
                log.warn("candidate.list reported more data without a cursor after {} pages; stopping scan", pages);
                break;
            }
            cursor = nextCursor;
        }

        Instant builtAt = clock.instant();
        CandidateIndex index = new CandidateIndex(
            builtAt.toEpochMilli(),
            builtAt.toString(),
            scanned,
            "exhausted".equals(stopReason),
            syncToken,
            Collections.unmodifiableMap(working),
            buildReverseIndex(working)
        );
        log.info(
            "Candidate index {} built: scanned={} candidates={} linkedInKeys={} pages={} stop={} complete={} requestId={}",
            incremental ? "incrementally" : "fully",
            scanned,
            index.candidateCount(),
            index.linkedInToCandidateIds().size(),
            pages,
            stopReason,
            index.isComplete(),
            audit == null ? "" : audit.requestId()
        );
        return index;
    }

    /**
     * Incremental sync needs a populated snapshot with a sync token and no forced full resync.
     */
    public static boolean usesIncrementalSync(CandidateIndex previous, boolean forceFull) {
        return !forceFull && previous != null && previous.candidateCount() > 0 && previous.hasSyncToken();
    }

    /**
     * Rebuilds the whole LinkedIn-key index from the candidate map. Never patched incrementally.
     */
    public static Map<String, List<String>> buildReverseIndex(Map<String, CandidateSummary> candidatesById) {
        Map<String, List<CandidateSummary>> grouped = new LinkedHashMap<>();
        for (CandidateSummary summary : candidatesById.values()) {
            Set<String> keys = new LinkedHashSet<>(summary.linkedInKeys());
            for (String key : keys) {
                grouped.computeIfAbsent(key, ignored -> new ArrayList<>()).add(summary);
            }
        }
        Map<String, List<String>> reverse = new LinkedHashMap<>();
        for (Map.Entry<String, List<CandidateSummary>> entry : grouped.entrySet()) {
            List<CandidateSummary> ordered = new ArrayList<>(entry.getValue());
            ordered.sort(KEY_ORDER);
            List<String> ids = new ArrayList<>(ordered.size());
            for (CandidateSummary summary : ordered) {
                ids.add(summary.id());
            }
            reverse.put(entry.getKey(), List.copyOf(ids));
        }
        return Collections.unmodifiableMap(reverse);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
