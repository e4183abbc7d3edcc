package com.talentrelay.relay.index;

import com.talentrelay.relay.model.CandidateSummary;
import com.talentrelay.relay.model.IndexMetadata;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the candidate identity index. A refresh never mutates a snapshot; it builds a new
 * one and swaps it in, so a reader holding a reference always sees a consistent view.
 *
 * @param isComplete true only when the last scan exhausted the upstream feed before hitting the scan cap
 * @param syncToken opaque cursor for incremental resync, empty when the upstream issued none
 * @param linkedInToCandidateIds normalized LinkedIn key to candidate ids, most recently updated first
 */
public record CandidateIndex(
    long builtAtMs,
    String builtAt,
    int scannedCount,
    boolean isComplete,
    String syncToken,
    Map<String, CandidateSummary> candidatesById,
    Map<String, List<String>> linkedInToCandidateIds
) {
    private static final CandidateIndex EMPTY = new CandidateIndex(0L, "", 0, false, "", Map.of(), Map.of());

    public CandidateIndex {
        builtAt = builtAt == null ? "" : builtAt;
        syncToken = syncToken == null ? "" : syncToken;
        candidatesById = candidatesById == null ? Map.of() : candidatesById;
        linkedInToCandidateIds = linkedInToCandidateIds == null ? Map.of() : linkedInToCandidateIds;
    }

    public static CandidateIndex empty() {
        return EMPTY;
    }

    public boolean isBuilt() {
        return builtAtMs > 0;
    }

    public int candidateCount() {
        return candidatesById.size();
    }

    public boolean hasSyncToken() {
        return !syncToken.isBlank();
    }

    public boolean isFresh(long nowMs, long ttlMs) {
        return isBuilt() && nowMs - builtAtMs <= ttlMs;
    }

    public IndexMetadata metadata(long nowMs, boolean refreshInFlight) {
        return new IndexMetadata(
            builtAt,
            isBuilt() ? Math.max(0L, nowMs - builtAtMs) : -1L,
            isComplete,
            scannedCount,
            candidateCount(),
            refreshInFlight,
            hasSyncToken()
        );
    }
}
