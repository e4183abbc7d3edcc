package com.talentrelay.relay.index;

import com.talentrelay.config.RelayProperties;
import com.talentrelay.relay.http.UpstreamApiException;
import com.talentrelay.relay.model.IndexMetadata;
import com.talentrelay.relay.model.WriteAudit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;

/**
 * Owns index freshness. Refreshes are single-flight: a caller arriving while one runs attaches to it
 * instead of starting another scan.
 */
@Service
public class CandidateIndexScheduler {
    private static final Logger log = LoggerFactory.getLogger(CandidateIndexScheduler.class);
    private static final Pattern SYNC_TOKEN_FAILURE = Pattern.compile("sync[\\s_-]?token", Pattern.CASE_INSENSITIVE);

    private final CandidateIndexStore store;
    private final CandidateIndexBuilder builder;
    private final ExecutorService refreshExecutor;
    private final RelayProperties.Index settings;
    private final Clock clock;

    public CandidateIndexScheduler(
        CandidateIndexStore store,
        CandidateIndexBuilder builder,
        @Qualifier("indexRefreshExecutor") ExecutorService refreshExecutor,
        RelayProperties properties,
        Clock clock
    ) {
        this.store = store;
        this.builder = builder;
        this.refreshExecutor = refreshExecutor;
        this.settings = properties.getIndex();
        this.clock = clock;
    }

    public CandidateIndex current() {
        return store.current();
    }

    public boolean isFresh(CandidateIndex index) {
        return index != null && index.isFresh(clock.millis(), settings.getTtlSeconds() * 1000L);
    }

    public IndexMetadata metadata() {
        return metadata(store.current());
    }

    public IndexMetadata metadata(CandidateIndex index) {
        CandidateIndex safeIndex = index == null ? CandidateIndex.empty() : index;
        return safeIndex.metadata(clock.millis(), store.isRefreshInFlight());
    }

    public CandidateIndex ensureFresh(WriteAudit audit, RefreshOptions options) {
        RefreshOptions safeOptions = options == null ? RefreshOptions.blocking() : options;
        if (safeOptions.forceRefresh()) {
            return await(refresh(audit, safeOptions.forceFull()));
        }
        CandidateIndex index = store.current();
        if (isFresh(index)) {
            return index;
        }
        if (safeOptions.preferStale() && index.candidateCount() > 0) {
            refreshInBackground(audit);
            return index;
        }
        return await(refresh(audit, safeOptions.forceFull()));
    }

    /**
     * Starts a refresh, or returns the one already in flight. A {@code forceFull} caller that attaches
     * to an incremental refresh gets a full resync chained onto the same handle.
     */
    public CompletableFuture<CandidateIndex> refresh(WriteAudit audit, boolean forceFull) {
        CandidateIndexStore.Claim claim = store.claimRefresh(CompletableFuture::new, forceFull);
        CompletableFuture<CandidateIndex> handle = claim.handle();
        if (!claim.owner()) {
            log.debug("Attaching to in-flight candidate index refresh requestId={} forceFull={}", requestId(audit), forceFull);
            return handle;
        }
        try {
            refreshExecutor.execute(() -> runRefresh(handle, audit, forceFull));
        } catch (RejectedExecutionException e) {
            store.release(handle);
            handle.completeExceptionally(e);
        }
        return handle;
    }

    /**
     * Fire-and-forget refresh. Failures are logged and never reach the caller.
     */
    public void refreshInBackground(WriteAudit audit) {
        try {
            refresh(audit, false).whenComplete((index, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                    log.warn("Background candidate index refresh failed requestId={}: {}", requestId(audit), cause.getMessage(), cause);
                }
            });
        } catch (RuntimeException e) {
            log.warn("Failed to schedule background candidate index refresh requestId={}", requestId(audit), e);
        }
    }

    private void runRefresh(CompletableFuture<CandidateIndex> handle, WriteAudit audit, boolean forceFull) {
        CandidateIndex built = null;
        Throwable failure = null;
        try {
            built = buildWithSyncTokenFallback(audit, forceFull);
            store.install(built);
            while (store.continueWithFullResync(handle)) {
                log.info("Running full candidate index resync queued during refresh requestId={}", requestId(audit));
                built = builder.buildOrExtend(store.current(), audit, true);
                store.install(built);
            }
        } catch (Throwable t) {
            failure = t;
        } finally {
            store.release(handle);
        }
        if (failure != null) {
            handle.completeExceptionally(failure);
        } else {
            handle.complete(built);
        }
    }

    private CandidateIndex buildWithSyncTokenFallback(WriteAudit audit, boolean forceFull) {
        CandidateIndex previous = store.current();
        boolean incremental = CandidateIndexBuilder.usesIncrementalSync(previous, forceFull);
        try {
            return builder.buildOrExtend(previous, audit, forceFull);
        } catch (RuntimeException e) {
            if (!incremental || !isSyncTokenFailure(e)) {
                throw e;
            }
            log.warn(
                "Incremental candidate index refresh rejected the sync token; retrying as full resync requestId={} error={}",
                requestId(audit),
                e.getMessage()
            );
            return builder.buildOrExtend(previous, audit, true);
        }
    }

    static boolean isSyncTokenFailure(Throwable error) {
        if (error == null) {
            return false;
        }
        StringBuilder text = new StringBuilder();
        if (error.getMessage() != null) {
            text.append(error.getMessage());
        }
        if (error instanceof UpstreamApiException upstream && upstream.getBody() != null) {
            text.append(' ').append(upstream.getBody().toString());
        }
        return SYNC_TOKEN_FAILURE.matcher(text).find();
    }

    private static CandidateIndex await(CompletableFuture<CandidateIndex> handle) {
        try {
            return handle.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Candidate index refresh failed", cause);
        }
    }

    private static String requestId(WriteAudit audit) {
        return audit == null ? "" : audit.requestId();
    }
}
