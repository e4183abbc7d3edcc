package com.talentrelay.relay.index;

import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Process-wide holder of the current index snapshot and of the single in-flight refresh handle.
 */
@Component
public class CandidateIndexStore {
    private final AtomicReference<CandidateIndex> current = new AtomicReference<>(CandidateIndex.empty());
    private final Object refreshLock = new Object();
    private CompletableFuture<CandidateIndex> inFlight;
    private boolean inFlightFull;
    private boolean pendingFullResync;

    public CandidateIndex current() {
        return current.get();
    }

    public void install(CandidateIndex index) {
        current.set(index == null ? CandidateIndex.empty() : index);
    }

    public boolean isRefreshInFlight() {
        synchronized (refreshLock) {
            return inFlight != null;
        }
    }

    /**
     * Returns the in-flight refresh if there is one, otherwise registers the handle produced by
     * {@code starter}. {@link Claim#owner()} tells the caller whether it must run the refresh.
     * A full resync requested while an incremental refresh runs is queued on that refresh.
     */
    public Claim claimRefresh(Supplier<CompletableFuture<CandidateIndex>> starter, boolean forceFull) {
        synchronized (refreshLock) {
            if (inFlight != null) {
                if (forceFull && !inFlightFull) {
                    pendingFullResync = true;
                }
                return new Claim(inFlight, false);
            }
            inFlight = starter.get();
            inFlightFull = forceFull;
            pendingFullResync = false;
            return new Claim(inFlight, true);
        }
    }

    /**
     * Called by the refresh owner once a build is installed. Returns {@code true} and keeps the handle
     * when a full resync was queued meanwhile; otherwise releases the handle and returns {@code false}.
     */
    public boolean continueWithFullResync(CompletableFuture<CandidateIndex> handle) {
        synchronized (refreshLock) {
            if (inFlight != handle) {
                return false;
            }
            if (pendingFullResync) {
                pendingFullResync = false;
                inFlightFull = true;
                return true;
            }
            clear();
            return false;
        }
    }

    /**
     * Clears the handle only if it is still the given one.
     */
    public void release(CompletableFuture<CandidateIndex> handle) {
        synchronized (refreshLock) {
            if (inFlight == handle) {
                clear();
            }
        }
    }

    private void clear() {
        inFlight = null;
        inFlightFull = false;
        pendingFullResync = false;
    }

    public record Claim(CompletableFuture<CandidateIndex> handle, boolean owner) {
    }
}
