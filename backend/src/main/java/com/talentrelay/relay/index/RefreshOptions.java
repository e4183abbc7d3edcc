package com.talentrelay.relay.index;

/**
 * @param forceRefresh always refresh and wait for it
 * @param preferStale serve a stale, non-empty snapshot immediately and refresh in the background
 * @param forceFull discard the snapshot and rescan from scratch instead of using the sync token
 */
public record RefreshOptions(boolean forceRefresh, boolean preferStale, boolean forceFull) {

    public static RefreshOptions blocking() {
        return new RefreshOptions(false, false, false);
    }

    public static RefreshOptions staleWhileRevalidate() {
        return new RefreshOptions(false, true, false);
    }

    public static RefreshOptions forced(boolean forceFull) {
        return new RefreshOptions(true, false, forceFull);
    }
}
