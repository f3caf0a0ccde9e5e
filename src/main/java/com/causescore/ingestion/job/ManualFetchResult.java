package com.causescore.ingestion.job;

import com.causescore.domain.Platform;

import java.util.Map;

public record ManualFetchResult(String projectId, Map<Platform, PlatformResult> platforms) {

    /**
     * @param postsFound posts returned by the platform; null when not attempted or failed
     */
    public record PlatformResult(boolean attempted, Boolean success, Integer postsFound, Integer postsStored, String error) {

        static PlatformResult notAttempted() {
            return new PlatformResult(false, null, null, null, null);
        }

        static PlatformResult succeeded(int found, int stored) {
            return new PlatformResult(true, true, found, stored, null);
        }

        static PlatformResult failed(String error) {
            return new PlatformResult(true, false, null, null, error);
        }
    }
}
