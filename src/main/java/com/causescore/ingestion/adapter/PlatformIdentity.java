package com.causescore.ingestion.adapter;

/**
 * Stable numeric identity behind a human handle (Twitter user id, Farcaster FID).
 *
 * @param pinnedPostId id of the pinned post when the platform reports one, else null
 */
public record PlatformIdentity(String handle, String id, String pinnedPostId) {

    public static PlatformIdentity of(String handle, String id) {
        return new PlatformIdentity(handle, id, null);
    }
}
