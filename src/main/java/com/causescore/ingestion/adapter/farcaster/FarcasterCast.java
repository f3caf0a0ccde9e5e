package com.causescore.ingestion.adapter.farcaster;

import java.time.Instant;

/**
 * One cast as returned by the Warpcast profile-casts endpoint.
 */
public record FarcasterCast(String hash, String authorUsername, String text, Instant timestamp) {

    /** Recasts arrive without own text. */
    public boolean isPureRecast() {
        return text == null || text.isBlank();
    }
}
