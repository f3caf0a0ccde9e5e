package com.causescore.ingestion.lock;

import java.time.Instant;

/**
 * Outcome of one acquire attempt. Not held means another holder is active: skip, do not fail.
 */
public record LockResult(String key, String holder, boolean held, Instant expiresAt) {

    public static LockResult notHeld(String key, String holder) {
        return new LockResult(key, holder, false, null);
    }
}
