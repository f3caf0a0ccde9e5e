package com.causescore.ingestion.store;

import java.time.Instant;

/**
 * Outcome of one incremental write.
 *
 * @param boundaryTimestamp timestamp of the post that halted the write, null when no boundary was hit
 * @param newestStored      timestamp of the newest inserted post, null when nothing was stored
 */
public record IncrementalWriteResult(int storedCount,
                                     boolean duplicateBoundaryHit,
                                     Instant boundaryTimestamp,
                                     Instant newestStored) {

    public static IncrementalWriteResult nothingStored() {
        return new IncrementalWriteResult(0, false, null, null);
    }
}
