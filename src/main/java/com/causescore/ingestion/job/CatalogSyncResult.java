package com.causescore.ingestion.job;

/**
 * Outcome of one catalog sync run. {@code skipped} means another instance held the sync lock.
 */
public record CatalogSyncResult(boolean skipped, int causesProcessed, int projectsProcessed, int errors,
                                long processingTimeMs) {

    public static CatalogSyncResult lockHeldElsewhere() {
        return new CatalogSyncResult(true, 0, 0, 0, 0L);
    }
}
