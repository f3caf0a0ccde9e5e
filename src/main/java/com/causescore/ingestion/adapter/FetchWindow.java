package com.causescore.ingestion.adapter;

import java.time.Duration;
import java.time.Instant;

/**
 * Date window for one incremental fetch: the effective cutoff is the later of (now - lookback) and the watermark.
 * Items at or after the cutoff are collected; the first item strictly older than the watermark ends the scan.
 */
public final class FetchWindow {

    private final Instant lookbackCutoff;
    private final Instant watermark;

    private FetchWindow(Instant lookbackCutoff, Instant watermark) {
        this.lookbackCutoff = lookbackCutoff;
        this.watermark = watermark;
    }

    public static FetchWindow of(Instant now, int lookbackDays, Instant watermark) {
        return new FetchWindow(now.minus(Duration.ofDays(lookbackDays)), watermark);
    }

    public Instant effectiveCutoff() {
        if (watermark != null && watermark.isAfter(lookbackCutoff)) {
            return watermark;
        }
        return lookbackCutoff;
    }

    /** True when the scan must stop: the item is strictly older than the watermark. */
    public boolean isPastWatermark(Instant timestamp) {
        return watermark != null && timestamp.isBefore(watermark);
    }

    /** True when the item falls outside the lookback age. Timelines are newest first, so this also ends a scan. */
    public boolean isPastLookback(Instant timestamp) {
        return timestamp.isBefore(lookbackCutoff);
    }

    public boolean accepts(Instant timestamp) {
        return !timestamp.isBefore(effectiveCutoff());
    }
}
