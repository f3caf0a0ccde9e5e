package com.causescore.ingestion.config;

import lombok.Getter;
import lombok.Setter;

/**
 * Settings shared by every platform adapter: request spacing, retries and fetch bounds.
 */
@Getter
@Setter
public abstract class PlatformFetchProperties {

    /** Lower bound of the random delay before each request, in ms. */
    private long minDelayMs;

    /** Upper bound of the random delay before each request, in ms. */
    private long maxDelayMs;

    /** Retries after the first attempt. Default 3. */
    private int maxRetries = 3;

    /** First retry delay in ms; doubles per retry. */
    private long retryBaseDelayMs;

    /** Random jitter added to each retry delay, 0..this many ms. Default 1000. */
    private long retryJitterMs = 1000L;

    /** Max posts collected per fetch. Default 10. */
    private int maxPostsPerFetch = 10;

    /** Max timeline items inspected per fetch (safety valve). Default 30. */
    private int scanLimit = 30;

    /** Oldest post age considered, in days. Default 90. */
    private int lookbackDays = 90;

    /** Lifetime of a resolved handle. Default 24h. */
    private int identityCacheTtlHours = 24;

    /** Lifetime of a failed handle resolution. Default 60 min. */
    private int missingIdentityCacheTtlMinutes = 60;
}
