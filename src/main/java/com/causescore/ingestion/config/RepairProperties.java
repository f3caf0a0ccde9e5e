package com.causescore.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Watermark corruption sweep.
 */
@ConfigurationProperties(prefix = "causescore.ingestion.repair")
@NoArgsConstructor
@Getter
@Setter
public class RepairProperties {

    /** Accounts inspected per page. Default 100. */
    private int batchSize = 100;

    /** Retries per failed page. Default 3. */
    private int maxBatchRetries = 3;

    /** First page retry delay in ms; doubles per retry. Default 1000. */
    private long retryBaseDelayMs = 1000L;

    /** Sweep lock TTL. Default 30 min. */
    private int lockTtlMinutes = 30;
}
