package com.causescore.ingestion.job;

import com.causescore.domain.Platform;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one platform fetch for one project; also stored as the account's last fetch result.
 */
public record FetchOutcome(String projectId,
                           Platform platform,
                           int found,
                           int stored,
                           boolean duplicatesFound,
                           Instant stoppedAtTimestamp,
                           boolean watermarkRepaired,
                           long processingTimeMs) {

    Map<String, Object> toMetadata() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("success", true);
        m.put("found", found);
        m.put("stored", stored);
        m.put("duplicatesFound", duplicatesFound);
        m.put("stoppedAtTimestamp", stoppedAtTimestamp);
        m.put("watermarkRepaired", watermarkRepaired);
        m.put("processingTimeMs", processingTimeMs);
        m.put("completedAt", Instant.now());
        return m;
    }
}
