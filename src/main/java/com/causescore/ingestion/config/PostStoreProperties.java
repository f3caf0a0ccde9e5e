package com.causescore.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Stored post retention and incremental write boundary. Retention runs after every write that stored posts.
 */
@ConfigurationProperties(prefix = "causescore.ingestion.store")
@NoArgsConstructor
@Getter
@Setter
public class PostStoreProperties {

    /** Posts older than this are deleted and never returned. Default 90 days. */
    private int maxAgeDays = 90;

    /** Newest posts kept per account inside the age window. Default 15. */
    private int maxPostsPerAccount = 15;

    /**
     * Also stop an incremental write at a post whose timestamp equals an already stored one, even when the ids
     * differ. Off by default: only a stored native id marks previously seen territory.
     */
    private boolean haltOnTimestampMatch = false;
}
