package com.causescore.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One tracked project: per-platform handles and watermarks plus the project facts mirrored from the catalog.
 * A non-null watermark must be backed by at least one stored post for that platform.
 */
@Document(collection = "tracked_accounts")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TrackedAccount {

    @Id
    @EqualsAndHashCode.Include
    private String id;

    @Indexed(unique = true)
    private String projectId;

    private String twitterHandle;
    private String farcasterHandle;

    /** Timestamp of the newest stored tweet; null until the first successful write. */
    private Instant latestTwitterPostTimestamp;
    private Instant latestFarcasterPostTimestamp;

    private Instant lastTwitterFetch;
    private Instant lastFarcasterFetch;

    private String title;
    private String slug;
    private String description;
    private String projectStatus;
    private Double qualityScore;
    private Integer givPowerRank;
    private Instant lastUpdateDate;
    private String lastUpdateTitle;
    private String lastUpdateContent;

    private Map<String, Object> metadata = new HashMap<>();

    private Instant createdAt;
    private Instant updatedAt;

    public TrackedAccount(String projectId) {
        this.projectId = projectId;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public String getHandle(Platform platform) {
        return switch (platform) {
            case TWITTER -> twitterHandle;
            case FARCASTER -> farcasterHandle;
        };
    }

    public Instant getWatermark(Platform platform) {
        return switch (platform) {
            case TWITTER -> latestTwitterPostTimestamp;
            case FARCASTER -> latestFarcasterPostTimestamp;
        };
    }

    public Instant getLastFetch(Platform platform) {
        return switch (platform) {
            case TWITTER -> lastTwitterFetch;
            case FARCASTER -> lastFarcasterFetch;
        };
    }
}
