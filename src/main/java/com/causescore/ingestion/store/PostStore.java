package com.causescore.ingestion.store;

import com.causescore.domain.Platform;
import com.causescore.domain.StoredPost;
import com.causescore.domain.StoredPostRepository;
import com.causescore.domain.TrackedAccount;
import com.causescore.ingestion.adapter.NormalizedPost;
import com.causescore.ingestion.config.PostStoreProperties;
import com.mongodb.client.result.DeleteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Durable, deduplicated post storage keyed by (account, platform). Writes go through
 * {@link IncrementalPostWriter} in one transaction; retention runs after the transaction commits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostStore {

    private final IncrementalPostWriter writer;
    private final MongoTemplate mongoTemplate;
    private final StoredPostRepository postRepository;
    private final PostStoreProperties properties;

    /**
     * Stores posts newest first until a previously stored post is reached, advances the watermark,
     * then applies retention when anything was stored.
     */
    public IncrementalWriteResult storeIncremental(String accountId, List<NormalizedPost> posts) {
        IncrementalWriteResult result = writer.write(accountId, posts);
        if (result.storedCount() > 0) {
            try {
                cleanupRetention(accountId);
            } catch (RuntimeException e) {
                log.warn("Retention cleanup failed for account {}: {}", accountId, e.getMessage());
            }
        }
        return result;
    }

    /**
     * Newest posts for the account and platform inside the retention age, newest first.
     */
    public List<StoredPost> recent(String accountId, Platform platform, int limit) {
        Query query = new Query(where("accountId").is(accountId)
                .and("platform").is(platform)
                .and("postTimestamp").gte(retentionCutoff()))
                .with(Sort.by(Sort.Direction.DESC, "postTimestamp"))
                .limit(Math.max(0, limit));
        return mongoTemplate.find(query, StoredPost.class);
    }

    public Optional<Instant> latestWatermark(String accountId, Platform platform) {
        Query query = new Query(where("_id").is(accountId));
        query.fields().include(platform.watermarkField());
        TrackedAccount account = mongoTemplate.findOne(query, TrackedAccount.class);
        return Optional.ofNullable(account).map(a -> a.getWatermark(platform));
    }

    long countPosts(String accountId, Platform platform) {
        return postRepository.countByAccountIdAndPlatform(accountId, platform);
    }

    /**
     * Deletes posts older than the retention age, then the oldest excess beyond the per-account maximum.
     * Returns the number of deleted posts.
     */
    public long cleanupRetention(String accountId) {
        Instant cutoff = retentionCutoff();
        DeleteResult expired = mongoTemplate.remove(
                new Query(where("accountId").is(accountId).and("postTimestamp").lt(cutoff)), StoredPost.class);

        Query excessQuery = new Query(where("accountId").is(accountId).and("postTimestamp").gte(cutoff))
                .with(Sort.by(Sort.Direction.DESC, "postTimestamp").and(Sort.by(Sort.Direction.DESC, "_id")))
                .skip(properties.getMaxPostsPerAccount());
        excessQuery.fields().include("_id");
        List<String> excessIds = mongoTemplate.find(excessQuery, StoredPost.class).stream()
                .map(StoredPost::getId)
                .toList();
        long excessDeleted = 0;
        if (!excessIds.isEmpty()) {
            excessDeleted = mongoTemplate.remove(new Query(where("_id").in(excessIds)), StoredPost.class).getDeletedCount();
        }
        long total = expired.getDeletedCount() + excessDeleted;
        if (total > 0) {
            log.debug("Retention for account {}: {} expired, {} over limit", accountId, expired.getDeletedCount(), excessDeleted);
        }
        return total;
    }

    public PostStats stats() {
        long twitter = postRepository.countByPlatform(Platform.TWITTER);
        long farcaster = postRepository.countByPlatform(Platform.FARCASTER);
        return new PostStats(twitter + farcaster, twitter, farcaster);
    }

    private Instant retentionCutoff() {
        return Instant.now().minus(Duration.ofDays(properties.getMaxAgeDays()));
    }

    public record PostStats(long totalPosts, long twitterPosts, long farcasterPosts) {
    }
}
