package com.causescore.ingestion.store;

import com.causescore.domain.Platform;
import com.causescore.domain.StoredPost;
import com.causescore.domain.StoredPostRepository;
import com.causescore.domain.TrackedAccount;
import com.causescore.ingestion.adapter.NormalizedPost;
import com.causescore.ingestion.config.PostStoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Transactional half of the incremental write: inserts newest-first until previously seen territory,
 * then moves the platform watermark forward. The watermark update is conditional, so it never regresses.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IncrementalPostWriter {

    private final MongoTemplate mongoTemplate;
    private final StoredPostRepository postRepository;
    private final PostStoreProperties properties;

    @Transactional
    public IncrementalWriteResult write(String accountId, List<NormalizedPost> posts) {
        if (posts == null || posts.isEmpty()) {
            return IncrementalWriteResult.nothingStored();
        }
        Platform platform = posts.get(0).platform();
        if (posts.stream().anyMatch(p -> p.platform() != platform)) {
            throw new IllegalArgumentException("Incremental write must not mix platforms for account " + accountId);
        }
        List<NormalizedPost> newestFirst = new ArrayList<>(posts);
        newestFirst.sort(Comparator.comparing(NormalizedPost::timestamp).reversed());

        Instant fetchedAt = Instant.now();
        Instant newestStored = null;
        int stored = 0;
        for (NormalizedPost post : newestFirst) {
            if (postRepository.existsByAccountIdAndPostId(accountId, post.postId())) {
                log.debug("Account {} {}: reached stored post {} at {}", accountId, platform, post.postId(), post.timestamp());
                return new IncrementalWriteResult(stored, true, post.timestamp(), newestStored);
            }
            if (properties.isHaltOnTimestampMatch()
                    && !postRepository.findByAccountIdAndPlatformAndPostTimestamp(accountId, platform, post.timestamp()).isEmpty()) {
                log.debug("Account {} {}: timestamp {} already stored, halting", accountId, platform, post.timestamp());
                return new IncrementalWriteResult(stored, true, post.timestamp(), newestStored);
            }
            mongoTemplate.insert(toStoredPost(accountId, post, fetchedAt));
            stored++;
            if (newestStored == null) {
                newestStored = post.timestamp();
                advanceWatermark(accountId, platform, newestStored);
            }
        }
        return new IncrementalWriteResult(stored, false, null, newestStored);
    }

    private void advanceWatermark(String accountId, Platform platform, Instant newest) {
        String field = platform.watermarkField();
        Query query = new Query(where("_id").is(accountId)
                .orOperator(where(field).is(null), where(field).lt(newest)));
        Update update = new Update().set(field, newest).set("updatedAt", Instant.now());
        long modified = mongoTemplate.updateFirst(query, update, TrackedAccount.class).getModifiedCount();
        if (modified == 0) {
            log.debug("Account {} {}: watermark already at or after {}", accountId, platform, newest);
        }
    }

    private static StoredPost toStoredPost(String accountId, NormalizedPost post, Instant fetchedAt) {
        StoredPost stored = new StoredPost();
        stored.setPostId(post.postId());
        stored.setAccountId(accountId);
        stored.setPlatform(post.platform());
        stored.setContent(post.content());
        stored.setUrl(post.url());
        stored.setPostTimestamp(post.timestamp());
        stored.setFetchedAt(fetchedAt);
        Map<String, Object> metadata = new HashMap<>(post.metadata());
        metadata.putIfAbsent("platform", post.platform().name().toLowerCase());
        stored.setMetadata(metadata);
        return stored;
    }
}
