package com.causescore.ingestion.store;

import com.causescore.domain.Platform;
import com.causescore.domain.StoredPost;
import com.causescore.domain.TrackedAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Detects and repairs watermark corruption: a non-null watermark with no stored post for that platform.
 * Repair re-checks inside a transaction and clears the watermark only if it still holds the observed value,
 * so a concurrent incremental write that moved the watermark wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WatermarkRepairService {

    private final MongoTemplate mongoTemplate;

    /**
     * Platforms whose watermark is set but not backed by any stored post.
     */
    public List<Platform> detectCorruption(TrackedAccount account) {
        List<Platform> corrupt = new ArrayList<>();
        for (Platform platform : Platform.values()) {
            if (account.getWatermark(platform) != null && countPosts(account.getId(), platform) == 0) {
                corrupt.add(platform);
            }
        }
        return corrupt;
    }

    /**
     * Clears the platform watermark when it is still unbacked. Returns true when a watermark was cleared.
     */
    @Transactional
    public boolean repair(String accountId, Platform platform) {
        String field = platform.watermarkField();
        Query accountQuery = new Query(where("_id").is(accountId));
        accountQuery.fields().include(field);
        TrackedAccount account = mongoTemplate.findOne(accountQuery, TrackedAccount.class);
        if (account == null) {
            return false;
        }
        Instant observed = account.getWatermark(platform);
        if (observed == null || countPosts(accountId, platform) > 0) {
            return false;
        }
        Query stillObserved = new Query(where("_id").is(accountId).and(field).is(observed));
        Update clear = new Update().unset(field).set("updatedAt", Instant.now());
        boolean cleared = mongoTemplate.updateFirst(stillObserved, clear, TrackedAccount.class).getModifiedCount() == 1;
        if (cleared) {
            log.warn("Cleared corrupt {} watermark {} on account {} (no stored posts)", platform, observed, accountId);
        } else {
            log.info("Skipped {} watermark repair on account {}: watermark changed concurrently", platform, accountId);
        }
        return cleared;
    }

    private long countPosts(String accountId, Platform platform) {
        return mongoTemplate.count(new Query(where("accountId").is(accountId).and("platform").is(platform)), StoredPost.class);
    }
}
