package com.causescore.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

/**
 * Persistence for stored_posts. Bulk retention deletes go through MongoTemplate in PostStore.
 */
public interface StoredPostRepository extends MongoRepository<StoredPost, String> {

    List<StoredPost> findByAccountIdAndPlatformOrderByPostTimestampDesc(String accountId, Platform platform, Pageable pageable);

    boolean existsByAccountIdAndPostId(String accountId, String postId);

    List<StoredPost> findByAccountIdAndPlatformAndPostTimestamp(String accountId, Platform platform, Instant postTimestamp);

    long countByAccountIdAndPlatform(String accountId, Platform platform);

    long countByPlatform(Platform platform);

    long deleteByAccountId(String accountId);
}
