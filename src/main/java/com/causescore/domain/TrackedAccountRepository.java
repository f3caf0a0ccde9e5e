package com.causescore.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for tracked_accounts. Conditional watermark updates go through MongoTemplate in PostStore.
 */
public interface TrackedAccountRepository extends MongoRepository<TrackedAccount, String> {

    Optional<TrackedAccount> findByProjectId(String projectId);

    List<TrackedAccount> findByProjectIdIn(List<String> projectIds);

    List<TrackedAccount> findByTwitterHandleNotNull();

    List<TrackedAccount> findByFarcasterHandleNotNull();

    long countByTwitterHandleNotNull();

    long countByFarcasterHandleNotNull();
}
