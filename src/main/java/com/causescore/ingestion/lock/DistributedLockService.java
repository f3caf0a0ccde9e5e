package com.causescore.ingestion.lock;

import com.causescore.domain.SyncLock;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Cluster-wide mutual exclusion on sync_locks. Acquire inserts the key; on a duplicate key an expired row is
 * taken over with a conditional update, otherwise the caller is told the lock is held elsewhere.
 * Expiry is the only recovery for a holder that died without releasing.
 */
@Service
@Slf4j
public class DistributedLockService {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;
    private final String instanceHolder;

    @Autowired
    public DistributedLockService(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    DistributedLockService(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
        this.instanceHolder = ManagementFactory.getRuntimeMXBean().getName() + "-" + UUID.randomUUID();
    }

    public LockResult acquire(String key, Duration ttl) {
        return acquire(key, ttl, instanceHolder);
    }

    public LockResult acquire(String key, Duration ttl, String holder) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        try {
            mongoTemplate.insert(new SyncLock(key, holder, now, expiresAt));
            log.debug("Lock {} acquired by {} until {}", key, holder, expiresAt);
            return new LockResult(key, holder, true, expiresAt);
        } catch (DuplicateKeyException e) {
            Query expired = new Query(where("_id").is(key).and("expiresAt").lt(now));
            Update takeOver = new Update()
                    .set("holder", holder)
                    .set("acquiredAt", now)
                    .set("expiresAt", expiresAt);
            UpdateResult result = mongoTemplate.updateFirst(expired, takeOver, SyncLock.class);
            if (result.getModifiedCount() == 1) {
                log.info("Lock {} was expired, taken over by {}", key, holder);
                return new LockResult(key, holder, true, expiresAt);
            }
            log.debug("Lock {} is held by another instance, skipping", key);
            return LockResult.notHeld(key, holder);
        }
    }

    public boolean release(String key) {
        return release(key, instanceHolder);
    }

    /** Deletes the row only while this holder still owns it. */
    public boolean release(String key, String holder) {
        DeleteResult result = mongoTemplate.remove(new Query(where("_id").is(key).and("holder").is(holder)), SyncLock.class);
        if (result.getDeletedCount() == 0) {
            log.warn("Lock {} was not held by {} at release (expired and taken over?)", key, holder);
            return false;
        }
        return true;
    }

    /**
     * Runs the task under the lock and releases afterwards. Empty when the lock is held elsewhere.
     */
    public <T> Optional<T> withLock(String key, Duration ttl, Supplier<T> task) {
        LockResult lock = acquire(key, ttl);
        if (!lock.held()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(task.get());
        } finally {
            release(key, lock.holder());
        }
    }

    public long deleteExpired() {
        DeleteResult result = mongoTemplate.remove(new Query(where("expiresAt").lt(clock.instant())), SyncLock.class);
        return result.getDeletedCount();
    }
}
