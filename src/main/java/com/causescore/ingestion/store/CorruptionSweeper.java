package com.causescore.ingestion.store;

import com.causescore.common.RetryPolicy;
import com.causescore.domain.Platform;
import com.causescore.domain.TrackedAccount;
import com.causescore.ingestion.config.RepairProperties;
import com.causescore.ingestion.lock.DistributedLockService;
import com.causescore.ingestion.lock.LockResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Cluster-wide corruption sweep over every account with a watermark, in keyset pages of a fixed size.
 * Runs under the {@value #LOCK_KEY} lock; a page that keeps failing is logged and skipped.
 */
@Service
@Slf4j
public class CorruptionSweeper {

    public static final String LOCK_KEY = "watermark-repair-sweep";

    private final MongoTemplate mongoTemplate;
    private final WatermarkRepairService repairService;
    private final DistributedLockService lockService;
    private final RepairProperties properties;
    private final RetryPolicy batchRetryPolicy;

    public CorruptionSweeper(MongoTemplate mongoTemplate,
                             WatermarkRepairService repairService,
                             DistributedLockService lockService,
                             RepairProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.repairService = repairService;
        this.lockService = lockService;
        this.properties = properties;
        this.batchRetryPolicy = new RetryPolicy(properties.getRetryBaseDelayMs(), 0L, properties.getMaxBatchRetries());
    }

    /**
     * Empty when another instance holds the sweep lock.
     */
    public Optional<SweepResult> sweep() {
        LockResult lock = lockService.acquire(LOCK_KEY, Duration.ofMinutes(properties.getLockTtlMinutes()));
        if (!lock.held()) {
            log.info("Corruption sweep already running elsewhere, skipping");
            return Optional.empty();
        }
        try {
            return Optional.of(sweepPages());
        } finally {
            lockService.release(LOCK_KEY, lock.holder());
        }
    }

    private SweepResult sweepPages() {
        int checked = 0;
        int repaired = 0;
        int failedBatches = 0;
        String lastId = null;
        while (true) {
            List<TrackedAccount> page = nextPage(lastId);
            if (page.isEmpty()) {
                break;
            }
            lastId = page.get(page.size() - 1).getId();
            Optional<Integer> batchRepaired = repairBatchWithRetry(page);
            if (batchRepaired.isPresent()) {
                repaired += batchRepaired.get();
            } else {
                failedBatches++;
            }
            checked += page.size();
            if (page.size() < properties.getBatchSize()) {
                break;
            }
        }
        SweepResult result = new SweepResult(checked, repaired, failedBatches);
        log.info("Corruption sweep done: {} accounts checked, {} watermarks cleared, {} failed batches",
                checked, repaired, failedBatches);
        return result;
    }

    private List<TrackedAccount> nextPage(String afterId) {
        Criteria hasWatermark = new Criteria().orOperator(
                where(Platform.TWITTER.watermarkField()).ne(null),
                where(Platform.FARCASTER.watermarkField()).ne(null));
        Criteria criteria = afterId == null
                ? hasWatermark
                : new Criteria().andOperator(where("_id").gt(afterId), hasWatermark);
        Query query = new Query(criteria)
                .with(Sort.by(Sort.Direction.ASC, "_id"))
                .limit(properties.getBatchSize());
        return mongoTemplate.find(query, TrackedAccount.class);
    }

    private Optional<Integer> repairBatchWithRetry(List<TrackedAccount> page) {
        for (int attempt = 0; attempt < batchRetryPolicy.totalAttempts(); attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(batchRetryPolicy.delayMs(attempt));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
            }
            try {
                return Optional.of(repairBatch(page));
            } catch (RuntimeException e) {
                log.warn("Corruption sweep batch starting at {} failed (attempt {}): {}",
                        page.get(0).getId(), attempt + 1, e.getMessage());
            }
        }
        log.error("Corruption sweep batch starting at {} abandoned after {} attempts",
                page.get(0).getId(), batchRetryPolicy.totalAttempts());
        return Optional.empty();
    }

    private int repairBatch(List<TrackedAccount> page) {
        int repaired = 0;
        for (TrackedAccount account : page) {
            for (Platform platform : repairService.detectCorruption(account)) {
                if (repairService.repair(account.getId(), platform)) {
                    repaired++;
                }
            }
        }
        return repaired;
    }

    public record SweepResult(int accountsChecked, int watermarksCleared, int failedBatches) {
    }
}
