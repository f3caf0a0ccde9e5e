package com.causescore.ingestion.job;

import com.causescore.domain.Platform;
import com.causescore.domain.TrackedAccount;
import com.causescore.domain.TrackedAccountRepository;
import com.causescore.ingestion.adapter.NormalizedPost;
import com.causescore.ingestion.adapter.SocialPlatformAdapter;
import com.causescore.ingestion.store.IncrementalWriteResult;
import com.causescore.ingestion.store.PostStore;
import com.causescore.ingestion.store.WatermarkRepairService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * One incremental fetch for one (project, platform): repair a corrupt watermark, fetch since the watermark,
 * store, then stamp the outcome on the account. Failures are stamped too and rethrown to the job processor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlatformFetchTask {

    private final TrackedAccountRepository accountRepository;
    private final List<SocialPlatformAdapter> adapters;
    private final PostStore postStore;
    private final WatermarkRepairService repairService;
    private final MongoTemplate mongoTemplate;

    public FetchOutcome fetch(String projectId, Platform platform) {
        long started = System.currentTimeMillis();
        TrackedAccount account = getOrCreate(projectId);
        try {
            String handle = account.getHandle(platform);
            if (handle == null || handle.isBlank()) {
                throw new IllegalStateException("Project " + projectId + " has no " + platform + " handle");
            }

            boolean repaired = false;
            Instant watermark = account.getWatermark(platform);
            if (repairService.detectCorruption(account).contains(platform)) {
                repaired = repairService.repair(account.getId(), platform);
                watermark = postStore.latestWatermark(account.getId(), platform).orElse(null);
            }

            SocialPlatformAdapter adapter = findAdapter(platform);
            List<NormalizedPost> posts = adapter.fetchRecentForHandle(handle, watermark);
            IncrementalWriteResult written = postStore.storeIncremental(account.getId(), posts);

            FetchOutcome outcome = new FetchOutcome(projectId, platform, posts.size(), written.storedCount(),
                    written.duplicateBoundaryHit(), written.boundaryTimestamp(), repaired,
                    System.currentTimeMillis() - started);
            stampResult(account.getId(), platform, outcome.toMetadata());
            log.info("{} fetch for project {}: found {}, stored {}{}", platform, projectId, outcome.found(),
                    outcome.stored(), outcome.duplicatesFound() ? " (stopped at known post)" : "");
            return outcome;
        } catch (RuntimeException e) {
            Map<String, Object> failure = new LinkedHashMap<>();
            failure.put("success", false);
            failure.put("error", e.getMessage());
            failure.put("processingTimeMs", System.currentTimeMillis() - started);
            failure.put("completedAt", Instant.now());
            try {
                stampResult(account.getId(), platform, failure);
            } catch (RuntimeException stampError) {
                e.addSuppressed(stampError);
            }
            throw e;
        }
    }

    TrackedAccount getOrCreate(String projectId) {
        return accountRepository.findByProjectId(projectId).orElseGet(() -> {
            try {
                return accountRepository.insert(new TrackedAccount(projectId));
            } catch (DuplicateKeyException e) {
                return accountRepository.findByProjectId(projectId)
                        .orElseThrow(() -> new IllegalStateException("Account for project " + projectId + " vanished", e));
            }
        });
    }

    private SocialPlatformAdapter findAdapter(Platform platform) {
        return adapters.stream()
                .filter(a -> a.supports(platform))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No adapter for " + platform));
    }

    private void stampResult(String accountId, Platform platform, Map<String, Object> result) {
        Instant now = Instant.now();
        Update update = new Update()
                .set(platform.lastFetchField(), now)
                .set("metadata." + platform.lastFetchResultKey(), result)
                .set("updatedAt", now);
        mongoTemplate.updateFirst(new Query(where("_id").is(accountId)), update, TrackedAccount.class);
    }
}
