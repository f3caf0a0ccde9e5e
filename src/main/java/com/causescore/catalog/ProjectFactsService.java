package com.causescore.catalog;

import com.causescore.domain.Platform;
import com.causescore.domain.TrackedAccount;
import com.causescore.domain.TrackedAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Project facts for evaluation. The local tracked_accounts mirror, kept fresh by the catalog sync, is read first;
 * only ids missing locally go to the catalog.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectFactsService {

    private final TrackedAccountRepository accountRepository;
    private final CatalogClient catalogClient;
    private final MongoTemplate mongoTemplate;

    /**
     * Facts for the requested ids in request order; ids found neither locally nor in the catalog are left out.
     */
    public List<ProjectFacts> getProjectsByIds(List<String> projectIds) {
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(projectIds));
        Map<String, ProjectFacts> byId = new LinkedHashMap<>();
        for (TrackedAccount account : accountRepository.findByProjectIdIn(ids)) {
            if (account.getTitle() != null) {
                byId.put(account.getProjectId(), fromAccount(account));
            }
        }
        List<String> missing = ids.stream().filter(id -> !byId.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            log.debug("{} of {} projects not mirrored locally, asking catalog", missing.size(), ids.size());
            try {
                for (ProjectFacts facts : catalogClient.getProjectsByIds(missing)) {
                    byId.put(facts.id(), facts);
                }
            } catch (CatalogException e) {
                log.warn("Catalog lookup for {} projects failed: {}", missing.size(), e.getMessage());
            }
        }
        return ids.stream().map(byId::get).filter(Objects::nonNull).toList();
    }

    /**
     * Upserts the mirrored facts and handles for one project. A changed handle clears that platform's watermark
     * so the next fetch starts from the lookback window of the new account.
     */
    public TrackedAccount upsertFacts(ProjectFacts facts) {
        if (facts.id() == null || facts.id().isBlank()) {
            throw new IllegalArgumentException("Project facts without id");
        }
        TrackedAccount existing = accountRepository.findByProjectId(facts.id()).orElse(null);
        Instant now = Instant.now();
        Update update = new Update()
                .set("title", facts.title())
                .set("slug", facts.slug())
                .set("description", facts.description())
                .set("projectStatus", facts.status())
                .set("qualityScore", facts.qualityScore())
                .set("givPowerRank", facts.powerRank())
                .set("lastUpdateDate", facts.lastUpdateDate())
                .set("lastUpdateTitle", facts.lastUpdateTitle())
                .set("lastUpdateContent", facts.lastUpdateContent())
                .set(Platform.TWITTER.handleField(), facts.twitterHandle())
                .set(Platform.FARCASTER.handleField(), facts.farcasterHandle())
                .set("metadata.lastSyncedAt", now)
                .set("updatedAt", now)
                .setOnInsert("createdAt", now);
        if (existing != null) {
            if (handleChanged(existing.getTwitterHandle(), facts.twitterHandle())) {
                update.unset(Platform.TWITTER.watermarkField());
            }
            if (handleChanged(existing.getFarcasterHandle(), facts.farcasterHandle())) {
                update.unset(Platform.FARCASTER.watermarkField());
            }
        }
        return mongoTemplate.findAndModify(new Query(where("projectId").is(facts.id())), update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), TrackedAccount.class);
    }

    static ProjectFacts fromAccount(TrackedAccount a) {
        return new ProjectFacts(a.getProjectId(), a.getTitle(), a.getSlug(), a.getDescription(), a.getProjectStatus(),
                a.getQualityScore(), a.getGivPowerRank(), a.getLastUpdateDate(), a.getLastUpdateTitle(),
                a.getLastUpdateContent(), a.getTwitterHandle(), a.getFarcasterHandle());
    }

    private static boolean handleChanged(String current, String incoming) {
        return current != null && !current.equalsIgnoreCase(Objects.requireNonNullElse(incoming, ""));
    }
}
