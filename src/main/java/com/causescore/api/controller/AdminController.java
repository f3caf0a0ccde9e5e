package com.causescore.api.controller;

import com.causescore.api.dto.ErrorBody;
import com.causescore.api.dto.SocialPostResponse;
import com.causescore.api.dto.StatsResponse;
import com.causescore.domain.Platform;
import com.causescore.domain.StoredPost;
import com.causescore.ingestion.job.AdminIngestionService;
import com.causescore.ingestion.job.CatalogSyncJob;
import com.causescore.ingestion.job.CatalogSyncResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Locale;

/**
 * Operator endpoints: trigger a catalog sync, fetch one project now, inspect stored posts and counters.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    static final int MAX_POSTS_LIMIT = 100;

    private final CatalogSyncJob catalogSyncJob;
    private final AdminIngestionService adminIngestionService;

    @PostMapping("/sync-projects")
    public Mono<ResponseEntity<?>> syncProjects() {
        return Mono.fromCallable(catalogSyncJob::sync)
                .subscribeOn(Schedulers.boundedElastic())
                .map(AdminController::toSyncResponse);
    }

    @PostMapping("/fetch/{projectId}")
    public Mono<ResponseEntity<?>> fetchProject(@PathVariable String projectId) {
        return Mono.fromCallable(() -> adminIngestionService.fetchNow(projectId.trim()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> result
                        .<ResponseEntity<?>>map(ResponseEntity::ok)
                        .orElseGet(() -> projectNotFound(projectId)));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<StatsResponse>> stats() {
        return Mono.fromCallable(adminIngestionService::stats)
                .subscribeOn(Schedulers.boundedElastic())
                .map(stats -> ResponseEntity.ok(StatsResponse.from(stats)));
    }

    @GetMapping("/social-posts/{projectId}")
    public Mono<ResponseEntity<?>> socialPosts(@PathVariable String projectId,
                                               @RequestParam(required = false) String platform,
                                               @RequestParam(defaultValue = "20") int limit) {
        Platform selected;
        try {
            selected = platform == null || platform.isBlank() ? null : Platform.valueOf(platform.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PLATFORM", "Unsupported platform: " + platform)));
        }
        if (limit < 1 || limit > MAX_POSTS_LIMIT) {
            return Mono.just(ResponseEntity.badRequest().body(
                    ErrorBody.of("INVALID_LIMIT", "limit must be between 1 and " + MAX_POSTS_LIMIT)));
        }
        return Mono.fromCallable(() -> adminIngestionService.recentPosts(projectId.trim(), selected, limit))
                .subscribeOn(Schedulers.boundedElastic())
                .map(posts -> posts
                        .<ResponseEntity<?>>map(list -> ResponseEntity.ok(toPostResponses(list)))
                        .orElseGet(() -> projectNotFound(projectId)));
    }

    private static ResponseEntity<?> toSyncResponse(CatalogSyncResult result) {
        if (result.skipped()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ErrorBody.of("SYNC_IN_PROGRESS", "Catalog sync is already running"));
        }
        return ResponseEntity.ok(result);
    }

    private static List<SocialPostResponse> toPostResponses(List<StoredPost> posts) {
        return posts.stream().map(SocialPostResponse::from).toList();
    }

    private static ResponseEntity<?> projectNotFound(String projectId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorBody.of("PROJECT_NOT_FOUND", "Project " + projectId + " is not tracked"));
    }
}
