package com.causescore.ingestion.adapter.twitter;

import com.causescore.common.HandleParser;
import com.causescore.common.RandomDelayRateLimiter;
import com.causescore.domain.Platform;
import com.causescore.ingestion.adapter.FetchWindow;
import com.causescore.ingestion.adapter.IdentityCache;
import com.causescore.ingestion.adapter.NormalizedPost;
import com.causescore.ingestion.adapter.PlatformCallExecutor;
import com.causescore.ingestion.adapter.PlatformIdentity;
import com.causescore.ingestion.adapter.SocialApiException;
import com.causescore.ingestion.adapter.SocialPlatformAdapter;
import com.causescore.ingestion.config.TwitterProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Twitter/X adapter: username to user id (cached), then one timeline page per fetch.
 * Pure retweets are dropped; quote tweets stay. The pinned tweet may sit out of chronological order,
 * so it never ends the scan but is still subject to the date window.
 * Every request, token requests included, takes its own slot on the shared Twitter limiter.
 */
@Component
@Slf4j
public class TwitterAdapter implements SocialPlatformAdapter {

    private final TwitterApiClient client;
    private final TwitterSessionManager sessionManager;
    private final PlatformCallExecutor executor;
    private final RandomDelayRateLimiter rateLimiter;
    private final IdentityCache identityCache;
    private final TwitterProperties properties;

    public TwitterAdapter(TwitterApiClient client,
                          TwitterSessionManager sessionManager,
                          @Qualifier("twitterCallExecutor") PlatformCallExecutor executor,
                          @Qualifier("twitterRateLimiter") RandomDelayRateLimiter rateLimiter,
                          @Qualifier("twitterIdentityCache") IdentityCache identityCache,
                          TwitterProperties properties) {
        this.client = client;
        this.sessionManager = sessionManager;
        this.executor = executor;
        this.rateLimiter = rateLimiter;
        this.identityCache = identityCache;
        this.properties = properties;
    }

    @Override
    public boolean supports(Platform platform) {
        return platform == Platform.TWITTER;
    }

    @Override
    public Optional<PlatformIdentity> resolveIdentity(String handleOrUrl) {
        Optional<String> handle = HandleParser.twitterHandle(handleOrUrl);
        if (handle.isEmpty()) {
            log.warn("Not a Twitter handle: {}", handleOrUrl);
            return Optional.empty();
        }
        try {
            return identityCache.resolve(handle.get(), this::lookupUser);
        } catch (SocialApiException e) {
            log.warn("Twitter user lookup failed for @{}: {}", handle.get(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<PlatformIdentity> lookupUser(String handle) {
        try {
            String json = executor.execute("lookup @" + handle,
                    () -> withSession(token -> client.getUserByUsername(handle, token)));
            return parseUser(handle, json);
        } catch (SocialApiException e) {
            if (e.getStatusCode() == 404) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public List<NormalizedPost> fetchRecent(PlatformIdentity identity, Instant sinceWatermark) {
        FetchWindow window = FetchWindow.of(Instant.now(), properties.getLookbackDays(), sinceWatermark);
        List<Tweet> timeline;
        try {
            String json = executor.execute("timeline @" + identity.handle(),
                    () -> withSession(token -> client.getUserTweets(identity.id(), properties.getScanLimit(), token)));
            timeline = parseTweets(json);
        } catch (SocialApiException e) {
            log.warn("Twitter fetch gave up for @{} ({}): {}", identity.handle(), identity.id(), e.getMessage());
            return List.of();
        }

        List<NormalizedPost> collected = new ArrayList<>();
        int scanned = 0;
        for (Tweet tweet : timeline) {
            if (scanned++ >= properties.getScanLimit() || collected.size() >= properties.getMaxPostsPerFetch()) {
                break;
            }
            boolean pinned = tweet.id().equals(identity.pinnedPostId());
            if (!pinned && (window.isPastWatermark(tweet.createdAt()) || window.isPastLookback(tweet.createdAt()))) {
                break;
            }
            if (tweet.retweet() && !tweet.quote()) {
                continue;
            }
            if (window.accepts(tweet.createdAt())) {
                collected.add(toPost(tweet, identity, pinned));
            }
        }
        collected.sort(Comparator.comparing(NormalizedPost::timestamp).reversed());
        log.debug("Twitter @{}: scanned {} collected {} since {}", identity.handle(), scanned, collected.size(), sinceWatermark);
        return collected;
    }

    private String withSession(Function<String, Mono<String>> call) {
        String token = sessionManager.bearerToken();
        try {
            rateLimiter.acquire();
            return call.apply(token).block();
        } catch (SocialApiException e) {
            if (!e.isUnauthorized()) {
                throw e;
            }
            String refreshed = sessionManager.refresh();
            rateLimiter.acquire();
            return call.apply(refreshed).block();
        }
    }

    private NormalizedPost toPost(Tweet tweet, PlatformIdentity identity, boolean pinned) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("platform", Platform.TWITTER.name().toLowerCase());
        metadata.put("authorId", identity.id());
        if (tweet.quote()) {
            metadata.put("quote", true);
        }
        if (pinned) {
            metadata.put("pinned", true);
        }
        String url = "https://x.com/" + identity.handle() + "/status/" + tweet.id();
        return new NormalizedPost(tweet.id(), Platform.TWITTER, tweet.text(), url, tweet.createdAt(), metadata);
    }

    static Optional<PlatformIdentity> parseUser(String handle, String json) {
        try {
            JsonNode data = new ObjectMapper().readTree(json).path("data");
            JsonNode id = data.path("id");
            if (!id.isTextual() || id.asText().isBlank()) {
                return Optional.empty();
            }
            JsonNode pinned = data.path("pinned_tweet_id");
            String username = data.path("username").asText(handle);
            return Optional.of(new PlatformIdentity(username, id.asText(), pinned.isTextual() ? pinned.asText() : null));
        } catch (Exception e) {
            throw new SocialApiException("Unparseable Twitter user response for @" + handle, e, false, 0);
        }
    }

    /**
     * Parses a v2 timeline page. Items without id or a valid created_at are skipped.
     */
    static List<Tweet> parseTweets(String json) {
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(json);
        } catch (Exception e) {
            throw new SocialApiException("Unparseable Twitter timeline response", e);
        }
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            return List.of();
        }
        List<Tweet> tweets = new ArrayList<>();
        for (JsonNode node : data) {
            String id = node.path("id").asText("");
            String createdAt = node.path("created_at").asText("");
            if (id.isBlank() || createdAt.isBlank()) {
                continue;
            }
            Instant timestamp;
            try {
                timestamp = Instant.parse(createdAt);
            } catch (DateTimeParseException e) {
                log.debug("Skipping tweet {} with bad created_at {}", id, createdAt);
                continue;
            }
            boolean retweet = false;
            boolean quote = false;
            for (JsonNode ref : node.path("referenced_tweets")) {
                String type = ref.path("type").asText("");
                retweet |= "retweeted".equals(type);
                quote |= "quoted".equals(type);
            }
            tweets.add(new Tweet(id, node.path("text").asText(""), timestamp, retweet, quote));
        }
        return tweets;
    }

    record Tweet(String id, String text, Instant createdAt, boolean retweet, boolean quote) {
    }
}
