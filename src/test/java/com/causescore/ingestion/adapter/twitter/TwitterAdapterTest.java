package com.causescore.ingestion.adapter.twitter;

import com.causescore.common.RetryPolicy;
import com.causescore.ingestion.adapter.IdentityCache;
import com.causescore.ingestion.adapter.NormalizedPost;
import com.causescore.ingestion.adapter.PlatformCallExecutor;
import com.causescore.ingestion.adapter.PlatformIdentity;
import com.causescore.ingestion.adapter.SocialApiException;
import com.causescore.ingestion.config.TwitterProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TwitterAdapterTest {

    @TempDir
    Path tempDir;

    private FakeTwitterApiClient client;
    private TwitterAdapter adapter;
    private TwitterProperties properties;
    private TwitterSessionManagerTest.CountingRateLimiter limiter;

    @BeforeEach
    void setUp() {
        client = new FakeTwitterApiClient();
        properties = new TwitterProperties();
        properties.setMaxPostsPerFetch(10);
        properties.setScanLimit(30);
        properties.setLookbackDays(90);
        TwitterProperties.Credential credential = new TwitterProperties.Credential();
        credential.setApiKey("key-1");
        credential.setApiSecret("secret-1");
        limiter = new TwitterSessionManagerTest.CountingRateLimiter();
        TwitterSessionManager sessions = new TwitterSessionManager(client, limiter,
                new ObjectMapper().registerModule(new JavaTimeModule()), tempDir.resolve("session.json"), List.of(credential));
        PlatformCallExecutor executor = new PlatformCallExecutor("Twitter", null, new RetryPolicy(0, 0, 2));
        adapter = new TwitterAdapter(client, sessions, executor, limiter,
                new IdentityCache(Duration.ofHours(1), Duration.ofMinutes(5), 100), properties);
    }

    @Test
    @DisplayName("stops at the first tweet older than the watermark and keeps the watermark tweet itself")
    void fetchRecent_haltsAtWatermark() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        Instant watermark = now.minus(Duration.ofHours(3));
        client.timeline = timeline(
                tweet("5", now.minus(Duration.ofHours(1)), null),
                tweet("4", now.minus(Duration.ofHours(2)), null),
                tweet("3", watermark, null),
                tweet("2", now.minus(Duration.ofHours(4)), null),
                tweet("1", now.minus(Duration.ofHours(5)), null));

        List<NormalizedPost> posts = adapter.fetchRecent(PlatformIdentity.of("giveth", "100"), watermark);

        assertThat(posts).extracting(NormalizedPost::postId).containsExactly("5", "4", "3");
        assertThat(posts.get(0).url()).isEqualTo("https://x.com/giveth/status/5");
    }

    @Test
    @DisplayName("drops pure retweets, keeps quote tweets")
    void fetchRecent_filtersRetweets() {
        Instant now = Instant.now();
        client.timeline = timeline(
                tweet("3", now.minus(Duration.ofMinutes(10)), "retweeted"),
                tweet("2", now.minus(Duration.ofMinutes(20)), "quoted"),
                tweet("1", now.minus(Duration.ofMinutes(30)), null));

        List<NormalizedPost> posts = adapter.fetchRecent(PlatformIdentity.of("giveth", "100"), null);

        assertThat(posts).extracting(NormalizedPost::postId).containsExactly("2", "1");
        assertThat(posts.get(0).metadata()).containsEntry("quote", true);
    }

    @Test
    @DisplayName("an old pinned tweet does not end the scan")
    void fetchRecent_pinnedTweetDoesNotHalt() {
        Instant now = Instant.now();
        Instant watermark = now.minus(Duration.ofDays(1));
        client.timeline = timeline(
                tweet("pin", now.minus(Duration.ofDays(30)), null),
                tweet("9", now.minus(Duration.ofHours(1)), null));

        List<NormalizedPost> posts = adapter.fetchRecent(new PlatformIdentity("giveth", "100", "pin"), watermark);

        assertThat(posts).extracting(NormalizedPost::postId).containsExactly("9");
    }

    @Test
    @DisplayName("caps collected posts at maxPostsPerFetch")
    void fetchRecent_respectsMaxPosts() {
        properties.setMaxPostsPerFetch(2);
        Instant now = Instant.now();
        client.timeline = timeline(
                tweet("3", now.minus(Duration.ofMinutes(1)), null),
                tweet("2", now.minus(Duration.ofMinutes(2)), null),
                tweet("1", now.minus(Duration.ofMinutes(3)), null));

        assertThat(adapter.fetchRecent(PlatformIdentity.of("giveth", "100"), null)).hasSize(2);
    }

    @Test
    @DisplayName("exhausted retries yield an empty list")
    void fetchRecent_failureReturnsEmpty() {
        client.timelineFailure = new SocialApiException("503");
        assertThat(adapter.fetchRecent(PlatformIdentity.of("giveth", "100"), null)).isEmpty();
        assertThat(client.timelineCalls).hasValue(3);
    }

    @Test
    @DisplayName("rejected token triggers one fresh login")
    void fetchRecent_refreshesRejectedSession() {
        client.rejectFirstTimelineCall = true;
        client.timeline = timeline(tweet("1", Instant.now().minusSeconds(60), null));

        assertThat(adapter.fetchRecent(PlatformIdentity.of("giveth", "100"), null)).hasSize(1);
        assertThat(client.tokenRequests).hasValue(2);
    }

    @Test
    @DisplayName("login, rejected call, re-login and retried call each take a limiter slot")
    void everyOutboundRequest_takesOneLimiterSlot() {
        client.rejectFirstTimelineCall = true;
        client.timeline = timeline(tweet("1", Instant.now().minusSeconds(60), null));

        adapter.resolveIdentity("giveth");
        adapter.fetchRecent(PlatformIdentity.of("giveth", "100"), null);

        int outbound = client.userCalls.get() + client.timelineCalls.get() + client.tokenRequests.get();
        assertThat(outbound).isEqualTo(5);
        assertThat(limiter.acquires).hasValue(outbound);
    }

    @Test
    void transientRetries_eachTakeALimiterSlot() {
        client.timelineFailure = new SocialApiException("503");
        adapter.fetchRecent(PlatformIdentity.of("giveth", "100"), null);

        assertThat(limiter.acquires).hasValue(client.timelineCalls.get() + client.tokenRequests.get());
    }

    @Test
    void resolveIdentity_acceptsProfileUrlAndCaches() {
        client.userJson = "{\"data\":{\"id\":\"100\",\"username\":\"Giveth\",\"pinned_tweet_id\":\"77\"}}";

        assertThat(adapter.resolveIdentity("https://x.com/Giveth"))
                .contains(new PlatformIdentity("Giveth", "100", "77"));
        assertThat(adapter.resolveIdentity("@giveth")).isPresent();
        assertThat(client.userCalls).hasValue(1);
    }

    @Test
    void resolveIdentity_unknownUserIsEmpty() {
        client.userFailure = new SocialApiException("not found", null, false, 404);
        assertThat(adapter.resolveIdentity("nobody_here")).isEmpty();
    }

    @Test
    void parseTweets_skipsItemsWithoutTimestamp() {
        String json = "{\"data\":[{\"id\":\"1\",\"text\":\"a\"},{\"id\":\"2\",\"text\":\"b\",\"created_at\":\"2025-01-01T00:00:00.000Z\"}]}";
        assertThat(TwitterAdapter.parseTweets(json)).extracting(TwitterAdapter.Tweet::id).containsExactly("2");
    }

    @Test
    void parseTweets_invalidJsonThrows() {
        assertThatThrownBy(() -> TwitterAdapter.parseTweets("not json")).isInstanceOf(SocialApiException.class);
    }

    private static String tweet(String id, Instant createdAt, String referenceType) {
        String refs = referenceType == null ? "" : ",\"referenced_tweets\":[{\"type\":\"" + referenceType + "\",\"id\":\"x\"}]";
        return "{\"id\":\"" + id + "\",\"text\":\"tweet " + id + "\",\"created_at\":\"" + createdAt + "\"" + refs + "}";
    }

    private static String timeline(String... tweets) {
        return "{\"data\":[" + String.join(",", tweets) + "]}";
    }

    static class FakeTwitterApiClient implements TwitterApiClient {
        String userJson = "{\"data\":{\"id\":\"100\",\"username\":\"giveth\"}}";
        String timeline = "{\"data\":[]}";
        RuntimeException userFailure;
        RuntimeException timelineFailure;
        boolean rejectFirstTimelineCall;
        final AtomicInteger userCalls = new AtomicInteger();
        final AtomicInteger timelineCalls = new AtomicInteger();
        final AtomicInteger tokenRequests = new AtomicInteger();

        @Override
        public Mono<String> getUserByUsername(String username, String bearerToken) {
            userCalls.incrementAndGet();
            return userFailure != null ? Mono.error(userFailure) : Mono.just(userJson);
        }

        @Override
        public Mono<String> getUserTweets(String userId, int maxResults, String bearerToken) {
            if (timelineCalls.incrementAndGet() == 1 && rejectFirstTimelineCall) {
                return Mono.error(new SocialApiException("unauthorized", null, false, 401));
            }
            return timelineFailure != null ? Mono.error(timelineFailure) : Mono.just(timeline);
        }

        @Override
        public Mono<String> requestToken(String apiKey, String apiSecret) {
            int n = tokenRequests.incrementAndGet();
            return Mono.just("{\"token_type\":\"bearer\",\"access_token\":\"token-" + n + "\"}");
        }
    }
}
