package com.causescore.ingestion.adapter.farcaster;

import com.causescore.common.RandomDelayRateLimiter;
import com.causescore.common.RetryPolicy;
import com.causescore.ingestion.adapter.IdentityCache;
import com.causescore.ingestion.adapter.NormalizedPost;
import com.causescore.ingestion.adapter.PlatformCallExecutor;
import com.causescore.ingestion.adapter.PlatformIdentity;
import com.causescore.ingestion.config.FarcasterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class FarcasterAdapterTest {

    private FakeFarcasterApiClient client;
    private FarcasterAdapter adapter;

    @BeforeEach
    void setUp() {
        client = new FakeFarcasterApiClient();
        FarcasterProperties properties = new FarcasterProperties();
        properties.setMaxPostsPerFetch(10);
        properties.setScanLimit(30);
        properties.setLookbackDays(90);
        PlatformCallExecutor executor = new PlatformCallExecutor("Farcaster", new RandomDelayRateLimiter(0, 0),
                new RetryPolicy(0, 0, 1));
        FarcasterCastFeed feed = new FarcasterCastFeed(client, executor, properties);
        adapter = new FarcasterAdapter(client, feed, executor,
                new IdentityCache(Duration.ofHours(1), Duration.ofMinutes(5), 100), properties);
    }

    @Test
    @DisplayName("latest FName transfer decides the FID")
    void resolveIdentity_usesLatestTransfer() {
        client.transfers = "{\"transfers\":[{\"timestamp\":100,\"to\":11},{\"timestamp\":200,\"to\":22}]}";

        assertThat(adapter.resolveIdentity("https://warpcast.com/giveth.eth"))
                .contains(PlatformIdentity.of("giveth", "22"));
        assertThat(client.lastName).isEqualTo("giveth");
    }

    @Test
    @DisplayName("a name transferred to FID 0 is released")
    void resolveIdentity_releasedName() {
        client.transfers = "{\"transfers\":[{\"timestamp\":100,\"to\":11},{\"timestamp\":200,\"to\":0}]}";
        assertThat(adapter.resolveIdentity("giveth")).isEmpty();
    }

    @Test
    void resolveIdentity_noTransfers() {
        client.transfers = "{\"transfers\":[]}";
        assertThat(adapter.resolveIdentity("giveth")).isEmpty();
    }

    @Test
    @DisplayName("casts are collected newest first until one is older than the watermark; recasts skipped")
    void fetchRecent_haltsAtWatermark() {
        Instant now = Instant.now();
        Instant watermark = now.minus(Duration.ofHours(3));
        client.casts = casts(
                cast("0xaaaaaaaaaaaaaaaa", now.minus(Duration.ofHours(1)), "hello"),
                cast("0xbbbbbbbbbbbbbbbb", now.minus(Duration.ofHours(2)), ""),
                cast("0xcccccccccccccccc", now.minus(Duration.ofHours(4)), "old"),
                cast("0xdddddddddddddddd", now.minus(Duration.ofMinutes(30)), "newest"));

        List<NormalizedPost> posts = adapter.fetchRecent(PlatformIdentity.of("giveth", "22"), watermark);

        assertThat(posts).extracting(NormalizedPost::postId).containsExactly("0xdddddddddddddddd", "0xaaaaaaaaaaaaaaaa");
        assertThat(posts.get(0).url()).isEqualTo("https://warpcast.com/giveth/0xdddddddd");
    }

    @Test
    void fetchRecent_failureReturnsEmpty() {
        client.castsFailure = new RuntimeException("timeout");
        assertThat(adapter.fetchRecent(PlatformIdentity.of("giveth", "22"), null)).isEmpty();
        assertThat(client.castCalls).hasValue(2);
    }

    @Test
    void parseCasts_skipsMalformedAndSortsNewestFirst() {
        String json = casts(
                "{\"hash\":\"0x1\",\"timestamp\":1000,\"text\":\"a\",\"author\":{\"username\":\"g\"}}",
                "{\"timestamp\":3000,\"text\":\"no hash\"}",
                "{\"hash\":\"0x2\",\"timestamp\":2000,\"text\":\"b\",\"author\":{\"username\":\"g\"}}");

        assertThat(FarcasterCastFeed.parseCasts(json)).extracting(FarcasterCast::hash).containsExactly("0x2", "0x1");
    }

    private static String cast(String hash, Instant timestamp, String text) {
        return "{\"hash\":\"" + hash + "\",\"timestamp\":" + timestamp.toEpochMilli()
                + ",\"text\":\"" + text + "\",\"author\":{\"username\":\"giveth\"}}";
    }

    private static String casts(String... casts) {
        return "{\"result\":{\"casts\":[" + String.join(",", casts) + "]}}";
    }

    static class FakeFarcasterApiClient implements FarcasterApiClient {
        String transfers = "{\"transfers\":[]}";
        String casts = "{\"result\":{\"casts\":[]}}";
        RuntimeException castsFailure;
        String lastName;
        final AtomicInteger castCalls = new AtomicInteger();

        @Override
        public Mono<String> getFnameTransfers(String name) {
            lastName = name;
            return Mono.just(transfers);
        }

        @Override
        public Mono<String> getProfileCasts(String fid, int limit) {
            castCalls.incrementAndGet();
            return castsFailure != null ? Mono.error(castsFailure) : Mono.just(casts);
        }
    }
}
