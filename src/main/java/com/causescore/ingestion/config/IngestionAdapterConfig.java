package com.causescore.ingestion.config;

import com.causescore.common.RandomDelayRateLimiter;
import com.causescore.common.RetryPolicy;
import com.causescore.ingestion.adapter.IdentityCache;
import com.causescore.ingestion.adapter.PlatformCallExecutor;
import com.causescore.ingestion.adapter.farcaster.FarcasterApiClient;
import com.causescore.ingestion.adapter.farcaster.WebClientFarcasterApiClient;
import com.causescore.ingestion.adapter.twitter.TwitterApiClient;
import com.causescore.ingestion.adapter.twitter.TwitterSessionManager;
import com.causescore.ingestion.adapter.twitter.WebClientTwitterApiClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires one rate limiter, retry policy, identity cache and HTTP client per platform from its properties.
 */
@Configuration
@EnableConfigurationProperties({ TwitterProperties.class, FarcasterProperties.class, PostStoreProperties.class, JobProperties.class, RepairProperties.class })
public class IngestionAdapterConfig {

    private static final long IDENTITY_CACHE_SIZE = 10_000;

    /** Shared by the Twitter adapter and session manager; one slot per outbound request. */
    @Bean(name = "twitterRateLimiter")
    public RandomDelayRateLimiter twitterRateLimiter(TwitterProperties properties) {
        return new RandomDelayRateLimiter(properties.getMinDelayMs(), properties.getMaxDelayMs());
    }

    @Bean(name = "twitterCallExecutor")
    public PlatformCallExecutor twitterCallExecutor(TwitterProperties properties) {
        return new PlatformCallExecutor("Twitter", null, retryPolicy(properties));
    }

    @Bean(name = "farcasterCallExecutor")
    public PlatformCallExecutor farcasterCallExecutor(FarcasterProperties properties) {
        RandomDelayRateLimiter limiter = new RandomDelayRateLimiter(properties.getMinDelayMs(), properties.getMaxDelayMs());
        return new PlatformCallExecutor("Farcaster", limiter, retryPolicy(properties));
    }

    @Bean(name = "twitterIdentityCache")
    public IdentityCache twitterIdentityCache(TwitterProperties properties) {
        return identityCache(properties);
    }

    @Bean(name = "farcasterIdentityCache")
    public IdentityCache farcasterIdentityCache(FarcasterProperties properties) {
        return identityCache(properties);
    }

    @Bean
    public TwitterApiClient twitterApiClient(WebClient.Builder webClientBuilder, TwitterProperties properties) {
        return new WebClientTwitterApiClient(webClientBuilder, properties.getApiBaseUrl(), properties.getTokenUrl(),
                Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
    }

    @Bean
    public TwitterSessionManager twitterSessionManager(TwitterApiClient twitterApiClient,
                                                       @Qualifier("twitterRateLimiter") RandomDelayRateLimiter twitterRateLimiter,
                                                       ObjectMapper objectMapper,
                                                       TwitterProperties properties) {
        Path sessionFile = properties.getSessionFile() == null || properties.getSessionFile().isBlank()
                ? null
                : Path.of(properties.getSessionFile());
        return new TwitterSessionManager(twitterApiClient, twitterRateLimiter, objectMapper, sessionFile, properties.getCredentials());
    }

    @Bean
    public FarcasterApiClient farcasterApiClient(WebClient.Builder webClientBuilder, FarcasterProperties properties) {
        return new WebClientFarcasterApiClient(webClientBuilder,
                properties.getFnameRegistryUrl(),
                properties.getWarpcastApiUrl(),
                Duration.ofSeconds(properties.getLookupTimeoutSeconds()),
                Duration.ofSeconds(properties.getCastsTimeoutSeconds()));
    }

    private static RetryPolicy retryPolicy(PlatformFetchProperties properties) {
        return new RetryPolicy(properties.getRetryBaseDelayMs(), properties.getRetryJitterMs(), properties.getMaxRetries());
    }

    private static IdentityCache identityCache(PlatformFetchProperties properties) {
        return new IdentityCache(
                Duration.ofHours(properties.getIdentityCacheTtlHours()),
                Duration.ofMinutes(properties.getMissingIdentityCacheTtlMinutes()),
                IDENTITY_CACHE_SIZE);
    }
}
