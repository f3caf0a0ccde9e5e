package com.causescore.ingestion.adapter.twitter;

import reactor.core.publisher.Mono;

/**
 * Twitter/X HTTP client abstraction so the adapter can be tested without the network.
 * Responses are raw JSON; parsing and retries stay in {@link TwitterAdapter}.
 */
public interface TwitterApiClient {

    /** GET /users/by/username/{username} with pinned_tweet_id. */
    Mono<String> getUserByUsername(String username, String bearerToken);

    /** GET /users/{id}/tweets, newest first. */
    Mono<String> getUserTweets(String userId, int maxResults, String bearerToken);

    /** OAuth2 client-credentials login; returns the token response JSON. */
    Mono<String> requestToken(String apiKey, String apiSecret);
}
