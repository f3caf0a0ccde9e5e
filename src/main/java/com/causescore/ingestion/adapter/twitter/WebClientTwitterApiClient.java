package com.causescore.ingestion.adapter.twitter;

import com.causescore.ingestion.adapter.SocialApiException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Twitter API v2 client using WebClient.
 */
public class WebClientTwitterApiClient implements TwitterApiClient {

    private static final String TWEET_FIELDS = "created_at,referenced_tweets";

    private final WebClient webClient;
    private final String apiBaseUrl;
    private final String tokenUrl;
    private final Duration timeout;

    public WebClientTwitterApiClient(WebClient.Builder builder, String apiBaseUrl, String tokenUrl, Duration timeout) {
        this.webClient = builder.build();
        this.apiBaseUrl = apiBaseUrl;
        this.tokenUrl = tokenUrl;
        this.timeout = timeout;
    }

    @Override
    public Mono<String> getUserByUsername(String username, String bearerToken) {
        return webClient.get()
                .uri(apiBaseUrl + "/users/by/username/{username}?user.fields=pinned_tweet_id", username)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(this::translate);
    }

    @Override
    public Mono<String> getUserTweets(String userId, int maxResults, String bearerToken) {
        int bounded = Math.max(5, Math.min(maxResults, 100));
        return webClient.get()
                .uri(apiBaseUrl + "/users/{id}/tweets?max_results={max}&tweet.fields=" + TWEET_FIELDS, userId, bounded)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(this::translate);
    }

    @Override
    public Mono<String> requestToken(String apiKey, String apiSecret) {
        return webClient.post()
                .uri(tokenUrl)
                .headers(h -> h.setBasicAuth(apiKey, apiSecret))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("grant_type", "client_credentials"))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(this::translate);
    }

    private Throwable translate(Throwable e) {
        if (e instanceof SocialApiException) {
            return e;
        }
        if (e instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            boolean retryable = status == 429 || status >= 500;
            return new SocialApiException("Twitter HTTP " + status + ": " + wcre.getStatusText(), e, retryable, status);
        }
        if (e instanceof TimeoutException) {
            return new SocialApiException("Twitter request timed out after " + timeout.toSeconds() + "s", e);
        }
        return new SocialApiException("Twitter request failed: " + e.getMessage(), e);
    }
}
