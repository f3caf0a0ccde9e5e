package com.causescore.ingestion.adapter.farcaster;

import com.causescore.ingestion.adapter.SocialApiException;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Farcaster client using WebClient. Lookup and casts calls carry separate timeouts.
 */
public class WebClientFarcasterApiClient implements FarcasterApiClient {

    private final WebClient webClient;
    private final String fnameRegistryUrl;
    private final String warpcastApiUrl;
    private final Duration lookupTimeout;
    private final Duration castsTimeout;

    public WebClientFarcasterApiClient(WebClient.Builder builder,
                                       String fnameRegistryUrl,
                                       String warpcastApiUrl,
                                       Duration lookupTimeout,
                                       Duration castsTimeout) {
        this.webClient = builder.build();
        this.fnameRegistryUrl = fnameRegistryUrl;
        this.warpcastApiUrl = warpcastApiUrl;
        this.lookupTimeout = lookupTimeout;
        this.castsTimeout = castsTimeout;
    }

    @Override
    public Mono<String> getFnameTransfers(String name) {
        return webClient.get()
                .uri(fnameRegistryUrl + "?name={name}", name)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(lookupTimeout)
                .onErrorMap(e -> translate(e, "FName lookup", lookupTimeout));
    }

    @Override
    public Mono<String> getProfileCasts(String fid, int limit) {
        return webClient.get()
                .uri(warpcastApiUrl + "/profile-casts?fid={fid}&limit={limit}", fid, limit)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(castsTimeout)
                .onErrorMap(e -> translate(e, "profile-casts", castsTimeout));
    }

    private static Throwable translate(Throwable e, String operation, Duration timeout) {
        if (e instanceof SocialApiException) {
            return e;
        }
        if (e instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            boolean retryable = status == 429 || status >= 500;
            return new SocialApiException("Farcaster " + operation + " HTTP " + status, e, retryable, status);
        }
        if (e instanceof TimeoutException) {
            return new SocialApiException("Farcaster " + operation + " timed out after " + timeout.toSeconds() + "s", e);
        }
        return new SocialApiException("Farcaster " + operation + " failed: " + e.getMessage(), e);
    }
}
