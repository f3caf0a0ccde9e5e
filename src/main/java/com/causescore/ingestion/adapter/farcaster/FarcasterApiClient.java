package com.causescore.ingestion.adapter.farcaster;

import reactor.core.publisher.Mono;

/**
 * Farcaster HTTP client abstraction: FName registry for name to FID, Warpcast client API for casts.
 */
public interface FarcasterApiClient {

    Mono<String> getFnameTransfers(String name);

    Mono<String> getProfileCasts(String fid, int limit);
}
