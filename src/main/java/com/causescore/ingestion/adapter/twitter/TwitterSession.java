package com.causescore.ingestion.adapter.twitter;

import java.time.Instant;

/**
 * Persisted login state: the bearer token and which credential set produced it.
 */
public record TwitterSession(String bearerToken, String apiKey, Instant createdAt) {
}
