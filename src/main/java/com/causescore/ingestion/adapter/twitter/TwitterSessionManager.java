package com.causescore.ingestion.adapter.twitter;

import com.causescore.common.RandomDelayRateLimiter;
import com.causescore.ingestion.adapter.SocialApiException;
import com.causescore.ingestion.config.TwitterProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Owns the Twitter bearer token. Order of preference: in-memory session, saved session file, fresh login.
 * Fresh login starts with a randomly chosen credential set and falls back to the others; the resulting
 * session is written back to the session file. Token requests wait on the same limiter as API calls.
 */
@Slf4j
public class TwitterSessionManager {

    private final TwitterApiClient client;
    private final RandomDelayRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Path sessionFile;
    private final List<TwitterProperties.Credential> credentials;

    private TwitterSession current;

    public TwitterSessionManager(TwitterApiClient client,
                                 RandomDelayRateLimiter rateLimiter,
                                 ObjectMapper objectMapper,
                                 Path sessionFile,
                                 List<TwitterProperties.Credential> credentials) {
        this.client = client;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.sessionFile = sessionFile;
        this.credentials = credentials == null ? List.of() : List.copyOf(credentials);
    }

    public synchronized String bearerToken() {
        if (current == null) {
            current = loadSavedSession().orElseGet(this::login);
        }
        return current.bearerToken();
    }

    /**
     * Drops the current session (rejected by the API) and logs in again.
     */
    public synchronized String refresh() {
        log.info("Twitter session rejected, logging in with credentials");
        current = login();
        return current.bearerToken();
    }

    Optional<TwitterSession> loadSavedSession() {
        if (sessionFile == null || !Files.isRegularFile(sessionFile)) {
            return Optional.empty();
        }
        try {
            TwitterSession saved = objectMapper.readValue(sessionFile.toFile(), TwitterSession.class);
            if (saved.bearerToken() == null || saved.bearerToken().isBlank()) {
                return Optional.empty();
            }
            log.debug("Loaded saved Twitter session from {}", sessionFile);
            return Optional.of(saved);
        } catch (IOException e) {
            log.warn("Could not read Twitter session file {}: {}", sessionFile, e.getMessage());
            return Optional.empty();
        }
    }

    private TwitterSession login() {
        List<TwitterProperties.Credential> usable = credentials.stream()
                .filter(TwitterProperties.Credential::isComplete)
                .toList();
        if (usable.isEmpty()) {
            throw new SocialApiException("No Twitter credentials configured", null, false, 401);
        }
        Exception lastException = null;
        for (TwitterProperties.Credential credential : randomPrimaryOrder(usable)) {
            try {
                rateLimiter.acquire();
                String json = client.requestToken(credential.getApiKey(), credential.getApiSecret()).block();
                String token = parseAccessToken(json)
                        .orElseThrow(() -> new SocialApiException("Token response has no access_token"));
                TwitterSession session = new TwitterSession(token, credential.getApiKey(), Instant.now());
                saveSession(session);
                return session;
            } catch (RuntimeException e) {
                lastException = e;
                log.warn("Twitter login failed for credential set {}: {}", mask(credential.getApiKey()), e.getMessage());
            }
        }
        throw new SocialApiException("Twitter login failed for all " + usable.size() + " credential sets",
                lastException, false, 401);
    }

    private void saveSession(TwitterSession session) {
        if (sessionFile == null) {
            return;
        }
        try {
            Path parent = sessionFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(sessionFile.toFile(), session);
        } catch (IOException e) {
            log.warn("Could not persist Twitter session to {}: {}", sessionFile, e.getMessage());
        }
    }

    static List<TwitterProperties.Credential> randomPrimaryOrder(List<TwitterProperties.Credential> usable) {
        int start = ThreadLocalRandom.current().nextInt(usable.size());
        List<TwitterProperties.Credential> ordered = new ArrayList<>(usable.size());
        for (int i = 0; i < usable.size(); i++) {
            ordered.add(usable.get((start + i) % usable.size()));
        }
        return ordered;
    }

    static Optional<String> parseAccessToken(String json) {
        try {
            JsonNode root = new ObjectMapper().readTree(json);
            JsonNode token = root.path("access_token");
            if (!token.isTextual() || token.asText().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(token.asText());
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    private static String mask(String apiKey) {
        if (apiKey == null || apiKey.length() < 4) {
            return "****";
        }
        return apiKey.substring(0, 4) + "****";
    }
}
