package com.causescore.ingestion.adapter.farcaster;

import com.causescore.config.CaffeineConfig;
import com.causescore.ingestion.adapter.PlatformCallExecutor;
import com.causescore.ingestion.adapter.SocialApiException;
import com.causescore.ingestion.config.FarcasterProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recent casts per FID, cached for an hour. Failures propagate and are not cached.
 */
@Component
@Slf4j
public class FarcasterCastFeed {

    private final FarcasterApiClient client;
    private final PlatformCallExecutor executor;
    private final FarcasterProperties properties;

    public FarcasterCastFeed(FarcasterApiClient client,
                             @Qualifier("farcasterCallExecutor") PlatformCallExecutor executor,
                             FarcasterProperties properties) {
        this.client = client;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * Casts for the FID, newest first.
     */
    @Cacheable(cacheNames = CaffeineConfig.FARCASTER_CASTS_CACHE, key = "#fid")
    public List<FarcasterCast> recentCasts(String fid) {
        String json = executor.execute("casts fid=" + fid,
                () -> client.getProfileCasts(fid, properties.getScanLimit()).block());
        return parseCasts(json);
    }

    static List<FarcasterCast> parseCasts(String json) {
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(json);
        } catch (Exception e) {
            throw new SocialApiException("Unparseable profile-casts response", e);
        }
        JsonNode casts = root.path("result").path("casts");
        if (!casts.isArray()) {
            return List.of();
        }
        List<FarcasterCast> parsed = new ArrayList<>();
        for (JsonNode cast : casts) {
            String hash = cast.path("hash").asText("");
            JsonNode ts = cast.path("timestamp");
            if (hash.isBlank() || !ts.canConvertToLong()) {
                log.debug("Skipping malformed cast {}", cast);
                continue;
            }
            parsed.add(new FarcasterCast(
                    hash,
                    cast.path("author").path("username").asText(""),
                    cast.path("text").asText(""),
                    Instant.ofEpochMilli(ts.asLong())));
        }
        parsed.sort(Comparator.comparing(FarcasterCast::timestamp).reversed());
        return parsed;
    }
}
