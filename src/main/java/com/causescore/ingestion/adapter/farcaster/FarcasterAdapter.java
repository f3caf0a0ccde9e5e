package com.causescore.ingestion.adapter.farcaster;

import com.causescore.common.HandleParser;
import com.causescore.domain.Platform;
import com.causescore.ingestion.adapter.FetchWindow;
import com.causescore.ingestion.adapter.IdentityCache;
import com.causescore.ingestion.adapter.NormalizedPost;
import com.causescore.ingestion.adapter.PlatformCallExecutor;
import com.causescore.ingestion.adapter.PlatformIdentity;
import com.causescore.ingestion.adapter.SocialApiException;
import com.causescore.ingestion.adapter.SocialPlatformAdapter;
import com.causescore.ingestion.config.FarcasterProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Farcaster adapter: FName registry resolves a name to an FID, Warpcast profile-casts supplies the timeline.
 * A name whose latest transfer goes to FID 0 has been released and resolves to nothing.
 */
@Component
@Slf4j
public class FarcasterAdapter implements SocialPlatformAdapter {

    private static final int HASH_PREFIX_LENGTH = 10;

    private final FarcasterApiClient client;
    private final FarcasterCastFeed castFeed;
    private final PlatformCallExecutor executor;
    private final IdentityCache identityCache;
    private final FarcasterProperties properties;

    public FarcasterAdapter(FarcasterApiClient client,
                            FarcasterCastFeed castFeed,
                            @Qualifier("farcasterCallExecutor") PlatformCallExecutor executor,
                            @Qualifier("farcasterIdentityCache") IdentityCache identityCache,
                            FarcasterProperties properties) {
        this.client = client;
        this.castFeed = castFeed;
        this.executor = executor;
        this.identityCache = identityCache;
        this.properties = properties;
    }

    @Override
    public boolean supports(Platform platform) {
        return platform == Platform.FARCASTER;
    }

    @Override
    public Optional<PlatformIdentity> resolveIdentity(String handleOrUrl) {
        Optional<String> name = HandleParser.farcasterName(handleOrUrl).map(HandleParser::stripEnsSuffix);
        if (name.isEmpty()) {
            log.warn("Not a Farcaster name: {}", handleOrUrl);
            return Optional.empty();
        }
        try {
            return identityCache.resolve(name.get(), this::lookupFid);
        } catch (SocialApiException e) {
            log.warn("FName lookup failed for {}: {}", name.get(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<PlatformIdentity> lookupFid(String name) {
        String json = executor.execute("fname " + name, () -> client.getFnameTransfers(name).block());
        return parseFid(json).map(fid -> PlatformIdentity.of(name, fid));
    }

    @Override
    public List<NormalizedPost> fetchRecent(PlatformIdentity identity, Instant sinceWatermark) {
        FetchWindow window = FetchWindow.of(Instant.now(), properties.getLookbackDays(), sinceWatermark);
        List<FarcasterCast> casts;
        try {
            casts = castFeed.recentCasts(identity.id());
        } catch (SocialApiException e) {
            log.warn("Farcaster fetch gave up for {} (fid {}): {}", identity.handle(), identity.id(), e.getMessage());
            return List.of();
        }

        List<NormalizedPost> collected = new ArrayList<>();
        int scanned = 0;
        for (FarcasterCast cast : casts) {
            if (scanned++ >= properties.getScanLimit() || collected.size() >= properties.getMaxPostsPerFetch()) {
                break;
            }
            if (window.isPastWatermark(cast.timestamp()) || window.isPastLookback(cast.timestamp())) {
                break;
            }
            if (cast.isPureRecast() || !window.accepts(cast.timestamp())) {
                continue;
            }
            collected.add(toPost(cast, identity));
        }
        log.debug("Farcaster {}: scanned {} collected {} since {}", identity.handle(), scanned, collected.size(), sinceWatermark);
        return collected;
    }

    private NormalizedPost toPost(FarcasterCast cast, PlatformIdentity identity) {
        String username = cast.authorUsername().isBlank() ? identity.handle() : cast.authorUsername();
        String shortHash = cast.hash().length() > HASH_PREFIX_LENGTH ? cast.hash().substring(0, HASH_PREFIX_LENGTH) : cast.hash();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("platform", Platform.FARCASTER.name().toLowerCase());
        metadata.put("fid", identity.id());
        metadata.put("username", username);
        String url = properties.getCastUrlPrefix() + "/" + username + "/" + shortHash;
        return new NormalizedPost(cast.hash(), Platform.FARCASTER, cast.text(), url, cast.timestamp(), metadata);
    }

    /**
     * FID from an FName transfers response: the latest transfer by timestamp wins; a transfer to 0 means released.
     */
    static Optional<String> parseFid(String json) {
        JsonNode transfers;
        try {
            transfers = new ObjectMapper().readTree(json).path("transfers");
        } catch (Exception e) {
            throw new SocialApiException("Unparseable FName transfers response", e);
        }
        if (!transfers.isArray() || transfers.isEmpty()) {
            return Optional.empty();
        }
        JsonNode latest = null;
        for (JsonNode transfer : transfers) {
            if (latest == null || transfer.path("timestamp").asLong() >= latest.path("timestamp").asLong()) {
                latest = transfer;
            }
        }
        long to = latest.path("to").asLong(0);
        return to > 0 ? Optional.of(Long.toString(to)) : Optional.empty();
    }
}
