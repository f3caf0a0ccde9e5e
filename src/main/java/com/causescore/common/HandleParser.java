package com.causescore.common;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts handles from the profile URLs or bare names stored for a project.
 */
public final class HandleParser {

    private static final Set<String> TWITTER_HOSTS = Set.of("twitter.com", "x.com", "mobile.twitter.com");
    private static final Set<String> FARCASTER_HOSTS = Set.of("warpcast.com", "farcaster.xyz", "www.farcaster.xyz");
    private static final Set<String> TWITTER_RESERVED = Set.of("home", "intent", "share", "search", "i", "hashtag");

    private HandleParser() {
    }

    public static Optional<String> twitterHandle(String value) {
        return extract(value, TWITTER_HOSTS)
                .filter(h -> !TWITTER_RESERVED.contains(h.toLowerCase(Locale.ROOT)))
                .filter(h -> h.matches("[A-Za-z0-9_]{1,15}"));
    }

    public static Optional<String> farcasterName(String value) {
        return extract(value, FARCASTER_HOSTS)
                .map(h -> h.toLowerCase(Locale.ROOT))
                .filter(h -> h.matches("[a-z0-9][a-z0-9.-]{0,31}"));
    }

    /** FName registry lookups use the name without an ENS suffix. */
    public static String stripEnsSuffix(String name) {
        return name.endsWith(".eth") ? name.substring(0, name.length() - 4) : name;
    }

    private static Optional<String> extract(String value, Set<String> hosts) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.strip();
        if (!trimmed.contains("/")) {
            String bare = trimmed.startsWith("@") ? trimmed.substring(1) : trimmed;
            return bare.isEmpty() ? Optional.empty() : Optional.of(bare);
        }
        String withScheme = trimmed.matches("(?i)^https?://.*") ? trimmed : "https://" + trimmed;
        try {
            URI uri = URI.create(withScheme);
            String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
            if (host.startsWith("www.") && !hosts.contains(host)) {
                host = host.substring(4);
            }
            if (!hosts.contains(host) || uri.getPath() == null) {
                return Optional.empty();
            }
            String[] segments = uri.getPath().split("/");
            for (String segment : segments) {
                if (!segment.isBlank()) {
                    String handle = segment.startsWith("@") ? segment.substring(1) : segment;
                    return handle.isEmpty() ? Optional.empty() : Optional.of(handle);
                }
            }
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
