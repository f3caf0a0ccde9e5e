package com.causescore.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Farcaster adapter settings. Documented in application.yml under causescore.ingestion.farcaster.
 */
@ConfigurationProperties(prefix = "causescore.ingestion.farcaster")
@NoArgsConstructor
@Getter
@Setter
public class FarcasterProperties extends PlatformFetchProperties {

    /** FName registry transfers endpoint (name to FID). */
    private String fnameRegistryUrl = "https://fnames.farcaster.xyz/transfers";

    /** Warpcast client API base URL. */
    private String warpcastApiUrl = "https://client.warpcast.com/v2";

    /** Public URL prefix for cast links. */
    private String castUrlPrefix = "https://warpcast.com";

    /** Timeout for the FName lookup, in seconds. */
    private int lookupTimeoutSeconds = 10;

    /** Timeout for the casts request, in seconds. */
    private int castsTimeoutSeconds = 15;

    {
        setMinDelayMs(2000L);
        setMaxDelayMs(3000L);
        setRetryBaseDelayMs(2000L);
    }
}
