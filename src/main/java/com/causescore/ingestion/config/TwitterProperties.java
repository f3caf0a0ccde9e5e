package com.causescore.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Twitter/X adapter settings. Documented in application.yml under causescore.ingestion.twitter.
 */
@ConfigurationProperties(prefix = "causescore.ingestion.twitter")
@NoArgsConstructor
@Getter
@Setter
public class TwitterProperties extends PlatformFetchProperties {

    /** API v2 base URL. */
    private String apiBaseUrl = "https://api.twitter.com/2";

    /** OAuth2 token endpoint used to log in with app credentials. */
    private String tokenUrl = "https://api.twitter.com/oauth2/token";

    /** Saved session (bearer token) file; read first, rewritten after every fresh login. */
    private String sessionFile = "./data/twitter-session.json";

    /** Request timeout in seconds. */
    private int requestTimeoutSeconds = 15;

    /** Credential sets; one is chosen at random as primary, the others are fallbacks. */
    private List<Credential> credentials = new ArrayList<>();

    {
        setMinDelayMs(3000L);
        setMaxDelayMs(8000L);
        setRetryBaseDelayMs(5000L);
    }

    @Getter
    @Setter
    public static class Credential {
        private String apiKey;
        private String apiSecret;

        public boolean isComplete() {
            return apiKey != null && !apiKey.isBlank() && apiSecret != null && !apiSecret.isBlank();
        }
    }
}
