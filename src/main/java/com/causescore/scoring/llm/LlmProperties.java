package com.causescore.scoring.llm;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OpenRouter-compatible chat-completions provider.
 */
@ConfigurationProperties(prefix = "causescore.llm")
@NoArgsConstructor
@Getter
@Setter
public class LlmProperties {

    private String baseUrl = "https://openrouter.ai/api/v1";

    /** Bearer key; set via environment (CAUSESCORE_LLM_API_KEY). */
    private String apiKey;

    private String model = "google/gemini-2.5-flash";

    /** Per-call timeout. Default 30 s. */
    private int timeoutSeconds = 30;

    /** Local limiter: completions per second across all evaluations. Default 2. */
    private int maxRequestsPerSecond = 2;

    /** How long a caller may wait for a limiter permit. Default 30000 ms. */
    private long limiterTimeoutMs = 30_000L;

    private double temperature = 0.3;

    private int maxTokens = 1000;
}
