package com.causescore.scoring.llm;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenRouterLlmClientTest {

    @Test
    void parseContent_readsFirstChoice() {
        assertThat(OpenRouterLlmClient.parseContent("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"{}\"}}]}"))
                .isEqualTo("{}");
    }

    @Test
    void parseContent_emptyOrMissingContentFails() {
        assertThatThrownBy(() -> OpenRouterLlmClient.parseContent("{\"choices\":[]}")).isInstanceOf(LlmException.class);
        assertThatThrownBy(() -> OpenRouterLlmClient.parseContent("{\"choices\":[{\"message\":{\"content\":\" \"}}]}"))
                .isInstanceOf(LlmException.class);
        assertThatThrownBy(() -> OpenRouterLlmClient.parseContent("not json")).isInstanceOf(LlmException.class);
    }

    @Test
    void complete_sendsBearerKeyAndReturnsContent() {
        AtomicReference<String> auth = new AtomicReference<>();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            auth.set(request.headers().getFirst(HttpHeaders.AUTHORIZATION));
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body("{\"choices\":[{\"message\":{\"content\":\"scored\"}}]}")
                    .build());
        });
        LlmProperties properties = new LlmProperties();
        properties.setApiKey("sk-test");

        OpenRouterLlmClient client = new OpenRouterLlmClient(builder, RateLimiter.ofDefaults("test"), properties);

        assertThat(client.complete("system", "user", new CompletionOptions(0.3, 100, true))).isEqualTo("scored");
        assertThat(auth.get()).isEqualTo("Bearer sk-test");
    }

    @Test
    void complete_limiterTimeoutFailsFast() {
        RateLimiter exhausted = RateLimiter.of("exhausted", RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofMinutes(10))
                .timeoutDuration(Duration.ZERO)
                .build());
        exhausted.acquirePermission();
        OpenRouterLlmClient client = new OpenRouterLlmClient(WebClient.builder(), exhausted, new LlmProperties());

        assertThatThrownBy(() -> client.complete("s", "u", new CompletionOptions(0.3, 100, true)))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("limiter");
    }

    @Test
    void complete_httpErrorWrapped() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS).build()));
        OpenRouterLlmClient client = new OpenRouterLlmClient(builder, RateLimiter.ofDefaults("t"), new LlmProperties());

        assertThatThrownBy(() -> client.complete("s", "u", new CompletionOptions(0.3, 100, false)))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("429");
    }
}
