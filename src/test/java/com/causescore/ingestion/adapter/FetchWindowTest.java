package com.causescore.ingestion.adapter;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class FetchWindowTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Test
    void noWatermark_cutoffIsLookback() {
        FetchWindow window = FetchWindow.of(NOW, 90, null);
        assertThat(window.effectiveCutoff()).isEqualTo(NOW.minus(Duration.ofDays(90)));
        assertThat(window.isPastWatermark(NOW.minus(Duration.ofDays(200)))).isFalse();
    }

    @Test
    void recentWatermark_winsOverLookback() {
        Instant watermark = NOW.minus(Duration.ofDays(2));
        FetchWindow window = FetchWindow.of(NOW, 90, watermark);
        assertThat(window.effectiveCutoff()).isEqualTo(watermark);
        assertThat(window.accepts(watermark)).isTrue();
        assertThat(window.isPastWatermark(watermark)).isFalse();
        assertThat(window.isPastWatermark(watermark.minusSeconds(1))).isTrue();
    }

    @Test
    void staleWatermark_lookbackStillBounds() {
        FetchWindow window = FetchWindow.of(NOW, 90, NOW.minus(Duration.ofDays(365)));
        Instant old = NOW.minus(Duration.ofDays(100));
        assertThat(window.accepts(old)).isFalse();
        assertThat(window.isPastLookback(old)).isTrue();
    }
}
