package com.causescore.ingestion.job;

import com.causescore.ingestion.store.CorruptionSweeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class WatermarkRepairJob {

    private final CorruptionSweeper sweeper;

    @Scheduled(
            fixedDelayString = "${causescore.ingestion.repair.interval-ms:21600000}",
            initialDelayString = "${causescore.ingestion.repair.initial-delay-ms:300000}")
    public void runScheduled() {
        try {
            sweeper.sweep();
        } catch (RuntimeException e) {
            log.error("Watermark corruption sweep failed", e);
        }
    }
}
