package com.haulmarket.arb.core;

import com.haulmarket.arb.domain.ScanReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic full scan of the configured pairs. Off unless
 * {@code arbitrage.scan.scheduled.enabled} is true.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "arbitrage.scan.scheduled", name = "enabled", havingValue = "true")
public class ScheduledScanRunner {

    private final ScanOrchestrator orchestrator;

    private volatile ScanReport lastReport;

    @Scheduled(fixedDelayString = "${arbitrage.scan.scheduled.interval-ms:900000}",
            initialDelayString = "${arbitrage.scan.scheduled.initial-delay-ms:10000}")
    public void runScheduledScan() {
        log.info("Scheduled scan starting");
        try {
            lastReport = orchestrator.runScan();
        } catch (ScanPersistenceException e) {
            log.error("Scheduled scan aborted: {}", e.getMessage());
        }
    }

    public ScanReport getLastReport() {
        return lastReport;
    }
}
