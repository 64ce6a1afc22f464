package com.chainwatch.ingestion.job;

import com.chainwatch.ingestion.watch.WalletWatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic wallet watch. Ticks never overlap (fixed delay).
 */
@Component
@ConditionalOnProperty(prefix = "chainwatch.watch", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class WalletWatchJob {

    private final WalletWatchService walletWatchService;

    @Scheduled(fixedDelayString = "${chainwatch.watch.poll-interval-ms:60000}")
    public void runScheduled() {
        try {
            walletWatchService.runTick();
        } catch (RuntimeException e) {
            log.error("Wallet watch tick failed", e);
        }
    }
}
