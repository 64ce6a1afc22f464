package com.chainwatch.ingestion.job;

import com.chainwatch.common.ComputeBudgetTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily compute budget tick; the tracker decides whether a new month started.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ComputeBudgetResetJob {

    private final ComputeBudgetTracker computeBudgetTracker;

    @Scheduled(
            fixedRateString = "${chainwatch.budget.reset-interval-ms:86400000}",
            initialDelayString = "${chainwatch.budget.reset-interval-ms:86400000}")
    public void runScheduled() {
        long consumed = computeBudgetTracker.getConsumedUnits();
        if (computeBudgetTracker.dailyTick()) {
            log.info("Compute budget reset for the new month ({} units used last period)", consumed);
        } else {
            log.debug("Compute budget: {} of {} units used, {} tick(s) since reset", computeBudgetTracker.getConsumedUnits(),
                    computeBudgetTracker.getCapacity(), computeBudgetTracker.getTicksSinceReset());
        }
    }
}
