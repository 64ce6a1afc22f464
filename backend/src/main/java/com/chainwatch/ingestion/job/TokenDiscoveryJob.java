package com.chainwatch.ingestion.job;

import com.chainwatch.ingestion.discovery.CandidateMonitor;
import com.chainwatch.ingestion.discovery.TokenDiscoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic token discovery followed by one classification cycle over the retained candidates.
 */
@Component
@ConditionalOnProperty(prefix = "chainwatch.discovery", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class TokenDiscoveryJob {

    private final TokenDiscoveryService tokenDiscoveryService;
    private final CandidateMonitor candidateMonitor;

    @Scheduled(fixedDelayString = "${chainwatch.discovery.poll-interval-ms:60000}")
    public void runScheduled() {
        try {
            tokenDiscoveryService.runTick();
            candidateMonitor.runCycle();
        } catch (RuntimeException e) {
            log.error("Token discovery tick failed", e);
        }
    }
}
