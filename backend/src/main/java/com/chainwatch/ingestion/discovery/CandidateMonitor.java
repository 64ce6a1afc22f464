package com.chainwatch.ingestion.discovery;

import com.chainwatch.domain.CandidateStatus;
import com.chainwatch.domain.CandidateToken;
import com.chainwatch.ingestion.risk.RiskClassifier;
import com.chainwatch.notification.NotificationPublisher;
import com.chainwatch.subscription.SubscriberRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Classifies every retained candidate once per cycle. Rejected and expired candidates are dropped; a classified one
 * is announced once to each auto-snipe subscriber and then dropped too.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CandidateMonitor {

    private final MonitoredCandidates monitoredCandidates;
    private final RiskClassifier riskClassifier;
    private final SubscriberRegistry subscriberRegistry;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    public MonitorCycleResult runCycle() {
        List<CandidateToken> candidates = monitoredCandidates.snapshot();
        if (candidates.isEmpty()) {
            return MonitorCycleResult.empty();
        }
        Instant now = clock.instant();
        int classified = 0;
        int rejected = 0;
        int expired = 0;
        int pending = 0;
        int alerts = 0;
        for (CandidateToken candidate : candidates) {
            CandidateStatus status = riskClassifier.classify(candidate, now);
            switch (status) {
                case PENDING -> pending++;
                case REJECTED -> {
                    rejected++;
                    monitoredCandidates.remove(candidate);
                    log.info("Rejected pair {}: honeypot ({})", candidate.getPairAddress(),
                            candidate.getLastReport() != null ? candidate.getLastReport().honeypotReason() : "taxes");
                }
                case EXPIRED -> {
                    expired++;
                    monitoredCandidates.remove(candidate);
                    log.info("Expired pair {} after {} min", candidate.getPairAddress(), candidate.ageAt(now).toMinutes());
                }
                case CLASSIFIED -> {
                    classified++;
                    alerts += announce(candidate);
                    monitoredCandidates.remove(candidate);
                }
            }
        }
        log.debug("Candidate cycle: {} pending, {} classified, {} rejected, {} expired",
                pending, classified, rejected, expired);
        return new MonitorCycleResult(classified, rejected, expired, pending, alerts);
    }

    private int announce(CandidateToken candidate) {
        List<String> subscribers = subscriberRegistry.autoSnipeSubscribers();
        if (subscribers.isEmpty()) {
            log.info("Pair {} classified to buy; no auto-snipe subscriber, alert suppressed", candidate.getPairAddress());
            return 0;
        }
        for (String subscriber : subscribers) {
            notificationPublisher.notifyCandidateToBuy(subscriber, candidate);
        }
        log.info("Pair {} classified to buy; alerted {} subscriber(s)", candidate.getPairAddress(), subscribers.size());
        return subscribers.size();
    }
}
