package com.chainwatch.ingestion.risk;

import com.chainwatch.domain.CandidateStatus;
import com.chainwatch.domain.CandidateToken;
import com.chainwatch.ingestion.config.RiskProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Runs every check on a pending candidate and records the outcomes and the resulting status on it.
 */
@Component
@RequiredArgsConstructor
public class RiskClassifier {

    private final HoneypotCheck honeypotCheck;
    private final LiquidityLockCheck liquidityLockCheck;
    private final RenouncementCheck renouncementCheck;
    private final RiskProperties riskProperties;

    public CandidateStatus classify(CandidateToken candidate, Instant now) {
        if (candidate.getStatus().isTerminal()) {
            return candidate.getStatus();
        }
        candidate.setHoneypot(honeypotCheck.evaluate(candidate));
        // liquidity after honeypot: the honeypot lookup may resolve a missing token address
        candidate.setLiquidityLocked(liquidityLockCheck.evaluate(candidate));
        candidate.setRenounced(renouncementCheck.evaluate(candidate));
        candidate.setLastCheckedAt(now);

        CandidateStatus status = RiskPolicy.decide(
                candidate.getHoneypot(),
                candidate.getLiquidityLocked(),
                candidate.getRenounced(),
                candidate.ageAt(now),
                riskProperties.renounceTtl());
        candidate.setStatus(status);
        candidate.setToBuy(status == CandidateStatus.CLASSIFIED);
        return status;
    }
}
