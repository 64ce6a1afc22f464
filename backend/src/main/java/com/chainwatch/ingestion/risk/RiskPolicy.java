package com.chainwatch.ingestion.risk;

import com.chainwatch.domain.CandidateStatus;
import com.chainwatch.domain.CheckOutcome;

import java.time.Duration;

/**
 * Reduces the three check outcomes of a candidate to its next status. Rules in priority order:
 * <ol>
 *     <li>not renounced: PENDING, or EXPIRED once older than the TTL</li>
 *     <li>renounced and honeypot: REJECTED, whatever the liquidity</li>
 *     <li>renounced, not a honeypot (or unknown), liquidity locked: CLASSIFIED</li>
 *     <li>otherwise PENDING, under the same TTL</li>
 * </ol>
 */
public final class RiskPolicy {

    private RiskPolicy() {
    }

    public static CandidateStatus decide(CheckOutcome honeypot,
                                         CheckOutcome liquidityLocked,
                                         CheckOutcome renounced,
                                         Duration age,
                                         Duration ttl) {
        if (!renounced.isTrue()) {
            return pendingOrExpired(age, ttl);
        }
        if (honeypot.isTrue()) {
            return CandidateStatus.REJECTED;
        }
        if (liquidityLocked.isTrue()) {
            return CandidateStatus.CLASSIFIED;
        }
        return pendingOrExpired(age, ttl);
    }

    private static CandidateStatus pendingOrExpired(Duration age, Duration ttl) {
        return age.compareTo(ttl) > 0 ? CandidateStatus.EXPIRED : CandidateStatus.PENDING;
    }
}
