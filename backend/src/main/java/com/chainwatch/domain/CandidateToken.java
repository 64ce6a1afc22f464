package com.chainwatch.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;

/**
 * A newly created token pair retained while its risk checks run. Mutated only by the discovery job thread.
 */
@NoArgsConstructor
@Getter
@Setter
public class CandidateToken {

    private String pairAddress;
    /** Underlying token contract; null when the lookup failed at discovery time. */
    private String tokenAddress;
    private String creatorAddress;
    private String creationTxHash;
    /** Factory internal transaction that announced the pair. */
    private String discoveryTxHash;
    private Instant createdAt;
    private boolean toBuy;
    private CheckOutcome honeypot = CheckOutcome.UNKNOWN;
    private CheckOutcome liquidityLocked = CheckOutcome.UNKNOWN;
    private CheckOutcome renounced = CheckOutcome.UNKNOWN;
    private CandidateStatus status = CandidateStatus.PENDING;
    /** Latest honeypot report, kept for alerts. */
    private TokenRiskReport lastReport;
    private Instant lastCheckedAt;

    public CandidateToken(String pairAddress, Instant createdAt, String discoveryTxHash) {
        this.pairAddress = pairAddress;
        this.createdAt = createdAt;
        this.discoveryTxHash = discoveryTxHash;
    }

    public Duration ageAt(Instant now) {
        return Duration.between(createdAt, now);
    }

    /** Address the honeypot lookup should use: the token when known, else the pair. */
    public String lookupAddress() {
        return tokenAddress != null ? tokenAddress : pairAddress;
    }
}
