package com.chainwatch.domain;

/**
 * Lifecycle of a discovered token pair.
 * PENDING: retained and re-checked every cycle.
 * CLASSIFIED: renounced, not a honeypot, liquidity locked or burned; flagged to buy, alerted once, then dropped.
 * REJECTED: renounced but a honeypot; dropped.
 * EXPIRED: not cleared within the renouncement window; dropped.
 */
public enum CandidateStatus {
    PENDING,
    CLASSIFIED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
