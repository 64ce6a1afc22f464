package com.chainwatch.domain;

import java.time.Instant;

/**
 * Application event: a candidate passed every risk check. Carries a copy of the fields needed for the alert,
 * since the candidate itself is dropped right after.
 */
public record CandidateToBuyEvent(
        String subscriberId,
        String pairAddress,
        String tokenAddress,
        String creatorAddress,
        Instant createdAt,
        TokenRiskReport report
) {

    public static CandidateToBuyEvent of(String subscriberId, CandidateToken candidate) {
        return new CandidateToBuyEvent(
                subscriberId,
                candidate.getPairAddress(),
                candidate.getTokenAddress(),
                candidate.getCreatorAddress(),
                candidate.getCreatedAt(),
                candidate.getLastReport());
    }
}
