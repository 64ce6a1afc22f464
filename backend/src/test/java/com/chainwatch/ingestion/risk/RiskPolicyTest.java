package com.chainwatch.ingestion.risk;

import com.chainwatch.domain.CandidateStatus;
import com.chainwatch.domain.CheckOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;

import static com.chainwatch.domain.CheckOutcome.FALSE;
import static com.chainwatch.domain.CheckOutcome.TRUE;
import static com.chainwatch.domain.CheckOutcome.UNKNOWN;
import static org.assertj.core.api.Assertions.assertThat;

class RiskPolicyTest {

    private static final Duration TTL = Duration.ofHours(2);
    private static final Duration YOUNG = Duration.ofMinutes(10);
    private static final Duration OLD = Duration.ofSeconds(7201);

    @Test
    @DisplayName("not renounced and older than the TTL expires")
    void notRenouncedAndOldExpires() {
        assertThat(RiskPolicy.decide(FALSE, TRUE, FALSE, OLD, TTL)).isEqualTo(CandidateStatus.EXPIRED);
        assertThat(RiskPolicy.decide(UNKNOWN, UNKNOWN, UNKNOWN, OLD, TTL)).isEqualTo(CandidateStatus.EXPIRED);
    }

    @Test
    @DisplayName("not renounced within the TTL stays pending even when every other check passes")
    void notRenouncedYoungStaysPending() {
        assertThat(RiskPolicy.decide(FALSE, TRUE, UNKNOWN, YOUNG, TTL)).isEqualTo(CandidateStatus.PENDING);
    }

    @Test
    @DisplayName("exactly two hours old is not yet expired")
    void ttlBoundaryIsExclusive() {
        assertThat(RiskPolicy.decide(FALSE, FALSE, FALSE, TTL, TTL)).isEqualTo(CandidateStatus.PENDING);
    }

    @ParameterizedTest
    @EnumSource(CheckOutcome.class)
    @DisplayName("renounced honeypot is rejected whatever the liquidity")
    void renouncedHoneypotRejected(CheckOutcome liquidity) {
        assertThat(RiskPolicy.decide(TRUE, liquidity, TRUE, YOUNG, TTL)).isEqualTo(CandidateStatus.REJECTED);
        assertThat(RiskPolicy.decide(TRUE, liquidity, TRUE, OLD, TTL)).isEqualTo(CandidateStatus.REJECTED);
    }

    @Test
    @DisplayName("renounced, not a honeypot, liquidity locked is classified to buy")
    void renouncedCleanLockedClassified() {
        assertThat(RiskPolicy.decide(FALSE, TRUE, TRUE, YOUNG, TTL)).isEqualTo(CandidateStatus.CLASSIFIED);
    }

    @Test
    @DisplayName("unknown honeypot outcome does not block classification")
    void unknownHoneypotStillClassified() {
        assertThat(RiskPolicy.decide(UNKNOWN, TRUE, TRUE, YOUNG, TTL)).isEqualTo(CandidateStatus.CLASSIFIED);
    }

    @Test
    @DisplayName("renounced without confirmed liquidity stays pending, then expires")
    void renouncedUnlockedPendingThenExpired() {
        assertThat(RiskPolicy.decide(FALSE, FALSE, TRUE, YOUNG, TTL)).isEqualTo(CandidateStatus.PENDING);
        assertThat(RiskPolicy.decide(FALSE, UNKNOWN, TRUE, OLD, TTL)).isEqualTo(CandidateStatus.EXPIRED);
    }
}
