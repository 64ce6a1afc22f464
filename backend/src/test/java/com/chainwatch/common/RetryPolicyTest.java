package com.chainwatch.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 0.2, 5);
        for (int i = 0; i < 20; i++) {
            long d = policy.delayMs(0);
            assertThat(d).isBetween(800L, 1200L); // ±20% of 1000
        }
    }

    @Test
    void delayMs_exponentialIncreases() {
        RetryPolicy policy = new RetryPolicy(100L, 0, 5);
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
    }

    @Test
    void defaultPolicy_hasThreeAttempts() {
        assertThat(RetryPolicy.defaultPolicy().getMaxAttempts()).isEqualTo(3);
    }

    @Test
    void noRetry_isSingleAttemptWithoutDelay() {
        RetryPolicy policy = RetryPolicy.noRetry();
        assertThat(policy.getMaxAttempts()).isEqualTo(1);
        assertThat(policy.delayMs(3)).isZero();
    }

    @Test
    void constructor_rejectsZeroAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(100L, 0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }
}
