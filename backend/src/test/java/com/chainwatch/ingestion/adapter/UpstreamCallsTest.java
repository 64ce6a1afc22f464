package com.chainwatch.ingestion.adapter;

import com.chainwatch.common.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpstreamCallsTest {

    private final RetryPolicy threeAttempts = new RetryPolicy(0L, 0.0, 3);

    @Test
    void withRetry_returnsFirstSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = UpstreamCalls.withRetry(threeAttempts, "op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("flaky");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void withRetry_exhaustedAttemptsWrapLastFailure() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> UpstreamCalls.withRetry(threeAttempts, "explorer.tokentx", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom " + calls.get());
        }))
                .isInstanceOf(UpstreamException.class)
                .hasMessage("explorer.tokentx failed after 3 attempt(s): boom 3")
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(calls).hasValue(3);
    }

    @Test
    void messageOf_fallsBackToClassName() {
        assertThat(UpstreamCalls.messageOf(new NullPointerException())).isEqualTo("NullPointerException");
        assertThat(UpstreamCalls.messageOf(null)).isEqualTo("unknown");
    }
}
