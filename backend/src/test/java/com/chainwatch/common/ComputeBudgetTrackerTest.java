package com.chainwatch.common;

import com.chainwatch.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComputeBudgetTrackerTest {

    private static final long CAPACITY = 300_000_000L;

    @Test
    @DisplayName("addUnits accumulates and remaining shrinks")
    void addUnitsAccumulates() {
        ComputeBudgetTracker tracker = new ComputeBudgetTracker(CAPACITY, MutableClock.at("2024-03-10T12:00:00Z"));
        tracker.addUnits(19);
        tracker.addUnits(26);
        tracker.addUnits(0);
        assertThat(tracker.getConsumedUnits()).isEqualTo(45);
        assertThat(tracker.getRemainingUnits()).isEqualTo(CAPACITY - 45);
        assertThat(tracker.isExhausted()).isFalse();
    }

    @Test
    @DisplayName("negative units are rejected")
    void negativeUnitsRejected() {
        ComputeBudgetTracker tracker = new ComputeBudgetTracker(CAPACITY, MutableClock.at("2024-03-10T12:00:00Z"));
        assertThatThrownBy(() -> tracker.addUnits(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("exhausted once consumed reaches capacity; tracker never throttles")
    void exhaustedAtCapacity() {
        ComputeBudgetTracker tracker = new ComputeBudgetTracker(100, MutableClock.at("2024-03-10T12:00:00Z"));
        tracker.addUnits(100);
        tracker.addUnits(5);
        assertThat(tracker.isExhausted()).isTrue();
        assertThat(tracker.getConsumedUnits()).isEqualTo(105);
        assertThat(tracker.getRemainingUnits()).isZero();
    }

    @Test
    @DisplayName("27 ticks away from the 1st never reset")
    void twentySevenTicksWithoutDayOneNeverReset() {
        MutableClock clock = MutableClock.at("2024-03-03T00:00:00Z");
        ComputeBudgetTracker tracker = new ComputeBudgetTracker(CAPACITY, clock);
        tracker.addUnits(1_000);
        for (int i = 0; i < 27; i++) {
            assertThat(tracker.dailyTick()).isFalse();
            clock.advance(Duration.ofDays(1));
        }
        assertThat(tracker.getConsumedUnits()).isEqualTo(1_000);
        assertThat(tracker.getTicksSinceReset()).isEqualTo(27);
    }

    @Test
    @DisplayName("day 1 resets consumed units and the tick counter")
    void dayOneResets() {
        ComputeBudgetTracker tracker = new ComputeBudgetTracker(CAPACITY, MutableClock.at("2024-04-01T00:00:05Z"));
        tracker.addUnits(5_000);
        assertThat(tracker.dailyTick()).isTrue();
        assertThat(tracker.getConsumedUnits()).isZero();
        assertThat(tracker.getTicksSinceReset()).isZero();
    }

    @Test
    @DisplayName("day 2 resets only after at least 28 ticks since the last reset")
    void dayTwoResetsAfterTwentyEightTicks() {
        MutableClock clock = MutableClock.at("2024-02-02T00:00:00Z");
        ComputeBudgetTracker tracker = new ComputeBudgetTracker(CAPACITY, clock);
        for (int i = 0; i < 28; i++) {
            tracker.dailyTick();
        }
        tracker.addUnits(777);
        assertThat(tracker.getTicksSinceReset()).isEqualTo(28);

        clock.set(Instant.parse("2024-03-02T00:00:00Z"));
        assertThat(tracker.dailyTick()).isTrue();
        assertThat(tracker.getConsumedUnits()).isZero();
    }

    @Test
    @DisplayName("day 2 with fewer than 28 ticks only counts")
    void dayTwoWithFewTicksOnlyCounts() {
        ComputeBudgetTracker tracker = new ComputeBudgetTracker(CAPACITY, MutableClock.at("2024-03-02T00:00:00Z"));
        tracker.addUnits(10);
        assertThat(tracker.dailyTick()).isFalse();
        assertThat(tracker.getConsumedUnits()).isEqualTo(10);
        assertThat(tracker.getTicksSinceReset()).isEqualTo(1);
    }

    @Test
    @DisplayName("a second tick on the 1st does not reset the same month again")
    void noDoubleResetInSameMonth() {
        MutableClock clock = MutableClock.at("2024-05-01T00:00:00Z");
        ComputeBudgetTracker tracker = new ComputeBudgetTracker(CAPACITY, clock);
        assertThat(tracker.dailyTick()).isTrue();
        tracker.addUnits(42);

        clock.advance(Duration.ofHours(6));
        assertThat(tracker.dailyTick()).isFalse();
        assertThat(tracker.getConsumedUnits()).isEqualTo(42);
    }

    @Test
    @DisplayName("a scheduler that skips the 1st still resets on the 2nd after a full month")
    void shortMonthSkippedFirstStillResets() {
        MutableClock clock = MutableClock.at("2024-01-01T12:00:00Z");
        ComputeBudgetTracker tracker = new ComputeBudgetTracker(CAPACITY, clock);
        assertThat(tracker.dailyTick()).isTrue();
        // 2024-01-02 .. 2024-01-31 plus 2024-02-02: the tick on 2024-02-01 is missed
        for (int day = 2; day <= 31; day++) {
            clock.set(Instant.parse(String.format("2024-01-%02dT12:00:00Z", day)));
            assertThat(tracker.dailyTick()).isFalse();
        }
        tracker.addUnits(99);
        clock.set(Instant.parse("2024-02-02T12:00:00Z"));
        assertThat(tracker.dailyTick()).isTrue();
        assertThat(tracker.getConsumedUnits()).isZero();
    }

    @Test
    @DisplayName("concurrent addUnits loses no update")
    void concurrentAddUnits() throws InterruptedException {
        ComputeBudgetTracker tracker = new ComputeBudgetTracker(CAPACITY, MutableClock.at("2024-03-10T12:00:00Z"));
        Thread[] threads = new Thread[8];
        for (int t = 0; t < threads.length; t++) {
            threads[t] = new Thread(() -> {
                for (int i = 0; i < 1_000; i++) {
                    tracker.addUnits(19);
                }
            });
            threads[t].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }
        assertThat(tracker.getConsumedUnits()).isEqualTo(8L * 1_000 * 19);
    }
}
