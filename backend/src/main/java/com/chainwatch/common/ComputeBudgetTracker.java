package com.chainwatch.common;

import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide counter of provider compute units consumed in the current calendar month.
 *
 * <p>{@link #dailyTick()} is driven once per 24h by an independent job. It resets the counter on the 1st of the
 * month, or on the 2nd when at least {@value #MIN_TICKS_BETWEEN_RESETS} ticks have passed since the last reset, so a
 * scheduler that happens to skip the 1st still resets once per month. A second tick on an already-reset month only
 * counts. The tracker never throttles; callers
 * read {@link #getRemainingUnits()} and decide.
 *
 * <p>The consumed counter and the tick counter are guarded by separate locks. {@code dailyTick} takes the tick lock
 * first, then the units lock; {@code addUnits} only takes the units lock.
 */
public class ComputeBudgetTracker {

    static final int MIN_TICKS_BETWEEN_RESETS = 28;

    private final long capacity;
    private final Clock clock;

    private final ReentrantLock unitsLock = new ReentrantLock();
    private final ReentrantLock ticksLock = new ReentrantLock();
    private long consumedUnits;
    private int ticksSinceReset;
    private YearMonth lastResetMonth;

    public ComputeBudgetTracker(long capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public void addUnits(long units) {
        if (units < 0) {
            throw new IllegalArgumentException("units must not be negative: " + units);
        }
        if (units == 0) {
            return;
        }
        unitsLock.lock();
        try {
            consumedUnits += units;
        } finally {
            unitsLock.unlock();
        }
    }

    /**
     * Applies the start-of-month rule for today's UTC date.
     *
     * @return true when this tick reset the counter
     */
    public boolean dailyTick() {
        ZonedDateTime today = clock.instant().atZone(ZoneOffset.UTC);
        int dayOfMonth = today.getDayOfMonth();
        YearMonth month = YearMonth.from(today);
        ticksLock.lock();
        try {
            boolean resetDay = dayOfMonth == 1
                    || (dayOfMonth == 2 && ticksSinceReset >= MIN_TICKS_BETWEEN_RESETS);
            if (resetDay && !month.equals(lastResetMonth)) {
                unitsLock.lock();
                try {
                    consumedUnits = 0;
                } finally {
                    unitsLock.unlock();
                }
                ticksSinceReset = 0;
                lastResetMonth = month;
                return true;
            }
            ticksSinceReset++;
            return false;
        } finally {
            ticksLock.unlock();
        }
    }

    public long getConsumedUnits() {
        unitsLock.lock();
        try {
            return consumedUnits;
        } finally {
            unitsLock.unlock();
        }
    }

    public long getCapacity() {
        return capacity;
    }

    public long getRemainingUnits() {
        return Math.max(0L, capacity - getConsumedUnits());
    }

    public boolean isExhausted() {
        return getConsumedUnits() >= capacity;
    }

    public int getTicksSinceReset() {
        ticksLock.lock();
        try {
            return ticksSinceReset;
        } finally {
            ticksLock.unlock();
        }
    }
}
