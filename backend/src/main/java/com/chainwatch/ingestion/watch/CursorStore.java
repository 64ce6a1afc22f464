package com.chainwatch.ingestion.watch;

import com.chainwatch.domain.WatchedAddress;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Last-seen timestamp per watched address. Cursors only move forward.
 */
@Component
public class CursorStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<WatchedAddress, Long> cursors = new HashMap<>();

    public OptionalLong get(WatchedAddress key) {
        lock.lock();
        try {
            Long cursor = cursors.get(key);
            return cursor != null ? OptionalLong.of(cursor) : OptionalLong.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the cursor to {@code timestamp} unless the stored one is already newer.
     *
     * @return the cursor after the update
     */
    public long advanceTo(WatchedAddress key, long timestamp) {
        lock.lock();
        try {
            return cursors.merge(key, timestamp, Math::max);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops cursors of pairs that are no longer watched.
     *
     * @return number of cursors removed
     */
    public int retainOnly(Set<WatchedAddress> watched) {
        lock.lock();
        try {
            int before = cursors.size();
            cursors.keySet().retainAll(watched);
            return before - cursors.size();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return cursors.size();
        } finally {
            lock.unlock();
        }
    }
}
