package com.chainwatch.ingestion.watch;

import com.chainwatch.domain.ActivityRecord;
import com.chainwatch.domain.WatchedAddress;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

/**
 * Turns a re-fetched, newest-first activity page into the records not seen before.
 * <p>
 * The first page seen for a watched address only seeds its cursor (no history is replayed). Later pages yield the
 * leading run of records strictly newer than the cursor. Callers must not invoke this for a failed fetch, so a failure
 * leaves the cursor where it was.
 */
@Component
@RequiredArgsConstructor
public class DiffEngine {

    private final CursorStore cursorStore;

    public DiffResult advance(String subscriberId, String address, List<ActivityRecord> freshRecords) {
        WatchedAddress key = new WatchedAddress(subscriberId, address);
        List<ActivityRecord> records = freshRecords != null ? freshRecords : List.of();
        OptionalLong cursor = cursorStore.get(key);

        if (cursor.isEmpty()) {
            if (records.isEmpty()) {
                return DiffResult.nothingSeen();
            }
            return DiffResult.seeded(cursorStore.advanceTo(key, records.get(0).timestamp()));
        }

        List<ActivityRecord> newest = newerThan(records, cursor.getAsLong());
        if (newest.isEmpty()) {
            return new DiffResult(List.of(), cursor, false);
        }
        long advanced = cursorStore.advanceTo(key, newest.get(0).timestamp());
        List<ActivityRecord> oldestFirst = new ArrayList<>(newest);
        Collections.reverse(oldestFirst);
        return new DiffResult(oldestFirst, OptionalLong.of(advanced), false);
    }

    /**
     * Leading records with {@code timestamp > cursor}; stops at the first record at or below the cursor.
     * Result keeps the input (newest-first) order.
     */
    public static List<ActivityRecord> newerThan(List<ActivityRecord> newestFirst, long cursor) {
        int end = 0;
        while (end < newestFirst.size() && newestFirst.get(end).timestamp() > cursor) {
            end++;
        }
        return newestFirst.subList(0, end);
    }
}
