package com.chainwatch.ingestion.watch;

import com.chainwatch.domain.ActivityRecord;

import java.util.List;
import java.util.OptionalLong;

/**
 * Outcome of one {@link DiffEngine#advance} call.
 *
 * @param newRecords records newer than the previous cursor, oldest first
 * @param cursor     cursor after the call; empty when nothing has been seen yet
 * @param baseline   true when this call seeded the cursor
 */
public record DiffResult(List<ActivityRecord> newRecords, OptionalLong cursor, boolean baseline) {

    public DiffResult {
        newRecords = newRecords == null ? List.of() : List.copyOf(newRecords);
    }

    static DiffResult nothingSeen() {
        return new DiffResult(List.of(), OptionalLong.empty(), false);
    }

    static DiffResult seeded(long cursor) {
        return new DiffResult(List.of(), OptionalLong.of(cursor), true);
    }

    public boolean hasNewRecords() {
        return !newRecords.isEmpty();
    }
}
