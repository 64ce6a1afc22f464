package com.chainwatch.api.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Stored watch-list, numbered from 1, plus the submitted entries that were not valid addresses.
 */
public record WatchListResponse(String subscriberId, List<Entry> watchList, List<String> rejected) {

    public record Entry(int number, String address) {
    }

    public static WatchListResponse of(String subscriberId, List<String> stored, List<String> rejected) {
        List<Entry> entries = new ArrayList<>(stored.size());
        for (int i = 0; i < stored.size(); i++) {
            entries.add(new Entry(i + 1, stored.get(i)));
        }
        return new WatchListResponse(subscriberId, entries, List.copyOf(rejected));
    }
}
