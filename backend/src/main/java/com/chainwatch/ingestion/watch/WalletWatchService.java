package com.chainwatch.ingestion.watch;

import com.chainwatch.domain.ActivityRecord;
import com.chainwatch.domain.WatchedAddress;
import com.chainwatch.ingestion.adapter.UpstreamException;
import com.chainwatch.ingestion.adapter.explorer.ExplorerClient;
import com.chainwatch.notification.NotificationPublisher;
import com.chainwatch.subscription.SubscriberRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One pass of the wallet watch: every (subscriber, address) pair is fetched, diffed against its cursor and each new
 * transfer is published oldest first. Pairs are processed sequentially; a failed fetch skips only that pair.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletWatchService {

    private final SubscriberRegistry subscriberRegistry;
    private final ExplorerClient explorerClient;
    private final DiffEngine diffEngine;
    private final CursorStore cursorStore;
    private final NotificationPublisher notificationPublisher;

    /**
     * @return number of notifications published
     */
    public int runTick() {
        Map<String, List<String>> watchLists = subscriberRegistry.snapshotWatchLists();
        Set<WatchedAddress> watched = new HashSet<>();
        watchLists.forEach((subscriber, addresses) ->
                addresses.forEach(address -> watched.add(new WatchedAddress(subscriber, address))));
        int pruned = cursorStore.retainOnly(watched);
        if (pruned > 0) {
            log.debug("Dropped {} cursor(s) of unwatched addresses", pruned);
        }
        if (watched.isEmpty()) {
            return 0;
        }

        int published = 0;
        for (Map.Entry<String, List<String>> entry : watchLists.entrySet()) {
            String subscriber = entry.getKey();
            for (String address : entry.getValue()) {
                published += watchOne(subscriber, address);
            }
        }
        if (published > 0) {
            log.info("Wallet watch published {} notification(s) for {} watched address(es)", published, watched.size());
        }
        return published;
    }

    private int watchOne(String subscriber, String address) {
        List<ActivityRecord> fresh;
        try {
            fresh = explorerClient.fetchRecentTransfers(address);
        } catch (UpstreamException e) {
            log.warn("Skipping {} for subscriber {} this tick: {}", address, subscriber, e.getMessage());
            return 0;
        }
        DiffResult diff = diffEngine.advance(subscriber, address, fresh);
        if (diff.baseline()) {
            log.debug("Baseline for {} / {} at {}", subscriber, address, diff.cursor().getAsLong());
            return 0;
        }
        for (ActivityRecord record : diff.newRecords()) {
            notificationPublisher.notifyWalletActivity(subscriber, address, record);
        }
        return diff.newRecords().size();
    }
}
