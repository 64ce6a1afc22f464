package com.chainwatch.subscription;

import com.chainwatch.common.EvmAddresses;
import com.chainwatch.domain.SubscriberSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Subscribers, their watch-lists and settings. Shared between the REST front-end (writes) and the watch and
 * discovery jobs (snapshots). One lock guards both maps; it is held only to copy or replace entries.
 */
@Component
@Slf4j
public class SubscriberRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, List<String>> watchLists = new LinkedHashMap<>();
    private final Map<String, SubscriberSettings> settings = new LinkedHashMap<>();

    /**
     * Replaces the subscriber's watch-list. Addresses are normalized to lower case; duplicates and blanks are dropped.
     *
     * @return the stored watch-list in submission order
     */
    public List<String> setWatchList(String subscriberId, List<String> addresses) {
        requireSubscriber(subscriberId);
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        if (addresses != null) {
            addresses.stream()
                    .map(EvmAddresses::normalize)
                    .filter(Objects::nonNull)
                    .forEach(normalized::add);
        }
        List<String> stored = List.copyOf(normalized);
        lock.lock();
        try {
            watchLists.put(subscriberId, stored);
            settings.putIfAbsent(subscriberId, SubscriberSettings.defaults());
        } finally {
            lock.unlock();
        }
        log.info("Subscriber {} now watches {} address(es)", subscriberId, stored.size());
        return stored;
    }

    public SubscriberSettings setAutoSnipe(String subscriberId, boolean enabled) {
        requireSubscriber(subscriberId);
        lock.lock();
        try {
            return settings.merge(subscriberId, SubscriberSettings.defaults().withAutoSnipe(enabled),
                    (current, ignored) -> current.withAutoSnipe(enabled));
        } finally {
            lock.unlock();
        }
    }

    public SubscriberSettings setHideZeroBalances(String subscriberId, boolean enabled) {
        requireSubscriber(subscriberId);
        lock.lock();
        try {
            return settings.merge(subscriberId, SubscriberSettings.defaults().withHideZeroBalances(enabled),
                    (current, ignored) -> current.withHideZeroBalances(enabled));
        } finally {
            lock.unlock();
        }
    }

    public Optional<SubscriberSettings> findSettings(String subscriberId) {
        lock.lock();
        try {
            return Optional.ofNullable(settings.get(subscriberId));
        } finally {
            lock.unlock();
        }
    }

    /** Settings of a known subscriber, defaults for an unknown one. */
    public SubscriberSettings settingsOf(String subscriberId) {
        return findSettings(subscriberId).orElse(SubscriberSettings.defaults());
    }

    public List<String> watchListOf(String subscriberId) {
        lock.lock();
        try {
            return watchLists.getOrDefault(subscriberId, List.of());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of every non-empty watch-list, keyed by subscriber.
     */
    public Map<String, List<String>> snapshotWatchLists() {
        lock.lock();
        try {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            watchLists.forEach((subscriber, addresses) -> {
                if (!addresses.isEmpty()) {
                    copy.put(subscriber, addresses);
                }
            });
            return copy;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Subscribers with auto-snipe enabled, in registration order.
     */
    public List<String> autoSnipeSubscribers() {
        lock.lock();
        try {
            List<String> out = new ArrayList<>();
            settings.forEach((subscriber, s) -> {
                if (s.autoSnipe()) {
                    out.add(subscriber);
                }
            });
            return out;
        } finally {
            lock.unlock();
        }
    }

    public boolean isKnown(String subscriberId) {
        lock.lock();
        try {
            return settings.containsKey(subscriberId);
        } finally {
            lock.unlock();
        }
    }

    private static void requireSubscriber(String subscriberId) {
        if (subscriberId == null || subscriberId.isBlank()) {
            throw new IllegalArgumentException("subscriberId is required");
        }
    }
}
