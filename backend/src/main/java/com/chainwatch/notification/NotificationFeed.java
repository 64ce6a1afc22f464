package com.chainwatch.notification;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded in-memory notification history per subscriber, read by the REST front-end.
 */
@Component
public class NotificationFeed {

    private final int capacity;
    private final Map<String, Deque<Notification>> feeds = new HashMap<>();

    public NotificationFeed(NotificationProperties properties) {
        this.capacity = Math.max(1, properties.getFeedSize());
    }

    public synchronized void append(Notification notification) {
        Deque<Notification> feed = feeds.computeIfAbsent(notification.subscriberId(), k -> new ArrayDeque<>());
        feed.addLast(notification);
        while (feed.size() > capacity) {
            feed.removeFirst();
        }
    }

    /**
     * Most recent notifications first, at most {@code limit}.
     */
    public synchronized List<Notification> latest(String subscriberId, int limit) {
        Deque<Notification> feed = feeds.get(subscriberId);
        if (feed == null || limit <= 0) {
            return List.of();
        }
        List<Notification> out = new ArrayList<>(Math.min(limit, feed.size()));
        var it = feed.descendingIterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(it.next());
        }
        return out;
    }
}
