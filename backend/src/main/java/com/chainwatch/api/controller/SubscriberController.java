package com.chainwatch.api.controller;

import com.chainwatch.api.dto.ErrorBody;
import com.chainwatch.api.dto.SettingsRequest;
import com.chainwatch.api.dto.SubscriberResponse;
import com.chainwatch.api.dto.WatchListRequest;
import com.chainwatch.api.dto.WatchListResponse;
import com.chainwatch.api.validation.AddressValidator;
import com.chainwatch.domain.SubscriberSettings;
import com.chainwatch.notification.Notification;
import com.chainwatch.notification.NotificationFeed;
import com.chainwatch.subscription.SubscriberRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Subscriber configuration: watch-list, settings and the notification feed.
 */
@RestController
@RequestMapping("/api/v1/subscribers")
@RequiredArgsConstructor
public class SubscriberController {

    private static final int MAX_NOTIFICATIONS = 200;

    private final SubscriberRegistry subscriberRegistry;
    private final AddressValidator addressValidator;
    private final NotificationFeed notificationFeed;

    @PutMapping("/{id}/watch-list")
    public ResponseEntity<?> setWatchList(@PathVariable String id, @Valid @RequestBody WatchListRequest request) {
        AddressValidator.Partition partition = addressValidator.partition(request.addresses());
        if (partition.valid().isEmpty() && !request.addresses().isEmpty()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "No valid wallet address in watch-list"));
        }
        List<String> stored = subscriberRegistry.setWatchList(id, partition.valid());
        return ResponseEntity.ok(WatchListResponse.of(id, stored, partition.invalid()));
    }

    @PutMapping("/{id}/settings")
    public ResponseEntity<SubscriberResponse> updateSettings(@PathVariable String id, @RequestBody SettingsRequest request) {
        if (request.autoSnipe() != null) {
            subscriberRegistry.setAutoSnipe(id, request.autoSnipe());
        }
        if (request.hideZeroBalances() != null) {
            subscriberRegistry.setHideZeroBalances(id, request.hideZeroBalances());
        }
        return ResponseEntity.ok(toResponse(id));
    }

    @GetMapping("/{id}")
    public ResponseEntity<SubscriberResponse> getSubscriber(@PathVariable String id) {
        if (!subscriberRegistry.isKnown(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(toResponse(id));
    }

    @GetMapping("/{id}/notifications")
    public List<Notification> getNotifications(@PathVariable String id,
                                               @RequestParam(defaultValue = "50") int limit) {
        return notificationFeed.latest(id, Math.min(Math.max(limit, 0), MAX_NOTIFICATIONS));
    }

    private SubscriberResponse toResponse(String id) {
        SubscriberSettings settings = subscriberRegistry.settingsOf(id);
        return new SubscriberResponse(id, settings.autoSnipe(), settings.hideZeroBalances(),
                subscriberRegistry.watchListOf(id));
    }
}
