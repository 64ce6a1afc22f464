package com.chainwatch.notification;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Notification feed settings.
 */
@ConfigurationProperties(prefix = "chainwatch.notification")
@NoArgsConstructor
@Getter
@Setter
public class NotificationProperties {

    /** Notifications kept per subscriber; oldest are evicted first. */
    private int feedSize = 200;
}
