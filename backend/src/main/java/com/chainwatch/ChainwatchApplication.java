package com.chainwatch;

import com.chainwatch.notification.NotificationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(NotificationProperties.class)
public class ChainwatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainwatchApplication.class, args);
    }
}
