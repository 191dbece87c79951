package com.example.feedreader.notification;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Real-time notification service of the feed reader.
 * <p>
 * Debounces backend events per user and topic in Redis and relays the
 * aggregated notifications to each user's Server-Sent Events stream. Any number
 * of instances can run side by side; they share nothing but the broker.
 */
@SpringBootApplication(scanBasePackages = "com.example.feedreader")
public class NotificationApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotificationApplication.class, args);
    }
}
