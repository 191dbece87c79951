package com.example.feedreader.notification.health;

import com.example.feedreader.notification.service.StreamSessionRegistry;
import com.example.feedreader.notification.service.TimerExpiryListener;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the timer expiry listener and local stream sessions. A stopped
 * listener means debounced notifications are not delivered by this instance.
 */
@Component("notificationPipeline")
public class NotificationHealthIndicator implements HealthIndicator {

    private final TimerExpiryListener timerExpiryListener;
    private final StreamSessionRegistry streamSessionRegistry;

    public NotificationHealthIndicator(TimerExpiryListener timerExpiryListener,
                                       StreamSessionRegistry streamSessionRegistry) {
        this.timerExpiryListener = timerExpiryListener;
        this.streamSessionRegistry = streamSessionRegistry;
    }

    @Override
    public Health health() {
        boolean listenerRunning = timerExpiryListener.isRunning();
        Health.Builder builder = listenerRunning ? Health.up() : Health.down();
        return builder
                .withDetail("expiryListener", listenerRunning ? "UP" : "DOWN")
                .withDetail("listenerRestarts", timerExpiryListener.getRestartCount())
                .withDetail("activeSessions", streamSessionRegistry.getActiveSessionCount())
                .withDetail("connectedUsers", streamSessionRegistry.getDistinctUserCount())
                .build();
    }
}
