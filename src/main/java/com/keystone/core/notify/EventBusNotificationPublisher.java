package com.keystone.core.notify;

import com.keystone.core.events.EventBus;
import com.keystone.core.events.PipelineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default {@link NotificationPublisher}: logs the notice and republishes it on the
 * {@link EventBus} as a {@code notification.<kind>} event. Alerts log at ERROR.
 */
@Component
public class EventBusNotificationPublisher implements NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventBusNotificationPublisher.class);

    private final EventBus eventBus;

    public EventBusNotificationPublisher(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void publish(PipelineNotification notification) {
        if (notification.alert()) {
            log.error("ALERT: {} {} for submission {} (attempt {}) requires operator attention: {}",
                    notification.kind(), notification.state(), notification.submissionId(),
                    notification.attemptId(), notification.reason());
        } else {
            log.info("{} {} for submission {}: {}", notification.kind(), notification.state(),
                    notification.submissionId(), notification.reason());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", notification.kind());
        payload.put("state", notification.state());
        payload.put("reason", notification.reason() != null ? notification.reason() : "");
        payload.put("details", notification.details());
        payload.put("alert", notification.alert());
        eventBus.publish(new PipelineEvent("notification." + notification.kind(), notification.submissionId(),
                notification.attemptId(), payload, notification.timestamp()));
    }
}
