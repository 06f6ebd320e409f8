package com.keystone.core.notify;

/**
 * Outbound notification channel for terminal pipeline states (chat, alerting and so on).
 */
public interface NotificationPublisher {

    void publish(PipelineNotification notification);
}
