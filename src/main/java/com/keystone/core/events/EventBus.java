package com.keystone.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for pipeline events.
 * <p>
 * Supports per-submission subscriptions and global subscriptions that receive every
 * event, including agent and circuit events that carry no submission id.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<PipelineEvent>>> submissionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<PipelineEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("Publishing {} for submission {}", event.eventType(), event.submissionId());

        if (event.submissionId() != null) {
            List<Consumer<PipelineEvent>> subs = submissionSubscribers.get(event.submissionId());
            if (subs != null) {
                for (Consumer<PipelineEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<PipelineEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one submission.
     *
     * @return a handle used to unsubscribe
     */
    public Subscription subscribe(String submissionId, Consumer<PipelineEvent> consumer) {
        submissionSubscribers.computeIfAbsent(submissionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> submissionSubscribers.computeIfPresent(submissionId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PipelineEvent> subscriber, PipelineEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
