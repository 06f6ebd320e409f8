package com.keystone.core.notify;

import com.keystone.core.events.EventBus;
import com.keystone.core.events.PipelineEvent;
import com.keystone.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventBusNotificationPublisherTest {

    @Test
    void republishesNoticeAsEvent() {
        EventBus bus = new EventBus();
        List<PipelineEvent> events = new ArrayList<>();
        bus.subscribe("sub-1", events::add);
        var publisher = new EventBusNotificationPublisher(bus);

        publisher.publish(new PipelineNotification("integration", "sub-1", "att-1", "FAILED",
                "rollback failed", List.of("target unreachable"), true, Fixtures.T0));

        assertEquals(1, events.size());
        PipelineEvent event = events.get(0);
        assertEquals("notification.integration", event.eventType());
        assertEquals("att-1", event.attemptId());
        assertEquals(true, event.payload().get("alert"));
        assertEquals(List.of("target unreachable"), event.payload().get("details"));
    }

    @Test
    void nullReasonBecomesEmpty() {
        EventBus bus = new EventBus();
        List<PipelineEvent> events = new ArrayList<>();
        bus.subscribeAll(events::add);

        new EventBusNotificationPublisher(bus).publish(new PipelineNotification("verification", "sub-1", null,
                "ACCEPTED", null, null, false, Fixtures.T0));

        assertEquals("", events.get(0).payload().get("reason"));
        assertEquals(List.of(), events.get(0).payload().get("details"));
    }
}
