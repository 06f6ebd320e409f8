package com.keystone.core.events;

import com.keystone.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private final EventBus bus = new EventBus();

    private static PipelineEvent event(String type, String submissionId) {
        return new PipelineEvent(type, submissionId, null, Map.of(), Fixtures.T0);
    }

    @Test
    void deliversOnlyToMatchingSubmission() {
        List<PipelineEvent> s1 = new ArrayList<>();
        List<PipelineEvent> s2 = new ArrayList<>();
        bus.subscribe("s1", s1::add);
        bus.subscribe("s2", s2::add);

        bus.publish(event(EventTypes.VERIFICATION_STARTED, "s1"));

        assertEquals(1, s1.size());
        assertTrue(s2.isEmpty());
    }

    @Test
    void globalSubscribersSeeEventsWithoutSubmission() {
        List<PipelineEvent> all = new ArrayList<>();
        bus.subscribeAll(all::add);

        bus.publish(event(EventTypes.AGENT_HEALTH, null));
        bus.publish(event(EventTypes.SUBMISSION_RECEIVED, "s1"));

        assertEquals(List.of(EventTypes.AGENT_HEALTH, EventTypes.SUBMISSION_RECEIVED),
                all.stream().map(PipelineEvent::eventType).toList());
    }

    @Test
    void unsubscribeStopsDelivery() {
        List<PipelineEvent> got = new ArrayList<>();
        EventBus.Subscription sub = bus.subscribe("s1", got::add);

        sub.unsubscribe();
        bus.publish(event(EventTypes.VERIFICATION_STARTED, "s1"));

        assertTrue(got.isEmpty());
    }

    @Test
    void failingSubscriberDoesNotStarveOthers() {
        List<PipelineEvent> got = new ArrayList<>();
        bus.subscribe("s1", e -> {
            throw new IllegalStateException("client went away");
        });
        bus.subscribe("s1", got::add);

        assertDoesNotThrow(() -> bus.publish(event(EventTypes.VERIFICATION_STARTED, "s1")));
        assertEquals(1, got.size());
    }
}
