package com.keystone.core.resilience;

import com.keystone.core.model.CircuitState;
import com.keystone.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private MutableClock clock;
    private List<String> transitions;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        transitions = new ArrayList<>();
        breaker = new CircuitBreaker("agent-1", 3, Duration.ofSeconds(30), Duration.ofMinutes(2), clock,
                (id, from, to) -> transitions.add(from + "->" + to));
    }

    private void failTimes(int n) {
        for (int i = 0; i < n; i++) {
            assertTrue(breaker.tryAcquirePermission());
            breaker.recordFailure();
        }
    }

    @Nested
    @DisplayName("CLOSED")
    class Closed {

        @Test
        @DisplayName("stays closed below the failure threshold")
        void staysClosedBelowThreshold() {
            failTimes(2);
            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertTrue(breaker.tryAcquirePermission());
        }

        @Test
        @DisplayName("a success clears the consecutive failure count")
        void successResetsCount() {
            failTimes(2);
            breaker.recordSuccess();
            failTimes(2);
            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertEquals(2, breaker.snapshot().failureCount());
        }

        @Test
        @DisplayName("opens after threshold consecutive failures")
        void opensAtThreshold() {
            failTimes(3);
            var snap = breaker.snapshot();
            assertEquals(CircuitState.OPEN, snap.state());
            assertEquals(clock.instant().plusSeconds(30), snap.nextRetryEligible());
            assertEquals(1, snap.timesOpened());
            assertEquals(List.of("CLOSED->OPEN"), transitions);
        }
    }

    @Nested
    @DisplayName("OPEN and HALF_OPEN")
    class OpenAndHalfOpen {

        @BeforeEach
        void open() {
            failTimes(3);
        }

        @Test
        @DisplayName("refuses calls until the cooldown elapses")
        void refusesDuringCooldown() {
            clock.advance(Duration.ofSeconds(29));
            assertFalse(breaker.tryAcquirePermission());
            assertEquals(CircuitState.OPEN, breaker.getState());
        }

        @Test
        @DisplayName("admits exactly one trial after the cooldown")
        void singleTrial() {
            clock.advance(Duration.ofSeconds(30));
            assertTrue(breaker.tryAcquirePermission());
            assertEquals(CircuitState.HALF_OPEN, breaker.getState());
            assertFalse(breaker.tryAcquirePermission(), "second caller must be refused while trial in flight");
        }

        @Test
        @DisplayName("successful trial closes the circuit")
        void trialSuccessCloses() {
            clock.advance(Duration.ofSeconds(30));
            breaker.tryAcquirePermission();
            breaker.recordSuccess();
            var snap = breaker.snapshot();
            assertEquals(CircuitState.CLOSED, snap.state());
            assertEquals(0, snap.failureCount());
            assertNull(snap.nextRetryEligible());
            assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), transitions);
        }

        @Test
        @DisplayName("failed trial re-opens with doubled cooldown, capped at the maximum")
        void trialFailureDoublesCooldown() {
            clock.advance(Duration.ofSeconds(30));
            breaker.tryAcquirePermission();
            breaker.recordFailure();
            assertEquals(CircuitState.OPEN, breaker.getState());
            assertEquals(Duration.ofSeconds(60), breaker.currentCooldown());
            assertEquals(clock.instant().plusSeconds(60), breaker.snapshot().nextRetryEligible());

            clock.advance(Duration.ofSeconds(60));
            breaker.tryAcquirePermission();
            breaker.recordFailure();
            assertEquals(Duration.ofSeconds(120), breaker.currentCooldown());

            clock.advance(Duration.ofSeconds(120));
            breaker.tryAcquirePermission();
            breaker.recordFailure();
            assertEquals(Duration.ofMinutes(2), breaker.currentCooldown(), "cooldown is capped");
        }

        @Test
        @DisplayName("cooldown returns to base after the circuit closes")
        void cooldownResetsAfterClose() {
            clock.advance(Duration.ofSeconds(30));
            breaker.tryAcquirePermission();
            breaker.recordFailure();
            clock.advance(Duration.ofSeconds(60));
            breaker.tryAcquirePermission();
            breaker.recordSuccess();
            assertEquals(Duration.ofSeconds(30), breaker.currentCooldown());
        }

        @Test
        @DisplayName("reset forces CLOSED")
        void reset() {
            breaker.reset();
            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertTrue(breaker.tryAcquirePermission());
        }
    }

    @Test
    @DisplayName("concurrent callers see a single half-open trial")
    void concurrentHalfOpen() throws Exception {
        failTimes(3);
        clock.advance(Duration.ofSeconds(30));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger permitted = new AtomicInteger();
        try {
            for (int i = 0; i < 16; i++) {
                pool.submit(() -> {
                    start.await();
                    if (breaker.tryAcquirePermission()) {
                        permitted.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }
        assertEquals(1, permitted.get());
    }
}
