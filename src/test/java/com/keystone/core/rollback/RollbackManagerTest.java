package com.keystone.core.rollback;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.deploy.DeploymentTarget;
import com.keystone.core.deploy.InMemoryDeploymentTarget;
import com.keystone.core.error.RollbackFailureException;
import com.keystone.core.error.SnapshotNotFoundException;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.AttemptState;
import com.keystone.core.model.DeploymentStrategy;
import com.keystone.core.model.IntegrationAttempt;
import com.keystone.core.model.Snapshot;
import com.keystone.core.model.TargetState;
import com.keystone.core.persistence.InMemoryPipelineStore;
import com.keystone.support.Fixtures;
import com.keystone.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RollbackManagerTest {

    private MutableClock clock;
    private InMemoryDeploymentTarget target;
    private InMemoryPipelineStore store;
    private SimpleMeterRegistry meters;
    private KeystoneProperties props;
    private RollbackManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        target = new InMemoryDeploymentTarget();
        store = new InMemoryPipelineStore(clock);
        meters = new SimpleMeterRegistry();
        props = new KeystoneProperties();
        props.getRollback().setRetention(Duration.ofDays(7));
        props.getRollback().setRolledBackRetention(Duration.ofDays(30));
        manager = new RollbackManager(target, store, props, new KeystoneMetrics(meters), clock);
    }

    private void deploy(String submissionId, Map<String, String> files) {
        target.applyInPlace("proj-1", Fixtures.submission(submissionId, "proj-1", files));
    }

    @Nested
    @DisplayName("Snapshots")
    class Snapshots {

        @Test
        @DisplayName("versions increase per target and checksums are stable")
        void versionsAndChecksums() {
            deploy("s0", Map.of("a.txt", "v0"));
            Snapshot first = manager.snapshot("proj-1", "att-1");
            Snapshot second = manager.snapshot("proj-1", "att-2");
            Snapshot other = manager.snapshot("proj-2", "att-3");

            assertEquals(1, first.version());
            assertEquals(2, second.version());
            assertEquals(1, other.version());
            assertEquals(first.checksum(), second.checksum());
            assertEquals(64, first.checksum().length());
            assertEquals(first, manager.get(first.id()));
        }

        @Test
        @DisplayName("versioning continues from snapshots already in the store")
        void versionsSeededFromStore() {
            manager.snapshot("proj-1", "att-1");
            manager.snapshot("proj-1", "att-2");
            var restarted = new RollbackManager(target, store, props, new KeystoneMetrics(meters), clock);
            assertEquals(3, restarted.snapshot("proj-1", "att-3").version());
        }

        @Test
        void checksumIgnoresMapInsertionOrder() {
            var a = new TargetState("t", 1, "s", Map.of("x", "1", "y", "2"), "blue");
            var b = new TargetState("t", 1, "s", Map.of("y", "2", "x", "1"), "blue");
            assertEquals(manager.checksum(a), manager.checksum(b));
            assertNotEquals(manager.checksum(a),
                    manager.checksum(new TargetState("t", 2, "s", Map.of("x", "1", "y", "2"), "blue")));
        }

        @Test
        void unknownSnapshot() {
            assertThrows(SnapshotNotFoundException.class, () -> manager.get("missing"));
        }
    }

    @Nested
    @DisplayName("Restore")
    class Restore {

        @Test
        @DisplayName("restores the captured state and is idempotent")
        void restoreIsIdempotent() {
            deploy("s0", Map.of("a.txt", "v0"));
            Snapshot snap = manager.snapshot("proj-1", "att-1");
            deploy("s1", Map.of("a.txt", "v1"));

            TargetState once = manager.restore(snap.id());
            TargetState twice = manager.restore(snap.id());

            assertEquals(snap.state(), once);
            assertEquals(once, twice);
            assertEquals(snap.state(), target.capture("proj-1"));
            assertEquals(2.0, meters.get("keystone.rollback.total").tag("outcome", "success").counter().count());
        }

        @Test
        @DisplayName("a tampered snapshot is refused")
        void checksumMismatch() {
            Snapshot snap = manager.snapshot("proj-1", "att-1");
            store.saveSnapshot(new Snapshot(snap.id(), snap.targetId(), snap.attemptId(), snap.version(),
                    snap.state(), "0".repeat(64), snap.createdAt()));

            var ex = assertThrows(RollbackFailureException.class, () -> manager.restore(snap.id()));
            assertEquals(snap.id(), ex.getSnapshotId());
            assertTrue(ex.getMessage().contains("checksum"));
            assertEquals(1.0, meters.get("keystone.rollback.total").tag("outcome", "failure").counter().count());
        }

        @Test
        @DisplayName("a missing snapshot is a rollback failure")
        void missingSnapshot() {
            assertThrows(RollbackFailureException.class, () -> manager.restore("gone"));
        }

        @Test
        @DisplayName("a target that rejects or ignores the restore is a rollback failure")
        void targetFailures() {
            DeploymentTarget broken = mock(DeploymentTarget.class);
            when(broken.capture("proj-1")).thenReturn(TargetState.empty("proj-1"));
            var brokenManager = new RollbackManager(broken, store, props, new KeystoneMetrics(meters), clock);
            Snapshot snap = brokenManager.snapshot("proj-1", "att-1");

            doThrow(new IllegalStateException("disk full")).when(broken).restore(any());
            assertThrows(RollbackFailureException.class, () -> brokenManager.restore(snap.id()));

            doNothing().when(broken).restore(any());
            when(broken.capture("proj-1"))
                    .thenReturn(new TargetState("proj-1", 9, "other", Map.of(), "green"));
            var ex = assertThrows(RollbackFailureException.class, () -> brokenManager.restore(snap.id()));
            assertTrue(ex.getMessage().contains("revision 9"));
        }
    }

    @Nested
    @DisplayName("Pruning")
    class Pruning {

        private IntegrationAttempt attempt(String id, AttemptState... path) {
            var a = IntegrationAttempt.start(id, "sub", "proj-1", null, DeploymentStrategy.BLUE_GREEN,
                    clock.instant());
            for (AttemptState s : path) {
                a = a.transitionTo(s, clock);
            }
            store.saveAttempt(a);
            return a;
        }

        @Test
        @DisplayName("keeps snapshots of running attempts and applies per-outcome retention")
        void retention() {
            attempt("running", AttemptState.VALIDATING, AttemptState.DEPLOYING);
            attempt("done", AttemptState.VALIDATING, AttemptState.DEPLOYING, AttemptState.VERIFYING,
                    AttemptState.COMPLETED);
            attempt("reverted", AttemptState.VALIDATING, AttemptState.DEPLOYING, AttemptState.ROLLED_BACK);

            Snapshot running = manager.snapshot("proj-1", "running");
            Snapshot done = manager.snapshot("proj-1", "done");
            Snapshot reverted = manager.snapshot("proj-1", "reverted");
            Snapshot orphan = manager.snapshot("proj-1", "no-such-attempt");

            clock.advance(Duration.ofDays(8));
            List<String> pruned = manager.prune();
            assertEquals(2, pruned.size());
            assertTrue(pruned.containsAll(List.of(done.id(), orphan.id())));

            clock.advance(Duration.ofDays(30));
            assertEquals(List.of(reverted.id()), manager.prune());
            assertTrue(store.findSnapshot(running.id()).isPresent());
        }
    }
}
