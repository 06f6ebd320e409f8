package com.keystone.core.persistence;

import com.keystone.core.error.InvalidSubmissionStateException;
import com.keystone.core.error.UnknownSubmissionException;
import com.keystone.core.model.AttemptState;
import com.keystone.core.model.CheckerResult;
import com.keystone.core.model.DeploymentStrategy;
import com.keystone.core.model.IntegrationAttempt;
import com.keystone.core.model.QualityReport;
import com.keystone.core.model.Snapshot;
import com.keystone.core.model.SubmissionStatus;
import com.keystone.core.model.TargetState;
import com.keystone.core.model.Verdict;
import com.keystone.support.Fixtures;
import com.keystone.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link PipelineStore} must share.
 */
abstract class PipelineStoreContractTest {

    protected MutableClock clock;
    protected PipelineStore store;

    protected abstract PipelineStore createStore(MutableClock clock) throws Exception;

    @BeforeEach
    void setUpStore() throws Exception {
        clock = new MutableClock(Fixtures.T0);
        store = createStore(clock);
    }

    private static QualityReport report(String id, String submissionId, Verdict verdict, String score) {
        return new QualityReport(id, submissionId, List.of(CheckerResult.of("code-quality", 90.0, List.of())),
                new BigDecimal(score), verdict, List.of(), verdict.name(), Fixtures.T0);
    }

    private static Snapshot snapshot(String id, String targetId, long version) {
        TargetState state = new TargetState(targetId, version, "s" + version, Map.of("app.js", "v" + version), "blue");
        return new Snapshot(id, targetId, "att-" + version, version, state, "sum-" + version, Fixtures.T0);
    }

    @Test
    void submissionRoundTripsWithStatusUpdates() {
        store.saveSubmission(Fixtures.submission("s1", "p1", Map.of("a.js", "x"), Map.of("author", "agent-7"),
                SubmissionStatus.RECEIVED));
        clock.advance(Duration.ofSeconds(5));

        var updated = store.updateSubmissionStatus("s1", SubmissionStatus.ACCEPTED, "ACCEPT");

        assertEquals(SubmissionStatus.ACCEPTED, updated.status());
        var loaded = store.findSubmission("s1").orElseThrow();
        assertEquals(SubmissionStatus.ACCEPTED, loaded.status());
        assertEquals("ACCEPT", loaded.reason());
        assertEquals(Map.of("a.js", "x"), loaded.artifact().files());
        assertEquals("agent-7", loaded.metadata().get("author"));
        assertEquals(Fixtures.T0.plusSeconds(5), loaded.updatedAt());
    }

    @Test
    void terminalSubmissionRefusesTransitions() {
        store.saveSubmission(Fixtures.submission("s1", "p1", Map.of("a.js", "x"), Map.of(),
                SubmissionStatus.VERIFYING));
        store.updateSubmissionStatus("s1", SubmissionStatus.REJECTED, "score too low");

        assertThrows(InvalidSubmissionStateException.class,
                () -> store.updateSubmissionStatus("s1", SubmissionStatus.ACCEPTED, null));
        assertEquals(SubmissionStatus.REJECTED, store.findSubmission("s1").orElseThrow().status());
    }

    @Test
    void transitionChecksTheExpectedStatus() {
        store.saveSubmission(Fixtures.submission("s1", "p1", Map.of("a.js", "x"), Map.of(),
                SubmissionStatus.INTEGRATING));

        assertThrows(InvalidSubmissionStateException.class, () -> store.transitionSubmission("s1",
                SubmissionStatus.verifiable(), SubmissionStatus.VERIFYING, null));
        assertEquals(SubmissionStatus.INTEGRATING, store.findSubmission("s1").orElseThrow().status());

        var moved = store.transitionSubmission("s1", Set.of(SubmissionStatus.INTEGRATING),
                SubmissionStatus.INTEGRATED, "done");
        assertEquals(SubmissionStatus.INTEGRATED, moved.status());
    }

    @Test
    void concurrentClaimsHaveASingleWinner() throws Exception {
        store.saveSubmission(Fixtures.submission("s1", "p1", Map.of("a.js", "x"), Map.of(),
                SubmissionStatus.ACCEPTED));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger integrating = new AtomicInteger();
        AtomicInteger verifying = new AtomicInteger();
        List<Future<?>> claims = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            boolean verify = i == 0;
            claims.add(pool.submit(() -> {
                start.await();
                try {
                    if (verify) {
                        store.transitionSubmission("s1", SubmissionStatus.verifiable(), SubmissionStatus.VERIFYING, null);
                        verifying.incrementAndGet();
                    } else {
                        store.transitionSubmission("s1", SubmissionStatus.integrable(), SubmissionStatus.INTEGRATING, null);
                        integrating.incrementAndGet();
                    }
                } catch (InvalidSubmissionStateException lost) {
                    // another claim got there first
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> claim : claims) {
            claim.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(1, integrating.get() + verifying.get());
        SubmissionStatus expected = integrating.get() == 1 ? SubmissionStatus.INTEGRATING : SubmissionStatus.VERIFYING;
        assertEquals(expected, store.findSubmission("s1").orElseThrow().status());
    }

    @Test
    void updatingUnknownSubmissionFails() {
        assertThrows(UnknownSubmissionException.class,
                () -> store.updateSubmissionStatus("nope", SubmissionStatus.ACCEPTED, null));
        assertTrue(store.findSubmission("nope").isEmpty());
    }

    @Test
    void submissionsAreListedPerProject() {
        store.saveSubmission(Fixtures.submission("s1", "p1", Map.of("a", "1")));
        store.saveSubmission(Fixtures.submission("s2", "p2", Map.of("a", "2")));
        store.saveSubmission(Fixtures.submission("s3", "p1", Map.of("a", "3")));

        assertEquals(List.of("s1", "s3"), store.submissionsForProject("p1").stream().map(s -> s.id()).toList());
    }

    @Test
    void reportsAreAppendOnlyAndLatestWins() {
        store.saveReport(report("r1", "s1", Verdict.REJECT, "70.0000"));
        store.saveReport(report("r2", "s1", Verdict.ACCEPT, "88.5000"));

        assertEquals(List.of("r1", "r2"), store.reportsFor("s1").stream().map(QualityReport::id).toList());
        QualityReport latest = store.latestReport("s1").orElseThrow();
        assertEquals("r2", latest.id());
        assertEquals(0, new BigDecimal("88.5").compareTo(latest.weightedScore()));
        assertEquals(Verdict.ACCEPT, latest.verdict());
        assertTrue(store.latestReport("s2").isEmpty());
    }

    @Test
    void attemptsAreUpsertedInStartOrder() {
        var a1 = IntegrationAttempt.start("a1", "s1", "p1", null, DeploymentStrategy.BLUE_GREEN, Fixtures.T0);
        var a2 = IntegrationAttempt.start("a2", "s1", "p1", DeploymentStrategy.CANARY, DeploymentStrategy.CANARY,
                Fixtures.T0);
        store.saveAttempt(a1);
        store.saveAttempt(a2);
        store.saveAttempt(a1.transitionTo(AttemptState.VALIDATING, clock).transitionTo(AttemptState.FAILED, clock)
                .withError("conflict"));

        var all = store.attemptsFor("s1");
        assertEquals(List.of("a1", "a2"), all.stream().map(IntegrationAttempt::id).toList());
        assertEquals(AttemptState.FAILED, all.get(0).state());
        assertEquals(List.of("conflict"), all.get(0).errors());
        assertEquals("a2", store.latestAttempt("s1").orElseThrow().id());
        assertEquals(DeploymentStrategy.CANARY, store.findAttempt("a2").orElseThrow().requestedStrategy());
        assertTrue(store.findAttempt("zz").isEmpty());
    }

    @Test
    void snapshotsAreOrderedByVersionAndDeletable() {
        store.saveSnapshot(snapshot("snap-2", "t1", 2));
        store.saveSnapshot(snapshot("snap-1", "t1", 1));
        store.saveSnapshot(snapshot("snap-x", "t0", 1));

        assertEquals(List.of(1L, 2L), store.listSnapshots("t1").stream().map(Snapshot::version).toList());
        assertEquals(List.of("snap-x", "snap-1", "snap-2"),
                store.listAllSnapshots().stream().map(Snapshot::id).toList());

        Snapshot loaded = store.findSnapshot("snap-2").orElseThrow();
        assertEquals("sum-2", loaded.checksum());
        assertEquals(Map.of("app.js", "v2"), loaded.state().files());

        assertTrue(store.deleteSnapshot("snap-2"));
        assertFalse(store.deleteSnapshot("snap-2"));
        assertTrue(store.findSnapshot("snap-2").isEmpty());
    }
}
