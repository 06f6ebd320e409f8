package com.keystone.core.engine;

import com.keystone.core.error.InvalidSubmissionStateException;
import com.keystone.core.error.UnknownSubmissionException;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.EventTypes;
import com.keystone.core.events.PipelineEvent;
import com.keystone.core.integration.ProjectIntegrator;
import com.keystone.core.model.AttemptState;
import com.keystone.core.model.DeploymentStrategy;
import com.keystone.core.model.IntegrationAttempt;
import com.keystone.core.model.IssueSeverity;
import com.keystone.core.model.QualityIssue;
import com.keystone.core.model.QualityReport;
import com.keystone.core.model.Submission;
import com.keystone.core.model.SubmissionStatus;
import com.keystone.core.model.Verdict;
import com.keystone.core.notify.NotificationPublisher;
import com.keystone.core.persistence.InMemoryPipelineStore;
import com.keystone.core.quality.QualityVerificationEngine;
import com.keystone.support.Fixtures;
import com.keystone.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PipelineEngineTest {

    private MutableClock clock;
    private InMemoryPipelineStore store;
    private QualityVerificationEngine quality;
    private ProjectIntegrator integrator;
    private NotificationPublisher notifications;
    private ExecutorService pool;
    private final List<PipelineEvent> events = new CopyOnWriteArrayList<>();
    private PipelineEngine engine;
    private volatile Verdict nextVerdict = Verdict.ACCEPT;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Fixtures.T0);
        store = new InMemoryPipelineStore(clock);
        quality = mock(QualityVerificationEngine.class);
        integrator = mock(ProjectIntegrator.class);
        notifications = mock(NotificationPublisher.class);
        pool = Executors.newFixedThreadPool(2);
        EventBus bus = new EventBus();
        bus.subscribeAll(events::add);
        engine = new PipelineEngine(store, quality, integrator, notifications, bus, pool, clock);

        when(quality.verify(any())).thenAnswer(inv -> {
            Submission s = inv.getArgument(0);
            QualityReport report = Fixtures.report(s.id(), nextVerdict, List.of());
            store.saveReport(report);
            return report;
        });
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void submitReturnsImmediatelyAndVerifiesInBackground() {
        Submission submission = engine.submit("proj-1", Map.of("a.js", "x"), Map.of("author", "agent-7"));

        assertEquals(SubmissionStatus.RECEIVED, submission.status());
        QualityReport report = engine.verifySubmission(submission.id());

        assertEquals(Verdict.ACCEPT, report.verdict());
        assertEquals(SubmissionStatus.ACCEPTED, engine.getStatus(submission.id()).submission().status());
        assertEquals(report, engine.getStatus(submission.id()).latestReport());
        verify(quality, times(1)).verify(any());
        verify(notifications).publish(any());
        assertTrue(events.stream().anyMatch(e -> EventTypes.SUBMISSION_RECEIVED.equals(e.eventType())));
        assertTrue(events.stream().anyMatch(e -> EventTypes.VERIFICATION_COMPLETED.equals(e.eventType())));
    }

    @Test
    void blankProjectIdIsRefused() {
        assertThrows(IllegalArgumentException.class, () -> engine.submit(" ", Map.of(), Map.of()));
    }

    @Test
    void rejectedSubmissionCannotBeReverified() {
        nextVerdict = Verdict.REJECT;
        Submission submission = engine.submit("proj-1", Map.of("a.js", "x"), Map.of());
        engine.verifySubmission(submission.id());

        assertEquals(SubmissionStatus.REJECTED, store.findSubmission(submission.id()).orElseThrow().status());
        assertThrows(InvalidSubmissionStateException.class, () -> engine.verifySubmission(submission.id(), true));
    }

    @Test
    void forcedVerificationProducesAFreshReport() {
        Submission submission = engine.submit("proj-1", Map.of("a.js", "x"), Map.of());
        QualityReport first = engine.verifySubmission(submission.id());

        QualityReport second = engine.verifySubmission(submission.id(), true);

        assertNotSame(first, second);
        assertEquals(2, store.reportsFor(submission.id()).size());
    }

    @Test
    void integratingSubmissionCannotBeReverified() {
        store.saveSubmission(Fixtures.submission("s1", "proj-1", Map.of("a.js", "x"), Map.of(),
                SubmissionStatus.INTEGRATING));

        assertThrows(InvalidSubmissionStateException.class, () -> engine.verifySubmission("s1", true));
        verify(quality, never()).verify(any());
    }

    @Test
    void integrationClaimBetweenCheckAndVerificationWins() {
        AtomicBoolean armed = new AtomicBoolean();
        InMemoryPipelineStore racing = new InMemoryPipelineStore(clock) {
            @Override
            public Optional<Submission> findSubmission(String submissionId) {
                Optional<Submission> seen = super.findSubmission(submissionId);
                if (armed.compareAndSet(true, false)) {
                    transitionSubmission(submissionId, SubmissionStatus.integrable(), SubmissionStatus.INTEGRATING,
                            "attempt a1");
                }
                return seen;
            }
        };
        racing.saveSubmission(Fixtures.submission("s1", "proj-1", Map.of("a.js", "x"), Map.of(),
                SubmissionStatus.ACCEPTED));
        PipelineEngine racingEngine = new PipelineEngine(racing, quality, integrator, notifications, new EventBus(),
                pool, clock);

        armed.set(true);
        assertThrows(InvalidSubmissionStateException.class, () -> racingEngine.verifySubmission("s1", true));

        assertEquals(SubmissionStatus.INTEGRATING, racing.findSubmission("s1").orElseThrow().status());
        verify(quality, never()).verify(any());
    }

    @Test
    void checkerCrashSurfacesToCaller() {
        doThrow(new IllegalStateException("checker pool gone")).when(quality).verify(any());
        Submission submission = engine.submit("proj-1", Map.of("a.js", "x"), Map.of());

        var ex = assertThrows(IllegalStateException.class, () -> engine.verifySubmission(submission.id()));
        assertEquals("checker pool gone", ex.getMessage());
    }

    @Test
    void integrationWaitsForRunningVerification() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(inv -> {
            assertTrue(release.await(5, TimeUnit.SECONDS));
            Submission s = inv.getArgument(0);
            QualityReport report = Fixtures.report(s.id(), Verdict.ACCEPT, List.of());
            store.saveReport(report);
            return report;
        }).when(quality).verify(any());
        Submission submission = engine.submit("proj-1", Map.of("a.js", "x"), Map.of());

        assertThrows(InvalidSubmissionStateException.class,
                () -> engine.startIntegration(submission.id(), null));

        release.countDown();
        engine.integrateSubmission(submission.id(), DeploymentStrategy.CANARY);
        verify(integrator).integrate(submission.id(), DeploymentStrategy.CANARY);
    }

    @Test
    void cancelDelegatesForLiveAttemptOnly() {
        Submission submission = engine.submit("proj-1", Map.of("a.js", "x"), Map.of());
        engine.verifySubmission(submission.id());
        assertFalse(engine.cancelIntegration(submission.id()));

        IntegrationAttempt pending = IntegrationAttempt.start("att-1", submission.id(), "proj-1", null,
                DeploymentStrategy.BLUE_GREEN, Fixtures.T0);
        store.saveAttempt(pending);
        when(integrator.cancel("att-1")).thenReturn(true);

        assertTrue(engine.cancelIntegration(submission.id()));
    }

    @Test
    void unknownSubmission() {
        assertThrows(UnknownSubmissionException.class, () -> engine.getStatus("nope"));
        assertThrows(UnknownSubmissionException.class, () -> engine.verifySubmission("nope"));
        assertThrows(UnknownSubmissionException.class, () -> engine.cancelIntegration("nope"));
    }

    @Test
    void projectQualityRollsUpHistory() {
        store.saveSubmission(Fixtures.submission("s1", "proj-9", Map.of("a", "1")));
        store.saveSubmission(Fixtures.submission("s2", "proj-9", Map.of("a", "2")));
        store.saveReport(Fixtures.report("s1", Verdict.ACCEPT, List.of()));
        store.saveReport(Fixtures.report("s2", Verdict.REJECT,
                List.of(QualityIssue.of(IssueSeverity.CRITICAL, "security", "hardcoded secret"))));
        store.saveAttempt(IntegrationAttempt.start("a1", "s1", "proj-9", null, DeploymentStrategy.CANARY,
                        Fixtures.T0)
                .transitionTo(AttemptState.VALIDATING, clock)
                .transitionTo(AttemptState.DEPLOYING, clock)
                .transitionTo(AttemptState.ROLLED_BACK, clock));

        var summary = engine.projectQuality("proj-9");

        assertEquals(2, summary.submissions());
        assertEquals(2, summary.reports());
        assertEquals(1, summary.accepted());
        assertEquals(0.5, summary.approvalRate());
        assertEquals(95.0, summary.averageScore(), 1e-9);
        assertEquals(1L, summary.issuesBySeverity().get(IssueSeverity.CRITICAL));
        assertEquals(1, summary.rolledBack());
        assertEquals(0, summary.integrated());
    }

    @Test
    void emptyProjectHasZeroApprovalRate() {
        var summary = engine.projectQuality("ghost");

        assertEquals(0, summary.submissions());
        assertEquals(0.0, summary.approvalRate());
    }
}
