package com.keystone.core.quality;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.CheckerResult;
import com.keystone.core.model.IssueSeverity;
import com.keystone.core.model.QualityIssue;
import com.keystone.core.model.QualityReport;
import com.keystone.core.model.Submission;
import com.keystone.core.model.Verdict;
import com.keystone.core.persistence.PipelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs the enabled quality checkers against a submission and turns their scores
 * into a verdict.
 * <p>
 * Decision rules:
 * <ul>
 *   <li>checkers run in parallel under one overall deadline;</li>
 *   <li>a checker that throws or is still running at the deadline scores 0 and
 *       contributes a HIGH issue; a late checker is interrupted, so checkers must
 *       stop when interrupted to free their pool thread;</li>
 *   <li>the weighted score is the sum of score times configured weight, computed in
 *       checker-name order with {@link BigDecimal} so identical inputs always give
 *       identical output;</li>
 *   <li>ACCEPT requires the weighted score to reach the threshold and no CRITICAL issue.</li>
 * </ul>
 * The report is persisted before it is returned.
 */
@Service
public class QualityVerificationEngine {

    private static final Logger log = LoggerFactory.getLogger(QualityVerificationEngine.class);

    private static final int SCORE_SCALE = 4;

    private final List<QualityChecker> checkers;
    private final PipelineStore store;
    private final ExecutorService executor;
    private final KeystoneProperties.Quality config;
    private final KeystoneMetrics metrics;
    private final Clock clock;

    public QualityVerificationEngine(List<QualityChecker> checkers, PipelineStore store,
                                     @Qualifier("checkerExecutor") ExecutorService executor,
                                     KeystoneProperties properties, KeystoneMetrics metrics, Clock clock) {
        this.config = properties.getQuality();
        this.checkers = checkers.stream()
                .filter(c -> config.getEnabledCheckers().contains(c.name()))
                .sorted(Comparator.comparing(QualityChecker::name))
                .toList();
        this.store = store;
        this.executor = executor;
        this.metrics = metrics;
        this.clock = clock;
    }

    public QualityReport verify(Submission submission) {
        log.info("Verifying submission {} with checkers {}", submission.id(),
                checkers.stream().map(QualityChecker::name).toList());

        List<Callable<CheckerResult>> tasks = new ArrayList<>();
        for (QualityChecker checker : checkers) {
            tasks.add(() -> checker.check(submission));
        }
        List<Future<CheckerResult>> futures = runAll(tasks, config.getCheckerTimeout());

        List<CheckerResult> results = new ArrayList<>();
        for (int i = 0; i < checkers.size(); i++) {
            String name = checkers.get(i).name();
            results.add(futures.isEmpty()
                    ? CheckerResult.crashed(name, "Checker '" + name + "' interrupted")
                    : collect(name, futures.get(i)));
        }

        QualityReport report = evaluate(submission.id(), results);
        store.saveReport(report);
        metrics.recordVerdict(report.verdict().name(), report.weightedScore().doubleValue());
        log.info("Submission {} verdict {} (score {})", submission.id(), report.verdict(), report.weightedScore());
        return report;
    }

    /**
     * Combine checker results into a report. Pure apart from id and timestamp.
     */
    public QualityReport evaluate(String submissionId, List<CheckerResult> results) {
        List<CheckerResult> ordered = results.stream()
                .sorted(Comparator.comparing(CheckerResult::checker))
                .toList();

        BigDecimal weighted = BigDecimal.ZERO;
        for (CheckerResult r : ordered) {
            Double weight = config.getWeights().get(r.checker());
            if (weight == null) {
                log.warn("No weight configured for checker '{}'; it does not count towards the score", r.checker());
                continue;
            }
            weighted = weighted.add(BigDecimal.valueOf(r.score()).multiply(BigDecimal.valueOf(weight)));
        }
        weighted = weighted.setScale(SCORE_SCALE, RoundingMode.HALF_UP);

        List<QualityIssue> issues = ordered.stream().flatMap(r -> r.issues().stream()).toList();
        boolean critical = issues.stream().anyMatch(i -> i.severity() == IssueSeverity.CRITICAL);
        boolean meetsThreshold = weighted.compareTo(BigDecimal.valueOf(config.getThreshold())) >= 0;
        Verdict verdict = meetsThreshold && !critical ? Verdict.ACCEPT : Verdict.REJECT;

        return new QualityReport(UUID.randomUUID().toString(), submissionId, ordered, weighted, verdict,
                issues, summarize(verdict, weighted, critical, issues), clock.instant());
    }

    private String summarize(Verdict verdict, BigDecimal weighted, boolean critical, List<QualityIssue> issues) {
        Map<IssueSeverity, Long> counts = new EnumMap<>(IssueSeverity.class);
        for (QualityIssue issue : issues) {
            counts.merge(issue.severity(), 1L, Long::sum);
        }
        StringBuilder sb = new StringBuilder()
                .append(verdict).append(": weighted score ")
                .append(weighted.setScale(2, RoundingMode.HALF_UP))
                .append(" against threshold ").append(config.getThreshold());
        if (critical) {
            sb.append("; rejected for CRITICAL issue(s)");
        }
        if (!counts.isEmpty()) {
            sb.append("; issues ").append(counts);
        }
        return sb.toString();
    }

    /**
     * Run every checker under one deadline. Checkers still running when it passes are
     * cancelled with an interrupt so they give their pool thread back.
     *
     * @return futures in checker order, or an empty list if this thread was interrupted
     */
    private List<Future<CheckerResult>> runAll(List<Callable<CheckerResult>> tasks, Duration timeout) {
        try {
            return executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for quality checkers");
            return List.of();
        }
    }

    private static CheckerResult collect(String name, Future<CheckerResult> future) {
        if (future.isCancelled()) {
            log.warn("Checker '{}' exceeded its deadline and was cancelled", name);
            return CheckerResult.crashed(name, "Checker '" + name + "' timed out");
        }
        try {
            CheckerResult result = future.get();
            if (!name.equals(result.checker())) {
                return new CheckerResult(name, result.score(), result.issues(), result.failed(), result.details());
            }
            return result;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Checker '{}' failed: {}", name, cause.getMessage());
            return CheckerResult.crashed(name, "Checker '" + name + "' failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CheckerResult.crashed(name, "Checker '" + name + "' interrupted");
        }
    }
}
