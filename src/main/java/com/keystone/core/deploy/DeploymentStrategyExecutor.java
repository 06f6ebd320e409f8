package com.keystone.core.deploy;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.error.DeploymentFailureException;
import com.keystone.core.model.DeploymentStrategy;
import com.keystone.core.model.Submission;
import com.keystone.core.rollback.RollbackManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies an accepted submission with the chosen strategy under the step deadline.
 * <p>
 * A snapshot must already exist for the attempt. Exceptions and timeouts surface as
 * {@link DeploymentFailureException}; the caller then restores the snapshot. On a
 * timeout the strategy is interrupted and this method returns only once it has
 * stopped, so a restore never races a strategy still mutating the target. A strategy
 * that ignores the interrupt for longer than {@code keystone.deploy.cancel-grace} is
 * reported with {@link DeploymentFailureException#isTargetUnsettled()} set.
 */
@Service
public class DeploymentStrategyExecutor {

    private static final Logger log = LoggerFactory.getLogger(DeploymentStrategyExecutor.class);

    private static final int QUEUED = 0;
    private static final int RUNNING = 1;
    private static final int ABANDONED = 2;

    private final Map<DeploymentStrategy, DeploymentStrategyHandler> handlers = new EnumMap<>(DeploymentStrategy.class);
    private final RollbackManager rollbackManager;
    private final ExecutorService executor;
    private final Duration stepTimeout;
    private final Duration cancelGrace;

    public DeploymentStrategyExecutor(List<DeploymentStrategyHandler> handlers, RollbackManager rollbackManager,
                                      @Qualifier("deployExecutor") ExecutorService executor,
                                      KeystoneProperties properties) {
        handlers.forEach(h -> this.handlers.put(h.strategy(), h));
        this.rollbackManager = rollbackManager;
        this.executor = executor;
        this.stepTimeout = properties.getDeploy().getStepTimeout();
        this.cancelGrace = properties.getDeploy().getCancelGrace();
    }

    public DeploymentOutcome execute(DeploymentStrategy strategy, Submission submission, String targetId,
                                     String snapshotId) {
        rollbackManager.get(snapshotId);
        DeploymentStrategyHandler handler = handlers.get(strategy);
        if (handler == null) {
            throw new IllegalStateException("No handler for strategy " + strategy);
        }

        log.info("Deploying submission {} to {} with {}", submission.id(), targetId, strategy);
        AtomicInteger phase = new AtomicInteger(QUEUED);
        CountDownLatch stopped = new CountDownLatch(1);
        Future<DeploymentOutcome> future = executor.submit(() -> {
            if (!phase.compareAndSet(QUEUED, RUNNING)) {
                return null;
            }
            try {
                return handler.deploy(submission, targetId);
            } finally {
                stopped.countDown();
            }
        });

        try {
            return future.get(stepTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            String message = strategy + " deployment to " + targetId + " exceeded " + stepTimeout.toMillis() + " ms";
            boolean settled = stop(future, phase, stopped);
            if (!settled) {
                log.error("{} strategy on {} ignored cancellation for {} ms", strategy, targetId, cancelGrace.toMillis());
                throw new DeploymentFailureException(message + "; strategy still running", null, true);
            }
            throw new DeploymentFailureException(message);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new DeploymentFailureException(strategy + " deployment to " + targetId
                    + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            boolean settled = stop(future, phase, stopped);
            throw new DeploymentFailureException("Interrupted deploying to " + targetId, e, !settled);
        }
    }

    /**
     * Interrupt the strategy and wait for it to return.
     *
     * @return {@code true} once the strategy is known not to touch the target again
     */
    private boolean stop(Future<DeploymentOutcome> future, AtomicInteger phase, CountDownLatch stopped) {
        if (phase.compareAndSet(QUEUED, ABANDONED)) {
            future.cancel(false);
            return true;
        }
        future.cancel(true);
        boolean interrupted = Thread.interrupted();
        try {
            return stopped.await(cancelGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            interrupted = true;
            return false;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
