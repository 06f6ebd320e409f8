package com.keystone.core.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.DoubleSupplier;
import java.util.function.IntConsumer;

/**
 * Runs a call with exponential backoff. Only failures the policy marks as
 * retryable are retried; the last failure propagates once the budget is spent.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final Sleeper sleeper;
    private final DoubleSupplier jitterSource;

    /**
     * @param jitterSource yields samples in [-1,1]
     */
    public RetryExecutor(Sleeper sleeper, DoubleSupplier jitterSource) {
        this.sleeper = sleeper;
        this.jitterSource = jitterSource;
    }

    public <T> T execute(Callable<T> call, RetryPolicy policy) throws Exception {
        return execute(call, policy, attempt -> { });
    }

    /**
     * @param onRetry notified with the retry number before each retry
     */
    public <T> T execute(Callable<T> call, RetryPolicy policy, IntConsumer onRetry) throws Exception {
        int attempt = 0;
        while (true) {
            try {
                return call.call();
            } catch (Exception e) {
                if (!policy.retryable().test(e) || attempt >= policy.maxRetries()) {
                    throw e;
                }
                Duration delay = policy.delayFor(attempt, jitterSource.getAsDouble());
                attempt++;
                log.debug("Retry {}/{} in {} ms after: {}", attempt, policy.maxRetries(),
                        delay.toMillis(), e.getMessage());
                onRetry.accept(attempt);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ie;
                }
            }
        }
    }
}
