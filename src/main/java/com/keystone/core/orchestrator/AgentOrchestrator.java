package com.keystone.core.orchestrator;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.error.AgentCallException;
import com.keystone.core.error.AgentUnavailableException;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.AgentDescriptor;
import com.keystone.core.model.AgentResponse;
import com.keystone.core.model.AgentTask;
import com.keystone.core.model.DispatchResult;
import com.keystone.core.registry.AgentRegistry;
import com.keystone.core.resilience.CircuitBreaker;
import com.keystone.core.resilience.CircuitBreakerRegistry;
import com.keystone.core.resilience.RetryExecutor;
import com.keystone.core.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes tasks to capable agents.
 * <p>
 * Candidates come from the registry in dispatch order. For each candidate:
 * <ol>
 *   <li>agents whose circuit refuses the call are skipped;</li>
 *   <li>the call runs under the retry policy;</li>
 *   <li>exactly one outcome per candidate is reported to the circuit breaker and the registry.</li>
 * </ol>
 * The first success wins. If every candidate is skipped or fails, the caller gets
 * an {@link AgentUnavailableException} listing why.
 */
@Service
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    private final AgentRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final AgentClient client;
    private final RetryExecutor retryExecutor;
    private final KeystoneMetrics metrics;
    private final RetryPolicy retryPolicy;
    private final Duration defaultTimeout;

    public AgentOrchestrator(AgentRegistry registry, CircuitBreakerRegistry breakers, AgentClient client,
                             RetryExecutor retryExecutor, KeystoneMetrics metrics, KeystoneProperties properties) {
        this.registry = registry;
        this.breakers = breakers;
        this.client = client;
        this.retryExecutor = retryExecutor;
        this.metrics = metrics;
        var resilience = properties.getResilience();
        this.retryPolicy = new RetryPolicy(resilience.getMaxRetries(), resilience.getRetryBaseDelay(),
                resilience.getRetryMaxDelay(), resilience.getJitter(), RetryPolicy.RETRYABLE_AGENT_ERRORS);
        this.defaultTimeout = resilience.getCallTimeout();
    }

    public DispatchResult dispatch(AgentTask task) {
        String capability = task.requiredCapability();
        Duration timeout = task.timeout() != null ? task.timeout() : defaultTimeout;
        List<AgentDescriptor> candidates = registry.listByCapability(capability);
        Map<String, String> reasons = new LinkedHashMap<>();
        long dispatchStart = System.nanoTime();

        for (AgentDescriptor agent : candidates) {
            if (!registry.tryAcquireSlot(agent.id())) {
                reasons.put(agent.id(), "at capacity");
                log.debug("Skipping agent {} for task {}: at capacity {}", agent.id(), task.id(), agent.maxLoad());
                continue;
            }
            CircuitBreaker breaker = breakers.forAgent(agent.id());
            if (!breaker.tryAcquirePermission()) {
                registry.decrementLoad(agent.id());
                reasons.put(agent.id(), "circuit " + breaker.getState());
                log.debug("Skipping agent {} for task {}: circuit {}", agent.id(), task.id(), breaker.getState());
                continue;
            }

            MdcContext.setAgent(agent.id());
            long start = System.nanoTime();
            try {
                AgentResponse response = retryExecutor.execute(
                        () -> client.call(agent, task, timeout), retryPolicy,
                        attempt -> metrics.recordRetryAttempt(agent.id()));
                long elapsed = (System.nanoTime() - start) / 1_000_000;
                breaker.recordSuccess();
                registry.recordSuccess(agent.id(), elapsed);
                metrics.recordDispatch(capability, "success", (System.nanoTime() - dispatchStart) / 1_000_000);
                log.info("Task {} served by agent {} in {} ms", task.id(), agent.id(), elapsed);
                return new DispatchResult(agent.id(), response, elapsed);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                breaker.recordFailure();
                registry.recordFailure(agent.id());
                throw new AgentCallException(agent.id(), "Interrupted dispatching task " + task.id(), false, e);
            } catch (Exception e) {
                breaker.recordFailure();
                registry.recordFailure(agent.id());
                reasons.put(agent.id(), e.getMessage());
                log.warn("Agent {} failed task {}: {}", agent.id(), task.id(), e.getMessage());
            } finally {
                registry.decrementLoad(agent.id());
                MdcContext.clearAgent();
            }
        }

        metrics.recordDispatch(capability, "unavailable", (System.nanoTime() - dispatchStart) / 1_000_000);
        throw new AgentUnavailableException(capability, reasons);
    }
}
