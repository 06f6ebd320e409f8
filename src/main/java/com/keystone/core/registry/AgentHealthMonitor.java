package com.keystone.core.registry;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.model.AgentDescriptor;
import com.keystone.core.orchestrator.AgentClient;
import com.keystone.core.resilience.CircuitBreakerRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic liveness sweep over the registry.
 * <p>
 * Each sweep:
 * <ul>
 *   <li>treats agents that heartbeated within the last interval as alive;</li>
 *   <li>probes the rest in parallel, each with its own timeout. A successful probe
 *       counts as a heartbeat, a failed probe as a missed interval;</li>
 *   <li>evicts agents that stayed UNREACHABLE past the TTL and drops their circuit breakers.</li>
 * </ul>
 */
@Service
public class AgentHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(AgentHealthMonitor.class);

    private final AgentRegistry registry;
    private final AgentClient client;
    private final CircuitBreakerRegistry breakers;
    private final KeystoneProperties.Registry config;
    private final Clock clock;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "agent-health-monitor");
        t.setDaemon(true);
        return t;
    });

    private final ExecutorService probes = Executors.newFixedThreadPool(4, new ThreadFactory() {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "agent-probe-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    });

    public AgentHealthMonitor(AgentRegistry registry, AgentClient client, CircuitBreakerRegistry breakers,
                              KeystoneProperties properties, Clock clock) {
        this.registry = registry;
        this.client = client;
        this.breakers = breakers;
        this.config = properties.getRegistry();
        this.clock = clock;
    }

    @PostConstruct
    void start() {
        long interval = config.getHeartbeatInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::runSafely, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Agent health monitor started (interval={}ms, missed-heartbeats={})",
                interval, config.getMissedHeartbeats());
    }

    @PreDestroy
    void stop() {
        scheduler.shutdownNow();
        probes.shutdownNow();
        log.info("Agent health monitor stopped");
    }

    /**
     * Run a single sweep.
     *
     * @return ids evicted during this sweep
     */
    public List<String> runOnce() {
        Instant freshSince = clock.instant().minus(config.getHeartbeatInterval());
        Duration timeout = config.getProbeTimeout();
        List<CompletableFuture<Void>> pending = new ArrayList<>();

        for (AgentDescriptor agent : registry.listAll()) {
            if (agent.lastHeartbeat().isAfter(freshSince)) {
                continue;
            }
            pending.add(CompletableFuture
                    .supplyAsync(() -> client.ping(agent, timeout), probes)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .handle((health, error) -> {
                        if (error == null) {
                            registry.heartbeat(agent.id(), health);
                        } else {
                            log.debug("Probe of agent {} failed: {}", agent.id(), error.getMessage());
                            registry.recordMissedHeartbeat(agent.id());
                        }
                        return null;
                    }));
        }
        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();

        List<String> evicted = registry.evictExpired();
        evicted.forEach(breakers::remove);
        if (!evicted.isEmpty()) {
            log.info("Health sweep evicted {} agent(s): {}", evicted.size(), evicted);
        }
        return evicted;
    }

    private void runSafely() {
        try {
            runOnce();
        } catch (Exception e) {
            log.warn("Agent health sweep failed: {}", e.getMessage(), e);
        }
    }
}
