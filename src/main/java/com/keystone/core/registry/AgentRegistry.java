package com.keystone.core.registry;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.error.DuplicateAgentException;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.EventTypes;
import com.keystone.core.events.PipelineEvent;
import com.keystone.core.model.AgentDescriptor;
import com.keystone.core.model.AgentHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Catalogue of worker agents, their capabilities, health and load.
 * <p>
 * Every mutation of one agent goes through {@link ConcurrentHashMap#computeIfPresent}
 * so updates to the same agent are serialised while different agents proceed
 * independently. Readers always see whole descriptors.
 */
@Service
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    /** Candidate ordering: healthiest first, then least loaded, then id. */
    static final Comparator<AgentDescriptor> DISPATCH_ORDER = Comparator
            .comparing(AgentDescriptor::health)
            .thenComparingInt(AgentDescriptor::currentLoad)
            .thenComparing(AgentDescriptor::id);

    private final ConcurrentHashMap<String, AgentDescriptor> agents = new ConcurrentHashMap<>();
    private final KeystoneProperties.Registry config;
    private final Clock clock;
    private final EventBus eventBus;

    public AgentRegistry(KeystoneProperties properties, Clock clock, EventBus eventBus) {
        this.config = properties.getRegistry();
        this.clock = clock;
        this.eventBus = eventBus;
    }

    /**
     * Register a new agent as HEALTHY.
     *
     * @throws DuplicateAgentException if the id is already registered
     */
    public AgentDescriptor register(String id, Set<String> capabilities, String endpoint, Integer maxLoad) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("agent id is required");
        }
        int limit = maxLoad != null && maxLoad > 0 ? maxLoad : config.getDefaultMaxLoad();
        AgentDescriptor descriptor = AgentDescriptor.register(id, capabilities, endpoint, limit, clock.instant());
        if (agents.putIfAbsent(id, descriptor) != null) {
            throw new DuplicateAgentException(id);
        }
        log.info("Registered agent {} with capabilities {} at {}", id, descriptor.capabilities(), endpoint);
        publish(EventTypes.AGENT_REGISTERED, descriptor);
        return descriptor;
    }

    public boolean deregister(String id) {
        AgentDescriptor removed = agents.remove(id);
        if (removed != null) {
            log.info("Deregistered agent {}", id);
        }
        return removed != null;
    }

    /**
     * Record a sign of life. Resets missed-heartbeat and failure counters and
     * sets health to what the agent reported.
     *
     * @return the updated descriptor, empty if the agent is unknown
     */
    public Optional<AgentDescriptor> heartbeat(String id, AgentHealth reported) {
        AgentHealth health = reported != null ? reported : AgentHealth.HEALTHY;
        Instant now = clock.instant();
        return update(id, d -> d.withHeartbeat(health, now));
    }

    /**
     * Count one missed heartbeat interval. Every {@code missed-heartbeats}
     * consecutive misses move the agent one step down: HEALTHY to DEGRADED,
     * DEGRADED to UNREACHABLE.
     */
    public Optional<AgentDescriptor> recordMissedHeartbeat(String id) {
        int step = Math.max(1, config.getMissedHeartbeats());
        return update(id, d -> d.withMissedHeartbeat(step));
    }

    public Optional<AgentDescriptor> find(String id) {
        return Optional.ofNullable(agents.get(id));
    }

    /**
     * Agents advertising {@code capability} that are not UNREACHABLE,
     * in dispatch order. Agents at capacity are still listed; dispatch skips them.
     */
    public List<AgentDescriptor> listByCapability(String capability) {
        return agents.values().stream()
                .filter(d -> d.hasCapability(capability))
                .filter(d -> d.health() != AgentHealth.UNREACHABLE)
                .sorted(DISPATCH_ORDER)
                .toList();
    }

    public List<AgentDescriptor> listAll() {
        return agents.values().stream()
                .sorted(Comparator.comparing(AgentDescriptor::id))
                .toList();
    }

    public void incrementLoad(String id) {
        update(id, d -> d.withLoadDelta(1));
    }

    /**
     * Take one dispatch slot on the agent if it is below its {@code maxLoad}.
     * The check and the increment happen in one update, so concurrent callers
     * cannot overshoot the limit.
     *
     * @return {@code false} if the agent is unknown or already at capacity
     */
    public boolean tryAcquireSlot(String id) {
        boolean[] acquired = new boolean[1];
        update(id, d -> {
            acquired[0] = !d.atCapacity();
            return acquired[0] ? d.withLoadDelta(1) : d;
        });
        return acquired[0];
    }

    public void decrementLoad(String id) {
        update(id, d -> d.withLoadDelta(-1));
    }

    public void recordSuccess(String id, long elapsedMs) {
        update(id, d -> d.withCallSuccess(elapsedMs));
    }

    public void recordFailure(String id) {
        update(id, AgentDescriptor::withCallFailure);
    }

    /**
     * Remove agents that have been UNREACHABLE with no heartbeat for longer
     * than the configured TTL.
     *
     * @return ids of evicted agents
     */
    public List<String> evictExpired() {
        Instant cutoff = clock.instant().minus(config.getUnreachableTtl());
        List<String> evicted = new ArrayList<>();
        for (AgentDescriptor d : agents.values()) {
            if (d.health() == AgentHealth.UNREACHABLE && d.lastHeartbeat().isBefore(cutoff)
                    && agents.remove(d.id(), d)) {
                evicted.add(d.id());
                log.info("Evicted agent {}: unreachable since before {}", d.id(), cutoff);
            }
        }
        return evicted;
    }

    /** Aggregate counts across the catalogue. */
    public Map<String, Object> stats() {
        List<AgentDescriptor> all = listAll();
        Map<String, Long> byHealth = new LinkedHashMap<>();
        for (AgentHealth h : AgentHealth.values()) {
            byHealth.put(h.name(), all.stream().filter(d -> d.health() == h).count());
        }
        Set<String> capabilities = new TreeSet<>();
        all.forEach(d -> capabilities.addAll(d.capabilities()));
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total", all.size());
        stats.put("byHealth", byHealth);
        stats.put("capabilities", List.copyOf(capabilities));
        stats.put("currentLoad", all.stream().mapToInt(AgentDescriptor::currentLoad).sum());
        stats.put("tasksProcessed", all.stream().mapToLong(AgentDescriptor::tasksProcessed).sum());
        stats.put("tasksFailed", all.stream().mapToLong(AgentDescriptor::tasksFailed).sum());
        return stats;
    }

    private Optional<AgentDescriptor> update(String id, UnaryOperator<AgentDescriptor> change) {
        AgentDescriptor[] before = new AgentDescriptor[1];
        AgentDescriptor after = agents.computeIfPresent(id, (k, d) -> {
            before[0] = d;
            return change.apply(d);
        });
        if (after != null && before[0].health() != after.health()) {
            log.info("Agent {} health {} -> {}", id, before[0].health(), after.health());
            publish(EventTypes.AGENT_HEALTH, after);
        }
        return Optional.ofNullable(after);
    }

    private void publish(String type, AgentDescriptor d) {
        eventBus.publish(new PipelineEvent(type, null, null,
                Map.of("agentId", d.id(), "health", d.health().name()), clock.instant()));
    }
}
