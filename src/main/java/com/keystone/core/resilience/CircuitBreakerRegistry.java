package com.keystone.core.resilience;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.EventTypes;
import com.keystone.core.events.PipelineEvent;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.CircuitBreakerState;
import com.keystone.core.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link CircuitBreaker} per agent id. Breakers are created lazily on
 * first use and dropped when their agent is evicted.
 */
@Service
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final KeystoneProperties.Resilience config;
    private final Clock clock;
    private final KeystoneMetrics metrics;
    private final EventBus eventBus;

    public CircuitBreakerRegistry(KeystoneProperties properties, Clock clock,
                                  KeystoneMetrics metrics, EventBus eventBus) {
        this.config = properties.getResilience();
        this.clock = clock;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    public CircuitBreaker forAgent(String agentId) {
        return breakers.computeIfAbsent(agentId, id -> new CircuitBreaker(id,
                config.getFailureThreshold(), config.getBaseCooldown(), config.getMaxCooldown(),
                clock, this::onTransition));
    }

    public Optional<CircuitBreakerState> stateOf(String agentId) {
        CircuitBreaker breaker = breakers.get(agentId);
        return breaker == null ? Optional.empty() : Optional.of(breaker.snapshot());
    }

    public List<CircuitBreakerState> all() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerState::agentId))
                .toList();
    }

    public List<String> listOpen() {
        return all().stream()
                .filter(s -> s.state() == CircuitState.OPEN)
                .map(CircuitBreakerState::agentId)
                .toList();
    }

    public boolean reset(String agentId) {
        CircuitBreaker breaker = breakers.get(agentId);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        log.info("Circuit for agent {} reset manually", agentId);
        return true;
    }

    public void remove(String agentId) {
        breakers.remove(agentId);
    }

    private void onTransition(String agentId, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            log.warn("Circuit for agent {} opened ({} -> {})", agentId, from, to);
        } else {
            log.info("Circuit for agent {}: {} -> {}", agentId, from, to);
        }
        metrics.recordCircuitTransition(from.name(), to.name());
        eventBus.publish(new PipelineEvent(EventTypes.CIRCUIT_STATE, null, null,
                Map.of("agentId", agentId, "from", from.name(), "to", to.name()), clock.instant()));
    }
}
