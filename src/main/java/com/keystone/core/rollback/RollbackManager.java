package com.keystone.core.rollback;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.deploy.DeploymentTarget;
import com.keystone.core.error.RollbackFailureException;
import com.keystone.core.error.SnapshotNotFoundException;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.AttemptState;
import com.keystone.core.model.IntegrationAttempt;
import com.keystone.core.model.Snapshot;
import com.keystone.core.model.TargetState;
import com.keystone.core.persistence.PipelineStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Snapshot-before-mutate and restore-on-failure for deployment targets.
 * <p>
 * Snapshots are immutable, versioned per target and carry a SHA-256 checksum of
 * the captured state. {@link #restore} verifies the checksum, applies the state and
 * then re-captures the target to confirm it matches; any mismatch is a
 * {@link RollbackFailureException}. Restoring the same snapshot repeatedly leaves
 * the target in the same state.
 * <p>
 * Retention: snapshots whose attempt has reached a terminal state are pruned after
 * {@code keystone.rollback.retention}, or {@code rolled-back-retention} when the
 * attempt was ROLLED_BACK.
 */
@Service
public class RollbackManager {

    private static final Logger log = LoggerFactory.getLogger(RollbackManager.class);

    private final DeploymentTarget target;
    private final PipelineStore store;
    private final KeystoneProperties.Rollback config;
    private final KeystoneMetrics metrics;
    private final Clock clock;
    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();
    private final ConcurrentHashMap<String, Long> versions = new ConcurrentHashMap<>();

    private final ScheduledExecutorService pruner = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "snapshot-pruner");
        t.setDaemon(true);
        return t;
    });

    public RollbackManager(DeploymentTarget target, PipelineStore store, KeystoneProperties properties,
                           KeystoneMetrics metrics, Clock clock) {
        this.target = target;
        this.store = store;
        this.config = properties.getRollback();
        this.metrics = metrics;
        this.clock = clock;
    }

    @PostConstruct
    void startPruning() {
        long interval = config.getPruneInterval().toMillis();
        pruner.scheduleWithFixedDelay(() -> {
            try {
                prune();
            } catch (Exception e) {
                log.warn("Snapshot pruning failed: {}", e.getMessage(), e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void stopPruning() {
        pruner.shutdownNow();
    }

    /**
     * Capture the current state of a target.
     *
     * @param attemptId the attempt that owns the snapshot
     */
    public Snapshot snapshot(String targetId, String attemptId) {
        TargetState state = target.capture(targetId);
        long version = versions.compute(targetId, (id, last) -> {
            long base = last != null ? last : store.listSnapshots(id).stream()
                    .mapToLong(Snapshot::version).max().orElse(0L);
            return base + 1;
        });
        Snapshot snapshot = new Snapshot(UUID.randomUUID().toString(), targetId, attemptId, version,
                state, checksum(state), clock.instant());
        store.saveSnapshot(snapshot);
        log.info("Snapshot {} v{} taken of target {} at revision {}", snapshot.id(), version, targetId,
                state.revision());
        return snapshot;
    }

    /**
     * @throws SnapshotNotFoundException if no snapshot has that id
     */
    public Snapshot get(String snapshotId) {
        return store.findSnapshot(snapshotId).orElseThrow(() -> new SnapshotNotFoundException(snapshotId));
    }

    /**
     * Revert the snapshot's target to the captured state.
     *
     * @throws RollbackFailureException if the snapshot is missing or corrupt, the target
     *                                  rejects the restore, or the result does not match
     */
    public TargetState restore(String snapshotId) {
        Snapshot snapshot = store.findSnapshot(snapshotId)
                .orElseThrow(() -> fail(snapshotId, "Snapshot " + snapshotId + " not found", null));

        if (!checksum(snapshot.state()).equals(snapshot.checksum())) {
            throw fail(snapshotId, "Snapshot " + snapshotId + " failed checksum verification", null);
        }

        try {
            target.restore(snapshot.state());
        } catch (Exception e) {
            throw fail(snapshotId, "Target " + snapshot.targetId() + " rejected restore: " + e.getMessage(), e);
        }

        TargetState actual = target.capture(snapshot.targetId());
        if (!actual.equals(snapshot.state())) {
            throw fail(snapshotId, "Target " + snapshot.targetId() + " is at revision " + actual.revision()
                    + " after restoring snapshot of revision " + snapshot.state().revision(), null);
        }

        metrics.recordRollback("success");
        log.info("Restored target {} from snapshot {} (revision {})", snapshot.targetId(), snapshotId,
                actual.revision());
        return actual;
    }

    /**
     * Delete snapshots whose retention window has passed.
     *
     * @return ids of deleted snapshots
     */
    public List<String> prune() {
        Instant now = clock.instant();
        List<String> pruned = new ArrayList<>();
        for (Snapshot snapshot : store.listAllSnapshots()) {
            Optional<IntegrationAttempt> attempt = store.findAttempt(snapshot.attemptId());
            if (attempt.isPresent() && !attempt.get().state().isTerminal()) {
                continue;
            }
            Duration keep = attempt.map(a -> a.state() == AttemptState.ROLLED_BACK
                    ? config.getRolledBackRetention() : config.getRetention())
                    .orElse(config.getRetention());
            if (snapshot.createdAt().plus(keep).isBefore(now) && store.deleteSnapshot(snapshot.id())) {
                pruned.add(snapshot.id());
            }
        }
        if (!pruned.isEmpty()) {
            log.info("Pruned {} snapshot(s)", pruned.size());
        }
        return pruned;
    }

    String checksum(TargetState state) {
        try {
            byte[] canonical = canonicalMapper.writeValueAsString(state).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to checksum target state", e);
        }
    }

    private RollbackFailureException fail(String snapshotId, String message, Throwable cause) {
        metrics.recordRollback("failure");
        return cause != null ? new RollbackFailureException(snapshotId, message, cause)
                : new RollbackFailureException(snapshotId, message);
    }
}
