package com.keystone.core.integration;

import com.keystone.core.error.IntegrationConflictException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One integration at a time per project. The lock is held by an attempt id from
 * VALIDATING until the attempt reaches a terminal state.
 */
@Component
public class ProjectLockRegistry {

    private final ConcurrentHashMap<String, String> holders = new ConcurrentHashMap<>();

    /**
     * @throws IntegrationConflictException if another attempt holds the project
     */
    public void acquire(String projectId, String attemptId) {
        String holder = holders.putIfAbsent(projectId, attemptId);
        if (holder != null && !holder.equals(attemptId)) {
            throw new IntegrationConflictException(projectId, holder);
        }
    }

    /** Release only if {@code attemptId} is the holder. */
    public boolean release(String projectId, String attemptId) {
        return holders.remove(projectId, attemptId);
    }

    public Optional<String> holder(String projectId) {
        return Optional.ofNullable(holders.get(projectId));
    }

    public Map<String, String> held() {
        return Map.copyOf(holders);
    }
}
