package com.keystone.core.events;

/** Event type names published on the {@link EventBus}. */
public final class EventTypes {

    private EventTypes() {}

    public static final String SUBMISSION_RECEIVED = "submission.received";
    public static final String VERIFICATION_STARTED = "verification.started";
    public static final String VERIFICATION_COMPLETED = "verification.completed";
    public static final String INTEGRATION_STARTED = "integration.started";
    public static final String INTEGRATION_STATE = "integration.state";
    public static final String INTEGRATION_COMPLETED = "integration.completed";
    public static final String ROLLBACK_STARTED = "rollback.started";
    public static final String ROLLBACK_COMPLETED = "rollback.completed";
    public static final String ROLLBACK_FAILED = "rollback.failed";
    public static final String AGENT_REGISTERED = "agent.registered";
    public static final String AGENT_HEALTH = "agent.health";
    public static final String CIRCUIT_STATE = "circuit.state";
}
