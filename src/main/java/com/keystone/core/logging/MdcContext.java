package com.keystone.core.logging;

import org.slf4j.MDC;

/**
 * Pipeline-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SUBMISSION_ID = "submissionId";
    public static final String PROJECT_ID = "projectId";
    public static final String ATTEMPT_ID = "attemptId";
    public static final String AGENT_ID = "agentId";

    private MdcContext() {}

    public static void setSubmission(String submissionId, String projectId) {
        MDC.put(SUBMISSION_ID, submissionId);
        MDC.put(PROJECT_ID, projectId);
    }

    public static void setAttempt(String submissionId, String projectId, String attemptId) {
        setSubmission(submissionId, projectId);
        MDC.put(ATTEMPT_ID, attemptId);
    }

    public static void setAgent(String agentId) {
        MDC.put(AGENT_ID, agentId);
    }

    public static void clearAgent() {
        MDC.remove(AGENT_ID);
    }

    public static void clear() {
        MDC.remove(SUBMISSION_ID);
        MDC.remove(PROJECT_ID);
        MDC.remove(ATTEMPT_ID);
        MDC.remove(AGENT_ID);
    }
}
