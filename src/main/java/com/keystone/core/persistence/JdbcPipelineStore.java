package com.keystone.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.keystone.core.error.InvalidSubmissionStateException;
import com.keystone.core.error.StoreException;
import com.keystone.core.error.UnknownSubmissionException;
import com.keystone.core.model.IntegrationAttempt;
import com.keystone.core.model.QualityReport;
import com.keystone.core.model.Snapshot;
import com.keystone.core.model.Submission;
import com.keystone.core.model.SubmissionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC-backed {@link PipelineStore}.
 * <p>
 * Each record is stored as a JSON document next to the columns used for lookup
 * and ordering. Tables are created by {@link #createTables()}. The SQL sticks to
 * what both PostgreSQL and H2 accept.
 */
public class JdbcPipelineStore implements PipelineStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcPipelineStore.class);

    private static final List<String> CREATE_TABLES_SQL = List.of("""
            CREATE TABLE IF NOT EXISTS keystone_submissions (
                id          VARCHAR(64) PRIMARY KEY,
                project_id  VARCHAR(255) NOT NULL,
                status      VARCHAR(32) NOT NULL,
                created_at  TIMESTAMP NOT NULL,
                body        TEXT NOT NULL
            )
            """, """
            CREATE TABLE IF NOT EXISTS keystone_reports (
                seq           BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                id            VARCHAR(64) NOT NULL UNIQUE,
                submission_id VARCHAR(64) NOT NULL,
                created_at    TIMESTAMP NOT NULL,
                body          TEXT NOT NULL
            )
            """, """
            CREATE TABLE IF NOT EXISTS keystone_attempts (
                seq           BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                id            VARCHAR(64) NOT NULL UNIQUE,
                submission_id VARCHAR(64) NOT NULL,
                state         VARCHAR(32) NOT NULL,
                body          TEXT NOT NULL
            )
            """, """
            CREATE TABLE IF NOT EXISTS keystone_snapshots (
                id          VARCHAR(64) PRIMARY KEY,
                target_id   VARCHAR(255) NOT NULL,
                version     BIGINT NOT NULL,
                created_at  TIMESTAMP NOT NULL,
                body        TEXT NOT NULL
            )
            """);

    private static final String INSERT_SUBMISSION_SQL = """
            INSERT INTO keystone_submissions (id, project_id, status, created_at, body)
            VALUES (?, ?, ?, ?, ?)
            """;

    private static final String UPDATE_SUBMISSION_SQL = """
            UPDATE keystone_submissions SET status = ?, body = ?
            WHERE id = ? AND status = ?
            """;

    private static final String SELECT_SUBMISSION_SQL = """
            SELECT body FROM keystone_submissions WHERE id = ?
            """;

    private static final String SELECT_PROJECT_SUBMISSIONS_SQL = """
            SELECT body FROM keystone_submissions WHERE project_id = ? ORDER BY created_at, id
            """;

    private static final String INSERT_REPORT_SQL = """
            INSERT INTO keystone_reports (id, submission_id, created_at, body) VALUES (?, ?, ?, ?)
            """;

    private static final String SELECT_REPORTS_SQL = """
            SELECT body FROM keystone_reports WHERE submission_id = ? ORDER BY seq
            """;

    private static final String INSERT_ATTEMPT_SQL = """
            INSERT INTO keystone_attempts (id, submission_id, state, body) VALUES (?, ?, ?, ?)
            """;

    private static final String UPDATE_ATTEMPT_SQL = """
            UPDATE keystone_attempts SET state = ?, body = ? WHERE id = ?
            """;

    private static final String SELECT_ATTEMPT_SQL = """
            SELECT body FROM keystone_attempts WHERE id = ?
            """;

    private static final String SELECT_ATTEMPTS_SQL = """
            SELECT body FROM keystone_attempts WHERE submission_id = ? ORDER BY seq
            """;

    private static final String INSERT_SNAPSHOT_SQL = """
            INSERT INTO keystone_snapshots (id, target_id, version, created_at, body) VALUES (?, ?, ?, ?, ?)
            """;

    private static final String SELECT_SNAPSHOT_SQL = """
            SELECT body FROM keystone_snapshots WHERE id = ?
            """;

    private static final String SELECT_TARGET_SNAPSHOTS_SQL = """
            SELECT body FROM keystone_snapshots WHERE target_id = ? ORDER BY version
            """;

    private static final String SELECT_ALL_SNAPSHOTS_SQL = """
            SELECT body FROM keystone_snapshots ORDER BY target_id, version
            """;

    private static final String DELETE_SNAPSHOT_SQL = """
            DELETE FROM keystone_snapshots WHERE id = ?
            """;

    private final DataSource dataSource;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public JdbcPipelineStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Creates the pipeline tables if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : CREATE_TABLES_SQL) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
        }
        log.info("Pipeline tables ensured");
    }

    @Override
    public void saveSubmission(Submission submission) {
        update(INSERT_SUBMISSION_SQL, "save submission " + submission.id(),
                submission.id(), submission.projectId(), submission.status().name(),
                Timestamp.from(submission.createdAt()), toJson(submission));
    }

    @Override
    public Submission transitionSubmission(String submissionId, Set<SubmissionStatus> expected,
                                           SubmissionStatus status, String reason) {
        while (true) {
            Submission current = findSubmission(submissionId)
                    .orElseThrow(() -> new UnknownSubmissionException(submissionId));
            if (!expected.contains(current.status())) {
                throw new InvalidSubmissionStateException(
                        "Submission " + submissionId + " is " + current.status() + " and cannot move to " + status);
            }
            Submission next = current.withStatus(status, reason, clock.instant());
            int rows = update(UPDATE_SUBMISSION_SQL, "update submission " + submissionId,
                    status.name(), toJson(next), submissionId, current.status().name());
            if (rows == 1) {
                return next;
            }
            log.debug("Concurrent status change on submission {}, retrying", submissionId);
        }
    }

    @Override
    public Optional<Submission> findSubmission(String submissionId) {
        return queryOne(SELECT_SUBMISSION_SQL, Submission.class, submissionId);
    }

    @Override
    public List<Submission> submissionsForProject(String projectId) {
        return queryList(SELECT_PROJECT_SUBMISSIONS_SQL, Submission.class, projectId);
    }

    @Override
    public void saveReport(QualityReport report) {
        update(INSERT_REPORT_SQL, "save report " + report.id(),
                report.id(), report.submissionId(), Timestamp.from(report.createdAt()), toJson(report));
    }

    @Override
    public Optional<QualityReport> latestReport(String submissionId) {
        List<QualityReport> all = reportsFor(submissionId);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    @Override
    public List<QualityReport> reportsFor(String submissionId) {
        return queryList(SELECT_REPORTS_SQL, QualityReport.class, submissionId);
    }

    @Override
    public void saveAttempt(IntegrationAttempt attempt) {
        String json = toJson(attempt);
        int rows = update(UPDATE_ATTEMPT_SQL, "update attempt " + attempt.id(),
                attempt.state().name(), json, attempt.id());
        if (rows == 0) {
            update(INSERT_ATTEMPT_SQL, "save attempt " + attempt.id(),
                    attempt.id(), attempt.submissionId(), attempt.state().name(), json);
        }
    }

    @Override
    public Optional<IntegrationAttempt> findAttempt(String attemptId) {
        return queryOne(SELECT_ATTEMPT_SQL, IntegrationAttempt.class, attemptId);
    }

    @Override
    public Optional<IntegrationAttempt> latestAttempt(String submissionId) {
        List<IntegrationAttempt> all = attemptsFor(submissionId);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    @Override
    public List<IntegrationAttempt> attemptsFor(String submissionId) {
        return queryList(SELECT_ATTEMPTS_SQL, IntegrationAttempt.class, submissionId);
    }

    @Override
    public void saveSnapshot(Snapshot snapshot) {
        update(INSERT_SNAPSHOT_SQL, "save snapshot " + snapshot.id(),
                snapshot.id(), snapshot.targetId(), snapshot.version(),
                Timestamp.from(snapshot.createdAt()), toJson(snapshot));
    }

    @Override
    public Optional<Snapshot> findSnapshot(String snapshotId) {
        return queryOne(SELECT_SNAPSHOT_SQL, Snapshot.class, snapshotId);
    }

    @Override
    public List<Snapshot> listSnapshots(String targetId) {
        return queryList(SELECT_TARGET_SNAPSHOTS_SQL, Snapshot.class, targetId);
    }

    @Override
    public List<Snapshot> listAllSnapshots() {
        return queryList(SELECT_ALL_SNAPSHOTS_SQL, Snapshot.class);
    }

    @Override
    public boolean deleteSnapshot(String snapshotId) {
        return update(DELETE_SNAPSHOT_SQL, "delete snapshot " + snapshotId, snapshotId) > 0;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int update(String sql, String what, Object... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to " + what, e);
        }
    }

    private <T> Optional<T> queryOne(String sql, Class<T> type, Object... params) {
        List<T> rows = queryList(sql, type, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private <T> List<T> queryList(String sql, Class<T> type, Object... params) {
        List<T> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(fromJson(rs.getString("body"), type));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to query " + type.getSimpleName(), e);
        }
        return rows;
    }

    private static void bind(PreparedStatement stmt, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            stmt.setObject(i + 1, params[i]);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
