package com.climaterisklens.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Database access for background job run logs.
 */
public class JobRunRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(JobRunRepo.class);

    public JobRunRepo(HikariDataSource ds) {
        this.ds = ds;
        Jdbc.ensureSchema(ds, "job_run", """
                CREATE TABLE IF NOT EXISTS job_run (
                    run_id UUID PRIMARY KEY,
                    job_name VARCHAR(100) NOT NULL,
                    started_at TIMESTAMPTZ NOT NULL,
                    finished_at TIMESTAMPTZ,
                    status VARCHAR(20) NOT NULL,
                    notes TEXT
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_job_run_name_started ON job_run (job_name, started_at)");
    }

    /**
     * Starts a new run and returns its id. A closed pool (shutdown in progress)
     * skips the write but still hands out an id.
     */
    public UUID startRun(String jobName) throws Exception {
        UUID runId = UUID.randomUUID();
        if (ds.isClosed()) {
            log.warn("startRun skipped (datasource closed): {}", jobName);
            return runId;
        }
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO job_run (run_id, job_name, started_at, status) VALUES (?, ?, now(), 'RUNNING')")) {
            ps.setObject(1, runId);
            ps.setString(2, jobName);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isClosed(e)) {
                log.warn("startRun skipped (datasource closed): {}", jobName);
                return runId;
            }
            throw e;
        }
        log.debug("startRun: {} -> {}", jobName, runId);
        return runId;
    }

    /**
     * Marks a run as SUCCESS or FAILED with notes.
     */
    public void finishRun(UUID runId, boolean success, String notes) throws Exception {
        if (ds.isClosed()) {
            log.warn("finishRun skipped (datasource closed): {}", runId);
            return;
        }
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "UPDATE job_run SET finished_at=now(), status=?, notes=? WHERE run_id=?")) {
            ps.setString(1, success ? "SUCCESS" : "FAILED");
            ps.setString(2, notes);
            ps.setObject(3, runId);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isClosed(e)) {
                log.warn("finishRun skipped (datasource closed): {}", runId);
                return;
            }
            throw e;
        }
        log.debug("finishRun: {} success={} notes={}", runId, success, notes);
    }

    /**
     * Latest run of every job, by job name.
     */
    public List<JobRun> latestPerJob() throws Exception {
        String sql = "SELECT DISTINCT ON (job_name) run_id, job_name, started_at, finished_at, status, notes "
                + "FROM job_run ORDER BY job_name, started_at DESC";
        List<JobRun> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new JobRun(Jdbc.uuid(rs, "run_id"), rs.getString("job_name"),
                        Jdbc.instant(rs, "started_at"), Jdbc.instant(rs, "finished_at"), rs.getString("status"),
                        rs.getString("notes")));
            }
        }
        return out;
    }

    private boolean isClosed(SQLException e) {
        return ds.isClosed() || String.valueOf(e.getMessage()).toLowerCase().contains("closed");
    }

    public record JobRun(UUID runId, String jobName, Instant startedAt, Instant finishedAt, String status,
            String notes) {
    }
}
