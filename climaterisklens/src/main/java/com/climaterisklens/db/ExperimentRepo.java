package com.climaterisklens.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Database access for A/B experiments.
 */
public class ExperimentRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ExperimentRepo.class);

    private final HikariDataSource ds;

    public ExperimentRepo(HikariDataSource ds) {
        this.ds = ds;
        Jdbc.ensureSchema(ds, "experiments", """
                CREATE TABLE IF NOT EXISTS experiments (
                    exp_id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    name VARCHAR(255) NOT NULL,
                    variant VARCHAR(50) NOT NULL,
                    start_at TIMESTAMPTZ NOT NULL,
                    stop_at TIMESTAMPTZ,
                    config_json JSONB,
                    is_active BOOLEAN NOT NULL DEFAULT TRUE,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT now()
                )
                """);
    }

    public List<Experiment> list() throws Exception {
        String sql = "SELECT exp_id, name, variant, start_at, stop_at, config_json::text AS config_json, is_active "
                + "FROM experiments ORDER BY start_at DESC";
        List<Experiment> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new Experiment(
                        Jdbc.uuid(rs, "exp_id"),
                        rs.getString("name"),
                        rs.getString("variant"),
                        Jdbc.instant(rs, "start_at"),
                        Jdbc.instant(rs, "stop_at"),
                        rs.getString("config_json"),
                        rs.getBoolean("is_active")));
            }
        }
        return out;
    }

    public UUID start(String name, String variant, String configJson) throws Exception {
        String sql = "INSERT INTO experiments (name, variant, start_at, config_json, is_active) "
                + "VALUES (?, ?, now(), ?::jsonb, TRUE) RETURNING exp_id";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, name);
            ps.setString(2, variant);
            ps.setString(3, configJson);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                UUID id = Jdbc.uuid(rs, "exp_id");
                log.info("Experiment started: {} ({}) -> {}", name, variant, id);
                return id;
            }
        }
    }

    /**
     * Stops an active experiment. Returns false when the id is unknown or the
     * experiment was already stopped.
     */
    public boolean stop(UUID expId) throws Exception {
        String sql = "UPDATE experiments SET is_active = FALSE, stop_at = now() WHERE exp_id = ? AND is_active";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, expId);
            return ps.executeUpdate() > 0;
        }
    }

    public record Experiment(UUID id, String name, String variant, Instant startAt, Instant stopAt,
            String configJson, boolean active) {
    }
}
