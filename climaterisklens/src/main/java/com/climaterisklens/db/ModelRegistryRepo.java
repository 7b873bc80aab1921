package com.climaterisklens.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.UUID;

/**
 * Database access for the model registry (versioned trained models and where
 * their artifacts live).
 */
public class ModelRegistryRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ModelRegistryRepo.class);

    private final HikariDataSource ds;

    public ModelRegistryRepo(HikariDataSource ds) {
        this.ds = ds;
        Jdbc.ensureSchema(ds, "model_registry", """
                CREATE TABLE IF NOT EXISTS model_registry (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    model_name VARCHAR(255) NOT NULL,
                    model_version VARCHAR(50) NOT NULL,
                    run_id VARCHAR(255),
                    artifact_uri TEXT,
                    stage VARCHAR(50) NOT NULL DEFAULT 'None',
                    metrics_json JSONB,
                    is_active BOOLEAN NOT NULL DEFAULT TRUE,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT now(),
                    UNIQUE (model_name, model_version)
                )
                """);
    }

    /**
     * Next integer version for a model name (1 when none is registered).
     */
    public int nextVersion(String modelName) throws Exception {
        String sql = "SELECT COALESCE(MAX(CAST(model_version AS INTEGER)), 0) + 1 FROM model_registry "
                + "WHERE model_name = ? AND model_version ~ '^[0-9]+$'";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, modelName);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    public UUID register(String modelName, String version, String runId, String artifactUri, String metricsJson)
            throws Exception {
        String sql = "INSERT INTO model_registry (model_name, model_version, run_id, artifact_uri, metrics_json) "
                + "VALUES (?, ?, ?, ?, ?::jsonb) RETURNING id";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, modelName);
            ps.setString(2, version);
            ps.setString(3, runId);
            ps.setString(4, artifactUri);
            ps.setString(5, metricsJson);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                UUID id = Jdbc.uuid(rs, "id");
                log.info("Registered model {} v{} -> {}", modelName, version, artifactUri);
                return id;
            }
        }
    }

    /**
     * Most recently registered active version of a model, or null.
     */
    public RegisteredModel latest(String modelName) throws Exception {
        String sql = "SELECT model_name, model_version, run_id, artifact_uri, stage, created_at FROM model_registry "
                + "WHERE model_name = ? AND is_active ORDER BY created_at DESC LIMIT 1";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, modelName);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return null;
                return new RegisteredModel(rs.getString("model_name"), rs.getString("model_version"),
                        rs.getString("run_id"), rs.getString("artifact_uri"), rs.getString("stage"),
                        Jdbc.instant(rs, "created_at"));
            }
        }
    }

    public record RegisteredModel(String name, String version, String runId, String artifactUri, String stage,
            Instant createdAt) {
    }
}
