package com.climaterisklens.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Database access for raw telemetry observations (one row per source reading).
 */
public class TelemetryRepo {
    private final HikariDataSource ds;

    public TelemetryRepo(HikariDataSource ds) {
        this.ds = ds;
        Jdbc.ensureSchema(ds, "telemetry", """
                CREATE TABLE IF NOT EXISTS telemetry (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    source VARCHAR(50) NOT NULL,
                    ts TIMESTAMPTZ NOT NULL,
                    lat DOUBLE PRECISION NOT NULL,
                    lon DOUBLE PRECISION NOT NULL,
                    payload_json JSONB NOT NULL,
                    data_latency_ms INTEGER,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT now()
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_telemetry_source_ts ON telemetry (source, ts)");
    }

    public void insert(String source, Instant ts, double lat, double lon, String payloadJson, Integer latencyMs)
            throws Exception {
        String sql = "INSERT INTO telemetry (source, ts, lat, lon, payload_json, data_latency_ms) "
                + "VALUES (?, ?, ?, ?, ?::jsonb, ?)";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, source);
            Jdbc.setInstant(ps, 2, ts);
            ps.setDouble(3, lat);
            ps.setDouble(4, lon);
            ps.setString(5, payloadJson);
            if (latencyMs == null)
                ps.setNull(6, java.sql.Types.INTEGER);
            else
                ps.setInt(6, latencyMs);
            ps.executeUpdate();
        }
    }

    /**
     * Latest observation time per source, sorted by source name.
     */
    public Map<String, Instant> latestPerSource() throws Exception {
        String sql = "SELECT source, MAX(ts) AS last_ts FROM telemetry GROUP BY source ORDER BY source";
        Map<String, Instant> out = new LinkedHashMap<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                out.put(rs.getString("source"), Jdbc.instant(rs, "last_ts"));
        }
        return out;
    }

    public int deleteOlderThan(Instant cutoff) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("DELETE FROM telemetry WHERE ts < ?")) {
            ps.setTimestamp(1, Timestamp.from(cutoff));
            return ps.executeUpdate();
        }
    }
}
