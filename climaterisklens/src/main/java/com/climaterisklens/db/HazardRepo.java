package com.climaterisklens.db;

import com.climaterisklens.geo.GridSystem;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Database access for hazard predictions (one row per hazard, grid cell, issue
 * time and horizon).
 */
public class HazardRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(HazardRepo.class);

    private static final String COLUMNS = "hazard_id, type, issued_at, horizon_minutes, grid_id, p_risk, "
            + "q10, q50, q90, model_version, data_time";

    private static final String GRID_ID_PATTERN = "'^-?[0-9]+_-?[0-9]+$'";
    static final String LAT_IDX = "(CASE WHEN grid_id ~ " + GRID_ID_PATTERN
            + " THEN split_part(grid_id, '_', 1)::bigint END)";
    static final String LON_IDX = "(CASE WHEN grid_id ~ " + GRID_ID_PATTERN
            + " THEN split_part(grid_id, '_', 2)::bigint END)";

    private final HikariDataSource ds;

    public HazardRepo(HikariDataSource ds) {
        this.ds = ds;
        Jdbc.ensureSchema(ds, "hazards", """
                CREATE TABLE IF NOT EXISTS hazards (
                    hazard_id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    type VARCHAR(50) NOT NULL,
                    issued_at TIMESTAMPTZ NOT NULL,
                    horizon_minutes INTEGER NOT NULL,
                    grid_id VARCHAR(50) NOT NULL,
                    p_risk DOUBLE PRECISION NOT NULL,
                    q10 DOUBLE PRECISION,
                    q50 DOUBLE PRECISION,
                    q90 DOUBLE PRECISION,
                    model_version VARCHAR(100) NOT NULL,
                    data_time TIMESTAMPTZ NOT NULL,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT now()
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_hazards_type_issued ON hazards (type, issued_at)",
                "CREATE INDEX IF NOT EXISTS idx_hazards_grid_id ON hazards (grid_id)",
                "CREATE INDEX IF NOT EXISTS idx_hazards_type_grid_issued ON hazards (type, grid_id, issued_at)",
                "CREATE INDEX IF NOT EXISTS idx_hazards_cell_idx ON hazards (" + LAT_IDX + ", " + LON_IDX + ")");
    }

    /**
     * Most recently issued prediction for a hazard and cell whose horizon does
     * not exceed the requested one; null when there is none.
     */
    public Prediction latest(String type, String gridId, int maxHorizonMinutes) throws Exception {
        String sql = "SELECT " + COLUMNS + " FROM hazards "
                + "WHERE type = ? AND grid_id = ? AND horizon_minutes <= ? "
                + "ORDER BY issued_at DESC, horizon_minutes DESC LIMIT 1";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, type);
            ps.setString(2, gridId);
            ps.setInt(3, maxHorizonMinutes);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? map(rs) : null;
            }
        }
    }

    /**
     * Latest prediction per cell for one hazard, restricted to the given cells.
     */
    public List<Prediction> latestPerGrid(String type, List<String> gridIds) throws Exception {
        if (gridIds.isEmpty())
            return List.of();
        String sql = "SELECT DISTINCT ON (grid_id) " + COLUMNS + " FROM hazards "
                + "WHERE type = ? AND grid_id = ANY(?) "
                + "ORDER BY grid_id, issued_at DESC, horizon_minutes ASC";
        List<Prediction> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, type);
            Array arr = c.createArrayOf("varchar", gridIds.toArray());
            ps.setArray(2, arr);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(map(rs));
            }
        }
        return out;
    }

    /**
     * Latest prediction per (cell, hazard) issued since the given instant.
     * A null type means every hazard.
     */
    public List<Prediction> latestSince(Instant since, String type) throws Exception {
        String sql = "SELECT DISTINCT ON (grid_id, type) " + COLUMNS + " FROM hazards "
                + "WHERE issued_at >= ? AND (?::varchar IS NULL OR type = ?) "
                + "ORDER BY grid_id, type, issued_at DESC, horizon_minutes ASC";
        List<Prediction> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(since));
            ps.setString(2, type);
            ps.setString(3, type);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(map(rs));
            }
        }
        return out;
    }

    /**
     * Like {@link #latestSince(Instant, String)} but restricted to cells whose
     * row and column indexes fall in the range, returning at most {@code limit}
     * rows. Malformed grid ids never match.
     */
    public List<Prediction> latestInRange(Instant since, String type, GridSystem.CellRange range, int limit)
            throws Exception {
        String sql = "SELECT DISTINCT ON (grid_id, type) " + COLUMNS + " FROM hazards "
                + "WHERE issued_at >= ? AND (?::varchar IS NULL OR type = ?) "
                + "AND " + LAT_IDX + " BETWEEN ? AND ? AND " + LON_IDX + " BETWEEN ? AND ? "
                + "ORDER BY grid_id, type, issued_at DESC, horizon_minutes ASC LIMIT ?";
        List<Prediction> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(since));
            ps.setString(2, type);
            ps.setString(3, type);
            ps.setLong(4, range.minLatIdx());
            ps.setLong(5, range.maxLatIdx());
            ps.setLong(6, range.minLonIdx());
            ps.setLong(7, range.maxLonIdx());
            ps.setInt(8, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(map(rs));
            }
        }
        return out;
    }

    public boolean exists(UUID hazardId) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT 1 FROM hazards WHERE hazard_id = ?")) {
            ps.setObject(1, hazardId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Batch insert; ids are generated by the database.
     */
    public int insertAll(List<Prediction> rows) throws Exception {
        if (rows.isEmpty())
            return 0;
        String sql = """
                INSERT INTO hazards (type, issued_at, horizon_minutes, grid_id, p_risk, q10, q50, q90,
                    model_version, data_time)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            for (Prediction p : rows) {
                ps.setString(1, p.type());
                Jdbc.setInstant(ps, 2, p.issuedAt());
                ps.setInt(3, p.horizonMinutes());
                ps.setString(4, p.gridId());
                ps.setDouble(5, p.pRisk());
                Jdbc.setDouble(ps, 6, p.q10());
                Jdbc.setDouble(ps, 7, p.q50());
                Jdbc.setDouble(ps, 8, p.q90());
                ps.setString(9, p.modelVersion());
                Jdbc.setInstant(ps, 10, p.dataTime());
                ps.addBatch();
            }
            int[] counts = ps.executeBatch();
            log.debug("insertAll: {} predictions", counts.length);
            return counts.length;
        }
    }

    public int deleteOlderThan(Instant cutoff) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("DELETE FROM hazards WHERE issued_at < ?")) {
            ps.setTimestamp(1, Timestamp.from(cutoff));
            return ps.executeUpdate();
        }
    }

    private static Prediction map(ResultSet rs) throws SQLException {
        return new Prediction(
                Jdbc.uuid(rs, "hazard_id"),
                rs.getString("type"),
                Jdbc.instant(rs, "issued_at"),
                rs.getInt("horizon_minutes"),
                rs.getString("grid_id"),
                rs.getDouble("p_risk"),
                Jdbc.nullableDouble(rs, "q10"),
                Jdbc.nullableDouble(rs, "q50"),
                Jdbc.nullableDouble(rs, "q90"),
                rs.getString("model_version"),
                Jdbc.instant(rs, "data_time"));
    }

    /**
     * One hazard prediction row. The id is null for rows not yet inserted.
     */
    public record Prediction(UUID hazardId, String type, Instant issuedAt, int horizonMinutes, String gridId,
            double pRisk, Double q10, Double q50, Double q90, String modelVersion, Instant dataTime) {
    }
}
