package com.climaterisklens.db;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.UUID;

/**
 * Small JDBC helpers shared by the repos (nullable binds, DDL bootstrap).
 */
final class Jdbc {
    private static final Logger log = LoggerFactory.getLogger(Jdbc.class);

    private Jdbc() {
    }

    /**
     * Runs CREATE TABLE / CREATE INDEX statements; a failure is logged so the
     * API can still start against a read-only or pre-provisioned schema.
     */
    static void ensureSchema(HikariDataSource ds, String table, String... ddl) {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            for (String sql : ddl) {
                st.execute(sql);
            }
        } catch (Exception e) {
            log.warn("Schema bootstrap for {} failed: {}", table, e.getMessage());
        }
    }

    static void setInstant(PreparedStatement ps, int idx, Instant t) throws SQLException {
        if (t == null)
            ps.setNull(idx, Types.TIMESTAMP_WITH_TIMEZONE);
        else
            ps.setTimestamp(idx, Timestamp.from(t));
    }

    static void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.DOUBLE);
        else
            ps.setDouble(idx, v);
    }

    static void setUuid(PreparedStatement ps, int idx, UUID v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.OTHER);
        else
            ps.setObject(idx, v);
    }

    static Instant instant(ResultSet rs, String col) throws SQLException {
        Timestamp ts = rs.getTimestamp(col);
        return ts == null ? null : ts.toInstant();
    }

    static Double nullableDouble(ResultSet rs, String col) throws SQLException {
        double v = rs.getDouble(col);
        return rs.wasNull() ? null : v;
    }

    static UUID uuid(ResultSet rs, String col) throws SQLException {
        Object o = rs.getObject(col);
        if (o == null)
            return null;
        if (o instanceof UUID u)
            return u;
        return UUID.fromString(o.toString());
    }
}
