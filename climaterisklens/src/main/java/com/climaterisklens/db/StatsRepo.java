package com.climaterisklens.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row counts for the admin metrics view.
 */
public class StatsRepo {
    private final HikariDataSource ds;

    public StatsRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    public Map<String, Long> tableCounts() throws Exception {
        String sql = """
                SELECT
                    (SELECT COUNT(*) FROM hazards) AS hazard_predictions,
                    (SELECT COUNT(*) FROM alerts) AS alerts,
                    (SELECT COUNT(*) FROM telemetry) AS telemetry,
                    (SELECT COUNT(*) FROM users) AS users,
                    (SELECT COUNT(*) FROM sites WHERE is_active) AS sites
                """;
        Map<String, Long> out = new LinkedHashMap<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            rs.next();
            for (String col : new String[] { "hazard_predictions", "alerts", "telemetry", "users", "sites" }) {
                out.put(col, rs.getLong(col));
            }
        }
        return out;
    }

    /**
     * Runs {@code SELECT 1}; true when the database answers.
     */
    public boolean ping() {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT 1");
                ResultSet rs = ps.executeQuery()) {
            return rs.next();
        } catch (Exception e) {
            org.slf4j.LoggerFactory.getLogger(StatsRepo.class).warn("Database ping failed: {}", e.getMessage());
            return false;
        }
    }
}
