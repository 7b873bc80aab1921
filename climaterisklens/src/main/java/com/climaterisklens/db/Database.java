package com.climaterisklens.db;

import com.climaterisklens.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;

/**
 * Creates pooled database connections using HikariCP.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private Database() {
    }

    /**
     * Builds a connection pool for API requests.
     */
    public static HikariDataSource createApiDataSource(AppConfig cfg) {
        return createDataSource(cfg, "api", cfg.dbApiPoolMax());
    }

    /**
     * Builds a connection pool for background jobs and CLIs.
     */
    public static HikariDataSource createJobsDataSource(AppConfig cfg) {
        return createDataSource(cfg, "jobs", cfg.dbJobsPoolMax());
    }

    /**
     * Enables the extensions the schema relies on (PostGIS for site geometry).
     */
    public static void ensureExtensions(HikariDataSource ds) {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("CREATE EXTENSION IF NOT EXISTS postgis")) {
            ps.execute();
        } catch (Exception e) {
            log.warn("Could not enable postgis extension (may need superuser): {}", e.getMessage());
        }
    }

    /**
     * Shared helper to build a configured pool with a named role.
     */
    private static HikariDataSource createDataSource(AppConfig cfg, String role, int maxPool) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.dbJdbcUrl());
        hc.setUsername(cfg.dbUsername());
        hc.setPassword(cfg.dbPassword());
        hc.setPoolName("climaterisklens-" + role);
        hc.setMaximumPoolSize(Math.max(2, maxPool));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }
}
