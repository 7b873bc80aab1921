package com.climaterisklens.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Database access for organization sites (uploaded asset locations).
 */
public class SiteRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(SiteRepo.class);

    private static final String COLUMNS = "id, org_id, name, lat, lon, grid_id, metadata::text AS metadata, "
            + "is_active, created_at";

    private final HikariDataSource ds;

    public SiteRepo(HikariDataSource ds) {
        this.ds = ds;
        Jdbc.ensureSchema(ds, "sites", """
                CREATE TABLE IF NOT EXISTS sites (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    org_id UUID NOT NULL REFERENCES organizations(id),
                    name VARCHAR(255) NOT NULL,
                    lat DOUBLE PRECISION NOT NULL,
                    lon DOUBLE PRECISION NOT NULL,
                    grid_id VARCHAR(50) NOT NULL,
                    geom GEOMETRY(POINT, 4326) NOT NULL,
                    metadata JSONB,
                    is_active BOOLEAN NOT NULL DEFAULT TRUE,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT now(),
                    updated_at TIMESTAMPTZ NOT NULL DEFAULT now()
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_sites_geom ON sites USING GIST (geom)",
                "CREATE INDEX IF NOT EXISTS idx_sites_org_id ON sites (org_id)");
    }

    /**
     * Inserts all sites in one transaction; either every row lands or none.
     */
    public List<UUID> insertAll(UUID orgId, List<NewSite> sites, String metadataJson) throws Exception {
        String sql = """
                INSERT INTO sites (org_id, name, lat, lon, grid_id, geom, metadata)
                VALUES (?, ?, ?, ?, ?, ST_SetSRID(ST_MakePoint(?, ?), 4326), ?::jsonb)
                RETURNING id
                """;
        List<UUID> ids = new ArrayList<>();
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (NewSite s : sites) {
                    ps.setObject(1, orgId);
                    ps.setString(2, s.name());
                    ps.setDouble(3, s.lat());
                    ps.setDouble(4, s.lon());
                    ps.setString(5, s.gridId());
                    ps.setDouble(6, s.lon());
                    ps.setDouble(7, s.lat());
                    ps.setString(8, metadataJson);
                    try (ResultSet rs = ps.executeQuery()) {
                        rs.next();
                        ids.add(Jdbc.uuid(rs, "id"));
                    }
                }
                c.commit();
            } catch (Exception e) {
                // any failure undoes the whole batch before autocommit is restored
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        }
        log.debug("insertAll: org={} sites={}", orgId, ids.size());
        return ids;
    }

    /**
     * Loads a site only if it belongs to the organization, else null.
     */
    public Site findForOrg(UUID siteId, UUID orgId) throws Exception {
        String sql = "SELECT " + COLUMNS + " FROM sites WHERE id = ? AND org_id = ? AND is_active";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, siteId);
            ps.setObject(2, orgId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? map(rs) : null;
            }
        }
    }

    public List<Site> listForOrg(UUID orgId) throws Exception {
        String sql = "SELECT " + COLUMNS + " FROM sites WHERE org_id = ? AND is_active ORDER BY created_at, name";
        List<Site> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, orgId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(map(rs));
            }
        }
        return out;
    }

    /**
     * Distinct grid cells that hold at least one active site.
     */
    public List<String> activeGridIds() throws Exception {
        String sql = "SELECT DISTINCT grid_id FROM sites WHERE is_active ORDER BY grid_id";
        List<String> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                out.add(rs.getString(1));
        }
        return out;
    }

    private static Site map(ResultSet rs) throws SQLException {
        return new Site(
                Jdbc.uuid(rs, "id"),
                Jdbc.uuid(rs, "org_id"),
                rs.getString("name"),
                rs.getDouble("lat"),
                rs.getDouble("lon"),
                rs.getString("grid_id"),
                rs.getString("metadata"),
                rs.getBoolean("is_active"),
                String.valueOf(rs.getObject("created_at")));
    }

    /**
     * A site to insert; the grid id is computed by the caller.
     */
    public record NewSite(String name, double lat, double lon, String gridId) {
    }

    public record Site(UUID id, UUID orgId, String name, double lat, double lon, String gridId,
            String metadataJson, boolean active, String createdAt) {
    }
}
