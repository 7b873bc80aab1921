package com.climaterisklens.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.UUID;

/**
 * Database access for organizations (tenants that own sites and alerts).
 */
public class OrganizationRepo {
    private final HikariDataSource ds;

    public OrganizationRepo(HikariDataSource ds) {
        this.ds = ds;
        Jdbc.ensureSchema(ds, "organizations", """
                CREATE TABLE IF NOT EXISTS organizations (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    name VARCHAR(255) NOT NULL,
                    api_key VARCHAR(255) UNIQUE,
                    is_active BOOLEAN NOT NULL DEFAULT TRUE,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT now(),
                    updated_at TIMESTAMPTZ NOT NULL DEFAULT now()
                )
                """);
    }

    /**
     * Creates an organization and returns its id. When an api key is given and
     * already taken, the existing organization is returned instead.
     */
    public UUID create(String name, String apiKey) throws Exception {
        String sql = """
                INSERT INTO organizations (name, api_key) VALUES (?, ?)
                ON CONFLICT (api_key) DO UPDATE SET name = EXCLUDED.name, updated_at = now()
                RETURNING id
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, name);
            ps.setString(2, apiKey);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return Jdbc.uuid(rs, "id");
            }
        }
    }

    /**
     * Returns true when an active organization with this id exists.
     */
    public boolean exists(UUID id) throws Exception {
        String sql = "SELECT 1 FROM organizations WHERE id = ? AND is_active";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
