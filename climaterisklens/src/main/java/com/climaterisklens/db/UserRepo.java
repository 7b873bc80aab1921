package com.climaterisklens.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.UUID;

/**
 * Database access for users (OTP-verified accounts, roles, organization link).
 */
public class UserRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(UserRepo.class);

    private static final String COLUMNS = "id, email, is_active, is_verified, role, org_id, created_at";

    private final HikariDataSource ds;

    /**
     * Creates a repo and ensures the table exists.
     */
    public UserRepo(HikariDataSource ds) {
        this.ds = ds;
        Jdbc.ensureSchema(ds, "users", """
                CREATE TABLE IF NOT EXISTS users (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    email VARCHAR(255) NOT NULL UNIQUE,
                    hashed_password VARCHAR(255),
                    is_active BOOLEAN NOT NULL DEFAULT TRUE,
                    is_verified BOOLEAN NOT NULL DEFAULT FALSE,
                    role VARCHAR(50) NOT NULL DEFAULT 'anon',
                    org_id UUID REFERENCES organizations(id),
                    created_at TIMESTAMPTZ NOT NULL DEFAULT now(),
                    updated_at TIMESTAMPTZ NOT NULL DEFAULT now()
                )
                """);
    }

    /**
     * Loads a user by id, or null when absent.
     */
    public User findById(UUID id) throws Exception {
        String sql = "SELECT " + COLUMNS + " FROM users WHERE id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? map(rs) : null;
            }
        }
    }

    /**
     * Loads a user by email, or null when absent.
     */
    public User findByEmail(String email) throws Exception {
        String sql = "SELECT " + COLUMNS + " FROM users WHERE email = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, email);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? map(rs) : null;
            }
        }
    }

    /**
     * Creates the user on first login, or marks an existing one verified.
     */
    public User upsertVerified(String email) throws Exception {
        String sql = """
                INSERT INTO users (email, is_verified, role)
                VALUES (?, TRUE, 'anon')
                ON CONFLICT (email) DO UPDATE SET is_verified = TRUE, updated_at = now()
                RETURNING """ + " " + COLUMNS;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, email);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                User u = map(rs);
                log.debug("upsertVerified: {} -> {}", email, u.id());
                return u;
            }
        }
    }

    /**
     * Inserts or refreshes a user with a fixed role and organization (used by
     * the demo seeder).
     */
    public User upsertWithRole(String email, String role, UUID orgId) throws Exception {
        String sql = """
                INSERT INTO users (email, is_verified, role, org_id)
                VALUES (?, TRUE, ?, ?)
                ON CONFLICT (email) DO UPDATE SET role = EXCLUDED.role, org_id = EXCLUDED.org_id,
                    is_verified = TRUE, updated_at = now()
                RETURNING """ + " " + COLUMNS;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, email);
            ps.setString(2, role);
            Jdbc.setUuid(ps, 3, orgId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return map(rs);
            }
        }
    }

    /**
     * Applies the non-null fields of an admin update; returns the updated user
     * or null when the id is unknown.
     */
    public User update(UUID id, String role, UUID orgId, Boolean active) throws Exception {
        String sql = """
                UPDATE users SET
                    role = COALESCE(?, role),
                    org_id = COALESCE(?, org_id),
                    is_active = COALESCE(?, is_active),
                    updated_at = now()
                WHERE id = ?
                RETURNING """ + " " + COLUMNS;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, role);
            Jdbc.setUuid(ps, 2, orgId);
            if (active == null)
                ps.setNull(3, java.sql.Types.BOOLEAN);
            else
                ps.setBoolean(3, active);
            ps.setObject(4, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? map(rs) : null;
            }
        }
    }

    private static User map(ResultSet rs) throws SQLException {
        return new User(
                Jdbc.uuid(rs, "id"),
                rs.getString("email"),
                rs.getBoolean("is_active"),
                rs.getBoolean("is_verified"),
                rs.getString("role"),
                Jdbc.uuid(rs, "org_id"),
                Jdbc.instant(rs, "created_at"));
    }

    /**
     * User row as seen by the API.
     */
    public record User(UUID id, String email, boolean active, boolean verified, String role, UUID orgId,
            Instant createdAt) {

        public boolean isAdmin() {
            return "admin".equals(role);
        }
    }
}
