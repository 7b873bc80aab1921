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
 * Database access for user feedback on predictions.
 */
public class FeedbackRepo {
    private final HikariDataSource ds;

    public FeedbackRepo(HikariDataSource ds) {
        this.ds = ds;
        Jdbc.ensureSchema(ds, "feedback", """
                CREATE TABLE IF NOT EXISTS feedback (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    hazard_id UUID NOT NULL REFERENCES hazards(hazard_id) ON DELETE CASCADE,
                    user_id UUID REFERENCES users(id),
                    label VARCHAR(10) NOT NULL,
                    notes TEXT,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT now()
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_feedback_user_id ON feedback (user_id)");
    }

    public UUID insert(UUID hazardId, UUID userId, String label, String notes) throws Exception {
        String sql = "INSERT INTO feedback (hazard_id, user_id, label, notes) VALUES (?, ?, ?, ?) RETURNING id";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, hazardId);
            Jdbc.setUuid(ps, 2, userId);
            ps.setString(3, label);
            ps.setString(4, notes);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return Jdbc.uuid(rs, "id");
            }
        }
    }

    public List<Feedback> listForUser(UUID userId, int limit, int offset) throws Exception {
        String sql = "SELECT id, hazard_id, label, notes, created_at FROM feedback WHERE user_id = ? "
                + "ORDER BY created_at DESC LIMIT ? OFFSET ?";
        List<Feedback> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, userId);
            ps.setInt(2, limit);
            ps.setInt(3, offset);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Feedback(Jdbc.uuid(rs, "id"), Jdbc.uuid(rs, "hazard_id"), rs.getString("label"),
                            rs.getString("notes"), Jdbc.instant(rs, "created_at")));
                }
            }
        }
        return out;
    }

    public record Feedback(UUID id, UUID hazardId, String label, String notes, Instant createdAt) {
    }
}
