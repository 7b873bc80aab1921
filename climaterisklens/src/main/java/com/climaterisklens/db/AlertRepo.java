package com.climaterisklens.db;

import com.zaxxer.hikari.HikariDataSource;

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
 * Database access for alert subscription rows. One row exists per site and
 * channel of a subscription; it moves from pending to sent or failed.
 */
public class AlertRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(AlertRepo.class);

    private static final String COLUMNS = "a.id, a.org_id, a.site_id, a.subscription_id, a.hazard_type, a.status, "
            + "a.p_risk, a.threshold, a.channel, a.webhook_url, a.recipient_email, a.sent_at, a.created_at";

    private final HikariDataSource ds;

    public AlertRepo(HikariDataSource ds) {
        this.ds = ds;
        Jdbc.ensureSchema(ds, "alerts", """
                CREATE TABLE IF NOT EXISTS alerts (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    org_id UUID NOT NULL REFERENCES organizations(id),
                    site_id UUID NOT NULL REFERENCES sites(id) ON DELETE CASCADE,
                    subscription_id UUID NOT NULL,
                    hazard_type VARCHAR(50) NOT NULL,
                    status VARCHAR(20) NOT NULL DEFAULT 'pending',
                    p_risk DOUBLE PRECISION,
                    threshold DOUBLE PRECISION NOT NULL,
                    channel VARCHAR(20) NOT NULL,
                    webhook_url TEXT,
                    recipient_email VARCHAR(255),
                    sent_at TIMESTAMPTZ,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT now()
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_alerts_status ON alerts (status)",
                "CREATE INDEX IF NOT EXISTS idx_alerts_org_id ON alerts (org_id)",
                "CREATE INDEX IF NOT EXISTS idx_alerts_subscription ON alerts (subscription_id)");
    }

    /**
     * Inserts one pending row per site and channel, all under a fresh
     * subscription id, in a single transaction.
     */
    public UUID insertSubscription(UUID orgId, List<UUID> siteIds, String hazard, double threshold,
            List<String> channels, String webhookUrl, String recipientEmail) throws Exception {
        UUID subscriptionId = UUID.randomUUID();
        String sql = """
                INSERT INTO alerts (org_id, site_id, subscription_id, hazard_type, status, threshold, channel,
                    webhook_url, recipient_email)
                VALUES (?, ?, ?, ?, 'pending', ?, ?, ?, ?)
                """;
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (UUID siteId : siteIds) {
                    for (String channel : channels) {
                        ps.setObject(1, orgId);
                        ps.setObject(2, siteId);
                        ps.setObject(3, subscriptionId);
                        ps.setString(4, hazard);
                        ps.setDouble(5, threshold);
                        ps.setString(6, channel);
                        ps.setString(7, "webhook".equals(channel) ? webhookUrl : null);
                        ps.setString(8, "email".equals(channel) ? recipientEmail : null);
                        ps.addBatch();
                    }
                }
                ps.executeBatch();
                c.commit();
            } catch (Exception e) {
                // any failure undoes the whole batch before autocommit is restored
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        }
        log.debug("insertSubscription: org={} sub={} sites={} channels={}", orgId, subscriptionId, siteIds.size(),
                channels);
        return subscriptionId;
    }

    public List<Alert> listForOrg(UUID orgId) throws Exception {
        String sql = "SELECT " + COLUMNS + ", s.grid_id, s.name AS site_name FROM alerts a "
                + "JOIN sites s ON s.id = a.site_id WHERE a.org_id = ? ORDER BY a.created_at DESC";
        List<Alert> out = new ArrayList<>();
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
     * Pending rows joined with their site's grid cell, oldest first.
     */
    public List<Alert> pending(int limit) throws Exception {
        String sql = "SELECT " + COLUMNS + ", s.grid_id, s.name AS site_name FROM alerts a "
                + "JOIN sites s ON s.id = a.site_id WHERE a.status = 'pending' AND s.is_active "
                + "ORDER BY a.created_at LIMIT ?";
        List<Alert> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(map(rs));
            }
        }
        return out;
    }

    public void markSent(UUID id, double pRisk, Instant sentAt) throws Exception {
        updateStatus(id, "sent", pRisk, sentAt);
    }

    public void markFailed(UUID id, double pRisk) throws Exception {
        updateStatus(id, "failed", pRisk, null);
    }

    /**
     * Records the latest observed risk on a row that stays pending.
     */
    public void updateRisk(UUID id, double pRisk) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("UPDATE alerts SET p_risk = ? WHERE id = ?")) {
            ps.setDouble(1, pRisk);
            ps.setObject(2, id);
            ps.executeUpdate();
        }
    }

    private void updateStatus(UUID id, String status, double pRisk, Instant sentAt) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "UPDATE alerts SET status = ?, p_risk = ?, sent_at = ? WHERE id = ?")) {
            ps.setString(1, status);
            ps.setDouble(2, pRisk);
            Jdbc.setInstant(ps, 3, sentAt);
            ps.setObject(4, id);
            ps.executeUpdate();
        }
        log.debug("alert {} -> {} (p_risk={})", id, status, pRisk);
    }

    /**
     * Deletes the organization's rows of one subscription; returns the count.
     */
    public int deleteSubscription(UUID orgId, UUID subscriptionId) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "DELETE FROM alerts WHERE org_id = ? AND subscription_id = ?")) {
            ps.setObject(1, orgId);
            ps.setObject(2, subscriptionId);
            return ps.executeUpdate();
        }
    }

    public int deleteFinishedOlderThan(Instant cutoff) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "DELETE FROM alerts WHERE status IN ('sent', 'failed') AND created_at < ?")) {
            ps.setTimestamp(1, Timestamp.from(cutoff));
            return ps.executeUpdate();
        }
    }

    private static Alert map(ResultSet rs) throws SQLException {
        return new Alert(
                Jdbc.uuid(rs, "id"),
                Jdbc.uuid(rs, "org_id"),
                Jdbc.uuid(rs, "site_id"),
                rs.getString("site_name"),
                rs.getString("grid_id"),
                Jdbc.uuid(rs, "subscription_id"),
                rs.getString("hazard_type"),
                rs.getString("status"),
                Jdbc.nullableDouble(rs, "p_risk"),
                rs.getDouble("threshold"),
                rs.getString("channel"),
                rs.getString("webhook_url"),
                rs.getString("recipient_email"),
                Jdbc.instant(rs, "sent_at"),
                Jdbc.instant(rs, "created_at"));
    }

    public record Alert(UUID id, UUID orgId, UUID siteId, String siteName, String gridId, UUID subscriptionId,
            String hazardType, String status, Double pRisk, double threshold, String channel, String webhookUrl,
            String recipientEmail, Instant sentAt, Instant createdAt) {
    }
}
