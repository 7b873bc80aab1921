package com.climaterisklens.api;

import com.climaterisklens.db.AlertRepo.Alert;
import com.climaterisklens.db.UserRepo.User;
import com.climaterisklens.risk.HazardType;
import com.climaterisklens.util.AsciiSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Alert subscriptions per site and hazard, delivered by email or webhook.
 */
final class ApiRoutesAlerts {
    static final Set<String> CHANNELS = Set.of("email", "webhook");

    private ApiRoutesAlerts() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        AppServices svc = api.svc();

        app.post(ApiServer.API + "/alerts/subscribe", ctx -> {
            User user = AuthGuard.requireUser(api, ctx);
            if (user.orgId() == null) {
                throw ApiException.badRequest("no_organization", "User must belong to an organization");
            }
            ObjectNode body = api.jsonBody(ctx);

            String hazardName = ApiServer.text(body, "hazard");
            HazardType hazard = HazardType.fromKey(hazardName);
            if (hazard == null) {
                throw ApiException.badRequest("invalid_hazard", "Invalid hazard type");
            }

            double threshold = api.cfg().thresholdFor(hazard);
            JsonNode t = body.get("threshold");
            if (t != null && !t.isNull()) {
                if (!t.isNumber() || t.asDouble() < 0.0 || t.asDouble() > 1.0) {
                    throw ApiException.badRequest("invalid_threshold", "Threshold must be between 0.0 and 1.0");
                }
                threshold = t.asDouble();
            }

            Set<String> channels = new LinkedHashSet<>();
            JsonNode ch = body.get("channel");
            if (ch == null || !ch.isArray() || ch.isEmpty()) {
                throw ApiException.badRequest("invalid_channel", "channel must be a non-empty list");
            }
            for (JsonNode c : ch) {
                String name = AsciiSanitizer.sanitizeText(c.asText());
                name = name == null ? "" : name.toLowerCase(Locale.ROOT);
                if (!CHANNELS.contains(name)) {
                    throw ApiException.badRequest("invalid_channel", "Invalid channel: " + name);
                }
                channels.add(name);
            }

            String webhookUrl = ApiServer.text(body, "webhook_url");
            if (channels.contains("webhook")) {
                String lower = webhookUrl == null ? "" : webhookUrl.toLowerCase(Locale.ROOT);
                if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
                    throw ApiException.badRequest("invalid_webhook_url",
                            "webhook_url with http(s) scheme is required for the webhook channel");
                }
            }

            JsonNode ids = body.get("site_ids");
            if (ids == null || !ids.isArray() || ids.isEmpty()) {
                throw ApiException.badRequest("invalid_request", "site_ids must be a non-empty list");
            }
            List<UUID> siteIds = new ArrayList<>();
            for (JsonNode n : ids) {
                UUID id = ApiServer.parseUuid(n.asText());
                if (id == null || svc.sites().findForOrg(id, user.orgId()) == null) {
                    throw ApiException.notFound("Site " + n.asText() + " not found");
                }
                if (!siteIds.contains(id))
                    siteIds.add(id);
            }

            UUID subscriptionId = svc.alerts().insertSubscription(user.orgId(), siteIds, hazard.key(), threshold,
                    new ArrayList<>(channels), channels.contains("webhook") ? webhookUrl : null, user.email());
            ctx.json(om.createObjectNode().put("subscription_id", subscriptionId.toString()));
        });

        app.get(ApiServer.API + "/alerts", ctx -> {
            User user = AuthGuard.requireUser(api, ctx);
            ArrayNode arr = om.createArrayNode();
            if (user.orgId() != null) {
                for (Alert a : svc.alerts().listForOrg(user.orgId())) {
                    ObjectNode row = arr.addObject();
                    row.put("id", a.id().toString());
                    row.put("site_id", a.siteId().toString());
                    row.put("site_name", a.siteName());
                    row.put("subscription_id", a.subscriptionId() == null ? null : a.subscriptionId().toString());
                    row.put("hazard_type", a.hazardType());
                    row.put("status", a.status());
                    if (a.pRisk() == null)
                        row.putNull("p_risk");
                    else
                        row.put("p_risk", a.pRisk());
                    row.put("threshold", a.threshold());
                    row.put("channel", a.channel());
                    row.put("webhook_url", a.webhookUrl());
                    row.put("sent_at", a.sentAt() == null ? null : a.sentAt().toString());
                    row.put("created_at", String.valueOf(a.createdAt()));
                }
            }
            ctx.json(arr);
        });

        app.delete(ApiServer.API + "/alerts/subscriptions/{subscription_id}", ctx -> {
            User user = AuthGuard.requireUser(api, ctx);
            if (user.orgId() == null) {
                throw ApiException.badRequest("no_organization", "User must belong to an organization");
            }
            UUID subId = ApiServer.parseUuid(ctx.pathParam("subscription_id"));
            if (subId == null) {
                throw ApiException.badRequest("invalid_request", "subscription_id must be a UUID");
            }
            int deleted = svc.alerts().deleteSubscription(user.orgId(), subId);
            ctx.json(om.createObjectNode().put("deleted", deleted));
        });
    }
}
