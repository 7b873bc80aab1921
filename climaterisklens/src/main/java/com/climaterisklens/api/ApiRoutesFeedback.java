package com.climaterisklens.api;

import com.climaterisklens.db.FeedbackRepo.Feedback;
import com.climaterisklens.db.UserRepo.User;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;

import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Analyst labels (TP/FP/FN/TN) on individual predictions.
 */
final class ApiRoutesFeedback {
    static final Set<String> LABELS = Set.of("TP", "FP", "FN", "TN");

    private ApiRoutesFeedback() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        AppServices svc = api.svc();

        app.post(ApiServer.API + "/feedback", ctx -> {
            User user = AuthGuard.requireUser(api, ctx);
            if (!api.cfg().enableFeedback()) {
                throw ApiException.badRequest("feedback_disabled", "Feedback is disabled");
            }
            ObjectNode body = api.jsonBody(ctx);
            String label = ApiServer.text(body, "label");
            label = label == null ? null : label.toUpperCase(Locale.ROOT);
            if (label == null || !LABELS.contains(label)) {
                throw ApiException.badRequest("invalid_label", "Invalid label. Must be TP, FP, FN, or TN");
            }
            UUID hazardId = ApiServer.parseUuid(ApiServer.text(body, "hazard_id"));
            if (hazardId == null) {
                throw ApiException.badRequest("invalid_request", "hazard_id must be a UUID");
            }
            if (!svc.hazards().exists(hazardId)) {
                throw ApiException.notFound("Hazard prediction not found");
            }
            UUID id = svc.feedback().insert(hazardId, user.id(), label, ApiServer.text(body, "notes"));
            ctx.json(om.createObjectNode()
                    .put("message", "Feedback submitted successfully")
                    .put("feedback_id", id.toString()));
        });

        app.get(ApiServer.API + "/feedback", ctx -> {
            User user = AuthGuard.requireUser(api, ctx);
            ArrayNode arr = om.createArrayNode();
            if (api.cfg().enableFeedback()) {
                int limit = ApiServer.parseInt(ctx.queryParam("limit"), 100, 1, 500);
                int offset = ApiServer.parseInt(ctx.queryParam("offset"), 0, 0, Integer.MAX_VALUE);
                for (Feedback f : svc.feedback().listForUser(user.id(), limit, offset)) {
                    ObjectNode row = arr.addObject();
                    row.put("id", f.id().toString());
                    row.put("hazard_id", f.hazardId().toString());
                    row.put("label", f.label());
                    row.put("notes", f.notes());
                    row.put("created_at", String.valueOf(f.createdAt()));
                }
            }
            ctx.json(arr);
        });
    }
}
