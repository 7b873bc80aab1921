package com.climaterisklens.api;

import com.climaterisklens.cache.TtlCache;
import com.climaterisklens.db.ExperimentRepo.Experiment;
import com.climaterisklens.db.JobRunRepo.JobRun;
import com.climaterisklens.db.UserRepo.User;
import com.climaterisklens.metrics.ExternalApiMetrics;
import com.climaterisklens.metrics.RequestMetrics;
import com.climaterisklens.risk.HazardType;
import com.climaterisklens.util.AsciiSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Admin-only operations: background rebuilds, metrics, experiments, org and
 * user management.
 */
final class ApiRoutesAdmin {
    private static final Logger log = LoggerFactory.getLogger(ApiRoutesAdmin.class);
    static final Set<String> VARIANTS = Set.of("A", "B", "control");
    static final Set<String> ROLES = Set.of("anon", "org_user", "analyst", "admin");

    private ApiRoutesAdmin() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        AppServices svc = api.svc();
        String base = ApiServer.API + "/admin";

        app.post(base + "/reindex_tiles", ctx -> {
            AuthGuard.requireAdmin(api, ctx);
            Runnable trigger = svc.tileRebuildTrigger();
            if (trigger == null) {
                throw new ApiException(503, "reindex_not_available", "Tile reindexing is not available");
            }

            new Thread(() -> {
                try {
                    trigger.run();
                } catch (Exception e) {
                    log.warn("Manual tile reindex failed: {}", e.getMessage());
                }
            }, "api-tile-reindex").start();

            ctx.json(om.createObjectNode()
                    .put("message", "Tile reindexing started")
                    .put("status", "success"));
        });

        app.post(base + "/retrain", ctx -> {
            AuthGuard.requireAdmin(api, ctx);
            String hazardParam = ctx.queryParam("hazard");
            List<HazardType> hazards = new ArrayList<>();
            if (hazardParam == null || hazardParam.isBlank() || hazardParam.equalsIgnoreCase("all")) {
                hazards.addAll(List.of(HazardType.values()));
            } else {
                HazardType h = HazardType.fromKey(hazardParam);
                if (h == null) {
                    throw ApiException.badRequest("invalid_hazard", "Unknown hazard: " + hazardParam);
                }
                hazards.add(h);
            }
            Consumer<HazardType> trigger = svc.retrainTrigger();
            if (trigger == null) {
                throw new ApiException(503, "retrain_not_available", "Retraining is not available");
            }

            new Thread(() -> {
                for (HazardType h : hazards) {
                    try {
                        trigger.accept(h);
                    } catch (Exception e) {
                        log.warn("Retraining {} failed: {}", h.key(), e.getMessage());
                    }
                }
            }, "api-retrain").start();

            String what = hazards.size() == 1 ? hazards.get(0).key() : "all hazards";
            ctx.json(om.createObjectNode()
                    .put("message", "Model retraining started for " + what)
                    .put("status", "success"));
        });

        app.get(base + "/metrics", ctx -> {
            AuthGuard.requireAdmin(api, ctx);
            ObjectNode out = om.createObjectNode();
            out.put("timestamp", Instant.now().toString());

            ObjectNode db = out.putObject("database");
            for (Map.Entry<String, Long> e : svc.stats().tableCounts().entrySet()) {
                db.put(e.getKey(), e.getValue());
            }

            ObjectNode latency = out.putObject("latency");
            latency(latency.putObject("api_requests"), api.requestMetrics());
            latency(latency.putObject("risk_queries"), api.riskMetrics());

            ObjectNode cache = out.putObject("cache");
            List<TtlCache<?>> caches = new ArrayList<>(svc.caches());
            caches.add(api.responseCache());
            for (TtlCache<?> c : caches) {
                cache.put(c.name() + "_hit_ratio", ApiServer.roundTo(c.hitRatio(), 4));
            }

            ArrayNode jobs = out.putArray("jobs");
            for (JobRun r : svc.jobRuns().latestPerJob()) {
                ObjectNode row = jobs.addObject();
                row.put("job_name", r.jobName());
                row.put("run_id", r.runId().toString());
                row.put("status", r.status());
                row.put("started_at", String.valueOf(r.startedAt()));
                row.put("finished_at", r.finishedAt() == null ? null : r.finishedAt().toString());
                row.put("notes", r.notes());
            }

            ObjectNode external = out.putObject("external");
            external.put("window_minutes", ExternalApiMetrics.windowMinutes());
            ArrayNode services = external.putArray("services");
            for (var e : ExternalApiMetrics.snapshot().entrySet()) {
                var snap = e.getValue();
                ObjectNode row = services.addObject();
                row.put("service", e.getKey());
                row.put("calls_last_hour", snap.calls());
                row.put("failures_last_hour", snap.failures());
                row.put("failure_pct", snap.failurePct());
                row.put("status", snap.status());
            }

            ObjectNode freshness = out.putObject("data_freshness");
            for (Map.Entry<String, Instant> e : svc.telemetry().latestPerSource().entrySet()) {
                freshness.put(e.getKey(), String.valueOf(e.getValue()));
            }

            ctx.json(out);
        });

        app.get(base + "/experiments", ctx -> {
            AuthGuard.requireAdmin(api, ctx);
            ArrayNode arr = om.createArrayNode();
            for (Experiment e : svc.experiments().list()) {
                ObjectNode row = arr.addObject();
                row.put("exp_id", e.id().toString());
                row.put("name", e.name());
                row.put("variant", e.variant());
                row.put("start_at", String.valueOf(e.startAt()));
                row.put("stop_at", e.stopAt() == null ? null : e.stopAt().toString());
                row.set("config", e.configJson() == null ? om.createObjectNode() : om.readTree(e.configJson()));
                row.put("is_active", e.active());
            }
            ctx.json(arr);
        });

        app.post(base + "/experiments/start", ctx -> {
            AuthGuard.requireAdmin(api, ctx);
            ObjectNode body = api.jsonBody(ctx);
            String name = ApiServer.text(body, "name");
            if (name == null) {
                throw ApiException.badRequest("invalid_request", "name is required");
            }
            String variant = ApiServer.text(body, "variant");
            if (variant == null || !VARIANTS.contains(variant)) {
                throw ApiException.badRequest("invalid_variant", "variant must be A, B or control");
            }
            JsonNode config = body.get("variant_config");
            String configJson = config == null || config.isNull() ? "{}"
                    : om.writeValueAsString(AsciiSanitizer.sanitizeTree(config));
            UUID id = svc.experiments().start(name, variant, configJson);
            ctx.json(om.createObjectNode()
                    .put("message", "Experiment started successfully")
                    .put("experiment_id", id.toString())
                    .put("status", "active"));
        });

        app.post(base + "/experiments/stop", ctx -> {
            AuthGuard.requireAdmin(api, ctx);
            UUID id = ApiServer.parseUuid(ctx.queryParam("exp_id"));
            if (id == null) {
                throw ApiException.badRequest("invalid_request", "exp_id must be a UUID");
            }
            if (!svc.experiments().stop(id)) {
                throw ApiException.notFound("Active experiment " + id + " not found");
            }
            ctx.json(om.createObjectNode()
                    .put("message", "Experiment " + id + " stopped successfully")
                    .put("status", "stopped"));
        });

        app.post(base + "/organizations", ctx -> {
            AuthGuard.requireAdmin(api, ctx);
            String name = ApiServer.text(api.jsonBody(ctx), "name");
            if (name == null) {
                throw ApiException.badRequest("invalid_request", "name is required");
            }
            UUID id = svc.orgs().create(name, null);
            ctx.json(om.createObjectNode().put("id", id.toString()).put("name", name));
        });

        app.put(base + "/users/{user_id}", ctx -> {
            AuthGuard.requireAdmin(api, ctx);
            UUID userId = ApiServer.parseUuid(ctx.pathParam("user_id"));
            if (userId == null) {
                throw ApiException.notFound("User not found");
            }
            ObjectNode body = api.jsonBody(ctx);

            String role = ApiServer.text(body, "role");
            if (role != null) {
                role = role.toLowerCase(Locale.ROOT);
                if (!ROLES.contains(role))
                    throw ApiException.badRequest("invalid_role", "role must be one of " + ROLES);
            }
            UUID orgId = null;
            String orgRaw = ApiServer.text(body, "org_id");
            if (orgRaw != null) {
                orgId = ApiServer.parseUuid(orgRaw);
                if (orgId == null)
                    throw ApiException.badRequest("invalid_request", "org_id must be a UUID");
                if (!svc.orgs().exists(orgId))
                    throw ApiException.notFound("Organization not found");
            }
            JsonNode activeNode = body.get("is_active");
            Boolean active = null;
            if (activeNode != null && !activeNode.isNull()) {
                if (!activeNode.isBoolean())
                    throw ApiException.badRequest("invalid_request", "is_active must be a boolean");
                active = activeNode.asBoolean();
            }

            User updated = svc.users().update(userId, role, orgId, active);
            if (updated == null) {
                throw ApiException.notFound("User not found");
            }
            ObjectNode out = om.createObjectNode();
            out.put("id", updated.id().toString());
            out.put("email", updated.email());
            out.put("role", updated.role());
            out.put("org_id", updated.orgId() == null ? null : updated.orgId().toString());
            out.put("is_active", updated.active());
            out.put("is_verified", updated.verified());
            ctx.json(out);
        });
    }

    private static void latency(ObjectNode node, RequestMetrics m) {
        node.put("count", m.count());
        node.put("p50_ms", m.percentile(50));
        node.put("p95_ms", m.percentile(95));
    }
}
