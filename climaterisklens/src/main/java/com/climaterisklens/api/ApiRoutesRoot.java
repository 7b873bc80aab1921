package com.climaterisklens.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;

import java.time.Instant;

/**
 * Root and health endpoints for the API.
 */
final class ApiRoutesRoot {
    static final String VERSION = "0.1.0";

    private ApiRoutesRoot() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("message", "Climate Risk Lens API");
            out.put("version", VERSION);
            out.put("status", "operational");
            out.put("ascii_only", true);
            ArrayNode endpoints = out.putArray("endpoints");
            for (String e : new String[] {
                    "GET /api/v1/healthz",
                    "GET /api/v1/readyz",
                    "POST /api/v1/auth/request_otp",
                    "POST /api/v1/auth/verify_otp",
                    "GET /api/v1/auth/me",
                    "POST /api/v1/risk/query",
                    "GET /api/v1/risk/geocode?query=seattle",
                    "GET /api/v1/risk/grid?bbox=-122.5,37.7,-122.4,37.8&hazard=flood",
                    "GET /api/v1/tiles/{z}/{x}/{y}.json?layer=risk",
                    "POST /api/v1/assets/upload",
                    "GET /api/v1/assets",
                    "GET /api/v1/assets/{site_id}/risk",
                    "POST /api/v1/alerts/subscribe",
                    "GET /api/v1/alerts",
                    "POST /api/v1/feedback",
                    "GET /api/v1/admin/metrics"
            }) {
                endpoints.add(e);
            }
            ctx.json(out);
        });

        app.get(ApiServer.API + "/healthz", ctx -> ctx.json(om.createObjectNode()
                .put("status", "healthy")
                .put("timestamp", Instant.now().toString())
                .put("version", VERSION)));

        app.get(ApiServer.API + "/readyz", ctx -> {
            boolean db = api.svc().stats().ping();
            ObjectNode out = om.createObjectNode();
            out.put("status", db ? "ready" : "not_ready");
            out.put("timestamp", Instant.now().toString());
            out.putObject("checks").put("database", db ? "healthy" : "unhealthy");
            if (!db)
                ctx.status(503);
            ctx.json(out);
        });
    }
}
