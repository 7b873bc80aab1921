/*
* Copyright 2025 Climate Risk Lens
* API Server for Climate Risk Lens, a geospatial service forecasting local climate hazards.
* utilizes Javalin for the HTTP server and exposes auth, risk, tile, asset, alert, feedback and admin endpoints.
* uses Jackson for JSON processing; every JSON body leaves the server ASCII-only.
*/

package com.climaterisklens.api;

import com.climaterisklens.cache.TtlCache;
import com.climaterisklens.config.AppConfig;
import com.climaterisklens.metrics.RequestMetrics;
import com.climaterisklens.util.AsciiSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);
    static final String API = "/api/v1";

    private final AppServices svc;
    private final AppConfig cfg;
    private final ObjectMapper om;
    private final ObjectWriter asciiWriter;
    private final RequestMetrics requestMetrics = new RequestMetrics(2000);
    private final RequestMetrics riskMetrics = new RequestMetrics(2000);
    private final TtlCache<CachedResponse> responseCache;
    private Javalin app;

    public ApiServer(AppServices svc) {
        this.svc = svc;
        this.cfg = svc.cfg();
        this.om = svc.om();
        this.asciiWriter = om.writer().with(JsonWriteFeature.ESCAPE_NON_ASCII);
        this.responseCache = new TtlCache<>("tiles", cfg.tileCacheTtlSeconds(), !cfg.debug());
    }

    /**
     * Builds the Javalin app with every route registered, without starting it.
     */
    public Javalin create() {
        List<String> origins = cfg.corsOrigins();
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> {
                if (origins.isEmpty() || origins.contains("*")) {
                    r.anyHost();
                } else {
                    for (String o : origins) {
                        r.allowHost(o);
                    }
                }
            }));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
            ctx.header("Access-Control-Max-Age", "600");
        });

        // JSON bodies go out ASCII-only; then log status and duration
        app.after(ctx -> {
            String ct = ctx.res().getContentType();
            if (ct != null && ct.startsWith("application/json")) {
                String body = ctx.result();
                if (body != null)
                    ctx.result(asciiBody(body));
            }
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            if (ms >= 0) {
                requestMetrics.record(ms);
                if (ctx.path().equals(API + "/risk/query"))
                    riskMetrics.record(ms);
            }
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        app.exception(ApiException.class, (e, ctx) -> {
            if (e.status() == 401)
                ctx.header("WWW-Authenticate", "Bearer");
            ctx.status(e.status()).json(error(e.code(), e.getMessage()));
        });

        // Helpful JSON error instead of default HTML-ish errors
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(error("internal_error",
                    e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        ApiRoutesRoot.register(this);
        ApiRoutesAuth.register(this);
        ApiRoutesRisk.register(this);
        ApiRoutesTiles.register(this);
        ApiRoutesAssets.register(this);
        ApiRoutesAlerts.register(this);
        ApiRoutesFeedback.register(this);
        ApiRoutesAdmin.register(this);
        return app;
    }

    public void start() {
        log.info("Starting API server on port {}", cfg.apiPort());
        create().start(cfg.apiPort());
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    Javalin app() {
        return app;
    }

    AppServices svc() {
        return svc;
    }

    AppConfig cfg() {
        return cfg;
    }

    ObjectMapper om() {
        return om;
    }

    RequestMetrics requestMetrics() {
        return requestMetrics;
    }

    RequestMetrics riskMetrics() {
        return riskMetrics;
    }

    TtlCache<CachedResponse> responseCache() {
        return responseCache;
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------
    record CachedResponse(String body, String etag, int maxAgeSeconds, int staleSeconds) {
    }

    /**
     * Answers from the response cache (or with 304 on a matching ETag). Returns
     * false on a miss.
     */
    boolean serveCached(Context ctx, String key) {
        CachedResponse cached = responseCache.get(key);
        if (cached == null) {
            return false;
        }

        String inm = ctx.header("If-None-Match");
        if (cached.etag().equals(inm)) {
            applyCacheHeaders(ctx, cached.maxAgeSeconds(), cached.staleSeconds());
            ctx.header("ETag", cached.etag());
            ctx.status(304);
            return true;
        }

        applyCacheHeaders(ctx, cached.maxAgeSeconds(), cached.staleSeconds());
        ctx.header("ETag", cached.etag());
        ctx.contentType("application/json");
        ctx.result(cached.body());
        return true;
    }

    void cacheAndRespond(Context ctx, String key, JsonNode node, int maxAgeSeconds, int staleSeconds)
            throws Exception {
        String body = asciiWriter.writeValueAsString(AsciiSanitizer.sanitizeTree(node));
        String etag = "\"" + Integer.toHexString(body.hashCode()) + "\"";
        responseCache.put(key, new CachedResponse(body, etag, maxAgeSeconds, staleSeconds));
        applyCacheHeaders(ctx, maxAgeSeconds, staleSeconds);
        ctx.header("ETag", etag);
        if (etag.equals(ctx.header("If-None-Match"))) {
            ctx.status(304);
            return;
        }
        ctx.contentType("application/json");
        ctx.result(body);
    }

    private void applyCacheHeaders(Context ctx, int maxAgeSeconds, int staleSeconds) {
        if (maxAgeSeconds <= 0) {
            return;
        }
        StringBuilder sb = new StringBuilder("public, max-age=").append(maxAgeSeconds);
        if (staleSeconds > 0) {
            sb.append(", stale-while-revalidate=").append(staleSeconds);
        }
        ctx.header("Cache-Control", sb.toString());
    }

    /**
     * Rewrites a JSON body so it contains only ASCII text, field names
     * included. Anything the sanitizer leaves behind is written as a JSON
     * unicode escape.
     */
    String asciiBody(String body) {
        if (AsciiSanitizer.isAsciiOnly(body))
            return body;
        try {
            return asciiWriter.writeValueAsString(AsciiSanitizer.sanitizeTree(om.readTree(body)));
        } catch (JsonProcessingException e) {
            log.warn("Response body is not valid JSON, stripping non-ASCII: {}", e.getOriginalMessage());
            StringBuilder sb = new StringBuilder(body.length());
            for (int i = 0; i < body.length(); i++) {
                char ch = body.charAt(i);
                if (ch < 128)
                    sb.append(ch);
            }
            return sb.toString();
        }
    }

    ObjectNode error(String code, String message) {
        return om.createObjectNode().put("error", code).put("message", message);
    }

    /**
     * Parses the request body as a JSON object, or fails with 400.
     */
    ObjectNode jsonBody(Context ctx) {
        JsonNode n;
        try {
            n = om.readTree(ctx.body());
        } catch (JsonProcessingException e) {
            throw ApiException.badRequest("invalid_json", "Request body must be valid JSON");
        }
        if (n instanceof ObjectNode o)
            return o;
        throw ApiException.badRequest("invalid_json", "Request body must be a JSON object");
    }

    /**
     * Sanitized text of a field, or null when absent/null/blank.
     */
    static String text(JsonNode body, String field) {
        JsonNode v = body.get(field);
        if (v == null || v.isNull())
            return null;
        String s = AsciiSanitizer.sanitizeText(v.asText());
        return s == null || s.isEmpty() ? null : s;
    }

    static double roundTo(double value, int places) {
        if (places < 0)
            return value;
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    /**
     * bbox=minLon,minLat,maxLon,maxLat; null when malformed, out of range or
     * inverted.
     */
    static double[] parseBbox(String bbox) {
        if (bbox == null || bbox.isBlank())
            return null;
        String[] parts = bbox.split(",");
        if (parts.length != 4)
            return null;
        double[] out = new double[4];
        try {
            for (int i = 0; i < 4; i++) {
                out[i] = Double.parseDouble(parts[i].trim());
            }
        } catch (NumberFormatException e) {
            return null;
        }
        if (!isLatLonValid(out[1], out[0]) || !isLatLonValid(out[3], out[2]))
            return null;
        if (out[0] > out[2] || out[1] > out[3])
            return null;
        return out;
    }

    static boolean isLatLonValid(Double lat, Double lon) {
        if (lat == null || lon == null)
            return false;
        return lat >= -90.0 && lat <= 90.0 && lon >= -180.0 && lon <= 180.0;
    }

    static Integer parseInt(String s, Integer def, int min, int max) {
        if (s == null || s.isBlank())
            return def;
        try {
            int v = Integer.parseInt(s.trim());
            if (v < min)
                v = min;
            if (v > max)
                v = max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    static UUID parseUuid(String s) {
        if (s == null || s.isBlank())
            return null;
        try {
            return UUID.fromString(s.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
