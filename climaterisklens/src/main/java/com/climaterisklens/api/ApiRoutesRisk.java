package com.climaterisklens.api;

import com.climaterisklens.geo.Geocoder;
import com.climaterisklens.geo.GridSystem;
import com.climaterisklens.risk.HazardType;
import com.climaterisklens.util.AsciiSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Point risk queries, the demo geocoder and per-cell GeoJSON. Every route
 * needs a signed-in user.
 */
final class ApiRoutesRisk {
    static final int MAX_GRID_CELLS = 2500;

    private ApiRoutesRisk() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        AppServices svc = api.svc();

        app.post(ApiServer.API + "/risk/query", ctx -> {
            AuthGuard.requireUser(api, ctx);
            ObjectNode body = api.jsonBody(ctx);
            JsonNode latNode = body.get("lat");
            JsonNode lonNode = body.get("lon");
            if (latNode == null || !latNode.isNumber() || lonNode == null || !lonNode.isNumber()) {
                throw ApiException.badRequest("invalid_request", "lat and lon are required numbers");
            }
            double lat = latNode.asDouble();
            double lon = lonNode.asDouble();
            if (!ApiServer.isLatLonValid(lat, lon)) {
                throw ApiException.badRequest("invalid_request", "lat must be in [-90, 90] and lon in [-180, 180]");
            }

            int horizon = 24;
            JsonNode h = body.get("horizon_hours");
            if (h != null && !h.isNull()) {
                if (!h.canConvertToInt() || !h.isIntegralNumber() || h.asInt() < 1 || h.asInt() > 72) {
                    throw ApiException.badRequest("invalid_request", "horizon_hours must be between 1 and 72");
                }
                horizon = h.asInt();
            }

            List<String> hazards = new ArrayList<>();
            JsonNode hz = body.get("hazards");
            if (hz == null || hz.isNull()) {
                for (HazardType t : HazardType.values()) {
                    hazards.add(t.key());
                }
            } else if (hz.isArray()) {
                for (JsonNode n : hz) {
                    String s = AsciiSanitizer.sanitizeText(n.asText());
                    if (s != null && !s.isEmpty())
                        hazards.add(s.toLowerCase(Locale.ROOT));
                }
            } else {
                throw ApiException.badRequest("invalid_request", "hazards must be a list");
            }

            ctx.json(svc.risk().query(lat, lon, hazards, horizon));
        });

        app.get(ApiServer.API + "/risk/geocode", ctx -> {
            AuthGuard.requireUser(api, ctx);
            String query = AsciiSanitizer.sanitizeText(ctx.queryParam("query"));
            if (query == null || query.isEmpty()) {
                throw ApiException.badRequest("invalid_request", "query is required");
            }
            Geocoder.Place place = svc.geocoder().geocode(query);
            ObjectNode out = om.createObjectNode();
            out.put("query", query);
            out.putObject("point").put("lat", place.lat()).put("lon", place.lon());
            ArrayNode admin = out.putArray("admin_areas");
            place.adminAreas().forEach(admin::add);
            ctx.json(out);
        });

        app.get(ApiServer.API + "/risk/grid", ctx -> {
            AuthGuard.requireUser(api, ctx);
            double[] bbox = ApiServer.parseBbox(ctx.queryParam("bbox"));
            if (bbox == null) {
                throw ApiException.badRequest("invalid_bbox", "bbox must be minLon,minLat,maxLon,maxLat");
            }
            String hazardParam = ctx.queryParam("hazard");
            HazardType hazard = hazardParam == null || hazardParam.isBlank() ? HazardType.FLOOD
                    : HazardType.fromKey(AsciiSanitizer.sanitizeText(hazardParam));
            if (hazard == null) {
                throw ApiException.badRequest("invalid_hazard", "Unknown hazard: " + hazardParam);
            }
            GridSystem grid = svc.risk().grid();
            long cells = grid.countForBounds(bbox[0], bbox[1], bbox[2], bbox[3]);
            if (cells > MAX_GRID_CELLS) {
                throw ApiException.badRequest("bbox_too_large",
                        "bbox covers " + cells + " cells; the limit is " + MAX_GRID_CELLS);
            }
            ctx.json(svc.risk().gridFeatures(bbox, hazard));
        });
    }
}
