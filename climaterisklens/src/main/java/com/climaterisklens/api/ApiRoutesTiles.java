package com.climaterisklens.api;

import com.climaterisklens.geo.TileCoord;
import com.climaterisklens.risk.HazardType;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;

/**
 * Risk and uncertainty tiles as GeoJSON, with ETag and Cache-Control.
 */
final class ApiRoutesTiles {
    private ApiRoutesTiles() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        AppServices svc = api.svc();
        int maxAge = Math.max(60, api.cfg().tileCacheTtlSeconds());

        app.get(ApiServer.API + "/tiles/{z}/{x}/{y}", ctx -> {
            AuthGuard.requireUser(api, ctx);
            String yRaw = ctx.pathParam("y");
            if (yRaw.endsWith(".json"))
                yRaw = yRaw.substring(0, yRaw.length() - 5);
            TileCoord coord;
            try {
                coord = new TileCoord(Integer.parseInt(ctx.pathParam("z")), Integer.parseInt(ctx.pathParam("x")),
                        Integer.parseInt(yRaw));
            } catch (NumberFormatException e) {
                throw ApiException.badRequest("invalid_tile", "z, x and y must be integers");
            }
            if (!coord.isValid()) {
                throw ApiException.badRequest("invalid_tile", "Tile " + coord.path() + " is out of range");
            }

            String hazardParam = ctx.queryParam("hazard");
            HazardType hazard = null;
            if (hazardParam != null && !hazardParam.isBlank()) {
                hazard = HazardType.fromKey(hazardParam);
                if (hazard == null)
                    throw ApiException.badRequest("invalid_hazard", "Unknown hazard: " + hazardParam);
            }
            String layer = ctx.queryParam("layer") == null ? "risk" : ctx.queryParam("layer");
            if (!layer.equals("risk") && !layer.equals("uncertainty")) {
                throw ApiException.badRequest("invalid_layer", "layer must be risk or uncertainty");
            }

            String cacheKey = "tile:" + coord.path() + ":" + (hazard == null ? "all" : hazard.key()) + ":" + layer;
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }
            ObjectNode tile = svc.tiles().tile(coord, hazard, layer);
            api.cacheAndRespond(ctx, cacheKey, tile, maxAge, maxAge);
        });
    }
}
