package com.climaterisklens.geo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.List;

/**
 * Builds GeoJSON tiles (risk and uncertainty layers) from prediction points.
 * Only points inside the tile bounds (edges inclusive) are emitted.
 */
public final class VectorTileBuilder {
    static final double CONFIDENCE_INTERVAL = 0.8;

    private final ObjectMapper om;

    public VectorTileBuilder(ObjectMapper om) {
        this.om = om;
    }

    public ObjectNode buildRiskTile(TileCoord coord, List<RiskPoint> points) {
        double[] b = TileSystem.bounds(coord);
        ObjectNode fc = featureCollection();
        ArrayNode features = (ArrayNode) fc.get("features");
        for (RiskPoint p : points) {
            if (!inside(b, p))
                continue;
            ObjectNode props = pointFeature(features, p);
            props.put("grid_id", p.gridId());
            props.put("hazard_type", p.hazardType());
            props.put("p_risk", p.pRisk());
            props.put("q10", orZero(p.q10()));
            props.put("q50", orZero(p.q50()));
            props.put("q90", orZero(p.q90()));
            props.put("model_version", p.modelVersion());
            props.put("issued_at", p.issuedAt() == null ? "" : p.issuedAt().toString());
        }
        return fc;
    }

    public ObjectNode buildUncertaintyTile(TileCoord coord, List<RiskPoint> points) {
        double[] b = TileSystem.bounds(coord);
        ObjectNode fc = featureCollection();
        ArrayNode features = (ArrayNode) fc.get("features");
        for (RiskPoint p : points) {
            if (!inside(b, p))
                continue;
            ObjectNode props = pointFeature(features, p);
            props.put("grid_id", p.gridId());
            props.put("hazard_type", p.hazardType());
            props.put("uncertainty", p.uncertainty());
            props.put("confidence_interval", CONFIDENCE_INTERVAL);
            props.put("model_version", p.modelVersion());
        }
        return fc;
    }

    private ObjectNode featureCollection() {
        ObjectNode fc = om.createObjectNode();
        fc.put("type", "FeatureCollection");
        fc.set("features", om.createArrayNode());
        return fc;
    }

    private ObjectNode pointFeature(ArrayNode features, RiskPoint p) {
        ObjectNode f = features.addObject();
        f.put("type", "Feature");
        ObjectNode geom = f.putObject("geometry");
        geom.put("type", "Point");
        geom.putArray("coordinates").add(p.lon()).add(p.lat());
        return f.putObject("properties");
    }

    private static boolean inside(double[] b, RiskPoint p) {
        return p.lon() >= b[0] && p.lon() <= b[2] && p.lat() >= b[1] && p.lat() <= b[3];
    }

    private static double orZero(Double v) {
        return v == null ? 0.0 : v;
    }

    /**
     * A prediction placed at its grid cell center.
     */
    public record RiskPoint(String gridId, String hazardType, double lat, double lon, double pRisk, Double q10,
            Double q50, Double q90, String modelVersion, Instant issuedAt) {

        /**
         * Width of the 10-90 quantile band, 0 when either bound is missing.
         */
        public double uncertainty() {
            if (q10 == null || q90 == null)
                return 0.0;
            return q90 - q10;
        }
    }
}
