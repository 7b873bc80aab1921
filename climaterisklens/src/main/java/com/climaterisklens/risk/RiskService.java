package com.climaterisklens.risk;

import com.climaterisklens.cache.TtlCache;
import com.climaterisklens.db.HazardRepo;
import com.climaterisklens.db.HazardRepo.Prediction;
import com.climaterisklens.db.SiteRepo;
import com.climaterisklens.geo.GridSystem;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Answers point and site risk questions from the latest stored predictions,
 * synthesizing demo values when nothing is stored and demo mode is on.
 */
public class RiskService {
    private static final Logger log = LoggerFactory.getLogger(RiskService.class);

    public static final String DEMO_MODEL = "demo-model-v1";
    public static final List<String> SOURCES = List.of("NOAA", "USGS", "EPA AirNow", "NASA FIRMS");

    private final HazardRepo hazardRepo;
    private final GridSystem grid;
    private final TtlCache<ObjectNode> cache;
    private final ObjectMapper om;
    private final boolean demoMode;
    private final Random random;
    private final Clock clock;

    public RiskService(HazardRepo hazardRepo, GridSystem grid, TtlCache<ObjectNode> cache, ObjectMapper om,
            boolean demoMode, Random random, Clock clock) {
        this.hazardRepo = hazardRepo;
        this.grid = grid;
        this.cache = cache;
        this.om = om;
        this.demoMode = demoMode;
        this.random = random;
        this.clock = clock;
    }

    public GridSystem grid() {
        return grid;
    }

    /**
     * Risk answer for a point. Unknown hazard names are skipped; coordinates
     * and horizon are expected to be validated by the caller.
     */
    public ObjectNode query(double lat, double lon, List<String> hazards, int horizonHours) throws Exception {
        String gridId = grid.pointToGridId(lat, lon);
        String cacheKey = "risk:" + gridId + ":" + String.join(":", hazards) + ":" + horizonHours;
        ObjectNode cached = cache.get(cacheKey);
        if (cached != null) {
            log.debug("risk cache hit {}", cacheKey);
            return cached.deepCopy();
        }

        int horizonMinutes = horizonHours * 60;
        List<Prediction> found = new ArrayList<>();
        for (String name : hazards) {
            HazardType h = HazardType.fromKey(name);
            if (h == null)
                continue;
            Prediction p = latestOrDemo(h, gridId, horizonMinutes);
            if (p != null)
                found.add(p);
        }

        ObjectNode out = om.createObjectNode();
        out.put("grid_id", gridId);
        out.put("horizon", horizonHours);
        ArrayNode preds = out.putArray("predictions");
        for (Prediction p : found) {
            ObjectNode row = preds.addObject();
            row.put("hazard", p.type());
            row.put("p_risk", p.pRisk());
            putNullable(row, "q10", p.q10());
            putNullable(row, "q50", p.q50());
            putNullable(row, "q90", p.q90());
            row.put("model", p.modelVersion());
            row.put("updated_at", String.valueOf(p.issuedAt()));
        }

        Prediction top = highest(found);
        HazardType driverHazard = top == null ? HazardType.FLOOD : HazardType.fromKey(top.type());
        ArrayNode drivers = out.putArray("top_drivers");
        for (HazardType.Driver d : driverHazard.drivers()) {
            drivers.addObject().put("feature", d.feature()).put("contribution", d.contribution());
        }

        if (top == null)
            out.putNull("brief");
        else
            out.put("brief", brief(top.pRisk(), top.type()));
        ArrayNode sources = out.putArray("sources");
        SOURCES.forEach(sources::add);

        cache.put(cacheKey, out.deepCopy());
        return out;
    }

    /**
     * One entry per hazard for a site at now + horizon. Without demo mode,
     * hazards with no stored prediction are left out.
     */
    public ArrayNode siteRisk(SiteRepo.Site site, int horizonHours) throws Exception {
        ArrayNode out = om.createArrayNode();
        String time = clock.instant().plus(horizonHours, ChronoUnit.HOURS).toString();
        for (HazardType h : HazardType.values()) {
            Prediction p = hazardRepo.latest(h.key(), site.gridId(), horizonHours * 60);
            String brief;
            if (p != null) {
                brief = brief(p.pRisk(), h.key());
            } else if (demoMode) {
                p = demoPrediction(h, site.gridId(), horizonHours * 60);
                brief = "Demo risk assessment for " + h.key() + " at " + site.name();
            } else {
                continue;
            }
            ObjectNode row = out.addObject();
            row.put("site_id", site.id().toString());
            row.put("time", time);
            row.put("hazard", h.key());
            row.put("p_risk", p.pRisk());
            putNullable(row, "q10", p.q10());
            putNullable(row, "q50", p.q50());
            putNullable(row, "q90", p.q90());
            row.put("brief", brief);
        }
        return out;
    }

    /**
     * GeoJSON polygons of the latest prediction per cell inside a bbox. The
     * caller bounds the cell count.
     */
    public ObjectNode gridFeatures(double[] bbox, HazardType hazard) throws Exception {
        List<String> cells = grid.gridsForBounds(bbox[0], bbox[1], bbox[2], bbox[3]);
        ObjectNode fc = om.createObjectNode();
        fc.put("type", "FeatureCollection");
        ArrayNode features = fc.putArray("features");
        for (Prediction p : hazardRepo.latestPerGrid(hazard.key(), cells)) {
            ObjectNode f = features.addObject();
            f.put("type", "Feature");
            ObjectNode geom = f.putObject("geometry");
            geom.put("type", "Polygon");
            ArrayNode ring = geom.putArray("coordinates").addArray();
            for (double[] pt : grid.gridRing(p.gridId())) {
                ring.addArray().add(pt[0]).add(pt[1]);
            }
            ObjectNode props = f.putObject("properties");
            props.put("grid_id", p.gridId());
            props.put("hazard_type", p.type());
            props.put("p_risk", p.pRisk());
            putNullable(props, "q10", p.q10());
            putNullable(props, "q50", p.q50());
            putNullable(props, "q90", p.q90());
            props.put("model_version", p.modelVersion());
            props.put("issued_at", String.valueOf(p.issuedAt()));
        }
        return fc;
    }

    private Prediction latestOrDemo(HazardType h, String gridId, int horizonMinutes) throws Exception {
        Prediction p = hazardRepo.latest(h.key(), gridId, horizonMinutes);
        if (p == null && demoMode)
            return demoPrediction(h, gridId, horizonMinutes);
        return p;
    }

    private Prediction demoPrediction(HazardType h, String gridId, int horizonMinutes) {
        Instant now = clock.instant();
        return new Prediction(null, h.key(), now, horizonMinutes, gridId,
                uniform(0.1, 0.8), uniform(0.05, 0.3), uniform(0.2, 0.6), uniform(0.4, 0.9), DEMO_MODEL, now);
    }

    private double uniform(double lo, double hi) {
        return lo + (hi - lo) * random.nextDouble();
    }

    private static Prediction highest(List<Prediction> preds) {
        Prediction top = null;
        for (Prediction p : preds) {
            if (top == null || p.pRisk() > top.pRisk())
                top = p;
        }
        return top;
    }

    /**
     * Plain-language summary for the highest risk and its hazard.
     */
    public static String brief(double maxRisk, String hazard) {
        String pct = String.format(Locale.ROOT, "%.1f%%", maxRisk * 100.0);
        if (maxRisk > 0.5) {
            return "High risk conditions detected. Primary concern: " + hazard + " with " + pct
                    + " probability. Monitor conditions closely.";
        }
        if (maxRisk > 0.3) {
            return "Moderate risk conditions present. Main hazard: " + hazard + " with " + pct
                    + " probability. Stay informed.";
        }
        return "Low risk conditions. All hazards below 30% probability. Normal operations recommended.";
    }

    private static void putNullable(ObjectNode obj, String key, Double value) {
        if (value == null)
            obj.putNull(key);
        else
            obj.put(key, value);
    }
}
