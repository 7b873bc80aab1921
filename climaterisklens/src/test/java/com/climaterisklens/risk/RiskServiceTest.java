package com.climaterisklens.risk;

import com.climaterisklens.cache.TtlCache;
import com.climaterisklens.db.HazardRepo;
import com.climaterisklens.db.HazardRepo.Prediction;
import com.climaterisklens.db.SiteRepo.Site;
import com.climaterisklens.geo.GridSystem;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RiskServiceTest {
    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
    private static final double LAT = 37.7749;
    private static final double LON = -122.4194;

    @Mock
    HazardRepo hazards;

    private final ObjectMapper om = new ObjectMapper();
    private final GridSystem grid = new GridSystem(1.0);
    private final String gridId = grid.pointToGridId(LAT, LON);
    private TtlCache<ObjectNode> cache;

    @BeforeEach
    void setUp() {
        cache = new TtlCache<>("risk", 900, true);
    }

    private RiskService service(boolean demo) {
        return new RiskService(hazards, grid, cache, om, demo, new Random(7), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Prediction stored(String type, double p) {
        return new Prediction(UUID.randomUUID(), type, NOW.minusSeconds(600), 1440, gridId, p, 0.1, 0.4, 0.8,
                "flood-head-v2", NOW);
    }

    @Test
    void storedPredictionsAnswerTheQuery() throws Exception {
        when(hazards.latest("flood", gridId, 1440)).thenReturn(stored("flood", 0.62));
        when(hazards.latest("heat", gridId, 1440)).thenReturn(stored("heat", 0.2));

        ObjectNode out = service(false).query(LAT, LON, List.of("flood", "heat"), 24);

        assertThat(out.get("grid_id").asText(), is(gridId));
        assertThat(out.get("horizon").asInt(), is(24));
        assertThat(out.get("predictions").size(), is(2));
        JsonNode first = out.get("predictions").get(0);
        assertThat(first.get("hazard").asText(), is("flood"));
        assertThat(first.get("p_risk").asDouble(), is(0.62));
        assertThat(first.get("model").asText(), is("flood-head-v2"));
        assertThat(out.get("top_drivers").get(0).get("feature").asText(), is("precipitation_24h"));
        assertThat(out.get("brief").asText(), containsString("High risk conditions detected"));
        assertThat(out.get("brief").asText(), containsString("62.0%"));
        assertThat(out.get("sources").size(), is(4));
    }

    @Test
    void emptyAnswerWithoutDemoMode() throws Exception {
        ObjectNode out = service(false).query(LAT, LON, List.of("smoke"), 6);
        assertThat(out.get("predictions").size(), is(0));
        assertThat(out.get("brief").isNull(), is(true));
        assertThat(out.get("top_drivers").get(0).get("feature").asText(), is("precipitation_24h"));
    }

    @Test
    void demoModeSynthesizesBoundedValues() throws Exception {
        ObjectNode out = service(true).query(LAT, LON, List.of("pm25", "bogus"), 12);

        assertThat(out.get("predictions").size(), is(1));
        JsonNode row = out.get("predictions").get(0);
        assertThat(row.get("model").asText(), is(RiskService.DEMO_MODEL));
        assertThat(row.get("p_risk").asDouble(), is(allOf(greaterThanOrEqualTo(0.1), lessThanOrEqualTo(0.8))));
        assertThat(row.get("updated_at").asText(), is(NOW.toString()));
    }

    @Test
    void repeatedQueryIsCached() throws Exception {
        when(hazards.latest(anyString(), anyString(), anyInt())).thenReturn(stored("heat", 0.35));
        RiskService risk = service(false);

        ObjectNode a = risk.query(LAT, LON, List.of("heat"), 24);
        a.put("grid_id", "mutated");
        ObjectNode b = risk.query(LAT, LON, List.of("heat"), 24);

        verify(hazards, times(1)).latest(anyString(), anyString(), anyInt());
        assertThat(b.get("grid_id").asText(), is(gridId));
        assertThat(b.get("brief").asText(), containsString("Moderate risk"));
    }

    @Test
    void siteRiskCoversEveryHazardInDemoMode() throws Exception {
        when(hazards.latest(eq("flood"), eq(gridId), anyInt())).thenReturn(stored("flood", 0.25));
        Site site = new Site(UUID.randomUUID(), UUID.randomUUID(), "Depot", LAT, LON, gridId, "{}", true,
                NOW.toString());

        ArrayNode rows = service(true).siteRisk(site, 48);

        assertThat(rows.size(), is(HazardType.values().length));
        assertThat(rows.get(0).get("hazard").asText(), is("flood"));
        assertThat(rows.get(0).get("p_risk").asDouble(), is(0.25));
        assertThat(rows.get(0).get("time").asText(), is(NOW.plusSeconds(48 * 3600).toString()));
        assertThat(rows.get(0).get("brief").asText(), containsString("Low risk"));
        assertThat(rows.get(1).get("brief").asText(), is("Demo risk assessment for heat at Depot"));
    }

    @Test
    void gridFeaturesArePolygons() throws Exception {
        when(hazards.latestPerGrid(eq("flood"), anyList())).thenReturn(List.of(stored("flood", 0.5)));

        ObjectNode fc = service(false).gridFeatures(new double[] { -122.43, 37.77, -122.41, 37.78 },
                HazardType.FLOOD);

        assertThat(fc.get("features").size(), is(1));
        JsonNode f = fc.get("features").get(0);
        assertThat(f.get("geometry").get("type").asText(), is("Polygon"));
        assertThat(f.get("geometry").get("coordinates").get(0).size(), is(5));
        assertThat(f.get("properties").get("grid_id").asText(), is(gridId));
    }

    @Test
    void briefBands() {
        assertThat(RiskService.brief(0.51, "heat"), containsString("Primary concern: heat with 51.0%"));
        assertThat(RiskService.brief(0.5, "heat"), containsString("Moderate"));
        assertThat(RiskService.brief(0.3, "heat"), containsString("Low risk"));
        assertThat(HazardType.fromKey(" PM25 "), is(HazardType.PM25));
    }
}
