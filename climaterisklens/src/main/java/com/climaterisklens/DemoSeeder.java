package com.climaterisklens;

import com.climaterisklens.config.AppConfig;
import com.climaterisklens.db.Database;
import com.climaterisklens.db.HazardRepo;
import com.climaterisklens.db.HazardRepo.Prediction;
import com.climaterisklens.db.OrganizationRepo;
import com.climaterisklens.db.SiteRepo;
import com.climaterisklens.db.SiteRepo.NewSite;
import com.climaterisklens.db.TelemetryRepo;
import com.climaterisklens.db.UserRepo;
import com.climaterisklens.geo.GridSystem;
import com.climaterisklens.jobs.InferenceJob;
import com.climaterisklens.risk.HazardType;
import com.climaterisklens.risk.RiskService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Loads a demo organization, admin user, San Francisco sites, predictions and
 * telemetry so the API has something to show.
 */
public final class DemoSeeder {
    private static final Logger log = LoggerFactory.getLogger(DemoSeeder.class);

    static final String ORG_NAME = "Demo Organization";
    static final String ORG_API_KEY = "demo_api_key_123";
    static final String ADMIN_EMAIL = "demo@climaterisklens.com";
    static final int TELEMETRY_PER_SOURCE = 10;
    static final List<NewSiteSpec> SITES = List.of(
            new NewSiteSpec("Downtown SF", 37.7749, -122.4194),
            new NewSiteSpec("Golden Gate Park", 37.7694, -122.4862),
            new NewSiteSpec("Mission District", 37.7599, -122.4148),
            new NewSiteSpec("SOMA", 37.7785, -122.4056),
            new NewSiteSpec("Marina District", 37.8024, -122.4358));

    private final OrganizationRepo orgRepo;
    private final UserRepo userRepo;
    private final SiteRepo siteRepo;
    private final HazardRepo hazardRepo;
    private final TelemetryRepo telemetryRepo;
    private final GridSystem grid;
    private final ObjectMapper om;
    private final Random rnd;
    private final Clock clock;

    public DemoSeeder(OrganizationRepo orgRepo, UserRepo userRepo, SiteRepo siteRepo, HazardRepo hazardRepo,
            TelemetryRepo telemetryRepo, GridSystem grid, ObjectMapper om, Random rnd, Clock clock) {
        this.orgRepo = orgRepo;
        this.userRepo = userRepo;
        this.siteRepo = siteRepo;
        this.hazardRepo = hazardRepo;
        this.telemetryRepo = telemetryRepo;
        this.grid = grid;
        this.om = om;
        this.rnd = rnd;
        this.clock = clock;
    }

    public static void main(String[] args) throws Exception {
        AppConfig cfg = AppConfig.load();
        ObjectMapper om = new ObjectMapper();
        HikariDataSource ds = Database.createJobsDataSource(cfg);
        try {
            Database.ensureExtensions(ds);
            OrganizationRepo orgRepo = new OrganizationRepo(ds);
            UserRepo userRepo = new UserRepo(ds);
            SiteRepo siteRepo = new SiteRepo(ds);
            HazardRepo hazardRepo = new HazardRepo(ds);
            TelemetryRepo telemetryRepo = new TelemetryRepo(ds);
            Summary s = new DemoSeeder(orgRepo, userRepo, siteRepo, hazardRepo, telemetryRepo,
                    new GridSystem(cfg.gridSizeKm()), om, new Random(), Clock.systemUTC()).seed();
            log.info("Demo data seeded: org={} user={} sites={} predictions={} telemetry={}", s.orgId(),
                    ADMIN_EMAIL, s.sites(), s.predictions(), s.telemetry());
        } finally {
            ds.close();
        }
    }

    public Summary seed() throws Exception {
        UUID orgId = orgRepo.create(ORG_NAME, ORG_API_KEY);
        userRepo.upsertWithRole(ADMIN_EMAIL, "admin", orgId);

        List<NewSite> sites = new ArrayList<>();
        Set<String> gridIds = new LinkedHashSet<>();
        for (NewSiteSpec s : SITES) {
            String gridId = grid.pointToGridId(s.lat(), s.lon());
            sites.add(new NewSite(s.name(), s.lat(), s.lon(), gridId));
            gridIds.add(gridId);
        }
        ObjectNode meta = om.createObjectNode().put("demo", true).put("city", "San Francisco");
        List<UUID> siteIds = siteRepo.insertAll(orgId, sites, om.writeValueAsString(meta));

        Instant now = clock.instant();
        List<Prediction> preds = new ArrayList<>();
        for (String gridId : gridIds) {
            for (HazardType h : HazardType.values()) {
                for (int hours : InferenceJob.HORIZONS_HOURS) {
                    preds.add(new Prediction(null, h.key(), now, hours * 60, gridId, uniform(0.1, 0.8),
                            uniform(0.05, 0.3), uniform(0.2, 0.6), uniform(0.4, 0.9), RiskService.DEMO_MODEL,
                            now.minus(Duration.ofMinutes(15))));
                }
            }
        }
        int predictions = hazardRepo.insertAll(preds);

        int telemetry = 0;
        for (String source : RiskService.SOURCES) {
            for (int i = 0; i < TELEMETRY_PER_SOURCE; i++) {
                ObjectNode payload = om.createObjectNode()
                        .put("temperature", uniform(15, 25))
                        .put("humidity", uniform(0.4, 0.8))
                        .put("pressure", uniform(1010, 1020))
                        .put("demo", true);
                telemetryRepo.insert(source, now.minus(Duration.ofMinutes(5L * i)), 37.7749 + uniform(-0.1, 0.1),
                        -122.4194 + uniform(-0.1, 0.1), om.writeValueAsString(payload), 100 + rnd.nextInt(901));
                telemetry++;
            }
        }
        return new Summary(orgId, siteIds.size(), predictions, telemetry);
    }

    private double uniform(double lo, double hi) {
        return lo + rnd.nextDouble() * (hi - lo);
    }

    record NewSiteSpec(String name, double lat, double lon) {
    }

    public record Summary(UUID orgId, int sites, int predictions, int telemetry) {
    }
}
