/*
* Copyright 2025 Climate Risk Lens
* Main application entry point for Climate Risk Lens, a geospatial service forecasting local climate hazards.
*
* Initializes configuration, database pools, repositories, caches, auth, risk and tile services,
* the background job scheduler and the API server. Startup flow loads configuration, prepares the
* schema, starts the scheduler and the API, then builds an initial tile set in the background;
* program also handles a graceful shutdown.
*/

package com.climaterisklens;

import com.climaterisklens.alerts.AlertProcessor;
import com.climaterisklens.alerts.WebhookNotifier;
import com.climaterisklens.api.ApiServer;
import com.climaterisklens.api.AppServices;
import com.climaterisklens.assets.AssetFileParser;
import com.climaterisklens.auth.JwtService;
import com.climaterisklens.auth.Mailer;
import com.climaterisklens.auth.OtpService;
import com.climaterisklens.cache.TtlCache;
import com.climaterisklens.config.AppConfig;
import com.climaterisklens.db.*;
import com.climaterisklens.geo.Geocoder;
import com.climaterisklens.geo.GridSystem;
import com.climaterisklens.jobs.CleanupJob;
import com.climaterisklens.jobs.InferenceJob;
import com.climaterisklens.jobs.JobScheduler;
import com.climaterisklens.ml.TrainParams;
import com.climaterisklens.ml.TrainingService;
import com.climaterisklens.risk.RiskService;
import com.climaterisklens.tiles.TileService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();
        if (cfg.debug())
            log.info("DEBUG is on: response caches are bypassed");

        ObjectMapper om = new ObjectMapper();
        Clock clock = Clock.systemUTC();
        HikariDataSource apiDs = Database.createApiDataSource(cfg);
        HikariDataSource jobsDs = Database.createJobsDataSource(cfg);
        Database.ensureExtensions(jobsDs);

        // Repos (API pool); creation order follows the foreign keys
        OrganizationRepo orgRepo = new OrganizationRepo(apiDs);
        UserRepo userRepo = new UserRepo(apiDs);
        SiteRepo siteRepo = new SiteRepo(apiDs);
        HazardRepo hazardRepo = new HazardRepo(apiDs);
        AlertRepo alertRepo = new AlertRepo(apiDs);
        FeedbackRepo feedbackRepo = new FeedbackRepo(apiDs);
        TelemetryRepo telemetryRepo = new TelemetryRepo(apiDs);
        ExperimentRepo experimentRepo = new ExperimentRepo(apiDs);
        JobRunRepo apiJobRuns = new JobRunRepo(apiDs);
        StatsRepo statsRepo = new StatsRepo(apiDs);

        // Repos (jobs pool)
        SiteRepo jobSites = new SiteRepo(jobsDs);
        HazardRepo jobHazards = new HazardRepo(jobsDs);
        AlertRepo jobAlerts = new AlertRepo(jobsDs);
        TelemetryRepo jobTelemetry = new TelemetryRepo(jobsDs);
        JobRunRepo jobRuns = new JobRunRepo(jobsDs);
        ModelRegistryRepo modelRegistry = new ModelRegistryRepo(jobsDs);

        // Caches
        boolean responseCaches = !cfg.debug();
        TtlCache<OtpService.Pending> otpStore = new TtlCache<>("otp", cfg.otpTtlSeconds(), true);
        TtlCache<ObjectNode> riskCache = new TtlCache<>("risk", cfg.predictionCacheTtlSeconds(), responseCaches);
        TtlCache<Geocoder.Place> geocodeCache = new TtlCache<>("geocode", cfg.geocodeCacheTtlSeconds(),
                responseCaches);

        // Services
        GridSystem grid = new GridSystem(cfg.gridSizeKm());
        Mailer mailer = Mailer.fromConfig(cfg);
        RiskService risk = new RiskService(hazardRepo, grid, riskCache, om, cfg.demoMode(), new SecureRandom(),
                clock);
        TileService apiTiles = new TileService(hazardRepo, apiJobRuns, grid, om, Path.of(cfg.tilesDir()), clock);
        TileService jobTiles = new TileService(jobHazards, jobRuns, grid, om, Path.of(cfg.tilesDir()), clock);
        TrainingService training = new TrainingService(modelRegistry, Path.of(cfg.mlArtifactPath()), om, clock);

        // Jobs
        AlertProcessor alerts = new AlertProcessor(jobAlerts, jobHazards, jobRuns, mailer,
                new WebhookNotifier(om, cfg.webhookTimeoutSeconds(), cfg.webhookRetryAttempts()), om,
                cfg.predictionHorizonHours(), clock);
        InferenceJob inference = new InferenceJob(jobSites, jobHazards, jobRuns, training, clock);
        CleanupJob cleanup = new CleanupJob(jobHazards, jobTelemetry, jobAlerts, jobRuns, cfg.dataRetentionDays(),
                clock);

        JobScheduler scheduler = new JobScheduler(cfg, alerts, inference, jobTiles, cleanup);
        scheduler.start();

        // API server (start immediately; tiles build in background)
        AppServices services = new AppServices(cfg, om, userRepo, orgRepo, siteRepo, hazardRepo, alertRepo,
                feedbackRepo, experimentRepo, apiJobRuns, telemetryRepo, statsRepo, new JwtService(cfg),
                new OtpService(otpStore, mailer, cfg.otpMaxAttempts()), risk, new Geocoder(geocodeCache),
                new AssetFileParser(om), apiTiles, List.of(otpStore, riskCache, geocodeCache),
                () -> {
                    try {
                        jobTiles.buildAll();
                    } catch (Exception e) {
                        log.error("Manual tile reindex failed", e);
                    }
                },
                hazard -> {
                    try {
                        training.train(hazard, TrainParams.defaults(), true);
                    } catch (Exception e) {
                        log.error("Retraining {} failed", hazard.key(), e);
                    }
                });
        ApiServer api = new ApiServer(services);
        api.start();
        log.info("API server started on port {}", cfg.apiPort());

        Thread startupTiles = new Thread(() -> {
            MDC.put("job", "startup-tiles");
            try {
                jobTiles.buildAll();
            } catch (Exception e) {
                log.error("Startup tile build failed", e);
            } finally {
                MDC.remove("job");
            }
        }, "startup-tiles");
        startupTiles.setDaemon(true);
        startupTiles.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                scheduler.stop();
                apiDs.close();
                jobsDs.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }
}
