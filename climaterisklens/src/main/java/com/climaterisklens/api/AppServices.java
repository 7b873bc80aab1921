package com.climaterisklens.api;

import com.climaterisklens.assets.AssetFileParser;
import com.climaterisklens.auth.JwtService;
import com.climaterisklens.auth.OtpService;
import com.climaterisklens.cache.TtlCache;
import com.climaterisklens.config.AppConfig;
import com.climaterisklens.db.AlertRepo;
import com.climaterisklens.db.ExperimentRepo;
import com.climaterisklens.db.FeedbackRepo;
import com.climaterisklens.db.HazardRepo;
import com.climaterisklens.db.JobRunRepo;
import com.climaterisklens.db.OrganizationRepo;
import com.climaterisklens.db.SiteRepo;
import com.climaterisklens.db.StatsRepo;
import com.climaterisklens.db.TelemetryRepo;
import com.climaterisklens.db.UserRepo;
import com.climaterisklens.geo.Geocoder;
import com.climaterisklens.risk.HazardType;
import com.climaterisklens.risk.RiskService;
import com.climaterisklens.tiles.TileService;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.function.Consumer;

/**
 * Everything the HTTP layer talks to. The two triggers start background work
 * (tile rebuild, demo retrain) and may be null when not wired.
 */
public record AppServices(
        AppConfig cfg,
        ObjectMapper om,
        UserRepo users,
        OrganizationRepo orgs,
        SiteRepo sites,
        HazardRepo hazards,
        AlertRepo alerts,
        FeedbackRepo feedback,
        ExperimentRepo experiments,
        JobRunRepo jobRuns,
        TelemetryRepo telemetry,
        StatsRepo stats,
        JwtService jwt,
        OtpService otp,
        RiskService risk,
        Geocoder geocoder,
        AssetFileParser assetParser,
        TileService tiles,
        List<TtlCache<?>> caches,
        Runnable tileRebuildTrigger,
        Consumer<HazardType> retrainTrigger) {
}
