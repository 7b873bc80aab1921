package com.climaterisklens.config;

import com.climaterisklens.risk.HazardType;

import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups all runtime settings for the API, database, auth, mail,
 * alert delivery, caches, background jobs, and the demo ML pipeline.
 * </p>
 */
public record AppConfig(
        // API / DB
        int apiPort,
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbApiPoolMax,
        int dbJobsPoolMax,
        List<String> corsOrigins,
        boolean debug,
        boolean demoMode,
        boolean enableFeedback,

        // Auth
        String jwtSecret,
        String jwtAlgorithm,
        int jwtExpireMinutes,
        int otpTtlSeconds,
        int otpMaxAttempts,

        // Mail
        String smtpHost,
        int smtpPort,
        String smtpUser,
        String smtpPassword,
        String smtpFrom,

        // Webhooks
        int webhookTimeoutSeconds,
        int webhookRetryAttempts,

        // Caches
        int predictionCacheTtlSeconds,
        int geocodeCacheTtlSeconds,
        int tileCacheTtlSeconds,

        // Grid / risk
        double gridSizeKm,
        int predictionHorizonHours,
        Map<HazardType, Double> riskThresholds,

        // Schedules
        Duration alertsSchedule,
        Duration inferenceSchedule,
        Duration tilesSchedule,
        Duration cleanupSchedule,
        int dataRetentionDays,

        // Files
        String tilesDir,
        String mlArtifactPath) {

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (Exception e) {
            org.slf4j.LoggerFactory.getLogger(AppConfig.class)
                    .warn("Could not read application.properties: {}", e.getMessage());
        }
        return load(p);
    }

    /**
     * Builds configuration from the given properties, still letting env vars and
     * -D overrides win.
     */
    public static AppConfig load(Properties p) {
        // Required
        String dbUrl = requireNonBlank("DB_JDBC_URL", envOr(p, "DB_JDBC_URL", "db.jdbcUrl", ""));
        String dbUser = requireNonBlank("DB_USERNAME", envOr(p, "DB_USERNAME", "db.username", ""));
        String dbPass = envOr(p, "DB_PASSWORD", "db.password", ""); // ok empty if local trust auth
        String jwtSecret = requireNonBlank("JWT_SECRET", envOr(p, "JWT_SECRET", "jwt.secret", ""));

        int port = Integer.parseInt(envOr(p, "API_PORT", "api.port", "8000"));
        int dbApiPoolMax = Integer.parseInt(envOr(p, "DB_API_POOL_MAX", "db.api.poolMax", "10"));
        int dbJobsPoolMax = Integer.parseInt(envOr(p, "DB_JOBS_POOL_MAX", "db.jobs.poolMax", "4"));
        List<String> cors = parseList(envOr(p, "CORS_ORIGINS", "cors.origins", "http://localhost:3000"));
        boolean debug = Boolean.parseBoolean(envOr(p, "DEBUG", "app.debug", "false"));
        boolean demoMode = Boolean.parseBoolean(envOr(p, "DEMO_MODE", "app.demoMode", "true"));
        boolean enableFeedback = Boolean.parseBoolean(envOr(p, "ENABLE_FEEDBACK", "feature.feedback", "true"));

        // Auth
        String jwtAlgorithm = envOr(p, "JWT_ALGORITHM", "jwt.algorithm", "HS256").toUpperCase();
        if (!List.of("HS256", "HS384", "HS512").contains(jwtAlgorithm)) {
            throw new IllegalStateException("Unsupported JWT_ALGORITHM: " + jwtAlgorithm);
        }
        int jwtExpire = Integer.parseInt(envOr(p, "JWT_ACCESS_TOKEN_EXPIRE_MINUTES", "jwt.expireMinutes", "30"));
        int otpTtl = Integer.parseInt(envOr(p, "OTP_TTL_SECONDS", "otp.ttlSeconds", "300"));
        int otpMaxAttempts = Integer.parseInt(envOr(p, "OTP_MAX_ATTEMPTS", "otp.maxAttempts", "5"));

        // Mail
        String smtpHost = envOr(p, "SMTP_HOST", "smtp.host", "");
        int smtpPort = Integer.parseInt(envOr(p, "SMTP_PORT", "smtp.port", "587"));
        String smtpUser = envOr(p, "SMTP_USER", "smtp.user", "");
        String smtpPassword = envOr(p, "SMTP_PASSWORD", "smtp.password", "");
        String smtpFrom = envOr(p, "SMTP_FROM", "smtp.from", "alerts@climaterisklens.com");

        // Webhooks
        int webhookTimeout = Integer.parseInt(envOr(p, "WEBHOOK_TIMEOUT_SECONDS", "webhook.timeoutSeconds", "30"));
        int webhookRetries = Integer.parseInt(envOr(p, "WEBHOOK_RETRY_ATTEMPTS", "webhook.retryAttempts", "3"));

        // Caches
        int predictionTtl = Integer
                .parseInt(envOr(p, "PREDICTION_CACHE_TTL_SECONDS", "cache.predictionTtlSeconds", "900"));
        int geocodeTtl = Integer.parseInt(envOr(p, "GEOCODE_CACHE_TTL_SECONDS", "cache.geocodeTtlSeconds", "3600"));
        int tileTtl = Integer.parseInt(envOr(p, "TILE_CACHE_TTL_SECONDS", "cache.tileTtlSeconds", "1800"));

        // Grid / risk
        double gridSizeKm = Double.parseDouble(envOr(p, "GRID_SIZE_KM", "grid.sizeKm", "1.0"));
        int horizonHours = Integer.parseInt(envOr(p, "PREDICTION_HORIZON_HOURS", "risk.horizonHours", "72"));
        Map<HazardType, Double> thresholds = new EnumMap<>(HazardType.class);
        thresholds.put(HazardType.FLOOD,
                Double.parseDouble(envOr(p, "FLOOD_RISK_THRESHOLD", "risk.threshold.flood", "0.3")));
        thresholds.put(HazardType.HEAT,
                Double.parseDouble(envOr(p, "HEAT_RISK_THRESHOLD", "risk.threshold.heat", "0.4")));
        thresholds.put(HazardType.SMOKE,
                Double.parseDouble(envOr(p, "SMOKE_RISK_THRESHOLD", "risk.threshold.smoke", "0.5")));
        thresholds.put(HazardType.PM25,
                Double.parseDouble(envOr(p, "PM25_RISK_THRESHOLD", "risk.threshold.pm25", "0.6")));

        // Schedules
        Duration al = schedule(p, "SCHED_ALERTS", "schedule.alerts", "PT5M");
        Duration inf = schedule(p, "SCHED_INFERENCE", "schedule.inference", "PT15M");
        Duration tiles = schedule(p, "SCHED_TILES", "schedule.tiles", "PT30M");
        Duration cleanup = schedule(p, "SCHED_CLEANUP", "schedule.cleanup", "P1D");
        int retentionDays = Integer.parseInt(envOr(p, "DATA_RETENTION_DAYS", "data.retentionDays", "30"));

        String tilesDir = envOr(p, "TILES_DIR", "tiles.dir", "./tiles");
        String mlArtifactPath = envOr(p, "ML_ARTIFACT_PATH", "ml.artifactPath", "./ml-artifacts");

        // constructor args must match record field order exactly
        return new AppConfig(
                port,
                dbUrl,
                dbUser,
                dbPass,
                dbApiPoolMax,
                dbJobsPoolMax,
                cors,
                debug,
                demoMode,
                enableFeedback,

                jwtSecret,
                jwtAlgorithm,
                jwtExpire,
                otpTtl,
                otpMaxAttempts,

                smtpHost,
                smtpPort,
                smtpUser,
                smtpPassword,
                smtpFrom,

                webhookTimeout,
                webhookRetries,

                predictionTtl,
                geocodeTtl,
                tileTtl,

                gridSizeKm,
                horizonHours,
                Map.copyOf(thresholds),

                al,
                inf,
                tiles,
                cleanup,
                retentionDays,

                tilesDir,
                mlArtifactPath);
    }

    /**
     * Default alert threshold for a hazard.
     */
    public double thresholdFor(HazardType hazard) {
        Double v = riskThresholds.get(hazard);
        return v == null ? 0.5 : v;
    }

    /**
     * True when both an SMTP host and user are configured.
     */
    public boolean smtpConfigured() {
        return smtpHost != null && !smtpHost.isBlank() && smtpUser != null && !smtpUser.isBlank();
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String name, String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + name + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }

    /**
     * Reads a job interval as an ISO-8601 duration of at least one second.
     */
    static Duration schedule(Properties p, String envKey, String propKey, String def) {
        String raw = envOr(p, envKey, propKey, def).trim();
        Duration d;
        try {
            d = Duration.parse(raw);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException(envKey + " is not an ISO-8601 duration: " + raw, e);
        }
        if (d.toSeconds() < 1) {
            throw new IllegalStateException(envKey + " must be at least PT1S, got " + raw);
        }
        return d;
    }

    /**
     * Parses either a JSON-style array ["a","b"] or a comma separated list.
     */
    static List<String> parseList(String s) {
        if (s == null || s.isBlank())
            return List.of();
        String body = s.trim();
        if (body.startsWith("[") && body.endsWith("]")) {
            body = body.substring(1, body.length() - 1);
        }
        List<String> out = new ArrayList<>();
        for (String part : body.split(",")) {
            String v = part.trim();
            if (v.startsWith("\"") && v.endsWith("\"") && v.length() >= 2) {
                v = v.substring(1, v.length() - 1).trim();
            }
            if (!v.isEmpty())
                out.add(v);
        }
        return List.copyOf(out);
    }
}
