package com.climaterisklens.jobs;

import com.climaterisklens.db.AlertRepo;
import com.climaterisklens.db.HazardRepo;
import com.climaterisklens.db.JobRunRepo;
import com.climaterisklens.db.TelemetryRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Retention: drops predictions, telemetry and finished alerts older than the
 * configured number of days.
 */
public class CleanupJob {
    private static final Logger log = LoggerFactory.getLogger(CleanupJob.class);

    private final HazardRepo hazardRepo;
    private final TelemetryRepo telemetryRepo;
    private final AlertRepo alertRepo;
    private final JobRunRepo jobRunRepo;
    private final int retentionDays;
    private final Clock clock;

    public CleanupJob(HazardRepo hazardRepo, TelemetryRepo telemetryRepo, AlertRepo alertRepo, JobRunRepo jobRunRepo,
            int retentionDays, Clock clock) {
        this.hazardRepo = hazardRepo;
        this.telemetryRepo = telemetryRepo;
        this.alertRepo = alertRepo;
        this.jobRunRepo = jobRunRepo;
        this.retentionDays = retentionDays;
        this.clock = clock;
    }

    public Result run() throws Exception {
        log.info("Starting job: cleanup (retention {} days)", retentionDays);
        UUID runId = jobRunRepo.startRun("cleanup");
        MDC.put("runId", runId.toString());
        try {
            Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
            Result r = new Result(hazardRepo.deleteOlderThan(cutoff), telemetryRepo.deleteOlderThan(cutoff),
                    alertRepo.deleteFinishedOlderThan(cutoff));
            jobRunRepo.finishRun(runId, true,
                    "hazards=" + r.hazards() + " telemetry=" + r.telemetry() + " alerts=" + r.alerts());
            log.info("Finished cleanup: hazards={} telemetry={} alerts={}", r.hazards(), r.telemetry(), r.alerts());
            return r;
        } catch (Exception outer) {
            jobRunRepo.finishRun(runId, false, "fatal: " + outer.getMessage());
            throw outer;
        } finally {
            MDC.remove("runId");
        }
    }

    public record Result(int hazards, int telemetry, int alerts) {
    }
}
