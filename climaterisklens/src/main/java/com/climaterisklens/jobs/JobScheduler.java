package com.climaterisklens.jobs;

import com.climaterisklens.alerts.AlertProcessor;
import com.climaterisklens.config.AppConfig;
import com.climaterisklens.tiles.TileService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the background jobs, each on its own single-thread executor with a
 * fixed delay between runs.
 */
public final class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final ScheduledExecutorService alertsExec = Executors
            .newSingleThreadScheduledExecutor(r -> new Thread(r, "job-alerts"));
    private final ScheduledExecutorService inferenceExec = Executors
            .newSingleThreadScheduledExecutor(r -> new Thread(r, "job-inference"));
    private final ScheduledExecutorService tilesExec = Executors
            .newSingleThreadScheduledExecutor(r -> new Thread(r, "job-tiles"));
    private final ScheduledExecutorService cleanupExec = Executors
            .newSingleThreadScheduledExecutor(r -> new Thread(r, "job-cleanup"));

    private final AppConfig cfg;
    private final AlertProcessor alerts;
    private final InferenceJob inference;
    private final TileService tiles;
    private final CleanupJob cleanup;

    private ScheduledFuture<?> alertsTask;
    private ScheduledFuture<?> inferenceTask;
    private ScheduledFuture<?> tilesTask;
    private ScheduledFuture<?> cleanupTask;

    public JobScheduler(AppConfig cfg, AlertProcessor alerts, InferenceJob inference, TileService tiles,
            CleanupJob cleanup) {
        this.cfg = cfg;
        this.alerts = alerts;
        this.inference = inference;
        this.tiles = tiles;
        this.cleanup = cleanup;
    }

    public void start() {
        if (cfg.demoMode()) {
            inferenceTask = inferenceExec.scheduleWithFixedDelay(safe("inference", inference::run),
                    5, cfg.inferenceSchedule().toSeconds(), TimeUnit.SECONDS);
        }

        alertsTask = alertsExec.scheduleWithFixedDelay(safe("alerts", alerts::processPending),
                30, cfg.alertsSchedule().toSeconds(), TimeUnit.SECONDS);

        tilesTask = tilesExec.scheduleWithFixedDelay(safe("tiles", tiles::buildAll),
                60, cfg.tilesSchedule().toSeconds(), TimeUnit.SECONDS);

        cleanupTask = cleanupExec.scheduleWithFixedDelay(safe("cleanup", cleanup::run),
                300, cfg.cleanupSchedule().toSeconds(), TimeUnit.SECONDS);

        log.info("Job scheduler started (demo inference {}).", cfg.demoMode() ? "on" : "off");
    }

    public void stop() {
        for (ScheduledFuture<?> f : new ScheduledFuture<?>[] { alertsTask, inferenceTask, tilesTask, cleanupTask }) {
            if (f != null)
                f.cancel(true);
        }
        shutdown(alertsExec, "alertsExec");
        shutdown(inferenceExec, "inferenceExec");
        shutdown(tilesExec, "tilesExec");
        shutdown(cleanupExec, "cleanupExec");
    }

    private void shutdown(ScheduledExecutorService es, String name) {
        es.shutdownNow();
        try {
            if (!es.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate cleanly", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Wraps a job so a failure is logged and the executor keeps its schedule.
     * Errors are caught as well: anything escaping the runnable would cancel
     * every later run of the job.
     */
    static Runnable safe(String name, ThrowingRunnable r) {
        return () -> {
            MDC.put("job", name);
            try {
                r.run();
            } catch (Exception e) {
                log.error("Scheduled job failed: {}", name, e);
            } catch (Error e) {
                log.error("Scheduled job hit an error and will retry on its next run: {}", name, e);
            } finally {
                MDC.remove("job");
            }
        };
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}
