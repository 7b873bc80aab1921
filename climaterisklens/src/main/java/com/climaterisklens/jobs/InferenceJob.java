package com.climaterisklens.jobs;

import com.climaterisklens.db.HazardRepo;
import com.climaterisklens.db.HazardRepo.Prediction;
import com.climaterisklens.db.JobRunRepo;
import com.climaterisklens.db.SiteRepo;
import com.climaterisklens.ml.DemoDataset;
import com.climaterisklens.ml.TrainingService;
import com.climaterisklens.ml.TrainingService.LoadedModel;
import com.climaterisklens.risk.HazardType;
import com.climaterisklens.risk.RiskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Demo inference: writes predictions for every grid cell that has an active
 * site, for each hazard and horizon.
 */
public class InferenceJob {
    private static final Logger log = LoggerFactory.getLogger(InferenceJob.class);

    public static final int[] HORIZONS_HOURS = { 6, 12, 24, 48, 72 };
    static final int FEATURE_SEQUENCE = 48;

    private final SiteRepo siteRepo;
    private final HazardRepo hazardRepo;
    private final JobRunRepo jobRunRepo;
    private final TrainingService training;
    private final Clock clock;

    public InferenceJob(SiteRepo siteRepo, HazardRepo hazardRepo, JobRunRepo jobRunRepo, TrainingService training,
            Clock clock) {
        this.siteRepo = siteRepo;
        this.hazardRepo = hazardRepo;
        this.jobRunRepo = jobRunRepo;
        this.training = training;
        this.clock = clock;
    }

    public int run() throws Exception {
        log.info("Starting job: demoInference");
        UUID runId = jobRunRepo.startRun("inference");
        MDC.put("runId", runId.toString());
        int ok = 0;
        int fail = 0;
        int written = 0;
        try {
            Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.MINUTES);
            Map<HazardType, LoadedModel> models = loadModels();
            List<String> grids = siteRepo.activeGridIds();
            for (String gridId : grids) {
                try {
                    written += hazardRepo.insertAll(predictionsFor(gridId, issuedAt, models));
                    ok++;
                } catch (Exception e) {
                    fail++;
                    log.warn("Inference failed for grid {}: {}", gridId, e.getMessage());
                }
            }
            jobRunRepo.finishRun(runId, fail == 0, "grids ok=" + ok + " fail=" + fail + " rows=" + written);
            log.info("Finished demoInference: grids={} rows={} models={}", grids.size(), written, models.keySet());
            return written;
        } catch (Exception outer) {
            jobRunRepo.finishRun(runId, false, "fatal: " + outer.getMessage());
            throw outer;
        } finally {
            MDC.remove("runId");
        }
    }

    private Map<HazardType, LoadedModel> loadModels() {
        Map<HazardType, LoadedModel> out = new EnumMap<>(HazardType.class);
        if (training == null)
            return out;
        for (HazardType h : HazardType.values()) {
            try {
                LoadedModel m = training.loadLatest(h);
                if (m != null)
                    out.put(h, m);
            } catch (Exception e) {
                log.warn("Could not load model for {}, using demo values: {}", h.key(), e.getMessage());
            }
        }
        return out;
    }

    /**
     * Predictions for one cell. Values are deterministic for a given cell,
     * hazard, horizon and issue hour.
     */
    List<Prediction> predictionsFor(String gridId, Instant issuedAt, Map<HazardType, LoadedModel> models) {
        long hour = issuedAt.truncatedTo(ChronoUnit.HOURS).getEpochSecond();
        List<Prediction> out = new ArrayList<>();
        for (HazardType h : HazardType.values()) {
            LoadedModel m = models.get(h);
            for (int horizon : HORIZONS_HOURS) {
                Random rnd = new Random((gridId + "|" + h.key() + "|" + horizon + "|" + hour).hashCode());
                double p;
                String version;
                if (m != null) {
                    p = m.model().predict(DemoDataset.sampleFeatures(rnd, FEATURE_SEQUENCE));
                    version = m.modelVersion();
                } else {
                    p = 0.1 + rnd.nextDouble() * 0.7;
                    version = RiskService.DEMO_MODEL;
                }
                double spread = 0.05 + 0.15 * horizon / 72.0;
                out.add(new Prediction(null, h.key(), issuedAt, horizon * 60, gridId, round(p),
                        round(Math.max(0.0, p - spread)), round(p), round(Math.min(1.0, p + spread)), version,
                        issuedAt));
            }
        }
        return out;
    }

    private static double round(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
