package com.climaterisklens.ml;

import com.climaterisklens.db.ModelRegistryRepo;
import com.climaterisklens.db.ModelRegistryRepo.RegisteredModel;
import com.climaterisklens.risk.HazardType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Demo training pipeline: synthetic data, linear head, artifact on disk and
 * (optionally) a row in the model registry under {@code {hazard}-head}.
 */
public class TrainingService {
    private static final Logger log = LoggerFactory.getLogger(TrainingService.class);

    public static final int SAMPLES = 1000;
    public static final int SEQUENCE_LENGTH = 48;
    private static final DateTimeFormatter LOCAL_VERSION = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
            .withZone(ZoneOffset.UTC);

    private final ModelRegistryRepo registry;
    private final ModelArtifacts artifacts;
    private final ObjectMapper om;
    private final Clock clock;

    /**
     * @param registry may be null when models are never registered (CLI
     *                 {@code --no-register})
     */
    public TrainingService(ModelRegistryRepo registry, Path artifactRoot, ObjectMapper om, Clock clock) {
        this.registry = registry;
        this.artifacts = new ModelArtifacts(artifactRoot, om);
        this.om = om;
        this.clock = clock;
    }

    public static String modelName(HazardType hazard) {
        return hazard.key() + "-head";
    }

    public Outcome train(HazardType hazard, TrainParams params, boolean register) throws Exception {
        if (register && registry == null)
            throw new IllegalStateException("No model registry configured");
        String name = modelName(hazard);
        String runId = UUID.randomUUID().toString();
        MDC.put("runId", runId);
        try {
            log.info("Training {} on synthetic data (epochs={}, batch={}, lr={}, seed={})", name, params.epochs(),
                    params.batchSize(), params.learningRate(), params.seed());
            DemoDataset data = DemoDataset.generate(hazard, SAMPLES, SEQUENCE_LENGTH, params.seed());
            DemoTrainer.Result result = DemoTrainer.train(data, params);

            String version = register ? String.valueOf(registry.nextVersion(name))
                    : "local-" + LOCAL_VERSION.format(clock.instant());
            Path file = artifacts.write(name, version, hazard.key(), params, result, clock.instant());
            if (register) {
                String metricsJson = om.writeValueAsString(artifacts.metrics(result));
                registry.register(name, version, runId, file.toAbsolutePath().toUri().toString(), metricsJson);
            }
            log.info("Finished training {} v{}: best val loss {}", name, version,
                    String.format("%.5f", result.bestValLoss()));
            return new Outcome(name, version, file, result.bestValLoss(), register);
        } finally {
            MDC.remove("runId");
        }
    }

    /**
     * Latest registered model for a hazard, or null when none is registered or
     * its artifact file is gone.
     */
    public LoadedModel loadLatest(HazardType hazard) throws Exception {
        if (registry == null)
            return null;
        RegisteredModel reg = registry.latest(modelName(hazard));
        if (reg == null || reg.artifactUri() == null)
            return null;
        Path file = reg.artifactUri().startsWith("file:") ? Path.of(URI.create(reg.artifactUri()))
                : Path.of(reg.artifactUri());
        if (!Files.isRegularFile(file)) {
            log.warn("Artifact for {} v{} is missing: {}", reg.name(), reg.version(), file);
            return null;
        }
        return new LoadedModel(reg.name() + "-v" + reg.version(), artifacts.read(file));
    }

    public record LoadedModel(String modelVersion, LinearModel model) {
    }

    public record Outcome(String modelName, String version, Path artifact, double bestValLoss, boolean registered) {
    }
}
