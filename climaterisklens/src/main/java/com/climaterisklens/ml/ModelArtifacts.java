package com.climaterisklens.ml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes model artifacts as JSON files laid out as
 * {@code root/{model-name}/{version}.json}.
 */
public final class ModelArtifacts {
    private final Path root;
    private final ObjectMapper om;

    public ModelArtifacts(Path root, ObjectMapper om) {
        this.root = root;
        this.om = om;
    }

    public Path pathFor(String modelName, String version) {
        return root.resolve(modelName).resolve(version + ".json");
    }

    public Path write(String modelName, String version, String hazard, TrainParams params,
            DemoTrainer.Result result, Instant createdAt) throws IOException {
        ObjectNode doc = om.createObjectNode();
        doc.put("model_name", modelName);
        doc.put("version", version);
        doc.put("hazard", hazard);
        doc.put("created_at", createdAt.toString());

        LinearModel m = result.model();
        ArrayNode names = doc.putArray("feature_names");
        m.featureNames().forEach(names::add);
        ArrayNode weights = doc.putArray("weights");
        for (double w : m.weights()) {
            weights.add(w);
        }
        doc.put("bias", m.bias());

        ObjectNode p = doc.putObject("params");
        p.put("epochs", params.epochs());
        p.put("batch_size", params.batchSize());
        p.put("learning_rate", params.learningRate());
        p.put("seed", params.seed());

        doc.set("metrics", metrics(result));

        Path file = pathFor(modelName, version);
        Files.createDirectories(file.getParent());
        Files.write(file, om.writerWithDefaultPrettyPrinter().writeValueAsBytes(doc));
        return file;
    }

    public ObjectNode metrics(DemoTrainer.Result result) {
        ObjectNode metrics = om.createObjectNode();
        metrics.put("best_val_loss", result.bestValLoss());
        metrics.put("train_size", result.trainSize());
        metrics.put("val_size", result.valSize());
        DemoTrainer.EpochMetrics last = result.last();
        if (last != null) {
            metrics.put("final_train_loss", last.trainLoss());
            metrics.put("final_val_loss", last.valLoss());
            metrics.put("final_train_mae", last.trainMae());
            metrics.put("final_val_mae", last.valMae());
        }
        return metrics;
    }

    public LinearModel read(Path file) throws IOException {
        JsonNode doc = om.readTree(file.toFile());
        List<String> names = new ArrayList<>();
        doc.path("feature_names").forEach(n -> names.add(n.asText()));
        JsonNode w = doc.path("weights");
        if (!w.isArray() || w.size() != DemoDataset.FEATURES) {
            throw new IOException("Artifact " + file + " has " + w.size() + " weights, expected "
                    + DemoDataset.FEATURES);
        }
        double[] weights = new double[w.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = w.get(i).asDouble();
        }
        return new LinearModel(List.copyOf(names), weights, doc.path("bias").asDouble());
    }
}
