package com.climaterisklens.ml;

import com.climaterisklens.db.ModelRegistryRepo;
import com.climaterisklens.db.ModelRegistryRepo.RegisteredModel;
import com.climaterisklens.risk.HazardType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrainingServiceTest {
    private static final Instant NOW = Instant.parse("2025-06-01T12:30:45Z");
    private static final TrainParams QUICK = new TrainParams(2, 64, 0.01, 7L);

    @Mock
    ModelRegistryRepo registry;

    @TempDir
    Path dir;

    private final ObjectMapper om = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void localRunWritesTimestampedArtifact() throws Exception {
        TrainingService training = new TrainingService(null, dir, om, clock);

        TrainingService.Outcome o = training.train(HazardType.HEAT, QUICK, false);

        assertThat(o.modelName(), is("heat-head"));
        assertThat(o.version(), is("local-20250601123045"));
        assertThat(o.registered(), is(false));
        assertThat(o.artifact(), is(dir.resolve("heat-head").resolve("local-20250601123045.json")));

        JsonNode doc = om.readTree(o.artifact().toFile());
        assertThat(doc.get("hazard").asText(), is("heat"));
        assertThat(doc.get("weights").size(), is(DemoDataset.FEATURES));
        assertThat(doc.get("feature_names").get(0).asText(), is("precipitation"));
        assertThat(doc.get("params").get("epochs").asInt(), is(2));
        assertThat(doc.get("metrics").get("train_size").asInt(), is(800));
        assertThat(doc.get("created_at").asText(), is(NOW.toString()));
    }

    @Test
    void registeringNeedsARegistry() {
        TrainingService training = new TrainingService(null, dir, om, clock);
        assertThrows(IllegalStateException.class, () -> training.train(HazardType.FLOOD, QUICK, true));
        assertThat(Files.exists(dir.resolve("flood-head")), is(false));
    }

    @Test
    void registeredModelRoundTripsThroughLoadLatest() throws Exception {
        when(registry.nextVersion("flood-head")).thenReturn(3);
        TrainingService training = new TrainingService(registry, dir, om, clock);

        TrainingService.Outcome o = training.train(HazardType.FLOOD, QUICK, true);

        assertThat(o.version(), is("3"));
        ArgumentCaptor<String> uri = ArgumentCaptor.forClass(String.class);
        verify(registry).register(eq("flood-head"), eq("3"), anyString(), uri.capture(), anyString());
        assertThat(uri.getValue().startsWith("file:"), is(true));

        when(registry.latest("flood-head"))
                .thenReturn(new RegisteredModel("flood-head", "3", "run", uri.getValue(), "None", NOW));
        TrainingService.LoadedModel loaded = training.loadLatest(HazardType.FLOOD);

        assertThat(loaded, is(notNullValue()));
        assertThat(loaded.modelVersion(), is("flood-head-v3"));
        assertThat(loaded.model().weights().length, is(DemoDataset.FEATURES));
    }

    @Test
    void missingArtifactOrRegistryLoadsNothing() throws Exception {
        when(registry.latest("smoke-head")).thenReturn(
                new RegisteredModel("smoke-head", "1", "run", dir.resolve("gone.json").toString(), "None", NOW));
        assertThat(new TrainingService(registry, dir, om, clock).loadLatest(HazardType.SMOKE), is(nullValue()));
        assertThat(new TrainingService(null, dir, om, clock).loadLatest(HazardType.SMOKE), is(nullValue()));
    }

    @Test
    void artifactWithWrongShapeIsRejected() throws Exception {
        Path bad = dir.resolve("bad.json");
        Files.writeString(bad, "{\"weights\":[1,2],\"bias\":0.1}");
        assertThrows(IOException.class, () -> new ModelArtifacts(dir, om).read(bad));
    }
}
