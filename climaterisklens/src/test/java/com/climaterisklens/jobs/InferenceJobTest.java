package com.climaterisklens.jobs;

import com.climaterisklens.db.HazardRepo;
import com.climaterisklens.db.HazardRepo.Prediction;
import com.climaterisklens.db.JobRunRepo;
import com.climaterisklens.db.SiteRepo;
import com.climaterisklens.ml.DemoDataset;
import com.climaterisklens.ml.LinearModel;
import com.climaterisklens.ml.TrainingService;
import com.climaterisklens.ml.TrainingService.LoadedModel;
import com.climaterisklens.risk.HazardType;
import com.climaterisklens.risk.RiskService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InferenceJobTest {
    private static final Instant NOW = Instant.parse("2025-06-01T12:34:56Z");
    private static final UUID RUN = UUID.randomUUID();

    @Mock
    SiteRepo sites;
    @Mock
    HazardRepo hazards;
    @Mock
    JobRunRepo jobRuns;
    @Mock
    TrainingService training;

    private InferenceJob job() {
        return new InferenceJob(sites, hazards, jobRuns, training, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void demoValuesCoverEveryHazardAndHorizon() {
        List<Prediction> preds = job().predictionsFor("10_20", NOW, Map.of());

        assertThat(preds.size(), is(HazardType.values().length * InferenceJob.HORIZONS_HOURS.length));
        for (Prediction p : preds) {
            assertThat(p.modelVersion(), is(RiskService.DEMO_MODEL));
            assertThat(p.pRisk(), is(allOf(greaterThanOrEqualTo(0.1), lessThanOrEqualTo(0.8))));
            assertThat(p.q10(), lessThanOrEqualTo(p.q50()));
            assertThat(p.q50(), lessThanOrEqualTo(p.q90()));
            assertThat(p.gridId(), is("10_20"));
        }
        assertThat(preds.get(0).horizonMinutes(), is(6 * 60));
        assertThat(preds.get(4).horizonMinutes(), is(72 * 60));
    }

    @Test
    void valuesAreStableWithinTheHour() {
        List<Prediction> a = job().predictionsFor("10_20", NOW, Map.of());
        List<Prediction> b = job().predictionsFor("10_20", NOW.plusSeconds(60), Map.of());
        assertThat(a.get(7).pRisk(), is(b.get(7).pRisk()));
    }

    @Test
    void loadedModelIsUsedForItsHazard() {
        double[] w = new double[DemoDataset.FEATURES];
        LinearModel constant = new LinearModel(DemoDataset.FEATURE_NAMES, w, 0.9);
        Map<HazardType, LoadedModel> models = new EnumMap<>(HazardType.class);
        models.put(HazardType.HEAT, new LoadedModel("heat-head-v2", constant));

        List<Prediction> preds = job().predictionsFor("10_20", NOW, models);

        Prediction heat = preds.stream().filter(p -> p.type().equals("heat")).findFirst().orElseThrow();
        assertThat(heat.modelVersion(), is("heat-head-v2"));
        assertThat(heat.pRisk(), is(0.9));
        Prediction flood = preds.stream().filter(p -> p.type().equals("flood")).findFirst().orElseThrow();
        assertThat(flood.modelVersion(), is(RiskService.DEMO_MODEL));
    }

    @Test
    void runWritesRowsPerGridAndRecordsFailures() throws Exception {
        when(jobRuns.startRun("inference")).thenReturn(RUN);
        when(sites.activeGridIds()).thenReturn(List.of("1_1", "2_2"));
        when(hazards.insertAll(anyList())).thenReturn(20).thenThrow(new SQLException("dup"));

        int written = job().run();

        assertThat(written, is(20));
        verify(jobRuns).finishRun(RUN, false, "grids ok=1 fail=1 rows=20");
    }

    @Test
    void modelLoadErrorsFallBackToDemoValues() throws Exception {
        when(jobRuns.startRun("inference")).thenReturn(RUN);
        when(training.loadLatest(any())).thenThrow(new SQLException("registry down"));
        when(sites.activeGridIds()).thenReturn(List.of("1_1"));
        when(hazards.insertAll(anyList())).thenReturn(20);

        assertThat(job().run(), is(20));
        verify(jobRuns).finishRun(RUN, true, "grids ok=1 fail=0 rows=20");
    }

    @Test
    void fatalErrorIsRecorded() throws Exception {
        when(jobRuns.startRun("inference")).thenReturn(RUN);
        when(sites.activeGridIds()).thenThrow(new SQLException("db gone"));

        assertThrows(SQLException.class, () -> job().run());
        verify(jobRuns).finishRun(RUN, false, "fatal: db gone");
    }
}
