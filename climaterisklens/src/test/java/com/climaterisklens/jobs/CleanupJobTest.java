package com.climaterisklens.jobs;

import com.climaterisklens.db.AlertRepo;
import com.climaterisklens.db.HazardRepo;
import com.climaterisklens.db.JobRunRepo;
import com.climaterisklens.db.TelemetryRepo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CleanupJobTest {
    private static final Instant NOW = Instant.parse("2025-06-30T00:00:00Z");
    private static final Instant CUTOFF = Instant.parse("2025-05-31T00:00:00Z");
    private static final UUID RUN = UUID.randomUUID();

    @Mock
    HazardRepo hazards;
    @Mock
    TelemetryRepo telemetry;
    @Mock
    AlertRepo alerts;
    @Mock
    JobRunRepo jobRuns;

    private CleanupJob job() {
        return new CleanupJob(hazards, telemetry, alerts, jobRuns, 30, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void deletesOlderThanRetention() throws Exception {
        when(jobRuns.startRun("cleanup")).thenReturn(RUN);
        when(hazards.deleteOlderThan(CUTOFF)).thenReturn(120);
        when(telemetry.deleteOlderThan(CUTOFF)).thenReturn(40);
        when(alerts.deleteFinishedOlderThan(CUTOFF)).thenReturn(3);

        CleanupJob.Result r = job().run();

        assertThat(r, is(new CleanupJob.Result(120, 40, 3)));
        verify(jobRuns).finishRun(RUN, true, "hazards=120 telemetry=40 alerts=3");
    }

    @Test
    void failureIsRecordedAndRethrown() throws Exception {
        when(jobRuns.startRun("cleanup")).thenReturn(RUN);
        when(hazards.deleteOlderThan(CUTOFF)).thenThrow(new SQLException("locked"));

        assertThrows(SQLException.class, () -> job().run());
        verify(jobRuns).finishRun(RUN, false, "fatal: locked");
    }
}
