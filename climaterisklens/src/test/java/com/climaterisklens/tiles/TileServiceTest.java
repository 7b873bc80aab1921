package com.climaterisklens.tiles;

import com.climaterisklens.db.HazardRepo;
import com.climaterisklens.db.HazardRepo.Prediction;
import com.climaterisklens.db.JobRunRepo;
import com.climaterisklens.geo.GridSystem;
import com.climaterisklens.geo.TileCoord;
import com.climaterisklens.geo.TileSystem;
import com.climaterisklens.risk.HazardType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TileServiceTest {
    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
    private static final UUID RUN = UUID.randomUUID();

    @Mock
    HazardRepo hazards;
    @Mock
    JobRunRepo jobRuns;

    @TempDir
    Path dir;

    private final ObjectMapper om = new ObjectMapper();
    private final GridSystem grid = new GridSystem(1.0);
    private final String gridId = grid.pointToGridId(37.7749, -122.4194);

    private TileService service() {
        return new TileService(hazards, jobRuns, grid, om, dir, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Prediction prediction(String type, String cell) {
        return new Prediction(UUID.randomUUID(), type, NOW.minusSeconds(60), 1440, cell, 0.4, 0.2, 0.4, 0.7,
                "demo-model-v1", NOW);
    }

    private TileCoord sfTile(int zoom) {
        double[] c = grid.gridCenter(gridId);
        return TileSystem.deg2num(c[0], c[1], zoom);
    }

    @Test
    void onDemandTileFiltersByHazard() throws Exception {
        when(hazards.latestInRange(eq(NOW.minus(TileService.LOOKBACK)), eq("heat"), any(),
                eq(TileService.MAX_TILE_POINTS))).thenReturn(List.of(prediction("heat", gridId)));

        ObjectNode tile = service().tile(sfTile(10), HazardType.HEAT, "risk");

        assertThat(tile.get("features").size(), is(1));
        assertThat(tile.get("features").get(0).get("properties").get("hazard_type").asText(), is("heat"));
    }

    @Test
    void uncertaintyLayerAndBadGridIds() throws Exception {
        when(hazards.latestInRange(any(), isNull(), any(), anyInt()))
                .thenReturn(List.of(prediction("flood", gridId), prediction("flood", "garbage")));

        ObjectNode tile = service().tile(sfTile(12), null, "uncertainty");

        assertThat(tile.get("features").size(), is(1));
        JsonNode props = tile.get("features").get(0).get("properties");
        assertThat(props.get("uncertainty").asDouble(), is(0.7 - 0.2));
    }

    @Test
    void buildWritesTilesAndArchive() throws Exception {
        when(jobRuns.startRun("tiles")).thenReturn(RUN);
        when(hazards.latestSince(any(), isNull())).thenReturn(List.of(prediction("flood", gridId)));

        TileService.BuildResult r = service().buildAll();

        assertThat(r.predictions(), is(1));
        assertThat(r.tiles(), is(TileService.BUILD_ZOOMS.length));
        Path tenFile = dir.resolve(sfTile(10).path() + ".json");
        assertThat(Files.exists(tenFile), is(true));
        assertThat(om.readTree(tenFile.toFile()).get("features").size(), is(1));

        List<String> names = archiveEntries(r.archive());
        assertThat(names.size(), is(TileService.BUILD_ZOOMS.length));
        assertThat(names, hasItem(sfTile(10).path() + ".json"));
        assertThat(Files.exists(dir.resolve(TileService.ARCHIVE_NAME + ".tmp")), is(false));
        verify(jobRuns).finishRun(RUN, true, "predictions=1 tiles=4");
    }

    @Test
    void tileQueryIsLimitedToCellsUnderTheTile() throws Exception {
        ArgumentCaptor<GridSystem.CellRange> range = ArgumentCaptor.forClass(GridSystem.CellRange.class);
        when(hazards.latestInRange(any(), isNull(), range.capture(), anyInt())).thenReturn(List.of());

        service().tile(sfTile(10), null, "risk");

        long[] cell = { 4193, -13589 };
        GridSystem.CellRange r = range.getValue();
        assertThat(r.minLatIdx() <= cell[0] && cell[0] <= r.maxLatIdx(), is(true));
        assertThat(r.minLonIdx() <= cell[1] && cell[1] <= r.maxLonIdx(), is(true));
        // a z10 tile is about 0.35 degrees wide, far from the whole world
        assertThat(r.maxLonIdx() - r.minLonIdx() < 60, is(true));
    }

    @Test
    void rebuildDropsTilesWhosePredictionsExpired() throws Exception {
        when(jobRuns.startRun("tiles")).thenReturn(RUN);
        String nyCell = grid.pointToGridId(40.7128, -74.0060);
        when(hazards.latestSince(any(), isNull()))
                .thenReturn(List.of(prediction("flood", gridId), prediction("flood", nyCell)))
                .thenReturn(List.of(prediction("flood", nyCell)))
                .thenReturn(List.of());
        TileService svc = service();

        assertThat(archiveEntries(svc.buildAll().archive()).size(), is(2 * TileService.BUILD_ZOOMS.length));

        List<String> second = archiveEntries(svc.buildAll().archive());
        assertThat(second.size(), is(TileService.BUILD_ZOOMS.length));
        assertThat(second.contains(sfTile(10).path() + ".json"), is(false));
        assertThat(Files.exists(dir.resolve(sfTile(10).path() + ".json")), is(false));

        TileService.BuildResult third = svc.buildAll();
        assertThat(third.tiles(), is(0));
        assertThat(archiveEntries(third.archive()).isEmpty(), is(true));
        assertThat(Files.exists(dir.resolve("10")), is(false));
        assertThat(Files.exists(dir.resolve(TileService.STAGING_DIR)), is(false));
    }

    @Test
    void failedBuildIsRecorded() throws Exception {
        when(jobRuns.startRun("tiles")).thenReturn(RUN);
        when(hazards.latestSince(any(), isNull())).thenThrow(new SQLException("boom"));

        assertThrows(SQLException.class, () -> service().buildAll());
        verify(jobRuns).finishRun(eq(RUN), eq(false), eq("fatal: boom"));
    }

    private static List<String> archiveEntries(Path archive) throws Exception {
        List<String> names = new ArrayList<>();
        try (InputStream in = Files.newInputStream(archive);
                TarArchiveInputStream tar = new TarArchiveInputStream(new GzipCompressorInputStream(in))) {
            TarArchiveEntry e;
            while ((e = tar.getNextEntry()) != null) {
                names.add(e.getName());
            }
        }
        return names;
    }
}
