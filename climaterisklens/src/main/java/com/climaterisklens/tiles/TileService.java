package com.climaterisklens.tiles;

import com.climaterisklens.db.HazardRepo;
import com.climaterisklens.db.HazardRepo.Prediction;
import com.climaterisklens.db.JobRunRepo;
import com.climaterisklens.geo.GridSystem;
import com.climaterisklens.geo.TileCoord;
import com.climaterisklens.geo.TileSystem;
import com.climaterisklens.geo.VectorTileBuilder;
import com.climaterisklens.geo.VectorTileBuilder.RiskPoint;
import com.climaterisklens.risk.HazardType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Risk tiles: built on demand for the API and pre-built to disk (plus a
 * tar.gz bundle) by the scheduled job.
 */
public class TileService {
    private static final Logger log = LoggerFactory.getLogger(TileService.class);

    public static final int[] BUILD_ZOOMS = { 8, 10, 12, 14 };
    public static final String ARCHIVE_NAME = "tiles.tar.gz";
    static final String STAGING_DIR = ".staging";
    static final Duration LOOKBACK = Duration.ofHours(24);
    static final int MAX_TILE_POINTS = 10_000;

    private final HazardRepo hazardRepo;
    private final JobRunRepo jobRunRepo;
    private final GridSystem grid;
    private final VectorTileBuilder builder;
    private final ObjectMapper om;
    private final Path tilesDir;
    private final Clock clock;

    public TileService(HazardRepo hazardRepo, JobRunRepo jobRunRepo, GridSystem grid, ObjectMapper om,
            Path tilesDir, Clock clock) {
        this.hazardRepo = hazardRepo;
        this.jobRunRepo = jobRunRepo;
        this.grid = grid;
        this.builder = new VectorTileBuilder(om);
        this.om = om;
        this.tilesDir = tilesDir;
        this.clock = clock;
    }

    /**
     * Builds one tile from the latest predictions. A null hazard means all
     * hazards; layer is "risk" or "uncertainty".
     */
    public ObjectNode tile(TileCoord coord, HazardType hazard, String layer) throws Exception {
        double[] b = TileSystem.bounds(coord);
        GridSystem.CellRange range = grid.cellRange(b[0], b[1], b[2], b[3]);
        List<Prediction> preds = hazardRepo.latestInRange(clock.instant().minus(LOOKBACK),
                hazard == null ? null : hazard.key(), range, MAX_TILE_POINTS);
        if (preds.size() >= MAX_TILE_POINTS) {
            log.warn("Tile {} hit the {} prediction limit; some cells are not drawn", coord.path(),
                    MAX_TILE_POINTS);
        }
        List<RiskPoint> points = toPoints(preds);
        if ("uncertainty".equals(layer))
            return builder.buildUncertaintyTile(coord, points);
        return builder.buildRiskTile(coord, points);
    }

    /**
     * Writes risk tiles for every build zoom under the tiles directory, then
     * bundles them into {@value #ARCHIVE_NAME}. Each build starts from an
     * empty staging tree, so tiles whose predictions have expired disappear
     * from both the directory and the archive.
     */
    public BuildResult buildAll() throws Exception {
        log.info("Starting job: buildTiles");
        UUID runId = jobRunRepo.startRun("tiles");
        MDC.put("runId", runId.toString());
        try {
            List<RiskPoint> points = toPoints(hazardRepo.latestSince(clock.instant().minus(LOOKBACK), null));
            Path staging = tilesDir.resolve(STAGING_DIR);
            deleteTree(staging);
            int written = 0;
            for (int z : BUILD_ZOOMS) {
                for (Map.Entry<TileCoord, List<RiskPoint>> e : groupByTile(points, z).entrySet()) {
                    writeTile(staging, e.getKey(), builder.buildRiskTile(e.getKey(), e.getValue()));
                    written++;
                }
            }
            Path archive = writeArchive(staging);
            publish(staging);
            BuildResult r = new BuildResult(points.size(), written, archive);
            jobRunRepo.finishRun(runId, true, "predictions=" + r.predictions() + " tiles=" + r.tiles());
            log.info("Finished buildTiles: predictions={} tiles={} archive={}", r.predictions(), r.tiles(),
                    archive);
            return r;
        } catch (Exception outer) {
            jobRunRepo.finishRun(runId, false, "fatal: " + outer.getMessage());
            throw outer;
        } finally {
            MDC.remove("runId");
        }
    }

    private List<RiskPoint> toPoints(List<Prediction> preds) {
        List<RiskPoint> out = new ArrayList<>(preds.size());
        for (Prediction p : preds) {
            double[] c;
            try {
                c = grid.gridCenter(p.gridId());
            } catch (IllegalArgumentException e) {
                log.debug("Skipping prediction with bad grid id {}", p.gridId());
                continue;
            }
            out.add(new RiskPoint(p.gridId(), p.type(), c[0], c[1], p.pRisk(), p.q10(), p.q50(), p.q90(),
                    p.modelVersion(), p.issuedAt()));
        }
        return out;
    }

    static Map<TileCoord, List<RiskPoint>> groupByTile(List<RiskPoint> points, int zoom) {
        Map<TileCoord, List<RiskPoint>> out = new LinkedHashMap<>();
        for (RiskPoint p : points) {
            TileCoord t = TileSystem.deg2num(p.lat(), p.lon(), zoom);
            out.computeIfAbsent(t, k -> new ArrayList<>()).add(p);
        }
        return out;
    }

    private void writeTile(Path root, TileCoord t, ObjectNode tile) throws IOException {
        Path file = root.resolve(String.valueOf(t.z())).resolve(String.valueOf(t.x()))
                .resolve(t.y() + ".json");
        Files.createDirectories(file.getParent());
        Files.write(file, om.writeValueAsBytes(tile));
    }

    /**
     * Packs the zoom directories of {@code root} into {@value #ARCHIVE_NAME}
     * in the tiles directory.
     */
    Path writeArchive(Path root) throws IOException {
        Files.createDirectories(tilesDir);
        Path target = tilesDir.resolve(ARCHIVE_NAME);
        Path tmp = tilesDir.resolve(ARCHIVE_NAME + ".tmp");
        List<Path> files = new ArrayList<>();
        for (int z : BUILD_ZOOMS) {
            Path zDir = root.resolve(String.valueOf(z));
            if (!Files.isDirectory(zDir))
                continue;
            try (Stream<Path> walk = Files.walk(zDir)) {
                walk.filter(Files::isRegularFile).sorted().forEach(files::add);
            }
        }
        try (OutputStream fos = Files.newOutputStream(tmp);
                OutputStream bos = new BufferedOutputStream(fos);
                GzipCompressorOutputStream gz = new GzipCompressorOutputStream(bos);
                TarArchiveOutputStream tar = new TarArchiveOutputStream(gz)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            for (Path f : files) {
                String name = root.relativize(f).toString().replace('\\', '/');
                TarArchiveEntry entry = new TarArchiveEntry(f.toFile(), name);
                tar.putArchiveEntry(entry);
                Files.copy(f, tar);
                tar.closeArchiveEntry();
            }
            tar.finish();
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    /**
     * Swaps the staged zoom directories in for the published ones.
     */
    private void publish(Path staging) throws IOException {
        for (int z : BUILD_ZOOMS) {
            Path live = tilesDir.resolve(String.valueOf(z));
            Path staged = staging.resolve(String.valueOf(z));
            deleteTree(live);
            if (Files.isDirectory(staged))
                Files.move(staged, live);
        }
        deleteTree(staging);
    }

    static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root))
            return;
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path p : paths) {
            Files.delete(p);
        }
    }

    public record BuildResult(int predictions, int tiles, Path archive) {
    }
}
