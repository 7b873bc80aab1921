package com.climaterisklens.geo;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-size square grid over EPSG:4326. Cell ids are
 * {@code "<latIndex>_<lonIndex>"} where each index is
 * {@code floor(coordinate / cellDegrees)}; the same cell size in degrees is
 * used for both axes.
 */
public final class GridSystem {
    private static final double KM_PER_DEGREE = 111.0;
    private static final double EARTH_RADIUS_KM = 6371.0;

    private final double gridSizeKm;
    private final double cellDeg;

    public GridSystem(double gridSizeKm) {
        if (gridSizeKm <= 0)
            throw new IllegalArgumentException("gridSizeKm must be positive: " + gridSizeKm);
        this.gridSizeKm = gridSizeKm;
        this.cellDeg = gridSizeKm / KM_PER_DEGREE;
    }

    public double gridSizeKm() {
        return gridSizeKm;
    }

    public double cellDegrees() {
        return cellDeg;
    }

    public String pointToGridId(double lat, double lon) {
        long gLat = (long) Math.floor(lat / cellDeg);
        long gLon = (long) Math.floor(lon / cellDeg);
        return gLat + "_" + gLon;
    }

    /**
     * Returns {minLon, minLat, maxLon, maxLat} of a cell.
     */
    public double[] gridIdToBounds(String gridId) {
        long[] idx = parse(gridId);
        double minLat = idx[0] * cellDeg;
        double minLon = idx[1] * cellDeg;
        return new double[] { minLon, minLat, minLon + cellDeg, minLat + cellDeg };
    }

    /**
     * Returns {lat, lon} of the cell center.
     */
    public double[] gridCenter(String gridId) {
        long[] idx = parse(gridId);
        return new double[] { (idx[0] + 0.5) * cellDeg, (idx[1] + 0.5) * cellDeg };
    }

    /**
     * Closed ring of the cell polygon as [lon, lat] pairs, GeoJSON order.
     */
    public double[][] gridRing(String gridId) {
        double[] b = gridIdToBounds(gridId);
        return new double[][] {
                { b[0], b[1] },
                { b[2], b[1] },
                { b[2], b[3] },
                { b[0], b[3] },
                { b[0], b[1] }
        };
    }

    /**
     * All cells within {@code radius} steps in each direction, center excluded.
     */
    public List<String> neighbors(String gridId, int radius) {
        long[] idx = parse(gridId);
        List<String> out = new ArrayList<>();
        for (int dLat = -radius; dLat <= radius; dLat++) {
            for (int dLon = -radius; dLon <= radius; dLon++) {
                if (dLat == 0 && dLon == 0)
                    continue;
                out.add((idx[0] + dLat) + "_" + (idx[1] + dLon));
            }
        }
        return out;
    }

    /**
     * True when the point lies strictly inside the cell.
     */
    public boolean contains(double lat, double lon, String gridId) {
        double[] b = gridIdToBounds(gridId);
        return lon > b[0] && lon < b[2] && lat > b[1] && lat < b[3];
    }

    /**
     * Cell ids covering a bbox, from floor(min) to ceil(max) on both axes.
     */
    public List<String> gridsForBounds(double minLon, double minLat, double maxLon, double maxLat) {
        long minGLat = (long) Math.floor(minLat / cellDeg);
        long maxGLat = (long) Math.ceil(maxLat / cellDeg);
        long minGLon = (long) Math.floor(minLon / cellDeg);
        long maxGLon = (long) Math.ceil(maxLon / cellDeg);
        List<String> out = new ArrayList<>();
        for (long gLat = minGLat; gLat <= maxGLat; gLat++) {
            for (long gLon = minGLon; gLon <= maxGLon; gLon++) {
                out.add(gLat + "_" + gLon);
            }
        }
        return out;
    }

    /**
     * Index range of the cells {@link #gridsForBounds} would return.
     */
    public CellRange cellRange(double minLon, double minLat, double maxLon, double maxLat) {
        return new CellRange((long) Math.floor(minLat / cellDeg), (long) Math.ceil(maxLat / cellDeg),
                (long) Math.floor(minLon / cellDeg), (long) Math.ceil(maxLon / cellDeg));
    }

    /**
     * Number of cells {@link #gridsForBounds} would return, without building
     * the list.
     */
    public long countForBounds(double minLon, double minLat, double maxLon, double maxLat) {
        long rows = (long) Math.ceil(maxLat / cellDeg) - (long) Math.floor(minLat / cellDeg) + 1;
        long cols = (long) Math.ceil(maxLon / cellDeg) - (long) Math.floor(minLon / cellDeg) + 1;
        return Math.max(0, rows) * Math.max(0, cols);
    }

    /**
     * Haversine distance in km between two cell centers.
     */
    public double distanceKm(String gridA, String gridB) {
        double[] a = gridCenter(gridA);
        double[] b = gridCenter(gridB);
        return haversineKm(a[0], a[1], b[0], b[1]);
    }

    static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                        * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return EARTH_RADIUS_KM * 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    }

    private static long[] parse(String gridId) {
        if (gridId == null)
            throw new IllegalArgumentException("Invalid grid ID format: null");
        String[] parts = gridId.split("_");
        if (parts.length != 2)
            throw new IllegalArgumentException("Invalid grid ID format: " + gridId);
        try {
            return new long[] { Long.parseLong(parts[0].trim()), Long.parseLong(parts[1].trim()) };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid grid ID format: " + gridId, e);
        }
    }

    /**
     * Inclusive row (latitude) and column (longitude) index bounds.
     */
    public record CellRange(long minLatIdx, long maxLatIdx, long minLonIdx, long maxLonIdx) {
    }
}
