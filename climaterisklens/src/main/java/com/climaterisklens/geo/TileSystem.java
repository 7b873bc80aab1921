package com.climaterisklens.geo;

/**
 * Web Mercator tile math (OSM slippy-map scheme).
 */
public final class TileSystem {

    private TileSystem() {
    }

    /**
     * Tile containing a point at the given zoom. Latitudes beyond the Mercator
     * limit are clamped to the edge rows.
     */
    public static TileCoord deg2num(double lat, double lon, int zoom) {
        double n = Math.pow(2.0, zoom);
        double latRad = Math.toRadians(lat);
        int x = (int) Math.floor((lon + 180.0) / 360.0 * n);
        int y = (int) Math.floor((1.0 - asinh(Math.tan(latRad)) / Math.PI) / 2.0 * n);
        int max = (int) n - 1;
        return new TileCoord(zoom, clamp(x, 0, max), clamp(y, 0, max));
    }

    /**
     * Returns {minLon, minLat, maxLon, maxLat} of a tile.
     */
    public static double[] num2deg(int x, int y, int zoom) {
        double n = Math.pow(2.0, zoom);
        double minLon = x / n * 360.0 - 180.0;
        double maxLon = (x + 1) / n * 360.0 - 180.0;
        double minLat = Math.toDegrees(Math.atan(Math.sinh(Math.PI * (1 - 2.0 * (y + 1) / n))));
        double maxLat = Math.toDegrees(Math.atan(Math.sinh(Math.PI * (1 - 2.0 * y / n))));
        return new double[] { minLon, minLat, maxLon, maxLat };
    }

    public static double[] bounds(TileCoord coord) {
        return num2deg(coord.x(), coord.y(), coord.z());
    }

    private static double asinh(double v) {
        return Math.log(v + Math.sqrt(v * v + 1.0));
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
