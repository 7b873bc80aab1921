package com.climaterisklens.geo;

/**
 * Slippy-map tile address.
 */
public record TileCoord(int z, int x, int y) {

    public static final int MAX_ZOOM = 22;

    /**
     * True when z is within [0, 22] and x, y are within [0, 2^z).
     */
    public boolean isValid() {
        if (z < 0 || z > MAX_ZOOM)
            return false;
        long n = 1L << z;
        return x >= 0 && y >= 0 && x < n && y < n;
    }

    public String path() {
        return z + "/" + x + "/" + y;
    }
}
