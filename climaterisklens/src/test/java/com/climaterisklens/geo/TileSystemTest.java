package com.climaterisklens.geo;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;

class TileSystemTest {

    @Test
    void worldTileAtZoomZero() {
        assertThat(TileSystem.deg2num(0, 0, 0), is(new TileCoord(0, 0, 0)));
        double[] b = TileSystem.num2deg(0, 0, 0);
        assertThat(b[0], is(-180.0));
        assertThat(b[2], is(180.0));
        assertThat(b[3], closeTo(85.0511, 1e-4));
    }

    @Test
    void sanFranciscoAtZoomTen() {
        TileCoord c = TileSystem.deg2num(37.7749, -122.4194, 10);
        assertThat(c, is(new TileCoord(10, 163, 395)));

        double[] b = TileSystem.bounds(c);
        assertThat(-122.4194, greaterThan(b[0]));
        assertThat(-122.4194, lessThan(b[2]));
        assertThat(37.7749, greaterThan(b[1]));
        assertThat(37.7749, lessThan(b[3]));
    }

    @Test
    void polarLatitudesClampToEdgeRows() {
        assertThat(TileSystem.deg2num(89.9, 0, 4).y(), is(0));
        assertThat(TileSystem.deg2num(-89.9, 0, 4).y(), is(15));
        assertThat(TileSystem.deg2num(0, 180, 4).x(), is(15));
    }

    @Test
    void coordValidity() {
        assertThat(new TileCoord(0, 0, 0).isValid(), is(true));
        assertThat(new TileCoord(3, 7, 7).isValid(), is(true));
        assertThat(new TileCoord(3, 8, 0).isValid(), is(false));
        assertThat(new TileCoord(3, 0, -1).isValid(), is(false));
        assertThat(new TileCoord(23, 0, 0).isValid(), is(false));
        assertThat(new TileCoord(-1, 0, 0).isValid(), is(false));
        assertThat(new TileCoord(10, 163, 395).path(), is("10/163/395"));
    }
}
