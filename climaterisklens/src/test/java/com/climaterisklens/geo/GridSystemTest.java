package com.climaterisklens.geo;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GridSystemTest {
    private final GridSystem grid = new GridSystem(1.0);

    @Test
    void pointMapsToFlooredIndices() {
        assertThat(grid.pointToGridId(37.7749, -122.4194), is("4193_-13589"));
        assertThat(grid.pointToGridId(0.0001, 0.0001), is("0_0"));
        assertThat(grid.pointToGridId(-0.0001, -0.0001), is("-1_-1"));
    }

    @Test
    void cellContainsItsPointAndCenter() {
        String id = grid.pointToGridId(37.7749, -122.4194);
        assertThat(grid.contains(37.7749, -122.4194, id), is(true));

        double[] center = grid.gridCenter(id);
        assertThat(grid.pointToGridId(center[0], center[1]), is(id));

        double[] b = grid.gridIdToBounds(id);
        assertThat(b[2] - b[0], closeTo(1.0 / 111.0, 1e-12));
        assertThat(grid.contains(b[1], b[0], id), is(false));
    }

    @Test
    void ringIsClosed() {
        double[][] ring = grid.gridRing("10_20");
        assertThat(ring.length, is(5));
        assertThat(ring[0][0], is(ring[4][0]));
        assertThat(ring[0][1], is(ring[4][1]));
    }

    @Test
    void neighborsExcludeCenter() {
        List<String> one = grid.neighbors("5_5", 1);
        assertThat(one.size(), is(8));
        assertThat(one, not(hasItem("5_5")));
        assertThat(one, hasItem("4_4"));
        assertThat(one, hasItem("6_6"));

        List<String> two = grid.neighbors("5_5", 2);
        assertThat(two.size(), is(24));
        assertThat(new HashSet<>(two).size(), is(24));
    }

    @Test
    void boundsCountMatchesList() {
        List<String> ids = grid.gridsForBounds(-122.45, 37.75, -122.40, 37.80);
        assertThat((long) ids.size(), is(grid.countForBounds(-122.45, 37.75, -122.40, 37.80)));
        assertThat(ids, hasItem(grid.pointToGridId(37.7749, -122.4194)));
    }

    @Test
    void adjacentCellsAreAboutOneCellApart() {
        assertThat(grid.distanceKm("0_0", "1_0"), closeTo(1.0, 0.01));
        assertThat(grid.distanceKm("0_0", "0_0"), is(0.0));
    }

    @Test
    void malformedIdsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> grid.gridCenter(null));
        assertThrows(IllegalArgumentException.class, () -> grid.gridCenter("abc"));
        assertThrows(IllegalArgumentException.class, () -> grid.gridCenter("1_2_3"));
        assertThrows(IllegalArgumentException.class, () -> grid.gridIdToBounds("x_1"));
        assertThrows(IllegalArgumentException.class, () -> new GridSystem(0));
    }
}
