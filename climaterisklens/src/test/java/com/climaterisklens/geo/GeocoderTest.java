package com.climaterisklens.geo;

import com.climaterisklens.cache.TtlCache;
import com.climaterisklens.geo.Geocoder.Place;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

class GeocoderTest {
    private final TtlCache<Place> cache = new TtlCache<>("geocode", 3600, true);
    private final Geocoder geocoder = new Geocoder(cache);

    @Test
    void knownCityMatchesCaseInsensitively() {
        Place p = geocoder.geocode("Downtown SEATTLE, WA");
        assertThat(p.lat(), is(47.6062));
        assertThat(p.lon(), is(-122.3321));
        assertThat(p.adminAreas(), is(List.of("Washington", "King County")));
    }

    @Test
    void unknownQueryFallsBackToSanFrancisco() {
        Place p = geocoder.geocode("Atlantis");
        assertThat(p.lat(), is(37.7749));
        assertThat(p.lon(), is(-122.4194));
    }

    @Test
    void repeatedQueryIsServedFromCache() {
        geocoder.geocode("Miami Beach");
        geocoder.geocode("Miami Beach");
        assertThat(cache.hits(), is(1L));
        assertThat(cache.size(), is(1));
    }
}
