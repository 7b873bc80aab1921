package com.climaterisklens.geo;

import com.climaterisklens.cache.TtlCache;
import com.climaterisklens.util.AsciiSanitizer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Demo geocoder over a fixed table of US cities. A query matches when it
 * contains a city name (case-insensitive); anything else resolves to San
 * Francisco.
 */
public final class Geocoder {
    private static final Map<String, Place> PLACES = new LinkedHashMap<>();

    static {
        PLACES.put("san francisco", new Place(37.7749, -122.4194, List.of("California", "San Francisco County")));
        PLACES.put("new york", new Place(40.7128, -74.0060, List.of("New York", "New York County")));
        PLACES.put("chicago", new Place(41.8781, -87.6298, List.of("Illinois", "Cook County")));
        PLACES.put("miami", new Place(25.7617, -80.1918, List.of("Florida", "Miami-Dade County")));
        PLACES.put("seattle", new Place(47.6062, -122.3321, List.of("Washington", "King County")));
    }

    private final TtlCache<Place> cache;

    public Geocoder(TtlCache<Place> cache) {
        this.cache = cache;
    }

    public Place geocode(String query) {
        String q = AsciiSanitizer.sanitizeText(query);
        String key = "geocode:" + q;
        Place cached = cache.get(key);
        if (cached != null)
            return cached;

        String lower = q.toLowerCase(Locale.ROOT);
        Place result = PLACES.get("san francisco");
        for (Map.Entry<String, Place> e : PLACES.entrySet()) {
            if (lower.contains(e.getKey())) {
                result = e.getValue();
                break;
            }
        }
        cache.put(key, result);
        return result;
    }

    public record Place(double lat, double lon, List<String> adminAreas) {
    }
}
