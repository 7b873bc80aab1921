package com.climaterisklens.risk;

import java.util.List;
import java.util.Locale;

/**
 * Hazards the platform forecasts, with the static driver weights shown next to a
 * risk answer.
 */
public enum HazardType {
    FLOOD("flood", List.of(
            new Driver("precipitation_24h", 0.35),
            new Driver("soil_moisture", 0.28),
            new Driver("elevation", 0.22),
            new Driver("distance_to_water", 0.15))),
    HEAT("heat", List.of(
            new Driver("air_temperature_max", 0.38),
            new Driver("humidity", 0.24),
            new Driver("urban_heat_index", 0.22),
            new Driver("wind_speed", 0.16))),
    SMOKE("smoke", List.of(
            new Driver("active_fire_distance", 0.41),
            new Driver("wind_direction", 0.27),
            new Driver("boundary_layer_height", 0.18),
            new Driver("humidity", 0.14))),
    PM25("pm25", List.of(
            new Driver("sensor_pm25_24h", 0.44),
            new Driver("active_fire_distance", 0.23),
            new Driver("wind_speed", 0.19),
            new Driver("boundary_layer_height", 0.14)));

    private final String key;
    private final List<Driver> drivers;

    HazardType(String key, List<Driver> drivers) {
        this.key = key;
        this.drivers = drivers;
    }

    /**
     * Lowercase wire name ("flood", "pm25", ...).
     */
    public String key() {
        return key;
    }

    public List<Driver> drivers() {
        return drivers;
    }

    /**
     * Resolves a wire name, or returns null when it is not a known hazard.
     */
    public static HazardType fromKey(String key) {
        if (key == null)
            return null;
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (HazardType h : values()) {
            if (h.key.equals(k))
                return h;
        }
        return null;
    }

    /**
     * One explanatory feature and its share of the risk score.
     */
    public record Driver(String feature, double contribution) {
    }
}
