package com.climaterisklens.ml;

import com.climaterisklens.risk.HazardType;

import java.util.List;
import java.util.Random;

/**
 * Synthetic training data for demo mode. Each sample is a 48-step sequence of
 * 8 physical channels, reduced to per-channel means; the target is a
 * hazard-specific linear mix of those means clipped to [0, 1].
 */
public final class DemoDataset {
    public static final int FEATURES = 8;
    public static final List<String> FEATURE_NAMES = List.of(
            "precipitation", "soil_moisture", "elevation", "distance_to_water",
            "upstream_flow", "temperature", "humidity", "wind_speed");

    private final double[][] x;
    private final double[] y;

    private DemoDataset(double[][] x, double[] y) {
        this.x = x;
        this.y = y;
    }

    public double[][] features() {
        return x;
    }

    public double[] targets() {
        return y;
    }

    public int size() {
        return y.length;
    }

    public static DemoDataset generate(HazardType hazard, int samples, int sequenceLength, long seed) {
        Random rnd = new Random(seed);
        double[][] x = new double[samples][];
        double[] y = new double[samples];
        for (int i = 0; i < samples; i++) {
            x[i] = sampleFeatures(rnd, sequenceLength);
            y[i] = clip01(target(hazard, x[i]));
        }
        return new DemoDataset(x, y);
    }

    /**
     * One feature vector (per-channel means over a generated sequence).
     */
    public static double[] sampleFeatures(Random rnd, int sequenceLength) {
        double[] sum = new double[FEATURES];
        double elevation = rnd.nextGaussian();
        double distanceToWater = exponential(rnd, 1.0);
        for (int t = 0; t < sequenceLength; t++) {
            double phase = sequenceLength == 1 ? 0.0 : (double) t / (sequenceLength - 1);
            sum[0] += rnd.nextGaussian() + Math.sin(phase * 4 * Math.PI) * 0.5;
            sum[1] += rnd.nextGaussian() + Math.cos(phase * 2 * Math.PI) * 0.3;
            sum[2] += elevation;
            sum[3] += distanceToWater;
            sum[4] += rnd.nextGaussian() + rnd.nextGaussian() * 0.5;
            sum[5] += rnd.nextGaussian() + Math.sin(phase * 2 * Math.PI) * 0.4;
            sum[6] += rnd.nextGaussian() + 0.7 + rnd.nextGaussian() * 0.2;
            sum[7] += rnd.nextGaussian() + exponential(rnd, 0.5);
        }
        double[] mean = new double[FEATURES];
        for (int f = 0; f < FEATURES; f++) {
            mean[f] = sum[f] / sequenceLength;
        }
        return mean;
    }

    /**
     * Unclipped ground-truth risk for a feature vector.
     */
    static double target(HazardType hazard, double[] f) {
        return switch (hazard) {
            case FLOOD -> 0.3 * f[0] + 0.2 * f[1] - 0.1 * f[2] - 0.1 * f[3];
            case HEAT -> 0.3 * f[5] + 0.4 * f[6] - 0.2 * f[7];
            case SMOKE -> 0.3 * f[7] + 0.2 * f[6] - 0.1 * f[2];
            case PM25 -> 0.25 * f[7] + 0.3 * f[6] + 0.2 * f[4] - 0.1 * f[3];
        };
    }

    static double clip01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static double exponential(Random rnd, double scale) {
        return -Math.log(1.0 - rnd.nextDouble()) * scale;
    }
}
