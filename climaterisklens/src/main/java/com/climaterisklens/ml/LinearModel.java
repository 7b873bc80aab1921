package com.climaterisklens.ml;

import java.util.List;

/**
 * Linear risk head with its output clipped to [0, 1].
 */
public record LinearModel(List<String> featureNames, double[] weights, double bias) {

    public double raw(double[] x) {
        double s = bias;
        for (int i = 0; i < weights.length; i++) {
            s += weights[i] * x[i];
        }
        return s;
    }

    public double predict(double[] x) {
        return DemoDataset.clip01(raw(x));
    }
}
