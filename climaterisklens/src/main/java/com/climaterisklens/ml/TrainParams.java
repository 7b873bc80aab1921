package com.climaterisklens.ml;

/**
 * Hyperparameters for a demo training run.
 */
public record TrainParams(int epochs, int batchSize, double learningRate, long seed) {

    public static TrainParams defaults() {
        return new TrainParams(100, 32, 0.001, 42L);
    }
}
