package com.climaterisklens.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Mini-batch gradient descent on MSE for {@link LinearModel}. Uses a seeded
 * 80/20 train/validation split and keeps the weights of the epoch with the
 * lowest validation loss.
 */
public final class DemoTrainer {
    private static final Logger log = LoggerFactory.getLogger(DemoTrainer.class);
    static final double VALIDATION_SHARE = 0.2;

    private DemoTrainer() {
    }

    public static Result train(DemoDataset data, TrainParams params) {
        int n = data.size();
        Random rnd = new Random(params.seed());
        int[] order = shuffled(n, rnd);
        int valCount = (int) Math.round(n * VALIDATION_SHARE);
        int trainCount = n - valCount;
        int[] train = Arrays.copyOfRange(order, 0, trainCount);
        int[] val = Arrays.copyOfRange(order, trainCount, n);

        double[][] x = data.features();
        double[] y = data.targets();
        int dims = DemoDataset.FEATURES;
        double[] w = new double[dims];
        double b = 0.5;

        double[] bestW = w.clone();
        double bestB = b;
        double bestVal = Double.POSITIVE_INFINITY;
        List<EpochMetrics> history = new ArrayList<>();

        int batchSize = Math.max(1, params.batchSize());
        for (int epoch = 0; epoch < params.epochs(); epoch++) {
            shuffleInPlace(train, rnd);
            for (int start = 0; start < train.length; start += batchSize) {
                int end = Math.min(train.length, start + batchSize);
                double[] gw = new double[dims];
                double gb = 0.0;
                for (int k = start; k < end; k++) {
                    int i = train[k];
                    double raw = dot(w, x[i]) + b;
                    if (raw < 0.0 || raw > 1.0)
                        continue;
                    double err = raw - y[i];
                    for (int d = 0; d < dims; d++) {
                        gw[d] += err * x[i][d];
                    }
                    gb += err;
                }
                double scale = 2.0 * params.learningRate() / (end - start);
                for (int d = 0; d < dims; d++) {
                    w[d] -= scale * gw[d];
                }
                b -= scale * gb;
            }

            LinearModel current = new LinearModel(DemoDataset.FEATURE_NAMES, w.clone(), b);
            double[] tr = evaluate(current, x, y, train);
            double[] va = evaluate(current, x, y, val);
            history.add(new EpochMetrics(epoch, tr[0], va[0], tr[1], va[1]));
            if (va[0] < bestVal) {
                bestVal = va[0];
                bestW = w.clone();
                bestB = b;
            }
            if (epoch % 10 == 0) {
                log.info("Epoch {}: train loss {} val loss {}", epoch, String.format("%.4f", tr[0]),
                        String.format("%.4f", va[0]));
            }
        }

        LinearModel best = new LinearModel(DemoDataset.FEATURE_NAMES, bestW, bestB);
        return new Result(best, history, bestVal, trainCount, valCount);
    }

    /**
     * Returns {mse, mae} of the model over the given rows.
     */
    static double[] evaluate(LinearModel m, double[][] x, double[] y, int[] rows) {
        if (rows.length == 0)
            return new double[] { 0.0, 0.0 };
        double se = 0.0;
        double ae = 0.0;
        for (int i : rows) {
            double err = m.predict(x[i]) - y[i];
            se += err * err;
            ae += Math.abs(err);
        }
        return new double[] { se / rows.length, ae / rows.length };
    }

    private static double dot(double[] w, double[] x) {
        double s = 0.0;
        for (int i = 0; i < w.length; i++) {
            s += w[i] * x[i];
        }
        return s;
    }

    private static int[] shuffled(int n, Random rnd) {
        int[] idx = new int[n];
        for (int i = 0; i < n; i++) {
            idx[i] = i;
        }
        shuffleInPlace(idx, rnd);
        return idx;
    }

    private static void shuffleInPlace(int[] a, Random rnd) {
        for (int i = a.length - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int t = a[i];
            a[i] = a[j];
            a[j] = t;
        }
    }

    public record EpochMetrics(int epoch, double trainLoss, double valLoss, double trainMae, double valMae) {
    }

    public record Result(LinearModel model, List<EpochMetrics> history, double bestValLoss, int trainSize,
            int valSize) {

        public EpochMetrics last() {
            return history.isEmpty() ? null : history.get(history.size() - 1);
        }
    }
}
