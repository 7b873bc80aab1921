package com.climaterisklens.metrics;

import java.util.Arrays;

/**
 * Rolling sample of request latencies (last N observations) with nearest-rank
 * percentiles.
 */
public final class RequestMetrics {
    private final long[] samples;
    private int next;
    private int count;

    public RequestMetrics(int capacity) {
        if (capacity <= 0)
            throw new IllegalArgumentException("capacity must be positive");
        this.samples = new long[capacity];
    }

    public synchronized void record(long millis) {
        samples[next] = Math.max(0L, millis);
        next = (next + 1) % samples.length;
        if (count < samples.length)
            count++;
    }

    public synchronized int count() {
        return count;
    }

    /**
     * Nearest-rank percentile (0 &lt; p &lt;= 100) in ms; 0 with no samples.
     */
    public synchronized long percentile(double p) {
        if (count == 0)
            return 0L;
        long[] sorted = Arrays.copyOf(samples, count);
        Arrays.sort(sorted);
        int rank = (int) Math.ceil(p / 100.0 * count);
        rank = Math.max(1, Math.min(count, rank));
        return sorted[rank - 1];
    }
}
