package com.climaterisklens.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Success/failure counts of outbound calls (webhooks, SMTP) over a rolling
 * 60-minute window of per-minute buckets.
 */
public final class ExternalApiMetrics {
    private static final int WINDOW_MINUTES = 60;
    private static final Map<String, ServiceBuckets> SERVICES = new ConcurrentHashMap<>();

    private ExternalApiMetrics() {
    }

    public static void record(String service, boolean success) {
        if (service == null || service.isBlank())
            return;
        SERVICES.computeIfAbsent(service, k -> new ServiceBuckets()).record(success, System.currentTimeMillis());
    }

    /**
     * Snapshot per service, sorted by name.
     */
    public static Map<String, ServiceSnapshot> snapshot() {
        long now = System.currentTimeMillis();
        Map<String, ServiceSnapshot> out = new TreeMap<>();
        for (var e : SERVICES.entrySet()) {
            out.put(e.getKey(), e.getValue().snapshot(now));
        }
        return out;
    }

    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    static void reset() {
        SERVICES.clear();
    }

    /**
     * Call counts and derived health of one service. Status is no-data, ok,
     * degraded (at least 10% failures) or down (at least 50%).
     */
    public record ServiceSnapshot(long calls, long failures, double failurePct, String status) {
    }

    private static final class ServiceBuckets {
        private final long[] total = new long[WINDOW_MINUTES];
        private final long[] fail = new long[WINDOW_MINUTES];
        private final long[] minute = new long[WINDOW_MINUTES];

        private synchronized void record(boolean success, long nowMillis) {
            long nowMin = nowMillis / 60000L;
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                total[idx] = 0L;
                fail[idx] = 0L;
            }
            total[idx]++;
            if (!success)
                fail[idx]++;
        }

        private synchronized ServiceSnapshot snapshot(long nowMillis) {
            long nowMin = nowMillis / 60000L;
            long totalSum = 0L;
            long failSum = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                if (minute[i] == 0L || nowMin - minute[i] >= WINDOW_MINUTES)
                    continue;
                totalSum += total[i];
                failSum += fail[i];
            }
            double failurePct = totalSum == 0 ? 0.0 : (failSum * 100.0) / totalSum;
            String status;
            if (totalSum == 0)
                status = "no-data";
            else if (failurePct >= 50.0)
                status = "down";
            else if (failurePct >= 10.0)
                status = "degraded";
            else
                status = "ok";
            return new ServiceSnapshot(totalSum, failSum, failurePct, status);
        }
    }
}
