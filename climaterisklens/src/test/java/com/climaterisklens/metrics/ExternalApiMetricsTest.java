package com.climaterisklens.metrics;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

class ExternalApiMetricsTest {

    @BeforeEach
    @AfterEach
    void reset() {
        ExternalApiMetrics.reset();
    }

    private static void record(String service, int ok, int failed) {
        for (int i = 0; i < ok; i++) {
            ExternalApiMetrics.record(service, true);
        }
        for (int i = 0; i < failed; i++) {
            ExternalApiMetrics.record(service, false);
        }
    }

    @Test
    void statusFollowsFailureShare() {
        record("webhook", 19, 1);
        record("smtp", 8, 2);
        record("geocoder", 1, 1);

        Map<String, ExternalApiMetrics.ServiceSnapshot> snap = ExternalApiMetrics.snapshot();
        assertThat(List.copyOf(snap.keySet()), is(List.of("geocoder", "smtp", "webhook")));

        assertThat(snap.get("webhook").calls(), is(20L));
        assertThat(snap.get("webhook").failures(), is(1L));
        assertThat(snap.get("webhook").failurePct(), is(5.0));
        assertThat(snap.get("webhook").status(), is("ok"));
        assertThat(snap.get("smtp").status(), is("degraded"));
        assertThat(snap.get("geocoder").status(), is("down"));
    }

    @Test
    void blankServiceIsIgnored() {
        ExternalApiMetrics.record(" ", false);
        ExternalApiMetrics.record(null, false);
        assertThat(ExternalApiMetrics.snapshot().isEmpty(), is(true));
        assertThat(ExternalApiMetrics.windowMinutes(), is(60));
    }
}
