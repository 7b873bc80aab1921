package com.climaterisklens.jobs;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

class JobSchedulerTest {

    @Test
    void safeTagsTheJobAndClearsAfterwards() {
        AtomicReference<String> seen = new AtomicReference<>();
        JobScheduler.safe("tiles", () -> seen.set(MDC.get("job"))).run();

        assertThat(seen.get(), is("tiles"));
        assertThat(MDC.get("job"), is(nullValue()));
    }

    @Test
    void safeSwallowsJobFailures() {
        Runnable r = JobScheduler.safe("alerts", () -> {
            throw new IllegalStateException("boom");
        });
        r.run();
        assertThat(MDC.get("job"), is(nullValue()));
    }

    @Test
    void scheduleSurvivesAnErrorFromTheJob() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch later = new CountDownLatch(3);
        ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor();
        try {
            exec.scheduleWithFixedDelay(JobScheduler.safe("inference", () -> {
                if (runs.incrementAndGet() == 1)
                    throw new StackOverflowError("first run");
                later.countDown();
            }), 0, 10, TimeUnit.MILLISECONDS);

            assertThat(later.await(5, TimeUnit.SECONDS), is(true));
            assertThat(runs.get() >= 4, is(true));
        } finally {
            exec.shutdownNow();
        }
    }
}
