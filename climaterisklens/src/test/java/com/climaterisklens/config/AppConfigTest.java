package com.climaterisklens.config;

import com.climaterisklens.risk.HazardType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AppConfigTest {

    @Test
    void defaultsApply() {
        AppConfig cfg = ConfigFixtures.config();
        assertThat(cfg.apiPort(), is(8000));
        assertThat(cfg.jwtAlgorithm(), is("HS256"));
        assertThat(cfg.jwtExpireMinutes(), is(30));
        assertThat(cfg.otpTtlSeconds(), is(300));
        assertThat(cfg.gridSizeKm(), is(1.0));
        assertThat(cfg.demoMode(), is(true));
        assertThat(cfg.debug(), is(false));
        assertThat(cfg.alertsSchedule(), is(Duration.ofMinutes(5)));
        assertThat(cfg.cleanupSchedule(), is(Duration.ofDays(1)));
        assertThat(cfg.smtpConfigured(), is(false));
    }

    @Test
    void thresholdsPerHazard() {
        AppConfig cfg = ConfigFixtures.config("risk.threshold.smoke", "0.35");
        assertThat(cfg.thresholdFor(HazardType.FLOOD), is(0.3));
        assertThat(cfg.thresholdFor(HazardType.HEAT), is(0.4));
        assertThat(cfg.thresholdFor(HazardType.SMOKE), is(0.35));
        assertThat(cfg.thresholdFor(HazardType.PM25), is(0.6));
    }

    @Test
    void corsListAcceptsJsonOrCommaForm() {
        assertThat(AppConfig.parseList("[\"http://a\", \"http://b\"]"), is(List.of("http://a", "http://b")));
        assertThat(AppConfig.parseList("http://a, http://b,"), is(List.of("http://a", "http://b")));
        assertThat(AppConfig.parseList(" "), is(List.of()));
        assertThat(ConfigFixtures.config("cors.origins", "*").corsOrigins(), is(List.of("*")));
    }

    @Test
    void smtpNeedsHostAndUser() {
        assertThat(ConfigFixtures.config("smtp.host", "mail.local").smtpConfigured(), is(false));
        assertThat(ConfigFixtures.config("smtp.host", "mail.local", "smtp.user", "bot").smtpConfigured(), is(true));
    }

    @Test
    void missingSecretIsRejected() {
        Properties p = ConfigFixtures.props();
        p.remove("jwt.secret");
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> AppConfig.load(p));
        assertThat(e.getMessage(), containsString("JWT_SECRET"));
    }

    @Test
    void unsupportedAlgorithmIsRejected() {
        assertThrows(IllegalStateException.class, () -> ConfigFixtures.config("jwt.algorithm", "RS256"));
        assertThat(ConfigFixtures.config("jwt.algorithm", "hs512").jwtAlgorithm(), is("HS512"));
    }

    @Test
    void jobIntervalsMustBePositive() {
        assertThat(ConfigFixtures.config("schedule.alerts", "PT30S").alertsSchedule().toSeconds(), is(30L));

        IllegalStateException zero = assertThrows(IllegalStateException.class,
                () -> ConfigFixtures.config("schedule.tiles", "PT0S"));
        assertThat(zero.getMessage(), containsString("SCHED_TILES"));
        assertThrows(IllegalStateException.class, () -> ConfigFixtures.config("schedule.cleanup", "-PT5M"));
        assertThrows(IllegalStateException.class, () -> ConfigFixtures.config("schedule.alerts", "PT0.5S"));

        IllegalStateException garbage = assertThrows(IllegalStateException.class,
                () -> ConfigFixtures.config("schedule.inference", "every 5 minutes"));
        assertThat(garbage.getMessage(), containsString("SCHED_INFERENCE"));
    }
}
