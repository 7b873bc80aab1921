package com.climaterisklens.ml;

import com.climaterisklens.risk.HazardType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

class TrainCliTest {

    @TempDir
    Path dir;

    @AfterEach
    void clearProperty() {
        System.clearProperty("ml.artifactPath");
    }

    @Test
    void helpAndUsageErrors() {
        assertThat(TrainCli.run(new String[] { "--help" }), is(TrainCli.EXIT_OK));
        assertThat(TrainCli.run(new String[] { "--bogus" }), is(TrainCli.EXIT_USAGE));
        assertThat(TrainCli.run(new String[] { "--demo", "--hazard", "quake" }), is(TrainCli.EXIT_USAGE));
        assertThat(TrainCli.run(new String[] { "--demo", "--epochs", "many" }), is(TrainCli.EXIT_USAGE));
        assertThat(TrainCli.run(new String[] { "--demo", "--epochs", "0" }), is(TrainCli.EXIT_USAGE));
        assertThat(TrainCli.run(new String[] { "--demo", "--seed" }), is(TrainCli.EXIT_USAGE));
    }

    @Test
    void realDataIsNotAvailable() {
        assertThat(TrainCli.run(new String[] { "--hazard", "heat" }), is(TrainCli.EXIT_NO_REAL_DATA));
    }

    @Test
    void demoRunWithoutRegistryWritesArtifact() throws Exception {
        System.setProperty("ml.artifactPath", dir.toString());

        int code = TrainCli.run(new String[] { "--demo", "--no-register", "--hazard", "pm25", "--epochs", "2" });

        assertThat(code, is(TrainCli.EXIT_OK));
        try (Stream<Path> files = Files.list(dir.resolve("pm25-head"))) {
            List<Path> written = files.toList();
            assertThat(written.size(), is(1));
            assertThat(written.get(0).getFileName().toString().startsWith("local-"), is(true));
        }
    }

    @Test
    void hazardArgument() {
        assertThat(TrainCli.hazards("all"), is(List.of(HazardType.values())));
        assertThat(TrainCli.hazards("Smoke"), is(List.of(HazardType.SMOKE)));
        assertThat(TrainCli.hazards("quake"), is(nullValue()));
    }
}
