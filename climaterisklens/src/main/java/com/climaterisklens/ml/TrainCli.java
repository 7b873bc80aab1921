package com.climaterisklens.ml;

import com.climaterisklens.config.AppConfig;
import com.climaterisklens.db.Database;
import com.climaterisklens.db.ModelRegistryRepo;
import com.climaterisklens.risk.HazardType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point for demo model training.
 *
 * <pre>
 * TrainCli --demo [--hazard flood|heat|smoke|pm25|all] [--epochs N] [--batch-size N]
 *          [--learning-rate F] [--seed N] [--no-register]
 * </pre>
 */
public final class TrainCli {
    private static final Logger log = LoggerFactory.getLogger(TrainCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_NO_REAL_DATA = 2;
    static final int EXIT_FAILED = 3;

    private TrainCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        String hazard = "flood";
        boolean demo = false;
        boolean register = true;
        TrainParams d = TrainParams.defaults();
        int epochs = d.epochs();
        int batchSize = d.batchSize();
        double learningRate = d.learningRate();
        long seed = d.seed();

        try {
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "--help", "-h" -> {
                        printUsage();
                        return EXIT_OK;
                    }
                    case "--demo" -> demo = true;
                    case "--no-register" -> register = false;
                    case "--hazard" -> hazard = value(args, ++i, a);
                    case "--epochs" -> epochs = Integer.parseInt(value(args, ++i, a));
                    case "--batch-size" -> batchSize = Integer.parseInt(value(args, ++i, a));
                    case "--learning-rate" -> learningRate = Double.parseDouble(value(args, ++i, a));
                    case "--seed" -> seed = Long.parseLong(value(args, ++i, a));
                    default -> {
                        log.error("Unknown argument: {}", a);
                        printUsage();
                        return EXIT_USAGE;
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            log.error("Bad arguments: {}", e.getMessage());
            return EXIT_USAGE;
        }

        List<HazardType> hazards = hazards(hazard);
        if (hazards == null) {
            log.error("Unknown hazard: {}", hazard);
            return EXIT_USAGE;
        }
        if (epochs < 1 || batchSize < 1 || learningRate <= 0) {
            log.error("epochs and batch size must be >= 1 and learning rate > 0");
            return EXIT_USAGE;
        }
        if (!demo) {
            log.error("Real data loading is not available; run with --demo to train on synthetic data");
            return EXIT_NO_REAL_DATA;
        }

        TrainParams params = new TrainParams(epochs, batchSize, learningRate, seed);
        ObjectMapper om = new ObjectMapper();
        HikariDataSource ds = null;
        try {
            TrainingService training;
            if (register) {
                AppConfig cfg = AppConfig.load();
                ds = Database.createJobsDataSource(cfg);
                training = new TrainingService(new ModelRegistryRepo(ds), Path.of(cfg.mlArtifactPath()), om,
                        Clock.systemUTC());
            } else {
                training = new TrainingService(null, artifactRoot(), om, Clock.systemUTC());
            }
            for (HazardType h : hazards) {
                TrainingService.Outcome o = training.train(h, params, register);
                log.info("{} v{} -> {} (registered={})", o.modelName(), o.version(), o.artifact(), o.registered());
            }
            return EXIT_OK;
        } catch (Exception e) {
            log.error("Training failed", e);
            return EXIT_FAILED;
        } finally {
            if (ds != null)
                ds.close();
        }
    }

    /**
     * Parses a hazard argument; "all" expands to every hazard. Null when
     * unknown.
     */
    static List<HazardType> hazards(String arg) {
        if ("all".equalsIgnoreCase(arg))
            return List.of(HazardType.values());
        HazardType h = HazardType.fromKey(arg);
        if (h == null)
            return null;
        List<HazardType> out = new ArrayList<>();
        out.add(h);
        return out;
    }

    static Path artifactRoot() {
        String v = System.getenv("ML_ARTIFACT_PATH");
        if (v == null || v.isBlank())
            v = System.getProperty("ml.artifactPath");
        if (v == null || v.isBlank())
            v = "./ml-artifacts";
        return Path.of(v);
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length)
            throw new IllegalArgumentException(flag + " needs a value");
        return args[i];
    }

    private static void printUsage() {
        System.out.println("""
                Usage: TrainCli --demo [options]
                  --hazard H           flood|heat|smoke|pm25|all (default flood)
                  --demo               train on synthetic data
                  --epochs N           default 100
                  --batch-size N       default 32
                  --learning-rate F    default 0.001
                  --seed N             default 42
                  --no-register        write the artifact only
                  --help               show this message""");
    }
}
