package org.carma.influence;

import org.carma.influence.config.ConfigurationException;
import org.carma.influence.config.HarnessConfig;
import org.carma.influence.config.HarnessConfigLoader;
import org.carma.influence.event.EventBus;
import org.carma.influence.event.ProgressReporter;
import org.carma.influence.ledger.LedgerException;
import org.carma.influence.ledger.LedgerWriteException;
import org.carma.influence.mechanism.InferenceBackend;
import org.carma.influence.mechanism.MockInferenceBackend;
import org.carma.influence.mechanism.OpenAiInferenceBackend;
import org.carma.influence.mechanism.RetryingInferenceBackend;
import org.carma.influence.model.GridPoint;
import org.carma.influence.runner.GridEvaluationHarness;
import org.carma.influence.runner.HarnessResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;

/**
 * Runs a mutual-influence sweep from a YAML configuration.
 *
 * The credential is read from {@code OPENAI_API_KEY} and an optional model override
 * from {@code OPENAI_MODEL_NAME}. With {@code --dry-run} the sweep uses the offline
 * mock backend and needs no credential.
 *
 * Usage:
 *   mvn exec:java -Dexec.mainClass=org.carma.influence.EvaluationMain
 *
 * Or with a specific configuration:
 *   mvn exec:java -Dexec.mainClass=org.carma.influence.EvaluationMain -Dexec.args="config/grid.yaml --dry-run"
 *
 * Exits 0 when the sweep ran, even if some grid points were recorded as FAILED, and 1
 * on configuration or ledger failures.
 */
public class EvaluationMain {

    private static final String SEP = "=".repeat(70);
    private static final String SUBSEP = "-".repeat(50);
    private static final String DEFAULT_CONFIG = "config/grid.yaml";

    public static void main(String[] args) {
        System.exit(run(args, System.getenv()));
    }

    static int run(String[] args, Map<String, String> env) {
        boolean dryRun = false;
        Path configPath = null;
        for (String arg : args) {
            if (arg.equals("--dry-run")) {
                dryRun = true;
            } else if (arg.equals("--help") || arg.equals("-h")) {
                printUsage();
                return 0;
            } else {
                configPath = Paths.get(arg);
            }
        }

        System.out.println(SEP);
        System.out.println("MUTUAL-INFLUENCE EVALUATION SWEEP" + (dryRun ? " (DRY RUN)" : ""));
        System.out.println(SEP);
        System.out.println();

        InferenceBackend backend = null;
        try {
            HarnessConfig config = loadConfig(configPath != null ? configPath : findConfig(), env);
            System.out.println("Configuration: " + config);
            System.out.println("Grid: " + config.getGrid());
            System.out.println();

            backend = dryRun
                ? new MockInferenceBackend(config.getProtocol().whitelist())
                : createBackend(config);

            EventBus bus = new EventBus(false);
            new ProgressReporter().attach(bus);
            HarnessResult result = new GridEvaluationHarness(config, backend, bus, Clock.systemUTC())
                .requireCredential(!dryRun)
                .run();

            printSummary(config, result);
            return 0;
        } catch (ConfigurationException e) {
            System.err.println("CONFIGURATION ERROR: " + e.getMessage());
            return 1;
        } catch (LedgerException | LedgerWriteException e) {
            System.err.println("LEDGER ERROR: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 1;
        } finally {
            if (backend != null) {
                backend.shutdown();
            }
        }
    }

    static HarnessConfig loadConfig(Path configPath, Map<String, String> env) throws IOException {
        HarnessConfigLoader loader = new HarnessConfigLoader();
        HarnessConfig.Builder builder;
        if (configPath == null) {
            System.out.println("No configuration file found; using defaults.");
            builder = HarnessConfig.builder();
        } else {
            System.out.println("Loading configuration from: " + configPath);
            builder = loader.load(configPath);
        }
        return builder
            .apiKey(env.get("OPENAI_API_KEY"))
            .model(env.get("OPENAI_MODEL_NAME"))
            .build();
    }

    private static InferenceBackend createBackend(HarnessConfig config) {
        if (!config.getInference().hasCredential()) {
            throw new ConfigurationException("OPENAI_API_KEY is not set (use --dry-run to run offline)");
        }
        OpenAiInferenceBackend client = OpenAiInferenceBackend.builder()
            .fromConfig(config.getInference())
            .build();
        return new RetryingInferenceBackend(client, config.getInference());
    }

    private static void printSummary(HarnessConfig config, HarnessResult result) {
        System.out.println();
        System.out.println(SEP);
        System.out.println("SWEEP SUMMARY");
        System.out.println(SEP);
        System.out.println(result);
        System.out.print(result.metrics().summary());
        if (result.budgetExhausted()) {
            System.out.println("Time budget exhausted: " + result.skippedByBudget()
                + " grid points left for the next run.");
        }
        if (result.failed() > 0) {
            System.out.println(SUBSEP);
            System.out.println("Failed grid points (see failure_reason in the ledger):");
            for (GridPoint point : result.failedKeys()) {
                System.out.println("  - " + point);
            }
        }
        System.out.println(SUBSEP);
        System.out.println("Ledger: " + config.getLedgerPath().toAbsolutePath());
    }

    /**
     * Find the default configuration file.
     */
    private static Path findConfig() {
        Path current = Paths.get(DEFAULT_CONFIG);
        if (Files.exists(current)) {
            return current;
        }

        // Parent directory, for runs from target/
        current = Paths.get("..").resolve(DEFAULT_CONFIG);
        if (Files.exists(current)) {
            return current;
        }

        String userDir = System.getProperty("user.dir");
        if (userDir != null) {
            current = Paths.get(userDir, DEFAULT_CONFIG);
            if (Files.exists(current)) {
                return current;
            }
        }
        return null;
    }

    private static void printUsage() {
        System.out.println("Usage:");
        System.out.println("  EvaluationMain                      - Run config/grid.yaml (or defaults)");
        System.out.println("  EvaluationMain <config.yaml>        - Run a specific configuration");
        System.out.println("  EvaluationMain [config] --dry-run   - Run offline against the mock backend");
        System.out.println();
        System.out.println("Environment:");
        System.out.println("  OPENAI_API_KEY      credential (required unless --dry-run)");
        System.out.println("  OPENAI_MODEL_NAME   model override (default " + HarnessConfig.DEFAULT_MODEL + ")");
    }
}
