package org.carma.influence.runner;

import org.carma.influence.config.HarnessConfig;
import org.carma.influence.config.HarnessConfigValidator;
import org.carma.influence.event.EventBus;
import org.carma.influence.event.HarnessEvent;
import org.carma.influence.ledger.Ledger;
import org.carma.influence.ledger.LedgerException;
import org.carma.influence.ledger.LedgerWriteException;
import org.carma.influence.ledger.LedgerWriter;
import org.carma.influence.mechanism.InferenceBackend;
import org.carma.influence.model.GridPoint;
import org.carma.influence.model.ResultRow;
import org.carma.influence.simulation.MetricsEngine;
import org.carma.influence.simulation.SweepMetrics;
import org.carma.influence.simulation.TagCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Runs a whole sweep against a resumable ledger.
 *
 * Key features:
 * - Validates the configuration before anything is dispatched
 * - Resumes: grid points already in the ledger are never run again
 * - Dispatches pending points in grid order to a bounded worker pool
 * - Stops dispatching once the time budget is exceeded; in-flight points finish
 * - Persists every evaluated point, FAILED ones included, through one writer
 *
 * Usage:
 * <pre>
 * GridEvaluationHarness harness = new GridEvaluationHarness(config, backend);
 * HarnessResult result = harness.run();
 * System.out.println(result);
 * </pre>
 */
public class GridEvaluationHarness {

    private static final Logger log = LoggerFactory.getLogger(GridEvaluationHarness.class);

    private final HarnessConfig config;
    private final InferenceBackend backend;
    private final EventBus eventBus;
    private final Clock clock;

    /**
     * Opens the append handle of a loaded ledger.
     */
    interface WriterOpener {
        LedgerWriter open(Ledger ledger) throws IOException;
    }

    private boolean requireCredential;
    private WriterOpener writerOpener = Ledger::openWriter;

    public GridEvaluationHarness(HarnessConfig config, InferenceBackend backend) {
        this(config, backend, new EventBus(false), Clock.systemUTC());
    }

    public GridEvaluationHarness(HarnessConfig config, InferenceBackend backend, EventBus eventBus, Clock clock) {
        this.config = config;
        this.backend = backend;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Whether a missing API key fails validation. Off for offline backends.
     */
    public GridEvaluationHarness requireCredential(boolean requireCredential) {
        this.requireCredential = requireCredential;
        return this;
    }

    GridEvaluationHarness writerOpener(WriterOpener writerOpener) {
        this.writerOpener = writerOpener;
        return this;
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    /**
     * Run every pending grid point, or as many as the time budget allows.
     *
     * @throws org.carma.influence.config.ConfigurationException if the configuration is invalid
     * @throws LedgerException if the ledger cannot be opened
     * @throws LedgerWriteException if a row cannot be persisted; rows written earlier stay intact
     */
    public HarnessResult run() throws LedgerException {
        Instant start = clock.instant();

        // 1. Validate
        HarnessConfigValidator.ValidationResult validation =
            new HarnessConfigValidator(requireCredential).validate(config).orThrow();
        validation.getWarnings().forEach(w -> log.warn("Configuration warning: {}", w));

        // 2. Load the ledger and compute pending work
        Ledger ledger = Ledger.open(config.getLedgerPath(), config.getExecution().retryFailed());
        List<GridPoint> planned = config.getGrid().enumerate();
        Set<GridPoint> persisted = ledger.persistedKeys();
        List<GridPoint> pending = planned.stream()
            .filter(p -> !persisted.contains(p))
            .collect(Collectors.toList());
        int alreadyPersisted = planned.size() - pending.size();
        int workers = config.getExecution().workers();

        eventBus.publish(new HarnessEvent.SweepStarted(clock.instant(),
            planned.size(), alreadyPersisted, pending.size(), workers));

        // 3. Dispatch
        GridPointEvaluator evaluator = new GridPointEvaluator(
            new ConversationRunner(config, backend),
            new MetricsEngine(TagCanonicalizer.forWhitelist(config.getProtocol().whitelist())));
        SweepMetrics metrics = new SweepMetrics();
        List<GridPoint> failedKeys = Collections.synchronizedList(new ArrayList<>());
        AtomicReference<LedgerWriteException> fatal = new AtomicReference<>();

        Optional<Duration> budget = config.getExecution().budget();
        boolean budgetExhausted = false;
        int dispatched = 0;

        LedgerWriter writer;
        try {
            writer = writerOpener.open(ledger);
        } catch (IOException e) {
            throw new LedgerException("Cannot open ledger " + ledger.getPath() + " for appending", e);
        }

        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        Semaphore slots = new Semaphore(workers);
        try {
            for (int i = 0; i < pending.size(); i++) {
                slots.acquire();
                if (fatal.get() != null) {
                    slots.release();
                    break;
                }
                Duration elapsed = Duration.between(start, clock.instant());
                if (budget.isPresent() && elapsed.compareTo(budget.get()) > 0) {
                    slots.release();
                    budgetExhausted = true;
                    eventBus.publish(new HarnessEvent.TimeBudgetExhausted(clock.instant(),
                        budget.get(), elapsed, pending.size() - i));
                    break;
                }

                GridPoint point = pending.get(i);
                eventBus.publish(new HarnessEvent.GridPointDispatched(clock.instant(), point, i, pending.size()));
                dispatched++;
                pool.execute(() -> {
                    try {
                        evaluateAndPersist(point, evaluator, writer, metrics, failedKeys, fatal);
                    } finally {
                        slots.release();
                    }
                });
            }

            // 4. Let in-flight points finish
            pool.shutdown();
            while (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                log.info("Waiting for in-flight grid points...");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted; abandoning in-flight grid points");
            pool.shutdownNow();
        } finally {
            try {
                writer.close();
            } catch (IOException e) {
                log.error("Cannot close ledger {}", ledger.getPath(), e);
            }
        }

        Duration elapsed = Duration.between(start, clock.instant());
        eventBus.publish(new HarnessEvent.SweepFinished(clock.instant(),
            metrics.getCompleted(), metrics.getFailed(), elapsed));

        if (fatal.get() != null) {
            throw fatal.get();
        }

        List<GridPoint> failed;
        synchronized (failedKeys) {
            failed = new ArrayList<>(failedKeys);
        }
        return new HarnessResult(planned.size(), alreadyPersisted, pending.size(), dispatched,
            metrics.getCompleted(), failed, pending.size() - dispatched, elapsed, budgetExhausted, metrics);
    }

    private void evaluateAndPersist(GridPoint point, GridPointEvaluator evaluator, LedgerWriter writer,
                                    SweepMetrics metrics, List<GridPoint> failedKeys,
                                    AtomicReference<LedgerWriteException> fatal) {
        if (fatal.get() != null) {
            return;
        }
        Instant started = clock.instant();
        GridPointEvaluator.Evaluation evaluation = evaluator.evaluate(point);
        ResultRow row = evaluation.row();

        try {
            if (!writer.append(row)) {
                return;
            }
        } catch (LedgerWriteException e) {
            log.error("Cannot persist row for {}; stopping dispatch", point, e);
            fatal.compareAndSet(null, e);
            return;
        }

        long durationMs = Duration.between(started, clock.instant()).toMillis();
        metrics.recordRow(row, evaluation.repairedTurns(), durationMs);
        if (row.isFailed()) {
            failedKeys.add(point);
            eventBus.publish(new HarnessEvent.GridPointFailed(clock.instant(), point, row.failureReason(), durationMs));
        } else {
            eventBus.publish(new HarnessEvent.GridPointCompleted(clock.instant(), point,
                row.agreementRateInfluence(), row.roundsToApprovalInfluence(), durationMs));
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "grid-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
