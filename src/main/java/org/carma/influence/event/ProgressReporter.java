package org.carma.influence.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Logs sweep progress from harness events.
 */
public class ProgressReporter {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private final int logEvery;
    private final AtomicInteger finished = new AtomicInteger();
    private volatile int pending;

    public ProgressReporter() {
        this(1);
    }

    /**
     * @param logEvery log one line per this many finished grid points
     */
    public ProgressReporter(int logEvery) {
        this.logEvery = Math.max(1, logEvery);
    }

    public ProgressReporter attach(EventBus bus) {
        bus.subscribeAll(this::onEvent);
        return this;
    }

    void onEvent(HarnessEvent event) {
        if (event instanceof HarnessEvent.SweepStarted e) {
            pending = e.pending();
            log.info("Planned total combos: {} | already in ledger: {} | to run now: {} | workers: {}",
                e.planned(), e.alreadyPersisted(), e.pending(), e.workers());
        } else if (event instanceof HarnessEvent.GridPointCompleted e) {
            int n = finished.incrementAndGet();
            if (n % logEvery == 0) {
                log.info("[{}/{}] saved {} -> agr_inf={} r2a={} ({} ms)", n, pending, e.gridPoint(),
                    String.format(Locale.ROOT, "%.4f", e.agreementInfluence()),
                    e.roundsToApprovalInfluence(), e.durationMs());
            }
        } else if (event instanceof HarnessEvent.GridPointFailed e) {
            int n = finished.incrementAndGet();
            log.warn("[{}/{}] FAILED {}: {}", n, pending, e.gridPoint(), e.reason());
        } else if (event instanceof HarnessEvent.TimeBudgetExhausted e) {
            log.warn("Stopping dispatch: time budget {} exceeded after {}; {} grid points not dispatched",
                e.budget(), e.elapsed(), e.notDispatched());
        } else if (event instanceof HarnessEvent.SweepFinished e) {
            log.info("Sweep finished: {} completed, {} failed in {} s",
                e.completed(), e.failed(), e.elapsed().toSeconds());
        } else if (event instanceof HarnessEvent.GridPointDispatched e) {
            log.debug("Dispatched {} ({} of {})", e.gridPoint(), e.index() + 1, e.pending());
        }
    }

    public int getFinished() {
        return finished.get();
    }
}
