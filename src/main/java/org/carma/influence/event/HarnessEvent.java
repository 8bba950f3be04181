package org.carma.influence.event;

import org.carma.influence.model.GridPoint;

import java.time.Duration;
import java.time.Instant;

/**
 * Base interface for all sweep events.
 * Events provide an audit trail of a sweep and drive progress reporting.
 */
public sealed interface HarnessEvent permits
        HarnessEvent.SweepStarted,
        HarnessEvent.GridPointDispatched,
        HarnessEvent.GridPointCompleted,
        HarnessEvent.GridPointFailed,
        HarnessEvent.TimeBudgetExhausted,
        HarnessEvent.SweepFinished {

    Instant timestamp();
    String eventType();

    // ========================================================================
    // Event Types
    // ========================================================================

    /**
     * Ledger loaded and pending work computed; dispatch is about to begin.
     */
    record SweepStarted(
            Instant timestamp,
            int planned,
            int alreadyPersisted,
            int pending,
            int workers
    ) implements HarnessEvent {
        public String eventType() { return "SWEEP_STARTED"; }
    }

    /**
     * A grid point was handed to a worker.
     */
    record GridPointDispatched(
            Instant timestamp,
            GridPoint gridPoint,
            int index,
            int pending
    ) implements HarnessEvent {
        public String eventType() { return "GRID_POINT_DISPATCHED"; }
    }

    /**
     * A grid point's row was persisted with status OK.
     */
    record GridPointCompleted(
            Instant timestamp,
            GridPoint gridPoint,
            double agreementInfluence,
            Integer roundsToApprovalInfluence,
            long durationMs
    ) implements HarnessEvent {
        public String eventType() { return "GRID_POINT_COMPLETED"; }
    }

    /**
     * A grid point's row was persisted with status FAILED.
     */
    record GridPointFailed(
            Instant timestamp,
            GridPoint gridPoint,
            String reason,
            long durationMs
    ) implements HarnessEvent {
        public String eventType() { return "GRID_POINT_FAILED"; }
    }

    /**
     * The time budget ran out; no further grid points are dispatched.
     */
    record TimeBudgetExhausted(
            Instant timestamp,
            Duration budget,
            Duration elapsed,
            int notDispatched
    ) implements HarnessEvent {
        public String eventType() { return "TIME_BUDGET_EXHAUSTED"; }
    }

    /**
     * All dispatched work has finished.
     */
    record SweepFinished(
            Instant timestamp,
            int completed,
            int failed,
            Duration elapsed
    ) implements HarnessEvent {
        public String eventType() { return "SWEEP_FINISHED"; }
    }
}
