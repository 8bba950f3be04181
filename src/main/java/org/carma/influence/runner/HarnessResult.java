package org.carma.influence.runner;

import org.carma.influence.model.GridPoint;
import org.carma.influence.simulation.SweepMetrics;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one harness invocation.
 *
 * @param planned grid points in the configured sweep
 * @param alreadyPersisted points found in the ledger at start
 * @param pending points that still needed a row
 * @param dispatched points handed to a worker before the budget ran out
 * @param failedKeys points persisted with status FAILED in this run
 * @param skippedByBudget pending points never dispatched
 */
public record HarnessResult(
        int planned,
        int alreadyPersisted,
        int pending,
        int dispatched,
        int completed,
        List<GridPoint> failedKeys,
        int skippedByBudget,
        Duration elapsed,
        boolean budgetExhausted,
        SweepMetrics metrics
) {
    public HarnessResult {
        failedKeys = List.copyOf(failedKeys);
    }

    public int failed() {
        return failedKeys.size();
    }

    public boolean isComplete() {
        return skippedByBudget == 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("HarnessResult[\n");
        sb.append("  Planned: ").append(planned).append("\n");
        sb.append("  Already persisted: ").append(alreadyPersisted).append("\n");
        sb.append("  Pending: ").append(pending).append("\n");
        sb.append("  Dispatched: ").append(dispatched).append("\n");
        sb.append("  Completed: ").append(completed).append("\n");
        sb.append("  Failed: ").append(failed()).append("\n");
        sb.append("  Skipped by budget: ").append(skippedByBudget).append("\n");
        sb.append("  Elapsed: ").append(elapsed.toMillis()).append(" ms\n");
        sb.append("]");
        return sb.toString();
    }
}
