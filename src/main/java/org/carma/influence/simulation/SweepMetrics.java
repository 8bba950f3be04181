package org.carma.influence.simulation;

import org.carma.influence.model.GridPoint;
import org.carma.influence.model.ResultRow;

import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tracks per-point outcomes over a sweep. Safe to record from concurrent workers.
 */
public class SweepMetrics {

    private final List<Long> durationHistory = new ArrayList<>();
    private final Map<GridPoint, String> failures = new LinkedHashMap<>();
    private final List<Double> agreementInfluenceHistory = new ArrayList<>();
    private int completed;
    private int approvedInfluence;
    private int repairedTurns;

    // ========================================================================
    // Recording
    // ========================================================================

    public synchronized void recordRow(ResultRow row, int repaired, long durationMs) {
        durationHistory.add(durationMs);
        repairedTurns += repaired;
        if (row.isFailed()) {
            failures.put(row.gridPoint(), row.failureReason());
            return;
        }
        completed++;
        if (row.roundsToApprovalInfluence() != null) {
            approvedInfluence++;
        }
        if (!Double.isNaN(row.agreementRateInfluence())) {
            agreementInfluenceHistory.add(row.agreementRateInfluence());
        }
    }

    // ========================================================================
    // Analysis
    // ========================================================================

    public synchronized int getCompleted() {
        return completed;
    }

    public synchronized int getFailed() {
        return failures.size();
    }

    public synchronized int getRepairedTurns() {
        return repairedTurns;
    }

    public synchronized int getApprovedInfluence() {
        return approvedInfluence;
    }

    public synchronized Map<GridPoint, String> getFailures() {
        return new LinkedHashMap<>(failures);
    }

    public synchronized DoubleSummaryStatistics getDurationStats() {
        return durationHistory.stream().mapToDouble(Long::doubleValue).summaryStatistics();
    }

    /**
     * Longest single grid point, the overrun bound past the time budget.
     */
    public synchronized long getMaxDurationMs() {
        return durationHistory.stream().mapToLong(Long::longValue).max().orElse(0);
    }

    public synchronized double getAverageAgreementInfluence() {
        return agreementInfluenceHistory.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
    }

    public synchronized String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Rows: %d OK, %d FAILED%n", completed, failures.size()));
        sb.append(String.format("Influence approvals: %d of %d%n", approvedInfluence, completed));
        double agreement = getAverageAgreementInfluence();
        sb.append(String.format("Mean influence agreement: %s%n",
            Double.isNaN(agreement) ? "n/a" : String.format(Locale.ROOT, "%.4f", agreement)));
        sb.append(String.format("Repaired turns: %d%n", repairedTurns));
        if (!durationHistory.isEmpty()) {
            DoubleSummaryStatistics stats = getDurationStats();
            sb.append(String.format("Point duration: avg %.0f ms, max %d ms%n", stats.getAverage(), getMaxDurationMs()));
        }
        return sb.toString();
    }
}
