package org.carma.influence.model;

import java.util.Objects;

/**
 * One persisted record per grid point: configuration, the influence-condition μ of
 * every role and all metric columns.
 *
 * <p>Missing values are sentinels: {@code NaN} for the rate columns and {@code null}
 * for the integer columns.
 */
public record ResultRow(
        GridPoint gridPoint,
        double muPlanner,
        double muResearcher,
        double muCritic,
        Integer roundsToApprovalBaseline,
        Integer roundsToApprovalInfluence,
        double agreementRateBaseline,
        double agreementRateInfluence,
        Integer revisionDepth,
        double canonicalOverlapBaseline,
        double canonicalOverlapInfluence,
        double plannerSelfAgreement,
        double researcherSelfAgreement,
        RowStatus status,
        String failureReason
) {

    public ResultRow {
        Objects.requireNonNull(gridPoint, "gridPoint");
        Objects.requireNonNull(status, "status");
        if (status == RowStatus.OK) {
            failureReason = null;
        }
    }

    /**
     * A row carrying only sentinels, for a grid point whose evaluation failed outright.
     */
    public static ResultRow failed(GridPoint gridPoint, String reason) {
        return new ResultRow(gridPoint, Double.NaN, Double.NaN, Double.NaN,
            null, null, Double.NaN, Double.NaN, null,
            Double.NaN, Double.NaN, Double.NaN, Double.NaN,
            RowStatus.FAILED, reason != null ? reason : "unknown failure");
    }

    public boolean isFailed() {
        return status == RowStatus.FAILED;
    }

    /**
     * True when no metric column holds a sentinel.
     */
    public boolean isFullyPopulated() {
        return !Double.isNaN(muPlanner) && !Double.isNaN(muResearcher) && !Double.isNaN(muCritic)
            && roundsToApprovalBaseline != null && roundsToApprovalInfluence != null
            && !Double.isNaN(agreementRateBaseline) && !Double.isNaN(agreementRateInfluence)
            && revisionDepth != null
            && !Double.isNaN(canonicalOverlapBaseline) && !Double.isNaN(canonicalOverlapInfluence)
            && !Double.isNaN(plannerSelfAgreement) && !Double.isNaN(researcherSelfAgreement);
    }
}
