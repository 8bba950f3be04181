package org.carma.influence.runner;

import org.carma.influence.model.Turn;
import org.carma.influence.simulation.MetricsEngine;

/**
 * Decides whether a completed round ends the conversation: the critic approved, or
 * the planner and researcher feature sets agree at least as much as the threshold.
 */
public class TerminationPredicate {

    private final double agreementThreshold;

    public TerminationPredicate(double agreementThreshold) {
        this.agreementThreshold = agreementThreshold;
    }

    public boolean holds(Turn planner, Turn researcher, Turn critic) {
        if (isApproval(critic)) {
            return true;
        }
        double agreement = MetricsEngine.jaccard(MetricsEngine.features(planner), MetricsEngine.features(researcher));
        return !Double.isNaN(agreement) && agreement >= agreementThreshold;
    }

    public static boolean isApproval(Turn critic) {
        return critic != null && MetricsEngine.criticDecision(critic.getPayload())
            .filter(MetricsEngine.APPROVE::equals)
            .isPresent();
    }
}
