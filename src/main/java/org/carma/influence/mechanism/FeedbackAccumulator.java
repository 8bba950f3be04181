package org.carma.influence.mechanism;

import org.carma.influence.model.Role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Exponential-moving-average peer scores held by one agent for the lifetime of one
 * conversation.
 *
 * <pre>new = β·score + (1 − β)·old</pre>
 *
 * On first contact with a peer, {@code old} is the configured prior, or the score
 * itself when no prior is configured. β = 1 always yields the latest score; β = 0
 * freezes the value at its initial state.
 */
public class FeedbackAccumulator {

    private final double beta;
    private final Double prior;
    private final Map<Role, Double> peerScores;

    /**
     * @param beta weight of the newest score, in [0,1]
     * @param prior initial score per peer, or {@code null} to seed with the first score seen
     */
    public FeedbackAccumulator(double beta, Double prior) {
        if (Double.isNaN(beta) || beta < 0.0 || beta > 1.0) {
            throw new IllegalArgumentException("beta must lie in [0,1]: " + beta);
        }
        this.beta = beta;
        this.prior = prior;
        this.peerScores = new EnumMap<>(Role.class);
    }

    /**
     * Fold a peer's score into the running average. Scores are clamped to [0,1].
     *
     * @return the updated score for that peer
     */
    public double receiveFeedback(Role peer, double score) {
        double clamped = Math.max(0.0, Math.min(1.0, score));
        Double old = peerScores.get(peer);
        if (old == null) {
            old = prior != null ? prior : clamped;
        }
        double updated = beta * clamped + (1.0 - beta) * old;
        peerScores.put(peer, updated);
        return updated;
    }

    /**
     * Mean of all peer scores, 0 before any feedback arrived.
     */
    public double mu() {
        if (peerScores.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double score : peerScores.values()) {
            sum += score;
        }
        return sum / peerScores.size();
    }

    public double getScore(Role peer) {
        return peerScores.getOrDefault(peer, 0.0);
    }

    public Map<Role, Double> getPeerScores() {
        return Collections.unmodifiableMap(new EnumMap<>(peerScores));
    }

    public double getBeta() {
        return beta;
    }

    @Override
    public String toString() {
        return String.format("FeedbackAccumulator[beta=%.2f, scores=%s]", beta, peerScores);
    }
}
