package org.carma.influence.agent;

import org.carma.influence.model.Role;
import org.carma.influence.model.Turn;
import org.carma.influence.simulation.MetricsEngine;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Turns a peer's latest output into a feedback score in [0,1].
 *
 * - critic as peer: APPROVE 0.9, anything else 0.5; 0.1 in adversarial runs
 * - proposer scoring the other proposer: Jaccard of their feature sets
 * - critic scoring a proposer: share of the proposer's features on the whitelist,
 *   halved in adversarial runs
 */
public class PeerScorer {

    static final double APPROVE_SCORE = 0.9;
    static final double REVISE_SCORE = 0.5;
    static final double ADVERSARIAL_SCORE = 0.1;

    private final Set<String> whitelist;
    private final boolean adversarial;

    public PeerScorer(List<String> whitelist, boolean adversarial) {
        this.whitelist = Set.copyOf(whitelist);
        this.adversarial = adversarial;
    }

    /**
     * Score the peer's turn from the receiver's point of view. Empty when there is
     * nothing to compare.
     */
    public OptionalDouble score(Role receiver, Turn own, Turn peerTurn) {
        Role peer = peerTurn.getRole();
        if (peer == receiver) {
            throw new IllegalArgumentException("An agent does not score itself: " + receiver);
        }

        if (peer == Role.CRITIC) {
            if (adversarial) {
                return OptionalDouble.of(ADVERSARIAL_SCORE);
            }
            boolean approved = MetricsEngine.criticDecision(peerTurn.getPayload())
                .filter(MetricsEngine.APPROVE::equals)
                .isPresent();
            return OptionalDouble.of(approved ? APPROVE_SCORE : REVISE_SCORE);
        }

        Set<String> peerFeatures = MetricsEngine.features(peerTurn);
        if (receiver == Role.CRITIC) {
            if (peerFeatures.isEmpty()) {
                return OptionalDouble.of(0.0);
            }
            long allowed = peerFeatures.stream().filter(whitelist::contains).count();
            double compliance = (double) allowed / peerFeatures.size();
            return OptionalDouble.of(adversarial ? compliance / 2.0 : compliance);
        }

        double agreement = MetricsEngine.jaccard(MetricsEngine.features(own), peerFeatures);
        return Double.isNaN(agreement) ? OptionalDouble.empty() : OptionalDouble.of(agreement);
    }

    public boolean isAdversarial() {
        return adversarial;
    }
}
