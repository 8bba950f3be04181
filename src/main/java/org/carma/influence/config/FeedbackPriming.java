package org.carma.influence.config;

import org.carma.influence.model.Role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Peer scores fed into every agent's accumulator before the first influence round.
 * One table for cooperative runs and one for adversarial runs, keyed by
 * receiver then peer.
 */
public final class FeedbackPriming {

    private final Map<Role, Map<Role, Double>> cooperative;
    private final Map<Role, Map<Role, Double>> adversarial;

    private FeedbackPriming(Map<Role, Map<Role, Double>> cooperative,
                            Map<Role, Map<Role, Double>> adversarial) {
        this.cooperative = freeze(cooperative);
        this.adversarial = freeze(adversarial);
    }

    /**
     * The scores used by the original calibration runs.
     */
    public static FeedbackPriming defaults() {
        Map<Role, Map<Role, Double>> coop = new EnumMap<>(Role.class);
        Map<Role, Map<Role, Double>> adv = new EnumMap<>(Role.class);

        put(coop, Role.PLANNER, Role.CRITIC, 0.9);
        put(coop, Role.PLANNER, Role.RESEARCHER, 0.8);
        put(coop, Role.RESEARCHER, Role.CRITIC, 0.7);
        put(coop, Role.RESEARCHER, Role.PLANNER, 0.85);
        put(coop, Role.CRITIC, Role.PLANNER, 0.8);
        put(coop, Role.CRITIC, Role.RESEARCHER, 0.75);

        put(adv, Role.PLANNER, Role.CRITIC, 0.1);
        put(adv, Role.PLANNER, Role.RESEARCHER, 0.8);
        put(adv, Role.RESEARCHER, Role.CRITIC, 0.1);
        put(adv, Role.RESEARCHER, Role.PLANNER, 0.85);
        put(adv, Role.CRITIC, Role.PLANNER, 0.4);
        put(adv, Role.CRITIC, Role.RESEARCHER, 0.4);

        return new FeedbackPriming(coop, adv);
    }

    /**
     * Copy of this table with one entry replaced.
     */
    public FeedbackPriming with(boolean adversarialRun, Role receiver, Role peer, double score) {
        if (receiver == peer) {
            throw new IllegalArgumentException("An agent does not score itself: " + receiver);
        }
        Map<Role, Map<Role, Double>> coop = thaw(cooperative);
        Map<Role, Map<Role, Double>> adv = thaw(adversarial);
        put(adversarialRun ? adv : coop, receiver, peer, score);
        return new FeedbackPriming(coop, adv);
    }

    /**
     * Peer scores the receiver starts the influence conversation with, in speaking order.
     */
    public Map<Role, Double> scoresFor(Role receiver, boolean adversarialRun) {
        Map<Role, Double> scores = (adversarialRun ? adversarial : cooperative).get(receiver);
        return scores != null ? scores : Collections.emptyMap();
    }

    public Map<Role, Map<Role, Double>> getCooperative() { return cooperative; }
    public Map<Role, Map<Role, Double>> getAdversarial() { return adversarial; }

    private static void put(Map<Role, Map<Role, Double>> table, Role receiver, Role peer, double score) {
        table.computeIfAbsent(receiver, r -> new EnumMap<>(Role.class)).put(peer, score);
    }

    private static Map<Role, Map<Role, Double>> freeze(Map<Role, Map<Role, Double>> table) {
        Map<Role, Map<Role, Double>> copy = new EnumMap<>(Role.class);
        for (Map.Entry<Role, Map<Role, Double>> entry : table.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableMap(new EnumMap<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Map<Role, Map<Role, Double>> thaw(Map<Role, Map<Role, Double>> table) {
        Map<Role, Map<Role, Double>> copy = new EnumMap<>(Role.class);
        for (Map.Entry<Role, Map<Role, Double>> entry : table.entrySet()) {
            copy.put(entry.getKey(), new EnumMap<>(entry.getValue()));
        }
        return copy;
    }

    @Override
    public String toString() {
        return String.format("FeedbackPriming[cooperative=%s, adversarial=%s]", cooperative, adversarial);
    }
}
