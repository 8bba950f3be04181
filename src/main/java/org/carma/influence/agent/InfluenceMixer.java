package org.carma.influence.agent;

import org.carma.influence.model.Role;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * λ-weighted mixing of an agent's own features with its peers' features.
 *
 * <pre>weight(f) = (1 − λ)·own(f) + λ·Σ_p ŝ_p·peer_p(f)</pre>
 *
 * where own(f) and peer_p(f) are 1 when the feature appears in the latest turn and
 * ŝ_p is the peer's EMA score normalized over the peers that proposed features. When
 * all those scores are zero the peers share the weight equally.
 */
public final class InfluenceMixer {

    public record Suggestion(String feature, double weight) {}

    private static final Comparator<Suggestion> BY_WEIGHT =
        Comparator.comparingDouble(Suggestion::weight).reversed()
            .thenComparing(Suggestion::feature);

    private InfluenceMixer() {}

    /**
     * Features ordered by mixed weight (ties by name), at most {@code limit} of them.
     * Features with zero weight are left out.
     */
    public static List<Suggestion> mix(Set<String> own, Map<Role, Set<String>> peerFeatures,
                                       Map<Role, Double> peerScores, double lambda, int limit) {
        Map<String, Double> weights = new TreeMap<>();
        for (String f : own) {
            weights.merge(f, 1.0 - lambda, Double::sum);
        }

        double total = 0.0;
        int contributing = 0;
        for (Map.Entry<Role, Set<String>> entry : peerFeatures.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                total += peerScores.getOrDefault(entry.getKey(), 0.0);
                contributing++;
            }
        }

        for (Map.Entry<Role, Set<String>> entry : peerFeatures.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            double share = total > 0.0
                ? peerScores.getOrDefault(entry.getKey(), 0.0) / total
                : 1.0 / contributing;
            for (String f : entry.getValue()) {
                weights.merge(f, lambda * share, Double::sum);
            }
        }

        List<Suggestion> suggestions = new ArrayList<>();
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (entry.getValue() > 0.0) {
                suggestions.add(new Suggestion(entry.getKey(), entry.getValue()));
            }
        }
        suggestions.sort(BY_WEIGHT);
        return suggestions.size() > limit ? new ArrayList<>(suggestions.subList(0, limit)) : suggestions;
    }
}
