package org.carma.influence.agent;

import org.carma.influence.agent.InfluenceMixer.Suggestion;
import org.carma.influence.model.Role;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class InfluenceMixerTest {

    private static Map<Role, Set<String>> peers(Role role, Set<String> features) {
        Map<Role, Set<String>> map = new EnumMap<>(Role.class);
        map.put(role, features);
        return map;
    }

    @Test
    void mixesOwnAndPeerFeaturesByLambda() {
        List<Suggestion> suggestions = InfluenceMixer.mix(Set.of("a", "b"),
            peers(Role.RESEARCHER, Set.of("b", "c")), Map.of(Role.RESEARCHER, 0.7), 0.5, 10);

        assertThat(suggestions).containsExactly(
            new Suggestion("b", 1.0),
            new Suggestion("a", 0.5),
            new Suggestion("c", 0.5));
    }

    @Test
    void peersShareWeightByNormalizedScore() {
        Map<Role, Set<String>> peerFeatures = peers(Role.RESEARCHER, Set.of("x"));
        peerFeatures.put(Role.CRITIC, Set.of("y"));

        List<Suggestion> suggestions = InfluenceMixer.mix(Set.of(), peerFeatures,
            Map.of(Role.RESEARCHER, 0.6, Role.CRITIC, 0.2), 1.0, 10);

        assertThat(suggestions).extracting(Suggestion::feature).containsExactly("x", "y");
        assertThat(suggestions.get(0).weight()).isCloseTo(0.75, within(1e-12));
        assertThat(suggestions.get(1).weight()).isCloseTo(0.25, within(1e-12));
    }

    @Test
    void zeroScoresShareEqually() {
        Map<Role, Set<String>> peerFeatures = peers(Role.RESEARCHER, Set.of("x"));
        peerFeatures.put(Role.CRITIC, Set.of("y"));

        List<Suggestion> suggestions = InfluenceMixer.mix(Set.of(), peerFeatures, Map.of(), 0.8, 10);

        assertThat(suggestions).containsExactly(new Suggestion("x", 0.4), new Suggestion("y", 0.4));
    }

    @Test
    void zeroLambdaDropsPeerOnlyFeatures() {
        List<Suggestion> suggestions = InfluenceMixer.mix(Set.of("a"),
            peers(Role.PLANNER, Set.of("z")), Map.of(Role.PLANNER, 0.9), 0.0, 10);

        assertThat(suggestions).containsExactly(new Suggestion("a", 1.0));
    }

    @Test
    void emptyPeerSetsDoNotDiluteTheShare() {
        Map<Role, Set<String>> peerFeatures = peers(Role.RESEARCHER, Set.of("x"));
        peerFeatures.put(Role.CRITIC, Set.of());

        List<Suggestion> suggestions = InfluenceMixer.mix(Set.of(), peerFeatures,
            Map.of(Role.RESEARCHER, 0.3, Role.CRITIC, 0.9), 1.0, 10);

        assertThat(suggestions).hasSize(1);
        assertThat(suggestions.get(0).weight()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void limitKeepsTheHeaviestFeatures() {
        List<Suggestion> suggestions = InfluenceMixer.mix(Set.of("a", "b", "c", "d"),
            peers(Role.RESEARCHER, Set.of("d")), Map.of(Role.RESEARCHER, 1.0), 0.5, 2);

        assertThat(suggestions).extracting(Suggestion::feature).containsExactly("d", "a");
    }
}
