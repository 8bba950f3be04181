package org.carma.influence.agent;

import org.carma.influence.config.HarnessConfig;
import org.carma.influence.model.Role;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.carma.influence.support.TestFixtures.critic;
import static org.carma.influence.support.TestFixtures.planner;
import static org.carma.influence.support.TestFixtures.researcher;

class PeerScorerTest {

    private final PeerScorer cooperative = new PeerScorer(HarnessConfig.DEFAULT_WHITELIST, false);
    private final PeerScorer adversarial = new PeerScorer(HarnessConfig.DEFAULT_WHITELIST, true);

    @Test
    void criticDecisionScoresProposers() {
        assertThat(cooperative.score(Role.PLANNER, planner(1, "rate"), critic(1, "APPROVE")))
            .hasValue(0.9);
        assertThat(cooperative.score(Role.PLANNER, planner(1, "rate"), critic(1, "REVISE")))
            .hasValue(0.5);
        assertThat(cooperative.score(Role.RESEARCHER, researcher(1, "rate"), critic(1, "maybe")))
            .hasValue(0.5);
    }

    @Test
    void adversarialCriticAlwaysScoresLow() {
        assertThat(adversarial.score(Role.PLANNER, planner(1, "rate"), critic(1, "APPROVE")))
            .hasValue(0.1);
    }

    @Test
    void proposersScoreEachOtherByFeatureOverlap() {
        OptionalDouble score = cooperative.score(Role.PLANNER,
            planner(2, "rate", "iat", "entropy"), researcher(1, "rate", "iat", "packets"));

        assertThat(score.getAsDouble()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void noFeaturesOnEitherSideGivesNoScore() {
        assertThat(cooperative.score(Role.RESEARCHER, researcher(1), planner(1))).isEmpty();
    }

    @Test
    void criticScoresWhitelistCompliance() {
        assertThat(cooperative.score(Role.CRITIC, critic(1, "REVISE"), planner(1, "rate", "ja3")))
            .hasValue(0.5);
        assertThat(adversarial.score(Role.CRITIC, critic(1, "REVISE"), planner(1, "rate", "ja3")))
            .hasValue(0.25);
        assertThat(cooperative.score(Role.CRITIC, critic(1, "REVISE"), researcher(1)))
            .hasValue(0.0);
    }

    @Test
    void selfScoringIsRejected() {
        assertThatThrownBy(() -> cooperative.score(Role.PLANNER, planner(1, "rate"), planner(1, "rate")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
