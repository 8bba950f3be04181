package org.carma.influence.agent;

import org.carma.influence.config.HarnessConfig;
import org.carma.influence.mechanism.InferenceRequest;
import org.carma.influence.mechanism.InfluenceFunctions;
import org.carma.influence.mechanism.MockInferenceBackend;
import org.carma.influence.mechanism.ProtocolValidator;
import org.carma.influence.mechanism.TurnOutcome;
import org.carma.influence.model.Condition;
import org.carma.influence.model.GridPoint;
import org.carma.influence.model.Role;
import org.carma.influence.model.Turn;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.carma.influence.support.TestFixtures.critic;
import static org.carma.influence.support.TestFixtures.planner;
import static org.carma.influence.support.TestFixtures.researcher;

class InfluenceAgentTest {

    private static final GridPoint POINT = new GridPoint(0.8, 0.8, 6.0, 0.5, 11, false);

    private final MockInferenceBackend backend = new MockInferenceBackend(HarnessConfig.DEFAULT_WHITELIST,
        new MockInferenceBackend.MockConfig().recordRequests(true));

    private InfluenceAgent agent(Role role, Condition condition, HarnessConfig config, GridPoint point) {
        return new InfluenceAgent(role, condition, point, config,
            new ProtocolValidator(config.getProtocol(), backend),
            new PromptLibrary(config.getProtocol().whitelist()),
            new PeerScorer(config.getProtocol().whitelist(), point.adversarial()));
    }

    private InfluenceAgent agent(Role role, Condition condition) {
        return agent(role, condition, HarnessConfig.builder().build(), POINT);
    }

    @Test
    void baselineAgentsUseNeutralMu() {
        InfluenceAgent baseline = agent(Role.PLANNER, Condition.BASELINE);

        assertThat(baseline.getMu()).isEqualTo(0.0);
        assertThat(baseline.getTemperature()).isCloseTo(0.7, within(1e-12));
        assertThat(baseline.getLambda()).isCloseTo(InfluenceFunctions.lambdaFromMu(0.0, 6.0, 0.5), within(1e-12));
    }

    @Test
    void influenceAgentsDeriveMuFromPrimedScores() {
        InfluenceAgent influence = agent(Role.PLANNER, Condition.INFLUENCE);

        // critic 0.8*0.9 + 0.2*0.5, researcher 0.8*0.8 + 0.2*0.5
        assertThat(influence.getMu()).isCloseTo(0.78, within(1e-9));
        assertThat(influence.getTemperature()).isCloseTo(0.7 * (1 - 0.8 * 0.78), within(1e-9));
        assertThat(influence.getLambda()).isGreaterThan(0.5);
    }

    @Test
    void withoutPriorTheFirstPrimedScoreSeedsTheAverage() {
        HarnessConfig config = HarnessConfig.builder().prior(null).build();

        InfluenceAgent influence = agent(Role.PLANNER, Condition.INFLUENCE, config, POINT);

        assertThat(influence.getMu()).isCloseTo(0.85, within(1e-9));
    }

    @Test
    void adversarialPrimingLowersMu() {
        GridPoint adversarialPoint = new GridPoint(0.8, 0.8, 6.0, 0.5, 11, true);

        InfluenceAgent cooperative = agent(Role.PLANNER, Condition.INFLUENCE);
        InfluenceAgent adversarial = agent(Role.PLANNER, Condition.INFLUENCE,
            HarnessConfig.builder().build(), adversarialPoint);

        assertThat(adversarial.getMu()).isLessThan(cooperative.getMu());
    }

    @Test
    void turnRequestUsesAgentTemperatureAndPointSeed() {
        InfluenceAgent influence = agent(Role.PLANNER, Condition.INFLUENCE);

        TurnOutcome outcome = influence.produceTurn(1, List.of());

        assertThat(outcome.isSuccess()).isTrue();
        InferenceRequest request = backend.getRequests().get(0);
        assertThat(request.temperature()).isEqualTo(influence.getTemperature());
        assertThat(request.seed()).isEqualTo(11);
        assertThat(request.userMessage()).startsWith("[mutual_influence μ=0.78");
    }

    @Test
    void baselinePromptsHaveNoInfluenceHeader() {
        agent(Role.RESEARCHER, Condition.BASELINE).produceTurn(1, List.of());

        assertThat(backend.getRequests().get(0).userMessage()).doesNotContain("mutual_influence");
    }

    @Test
    void acceptedTurnUpdatesPeerScoresButNotMu() {
        InfluenceAgent influence = agent(Role.PLANNER, Condition.INFLUENCE);
        List<Turn> history = List.of(
            planner(1, "rate", "iat", "entropy"),
            researcher(1, "rate", "iat", "entropy"),
            critic(1, "APPROVE"));

        influence.produceTurn(2, history);

        assertThat(influence.state().peerScores().get(Role.CRITIC)).isCloseTo(0.8 * 0.9 + 0.2 * 0.82, within(1e-9));
        assertThat(influence.getMu()).isCloseTo(0.78, within(1e-9));
    }

    @Test
    void criticPromptEmbedsTheRoundsProposals() {
        Turn plannerTurn = planner(2, "rate", "iat", "entropy");
        Turn researcherTurn = researcher(2, "rate", "iat", "packets");
        List<Turn> history = List.of(planner(1, "packets"), researcher(1, "dst_ip"), critic(1, "REVISE"),
            plannerTurn, researcherTurn);

        String prompt = agent(Role.CRITIC, Condition.BASELINE).buildPrompt(2, history);

        assertThat(prompt)
            .contains(PromptLibrary.PLANNER_BLOCK + "\n" + plannerTurn.getPayload().toString())
            .contains(PromptLibrary.RESEARCHER_BLOCK + "\n" + researcherTurn.getPayload().toString());
    }

    @Test
    void proposerPromptCarriesPeerSuggestionsAndLastDecision() {
        List<Turn> history = List.of(planner(1, "rate", "iat", "entropy"),
            researcher(1, "packets", "protocol", "dst_port"), critic(1, "REVISE"));

        String prompt = agent(Role.PLANNER, Condition.INFLUENCE).buildPrompt(2, history);

        assertThat(prompt)
            .contains(PromptLibrary.SUGGESTION_PREFIX)
            .contains("Critic decision last round: REVISE");
    }

    @Test
    void baselinePromptsCarryNoPeerFeatures() {
        List<Turn> history = List.of(planner(1, "rate", "iat", "entropy"));

        String baseline = agent(Role.RESEARCHER, Condition.BASELINE).buildPrompt(1, history);
        String influence = agent(Role.RESEARCHER, Condition.INFLUENCE).buildPrompt(1, history);

        assertThat(baseline).doesNotContain(PromptLibrary.SUGGESTION_PREFIX);
        assertThat(influence).contains(PromptLibrary.SUGGESTION_PREFIX + "entropy (");
    }
}
