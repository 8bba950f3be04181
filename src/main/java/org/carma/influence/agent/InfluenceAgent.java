package org.carma.influence.agent;

import org.carma.influence.config.HarnessConfig;
import org.carma.influence.mechanism.FeedbackAccumulator;
import org.carma.influence.mechanism.InferenceRequest;
import org.carma.influence.mechanism.InfluenceFunctions;
import org.carma.influence.mechanism.ProtocolValidator;
import org.carma.influence.mechanism.TurnOutcome;
import org.carma.influence.model.AgentState;
import org.carma.influence.model.Condition;
import org.carma.influence.model.GridPoint;
import org.carma.influence.model.Role;
import org.carma.influence.model.Turn;
import org.carma.influence.simulation.MetricsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * One role taking part in one conversation.
 *
 * μ is fixed when the agent is created: the neutral value in the baseline condition,
 * or the mean of the primed peer scores in the influence condition. Temperature and
 * λ follow from μ once and stay constant for the conversation, while the peer scores
 * keep moving with every turn the agent produces.
 */
public class InfluenceAgent {

    private static final Logger log = LoggerFactory.getLogger(InfluenceAgent.class);

    private static final int SUGGESTION_LIMIT = 3;

    private final Role role;
    private final Condition condition;
    private final GridPoint point;
    private final FeedbackAccumulator accumulator;
    private final ProtocolValidator validator;
    private final PromptLibrary prompts;
    private final PeerScorer scorer;

    private final double mu;
    private final double temperature;
    private final double lambda;

    public InfluenceAgent(Role role, Condition condition, GridPoint point, HarnessConfig config,
                          ProtocolValidator validator, PromptLibrary prompts, PeerScorer scorer) {
        this.role = role;
        this.condition = condition;
        this.point = point;
        this.validator = validator;
        this.prompts = prompts;
        this.scorer = scorer;

        HarnessConfig.Influence influence = config.getInfluence();
        this.accumulator = new FeedbackAccumulator(point.beta(), influence.prior());
        if (condition == Condition.INFLUENCE) {
            influence.priming().scoresFor(role, point.adversarial())
                .forEach(accumulator::receiveFeedback);
            this.mu = accumulator.mu();
        } else {
            this.mu = influence.neutralMu();
        }
        this.temperature = InfluenceFunctions.temperatureFromMu(mu, influence.t0(), point.alpha());
        this.lambda = InfluenceFunctions.lambdaFromMu(mu, point.k(), point.tau());
    }

    /**
     * Produce this role's turn for a round, given every turn accepted so far.
     * On success the peer scores are updated from the peers' latest turns.
     */
    public TurnOutcome produceTurn(int round, List<Turn> history) {
        InferenceRequest request = new InferenceRequest(role, prompts.systemMessage(role),
            buildPrompt(round, history), temperature, point.seed(), true);

        TurnOutcome outcome = validator.requestTurn(request, round);
        if (outcome instanceof TurnOutcome.Success success) {
            updateFeedback(success.turn(), history);
        }
        return outcome;
    }

    String buildPrompt(int round, List<Turn> history) {
        String header = condition == Condition.INFLUENCE
            ? prompts.influenceHeader(mu, lambda, temperature)
            : "";

        if (role == Role.CRITIC) {
            String planner = payloadText(history, Role.PLANNER, round);
            String researcher = payloadText(history, Role.RESEARCHER, round);
            return prompts.criticPrompt(point.seed(), round, header, scorer.isAdversarial(), planner, researcher);
        }

        Set<String> own = MetricsEngine.features(latest(history, role).orElse(null));
        // baseline agents never see peer features
        Map<Role, Set<String>> peerFeatures = new EnumMap<>(Role.class);
        for (Role peer : role.peers()) {
            if (condition == Condition.INFLUENCE && peer.isProposer()) {
                peerFeatures.put(peer, MetricsEngine.features(latest(history, peer).orElse(null)));
            }
        }
        List<InfluenceMixer.Suggestion> suggestions =
            InfluenceMixer.mix(own, peerFeatures, accumulator.getPeerScores(), lambda, SUGGESTION_LIMIT);
        String decision = latest(history, Role.CRITIC)
            .flatMap(t -> MetricsEngine.criticDecision(t.getPayload()))
            .orElse(null);

        return role == Role.PLANNER
            ? prompts.plannerPrompt(point.seed(), round, header, suggestions, decision)
            : prompts.researcherPrompt(point.seed(), round, header, suggestions, decision);
    }

    private void updateFeedback(Turn own, List<Turn> history) {
        for (Role peer : role.peers()) {
            Optional<Turn> peerTurn = latest(history, peer);
            if (peerTurn.isEmpty()) {
                continue;
            }
            OptionalDouble score = scorer.score(role, own, peerTurn.get());
            if (score.isPresent()) {
                double updated = accumulator.receiveFeedback(peer, score.getAsDouble());
                log.trace("{} {} scored {} at {} (EMA {})", condition, role, peer, score.getAsDouble(), updated);
            }
        }
    }

    private static Optional<Turn> latest(List<Turn> history, Role role) {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).getRole() == role) {
                return Optional.of(history.get(i));
            }
        }
        return Optional.empty();
    }

    private static String payloadText(List<Turn> history, Role role, int round) {
        for (Turn turn : history) {
            if (turn.getRole() == role && turn.getRoundIndex() == round) {
                return turn.getPayload().toString();
            }
        }
        return "{}";
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    public Role getRole() { return role; }
    public Condition getCondition() { return condition; }
    public double getMu() { return mu; }
    public double getTemperature() { return temperature; }
    public double getLambda() { return lambda; }

    public AgentState state() {
        return new AgentState(role, mu, temperature, lambda, accumulator.getPeerScores());
    }

    @Override
    public String toString() {
        return String.format("InfluenceAgent[%s %s, μ=%.3f, T=%.3f, λ=%.3f]",
            condition, role, mu, temperature, lambda);
    }
}
