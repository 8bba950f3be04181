package org.carma.influence.runner;

import org.carma.influence.agent.InfluenceAgent;
import org.carma.influence.agent.PeerScorer;
import org.carma.influence.agent.PromptLibrary;
import org.carma.influence.config.HarnessConfig;
import org.carma.influence.mechanism.InferenceBackend;
import org.carma.influence.mechanism.ProtocolValidator;
import org.carma.influence.mechanism.TurnOutcome;
import org.carma.influence.model.Condition;
import org.carma.influence.model.Conversation;
import org.carma.influence.model.GridPoint;
import org.carma.influence.model.Role;
import org.carma.influence.model.TerminationReason;
import org.carma.influence.model.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one conversation: planner, researcher and critic take turns each round
 * until the termination predicate holds, the round cap is reached, or a turn fails.
 *
 * Every call builds fresh agents, so a runner can be shared by concurrent workers.
 */
public class ConversationRunner {

    private static final Logger log = LoggerFactory.getLogger(ConversationRunner.class);

    private final HarnessConfig config;
    private final ProtocolValidator validator;
    private final PromptLibrary prompts;
    private final TerminationPredicate predicate;

    public ConversationRunner(HarnessConfig config, InferenceBackend backend) {
        this.config = config;
        this.validator = new ProtocolValidator(config.getProtocol(), backend);
        this.prompts = new PromptLibrary(config.getProtocol().whitelist());
        this.predicate = new TerminationPredicate(config.getConversation().agreementThreshold());
    }

    /**
     * Run one condition for one grid point to its terminal state.
     */
    public Conversation run(GridPoint point, Condition condition) {
        boolean adversarial = point.adversarial() && condition == Condition.INFLUENCE;
        PeerScorer scorer = new PeerScorer(config.getProtocol().whitelist(), adversarial);

        Map<Role, InfluenceAgent> agents = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            agents.put(role, new InfluenceAgent(role, condition, point, config, validator, prompts, scorer));
        }

        ConversationStateMachine machine = new ConversationStateMachine(config.getConversation().maxRounds());
        ConversationStateMachine.State state = machine.initial();
        List<Turn> turns = new ArrayList<>();
        String failure = null;

        while (!state.isTerminal()) {
            ConversationStateMachine.AwaitingRole awaiting = (ConversationStateMachine.AwaitingRole) state;
            TurnOutcome outcome = agents.get(awaiting.role()).produceTurn(awaiting.round(), List.copyOf(turns));

            if (outcome instanceof TurnOutcome.Failure failed) {
                failure = failed.describe();
                state = machine.onTurnFailed(awaiting);
                continue;
            }

            Turn turn = ((TurnOutcome.Success) outcome).turn();
            turns.add(turn);
            boolean holds = awaiting.role().isLast()
                && predicate.holds(find(turns, Role.PLANNER, awaiting.round()),
                                   find(turns, Role.RESEARCHER, awaiting.round()), turn);
            state = machine.onTurnAccepted(awaiting, holds);
        }

        ConversationStateMachine.Terminated terminated = (ConversationStateMachine.Terminated) state;
        Conversation.Builder builder = Conversation.builder(condition, point)
            .turns(turns)
            .terminated(terminated.reason(), terminated.roundsCompleted())
            .roundCap(machine.getMaxRounds())
            .approvalRound(terminated.reason() == TerminationReason.APPROVED ? terminated.roundsCompleted() : null)
            .failureReason(failure);
        agents.forEach((role, agent) -> builder.mu(role, agent.getMu()));

        Conversation conversation = builder.build();
        if (conversation.isFailed()) {
            log.warn("{} conversation for {} failed: {}", condition.getTag(), point, failure);
        } else {
            log.debug("{}", conversation);
        }
        return conversation;
    }

    private static Turn find(List<Turn> turns, Role role, int round) {
        for (Turn turn : turns) {
            if (turn.getRole() == role && turn.getRoundIndex() == round) {
                return turn;
            }
        }
        return null;
    }
}
