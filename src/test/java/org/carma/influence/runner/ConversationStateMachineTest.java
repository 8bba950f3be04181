package org.carma.influence.runner;

import org.carma.influence.model.Role;
import org.carma.influence.model.TerminationReason;
import org.carma.influence.runner.ConversationStateMachine.AwaitingRole;
import org.carma.influence.runner.ConversationStateMachine.State;
import org.carma.influence.runner.ConversationStateMachine.Terminated;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationStateMachineTest {

    private final ConversationStateMachine machine = new ConversationStateMachine(3);

    @Test
    void startsWithPlannerInRoundOne() {
        assertThat(machine.initial()).isEqualTo(new AwaitingRole(Role.PLANNER, 1));
    }

    @Test
    void rolesSpeakInOrderWithinARound() {
        assertThat(machine.onTurnAccepted(new AwaitingRole(Role.PLANNER, 2), true))
            .isEqualTo(new AwaitingRole(Role.RESEARCHER, 2));
        assertThat(machine.onTurnAccepted(new AwaitingRole(Role.RESEARCHER, 2), false))
            .isEqualTo(new AwaitingRole(Role.CRITIC, 2));
    }

    @Test
    void predicateAfterCriticTerminatesAsApproved() {
        State state = machine.onTurnAccepted(new AwaitingRole(Role.CRITIC, 1), true);

        assertThat(state.isTerminal()).isTrue();
        assertThat(state).isEqualTo(new Terminated(TerminationReason.APPROVED, 1));
    }

    @Test
    void unmetPredicateStartsTheNextRound() {
        assertThat(machine.onTurnAccepted(new AwaitingRole(Role.CRITIC, 2), false))
            .isEqualTo(new AwaitingRole(Role.PLANNER, 3));
    }

    @Test
    void roundCapTerminates() {
        assertThat(machine.onTurnAccepted(new AwaitingRole(Role.CRITIC, 3), false))
            .isEqualTo(new Terminated(TerminationReason.ROUND_CAP, 3));
    }

    @Test
    void approvalInTheLastRoundWinsOverTheCap() {
        assertThat(machine.onTurnAccepted(new AwaitingRole(Role.CRITIC, 3), true))
            .isEqualTo(new Terminated(TerminationReason.APPROVED, 3));
    }

    @Test
    void failedTurnDoesNotCompleteItsRound() {
        assertThat(machine.onTurnFailed(new AwaitingRole(Role.RESEARCHER, 2)))
            .isEqualTo(new Terminated(TerminationReason.FAILED, 1));
        assertThat(machine.onTurnFailed(new AwaitingRole(Role.PLANNER, 1)))
            .isEqualTo(new Terminated(TerminationReason.FAILED, 0));
    }

    @Test
    void fullRunVisitsEveryRoleOfEveryRound() {
        State state = machine.initial();
        int turns = 0;
        while (!state.isTerminal()) {
            state = machine.onTurnAccepted((AwaitingRole) state, false);
            turns++;
        }

        assertThat(turns).isEqualTo(9);
        assertThat(state).isEqualTo(new Terminated(TerminationReason.ROUND_CAP, 3));
    }

    @Test
    void rejectsZeroRounds() {
        assertThatThrownBy(() -> new ConversationStateMachine(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
