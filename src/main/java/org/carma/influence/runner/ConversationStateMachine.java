package org.carma.influence.runner;

import org.carma.influence.model.Role;
import org.carma.influence.model.TerminationReason;

/**
 * Round-robin turn order with early termination, as pure transitions.
 *
 * <pre>
 * AwaitingRole(planner, 1) → AwaitingRole(researcher, 1) → AwaitingRole(critic, 1)
 *   → check termination → AwaitingRole(planner, 2) | Terminated
 * </pre>
 *
 * The check after the critic's turn is folded into the critic transition: the caller
 * says whether the termination predicate holds for the completed round.
 */
public final class ConversationStateMachine {

    public sealed interface State permits AwaitingRole, Terminated {
        boolean isTerminal();
    }

    /**
     * Waiting for {@code role} to take its turn in 1-based {@code round}.
     */
    public record AwaitingRole(Role role, int round) implements State {
        public boolean isTerminal() { return false; }
    }

    /**
     * @param roundsCompleted rounds in which every role took its turn
     */
    public record Terminated(TerminationReason reason, int roundsCompleted) implements State {
        public boolean isTerminal() { return true; }
    }

    private final int maxRounds;

    public ConversationStateMachine(int maxRounds) {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be at least 1: " + maxRounds);
        }
        this.maxRounds = maxRounds;
    }

    public State initial() {
        return new AwaitingRole(Role.first(), 1);
    }

    /**
     * Transition after the awaited role's turn was accepted.
     *
     * @param predicateHolds whether the completed round satisfies the termination
     *                       predicate; ignored unless the last role just spoke
     */
    public State onTurnAccepted(AwaitingRole state, boolean predicateHolds) {
        if (!state.role().isLast()) {
            return new AwaitingRole(state.role().next(), state.round());
        }
        if (predicateHolds) {
            return new Terminated(TerminationReason.APPROVED, state.round());
        }
        if (state.round() >= maxRounds) {
            return new Terminated(TerminationReason.ROUND_CAP, state.round());
        }
        return new AwaitingRole(state.role().next(), state.round() + 1);
    }

    /**
     * Transition after the awaited role failed to produce a turn. The round in
     * progress does not count as completed.
     */
    public State onTurnFailed(AwaitingRole state) {
        return new Terminated(TerminationReason.FAILED, state.round() - 1);
    }

    public int getMaxRounds() {
        return maxRounds;
    }
}
