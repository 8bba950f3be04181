package org.carma.influence.mechanism;

import org.carma.influence.model.Role;
import org.carma.influence.model.Turn;

import java.util.Objects;

/**
 * Result of asking one role for one turn: either an accepted {@link Turn} or the
 * reason it could not be obtained.
 */
public sealed interface TurnOutcome permits TurnOutcome.Success, TurnOutcome.Failure {

    boolean isSuccess();

    /**
     * Accepted turn. {@link Turn#isRepaired()} tells whether the repair request was needed.
     */
    record Success(Turn turn) implements TurnOutcome {
        public Success {
            Objects.requireNonNull(turn, "turn");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * No turn could be accepted.
     *
     * @param attempts calls made to the inference backend, repair included
     */
    record Failure(Role role, int roundIndex, String reason, int attempts) implements TurnOutcome {
        @Override
        public boolean isSuccess() {
            return false;
        }

        public String describe() {
            return role + " round " + roundIndex + ": " + reason;
        }
    }
}
