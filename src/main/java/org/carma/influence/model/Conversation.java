package org.carma.influence.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A finished conversation: the ordered turns of one condition for one grid point.
 * Read-only; the metrics engine consumes it.
 */
public final class Conversation {

    private final Condition condition;
    private final GridPoint gridPoint;
    private final List<Turn> turns;
    private final Map<Role, Double> mu;
    private final TerminationReason terminationReason;
    private final int roundsCompleted;
    private final int roundCap;
    private final Integer approvalRound;
    private final String failureReason;

    private Conversation(Builder builder) {
        this.condition = Objects.requireNonNull(builder.condition, "condition");
        this.gridPoint = Objects.requireNonNull(builder.gridPoint, "gridPoint");
        this.turns = Collections.unmodifiableList(new ArrayList<>(builder.turns));
        this.mu = Collections.unmodifiableMap(new EnumMap<>(builder.mu));
        this.terminationReason = Objects.requireNonNull(builder.terminationReason, "terminationReason");
        this.roundsCompleted = builder.roundsCompleted;
        this.roundCap = builder.roundCap;
        this.approvalRound = builder.approvalRound;
        this.failureReason = builder.failureReason;
        if (terminationReason == TerminationReason.FAILED && failureReason == null) {
            throw new IllegalArgumentException("A failed conversation needs a failure reason");
        }
    }

    public Condition getCondition() { return condition; }
    public GridPoint getGridPoint() { return gridPoint; }
    public List<Turn> getTurns() { return turns; }
    public Map<Role, Double> getMu() { return mu; }
    public TerminationReason getTerminationReason() { return terminationReason; }
    public int getRoundsCompleted() { return roundsCompleted; }
    public int getRoundCap() { return roundCap; }
    public String getFailureReason() { return failureReason; }

    public double getMu(Role role) {
        return mu.getOrDefault(role, Double.NaN);
    }

    /**
     * 1-based round in which the termination predicate first held, if it ever did.
     */
    public Optional<Integer> getApprovalRound() {
        return Optional.ofNullable(approvalRound);
    }

    public boolean isFailed() {
        return terminationReason == TerminationReason.FAILED;
    }

    public List<Turn> turnsFor(Role role) {
        List<Turn> result = new ArrayList<>();
        for (Turn turn : turns) {
            if (turn.getRole() == role) {
                result.add(turn);
            }
        }
        return result;
    }

    public Optional<Turn> turn(Role role, int roundIndex) {
        for (Turn turn : turns) {
            if (turn.getRole() == role && turn.getRoundIndex() == roundIndex) {
                return Optional.of(turn);
            }
        }
        return Optional.empty();
    }

    /**
     * The role's turn in the last completed round.
     */
    public Optional<Turn> terminalTurn(Role role) {
        if (roundsCompleted < 1) {
            return Optional.empty();
        }
        return turn(role, roundsCompleted);
    }

    public int getRepairedTurnCount() {
        return (int) turns.stream().filter(Turn::isRepaired).count();
    }

    @Override
    public String toString() {
        return String.format("Conversation[%s %s, rounds=%d/%d, %s%s]",
            condition, gridPoint, roundsCompleted, roundCap, terminationReason,
            failureReason != null ? ": " + failureReason : "");
    }

    public static Builder builder(Condition condition, GridPoint gridPoint) {
        return new Builder(condition, gridPoint);
    }

    public static class Builder {
        private final Condition condition;
        private final GridPoint gridPoint;
        private final List<Turn> turns = new ArrayList<>();
        private final Map<Role, Double> mu = new EnumMap<>(Role.class);
        private TerminationReason terminationReason;
        private int roundsCompleted;
        private int roundCap;
        private Integer approvalRound;
        private String failureReason;

        private Builder(Condition condition, GridPoint gridPoint) {
            this.condition = condition;
            this.gridPoint = gridPoint;
        }

        public Builder turns(List<Turn> turns) {
            this.turns.clear();
            this.turns.addAll(turns);
            return this;
        }

        public Builder mu(Role role, double value) {
            mu.put(role, value);
            return this;
        }

        public Builder terminated(TerminationReason reason, int roundsCompleted) {
            this.terminationReason = reason;
            this.roundsCompleted = roundsCompleted;
            return this;
        }

        public Builder roundCap(int roundCap) {
            this.roundCap = roundCap;
            return this;
        }

        public Builder approvalRound(Integer approvalRound) {
            this.approvalRound = approvalRound;
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Conversation build() {
            return new Conversation(this);
        }
    }
}
