package org.carma.influence.simulation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.carma.influence.model.Conversation;
import org.carma.influence.model.GridPoint;
import org.carma.influence.model.Role;
import org.carma.influence.model.RowStatus;
import org.carma.influence.model.ResultRow;
import org.carma.influence.model.Turn;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Metrics over finished conversations.
 *
 * All metrics are total: a failed conversation, or one that lacks the turns a metric
 * needs, yields {@code NaN} (rates) or {@code null} (counts) instead of throwing.
 */
public class MetricsEngine {

    public static final String APPROVE = "APPROVE";
    public static final String REVISE = "REVISE";

    private final TagCanonicalizer canonicalizer;

    public MetricsEngine(TagCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    // ========================================================================
    // PAYLOAD HELPERS
    // ========================================================================

    /**
     * Normalized feature tags of a payload: lower case, whitespace collapsed, blanks
     * dropped. Missing or non-array {@code features} yields the empty set.
     */
    public static Set<String> features(ObjectNode payload) {
        Set<String> result = new TreeSet<>();
        if (payload == null) {
            return result;
        }
        JsonNode features = payload.get("features");
        if (features == null || !features.isArray()) {
            return result;
        }
        for (JsonNode node : features) {
            if (node.isTextual() || node.isNumber()) {
                String tag = String.join(" ", node.asText().toLowerCase(Locale.ROOT).trim().split("\\s+"));
                if (!tag.isEmpty()) {
                    result.add(tag);
                }
            }
        }
        return result;
    }

    public static Set<String> features(Turn turn) {
        return turn == null ? new TreeSet<>() : features(turn.getPayload());
    }

    /**
     * Critic decision, APPROVE or REVISE, if the payload carries a recognisable one.
     */
    public static Optional<String> criticDecision(ObjectNode payload) {
        if (payload == null) {
            return Optional.empty();
        }
        JsonNode decision = payload.get("decision");
        if (decision == null || !decision.isTextual()) {
            return Optional.empty();
        }
        String value = decision.asText().trim().toUpperCase(Locale.ROOT);
        return APPROVE.equals(value) || REVISE.equals(value) ? Optional.of(value) : Optional.empty();
    }

    /**
     * |A ∩ B| / |A ∪ B|, or {@code NaN} when both sets are empty.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return Double.NaN;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }

    /**
     * Half-up rounding to a number of decimals. {@code NaN} passes through.
     */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    // ========================================================================
    // CONVERSATION METRICS
    // ========================================================================

    /**
     * Planner/researcher feature Jaccard at the terminal round.
     */
    public double agreementRate(Conversation conversation) {
        if (conversation.isFailed()) {
            return Double.NaN;
        }
        return agreementRate(conversation, conversation.getRoundsCompleted());
    }

    public double agreementRate(Conversation conversation, int round) {
        Optional<Turn> planner = conversation.turn(Role.PLANNER, round);
        Optional<Turn> researcher = conversation.turn(Role.RESEARCHER, round);
        if (planner.isEmpty() || researcher.isEmpty()) {
            return Double.NaN;
        }
        return jaccard(features(planner.get()), features(researcher.get()));
    }

    /**
     * Planner/researcher Jaccard at the terminal round after canonicalizing both tag sets.
     */
    public double canonicalOverlap(Conversation conversation) {
        if (conversation.isFailed()) {
            return Double.NaN;
        }
        Optional<Turn> planner = conversation.terminalTurn(Role.PLANNER);
        Optional<Turn> researcher = conversation.terminalTurn(Role.RESEARCHER);
        if (planner.isEmpty() || researcher.isEmpty()) {
            return Double.NaN;
        }
        return jaccard(canonicalizer.canonicalize(features(planner.get())),
            canonicalizer.canonicalize(features(researcher.get())));
    }

    /**
     * Round in which the termination predicate first held, or the round cap.
     */
    public Integer roundsToApproval(Conversation conversation) {
        if (conversation.isFailed()) {
            return null;
        }
        return conversation.getApprovalRound().orElse(conversation.getRoundCap());
    }

    /**
     * Changed payload fields between consecutive rounds, summed over all roles.
     */
    public Integer revisionDepth(Conversation conversation) {
        if (conversation.isFailed()) {
            return null;
        }
        int total = 0;
        for (Role role : Role.values()) {
            total += revisionDepth(conversation, role);
        }
        return total;
    }

    public int revisionDepth(Conversation conversation, Role role) {
        int changed = 0;
        for (int round = 1; round < conversation.getRoundsCompleted(); round++) {
            Optional<Turn> before = conversation.turn(role, round);
            Optional<Turn> after = conversation.turn(role, round + 1);
            if (before.isPresent() && after.isPresent()) {
                changed += changedFields(before.get().getPayload(), after.get().getPayload());
            }
        }
        return changed;
    }

    /**
     * Jaccard of one role's features between two rounds of the same conversation.
     */
    public double selfAgreement(Conversation conversation, Role role, int roundA, int roundB) {
        if (conversation.isFailed()) {
            return Double.NaN;
        }
        Optional<Turn> a = conversation.turn(role, roundA);
        Optional<Turn> b = conversation.turn(role, roundB);
        if (a.isEmpty() || b.isEmpty()) {
            return Double.NaN;
        }
        return jaccard(features(a.get()), features(b.get()));
    }

    /**
     * Jaccard of one role's terminal features in the baseline and influence conversations.
     */
    public double selfAgreement(Conversation baseline, Conversation influence, Role role) {
        if (baseline.isFailed() || influence.isFailed()) {
            return Double.NaN;
        }
        Optional<Turn> a = baseline.terminalTurn(role);
        Optional<Turn> b = influence.terminalTurn(role);
        if (a.isEmpty() || b.isEmpty()) {
            return Double.NaN;
        }
        return jaccard(features(a.get()), features(b.get()));
    }

    // ========================================================================
    // RESULT ROW
    // ========================================================================

    /**
     * Assemble the ledger row for one grid point from its two conversations.
     */
    public ResultRow resultRow(GridPoint point, Conversation baseline, Conversation influence) {
        RowStatus status = baseline.isFailed() || influence.isFailed() ? RowStatus.FAILED : RowStatus.OK;
        String reason = null;
        if (status == RowStatus.FAILED) {
            StringBuilder sb = new StringBuilder();
            if (baseline.isFailed()) {
                sb.append("baseline: ").append(baseline.getFailureReason());
            }
            if (influence.isFailed()) {
                if (sb.length() > 0) sb.append("; ");
                sb.append("influence: ").append(influence.getFailureReason());
            }
            reason = sb.toString();
        }

        return new ResultRow(point,
            round(influence.getMu(Role.PLANNER), 4),
            round(influence.getMu(Role.RESEARCHER), 4),
            round(influence.getMu(Role.CRITIC), 4),
            roundsToApproval(baseline),
            roundsToApproval(influence),
            round(agreementRate(baseline), 4),
            round(agreementRate(influence), 4),
            revisionDepth(influence),
            round(canonicalOverlap(baseline), 3),
            round(canonicalOverlap(influence), 3),
            round(selfAgreement(baseline, influence, Role.PLANNER), 3),
            round(selfAgreement(baseline, influence, Role.RESEARCHER), 3),
            status, reason);
    }

    private static int changedFields(ObjectNode before, ObjectNode after) {
        Set<String> keys = new TreeSet<>();
        before.fieldNames().forEachRemaining(keys::add);
        after.fieldNames().forEachRemaining(keys::add);

        int changed = 0;
        for (String key : keys) {
            JsonNode a = before.get(key);
            JsonNode b = after.get(key);
            if ("features".equals(key)) {
                if (!features(before).equals(features(after))) {
                    changed++;
                }
            } else if (a == null || !a.equals(b)) {
                changed++;
            }
        }
        return changed;
    }
}
