package org.carma.influence.simulation;

import org.carma.influence.config.HarnessConfig;
import org.carma.influence.model.Condition;
import org.carma.influence.model.Conversation;
import org.carma.influence.model.ResultRow;
import org.carma.influence.model.Role;
import org.carma.influence.model.RowStatus;
import org.carma.influence.model.TerminationReason;
import org.carma.influence.model.Turn;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.carma.influence.support.TestFixtures.POINT;
import static org.carma.influence.support.TestFixtures.critic;
import static org.carma.influence.support.TestFixtures.json;
import static org.carma.influence.support.TestFixtures.planner;
import static org.carma.influence.support.TestFixtures.researcher;

class MetricsEngineTest {

    private final MetricsEngine engine = new MetricsEngine(TagCanonicalizer.forWhitelist(HarnessConfig.DEFAULT_WHITELIST));

    private static Conversation finished(Condition condition, TerminationReason reason, int rounds,
                                         Integer approvalRound, Turn... turns) {
        return Conversation.builder(condition, POINT)
            .turns(List.of(turns))
            .terminated(reason, rounds)
            .roundCap(3)
            .approvalRound(approvalRound)
            .mu(Role.PLANNER, 0.78)
            .mu(Role.RESEARCHER, 0.70)
            .mu(Role.CRITIC, 0.775)
            .build();
    }

    private static Conversation failed(Condition condition, String reason, Turn... turns) {
        return Conversation.builder(condition, POINT)
            .turns(List.of(turns))
            .terminated(TerminationReason.FAILED, 0)
            .roundCap(3)
            .failureReason(reason)
            .build();
    }

    /** Two rounds: disagreement, then agreement and approval. */
    private static Conversation twoRounds(Condition condition) {
        return finished(condition, TerminationReason.APPROVED, 2, 2,
            planner(1, "rate", "iat", "entropy"),
            researcher(1, "rate", "packets", "protocol"),
            critic(1, "REVISE"),
            planner(2, "rate", "iat", "packets"),
            researcher(2, "rate", "iat", "packets"),
            critic(2, "APPROVE"));
    }

    @Test
    void jaccardOfFeatureSets() {
        assertThat(MetricsEngine.jaccard(Set.of("a", "b"), Set.of("b", "c"))).isCloseTo(1.0 / 3, within(1e-12));
        assertThat(MetricsEngine.jaccard(Set.of("a"), Set.of())).isEqualTo(0.0);
        assertThat(MetricsEngine.jaccard(Set.of(), Set.of())).isNaN();
    }

    @Test
    void featuresAreNormalized() {
        Set<String> features = MetricsEngine.features(json("{\"features\":[\" Rate \",\"RATE\",\"src  ip\",3,\"\",null]}"));

        assertThat(features).containsExactlyInAnyOrder("rate", "src ip", "3");
        assertThat(MetricsEngine.features(json("{\"features\":\"rate\"}"))).isEmpty();
        assertThat(MetricsEngine.features((Turn) null)).isEmpty();
    }

    @Test
    void criticDecisionIsRecognisedLeniently() {
        assertThat(MetricsEngine.criticDecision(json("{\"decision\":\" approve \"}"))).contains(MetricsEngine.APPROVE);
        assertThat(MetricsEngine.criticDecision(json("{\"decision\":\"maybe\"}"))).isEmpty();
        assertThat(MetricsEngine.criticDecision(json("{\"decision\":true}"))).isEmpty();
        assertThat(MetricsEngine.criticDecision(json("{}"))).isEmpty();
    }

    @Test
    void roundingIsHalfUp() {
        assertThat(MetricsEngine.round(0.12345, 4)).isEqualTo(0.1235);
        assertThat(MetricsEngine.round(2.0 / 3, 3)).isEqualTo(0.667);
        assertThat(MetricsEngine.round(Double.NaN, 3)).isNaN();
    }

    @Test
    void agreementRateUsesTheTerminalRound() {
        Conversation conversation = twoRounds(Condition.INFLUENCE);

        assertThat(engine.agreementRate(conversation)).isEqualTo(1.0);
        assertThat(engine.agreementRate(conversation, 1)).isCloseTo(0.2, within(1e-12));
    }

    @Test
    void roundsToApprovalFallsBackToTheCap() {
        Conversation capped = finished(Condition.BASELINE, TerminationReason.ROUND_CAP, 3, null,
            planner(1, "rate"), researcher(1, "iat"), critic(1, "REVISE"));

        assertThat(engine.roundsToApproval(twoRounds(Condition.INFLUENCE))).isEqualTo(2);
        assertThat(engine.roundsToApproval(capped)).isEqualTo(3);
    }

    @Test
    void revisionDepthCountsChangedFieldsAcrossRoles() {
        Conversation conversation = twoRounds(Condition.INFLUENCE);

        assertThat(engine.revisionDepth(conversation, Role.PLANNER)).isEqualTo(1);
        assertThat(engine.revisionDepth(conversation, Role.RESEARCHER)).isEqualTo(1);
        assertThat(engine.revisionDepth(conversation, Role.CRITIC)).isEqualTo(1);
        assertThat(engine.revisionDepth(conversation)).isEqualTo(3);
    }

    @Test
    void canonicalOverlapForgivesSpellingDifferences() {
        Conversation conversation = finished(Condition.INFLUENCE, TerminationReason.ROUND_CAP, 1, null,
            planner(1, "Payload Entropy", "pkts", "rate"),
            researcher(1, "entropy", "packets", "rate"),
            critic(1, "REVISE"));

        assertThat(engine.agreementRate(conversation)).isCloseTo(0.2, within(1e-12));
        assertThat(engine.canonicalOverlap(conversation)).isEqualTo(1.0);
    }

    @Test
    void selfAgreementComparesBaselineAndInfluence() {
        Conversation baseline = finished(Condition.BASELINE, TerminationReason.ROUND_CAP, 1, null,
            planner(1, "rate", "iat", "entropy"), researcher(1, "rate", "iat", "entropy"), critic(1, "REVISE"));

        double planner = engine.selfAgreement(baseline, twoRounds(Condition.INFLUENCE), Role.PLANNER);

        assertThat(planner).isCloseTo(0.5, within(1e-12));
        assertThat(engine.selfAgreement(twoRounds(Condition.INFLUENCE), Role.PLANNER, 1, 2)).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void failedConversationsYieldSentinels() {
        Conversation broken = failed(Condition.INFLUENCE, "planner round 1: inference failed: HTTP 500");

        assertThat(engine.agreementRate(broken)).isNaN();
        assertThat(engine.canonicalOverlap(broken)).isNaN();
        assertThat(engine.roundsToApproval(broken)).isNull();
        assertThat(engine.revisionDepth(broken)).isNull();
    }

    @Test
    void resultRowForTwoFinishedConversations() {
        ResultRow row = engine.resultRow(POINT, twoRounds(Condition.BASELINE), twoRounds(Condition.INFLUENCE));

        assertThat(row.status()).isEqualTo(RowStatus.OK);
        assertThat(row.failureReason()).isNull();
        assertThat(row.muPlanner()).isEqualTo(0.78);
        assertThat(row.roundsToApprovalInfluence()).isEqualTo(2);
        assertThat(row.plannerSelfAgreement()).isEqualTo(1.0);
        assertThat(row.isFullyPopulated()).isTrue();
    }

    @Test
    void resultRowNamesTheFailedCondition() {
        ResultRow row = engine.resultRow(POINT, twoRounds(Condition.BASELINE),
            failed(Condition.INFLUENCE, "critic round 2: inference failed: timeout after 60000ms"));

        assertThat(row.isFailed()).isTrue();
        assertThat(row.failureReason()).isEqualTo("influence: critic round 2: inference failed: timeout after 60000ms");
        assertThat(row.roundsToApprovalBaseline()).isEqualTo(2);
        assertThat(row.roundsToApprovalInfluence()).isNull();
        assertThat(row.plannerSelfAgreement()).isNaN();
    }
}
