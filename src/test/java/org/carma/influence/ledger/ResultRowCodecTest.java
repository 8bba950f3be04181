package org.carma.influence.ledger;

import org.carma.influence.model.GridPoint;
import org.carma.influence.model.ResultRow;
import org.carma.influence.model.RowStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carma.influence.support.TestFixtures.ADVERSARIAL_POINT;
import static org.carma.influence.support.TestFixtures.POINT;
import static org.carma.influence.support.TestFixtures.okRow;

class ResultRowCodecTest {

    private final ResultRowCodec codec = ResultRowCodec.standard();

    @Test
    void headerListsKeyMetricAndAuditColumns() {
        assertThat(codec.header()).startsWith("beta,k,tau,alpha,seed,adversarial,mu_planner,")
            .endsWith("Researcher_SelfAgreement,status,failure_reason\n");
        assertThat(codec.getColumns()).hasSize(20);
    }

    @Test
    void okRowReadsBackIdentically() {
        ResultRow row = okRow(ADVERSARIAL_POINT);

        String line = codec.encode(row);

        assertThat(line).startsWith("0.6,6.0,0.5,0.8,1,1,0.78,").endsWith(",OK,\n");
        assertThat(codec.decode(line.trim())).isEqualTo(row);
    }

    @Test
    void sentinelsAreEmptyCells() {
        ResultRow row = ResultRow.failed(POINT, "baseline: planner round 1: inference failed: HTTP 500");

        String line = codec.encode(row);

        assertThat(line).startsWith("0.6,6.0,0.5,0.8,1,0,,,,,,,,,,,,,FAILED,");
        ResultRow decoded = codec.decode(line.trim());
        assertThat(decoded.isFailed()).isTrue();
        assertThat(decoded.roundsToApprovalBaseline()).isNull();
        assertThat(decoded.muPlanner()).isNaN();
        assertThat(decoded.failureReason()).isEqualTo(row.failureReason());
    }

    @Test
    void failureReasonIsKeptOnOneLineAndQuoted() {
        ResultRow row = ResultRow.failed(POINT, "critic round 2: protocol violation after repair:\n"
            + "not JSON (Unexpected character ('\"' (code 34)), expected a comma)");

        String line = codec.encode(row);

        assertThat(line.indexOf('\n')).isEqualTo(line.length() - 1);
        assertThat(codec.decode(line.trim()).failureReason())
            .isEqualTo("critic round 2: protocol violation after repair: "
                + "not JSON (Unexpected character ('\"' (code 34)), expected a comma)");
    }

    @Test
    void longFailureReasonsAreTruncated() {
        assertThat(ResultRowCodec.sanitize("x".repeat(800))).hasSize(500);
        assertThat(ResultRowCodec.sanitize(null)).isEmpty();
    }

    @Test
    void decodingAcceptsOtherSpellingsOfMissingValuesAndBooleans() {
        ResultRow row = codec.decode("0.2,6.0,0.5,0.8,1,True,nan,None,0.7,,3,0.1,0.2,1.0,0.3,0.4,0.5,0.6,ok,");

        assertThat(row.gridPoint()).isEqualTo(new GridPoint(0.8, 0.2, 6.0, 0.5, 1, true));
        assertThat(row.muPlanner()).isNaN();
        assertThat(row.muResearcher()).isNaN();
        assertThat(row.muCritic()).isEqualTo(0.7);
        assertThat(row.roundsToApprovalBaseline()).isNull();
        assertThat(row.roundsToApprovalInfluence()).isEqualTo(3);
        assertThat(row.revisionDepth()).isEqualTo(1);
        assertThat(row.status()).isEqualTo(RowStatus.OK);
    }

    @Test
    void legacyLayoutHasNoAuditColumns() {
        ResultRowCodec legacy = new ResultRowCodec(ResultRowCodec.LEGACY_COLUMNS);

        String line = legacy.encode(okRow(POINT));

        assertThat(line.split(",", -1)).hasSize(18);
        assertThat(legacy.decode(line.trim()).status()).isEqualTo(RowStatus.OK);
    }

    @Test
    void rejectsLayoutsWithoutKeyColumns() {
        assertThatThrownBy(() -> new ResultRowCodec(List.of("beta", "k", "tau", "alpha", "seed")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("adversarial");
    }

    @Test
    void rejectsIncompleteOrMalformedLines() {
        assertThatThrownBy(() -> codec.decode("0.6,6.0,0.5")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode("0.6,6.0,0.5,0.8,1,maybe,,,,,,,,,,,,,OK,"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode(",6.0,0.5,0.8,1,0,,,,,,,,,,,,,OK,"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void headerParsingTrimsNames() throws Exception {
        assertThat(ResultRowCodec.parseHeader("beta, k ,\"tau\",alpha"))
            .containsExactly("beta", "k", "tau", "alpha");
    }
}
