package org.carma.influence.config;

import org.carma.influence.config.HarnessConfigValidator.ValidationError;
import org.carma.influence.config.HarnessConfigValidator.ValidationResult;
import org.carma.influence.config.HarnessConfigValidator.ValidationWarning;
import org.carma.influence.model.Role;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class HarnessConfigValidatorTest {

    private final HarnessConfigValidator offline = new HarnessConfigValidator(false);

    private static List<String> errorFields(ValidationResult result) {
        return result.getErrors().stream().map(ValidationError::field).toList();
    }

    @Test
    void defaultsAreValidOffline() {
        ValidationResult result = offline.validate(HarnessConfig.builder().build());

        assertThat(result.isValid()).isTrue();
        assertThat(result.hasWarnings()).isFalse();
        assertThat(result.orThrow()).isSameAs(result);
    }

    @Test
    void credentialIsRequiredForLiveRuns() {
        HarnessConfigValidator live = new HarnessConfigValidator(true);

        assertThat(errorFields(live.validate(HarnessConfig.builder().build()))).containsExactly("inference.apiKey");
        assertThat(live.validate(HarnessConfig.builder().apiKey("sk-live").build()).isValid()).isTrue();
        assertThat(live.validate(HarnessConfig.builder().apiKey("  ").build()).isValid()).isFalse();
    }

    @Test
    void gridValuesAreChecked() {
        SweepGrid grid = new SweepGrid(List.of(Double.NaN), List.of(1.5), List.of(-1.0), List.of(0.5),
            List.of(), List.of(false));

        ValidationResult result = offline.validate(HarnessConfig.builder().grid(grid).build());

        assertThat(errorFields(result)).containsExactlyInAnyOrder("grid.seeds", "grid.beta", "grid.alpha");
        assertThat(result.getWarnings()).extracting(ValidationWarning::field).containsExactly("grid.k");
    }

    @Test
    void numericLimitsAreChecked() {
        HarnessConfig config = HarnessConfig.builder()
            .t0(0.0)
            .prior(1.2)
            .maxRounds(0)
            .agreementThreshold(1.5)
            .maxAttempts(0)
            .backoffMultiplier(0.5)
            .timeout(Duration.ZERO)
            .workers(0)
            .timeBudget(Duration.ofSeconds(-1))
            .build();

        assertThat(errorFields(offline.validate(config))).containsExactlyInAnyOrder(
            "influence.t0", "influence.prior", "conversation.maxRounds", "conversation.agreementThreshold",
            "inference.maxAttempts", "inference.backoffMultiplier", "inference.timeout",
            "execution.workers", "execution.timeBudgetSeconds");
    }

    @Test
    void protocolNeedsWhitelistAndKeysForEveryRole() {
        HarnessConfig config = HarnessConfig.builder()
            .whitelist(List.of())
            .requiredKeys(Role.RESEARCHER, List.of())
            .build();

        assertThat(errorFields(offline.validate(config)))
            .containsExactlyInAnyOrder("protocol.whitelist", "protocol.requiredKeys.researcher");
    }

    @Test
    void zeroBudgetIsOnlyAWarning() {
        ValidationResult result = offline.validate(HarnessConfig.builder().timeBudget(Duration.ZERO).build());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).extracting(ValidationWarning::field)
            .containsExactly("execution.timeBudgetSeconds");
    }

    @Test
    void missingLedgerPathIsAnError() {
        assertThat(errorFields(offline.validate(HarnessConfig.builder().ledgerPath(null).build())))
            .containsExactly("ledger.path");
    }

    @Test
    void orThrowCarriesTheResult() {
        ValidationResult result = offline.validate(HarnessConfig.builder().workers(0).build());

        ConfigurationException e = catchThrowableOfType(result::orThrow, ConfigurationException.class);

        assertThat(e).hasMessageContaining("execution.workers: worker pool width must be at least 1");
        assertThat(e.getValidation()).isSameAs(result);
    }
}
