package org.carma.influence.config;

import org.carma.influence.model.Role;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Validation of a harness configuration before anything is dispatched.
 *
 * Validates:
 * - credential present when a real inference backend is used
 * - every grid dimension has at least one value
 * - beta values in [0,1]
 * - positive worker count, round cap, timeout and attempt count
 * - non-negative time budget
 * - agreement threshold in [0,1]
 * - positive base temperature
 * - non-empty whitelist and required keys for every role
 */
public class HarnessConfigValidator {

    /**
     * Result of configuration validation.
     */
    public static class ValidationResult {
        private final List<ValidationError> errors;
        private final List<ValidationWarning> warnings;

        public ValidationResult(List<ValidationError> errors, List<ValidationWarning> warnings) {
            this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
            this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        }

        public boolean isValid() { return errors.isEmpty(); }
        public List<ValidationError> getErrors() { return errors; }
        public List<ValidationWarning> getWarnings() { return warnings; }
        public boolean hasWarnings() { return !warnings.isEmpty(); }

        /**
         * Throws {@link ConfigurationException} when any error was found.
         */
        public ValidationResult orThrow() {
            if (!isValid()) {
                throw new ConfigurationException(this);
            }
            return this;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(isValid() ? "VALID" : "INVALID");
            if (!errors.isEmpty()) {
                sb.append(" (").append(errors.size()).append(" errors)");
            }
            if (!warnings.isEmpty()) {
                sb.append(" (").append(warnings.size()).append(" warnings)");
            }
            return sb.toString();
        }

        public String toDetailedString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ValidationResult: ").append(isValid() ? "VALID" : "INVALID").append("\n");
            if (!errors.isEmpty()) {
                sb.append("Errors:\n");
                for (ValidationError error : errors) {
                    sb.append("  x ").append(error).append("\n");
                }
            }
            if (!warnings.isEmpty()) {
                sb.append("Warnings:\n");
                for (ValidationWarning warning : warnings) {
                    sb.append("  ! ").append(warning).append("\n");
                }
            }
            return sb.toString();
        }
    }

    public record ValidationError(String field, String message) {
        @Override
        public String toString() {
            return field + ": " + message;
        }
    }

    public record ValidationWarning(String field, String message) {
        @Override
        public String toString() {
            return field + ": " + message;
        }
    }

    private final boolean requireCredential;

    /**
     * @param requireCredential whether a missing API key is an error (false for dry runs)
     */
    public HarnessConfigValidator(boolean requireCredential) {
        this.requireCredential = requireCredential;
    }

    public ValidationResult validate(HarnessConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        validateGrid(config.getGrid(), errors, warnings);
        validateInfluence(config.getInfluence(), errors);
        validateConversation(config.getConversation(), errors);
        validateProtocol(config.getProtocol(), errors);
        validateInference(config.getInference(), errors);
        validateExecution(config.getExecution(), errors, warnings);

        if (config.getLedgerPath() == null) {
            errors.add(new ValidationError("ledger.path", "no ledger path configured"));
        }

        return new ValidationResult(errors, warnings);
    }

    private void validateGrid(SweepGrid grid, List<ValidationError> errors, List<ValidationWarning> warnings) {
        if (grid == null) {
            errors.add(new ValidationError("grid", "no sweep grid configured"));
            return;
        }
        requireValues("grid.alpha", grid.getAlpha(), errors);
        requireValues("grid.beta", grid.getBeta(), errors);
        requireValues("grid.k", grid.getK(), errors);
        requireValues("grid.tau", grid.getTau(), errors);
        requireValues("grid.seeds", grid.getSeeds(), errors);
        requireValues("grid.adversarial", grid.getAdversarial(), errors);

        for (double beta : grid.getBeta()) {
            if (Double.isNaN(beta) || beta < 0.0 || beta > 1.0) {
                errors.add(new ValidationError("grid.beta", "beta must lie in [0,1], got " + beta));
            }
        }
        for (double k : grid.getK()) {
            if (k <= 0) {
                warnings.add(new ValidationWarning("grid.k",
                    "k=" + k + " makes the influence gate non-increasing in mu"));
            }
        }
        for (double alpha : grid.getAlpha()) {
            if (Double.isNaN(alpha) || Double.isInfinite(alpha)) {
                errors.add(new ValidationError("grid.alpha", "alpha must be finite, got " + alpha));
            }
        }
    }

    private void validateInfluence(HarnessConfig.Influence influence, List<ValidationError> errors) {
        if (!(influence.t0() > 0)) {
            errors.add(new ValidationError("influence.t0", "base temperature must be positive, got " + influence.t0()));
        }
        if (influence.prior() != null && (influence.prior() < 0.0 || influence.prior() > 1.0)) {
            errors.add(new ValidationError("influence.prior", "prior must lie in [0,1], got " + influence.prior()));
        }
        if (influence.priming() == null) {
            errors.add(new ValidationError("influence.priming", "no priming table configured"));
        }
    }

    private void validateConversation(HarnessConfig.ConversationLimits limits, List<ValidationError> errors) {
        if (limits.maxRounds() < 1) {
            errors.add(new ValidationError("conversation.maxRounds", "round cap must be at least 1"));
        }
        double threshold = limits.agreementThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            errors.add(new ValidationError("conversation.agreementThreshold",
                "threshold must lie in [0,1], got " + threshold));
        }
    }

    private void validateProtocol(HarnessConfig.Protocol protocol, List<ValidationError> errors) {
        if (protocol.whitelist().isEmpty()) {
            errors.add(new ValidationError("protocol.whitelist", "feature whitelist is empty"));
        }
        for (Role role : Role.values()) {
            if (protocol.requiredKeys(role).isEmpty()) {
                errors.add(new ValidationError("protocol.requiredKeys." + role.getKey(),
                    "no required keys declared"));
            }
        }
    }

    private void validateInference(HarnessConfig.Inference inference, List<ValidationError> errors) {
        if (requireCredential && !inference.hasCredential()) {
            errors.add(new ValidationError("inference.apiKey",
                "credential for the inference service is missing (set OPENAI_API_KEY)"));
        }
        if (inference.timeout() == null || inference.timeout().isNegative() || inference.timeout().isZero()) {
            errors.add(new ValidationError("inference.timeout", "per-call timeout must be positive"));
        }
        if (inference.maxAttempts() < 1) {
            errors.add(new ValidationError("inference.maxAttempts", "at least one attempt is required"));
        }
        if (inference.backoffMultiplier() < 1.0) {
            errors.add(new ValidationError("inference.backoffMultiplier", "backoff multiplier must be >= 1"));
        }
    }

    private void validateExecution(HarnessConfig.Execution execution, List<ValidationError> errors,
                                   List<ValidationWarning> warnings) {
        if (execution.workers() < 1) {
            errors.add(new ValidationError("execution.workers", "worker pool width must be at least 1"));
        }
        if (execution.timeBudget() != null) {
            if (execution.timeBudget().isNegative()) {
                errors.add(new ValidationError("execution.timeBudgetSeconds", "time budget cannot be negative"));
            } else if (execution.timeBudget().isZero()) {
                warnings.add(new ValidationWarning("execution.timeBudgetSeconds",
                    "zero time budget stops dispatching as soon as any time has passed"));
            }
        }
    }

    private void requireValues(String field, List<?> values, List<ValidationError> errors) {
        if (values == null || values.isEmpty()) {
            errors.add(new ValidationError(field, "no values configured"));
        }
    }
}
