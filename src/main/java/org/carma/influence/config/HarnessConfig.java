package org.carma.influence.config;

import org.carma.influence.model.Role;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable configuration of a sweep, handed to every component at construction.
 *
 * Sections:
 * - grid: the value sets that span the sweep
 * - influence: temperature base, neutral μ, EMA prior and priming table
 * - conversation: round cap and agreement threshold
 * - protocol: feature whitelist and required payload keys per role
 * - inference: endpoint, credential, model, timeout and retry policy
 * - execution: worker pool width, time budget, retry of failed points
 * - ledger: where result rows are appended
 *
 * Usage:
 * <pre>
 * HarnessConfig config = HarnessConfig.builder()
 *     .grid(new SweepGrid(List.of(0.4, 0.8), List.of(0.3), List.of(3.0), List.of(0.5),
 *                         List.of(1), List.of(false)))
 *     .workers(4)
 *     .timeBudget(Duration.ofMinutes(20))
 *     .apiKey(System.getenv("OPENAI_API_KEY"))
 *     .build();
 * </pre>
 */
public final class HarnessConfig {

    public static final List<String> DEFAULT_WHITELIST = List.of(
        "flow_bytes", "packets", "rate", "iat", "src_ip", "dst_ip",
        "src_port", "dst_port", "protocol", "entropy", "payload_len");

    public static final String DEFAULT_MODEL = "gpt-4o";
    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    /**
     * Temperature and feedback constants.
     *
     * @param t0 temperature at μ = 0
     * @param neutralMu μ every role uses in the baseline condition
     * @param prior initial EMA peer score; {@code null} seeds the EMA with the first score seen
     * @param priming peer scores applied before the first influence round
     */
    public record Influence(double t0, double neutralMu, Double prior, FeedbackPriming priming) {
        public Optional<Double> priorScore() {
            return Optional.ofNullable(prior);
        }
    }

    /**
     * @param maxRounds round cap; reaching it terminates the conversation
     * @param agreementThreshold planner/researcher Jaccard at or above which a round terminates
     */
    public record ConversationLimits(int maxRounds, double agreementThreshold) {}

    /**
     * @param whitelist allowed feature tags
     * @param requiredKeys payload keys each role must return
     */
    public record Protocol(List<String> whitelist, Map<Role, List<String>> requiredKeys) {
        public List<String> requiredKeys(Role role) {
            return requiredKeys.getOrDefault(role, List.of());
        }
    }

    /**
     * @param maxAttempts attempts per call, the first one included
     */
    public record Inference(String baseUrl, String apiKey, String model, Duration timeout,
                            int maxAttempts, Duration initialBackoff, double backoffMultiplier) {
        public boolean hasCredential() {
            return apiKey != null && !apiKey.isBlank();
        }

        @Override
        public String toString() {
            return String.format("Inference[baseUrl=%s, model=%s, timeout=%s, attempts=%d, credential=%s]",
                baseUrl, model, timeout, maxAttempts, hasCredential() ? "set" : "missing");
        }
    }

    /**
     * @param workers worker pool width; 1 runs the sweep sequentially
     * @param timeBudget wall-clock budget for dispatching; {@code null} runs the whole grid
     * @param retryFailed whether FAILED rows are dropped and re-run on resume
     */
    public record Execution(int workers, Duration timeBudget, boolean retryFailed) {
        public Optional<Duration> budget() {
            return Optional.ofNullable(timeBudget);
        }
    }

    private final SweepGrid grid;
    private final Influence influence;
    private final ConversationLimits conversation;
    private final Protocol protocol;
    private final Inference inference;
    private final Execution execution;
    private final Path ledgerPath;

    private HarnessConfig(Builder builder) {
        this.grid = builder.grid;
        this.influence = new Influence(builder.t0, builder.neutralMu, builder.prior, builder.priming);
        this.conversation = new ConversationLimits(builder.maxRounds, builder.agreementThreshold);

        Map<Role, List<String>> keys = new EnumMap<>(Role.class);
        builder.requiredKeys.forEach((role, list) -> keys.put(role, List.copyOf(list)));
        this.protocol = new Protocol(List.copyOf(builder.whitelist), Collections.unmodifiableMap(keys));

        this.inference = new Inference(builder.baseUrl, builder.apiKey, builder.model, builder.timeout,
            builder.maxAttempts, builder.initialBackoff, builder.backoffMultiplier);
        this.execution = new Execution(builder.workers, builder.timeBudget, builder.retryFailed);
        this.ledgerPath = builder.ledgerPath;
    }

    public SweepGrid getGrid() { return grid; }
    public Influence getInfluence() { return influence; }
    public ConversationLimits getConversation() { return conversation; }
    public Protocol getProtocol() { return protocol; }
    public Inference getInference() { return inference; }
    public Execution getExecution() { return execution; }
    public Path getLedgerPath() { return ledgerPath; }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder seeded with this configuration's values.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.grid = grid;
        b.t0 = influence.t0();
        b.neutralMu = influence.neutralMu();
        b.prior = influence.prior();
        b.priming = influence.priming();
        b.maxRounds = conversation.maxRounds();
        b.agreementThreshold = conversation.agreementThreshold();
        b.whitelist = protocol.whitelist();
        b.requiredKeys = new EnumMap<>(protocol.requiredKeys());
        b.baseUrl = inference.baseUrl();
        b.apiKey = inference.apiKey();
        b.model = inference.model();
        b.timeout = inference.timeout();
        b.maxAttempts = inference.maxAttempts();
        b.initialBackoff = inference.initialBackoff();
        b.backoffMultiplier = inference.backoffMultiplier();
        b.workers = execution.workers();
        b.timeBudget = execution.timeBudget();
        b.retryFailed = execution.retryFailed();
        b.ledgerPath = ledgerPath;
        return b;
    }

    @Override
    public String toString() {
        return String.format("HarnessConfig[grid=%d points, workers=%d, budget=%s, maxRounds=%d, ledger=%s, %s]",
            grid != null ? grid.size() : 0, execution.workers(),
            execution.timeBudget() != null ? execution.timeBudget() : "none",
            conversation.maxRounds(), ledgerPath, inference);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private SweepGrid grid = new SweepGrid(List.of(0.8), List.of(0.6), List.of(6.0), List.of(0.5),
            List.of(1), List.of(false));

        private double t0 = 0.7;
        private double neutralMu = 0.0;
        private Double prior = 0.5;
        private FeedbackPriming priming = FeedbackPriming.defaults();

        private int maxRounds = 3;
        private double agreementThreshold = 1.0;

        private List<String> whitelist = DEFAULT_WHITELIST;
        private Map<Role, List<String>> requiredKeys = defaultRequiredKeys();

        private String baseUrl = DEFAULT_BASE_URL;
        private String apiKey;
        private String model = DEFAULT_MODEL;
        private Duration timeout = Duration.ofSeconds(60);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;

        private int workers = 1;
        private Duration timeBudget;
        private boolean retryFailed;

        private Path ledgerPath = Paths.get("results.csv");

        private static Map<Role, List<String>> defaultRequiredKeys() {
            Map<Role, List<String>> keys = new EnumMap<>(Role.class);
            keys.put(Role.PLANNER, List.of("features", "steps"));
            keys.put(Role.RESEARCHER, List.of("features"));
            keys.put(Role.CRITIC, List.of("decision"));
            return keys;
        }

        public Builder grid(SweepGrid grid) {
            this.grid = grid;
            return this;
        }

        public Builder t0(double t0) {
            this.t0 = t0;
            return this;
        }

        public Builder neutralMu(double neutralMu) {
            this.neutralMu = neutralMu;
            return this;
        }

        /**
         * Initial EMA peer score. {@code null} seeds each pair with its first score.
         */
        public Builder prior(Double prior) {
            this.prior = prior;
            return this;
        }

        public Builder priming(FeedbackPriming priming) {
            this.priming = priming;
            return this;
        }

        public Builder maxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
            return this;
        }

        public Builder agreementThreshold(double agreementThreshold) {
            this.agreementThreshold = agreementThreshold;
            return this;
        }

        public Builder whitelist(List<String> whitelist) {
            this.whitelist = whitelist;
            return this;
        }

        public Builder requiredKeys(Role role, List<String> keys) {
            this.requiredKeys.put(role, keys);
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        /**
         * Model identifier. Blank values keep the default.
         */
        public Builder model(String model) {
            if (model != null && !model.isBlank()) {
                this.model = model;
            }
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder timeBudget(Duration timeBudget) {
            this.timeBudget = timeBudget;
            return this;
        }

        public Builder retryFailed(boolean retryFailed) {
            this.retryFailed = retryFailed;
            return this;
        }

        public Builder ledgerPath(Path ledgerPath) {
            this.ledgerPath = ledgerPath;
            return this;
        }

        /**
         * Build without validating; {@link HarnessConfigValidator} owns the rules.
         */
        public HarnessConfig build() {
            return new HarnessConfig(this);
        }
    }
}
