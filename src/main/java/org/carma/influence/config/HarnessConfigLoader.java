package org.carma.influence.config;

import org.carma.influence.model.Role;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads a sweep configuration from YAML.
 *
 * File layout:
 * <pre>
 * grid:
 *   alpha: [0.4, 0.8, 1.2]
 *   beta: [0.2, 0.4]
 *   k: [3.0]
 *   tau: [0.3, 0.5]
 *   seeds: [1, 2]
 *   adversarial: [false, true]
 *   shuffle: false
 * influence:
 *   t0: 0.7
 *   neutralMu: 0.0
 *   prior: 0.5              # null seeds the EMA with the first score seen
 *   priming:
 *     cooperative:
 *       planner: {critic: 0.9, researcher: 0.8}
 *     adversarial:
 *       planner: {critic: 0.1}
 * conversation:
 *   maxRounds: 3
 *   agreementThreshold: 1.0
 * protocol:
 *   whitelist: [flow_bytes, packets, rate]
 *   requiredKeys:
 *     planner: [features, steps]
 * inference:
 *   baseUrl: https://api.openai.com/v1
 *   model: gpt-4o
 *   timeoutSeconds: 60
 *   maxAttempts: 3
 *   initialBackoffMillis: 500
 *   backoffMultiplier: 2.0
 * execution:
 *   workers: 4
 *   timeBudgetSeconds: 1200
 *   retryFailed: false
 * ledger:
 *   path: results.csv
 * </pre>
 *
 * Absent keys keep the {@link HarnessConfig.Builder} defaults. The credential is not
 * read from the file; callers set it on the returned builder.
 */
public class HarnessConfigLoader {

    private final Yaml yaml;

    public HarnessConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    /**
     * Load a configuration file into a builder.
     */
    public HarnessConfig.Builder load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Configuration file not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            return parse(yaml.load(is));
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML in " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load configuration text into a builder.
     */
    public HarnessConfig.Builder loadFromString(String text) {
        try {
            return parse(yaml.load(new StringReader(text)));
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML: " + e.getMessage(), e);
        }
    }

    private HarnessConfig.Builder parse(Object root) {
        HarnessConfig.Builder builder = HarnessConfig.builder();
        if (root == null) {
            return builder;
        }
        try {
            Map<String, Object> raw = asMap(root, "root");
            parseGrid(asMap(raw.get("grid"), "grid"), builder);
            parseInfluence(asMap(raw.get("influence"), "influence"), builder);
            parseConversation(asMap(raw.get("conversation"), "conversation"), builder);
            parseProtocol(asMap(raw.get("protocol"), "protocol"), builder);
            parseInference(asMap(raw.get("inference"), "inference"), builder);
            parseExecution(asMap(raw.get("execution"), "execution"), builder);

            Map<String, Object> ledger = asMap(raw.get("ledger"), "ledger");
            if (ledger != null && ledger.get("path") != null) {
                builder.ledgerPath(Paths.get(ledger.get("path").toString()));
            }
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration value: " + e.getMessage(), e);
        }
        return builder;
    }

    // ========================================================================
    // SECTIONS
    // ========================================================================

    private void parseGrid(Map<String, Object> grid, HarnessConfig.Builder builder) {
        if (grid == null) {
            return;
        }
        builder.grid(new SweepGrid(
            getDoubles(grid, "alpha"),
            getDoubles(grid, "beta"),
            getDoubles(grid, "k"),
            getDoubles(grid, "tau"),
            getInts(grid, "seeds"),
            getBooleans(grid, "adversarial"),
            getBoolean(grid, "shuffle", false),
            getLong(grid, "shuffleSeed", 1234L)));
    }

    private void parseInfluence(Map<String, Object> influence, HarnessConfig.Builder builder) {
        if (influence == null) {
            return;
        }
        if (influence.containsKey("t0")) {
            builder.t0(getDouble(influence, "t0", 0.7));
        }
        if (influence.containsKey("neutralMu")) {
            builder.neutralMu(getDouble(influence, "neutralMu", 0.0));
        }
        if (influence.containsKey("prior")) {
            Object prior = influence.get("prior");
            builder.prior(prior == null ? null : ((Number) prior).doubleValue());
        }

        Map<String, Object> priming = asMap(influence.get("priming"), "influence.priming");
        if (priming != null) {
            FeedbackPriming table = FeedbackPriming.defaults();
            table = applyPriming(table, asMap(priming.get("cooperative"), "priming.cooperative"), false);
            table = applyPriming(table, asMap(priming.get("adversarial"), "priming.adversarial"), true);
            builder.priming(table);
        }
    }

    private FeedbackPriming applyPriming(FeedbackPriming table, Map<String, Object> section, boolean adversarial) {
        if (section == null) {
            return table;
        }
        for (Map.Entry<String, Object> receiverEntry : section.entrySet()) {
            Role receiver = Role.fromKey(receiverEntry.getKey());
            Map<String, Object> peers = asMap(receiverEntry.getValue(), "priming." + receiverEntry.getKey());
            if (peers == null) {
                continue;
            }
            for (Map.Entry<String, Object> peerEntry : peers.entrySet()) {
                Role peer = Role.fromKey(peerEntry.getKey());
                table = table.with(adversarial, receiver, peer, ((Number) peerEntry.getValue()).doubleValue());
            }
        }
        return table;
    }

    private void parseConversation(Map<String, Object> conversation, HarnessConfig.Builder builder) {
        if (conversation == null) {
            return;
        }
        if (conversation.containsKey("maxRounds")) {
            builder.maxRounds(getInt(conversation, "maxRounds", 3));
        }
        if (conversation.containsKey("agreementThreshold")) {
            builder.agreementThreshold(getDouble(conversation, "agreementThreshold", 1.0));
        }
    }

    @SuppressWarnings("unchecked")
    private void parseProtocol(Map<String, Object> protocol, HarnessConfig.Builder builder) {
        if (protocol == null) {
            return;
        }
        if (protocol.get("whitelist") != null) {
            builder.whitelist(getStrings(protocol, "whitelist"));
        }
        Map<String, Object> required = asMap(protocol.get("requiredKeys"), "protocol.requiredKeys");
        if (required != null) {
            for (Map.Entry<String, Object> entry : required.entrySet()) {
                List<String> keys = new ArrayList<>();
                for (Object key : (List<Object>) entry.getValue()) {
                    keys.add(key.toString());
                }
                builder.requiredKeys(Role.fromKey(entry.getKey()), keys);
            }
        }
    }

    private void parseInference(Map<String, Object> inference, HarnessConfig.Builder builder) {
        if (inference == null) {
            return;
        }
        if (inference.get("baseUrl") != null) {
            builder.baseUrl(inference.get("baseUrl").toString());
        }
        builder.model(getString(inference, "model", null));
        if (inference.containsKey("timeoutSeconds")) {
            builder.timeout(Duration.ofMillis(Math.round(getDouble(inference, "timeoutSeconds", 60) * 1000)));
        }
        if (inference.containsKey("maxAttempts")) {
            builder.maxAttempts(getInt(inference, "maxAttempts", 3));
        }
        if (inference.containsKey("initialBackoffMillis")) {
            builder.initialBackoff(Duration.ofMillis(getLong(inference, "initialBackoffMillis", 500)));
        }
        if (inference.containsKey("backoffMultiplier")) {
            builder.backoffMultiplier(getDouble(inference, "backoffMultiplier", 2.0));
        }
    }

    private void parseExecution(Map<String, Object> execution, HarnessConfig.Builder builder) {
        if (execution == null) {
            return;
        }
        if (execution.containsKey("workers")) {
            builder.workers(getInt(execution, "workers", 1));
        }
        Object budget = execution.get("timeBudgetSeconds");
        if (budget != null) {
            builder.timeBudget(Duration.ofMillis(Math.round(((Number) budget).doubleValue() * 1000)));
        }
        builder.retryFailed(getBoolean(execution, "retryFailed", false));
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value, String section) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Section '" + section + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private List<Object> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List) {
            return new ArrayList<>((List<?>) value);
        }
        return List.of(value);
    }

    private List<Double> getDoubles(Map<String, Object> map, String key) {
        List<Double> result = new ArrayList<>();
        for (Object o : getList(map, key)) {
            result.add(((Number) o).doubleValue());
        }
        return result;
    }

    private List<Integer> getInts(Map<String, Object> map, String key) {
        List<Integer> result = new ArrayList<>();
        for (Object o : getList(map, key)) {
            result.add(((Number) o).intValue());
        }
        return result;
    }

    private List<Boolean> getBooleans(Map<String, Object> map, String key) {
        List<Boolean> result = new ArrayList<>();
        for (Object o : getList(map, key)) {
            if (o instanceof Boolean) {
                result.add((Boolean) o);
            } else if (o instanceof Number) {
                result.add(((Number) o).intValue() != 0);
            } else {
                result.add(Boolean.parseBoolean(o.toString()));
            }
        }
        return result;
    }

    private List<String> getStrings(Map<String, Object> map, String key) {
        List<String> result = new ArrayList<>();
        for (Object o : getList(map, key)) {
            result.add(o.toString());
        }
        return result;
    }

    private String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return defaultValue;
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }
}
