package org.carma.influence.mechanism;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.carma.influence.agent.PromptLibrary;
import org.carma.influence.model.Role;
import org.carma.influence.simulation.MetricsEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic offline backend for dry runs and tests.
 *
 * Provides:
 * - planner and researcher features drawn from the whitelist by seed and role
 * - adoption of suggested features whose weight reaches {@link MockConfig#adoptionWeight}
 * - a critic that applies the approval rubric to the embedded PLANNER and RESEARCHER
 *   payloads (Jaccard ≥ 0.66, whitelisted features, at least two planner steps;
 *   identical feature sets under adversarial review)
 * - optional malformed first answers, chosen by a hash of the request text so the
 *   outcome never depends on call order
 *
 * The same request always yields the same response.
 */
public class MockInferenceBackend implements InferenceBackend {

    private static final double APPROVAL_JACCARD = 0.66;
    private static final String MALFORMED = "Sure! Here are my thoughts on the features:";

    /**
     * Configuration for mock behavior.
     */
    public static class MockConfig {
        private double malformedRate = 0.0;
        private double adoptionWeight = 0.5;
        private boolean recordRequests = false;

        /**
         * Share of first attempts answered with prose instead of JSON.
         */
        public MockConfig malformedRate(double rate) {
            this.malformedRate = rate;
            return this;
        }

        public MockConfig adoptionWeight(double weight) {
            this.adoptionWeight = weight;
            return this;
        }

        /**
         * Keep every request for {@link MockInferenceBackend#getRequests()}. Off by default.
         */
        public MockConfig recordRequests(boolean record) {
            this.recordRequests = record;
            return this;
        }

        public static MockConfig defaults() {
            return new MockConfig();
        }
    }

    private final List<String> whitelist;
    private final MockConfig config;
    private final ObjectMapper mapper;
    private final AtomicLong calls;
    private final ConcurrentLinkedQueue<InferenceRequest> requests;

    public MockInferenceBackend(List<String> whitelist) {
        this(whitelist, MockConfig.defaults());
    }

    public MockInferenceBackend(List<String> whitelist, MockConfig config) {
        if (whitelist.size() < 3) {
            throw new IllegalArgumentException("The mock needs at least 3 whitelisted features");
        }
        this.whitelist = List.copyOf(whitelist);
        this.config = config;
        this.mapper = new ObjectMapper();
        this.calls = new AtomicLong();
        this.requests = new ConcurrentLinkedQueue<>();
    }

    @Override
    public InferenceResult complete(InferenceRequest request) {
        calls.incrementAndGet();
        if (config.recordRequests) {
            requests.add(request);
        }

        String prompt = request.userMessage();
        if (!prompt.startsWith(ProtocolValidator.REPAIR_MARKER) && isMalformedFirstAttempt(prompt)) {
            return InferenceResult.success(MALFORMED, 0);
        }

        ObjectNode payload = request.role() == Role.CRITIC
            ? criticResponse(prompt)
            : proposerResponse(request.role(), prompt);
        return InferenceResult.success(payload.toString(), 0);
    }

    boolean isMalformedFirstAttempt(String prompt) {
        if (config.malformedRate <= 0.0) {
            return false;
        }
        return Math.floorMod(prompt.hashCode(), 1000) < config.malformedRate * 1000;
    }

    // ========================================================================
    // PROPOSERS
    // ========================================================================

    private ObjectNode proposerResponse(Role role, String prompt) {
        int seed = tag(prompt, PromptLibrary.SEED_TAG, 0);
        List<String> chosen = new ArrayList<>(3);

        for (String line : prompt.split("\n")) {
            if (line.startsWith(PromptLibrary.SUGGESTION_PREFIX)) {
                Matcher m = PromptLibrary.SUGGESTION.matcher(line.substring(PromptLibrary.SUGGESTION_PREFIX.length()));
                while (m.find() && chosen.size() < 3) {
                    if (Double.parseDouble(m.group(2)) >= config.adoptionWeight && whitelist.contains(m.group(1))) {
                        chosen.add(m.group(1));
                    }
                }
            }
        }
        for (String feature : baseFeatures(seed, role)) {
            if (chosen.size() == 3) break;
            if (!chosen.contains(feature)) {
                chosen.add(feature);
            }
        }

        ObjectNode payload = mapper.createObjectNode();
        ArrayNode features = payload.putArray("features");
        chosen.forEach(features::add);
        if (role == Role.PLANNER) {
            ArrayNode steps = payload.putArray("steps");
            steps.add("Compute " + chosen.get(0) + " per flow over a sliding window");
            steps.add("Baseline " + chosen.get(1) + " against recent benign traffic");
            steps.add("Flag flows where " + chosen.get(2) + " deviates from the baseline");
        }
        return payload;
    }

    /**
     * Three distinct whitelist entries fixed by seed and role.
     */
    List<String> baseFeatures(int seed, Role role) {
        List<String> shuffled = new ArrayList<>(whitelist);
        Collections.shuffle(shuffled, new Random(seed * 1_000_003L + role.ordinal() * 7_919L));
        return shuffled.subList(0, 3);
    }

    // ========================================================================
    // CRITIC
    // ========================================================================

    private ObjectNode criticResponse(String prompt) {
        ObjectNode planner = embedded(prompt, PromptLibrary.PLANNER_BLOCK);
        ObjectNode researcher = embedded(prompt, PromptLibrary.RESEARCHER_BLOCK);
        boolean adversarial = prompt.contains(PromptLibrary.ADVERSARIAL_MARKER);

        List<String> issues = new ArrayList<>();
        Set<String> pf = MetricsEngine.features(planner);
        Set<String> rf = MetricsEngine.features(researcher);
        if (pf.size() != 3 || rf.size() != 3) {
            issues.add("each proposal needs exactly 3 features");
        }
        Set<String> all = new LinkedHashSet<>(pf);
        all.addAll(rf);
        if (!whitelist.containsAll(all)) {
            issues.add("features outside the allowed set");
        }
        JsonNode steps = planner != null ? planner.get("steps") : null;
        if (steps == null || !steps.isArray() || steps.size() < 2) {
            issues.add("planner needs at least 2 steps");
        }
        double agreement = MetricsEngine.jaccard(pf, rf);
        double required = adversarial ? 1.0 : APPROVAL_JACCARD;
        if (Double.isNaN(agreement) || agreement < required) {
            issues.add("planner and researcher disagree on features");
        }

        ObjectNode payload = mapper.createObjectNode();
        payload.put("decision", issues.isEmpty() ? MetricsEngine.APPROVE : MetricsEngine.REVISE);
        if (!issues.isEmpty()) {
            ArrayNode list = payload.putArray("issues");
            issues.forEach(list::add);
        }
        return payload;
    }

    private ObjectNode embedded(String prompt, String marker) {
        String[] lines = prompt.split("\n");
        for (int i = 0; i < lines.length - 1; i++) {
            if (lines[i].trim().equals(marker)) {
                try {
                    JsonNode node = mapper.readTree(lines[i + 1]);
                    return node != null && node.isObject() ? (ObjectNode) node : null;
                } catch (JsonProcessingException e) {
                    return null;
                }
            }
        }
        return null;
    }

    private static int tag(String prompt, Pattern pattern, int fallback) {
        Matcher m = pattern.matcher(prompt);
        return m.find() ? Integer.parseInt(m.group(1)) : fallback;
    }

    // ========================================================================
    // MONITORING
    // ========================================================================

    public long getCallCount() {
        return calls.get();
    }

    /**
     * Requests seen so far; empty unless {@link MockConfig#recordRequests} is on.
     */
    public List<InferenceRequest> getRequests() {
        return new ArrayList<>(requests);
    }

    @Override
    public String getName() {
        return "MockInferenceBackend";
    }
}
