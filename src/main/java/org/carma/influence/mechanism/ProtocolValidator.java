package org.carma.influence.mechanism;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.carma.influence.config.HarnessConfig;
import org.carma.influence.model.Role;
import org.carma.influence.model.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Enforces the turn protocol: every accepted payload is exactly one JSON object that
 * holds the keys its role must return.
 *
 * A response that does not parse, or lacks keys, gets exactly one repair request
 * carrying the original task plus an instruction naming the missing keys. A second
 * bad response fails the turn. Transport failures (after the backend's own retries)
 * fail the turn without a repair request.
 */
public class ProtocolValidator {

    private static final Logger log = LoggerFactory.getLogger(ProtocolValidator.class);

    /** First line of every repair request. */
    public static final String REPAIR_MARKER =
        "Your previous output was not a valid JSON object with required keys.";

    private static final List<String> ARRAY_KEYS = List.of("features", "steps");
    private static final List<String> TEXT_KEYS = List.of("decision");

    /**
     * Outcome of checking one response text.
     *
     * @param payload parsed object, {@code null} when the text was not a JSON object
     * @param problems missing or malformed keys, or a parse error description
     */
    public record Check(ObjectNode payload, List<String> problems) {
        public boolean isValid() {
            return payload != null && problems.isEmpty();
        }
    }

    private final HarnessConfig.Protocol protocol;
    private final InferenceBackend backend;
    private final ObjectMapper mapper;

    public ProtocolValidator(HarnessConfig.Protocol protocol, InferenceBackend backend) {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.mapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Ask the backend for a turn and validate it, repairing at most once.
     */
    public TurnOutcome requestTurn(InferenceRequest request, int roundIndex) {
        Role role = request.role();
        List<String> required = protocol.requiredKeys(role);

        InferenceBackend.InferenceResult first = backend.complete(request);
        if (!first.isSuccess()) {
            return new TurnOutcome.Failure(role, roundIndex, "inference failed: " + first.getError(), 1);
        }
        log.debug("Raw {} response, round {}: {}", role, roundIndex, first.getText());

        Check check = check(first.getText(), required);
        if (check.isValid()) {
            return new TurnOutcome.Success(new Turn(role, roundIndex, check.payload(), first.getText(), false));
        }

        log.info("{} round {} violated the protocol ({}); sending repair request",
            role, roundIndex, String.join(", ", check.problems()));
        InferenceRequest repair = request.withUserMessage(repairMessage(required, check.problems(),
            request.userMessage()));
        InferenceBackend.InferenceResult second = backend.complete(repair);
        if (!second.isSuccess()) {
            return new TurnOutcome.Failure(role, roundIndex,
                "inference failed during repair: " + second.getError(), 2);
        }
        log.debug("Raw {} repair response, round {}: {}", role, roundIndex, second.getText());

        Check recheck = check(second.getText(), required);
        if (recheck.isValid()) {
            return new TurnOutcome.Success(new Turn(role, roundIndex, recheck.payload(), second.getText(), true));
        }
        return new TurnOutcome.Failure(role, roundIndex,
            "protocol violation after repair: " + String.join(", ", recheck.problems()), 2);
    }

    /**
     * Parse a response and list what is wrong with it for the given required keys.
     */
    public Check check(String text, List<String> requiredKeys) {
        if (text == null || text.isBlank()) {
            return new Check(null, List.of("empty response"));
        }
        JsonNode node;
        try {
            node = mapper.readTree(text.trim());
        } catch (JsonProcessingException e) {
            return new Check(null, List.of("not JSON (" + e.getOriginalMessage() + ")"));
        }
        if (node == null || !node.isObject()) {
            return new Check(null, List.of("not a JSON object"));
        }

        ObjectNode payload = (ObjectNode) node;
        List<String> problems = new ArrayList<>();
        for (String key : requiredKeys) {
            JsonNode value = payload.get(key);
            if (value == null || value.isNull()) {
                problems.add("missing " + key);
            } else if (ARRAY_KEYS.contains(key) && !value.isArray()) {
                problems.add(key + " is not an array");
            } else if (TEXT_KEYS.contains(key) && !value.isTextual()) {
                problems.add(key + " is not a string");
            }
        }
        return new Check(payload, problems);
    }

    static String repairMessage(List<String> required, List<String> problems, String lastTask) {
        return REPAIR_MARKER + " "
            + "Required keys: " + required + ". "
            + "Problems: " + String.join("; ", problems) + ". "
            + "Return exactly one JSON object with those keys only. No explanations."
            + "\n\nLast task:\n" + lastTask;
    }
}
