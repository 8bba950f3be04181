package org.carma.influence.mechanism;

import org.carma.influence.model.Role;

import java.util.Objects;

/**
 * One call to the text-generation service.
 *
 * @param role speaking role, used for the system message and for logging
 * @param systemMessage role framing
 * @param userMessage task, context and protocol instructions
 * @param temperature sampling temperature
 * @param seed sampling seed, pinned by the grid point
 * @param jsonOnly whether the service is asked for exactly one JSON object
 */
public record InferenceRequest(
        Role role,
        String systemMessage,
        String userMessage,
        double temperature,
        int seed,
        boolean jsonOnly
) {

    public InferenceRequest {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(userMessage, "userMessage");
        systemMessage = systemMessage != null ? systemMessage : "";
    }

    /**
     * Same request with a different user message (the repair request reuses everything else).
     */
    public InferenceRequest withUserMessage(String message) {
        return new InferenceRequest(role, systemMessage, message, temperature, seed, jsonOnly);
    }
}
