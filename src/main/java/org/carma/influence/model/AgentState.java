package org.carma.influence.model;

import java.util.Map;

/**
 * Snapshot of one agent's influence state within a conversation.
 *
 * @param mu mutual influence the conversation started with
 * @param temperature sampling temperature derived from μ
 * @param lambda mixing gate derived from μ
 * @param peerScores current EMA peer scores
 */
public record AgentState(Role role, double mu, double temperature, double lambda, Map<Role, Double> peerScores) {

    public AgentState {
        peerScores = Map.copyOf(peerScores);
    }
}
