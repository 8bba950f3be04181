package org.carma.influence.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The three roles taking part in every conversation, in speaking order.
 * Each round is one turn from each role: planner, then researcher, then critic.
 */
public enum Role {
    PLANNER("planner", "Role: Planner. Short prioritized plan."),
    RESEARCHER("researcher", "Role: Researcher. List concise streaming features and brief reasons."),
    CRITIC("critic", "Role: Critic. Point gaps/risks. Reply 'APPROVE' if sufficient.");

    private final String key;
    private final String roleMessage;

    Role(String key, String roleMessage) {
        this.key = key;
        this.roleMessage = roleMessage;
    }

    public String getKey() {
        return key;
    }

    public String getRoleMessage() {
        return roleMessage;
    }

    /**
     * The first role of every round.
     */
    public static Role first() {
        return PLANNER;
    }

    public boolean isLast() {
        return this == CRITIC;
    }

    /**
     * Next role in round-robin order. The critic wraps around to the planner.
     */
    public Role next() {
        Role[] roles = values();
        return roles[(ordinal() + 1) % roles.length];
    }

    /**
     * Every other role, in speaking order.
     */
    public List<Role> peers() {
        List<Role> peers = new ArrayList<>(2);
        for (Role role : values()) {
            if (role != this) {
                peers.add(role);
            }
        }
        return peers;
    }

    /**
     * Roles that propose feature sets (everyone except the critic).
     */
    public boolean isProposer() {
        return this != CRITIC;
    }

    public static Role fromKey(String key) {
        for (Role role : values()) {
            if (role.key.equalsIgnoreCase(key.trim())) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
