package org.carma.influence.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * One validated agent output for one round. Immutable once accepted: the payload is
 * copied on the way in and on the way out.
 */
public final class Turn {

    private final Role role;
    private final int roundIndex;
    private final ObjectNode payload;
    private final String rawText;
    private final boolean repaired;

    public Turn(Role role, int roundIndex, ObjectNode payload, String rawText, boolean repaired) {
        if (roundIndex < 1) {
            throw new IllegalArgumentException("Round index is 1-based: " + roundIndex);
        }
        this.role = Objects.requireNonNull(role, "role");
        this.roundIndex = roundIndex;
        this.payload = Objects.requireNonNull(payload, "payload").deepCopy();
        this.rawText = rawText != null ? rawText : "";
        this.repaired = repaired;
    }

    public Role getRole() { return role; }
    public int getRoundIndex() { return roundIndex; }
    public ObjectNode getPayload() { return payload.deepCopy(); }
    public String getRawText() { return rawText; }

    /**
     * True when the turn was only accepted after the repair request.
     */
    public boolean isRepaired() { return repaired; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Turn)) return false;
        Turn other = (Turn) o;
        return role == other.role && roundIndex == other.roundIndex
            && repaired == other.repaired && payload.equals(other.payload)
            && rawText.equals(other.rawText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, roundIndex, payload, rawText, repaired);
    }

    @Override
    public String toString() {
        return String.format("Turn[%s r%d%s: %s]", role, roundIndex, repaired ? " repaired" : "", payload);
    }
}
