package org.carma.influence.model;

/**
 * Why a conversation stopped.
 */
public enum TerminationReason {
    /** The termination predicate held after a complete round. */
    APPROVED,
    /** The round cap was reached without the predicate holding. */
    ROUND_CAP,
    /** A turn failed the protocol irrecoverably. */
    FAILED
}
