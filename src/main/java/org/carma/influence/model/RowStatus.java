package org.carma.influence.model;

/**
 * Outcome recorded for a grid point in the ledger.
 */
public enum RowStatus {
    OK,
    /** At least one conversation failed; affected metric columns hold sentinels. */
    FAILED;

    public static RowStatus parse(String text) {
        if (text == null || text.isBlank()) {
            return OK;
        }
        return valueOf(text.trim().toUpperCase());
    }
}
