package org.carma.influence.model;

/**
 * The two conditions every grid point is evaluated under.
 */
public enum Condition {
    /** μ pinned to the neutral value for every role. */
    BASELINE("baseline"),
    /** μ derived from the grid point's feedback parameters. */
    INFLUENCE("influence");

    private final String tag;

    Condition(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
