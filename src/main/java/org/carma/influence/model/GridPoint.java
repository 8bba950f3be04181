package org.carma.influence.model;

/**
 * One configuration tuple of the parameter sweep.
 *
 * <p>Identity is the exact field tuple, which is also the deduplication key of the
 * ledger. Record equality compares the doubles with {@link Double#compare}, so a
 * value read back from the ledger text matches the value that produced it.
 *
 * @param alpha temperature slope
 * @param beta EMA weight of the newest peer score
 * @param k steepness of the λ gate
 * @param tau centre of the λ gate
 * @param seed seed forwarded to the inference service
 * @param adversarial whether the critic sends hostile feedback
 */
public record GridPoint(
        double alpha,
        double beta,
        double k,
        double tau,
        int seed,
        boolean adversarial
) {

    public GridPoint {
        if (beta < 0.0 || beta > 1.0) {
            throw new IllegalArgumentException("beta must be in [0,1]: " + beta);
        }
    }

    @Override
    public String toString() {
        return String.format("GridPoint[beta=%s, k=%s, tau=%s, alpha=%s, seed=%d, adversarial=%s]",
            beta, k, tau, alpha, seed, adversarial);
    }
}
