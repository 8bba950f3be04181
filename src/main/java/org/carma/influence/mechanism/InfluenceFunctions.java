package org.carma.influence.mechanism;

/**
 * Pure functions mapping mutual influence μ to sampling temperature and to the
 * mixing gate λ.
 *
 * Temperature falls linearly as μ grows (a more influenced agent samples more
 * conservatively) and is always clamped to [0.1, 1.5]. λ is a logistic gate centred
 * at τ: 0.5 exactly at μ = τ, towards 0 below and towards 1 above.
 */
public final class InfluenceFunctions {

    public static final double MIN_TEMPERATURE = 0.1;
    public static final double MAX_TEMPERATURE = 1.5;

    /** Keeps λ inside the open interval (0, 1) where the logistic saturates in double precision. */
    private static final double GATE_MARGIN = 1e-12;

    private InfluenceFunctions() {}

    /**
     * T(μ) = T0 · (1 − α·μ), clamped to [{@value #MIN_TEMPERATURE}, {@value #MAX_TEMPERATURE}].
     * Strictly decreasing in μ for positive T0 and α until a clamp bound is hit.
     */
    public static double temperatureFromMu(double mu, double t0, double alpha) {
        double t = t0 * (1.0 - alpha * mu);
        if (Double.isNaN(t)) {
            // 0 * infinity: α = 0 leaves the temperature at T0
            t = t0;
        }
        return Math.max(MIN_TEMPERATURE, Math.min(MAX_TEMPERATURE, t));
    }

    /**
     * λ(μ) = 1 / (1 + e^(−k(μ − τ))), kept strictly inside (0, 1).
     */
    public static double lambdaFromMu(double mu, double k, double tau) {
        double offset = mu - tau;
        if (offset == 0.0) {
            return 0.5;
        }
        double lambda = 1.0 / (1.0 + Math.exp(-k * offset));
        if (Double.isNaN(lambda)) {
            return 0.5;
        }
        return Math.max(GATE_MARGIN, Math.min(1.0 - GATE_MARGIN, lambda));
    }
}
