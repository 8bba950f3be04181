package org.carma.influence.config;

import org.carma.influence.model.GridPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;

/**
 * Value sets of the parameter sweep. The grid is their Cartesian product.
 * A value listed twice in one dimension counts once, so every grid point is unique.
 */
public final class SweepGrid {

    private final List<Double> alpha;
    private final List<Double> beta;
    private final List<Double> k;
    private final List<Double> tau;
    private final List<Integer> seeds;
    private final List<Boolean> adversarial;
    private final boolean shuffle;
    private final long shuffleSeed;

    public SweepGrid(List<Double> alpha, List<Double> beta, List<Double> k, List<Double> tau,
                     List<Integer> seeds, List<Boolean> adversarial,
                     boolean shuffle, long shuffleSeed) {
        this.alpha = distinct(alpha);
        this.beta = distinct(beta);
        this.k = distinct(k);
        this.tau = distinct(tau);
        this.seeds = distinct(seeds);
        this.adversarial = distinct(adversarial);
        this.shuffle = shuffle;
        this.shuffleSeed = shuffleSeed;
    }

    public SweepGrid(List<Double> alpha, List<Double> beta, List<Double> k, List<Double> tau,
                     List<Integer> seeds, List<Boolean> adversarial) {
        this(alpha, beta, k, tau, seeds, adversarial, false, 1234L);
    }

    public List<Double> getAlpha() { return alpha; }
    public List<Double> getBeta() { return beta; }
    public List<Double> getK() { return k; }
    public List<Double> getTau() { return tau; }
    public List<Integer> getSeeds() { return seeds; }
    public List<Boolean> getAdversarial() { return adversarial; }
    public boolean isShuffle() { return shuffle; }
    public long getShuffleSeed() { return shuffleSeed; }

    public int size() {
        return alpha.size() * beta.size() * k.size() * tau.size() * seeds.size() * adversarial.size();
    }

    /**
     * Every grid point in enumeration order (beta, k, tau, alpha, seed, adversarial,
     * last one varying fastest). With shuffling enabled the order is a fixed
     * permutation of that sequence for the configured seed.
     */
    public List<GridPoint> enumerate() {
        List<GridPoint> points = new ArrayList<>(size());
        for (double b : beta) {
            for (double kk : k) {
                for (double t : tau) {
                    for (double a : alpha) {
                        for (int seed : seeds) {
                            for (boolean adv : adversarial) {
                                points.add(new GridPoint(a, b, kk, t, seed, adv));
                            }
                        }
                    }
                }
            }
        }
        if (shuffle) {
            Collections.shuffle(points, new Random(shuffleSeed));
        }
        return points;
    }

    private static <T> List<T> distinct(List<T> values) {
        return List.copyOf(new LinkedHashSet<>(values));
    }

    @Override
    public String toString() {
        return String.format("SweepGrid[alpha=%s, beta=%s, k=%s, tau=%s, seeds=%s, adversarial=%s, size=%d]",
            alpha, beta, k, tau, seeds, adversarial, size());
    }
}
