package com.hazardscan.core.detect;

/**
 * Tuning knobs for {@link HazardDetector}.
 */
public class DetectorConfig {

    /** Two port arrival delays closer than this (ns) are reported as a race. */
    public final double raceThreshold;

    /** Backward path search depth ceiling. Deeper branches are pruned with a warning. */
    public final int maxPathDepth;

    /**
     * Largest number of non-target inputs the symbolic simulation will enumerate
     * (2^n assignments). Above this the simulation sub-check fails and the convergence
     * classification is used instead.
     */
    public final int maxEnumeratedInputs;

    /** Run the per-assignment simulations on the common fork-join pool. */
    public final boolean parallelSimulation;

    public DetectorConfig(double raceThreshold, int maxPathDepth, int maxEnumeratedInputs,
                          boolean parallelSimulation) {
        if (raceThreshold < 0) throw new IllegalArgumentException("raceThreshold must be >= 0");
        if (maxPathDepth < 1) throw new IllegalArgumentException("maxPathDepth must be >= 1");
        if (maxEnumeratedInputs < 0 || maxEnumeratedInputs > 30) {
            throw new IllegalArgumentException("maxEnumeratedInputs must be between 0 and 30");
        }
        this.raceThreshold = raceThreshold;
        this.maxPathDepth = maxPathDepth;
        this.maxEnumeratedInputs = maxEnumeratedInputs;
        this.parallelSimulation = parallelSimulation;
    }

    public static DetectorConfig defaults() {
        return new DetectorConfig(0.5, 100, 20, false);
    }

    public DetectorConfig withParallelSimulation(boolean parallel) {
        return new DetectorConfig(raceThreshold, maxPathDepth, maxEnumeratedInputs, parallel);
    }
}
