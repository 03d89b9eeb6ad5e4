package com.sportsautobet.domain.scoring;

import com.sportsautobet.domain.model.OddsPair;

/**
 * Squashes the expected value of a unit stake into a bounded value score.
 */
public class ValueScorer {

    /** Logistic steepness applied to the expected value. */
    static final double STEEPNESS = 4.0;

    /**
     * Returns 1 / (1 + e^(-4 * ev)) with ev = p * (odds - 1) - (1 - p),
     * or exactly 0.0 when the odds are missing or not above 1.0.
     */
    public static double score(double probability, Double odds) {
        if (!OddsPair.hasSignal(odds)) {
            return 0.0;
        }
        double ev = expectedValue(probability, odds);
        return 1.0 / (1.0 + Math.exp(-STEEPNESS * ev));
    }

    /**
     * Expected profit per unit stake at decimal odds.
     */
    public static double expectedValue(double probability, double odds) {
        return probability * (odds - 1.0) - (1.0 - probability);
    }
}
