package com.sportsautobet.domain.scoring;

import com.sportsautobet.domain.model.OddsPair;
import com.sportsautobet.domain.model.ProbabilityDistribution;

/**
 * Converts a pair of decimal odds into home/away probabilities.
 *
 * Rules:
 * 1. A side contributes a weight of 1/odds only when its odds are above 1.0
 * 2. No weights: uniform 0.5/0.5
 * 3. Two weights: normalized to sum to 1 (removes the bookmaker margin)
 * 4. One weight: that side keeps 1/odds as is, the other side gets the complement
 */
public class ImpliedProbabilityEstimator {

    public static ProbabilityDistribution estimate(OddsPair odds) {
        if (odds == null) {
            return ProbabilityDistribution.UNIFORM;
        }
        return estimate(odds.home(), odds.away());
    }

    public static ProbabilityDistribution estimate(Double homeOdds, Double awayOdds) {
        boolean homeSignal = OddsPair.hasSignal(homeOdds);
        boolean awaySignal = OddsPair.hasSignal(awayOdds);

        if (!homeSignal && !awaySignal) {
            return ProbabilityDistribution.UNIFORM;
        }

        if (homeSignal && awaySignal) {
            double homeWeight = 1.0 / homeOdds;
            double awayWeight = 1.0 / awayOdds;
            double total = homeWeight + awayWeight;
            return new ProbabilityDistribution(homeWeight / total, awayWeight / total);
        }

        // Single-sided: the missing side is inferred, not defaulted to 0.5
        if (homeSignal) {
            double homeWeight = 1.0 / homeOdds;
            return new ProbabilityDistribution(homeWeight, 1.0 - homeWeight);
        }
        double awayWeight = 1.0 / awayOdds;
        return new ProbabilityDistribution(1.0 - awayWeight, awayWeight);
    }
}
