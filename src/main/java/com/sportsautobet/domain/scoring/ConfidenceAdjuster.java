package com.sportsautobet.domain.scoring;

import com.sportsautobet.domain.model.Candidate;

import java.util.List;

/**
 * Odds-band penalties on candidate confidence.
 */
public class ConfidenceAdjuster {

    /** Below this the pick is a heavy favourite with little value left. */
    public static final double LOW_ODDS_THRESHOLD = 1.3;
    public static final double LOW_ODDS_PENALTY = 0.10;

    /** Above this the pick is a long shot. */
    public static final double HIGH_ODDS_THRESHOLD = 5.0;
    public static final double HIGH_ODDS_PENALTY = 0.05;

    /**
     * Penalty for the chosen odds. Thresholds are strict: 1.3 and 5.0 are not penalized.
     * Missing odds are not penalized.
     */
    public static double penaltyFor(Double odds) {
        if (odds == null) {
            return 0.0;
        }
        if (odds < LOW_ODDS_THRESHOLD) {
            return LOW_ODDS_PENALTY;
        }
        if (odds > HIGH_ODDS_THRESHOLD) {
            return HIGH_ODDS_PENALTY;
        }
        return 0.0;
    }

    /**
     * Applies the penalty in place, floors at 0 and rounds to 3 decimals.
     */
    public static Candidate adjust(Candidate candidate) {
        double adjusted = Math.max(0.0, candidate.getConfidence() - penaltyFor(candidate.getOdds()));
        candidate.setConfidence(Rounding.round3(adjusted));
        return candidate;
    }

    public static List<Candidate> adjustAll(List<Candidate> candidates) {
        for (Candidate candidate : candidates) {
            adjust(candidate);
        }
        return candidates;
    }
}
